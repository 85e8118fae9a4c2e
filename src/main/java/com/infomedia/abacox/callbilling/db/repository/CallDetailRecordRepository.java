package com.infomedia.abacox.callbilling.db.repository;

import com.infomedia.abacox.callbilling.db.entity.CallDetailRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface CallDetailRecordRepository extends JpaRepository<CallDetailRecord, Long> {

    Optional<CallDetailRecord> findByCallId(String callId);
}
