package com.infomedia.abacox.callbilling.db.repository;

import com.infomedia.abacox.callbilling.db.entity.RateEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.Collection;
import java.util.List;

public interface RateEntryRepository extends JpaRepository<RateEntry, Long>, JpaSpecificationExecutor<RateEntry> {

    List<RateEntry> findByDestinationPrefixIn(Collection<String> prefixes);
}
