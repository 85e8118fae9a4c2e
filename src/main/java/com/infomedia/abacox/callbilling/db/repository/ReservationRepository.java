package com.infomedia.abacox.callbilling.db.repository;

import com.infomedia.abacox.callbilling.db.entity.Reservation;
import com.infomedia.abacox.callbilling.db.entity.ReservationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ReservationRepository extends JpaRepository<Reservation, Long> {

    Optional<Reservation> findByCallId(String callId);

    boolean existsByCallId(String callId);

    /**
     * Holds that still count against the account: ACTIVE and not yet past their expiry.
     */
    @Query("SELECT COUNT(r) FROM Reservation r " +
            "WHERE r.accountId = :accountId AND r.status = com.infomedia.abacox.callbilling.db.entity.ReservationStatus.ACTIVE " +
            "AND r.expiresAt > :now")
    long countLiveByAccountId(@Param("accountId") Long accountId, @Param("now") Instant now);

    @Query("SELECT COALESCE(SUM(r.reservedAmount), 0) FROM Reservation r " +
            "WHERE r.accountId = :accountId AND r.status = com.infomedia.abacox.callbilling.db.entity.ReservationStatus.ACTIVE " +
            "AND r.expiresAt > :now")
    BigDecimal sumLiveReservedByAccountId(@Param("accountId") Long accountId, @Param("now") Instant now);

    List<Reservation> findByStatusAndExpiresAtLessThanEqual(ReservationStatus status, Instant now);

    List<Reservation> findByAccountIdAndStatus(Long accountId, ReservationStatus status);
}
