package com.infomedia.abacox.callbilling.db.repository;

import com.infomedia.abacox.callbilling.db.entity.BalanceTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.List;

public interface BalanceTransactionRepository extends JpaRepository<BalanceTransaction, Long> {

    List<BalanceTransaction> findByAccountIdOrderByIdAsc(Long accountId);

    List<BalanceTransaction> findByCallId(String callId);

    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM BalanceTransaction t WHERE t.accountId = :accountId")
    BigDecimal sumAmountByAccountId(@Param("accountId") Long accountId);

    long countByAccountId(Long accountId);
}
