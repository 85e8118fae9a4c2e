package com.infomedia.abacox.callbilling.db.repository;

import com.infomedia.abacox.callbilling.db.entity.Account;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface AccountRepository extends JpaRepository<Account, Long>, JpaSpecificationExecutor<Account> {

    Optional<Account> findFirstByCustomerPhoneOrderByIdAsc(String customerPhone);

    Optional<Account> findByAccountNumber(String accountNumber);

    /**
     * Row-locks the account for the rest of the transaction. Every balance or reservation
     * change goes through here, so writers on one account queue up instead of racing.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT a FROM Account a WHERE a.id = :id")
    Optional<Account> findForUpdateById(@Param("id") Long id);
}
