package com.infomedia.abacox.callbilling.service;

import com.infomedia.abacox.callbilling.component.rating.RatedResult;
import com.infomedia.abacox.callbilling.component.rating.RatingStatus;
import com.infomedia.abacox.callbilling.component.settlement.SettlementLedgerService;
import com.infomedia.abacox.callbilling.db.entity.Account;
import com.infomedia.abacox.callbilling.db.entity.BalanceTransaction;
import com.infomedia.abacox.callbilling.db.entity.TransactionType;
import com.infomedia.abacox.callbilling.db.repository.AccountRepository;
import com.infomedia.abacox.callbilling.dto.account.ReconciliationDto;
import com.infomedia.abacox.callbilling.exception.AccountNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class AccountServiceTest {

    @Autowired
    private AccountService accountService;
    @Autowired
    private SettlementLedgerService ledgerService;
    @Autowired
    private AccountRepository accountRepository;

    private Account account;

    @BeforeEach
    void setUp() {
        account = accountRepository.save(Account.builder()
                .accountNumber("ACC-" + UUID.randomUUID())
                .customerPhone("3001234567")
                .balance(new BigDecimal("10.00"))
                .initialBalance(new BigDecimal("10.00"))
                .maxConcurrentCalls(2)
                .build());
    }

    @Test
    void shouldRechargeAndRecordTransaction() {
        // When
        BalanceTransaction transaction = accountService.recharge(account.getId(), new BigDecimal("25.50"), null);

        // Then
        assertThat(transaction.getTransactionType()).isEqualTo(TransactionType.RECHARGE);
        assertThat(transaction.getAmount()).isEqualByComparingTo("25.50");
        assertThat(transaction.getPreviousBalance()).isEqualByComparingTo("10.00");
        assertThat(transaction.getNewBalance()).isEqualByComparingTo("35.50");
        assertThat(transaction.getReason()).isEqualTo("Recharge");
        assertThat(accountService.get(account.getId()).getBalance()).isEqualByComparingTo("35.50");
    }

    @Test
    void shouldRefundAgainstCall() {
        BalanceTransaction transaction = accountService.refund(account.getId(), new BigDecimal("1.20"), "call-9", null);

        assertThat(transaction.getTransactionType()).isEqualTo(TransactionType.REFUND);
        assertThat(transaction.getCallId()).isEqualTo("call-9");
        assertThat(transaction.getReason()).isEqualTo("Refund for call call-9");
        assertThat(transaction.getNewBalance()).isEqualByComparingTo("11.20");
    }

    @Test
    void shouldAcceptOnlyPositiveAmounts() {
        assertThatThrownBy(() -> accountService.recharge(account.getId(), BigDecimal.ZERO, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> accountService.refund(account.getId(), new BigDecimal("-5"), null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> accountService.recharge(account.getId(), null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldFailForUnknownAccount() {
        assertThatThrownBy(() -> accountService.get(Long.MAX_VALUE)).isInstanceOf(AccountNotFoundException.class);
        assertThatThrownBy(() -> accountService.recharge(Long.MAX_VALUE, BigDecimal.ONE, null))
                .isInstanceOf(AccountNotFoundException.class);
    }

    @Test
    void shouldReconcileAfterMixedActivity() {
        // Given
        RatedResult rated = RatedResult.builder()
                .status(RatingStatus.RATED)
                .destinationNumber("573101234567")
                .destinationPrefix("57310")
                .destinationName("Colombia Mobile")
                .ratePerMinute(new BigDecimal("0.6000"))
                .billingIncrement(60)
                .connectionFee(new BigDecimal("0.0500"))
                .build();
        accountService.recharge(account.getId(), new BigDecimal("5.00"), "Top-up");
        ledgerService.reserve(account.getId(), "call-" + UUID.randomUUID(), new BigDecimal("3.00"), Duration.ofHours(1), rated);
        String settled = "call-" + UUID.randomUUID();
        ledgerService.reserve(account.getId(), settled, new BigDecimal("3.00"), Duration.ofHours(1), rated);
        ledgerService.settle(settled, 90, rated);
        accountService.refund(account.getId(), new BigDecimal("0.50"), settled, "Dropped call");

        // When
        ReconciliationDto reconciliation = accountService.reconcile(account.getId());

        // Then: 10 + 5 - (0.05 + 1.20) + 0.50
        assertThat(reconciliation.isConsistent()).isTrue();
        assertThat(reconciliation.getBalance()).isEqualByComparingTo("14.25");
        assertThat(reconciliation.getTransactionSum()).isEqualByComparingTo("4.25");
        assertThat(reconciliation.getTransactionCount()).isEqualTo(3);
        assertThat(accountService.availableBalance(account.getId())).isEqualByComparingTo("11.25");
    }

    @Test
    void shouldListTransactionsInOrder() {
        accountService.recharge(account.getId(), new BigDecimal("1.00"), "first");
        accountService.recharge(account.getId(), new BigDecimal("2.00"), "second");

        List<BalanceTransaction> transactions = accountService.transactions(account.getId());

        assertThat(transactions).extracting(BalanceTransaction::getReason).containsExactly("first", "second");
    }
}
