package com.infomedia.abacox.callbilling.component.settlement;

import com.infomedia.abacox.callbilling.component.rating.RatedResult;
import com.infomedia.abacox.callbilling.component.rating.RatingStatus;
import com.infomedia.abacox.callbilling.db.entity.*;
import com.infomedia.abacox.callbilling.db.repository.AccountRepository;
import com.infomedia.abacox.callbilling.db.repository.BalanceTransactionRepository;
import com.infomedia.abacox.callbilling.db.repository.ReservationRepository;
import com.infomedia.abacox.callbilling.exception.*;
import com.infomedia.abacox.callbilling.service.AccountService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class SettlementLedgerServiceTest {

    private static final Duration TTL = Duration.ofHours(1);

    @Autowired
    private SettlementLedgerService ledger;
    @Autowired
    private AccountService accountService;
    @Autowired
    private AccountRepository accountRepository;
    @Autowired
    private ReservationRepository reservationRepository;
    @Autowired
    private BalanceTransactionRepository transactionRepository;

    // 0.60 per minute, whole minutes
    private final RatedResult mobile = RatedResult.builder()
            .status(RatingStatus.RATED)
            .destinationNumber("573101234567")
            .rateEntryId(1L)
            .destinationPrefix("57310")
            .destinationName("Colombia Mobile")
            .ratePerMinute(new BigDecimal("0.6000"))
            .billingIncrement(60)
            .connectionFee(BigDecimal.ZERO)
            .build();

    @Test
    void shouldConsumeActualCostAndReleaseRemainder() {
        // Given
        Account account = account("10.00", "0", 1);
        String callId = callId();
        ledger.reserve(account.getId(), callId, new BigDecimal("3.00"), TTL, mobile);

        // When
        SettlementOutcome outcome = ledger.settle(callId, 61, mobile);

        // Then
        assertThat(outcome.getActualCost()).isEqualByComparingTo("1.20");
        assertThat(outcome.getConsumedAmount()).isEqualByComparingTo("1.20");
        assertThat(outcome.getReleasedAmount()).isEqualByComparingTo("1.80");
        assertThat(outcome.hasOverage()).isFalse();
        assertThat(outcome.getNewBalance()).isEqualByComparingTo("8.80");

        Reservation reservation = reservationRepository.findByCallId(callId).orElseThrow();
        assertThat(reservation.getStatus()).isEqualTo(ReservationStatus.COMMITTED);
        assertThat(reservation.getConsumedAmount().add(reservation.getReleasedAmount()))
                .isEqualByComparingTo(reservation.getReservedAmount());
        assertThat(reservation.getDestinationPrefix()).isEqualTo("57310");

        List<BalanceTransaction> transactions = transactionRepository.findByCallId(callId);
        assertThat(transactions).hasSize(1);
        assertThat(transactions.get(0).getTransactionType()).isEqualTo(TransactionType.CONSUMPTION);
        assertThat(transactions.get(0).getAmount()).isEqualByComparingTo("-1.20");
        assertThat(transactions.get(0).getPreviousBalance()).isEqualByComparingTo("10.00");
        assertThat(transactions.get(0).getNewBalance()).isEqualByComparingTo("8.80");
        assertThat(accountService.reconcile(account.getId()).isConsistent()).isTrue();
    }

    @Test
    void shouldRecordOverageWhenCostExceedsHold() {
        // Given
        Account account = account("10.00", "0", 1);
        String callId = callId();
        ledger.reserve(account.getId(), callId, new BigDecimal("0.60"), TTL, mobile);

        // When: three minutes against a one minute hold
        SettlementOutcome outcome = ledger.settle(callId, 180, mobile);

        // Then
        assertThat(outcome.getConsumedAmount()).isEqualByComparingTo("0.60");
        assertThat(outcome.getReleasedAmount()).isEqualByComparingTo("0");
        assertThat(outcome.getOverageAmount()).isEqualByComparingTo("1.20");
        assertThat(outcome.hasOverage()).isTrue();
        assertThat(reload(account).getBalance()).isEqualByComparingTo("9.40");
        assertThat(reservationRepository.findByCallId(callId).orElseThrow().getOverageAmount()).isEqualByComparingTo("1.20");
        assertThat(accountService.reconcile(account.getId()).isConsistent()).isTrue();
    }

    @Test
    void shouldAppendZeroTransactionForFreeCall() {
        Account account = account("5.00", "0", 1);
        String callId = callId();
        ledger.reserve(account.getId(), callId, new BigDecimal("0.60"), TTL, RatedResult.unrated("4420"));

        SettlementOutcome outcome = ledger.settle(callId, 120, RatedResult.unrated("4420"));

        assertThat(outcome.getConsumedAmount()).isEqualByComparingTo("0");
        assertThat(outcome.getReleasedAmount()).isEqualByComparingTo("0.60");
        assertThat(transactionRepository.findByCallId(callId)).hasSize(1);
        assertThat(reload(account).getBalance()).isEqualByComparingTo("5.00");
    }

    @Test
    void shouldExtendHoldAndCoverLongerCall() {
        // Given
        Account account = account("5.00", "0", 1);
        String callId = callId();
        ledger.reserve(account.getId(), callId, new BigDecimal("3.00"), TTL, mobile);

        // When
        Reservation extended = ledger.extend(callId, new BigDecimal("1.80"), Duration.ofHours(2));
        SettlementOutcome outcome = ledger.settle(callId, 360, mobile);

        // Then
        assertThat(extended.getReservedAmount()).isEqualByComparingTo("4.80");
        assertThat(extended.getExtensionCount()).isEqualTo(1);
        assertThat(extended.getExpiresAt()).isAfter(Instant.now().plus(TTL));
        assertThat(outcome.getConsumedAmount()).isEqualByComparingTo("3.60");
        assertThat(outcome.getReleasedAmount()).isEqualByComparingTo("1.20");
        assertThat(outcome.hasOverage()).isFalse();
        assertThat(reload(account).getBalance()).isEqualByComparingTo("1.40");
        assertThat(accountService.reconcile(account.getId()).isConsistent()).isTrue();
    }

    @Test
    void shouldRefuseExtensionBeyondAvailableBalance() {
        // Given
        Account account = account("4.00", "0", 1);
        String callId = callId();
        ledger.reserve(account.getId(), callId, new BigDecimal("3.00"), TTL, mobile);

        // When / Then
        assertThatThrownBy(() -> ledger.extend(callId, new BigDecimal("1.80"), TTL))
                .isInstanceOf(InsufficientBalanceException.class);
        Reservation unchanged = reservationRepository.findByCallId(callId).orElseThrow();
        assertThat(unchanged.getReservedAmount()).isEqualByComparingTo("3.00");
        assertThat(unchanged.getExtensionCount()).isZero();
    }

    @Test
    void shouldNotExtendSettledHold() {
        Account account = account("5.00", "0", 1);
        String callId = callId();
        ledger.reserve(account.getId(), callId, new BigDecimal("3.00"), TTL, mobile);
        ledger.settle(callId, 60, mobile);

        assertThatThrownBy(() -> ledger.extend(callId, new BigDecimal("1.80"), TTL))
                .isInstanceOf(ReservationNotFoundException.class);
        assertThatThrownBy(() -> ledger.extend(callId(), new BigDecimal("1.80"), TTL))
                .isInstanceOf(ReservationNotFoundException.class);
    }

    @Test
    void shouldRefuseHoldBeyondBalancePlusCredit() {
        Account account = account("1.00", "0", 2);

        assertThatThrownBy(() -> ledger.reserve(account.getId(), callId(), new BigDecimal("2.00"), TTL))
                .isInstanceOf(InsufficientBalanceException.class);
        assertThat(reservationRepository.findByAccountIdAndStatus(account.getId(), ReservationStatus.ACTIVE)).isEmpty();
    }

    @Test
    void shouldCountCreditLimitAsAvailable() {
        Account account = account("1.00", "5.00", 2);

        Reservation reservation = ledger.reserve(account.getId(), callId(), new BigDecimal("4.00"), TTL);

        assertThat(reservation.getStatus()).isEqualTo(ReservationStatus.ACTIVE);
        assertThat(ledger.availableBalance(account.getId())).isEqualByComparingTo("2.00");
    }

    @Test
    void shouldSubtractLiveHoldsFromAvailability() {
        // Given
        Account account = account("5.00", "0", 0);
        ledger.reserve(account.getId(), callId(), new BigDecimal("3.00"), TTL);

        // When & Then
        assertThatThrownBy(() -> ledger.reserve(account.getId(), callId(), new BigDecimal("3.00"), TTL))
                .isInstanceOf(InsufficientBalanceException.class)
                .hasFieldOrPropertyWithValue("available", new BigDecimal("2.0000"));
        assertThat(ledger.reserve(account.getId(), callId(), new BigDecimal("2.00"), TTL)).isNotNull();
    }

    @Test
    void shouldRejectSecondReservationForSameCall() {
        Account account = account("10.00", "0", 0);
        String callId = callId();
        ledger.reserve(account.getId(), callId, new BigDecimal("1.00"), TTL);

        assertThatThrownBy(() -> ledger.reserve(account.getId(), callId, new BigDecimal("1.00"), TTL))
                .isInstanceOf(DuplicateReservationException.class);
    }

    @Test
    void shouldEnforceConcurrentCallLimit() {
        Account account = account("10.00", "0", 1);
        ledger.reserve(account.getId(), callId(), new BigDecimal("1.00"), TTL);

        assertThatThrownBy(() -> ledger.reserve(account.getId(), callId(), new BigDecimal("1.00"), TTL))
                .isInstanceOf(ConcurrentCallLimitException.class);
    }

    @Test
    void shouldRefuseInactiveOrUnknownAccounts() {
        Account suspended = accountRepository.save(Account.builder()
                .accountNumber("ACC-" + UUID.randomUUID())
                .balance(new BigDecimal("10.00"))
                .initialBalance(new BigDecimal("10.00"))
                .status(AccountStatus.SUSPENDED)
                .build());

        assertThatThrownBy(() -> ledger.reserve(suspended.getId(), callId(), BigDecimal.ONE, TTL))
                .isInstanceOf(AccountNotActiveException.class);
        assertThatThrownBy(() -> ledger.reserve(Long.MAX_VALUE, callId(), BigDecimal.ONE, TTL))
                .isInstanceOf(AccountNotFoundException.class);
    }

    @Test
    void shouldRejectNegativeHold() {
        Account account = account("10.00", "0", 1);

        assertThatThrownBy(() -> ledger.reserve(account.getId(), callId(), new BigDecimal("-1"), TTL))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldSettleOnlyOnce() {
        // Given
        Account account = account("10.00", "0", 1);
        String callId = callId();
        ledger.reserve(account.getId(), callId, new BigDecimal("3.00"), TTL);
        ledger.settle(callId, 60, mobile);

        // When & Then
        assertThatThrownBy(() -> ledger.settle(callId, 60, mobile))
                .isInstanceOf(ReservationNotFoundException.class);
        assertThat(reload(account).getBalance()).isEqualByComparingTo("9.40");
        assertThat(transactionRepository.findByCallId(callId)).hasSize(1);
    }

    @Test
    void shouldFailSettlementWithoutReservation() {
        assertThatThrownBy(() -> ledger.settle(callId(), 60, mobile))
                .isInstanceOf(ReservationNotFoundException.class);
    }

    @Test
    void shouldReleaseWholeHoldWithoutTouchingBalance() {
        // Given
        Account account = account("10.00", "0", 1);
        String callId = callId();
        ledger.reserve(account.getId(), callId, new BigDecimal("3.00"), TTL);

        // When
        SettlementOutcome outcome = ledger.release(callId, "not answered");

        // Then
        assertThat(outcome.getStatus()).isEqualTo(ReservationStatus.RELEASED);
        assertThat(outcome.getReleasedAmount()).isEqualByComparingTo("3.00");
        assertThat(reload(account).getBalance()).isEqualByComparingTo("10.00");
        assertThat(transactionRepository.findByCallId(callId)).isEmpty();
        assertThat(ledger.availableBalance(account.getId())).isEqualByComparingTo("10.00");
        assertThatThrownBy(() -> ledger.release(callId, "again")).isInstanceOf(ReservationNotFoundException.class);
    }

    @Test
    void shouldExpireStaleHoldsAndFreeTheirBalance() {
        // Given
        Account account = account("5.00", "0", 1);
        String callId = callId();
        ledger.reserve(account.getId(), callId, new BigDecimal("4.00"), Duration.ofMinutes(1));

        // When
        int expired = ledger.expireStale(Instant.now().plus(Duration.ofMinutes(2)));

        // Then
        assertThat(expired).isGreaterThanOrEqualTo(1);
        Reservation reservation = reservationRepository.findByCallId(callId).orElseThrow();
        assertThat(reservation.getStatus()).isEqualTo(ReservationStatus.EXPIRED);
        assertThat(reservation.getReleasedAmount()).isEqualByComparingTo("4.00");
        assertThat(ledger.availableBalance(account.getId())).isEqualByComparingTo("5.00");
        assertThat(ledger.reserve(account.getId(), callId(), new BigDecimal("4.00"), TTL)).isNotNull();
        assertThatThrownBy(() -> ledger.settle(callId, 60, mobile)).isInstanceOf(ReservationNotFoundException.class);
    }

    @Test
    void shouldSerializeConcurrentSettlementsOnOneAccount() throws Exception {
        // Given: twenty calls on one account, all ending at once
        Account account = account("100.00", "0", 0);
        List<String> callIds = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            String callId = callId();
            ledger.reserve(account.getId(), callId, new BigDecimal("1.00"), TTL, mobile);
            callIds.add(callId);
        }

        // When
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<SettlementOutcome>> results = new ArrayList<>();
            for (String callId : callIds) {
                results.add(executor.submit(() -> ledger.settle(callId, 60, mobile)));
            }
            for (Future<SettlementOutcome> result : results) {
                result.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Then: every deduction is visible, none lost
        assertThat(reload(account).getBalance()).isEqualByComparingTo("88.00");
        assertThat(transactionRepository.countByAccountId(account.getId())).isEqualTo(20);
        assertThat(accountService.reconcile(account.getId()).isConsistent()).isTrue();
    }

    private Account account(String balance, String creditLimit, int maxConcurrentCalls) {
        return accountRepository.save(Account.builder()
                .accountNumber("ACC-" + UUID.randomUUID())
                .balance(new BigDecimal(balance))
                .initialBalance(new BigDecimal(balance))
                .creditLimit(new BigDecimal(creditLimit))
                .maxConcurrentCalls(maxConcurrentCalls)
                .build());
    }

    private Account reload(Account account) {
        return accountRepository.findById(account.getId()).orElseThrow();
    }

    private static String callId() {
        return UUID.randomUUID().toString();
    }
}
