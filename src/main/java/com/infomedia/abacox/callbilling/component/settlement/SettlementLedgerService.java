package com.infomedia.abacox.callbilling.component.settlement;

import com.infomedia.abacox.callbilling.component.rating.CostCalculator;
import com.infomedia.abacox.callbilling.component.rating.RatedResult;
import com.infomedia.abacox.callbilling.db.entity.*;
import com.infomedia.abacox.callbilling.db.repository.AccountRepository;
import com.infomedia.abacox.callbilling.db.repository.BalanceTransactionRepository;
import com.infomedia.abacox.callbilling.db.repository.ReservationRepository;
import com.infomedia.abacox.callbilling.exception.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Reserve-then-commit ledger.
 * <pre>
 * ACTIVE --settle--> COMMITTED
 *        --release-> RELEASED
 *        --expire--> EXPIRED
 *        --extend--> ACTIVE (larger hold, later expiry)
 * </pre>
 * Every write locks the account row first and runs through {@link LedgerWriteExecutor}, so
 * concurrent calls on one account apply one after the other and a balance change is always
 * stored together with its {@link BalanceTransaction}.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class SettlementLedgerService {

    private final AccountRepository accountRepository;
    private final ReservationRepository reservationRepository;
    private final BalanceTransactionRepository balanceTransactionRepository;
    private final LedgerWriteExecutor writeExecutor;
    private final Clock clock;

    /**
     * Places a hold of {@code estimatedAmount} on the account for {@code callId}.
     *
     * @throws AccountNotFoundException      unknown account
     * @throws AccountNotActiveException     account suspended or closed
     * @throws ConcurrentCallLimitException  account already at its concurrent call limit
     * @throws InsufficientBalanceException  balance plus credit minus live holds is below the estimate
     * @throws DuplicateReservationException a reservation was already made for this call
     */
    public Reservation reserve(Long accountId, String callId, BigDecimal estimatedAmount, Duration ttl) {
        return reserve(accountId, callId, estimatedAmount, ttl, null);
    }

    /**
     * As {@link #reserve(Long, String, BigDecimal, Duration)}, also recording the tariff the hold was sized with.
     */
    public Reservation reserve(Long accountId, String callId, BigDecimal estimatedAmount, Duration ttl, RatedResult quote) {
        BigDecimal amount = scale(estimatedAmount);
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Estimated amount must not be negative");
        }
        return writeExecutor.execute("reserve " + callId, status -> {
            if (reservationRepository.existsByCallId(callId)) {
                throw new DuplicateReservationException(callId);
            }
            Account account = lockAccount(accountId);
            if (account.getStatus() != AccountStatus.ACTIVE) {
                throw new AccountNotActiveException(accountId, account.getStatus());
            }

            Instant now = clock.instant();
            int limit = account.getMaxConcurrentCalls();
            if (limit > 0 && reservationRepository.countLiveByAccountId(accountId, now) >= limit) {
                throw new ConcurrentCallLimitException(accountId, limit);
            }

            BigDecimal available = available(account, now);
            if (available.compareTo(amount) < 0) {
                throw new InsufficientBalanceException(accountId, available, amount);
            }

            Reservation reservation = Reservation.builder()
                    .accountId(accountId)
                    .callId(callId)
                    .reservedAmount(amount)
                    .status(ReservationStatus.ACTIVE)
                    .expiresAt(now.plus(ttl))
                    .destinationPrefix(quote != null && quote.isValid() ? quote.getDestinationPrefix() : null)
                    .ratePerMinute(quote != null && quote.isValid() ? quote.getRatePerMinute() : null)
                    .build();
            try {
                reservation = reservationRepository.saveAndFlush(reservation);
            } catch (DataIntegrityViolationException e) {
                throw new DuplicateReservationException(callId);
            }
            log.info("Reserved {} on account {} for call {} (available was {})",
                    amount.toPlainString(), accountId, callId, available.toPlainString());
            return reservation;
        });
    }

    /**
     * Grows the hold of a running call by {@code additionalAmount} and moves its expiry to
     * {@code ttl} from now.
     *
     * @throws ReservationNotFoundException no reservation for the call, or it already left ACTIVE
     * @throws AccountNotActiveException    account suspended or closed since the call started
     * @throws InsufficientBalanceException the extra hold does not fit in the available balance
     */
    public Reservation extend(String callId, BigDecimal additionalAmount, Duration ttl) {
        BigDecimal amount = scale(additionalAmount);
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Extension amount must be positive");
        }
        return writeExecutor.execute("extend " + callId, status -> {
            Reservation reservation = activeReservation(callId);
            Account account = lockAccount(reservation.getAccountId());
            if (account.getStatus() != AccountStatus.ACTIVE) {
                throw new AccountNotActiveException(account.getId(), account.getStatus());
            }
            Instant now = clock.instant();
            BigDecimal available = available(account, now);
            if (available.compareTo(amount) < 0) {
                throw new InsufficientBalanceException(account.getId(), available, amount);
            }
            reservation.setReservedAmount(scale(reservation.getReservedAmount().add(amount)));
            reservation.setExtensionCount(reservation.getExtensionCount() + 1);
            reservation.setExpiresAt(now.plus(ttl));
            reservation = reservationRepository.save(reservation);
            log.info("Extended hold for call {} by {} to {} (extension {}, account {})", callId,
                    amount.toPlainString(), reservation.getReservedAmount().toPlainString(),
                    reservation.getExtensionCount(), account.getId());
            return reservation;
        });
    }

    /**
     * Commits the call's cost against its ACTIVE reservation and debits the account.
     * <p>
     * When the cost exceeds the hold, only the held amount is consumed and the difference is
     * recorded as overage on the reservation for reconciliation.
     *
     * @throws ReservationNotFoundException no reservation for the call, or it already left ACTIVE
     */
    public SettlementOutcome settle(String callId, long billableSeconds, RatedResult rated) {
        BigDecimal actualCost = CostCalculator.cost(rated, billableSeconds);
        return writeExecutor.execute("settle " + callId, status -> {
            Reservation reservation = activeReservation(callId);
            Account account = lockAccount(reservation.getAccountId());

            BigDecimal reserved = reservation.getReservedAmount();
            BigDecimal consumed;
            BigDecimal released;
            BigDecimal overage;
            if (actualCost.compareTo(reserved) <= 0) {
                consumed = actualCost;
                released = reserved.subtract(actualCost);
                overage = zero();
            } else {
                consumed = reserved;
                released = zero();
                overage = actualCost.subtract(reserved);
                log.warn("Overage on call {}: cost {} exceeds hold {} by {} (account {})",
                        callId, actualCost.toPlainString(), reserved.toPlainString(),
                        overage.toPlainString(), account.getId());
            }

            Instant now = clock.instant();
            reservation.setConsumedAmount(scale(consumed));
            reservation.setReleasedAmount(scale(released));
            reservation.setOverageAmount(scale(overage));
            reservation.setStatus(ReservationStatus.COMMITTED);
            reservation.setSettledAt(now);
            reservationRepository.save(reservation);

            BalanceTransaction transaction = appendTransaction(account, consumed.negate(),
                    TransactionType.CONSUMPTION, "Call " + callId + " (" + billableSeconds + "s)", callId, now);

            log.info("Settled call {}: cost {}, consumed {}, released {}, balance {} -> {}",
                    callId, actualCost.toPlainString(), consumed.toPlainString(), released.toPlainString(),
                    transaction.getPreviousBalance().toPlainString(), transaction.getNewBalance().toPlainString());

            return SettlementOutcome.builder()
                    .reservationId(reservation.getId())
                    .callId(callId)
                    .accountId(account.getId())
                    .status(ReservationStatus.COMMITTED)
                    .reservedAmount(reserved)
                    .actualCost(actualCost)
                    .consumedAmount(reservation.getConsumedAmount())
                    .releasedAmount(reservation.getReleasedAmount())
                    .overageAmount(reservation.getOverageAmount())
                    .newBalance(account.getBalance())
                    .build();
        });
    }

    /**
     * Gives the whole hold back without touching the balance.
     *
     * @throws ReservationNotFoundException no reservation for the call, or it already left ACTIVE
     */
    public SettlementOutcome release(String callId, String reason) {
        return writeExecutor.execute("release " + callId, status -> {
            Reservation reservation = activeReservation(callId);
            Account account = lockAccount(reservation.getAccountId());
            finish(reservation, ReservationStatus.RELEASED, clock.instant());
            log.info("Released hold {} for call {} on account {}: {}",
                    reservation.getReservedAmount().toPlainString(), callId, account.getId(), reason);
            return SettlementOutcome.builder()
                    .reservationId(reservation.getId())
                    .callId(callId)
                    .accountId(account.getId())
                    .status(ReservationStatus.RELEASED)
                    .reservedAmount(reservation.getReservedAmount())
                    .actualCost(zero())
                    .consumedAmount(reservation.getConsumedAmount())
                    .releasedAmount(reservation.getReleasedAmount())
                    .overageAmount(zero())
                    .newBalance(account.getBalance())
                    .build();
        });
    }

    /**
     * Moves every ACTIVE reservation whose expiry is at or before {@code now} to EXPIRED, returning
     * its hold. Each reservation is handled in its own transaction; one that was settled meanwhile
     * is skipped.
     *
     * @return number of reservations expired
     */
    public int expireStale(Instant now) {
        List<Reservation> stale = reservationRepository.findByStatusAndExpiresAtLessThanEqual(ReservationStatus.ACTIVE, now);
        int expired = 0;
        for (Reservation candidate : stale) {
            try {
                Boolean done = writeExecutor.execute("expire " + candidate.getCallId(), status -> {
                    Optional<Reservation> current = reservationRepository.findById(candidate.getId());
                    if (current.isEmpty() || current.get().getStatus() != ReservationStatus.ACTIVE) {
                        return false;
                    }
                    lockAccount(current.get().getAccountId());
                    finish(current.get(), ReservationStatus.EXPIRED, now);
                    return true;
                });
                if (Boolean.TRUE.equals(done)) {
                    expired++;
                    log.warn("Expired reservation for call {} on account {} ({} returned)",
                            candidate.getCallId(), candidate.getAccountId(), candidate.getReservedAmount().toPlainString());
                }
            } catch (LedgerException e) {
                log.error("Could not expire reservation for call {}: {}", candidate.getCallId(), e.getMessage());
            }
        }
        return expired;
    }

    /**
     * Moves the balance of an account by a signed amount outside any call hold, recording the
     * transaction in the same write. Used for recharges and refunds.
     */
    public BalanceTransaction adjust(Long accountId, BigDecimal amount, TransactionType type, String reason, String callId) {
        return writeExecutor.execute(type + " " + accountId, status -> {
            Account account = lockAccount(accountId);
            BalanceTransaction transaction = appendTransaction(account, amount, type, reason, callId, clock.instant());
            log.info("{} of {} on account {}: balance {} -> {}", type, amount.toPlainString(), accountId,
                    transaction.getPreviousBalance().toPlainString(), transaction.getNewBalance().toPlainString());
            return transaction;
        });
    }

    /**
     * Balance plus credit limit minus live holds.
     */
    @Transactional(readOnly = true)
    public BigDecimal availableBalance(Long accountId) {
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));
        return available(account, clock.instant());
    }

    @Transactional(readOnly = true)
    public Optional<Reservation> findReservation(String callId) {
        return reservationRepository.findByCallId(callId);
    }

    /**
     * Appends one transaction and moves the balance by {@code amount}. Must run inside a ledger
     * write on a locked account.
     */
    BalanceTransaction appendTransaction(Account account, BigDecimal amount, TransactionType type,
                                         String reason, String callId, Instant now) {
        BigDecimal previous = account.getBalance();
        BigDecimal next = scale(previous.add(amount));
        account.setBalance(next);
        accountRepository.save(account);
        return balanceTransactionRepository.save(BalanceTransaction.builder()
                .accountId(account.getId())
                .amount(scale(amount))
                .previousBalance(scale(previous))
                .newBalance(next)
                .transactionType(type)
                .reason(reason)
                .callId(callId)
                .createdDate(now)
                .build());
    }

    Account lockAccount(Long accountId) {
        return accountRepository.findForUpdateById(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    private Reservation activeReservation(String callId) {
        Reservation reservation = reservationRepository.findByCallId(callId)
                .orElseThrow(() -> new ReservationNotFoundException(callId, "none recorded"));
        if (reservation.getStatus() != ReservationStatus.ACTIVE) {
            throw new ReservationNotFoundException(callId, "already " + reservation.getStatus());
        }
        return reservation;
    }

    private void finish(Reservation reservation, ReservationStatus terminal, Instant now) {
        reservation.setConsumedAmount(zero());
        reservation.setReleasedAmount(reservation.getReservedAmount());
        reservation.setStatus(terminal);
        reservation.setSettledAt(now);
        reservationRepository.save(reservation);
    }

    private BigDecimal available(Account account, Instant now) {
        BigDecimal held = reservationRepository.sumLiveReservedByAccountId(account.getId(), now);
        return scale(account.getBalance().add(account.getCreditLimit()).subtract(held == null ? BigDecimal.ZERO : held));
    }

    private static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(CostCalculator.SCALE, RoundingMode.HALF_UP);
    }

    static BigDecimal scale(BigDecimal value) {
        return value.setScale(CostCalculator.SCALE, RoundingMode.HALF_UP);
    }
}
