package com.infomedia.abacox.callbilling.component.settlement;

import com.infomedia.abacox.callbilling.component.callevents.CallEndedEvent;
import com.infomedia.abacox.callbilling.component.calltracking.ActiveCall;
import com.infomedia.abacox.callbilling.component.calltracking.CallDirection;
import com.infomedia.abacox.callbilling.component.configmanager.ConfigKey;
import com.infomedia.abacox.callbilling.component.configmanager.ConfigService;
import com.infomedia.abacox.callbilling.component.configmanager.UnratedPolicy;
import com.infomedia.abacox.callbilling.component.rating.CostCalculator;
import com.infomedia.abacox.callbilling.component.rating.RatedResult;
import com.infomedia.abacox.callbilling.component.rating.RatingService;
import com.infomedia.abacox.callbilling.db.entity.Account;
import com.infomedia.abacox.callbilling.db.entity.CallDetailRecord;
import com.infomedia.abacox.callbilling.db.entity.CdrDisposition;
import com.infomedia.abacox.callbilling.db.entity.Reservation;
import com.infomedia.abacox.callbilling.db.entity.ReservationStatus;
import com.infomedia.abacox.callbilling.db.entity.TransactionType;
import com.infomedia.abacox.callbilling.db.repository.AccountRepository;
import com.infomedia.abacox.callbilling.db.repository.CallDetailRecordRepository;
import com.infomedia.abacox.callbilling.dto.cdr.CdrDto;
import com.infomedia.abacox.callbilling.exception.DuplicateReservationException;
import com.infomedia.abacox.callbilling.exception.LedgerException;
import com.infomedia.abacox.callbilling.exception.ReservationNotFoundException;
import com.infomedia.abacox.callbilling.service.remote.DashboardGatewayService;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Connects the call lifecycle to rating and the ledger. Called from the call's worker lane,
 * so calls for one id never overlap here. Ledger refusals are outcomes, not failures: they are
 * recorded on the call and in its CDR.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class CallBillingService {

    private final RatingService ratingService;
    private final SettlementLedgerService ledgerService;
    private final AccountRepository accountRepository;
    private final CallDetailRecordRepository cdrRepository;
    private final DashboardGatewayService gatewayService;
    private final ConfigService configService;
    private final Clock clock;

    /**
     * Rates the destination and places a hold for a new call.
     */
    public BillingAuthorization authorize(ActiveCall call) {
        Instant asOf = call.getStartTime() != null ? call.getStartTime() : clock.instant();
        RatedResult quote = ratingService.rate(call.getCalleeNumber(), asOf);

        if (!isBillableDirection(call.getDirection())) {
            return BillingAuthorization.unbilled(quote, "direction " + call.getDirection() + " not billed");
        }
        Optional<Account> account = resolveAccount(call.getCallerNumber());
        if (account.isEmpty()) {
            log.debug("No account for caller {} on call {}", call.getCallerNumber(), call.getCallId());
            return BillingAuthorization.unbilled(quote, "no account for caller");
        }
        Long accountId = account.get().getId();

        if (!quote.isValid() && unratedPolicy() == UnratedPolicy.REJECT) {
            log.warn("Rejecting call {} to unrated destination {}", call.getCallId(), call.getCalleeNumber());
            return BillingAuthorization.rejected(accountId, quote, "destination not rated");
        }

        BigDecimal hold = CostCalculator.estimate(quote, reservationSeconds());
        try {
            Reservation reservation = ledgerService.reserve(accountId, call.getCallId(), hold, reservationTtl(), quote);
            return BillingAuthorization.reserved(accountId, quote,
                    reservation != null ? reservation.getReservedAmount() : hold);
        } catch (DuplicateReservationException e) {
            log.warn("Call {} already holds a reservation; keeping it", call.getCallId());
            BigDecimal existing = ledgerService.findReservation(call.getCallId())
                    .map(Reservation::getReservedAmount)
                    .orElse(hold);
            return BillingAuthorization.reserved(accountId, quote, existing);
        } catch (LedgerException e) {
            log.warn("Reservation refused for call {} on account {}: {}", call.getCallId(), accountId, e.getMessage());
            return BillingAuthorization.rejected(accountId, quote, e.getMessage());
        }
    }

    /**
     * Grows the hold of an answered call once the talk time it still covers drops below
     * {@link ConfigKey#HOLD_EXTENSION_THRESHOLD_SECONDS}. Each extension adds
     * {@link ConfigKey#HOLD_EXTENSION_SECONDS} of talk time at the quoted rate.
     *
     * @return the new hold, or empty when none was needed or the ledger refused it
     */
    public Optional<BigDecimal> extendHold(ActiveCall call, Instant now) {
        RatedResult quote = call.getQuote();
        if (!call.isReserved() || call.getAnswerTime() == null || call.getHeldAmount() == null
                || quote == null || !quote.isValid()) {
            return Optional.empty();
        }
        long elapsed = Math.max(0, Duration.between(call.getAnswerTime(), now).getSeconds());
        long threshold = configService.getValue(ConfigKey.HOLD_EXTENSION_THRESHOLD_SECONDS).asLong();
        if (CostCalculator.cost(quote, elapsed + threshold).compareTo(call.getHeldAmount()) <= 0) {
            return Optional.empty();
        }
        BigDecimal additional = CostCalculator.usage(quote, configService.getValue(ConfigKey.HOLD_EXTENSION_SECONDS).asLong());
        if (additional.signum() <= 0) {
            return Optional.empty();
        }
        try {
            Reservation extended = ledgerService.extend(call.getCallId(), additional, reservationTtl());
            return Optional.of(extended.getReservedAmount());
        } catch (LedgerException e) {
            log.warn("Hold for call {} not extended after {}s: {}", call.getCallId(), elapsed, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Final pricing for an ended call: commits or releases its hold, writes the CDR once and
     * mirrors it to the dashboard. A second call for the same id returns the stored CDR.
     */
    public CallDetailRecord settle(ActiveCall call, CallEndedEvent end) {
        Optional<CallDetailRecord> existing = cdrRepository.findByCallId(call.getCallId());
        if (existing.isPresent()) {
            log.debug("CDR for call {} already written", call.getCallId());
            return existing.get();
        }

        Instant start = firstNonNull(call.getStartTime(), end.getStartTime(), end.getEndTime());
        RatedResult rated = ratingService.rate(call.getCalleeNumber(), start);
        long billable = end.getBillableSeconds();
        BigDecimal cost = CostCalculator.cost(rated, billable);

        CallDetailRecord.CallDetailRecordBuilder<?, ?> cdr = CallDetailRecord.builder()
                .accountId(call.getAccountId())
                .cost(cost);
        if (call.isRejected()) {
            cdr.disposition(CdrDisposition.REJECTED)
                    .dispositionReason(call.getRejectionReason())
                    .cost(zero());
        } else if (call.isReserved()) {
            settleReserved(call, billable, rated, cdr);
        } else if (!call.isBillingChecked()) {
            settleUntracked(call, billable, rated, cdr);
        } else {
            cdr.disposition(CdrDisposition.UNBILLED).dispositionReason("not billed to an account");
        }

        CallDetailRecord record = store(cdr, call, end, start, rated, billable);
        gatewayService.publishCdr(toDto(record));
        return record;
    }

    private void settleReserved(ActiveCall call, long billable, RatedResult rated,
                                CallDetailRecord.CallDetailRecordBuilder<?, ?> cdr) {
        cdr.disposition(rated.isValid() ? CdrDisposition.BILLED : CdrDisposition.UNRATED);
        try {
            if (billable <= 0) {
                ledgerService.release(call.getCallId(), "no billable time");
            } else {
                SettlementOutcome outcome = ledgerService.settle(call.getCallId(), billable, rated);
                if (outcome.hasOverage()) {
                    cdr.dispositionReason("overage " + outcome.getOverageAmount().toPlainString() + " not charged");
                }
            }
        } catch (ReservationNotFoundException e) {
            log.warn("Hold for call {} is gone at settlement: {}", call.getCallId(), e.getMessage());
            settleWithoutHold(call, billable, rated, cdr);
        }
    }

    /**
     * The hold expired or was never stored. A committed reservation means the call is already
     * paid for; otherwise the actual cost is debited directly, and if the ledger refuses the
     * CDR is left unbilled.
     */
    private void settleWithoutHold(ActiveCall call, long billable, RatedResult rated,
                                   CallDetailRecord.CallDetailRecordBuilder<?, ?> cdr) {
        String callId = call.getCallId();
        Optional<Reservation> reservation = ledgerService.findReservation(callId);
        if (reservation.isPresent() && reservation.get().getStatus() == ReservationStatus.COMMITTED) {
            cdr.dispositionReason("already settled");
            return;
        }
        String holdState = reservation.map(r -> "hold " + r.getStatus()).orElse("no hold");
        BigDecimal cost = CostCalculator.cost(rated, billable);
        if (cost.signum() == 0) {
            cdr.dispositionReason(holdState);
            return;
        }
        try {
            ledgerService.adjust(call.getAccountId(), cost.negate(), TransactionType.CONSUMPTION,
                    "Call " + callId + " (" + billable + "s), " + holdState, callId);
            cdr.dispositionReason(holdState + ", charged without hold");
        } catch (LedgerException e) {
            log.warn("Could not charge call {} to account {}: {}", callId, call.getAccountId(), e.getMessage());
            cdr.disposition(CdrDisposition.UNBILLED).dispositionReason(holdState + ": " + e.getMessage());
        }
    }

    /**
     * The start of this call was never seen. If its caller has an account, hold and settle
     * the actual cost in one go; if the ledger refuses, keep the CDR as unbilled.
     */
    private void settleUntracked(ActiveCall call, long billable, RatedResult rated,
                                 CallDetailRecord.CallDetailRecordBuilder<?, ?> cdr) {
        Optional<Account> account = isBillableDirection(call.getDirection())
                ? resolveAccount(call.getCallerNumber()) : Optional.empty();
        if (account.isEmpty() || billable <= 0) {
            cdr.disposition(CdrDisposition.UNBILLED).dispositionReason("call start not observed");
            return;
        }
        Long accountId = account.get().getId();
        cdr.accountId(accountId);
        try {
            ledgerService.reserve(accountId, call.getCallId(), CostCalculator.cost(rated, billable), reservationTtl(), rated);
            ledgerService.settle(call.getCallId(), billable, rated);
            cdr.disposition(rated.isValid() ? CdrDisposition.BILLED : CdrDisposition.UNRATED);
        } catch (LedgerException e) {
            log.warn("Could not bill untracked call {} to account {}: {}", call.getCallId(), accountId, e.getMessage());
            cdr.disposition(CdrDisposition.UNBILLED).dispositionReason(e.getMessage());
        }
    }

    private CallDetailRecord store(CallDetailRecord.CallDetailRecordBuilder<?, ?> cdr, ActiveCall call,
                                   CallEndedEvent end, Instant start, RatedResult rated, long billable) {
        CallDetailRecord record = cdr
                .callId(call.getCallId())
                .callerNumber(call.getCallerNumber())
                .calleeNumber(call.getCalleeNumber())
                .direction(call.getDirection() != null ? call.getDirection().name() : CallDirection.UNKNOWN.name())
                .startTime(start)
                .answerTime(firstNonNull(call.getAnswerTime(), end.getAnswerTime()))
                .endTime(end.getEndTime())
                .durationSeconds(end.getDurationSeconds())
                .billableSeconds(billable)
                .rateEntryId(rated.getRateEntryId())
                .destinationPrefix(rated.getDestinationPrefix())
                .destinationName(rated.getDestinationName())
                .ratePerMinute(rated.getRatePerMinute())
                .hangupCause(end.getHangupCause())
                .connectionId(firstNonNull(call.getConnectionId(), end.getConnectionId()))
                .createdDate(clock.instant())
                .build();
        try {
            CallDetailRecord saved = cdrRepository.save(record);
            log.info("CDR {} for call {}: {} {}s cost {}", saved.getDisposition(), saved.getCallId(),
                    saved.getDestinationName(), billable, saved.getCost().toPlainString());
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.debug("CDR for call {} written concurrently", call.getCallId());
            return cdrRepository.findByCallId(call.getCallId()).orElseThrow(() -> e);
        }
    }

    public Optional<Account> resolveAccount(String callerNumber) {
        if (callerNumber == null || callerNumber.isBlank()) {
            return Optional.empty();
        }
        String digits = callerNumber.replaceAll("\\D", "");
        Optional<Account> account = digits.isEmpty() ? Optional.empty()
                : accountRepository.findFirstByCustomerPhoneOrderByIdAsc(digits);
        if (account.isEmpty() && !digits.equals(callerNumber)) {
            account = accountRepository.findFirstByCustomerPhoneOrderByIdAsc(callerNumber.trim());
        }
        return account;
    }

    public static CdrDto toDto(CallDetailRecord record) {
        return CdrDto.builder()
                .uuid(record.getCallId())
                .accountId(record.getAccountId())
                .caller(record.getCallerNumber())
                .callee(record.getCalleeNumber())
                .startTime(record.getStartTime())
                .answerTime(record.getAnswerTime())
                .endTime(record.getEndTime())
                .duration(record.getDurationSeconds())
                .billsec(record.getBillableSeconds())
                .hangupCause(record.getHangupCause())
                .rateApplied(record.getRatePerMinute())
                .cost(record.getCost())
                .direction(record.getDirection() != null ? record.getDirection().toLowerCase(Locale.ROOT) : null)
                .freeswitchServerId(record.getConnectionId())
                .build();
    }

    boolean isBillableDirection(CallDirection direction) {
        if (direction == CallDirection.INBOUND) {
            return configService.getValue(ConfigKey.BILL_INBOUND).asBoolean();
        }
        return true;
    }

    private UnratedPolicy unratedPolicy() {
        return configService.getValue(ConfigKey.UNRATED_POLICY).asEnum(UnratedPolicy.class);
    }

    private long reservationSeconds() {
        return configService.getValue(ConfigKey.RESERVATION_SECONDS).asLong();
    }

    private Duration reservationTtl() {
        return Duration.ofMinutes(configService.getValue(ConfigKey.RESERVATION_TTL_MINUTES).asLong());
    }

    private static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(CostCalculator.SCALE, RoundingMode.HALF_UP);
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
