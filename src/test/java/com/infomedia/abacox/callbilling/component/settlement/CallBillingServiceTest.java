package com.infomedia.abacox.callbilling.component.settlement;

import com.infomedia.abacox.callbilling.component.callevents.CallEndedEvent;
import com.infomedia.abacox.callbilling.component.calltracking.ActiveCall;
import com.infomedia.abacox.callbilling.component.calltracking.CallDirection;
import com.infomedia.abacox.callbilling.component.calltracking.CallState;
import com.infomedia.abacox.callbilling.component.configmanager.ConfigKey;
import com.infomedia.abacox.callbilling.component.configmanager.ConfigService;
import com.infomedia.abacox.callbilling.component.configmanager.UnratedPolicy;
import com.infomedia.abacox.callbilling.component.configmanager.Value;
import com.infomedia.abacox.callbilling.component.rating.RatedResult;
import com.infomedia.abacox.callbilling.component.rating.RatingService;
import com.infomedia.abacox.callbilling.component.rating.RatingStatus;
import com.infomedia.abacox.callbilling.db.entity.Account;
import com.infomedia.abacox.callbilling.db.entity.CallDetailRecord;
import com.infomedia.abacox.callbilling.db.entity.CdrDisposition;
import com.infomedia.abacox.callbilling.db.entity.Reservation;
import com.infomedia.abacox.callbilling.db.entity.ReservationStatus;
import com.infomedia.abacox.callbilling.db.entity.TransactionType;
import com.infomedia.abacox.callbilling.db.repository.AccountRepository;
import com.infomedia.abacox.callbilling.db.repository.CallDetailRecordRepository;
import com.infomedia.abacox.callbilling.dto.cdr.CdrDto;
import com.infomedia.abacox.callbilling.exception.AccountNotFoundException;
import com.infomedia.abacox.callbilling.exception.DuplicateReservationException;
import com.infomedia.abacox.callbilling.exception.InsufficientBalanceException;
import com.infomedia.abacox.callbilling.exception.ReservationNotFoundException;
import com.infomedia.abacox.callbilling.service.remote.DashboardGatewayService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CallBillingServiceTest {

    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");
    private static final String CALLEE = "573101234567";

    private RatingService ratingService;
    private SettlementLedgerService ledgerService;
    private AccountRepository accountRepository;
    private CallDetailRecordRepository cdrRepository;
    private DashboardGatewayService gatewayService;
    private ConfigService configService;
    private CallBillingService billingService;

    private final Account account = Account.builder().id(5L).accountNumber("ACC-5").customerPhone("3001234567").build();

    private final RatedResult quote = RatedResult.builder()
            .status(RatingStatus.RATED)
            .destinationNumber(CALLEE)
            .rateEntryId(7L)
            .destinationPrefix("57310")
            .destinationName("Colombia Mobile")
            .ratePerMinute(new BigDecimal("0.6000"))
            .billingIncrement(60)
            .connectionFee(BigDecimal.ZERO)
            .build();

    @BeforeEach
    void setUp() {
        ratingService = mock(RatingService.class);
        ledgerService = mock(SettlementLedgerService.class);
        accountRepository = mock(AccountRepository.class);
        cdrRepository = mock(CallDetailRecordRepository.class);
        gatewayService = mock(DashboardGatewayService.class);
        configService = mock(ConfigService.class);

        config(ConfigKey.RESERVATION_SECONDS, "300");
        config(ConfigKey.RESERVATION_TTL_MINUTES, "240");
        config(ConfigKey.UNRATED_POLICY, UnratedPolicy.ALLOW_ZERO.name());
        config(ConfigKey.BILL_INBOUND, "false");
        config(ConfigKey.HOLD_EXTENSION_THRESHOLD_SECONDS, "60");
        config(ConfigKey.HOLD_EXTENSION_SECONDS, "180");

        when(ratingService.rate(eq(CALLEE), any())).thenReturn(quote);
        when(accountRepository.findFirstByCustomerPhoneOrderByIdAsc("3001234567")).thenReturn(Optional.of(account));
        when(cdrRepository.save(any(CallDetailRecord.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(ledgerService.settle(anyString(), anyLong(), any())).thenReturn(outcome(BigDecimal.ZERO));

        billingService = new CallBillingService(ratingService, ledgerService, accountRepository, cdrRepository,
                gatewayService, configService, Clock.fixed(START.plusSeconds(120), ZoneOffset.UTC));
    }

    @Test
    void shouldReserveFiveMinutesAtQuotedRate() {
        // When
        BillingAuthorization authorization = billingService.authorize(call("call-1", CallDirection.OUTBOUND));

        // Then
        assertThat(authorization.isReserved()).isTrue();
        assertThat(authorization.getAccountId()).isEqualTo(5L);
        assertThat(authorization.getQuote()).isEqualTo(quote);
        assertThat(authorization.getHeldAmount()).isEqualByComparingTo("3.00");
        verify(ledgerService).reserve(eq(5L), eq("call-1"), argThat(hold -> hold.compareTo(new BigDecimal("3.00")) == 0),
                eq(Duration.ofMinutes(240)), eq(quote));
    }

    @Test
    void shouldNotBillInboundCallsByDefault() {
        BillingAuthorization authorization = billingService.authorize(call("call-1", CallDirection.INBOUND));

        assertThat(authorization.isReserved()).isFalse();
        assertThat(authorization.isRejected()).isFalse();
        assertThat(authorization.getUnbilledReason()).contains("INBOUND");
        verifyNoInteractions(ledgerService, accountRepository);
    }

    @Test
    void shouldBillInboundCallsWhenEnabled() {
        config(ConfigKey.BILL_INBOUND, "true");

        BillingAuthorization authorization = billingService.authorize(call("call-1", CallDirection.INBOUND));

        assertThat(authorization.isReserved()).isTrue();
    }

    @Test
    void shouldLeaveCallUnbilledWhenCallerHasNoAccount() {
        ActiveCall call = call("call-1", CallDirection.OUTBOUND).toBuilder().callerNumber("3119999999").build();

        BillingAuthorization authorization = billingService.authorize(call);

        assertThat(authorization.getAccountId()).isNull();
        assertThat(authorization.getUnbilledReason()).isEqualTo("no account for caller");
        verifyNoInteractions(ledgerService);
    }

    @Test
    void shouldRejectUnratedDestinationUnderRejectPolicy() {
        // Given
        config(ConfigKey.UNRATED_POLICY, UnratedPolicy.REJECT.name());
        when(ratingService.rate(eq("999"), any())).thenReturn(RatedResult.unrated("999"));
        ActiveCall call = call("call-1", CallDirection.OUTBOUND).toBuilder().calleeNumber("999").build();

        // When
        BillingAuthorization authorization = billingService.authorize(call);

        // Then
        assertThat(authorization.isRejected()).isTrue();
        assertThat(authorization.getRejectionReason()).isEqualTo("destination not rated");
        verifyNoInteractions(ledgerService);
    }

    @Test
    void shouldHoldNothingForUnratedDestinationUnderAllowZero() {
        when(ratingService.rate(eq("999"), any())).thenReturn(RatedResult.unrated("999"));
        ActiveCall call = call("call-1", CallDirection.OUTBOUND).toBuilder().calleeNumber("999").build();

        BillingAuthorization authorization = billingService.authorize(call);

        assertThat(authorization.isReserved()).isTrue();
        verify(ledgerService).reserve(eq(5L), eq("call-1"), argThat(hold -> hold.signum() == 0), any(), any());
    }

    @Test
    void shouldRejectWhenLedgerRefusesHold() {
        // Given
        when(ledgerService.reserve(anyLong(), anyString(), any(), any(), any()))
                .thenThrow(new InsufficientBalanceException(5L, new BigDecimal("1.00"), new BigDecimal("3.00")));

        // When
        BillingAuthorization authorization = billingService.authorize(call("call-1", CallDirection.OUTBOUND));

        // Then
        assertThat(authorization.isRejected()).isTrue();
        assertThat(authorization.getAccountId()).isEqualTo(5L);
        assertThat(authorization.getRejectionReason()).contains("Insufficient balance");
    }

    @Test
    void shouldKeepExistingHoldOnDuplicateReservation() {
        when(ledgerService.reserve(anyLong(), anyString(), any(), any(), any()))
                .thenThrow(new DuplicateReservationException("call-1"));

        BillingAuthorization authorization = billingService.authorize(call("call-1", CallDirection.OUTBOUND));

        assertThat(authorization.isReserved()).isTrue();
        assertThat(authorization.isRejected()).isFalse();
    }

    @Test
    void shouldExtendHoldWhenLessThanThresholdRemains() {
        // Given: 250 seconds talked, the next minute would cost 3.60 against a 3.00 hold
        when(ledgerService.extend(anyString(), any(), any()))
                .thenReturn(Reservation.builder().callId("call-1").reservedAmount(new BigDecimal("4.8000")).build());

        // When
        Optional<BigDecimal> held = billingService.extendHold(reserved("call-1"), START.plusSeconds(255));

        // Then
        assertThat(held).get().isEqualTo(new BigDecimal("4.8000"));
        verify(ledgerService).extend(eq("call-1"), argThat(amount -> amount.compareTo(new BigDecimal("1.80")) == 0),
                eq(Duration.ofMinutes(240)));
    }

    @Test
    void shouldNotExtendHoldWhileEnoughRemains() {
        Optional<BigDecimal> held = billingService.extendHold(reserved("call-1"), START.plusSeconds(105));

        assertThat(held).isEmpty();
        verify(ledgerService, never()).extend(anyString(), any(), any());
    }

    @Test
    void shouldKeepCallRunningWhenExtensionRefused() {
        // Given
        when(ledgerService.extend(anyString(), any(), any()))
                .thenThrow(new InsufficientBalanceException(5L, new BigDecimal("0.50"), new BigDecimal("1.80")));

        // When
        Optional<BigDecimal> held = billingService.extendHold(reserved("call-1"), START.plusSeconds(255));

        // Then
        assertThat(held).isEmpty();
    }

    @Test
    void shouldNotExtendUnreservedOrUnansweredCall() {
        ActiveCall unreserved = reserved("call-1").toBuilder().reserved(false).build();
        ActiveCall ringing = reserved("call-1").toBuilder().answerTime(null).build();

        assertThat(billingService.extendHold(unreserved, START.plusSeconds(600))).isEmpty();
        assertThat(billingService.extendHold(ringing, START.plusSeconds(600))).isEmpty();
        verifyNoInteractions(ledgerService);
    }

    @Test
    void shouldResolveAccountByCallerDigits() {
        assertThat(billingService.resolveAccount("+300 123-4567")).contains(account);
        assertThat(billingService.resolveAccount("  ")).isEmpty();
        assertThat(billingService.resolveAccount(null)).isEmpty();
    }

    @Test
    void shouldSettleReservedCallAndPublishCdr() {
        // Given
        ActiveCall call = reserved("call-1");

        // When
        CallDetailRecord cdr = billingService.settle(call, ended("call-1", 61));

        // Then
        verify(ledgerService).settle("call-1", 61, quote);
        assertThat(cdr.getDisposition()).isEqualTo(CdrDisposition.BILLED);
        assertThat(cdr.getCost()).isEqualByComparingTo("1.20");
        assertThat(cdr.getAccountId()).isEqualTo(5L);
        assertThat(cdr.getBillableSeconds()).isEqualTo(61);
        assertThat(cdr.getDestinationName()).isEqualTo("Colombia Mobile");
        assertThat(cdr.getDirection()).isEqualTo("OUTBOUND");

        ArgumentCaptor<CdrDto> published = ArgumentCaptor.forClass(CdrDto.class);
        verify(gatewayService).publishCdr(published.capture());
        assertThat(published.getValue().getUuid()).isEqualTo("call-1");
        assertThat(published.getValue().getDirection()).isEqualTo("outbound");
        assertThat(published.getValue().getRateApplied()).isEqualByComparingTo("0.6000");
        assertThat(published.getValue().getBillsec()).isEqualTo(61);
    }

    @Test
    void shouldReleaseHoldOfUnansweredCall() {
        CallDetailRecord cdr = billingService.settle(reserved("call-1"), ended("call-1", 0));

        verify(ledgerService).release(eq("call-1"), anyString());
        verify(ledgerService, never()).settle(anyString(), anyLong(), any());
        assertThat(cdr.getCost()).isEqualByComparingTo("0");
        assertThat(cdr.getDisposition()).isEqualTo(CdrDisposition.BILLED);
    }

    @Test
    void shouldNoteOverageOnCdr() {
        when(ledgerService.settle(anyString(), anyLong(), any())).thenReturn(outcome(new BigDecimal("1.2000")));

        CallDetailRecord cdr = billingService.settle(reserved("call-1"), ended("call-1", 600));

        assertThat(cdr.getCost()).isEqualByComparingTo("6.00");
        assertThat(cdr.getDispositionReason()).isEqualTo("overage 1.2000 not charged");
    }

    @Test
    void shouldChargeDirectlyWhenReservationExpired() {
        // Given
        when(ledgerService.settle(anyString(), anyLong(), any()))
                .thenThrow(new ReservationNotFoundException("call-1", "already EXPIRED"));
        when(ledgerService.findReservation("call-1")).thenReturn(Optional.of(reservation(ReservationStatus.EXPIRED)));

        // When
        CallDetailRecord cdr = billingService.settle(reserved("call-1"), ended("call-1", 61));

        // Then
        verify(ledgerService).adjust(eq(5L), argThat(amount -> amount.compareTo(new BigDecimal("-1.20")) == 0),
                eq(TransactionType.CONSUMPTION), contains("hold EXPIRED"), eq("call-1"));
        assertThat(cdr.getDisposition()).isEqualTo(CdrDisposition.BILLED);
        assertThat(cdr.getCost()).isEqualByComparingTo("1.20");
        assertThat(cdr.getDispositionReason()).isEqualTo("hold EXPIRED, charged without hold");
        verify(gatewayService).publishCdr(any());
    }

    @Test
    void shouldChargeDirectlyWhenReservationMissing() {
        when(ledgerService.settle(anyString(), anyLong(), any()))
                .thenThrow(new ReservationNotFoundException("call-1", "never stored"));

        CallDetailRecord cdr = billingService.settle(reserved("call-1"), ended("call-1", 61));

        verify(ledgerService).adjust(eq(5L), any(), eq(TransactionType.CONSUMPTION), anyString(), eq("call-1"));
        assertThat(cdr.getDispositionReason()).isEqualTo("no hold, charged without hold");
    }

    @Test
    void shouldMarkUnbilledWhenDirectChargeFails() {
        // Given
        when(ledgerService.settle(anyString(), anyLong(), any()))
                .thenThrow(new ReservationNotFoundException("call-1", "already EXPIRED"));
        when(ledgerService.findReservation("call-1")).thenReturn(Optional.of(reservation(ReservationStatus.EXPIRED)));
        when(ledgerService.adjust(anyLong(), any(), any(), anyString(), anyString()))
                .thenThrow(new AccountNotFoundException(5L));

        // When
        CallDetailRecord cdr = billingService.settle(reserved("call-1"), ended("call-1", 61));

        // Then
        assertThat(cdr.getDisposition()).isEqualTo(CdrDisposition.UNBILLED);
        assertThat(cdr.getDispositionReason()).startsWith("hold EXPIRED: ");
    }

    @Test
    void shouldNotChargeTwiceWhenReservationAlreadyCommitted() {
        when(ledgerService.settle(anyString(), anyLong(), any()))
                .thenThrow(new ReservationNotFoundException("call-1", "already COMMITTED"));
        when(ledgerService.findReservation("call-1")).thenReturn(Optional.of(reservation(ReservationStatus.COMMITTED)));

        CallDetailRecord cdr = billingService.settle(reserved("call-1"), ended("call-1", 61));

        verify(ledgerService, never()).adjust(any(), any(), any(), any(), any());
        assertThat(cdr.getDisposition()).isEqualTo(CdrDisposition.BILLED);
        assertThat(cdr.getDispositionReason()).isEqualTo("already settled");
    }

    @Test
    void shouldWriteRejectedCdrWithoutCharge() {
        ActiveCall call = call("call-1", CallDirection.OUTBOUND).toBuilder()
                .billingChecked(true).accountId(5L).quote(quote).rejectionReason("destination not rated").build();

        CallDetailRecord cdr = billingService.settle(call, ended("call-1", 61));

        assertThat(cdr.getDisposition()).isEqualTo(CdrDisposition.REJECTED);
        assertThat(cdr.getDispositionReason()).isEqualTo("destination not rated");
        assertThat(cdr.getCost()).isEqualByComparingTo("0");
        verifyNoInteractions(ledgerService);
    }

    @Test
    void shouldBillUntrackedCallInOneStep() {
        // Given: the call start was never seen
        ActiveCall call = call("call-1", CallDirection.OUTBOUND);

        // When
        CallDetailRecord cdr = billingService.settle(call, ended("call-1", 61));

        // Then
        verify(ledgerService).reserve(eq(5L), eq("call-1"), argThat(hold -> hold.compareTo(new BigDecimal("1.20")) == 0),
                eq(Duration.ofMinutes(240)), eq(quote));
        verify(ledgerService).settle("call-1", 61, quote);
        assertThat(cdr.getDisposition()).isEqualTo(CdrDisposition.BILLED);
        assertThat(cdr.getAccountId()).isEqualTo(5L);
    }

    @Test
    void shouldLeaveUntrackedCallUnbilledWithoutAccount() {
        ActiveCall call = call("call-1", CallDirection.OUTBOUND).toBuilder().callerNumber("3119999999").build();

        CallDetailRecord cdr = billingService.settle(call, ended("call-1", 61));

        assertThat(cdr.getDisposition()).isEqualTo(CdrDisposition.UNBILLED);
        assertThat(cdr.getDispositionReason()).isEqualTo("call start not observed");
        assertThat(cdr.getCost()).isEqualByComparingTo("1.20");
        verifyNoInteractions(ledgerService);
    }

    @Test
    void shouldMarkCheckedCallWithoutAccountAsUnbilled() {
        ActiveCall call = call("call-1", CallDirection.INBOUND).toBuilder().billingChecked(true).quote(quote).build();

        CallDetailRecord cdr = billingService.settle(call, ended("call-1", 61));

        assertThat(cdr.getDisposition()).isEqualTo(CdrDisposition.UNBILLED);
        assertThat(cdr.getDispositionReason()).isEqualTo("not billed to an account");
    }

    @Test
    void shouldReturnStoredCdrOnSecondSettlement() {
        // Given
        CallDetailRecord stored = CallDetailRecord.builder().callId("call-1").disposition(CdrDisposition.BILLED)
                .cost(new BigDecimal("1.2000")).build();
        when(cdrRepository.findByCallId("call-1")).thenReturn(Optional.of(stored));

        // When
        CallDetailRecord cdr = billingService.settle(reserved("call-1"), ended("call-1", 61));

        // Then
        assertThat(cdr).isSameAs(stored);
        verifyNoInteractions(ledgerService, gatewayService);
        verify(cdrRepository, never()).save(any());
    }

    private void config(ConfigKey key, String value) {
        when(configService.getValue(key)).thenReturn(new Value(key.getKey(), value));
    }

    private static ActiveCall call(String callId, CallDirection direction) {
        return ActiveCall.builder()
                .callId(callId)
                .callerNumber("3001234567")
                .calleeNumber(CALLEE)
                .direction(direction)
                .state(CallState.RINGING)
                .startTime(START)
                .currentCost(BigDecimal.ZERO)
                .build();
    }

    private ActiveCall reserved(String callId) {
        return call(callId, CallDirection.OUTBOUND).toBuilder()
                .state(CallState.ANSWERED)
                .answerTime(START.plusSeconds(5))
                .billingChecked(true)
                .reserved(true)
                .heldAmount(new BigDecimal("3.0000"))
                .accountId(5L)
                .quote(quote)
                .build();
    }

    private static Reservation reservation(ReservationStatus status) {
        return Reservation.builder()
                .accountId(5L)
                .callId("call-1")
                .reservedAmount(new BigDecimal("3.0000"))
                .status(status)
                .build();
    }

    private static CallEndedEvent ended(String callId, long billableSeconds) {
        return CallEndedEvent.builder()
                .callId(callId)
                .endTime(START.plusSeconds(5 + billableSeconds))
                .durationSeconds(5 + billableSeconds)
                .billableSeconds(billableSeconds)
                .hangupCause("NORMAL_CLEARING")
                .build();
    }

    private static SettlementOutcome outcome(BigDecimal overage) {
        return SettlementOutcome.builder()
                .callId("call-1")
                .accountId(5L)
                .status(ReservationStatus.COMMITTED)
                .overageAmount(overage)
                .build();
    }
}
