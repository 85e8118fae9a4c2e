package com.infomedia.abacox.callbilling.component.settlement;

import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Returns holds of calls that never ended (lost END, crashed process) to the available balance.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class ReservationExpiryWorker {

    private final SettlementLedgerService ledgerService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${callbilling.ledger.expiry-interval:PT1M}",
            initialDelayString = "${callbilling.ledger.expiry-interval:PT1M}")
    public void expireStaleReservations() {
        try {
            int expired = ledgerService.expireStale(clock.instant());
            if (expired > 0) {
                log.info("Expired {} stale reservations", expired);
            }
        } catch (Exception e) {
            log.error("Reservation expiry run failed", e);
        }
    }
}
