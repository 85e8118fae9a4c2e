package com.infomedia.abacox.callbilling.component.settlement;

import com.infomedia.abacox.callbilling.component.rating.RatedResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Decision taken when a call starts: billed against a hold, rejected, or not billed at all.
 */
@Value
@Builder
public class BillingAuthorization {
    Long accountId;
    RatedResult quote;
    boolean reserved;
    /** Amount held in the ledger when reserved. */
    BigDecimal heldAmount;
    String rejectionReason;
    /** Why the call is not billed to any account; null when it is. */
    String unbilledReason;

    public static BillingAuthorization reserved(Long accountId, RatedResult quote, BigDecimal heldAmount) {
        return BillingAuthorization.builder().accountId(accountId).quote(quote).reserved(true)
                .heldAmount(heldAmount).build();
    }

    public static BillingAuthorization rejected(Long accountId, RatedResult quote, String reason) {
        return BillingAuthorization.builder().accountId(accountId).quote(quote).rejectionReason(reason).build();
    }

    public static BillingAuthorization unbilled(RatedResult quote, String reason) {
        return BillingAuthorization.builder().quote(quote).unbilledReason(reason).build();
    }

    public boolean isRejected() {
        return rejectionReason != null;
    }
}
