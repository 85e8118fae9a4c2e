package com.infomedia.abacox.callbilling.component.settlement;

import com.infomedia.abacox.callbilling.db.entity.ReservationStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class SettlementOutcome {
    Long reservationId;
    String callId;
    Long accountId;
    ReservationStatus status;
    BigDecimal reservedAmount;
    BigDecimal actualCost;
    BigDecimal consumedAmount;
    BigDecimal releasedAmount;
    BigDecimal overageAmount;
    BigDecimal newBalance;

    public boolean hasOverage() {
        return overageAmount != null && overageAmount.signum() > 0;
    }
}
