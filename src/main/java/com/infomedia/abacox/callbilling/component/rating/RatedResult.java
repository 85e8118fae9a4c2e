package com.infomedia.abacox.callbilling.component.rating;

import com.infomedia.abacox.callbilling.db.entity.RateEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of a tariff lookup. Misses are values, never exceptions: an unrated or invalid
 * result carries a zero rate and no matched entry.
 */
@Value
@Builder
public class RatedResult {

    public static final String UNKNOWN_DESTINATION = "UNKNOWN";
    public static final String EMPTY_PREFIX = "EMPTY";

    RatingStatus status;
    String destinationNumber;
    Long rateEntryId;
    String destinationPrefix;
    String destinationName;
    BigDecimal ratePerMinute;
    int billingIncrement;
    BigDecimal connectionFee;
    int priority;

    public boolean isValid() {
        return status == RatingStatus.RATED;
    }

    public static RatedResult of(RateEntry entry, String destinationNumber) {
        return RatedResult.builder()
                .status(RatingStatus.RATED)
                .destinationNumber(destinationNumber)
                .rateEntryId(entry.getId())
                .destinationPrefix(entry.getDestinationPrefix())
                .destinationName(entry.getDestinationName())
                .ratePerMinute(entry.getRatePerMinute())
                .billingIncrement(entry.getBillingIncrement())
                .connectionFee(entry.getConnectionFee() != null ? entry.getConnectionFee() : BigDecimal.ZERO)
                .priority(entry.getPriority())
                .build();
    }

    public static RatedResult unrated(String destinationNumber) {
        return zeroRate(RatingStatus.UNRATED, destinationNumber, UNKNOWN_DESTINATION);
    }

    public static RatedResult invalidNumber(String destinationNumber) {
        return zeroRate(RatingStatus.INVALID_NUMBER, destinationNumber, EMPTY_PREFIX);
    }

    private static RatedResult zeroRate(RatingStatus status, String destinationNumber, String prefix) {
        return RatedResult.builder()
                .status(status)
                .destinationNumber(destinationNumber)
                .destinationPrefix(prefix)
                .destinationName(UNKNOWN_DESTINATION)
                .ratePerMinute(BigDecimal.ZERO)
                .billingIncrement(60)
                .connectionFee(BigDecimal.ZERO)
                .build();
    }
}
