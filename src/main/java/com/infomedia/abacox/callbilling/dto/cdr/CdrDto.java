package com.infomedia.abacox.callbilling.dto.cdr;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * CDR as the dashboard stores it. The dashboard builds its row straight from these keys, so
 * only its own columns are sent; disposition and tariff details stay in the local record.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CdrDto {
    private String uuid;
    private Long accountId;
    private String caller;
    private String callee;
    private Instant startTime;
    private Instant answerTime;
    private Instant endTime;
    private long duration;
    private long billsec;
    private String hangupCause;
    private BigDecimal rateApplied;
    private BigDecimal cost;
    private String direction;
    private String freeswitchServerId;
}
