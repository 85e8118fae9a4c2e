package com.infomedia.abacox.callbilling.dto.activecall;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ActiveCallSnapshot {
    @Schema(description = "switch call id", example = "4f6c2b1e-8d7a-4c55-9a53-0d8e4d1f2a10")
    private String callId;
    @Schema(example = "3001234567")
    private String callingNumber;
    @Schema(example = "573101234567")
    private String calledNumber;
    @Schema(example = "outbound")
    private String direction;
    @Schema(example = "ringing")
    private String status;
    private Instant startTime;
    private Instant answerTime;
    @Schema(description = "seconds since answer")
    private long currentDuration;
    private BigDecimal currentCost;
    private String destinationName;
    private String connectionId;
}
