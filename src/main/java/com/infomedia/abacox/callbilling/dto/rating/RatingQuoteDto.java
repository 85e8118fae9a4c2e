package com.infomedia.abacox.callbilling.dto.rating;

import com.infomedia.abacox.callbilling.component.rating.RatingStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RatingQuoteDto {
    private RatingStatus status;
    private String destinationNumber;
    private Long rateEntryId;
    private String destinationPrefix;
    private String destinationName;
    private BigDecimal ratePerMinute;
    private Integer billingIncrement;
    private BigDecimal connectionFee;
    @Schema(description = "cost of a call of the requested length")
    private BigDecimal cost;
    private Long seconds;
}
