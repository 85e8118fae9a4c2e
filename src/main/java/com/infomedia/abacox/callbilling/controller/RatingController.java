package com.infomedia.abacox.callbilling.controller;

import com.infomedia.abacox.callbilling.component.rating.CostCalculator;
import com.infomedia.abacox.callbilling.component.rating.RatedResult;
import com.infomedia.abacox.callbilling.component.rating.RatingService;
import com.infomedia.abacox.callbilling.dto.rating.RatingQuoteDto;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;

@RequiredArgsConstructor
@RestController
@Tag(name = "Rating", description = "Tariff lookup")
@RequestMapping("/api/rating")
public class RatingController {

    private final RatingService ratingService;
    private final Clock clock;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Quote the tariff for a destination number")
    public RatingQuoteDto quote(@Parameter(description = "Dialled number") @RequestParam("number") String number,
                                @Parameter(description = "Call length to price, in seconds") @RequestParam(value = "seconds", defaultValue = "60") long seconds,
                                @Parameter(description = "Instant the tariff must be effective at; now when omitted") @RequestParam(value = "asOf", required = false) Instant asOf) {
        RatedResult rated = ratingService.rate(number, asOf != null ? asOf : clock.instant());
        return RatingQuoteDto.builder()
                .status(rated.getStatus())
                .destinationNumber(rated.getDestinationNumber())
                .rateEntryId(rated.getRateEntryId())
                .destinationPrefix(rated.getDestinationPrefix())
                .destinationName(rated.getDestinationName())
                .ratePerMinute(rated.getRatePerMinute())
                .billingIncrement(rated.getBillingIncrement())
                .connectionFee(rated.getConnectionFee())
                .seconds(seconds)
                .cost(CostCalculator.cost(rated, seconds))
                .build();
    }

    @PostMapping("/cache/invalidate")
    @Operation(summary = "Reload the rate table on the next lookup")
    public void invalidateCache() {
        ratingService.invalidateCache();
    }
}
