package com.infomedia.abacox.callbilling.dto.configuration;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.infomedia.abacox.callbilling.component.configmanager.UnratedPolicy;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.openapitools.jackson.nullable.JsonNullable;

/**
 * Partial update of the billing policy. Fields left out of the request stay as they are;
 * a field sent as null goes back to its default.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public class UpdateConfigurationDto {

    @Schema(description = "Talk time, in seconds, covered by the hold placed when a call starts")
    private JsonNullable<Long> reservationSeconds = JsonNullable.undefined();

    @Schema(description = "Minutes after which an unsettled hold expires")
    private JsonNullable<Long> reservationTtlMinutes = JsonNullable.undefined();

    @Schema(description = "Remaining talk time, in seconds, below which the hold of a running call is grown")
    private JsonNullable<Long> holdExtensionThresholdSeconds = JsonNullable.undefined();

    @Schema(description = "Talk time, in seconds, added to the hold each time it is grown")
    private JsonNullable<Long> holdExtensionSeconds = JsonNullable.undefined();

    @Schema(description = "What to do with calls to destinations without a rate")
    private JsonNullable<UnratedPolicy> unratedPolicy = JsonNullable.undefined();

    @Schema(description = "Whether inbound calls are billed to the caller's account")
    private JsonNullable<Boolean> billInbound = JsonNullable.undefined();

    @Schema(description = "Whether calls refused at start are hung up on the switch")
    private JsonNullable<Boolean> hangupRejectedCalls = JsonNullable.undefined();

    @Schema(description = "Whether running duration and cost of answered calls are republished")
    private JsonNullable<Boolean> snapshotRefreshEnabled = JsonNullable.undefined();
}
