package com.infomedia.abacox.callbilling.dto.configuration;

import com.infomedia.abacox.callbilling.component.configmanager.UnratedPolicy;
import lombok.*;

/**
 * Effective billing policy.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ConfigurationDto {
    private Long reservationSeconds;
    private Long reservationTtlMinutes;
    private Long holdExtensionThresholdSeconds;
    private Long holdExtensionSeconds;
    private UnratedPolicy unratedPolicy;
    private Boolean billInbound;
    private Boolean hangupRejectedCalls;
    private Boolean snapshotRefreshEnabled;
}
