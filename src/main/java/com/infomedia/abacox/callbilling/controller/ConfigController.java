package com.infomedia.abacox.callbilling.controller;

import com.infomedia.abacox.callbilling.component.configmanager.ConfigKey;
import com.infomedia.abacox.callbilling.component.configmanager.ConfigService;
import com.infomedia.abacox.callbilling.component.configmanager.UnratedPolicy;
import com.infomedia.abacox.callbilling.dto.configuration.ConfigurationDto;
import com.infomedia.abacox.callbilling.dto.configuration.UpdateConfigurationDto;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.openapitools.jackson.nullable.JsonNullable;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

@RequiredArgsConstructor
@RestController
@Tag(name = "Configuration", description = "Billing policy controller")
@RequestMapping("/api/configuration")
public class ConfigController {

    private final ConfigService configService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ConfigurationDto getConfiguration() {
        return ConfigurationDto.builder()
                .reservationSeconds(configService.getValue(ConfigKey.RESERVATION_SECONDS).asLong())
                .reservationTtlMinutes(configService.getValue(ConfigKey.RESERVATION_TTL_MINUTES).asLong())
                .holdExtensionThresholdSeconds(configService.getValue(ConfigKey.HOLD_EXTENSION_THRESHOLD_SECONDS).asLong())
                .holdExtensionSeconds(configService.getValue(ConfigKey.HOLD_EXTENSION_SECONDS).asLong())
                .unratedPolicy(configService.getValue(ConfigKey.UNRATED_POLICY).asEnum(UnratedPolicy.class))
                .billInbound(configService.getValue(ConfigKey.BILL_INBOUND).asBoolean())
                .hangupRejectedCalls(configService.getValue(ConfigKey.HANGUP_REJECTED_CALLS).asBoolean())
                .snapshotRefreshEnabled(configService.getValue(ConfigKey.SNAPSHOT_REFRESH_ENABLED).asBoolean())
                .build();
    }

    @Operation(summary = "Change policy values; a field sent as null goes back to its default")
    @PatchMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ConfigurationDto updateConfiguration(@Valid @RequestBody UpdateConfigurationDto update) {
        apply(ConfigKey.RESERVATION_SECONDS, update.getReservationSeconds());
        apply(ConfigKey.RESERVATION_TTL_MINUTES, update.getReservationTtlMinutes());
        apply(ConfigKey.HOLD_EXTENSION_THRESHOLD_SECONDS, update.getHoldExtensionThresholdSeconds());
        apply(ConfigKey.HOLD_EXTENSION_SECONDS, update.getHoldExtensionSeconds());
        apply(ConfigKey.UNRATED_POLICY, update.getUnratedPolicy());
        apply(ConfigKey.BILL_INBOUND, update.getBillInbound());
        apply(ConfigKey.HANGUP_REJECTED_CALLS, update.getHangupRejectedCalls());
        apply(ConfigKey.SNAPSHOT_REFRESH_ENABLED, update.getSnapshotRefreshEnabled());
        return getConfiguration();
    }

    private void apply(ConfigKey key, JsonNullable<?> field) {
        if (field != null && field.isPresent()) {
            configService.updateValue(key, field.get());
        }
    }
}
