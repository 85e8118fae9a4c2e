package com.infomedia.abacox.callbilling.component.configmanager;

import com.infomedia.abacox.callbilling.db.repository.ConfigValueRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class ConfigServiceTest {

    @Autowired
    private ConfigService configService;
    @Autowired
    private ConfigValueService configValueService;
    @Autowired
    private ConfigValueRepository repository;

    @AfterEach
    void tearDown() {
        for (ConfigKey key : ConfigKey.values()) {
            configService.updateValue(key, null);
        }
    }

    @Test
    void shouldServeDefaultsFromEmptyTable() {
        assertThat(configService.getValue(ConfigKey.RESERVATION_SECONDS).asLong()).isEqualTo(300L);
        assertThat(configService.getValue(ConfigKey.RESERVATION_TTL_MINUTES).asLong()).isEqualTo(240L);
        assertThat(configService.getValue(ConfigKey.UNRATED_POLICY).asEnum(UnratedPolicy.class)).isEqualTo(UnratedPolicy.ALLOW_ZERO);
        assertThat(configService.getValue(ConfigKey.BILL_INBOUND).asBoolean()).isFalse();
        assertThat(configService.getValue(ConfigKey.HANGUP_REJECTED_CALLS).asBoolean()).isTrue();
        assertThat(configService.getValue(ConfigKey.HOLD_EXTENSION_SECONDS).asLong()).isEqualTo(180L);
    }

    @Test
    void shouldStoreAndCacheUpdates() {
        // When
        configService.updateValue(ConfigKey.RESERVATION_SECONDS, 120L);
        configService.updateValue(ConfigKey.UNRATED_POLICY, UnratedPolicy.REJECT);

        // Then
        assertThat(configService.getValue(ConfigKey.RESERVATION_SECONDS).asLong()).isEqualTo(120L);
        assertThat(configService.getValue(ConfigKey.UNRATED_POLICY).asEnum(UnratedPolicy.class)).isEqualTo(UnratedPolicy.REJECT);
        assertThat(repository.findByKey("reservationSeconds")).hasValueSatisfying(v -> assertThat(v.getValue()).isEqualTo("120"));

        // and survive a cache reload
        configValueService.invalidateCache();
        assertThat(configService.getValue(ConfigKey.RESERVATION_SECONDS).asLong()).isEqualTo(120L);
    }

    @Test
    void shouldResetKeyToDefaultOnNull() {
        // Given
        configService.updateValue(ConfigKey.BILL_INBOUND, true);
        assertThat(configService.getValue(ConfigKey.BILL_INBOUND).asBoolean()).isTrue();

        // When
        configService.updateValue(ConfigKey.BILL_INBOUND, null);

        // Then
        assertThat(configService.getValue(ConfigKey.BILL_INBOUND).asBoolean()).isFalse();
        assertThat(repository.findByKey("billInbound")).isEmpty();
    }

    @Test
    void shouldStoreUnderCamelCaseName() {
        configService.updateValue(ConfigKey.HOLD_EXTENSION_THRESHOLD_SECONDS, 90);

        assertThat(ConfigKey.HOLD_EXTENSION_THRESHOLD_SECONDS.getKey()).isEqualTo("holdExtensionThresholdSeconds");
        assertThat(repository.findByKey("holdExtensionThresholdSeconds")).isPresent();
    }

    @Test
    void shouldFailOnUnparsableValue() {
        configService.updateValue(ConfigKey.RESERVATION_SECONDS, "five minutes");

        assertThatThrownBy(() -> configService.getValue(ConfigKey.RESERVATION_SECONDS).asLong())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("reservationSeconds");
    }
}
