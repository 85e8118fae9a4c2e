package com.infomedia.abacox.callbilling.component.configmanager;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ConfigService {

    private final ConfigValueService configValueService;

    /**
     * Stores the value as text; null removes the stored value so the key's default applies.
     */
    public void updateValue(ConfigKey configKey, Object newValue) {
        String valueAsString = (newValue == null) ? null : newValue.toString();
        configValueService.setValue(configKey.getKey(), valueAsString);
    }

    public Value getValue(ConfigKey configKey) {
        return configValueService.getValue(configKey.getKey(), configKey.getDefaultValue());
    }
}
