package com.infomedia.abacox.callbilling.component.configmanager;

import com.infomedia.abacox.callbilling.db.entity.ConfigValue;
import com.infomedia.abacox.callbilling.db.repository.ConfigValueRepository;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cached access to the {@code config_value} table. The cache is loaded on first use and kept
 * in step with every write made through this service.
 */
@Service
@Log4j2
public class ConfigValueService {

    private static final Object NULL_PLACEHOLDER = new Object();

    private final ConfigValueRepository repository;

    // Cache: Key -> Value
    private volatile Map<String, Object> configCache;

    public ConfigValueService(ConfigValueRepository repository) {
        this.repository = repository;
    }

    private Object encodeValue(String value) {
        return value == null ? NULL_PLACEHOLDER : value;
    }

    private String decodeValue(Object storedValue) {
        return storedValue == NULL_PLACEHOLDER ? null : (String) storedValue;
    }

    private Map<String, Object> ensureCacheLoaded() {
        Map<String, Object> cache = configCache;
        if (cache != null) {
            return cache;
        }
        synchronized (this) {
            if (configCache == null) {
                log.debug("Loading configuration cache");
                Map<String, Object> loaded = new ConcurrentHashMap<>();
                try {
                    repository.findAll().forEach(configValue ->
                            loaded.put(configValue.getKey(), encodeValue(configValue.getValue())));
                } catch (RuntimeException e) {
                    // Schema may not exist yet while bootstrapping; defaults apply until the next invalidation.
                    log.warn("Could not load configuration values, using defaults: {}", e.getMessage());
                }
                configCache = loaded;
            }
            return configCache;
        }
    }

    public void invalidateCache() {
        configCache = null;
    }

    public Value getValue(String configKey, String defaultValue) {
        Object storedValue = ensureCacheLoaded().get(configKey);
        if (storedValue == null) {
            return new Value(configKey, defaultValue);
        }
        return new Value(configKey, decodeValue(storedValue));
    }

    @Transactional
    public void setValue(String configKey, String newValue) {
        Map<String, Object> cache = ensureCacheLoaded();
        if (newValue == null) {
            repository.findByKey(configKey).ifPresent(repository::delete);
            cache.remove(configKey);
            log.info("Reset config '{}' to its default.", configKey);
            return;
        }
        Object cached = cache.get(configKey);
        String oldValue = cached == null ? null : decodeValue(cached);
        if (cached != null && Objects.equals(oldValue, newValue)) {
            return;
        }

        ConfigValue configValue = repository.findByKey(configKey)
                .orElseGet(() -> ConfigValue.builder().key(configKey).build());
        configValue.setValue(newValue);
        repository.save(configValue);

        cache.put(configKey, encodeValue(newValue));
        log.info("Updated config '{}'.", configKey);
    }
}
