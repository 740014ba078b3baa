package me.christianrobert.namereduce.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runtime settings of the name reduction pipeline.
 *
 * <p>Typed getters return null for a missing or unreadable value, so callers fall back to
 * their own default instead of acting on a typo.</p>
 */
@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String EXPAND_ENABLED = "reduce.expand-enabled";
    public static final String SIMPLIFY_ENABLED = "reduce.simplify-enabled";
    public static final String CSHARP_UNRESOLVED_DIAGNOSTIC_ID = "reduce.csharp.unresolved-diagnostic-id";
    public static final String VB_UNRESOLVED_DIAGNOSTIC_ID = "reduce.vb.unresolved-diagnostic-id";
    public static final String BATCH_MAX_DOCUMENTS = "reduce.batch.max-documents";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        configuration.put(EXPAND_ENABLED, true);
        configuration.put(SIMPLIFY_ENABLED, true);
        configuration.put(CSHARP_UNRESOLVED_DIAGNOSTIC_ID, "CS0246");
        configuration.put(VB_UNRESOLVED_DIAGNOSTIC_ID, "BC30002");
        configuration.put(BATCH_MAX_DOCUMENTS, 1000);

        log.info("Configuration service initialized with {} default values", configuration.size());
    }

    public String getConfigValueAsString(String key) {
        Object value = configuration.get(key);
        return value != null ? value.toString() : null;
    }

    /**
     * Gets a configuration value as a boolean.
     * Accepts booleans and the strings "true" / "false" in any case, surrounding blanks ignored.
     *
     * @param key Configuration key
     * @return The value, or null if missing or not a boolean
     */
    public Boolean getConfigValueAsBoolean(String key) {
        Object value = configuration.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if ("true".equalsIgnoreCase(text)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(text)) {
                return Boolean.FALSE;
            }
            log.warn("Config value {} is not a boolean: {}", key, value);
        }
        return null;
    }

    /**
     * Gets a configuration value as an integer.
     * Accepts numbers and numeric strings ("250").
     *
     * @param key Configuration key
     * @return The value, or null if missing or not numeric
     */
    public Integer getConfigValueAsInteger(String key) {
        Object value = configuration.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("Config value {} is not a number: {}", key, value);
                return null;
            }
        }
        return null;
    }

    /**
     * Sets a value. A null value removes the key, so readers fall back to their default.
     */
    public void setConfigValue(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("Config key cannot be null");
        }
        Object oldValue = value != null ? configuration.put(key, value) : configuration.remove(key);
        log.debug("Config value set: {} = {} (was: {})", key, value, oldValue);
    }
}
