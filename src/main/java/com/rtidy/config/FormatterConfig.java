package com.rtidy.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the formatter: the {@code general} section (file
 * selection and batch settings) and the {@code tidy} section (option
 * values by name, deprecated names included).
 */
public class FormatterConfig {
    private final Map<String, Object> generalConfig;
    private final Map<String, Object> tidyConfig;

    public FormatterConfig(Map<String, Object> generalConfig, Map<String, Object> tidyConfig) {
        this.generalConfig = generalConfig;
        this.tidyConfig = tidyConfig;
    }

    /**
     * Gets a copy of the general config map.
     */
    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    /**
     * Gets a copy of the tidy option values.
     */
    public Map<String, Object> getTidyConfigMap() {
        return new HashMap<>(tidyConfig);
    }

    /**
     * Returns a copy of this configuration with the given option values
     * laid over the tidy section. An override replaces the option under
     * any of its names, so a deprecated name does not clash with the
     * current name already in the section.
     */
    public FormatterConfig withTidyOverrides(Map<String, ?> overrides) {
        Map<String, Object> tidy = new HashMap<>(tidyConfig);
        for (String key : overrides.keySet()) {
            String option = OptionResolver.canonicalName(key);
            tidy.keySet().removeIf(existing -> OptionResolver.canonicalName(existing).equals(option));
        }
        tidy.putAll(overrides);
        return new FormatterConfig(new HashMap<>(generalConfig), tidy);
    }

    /**
     * Returns a copy of this configuration with one general value replaced.
     */
    public FormatterConfig withGeneral(String key, Object value) {
        Map<String, Object> general = new HashMap<>(generalConfig);
        general.put(key, value);
        return new FormatterConfig(general, new HashMap<>(tidyConfig));
    }

    /**
     * Resolves the tidy section into options.
     *
     * @throws com.rtidy.api.error.ConfigException if a value is invalid
     */
    public ResolvedOptions resolveTidyOptions() {
        return OptionResolver.resolve(tidyConfig);
    }

    public boolean isRecursive() {
        return getGeneralConfig("recursive", Boolean.FALSE);
    }

    public int getThreads() {
        return getGeneralConfig("threads", Runtime.getRuntime().availableProcessors());
    }

    public List<String> getIgnoreFiles() {
        Object value = generalConfig.get("ignoreFiles");
        List<String> patterns = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                patterns.add(String.valueOf(item));
            }
        }
        return patterns;
    }

    @SuppressWarnings("unchecked")
    public <T> T getGeneralConfig(String key, T defaultValue) {
        Object value = generalConfig.get(key);
        if (value == null) {
            return defaultValue;
        }

        if (defaultValue != null && !defaultValue.getClass().isInstance(value)) {
            if (defaultValue instanceof Integer && value instanceof Number) {
                return (T) Integer.valueOf(((Number) value).intValue());
            } else if (defaultValue instanceof Boolean && value instanceof String) {
                return (T) Boolean.valueOf(value.toString());
            } else if (defaultValue instanceof String) {
                return (T) value.toString();
            }
            return defaultValue;
        }

        return (T) value;
    }
}
