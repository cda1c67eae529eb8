package com.rtidy.api;

import java.nio.file.Path;

import com.rtidy.config.FormatterConfig;

/**
 * A formatter for one language.
 */
public interface FormatterPlugin {

    /**
     * Reads the plugin's settings from the configuration.
     *
     * @throws com.rtidy.api.error.ConfigException if a setting is invalid
     */
    void initialize(FormatterConfig config);

    /**
     * Formats the source. Failures are reported in the result, not thrown.
     */
    FormatterResult format(Path filePath, String sourceCode);
}
