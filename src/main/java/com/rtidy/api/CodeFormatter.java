package com.rtidy.api;

import java.nio.file.Path;
import java.util.Map;

/**
 * The main formatter interface that all implementations must provide.
 */
public interface CodeFormatter {

    /**
     * Formats one source; the file itself is not touched.
     */
    FormatterResult formatFile(Path filePath, String sourceCode);

    /**
     * Formats every supported file of a directory in place.
     */
    Map<Path, FormatterResult> formatDirectory(Path directory);
}
