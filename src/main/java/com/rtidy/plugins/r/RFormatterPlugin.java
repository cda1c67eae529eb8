package com.rtidy.plugins.r;

import com.rtidy.api.FormatterPlugin;
import com.rtidy.api.FormatterResult;
import com.rtidy.api.error.FormatterError;
import com.rtidy.api.error.Severity;
import com.rtidy.api.error.TidyException;
import com.rtidy.config.FormatterConfig;
import com.rtidy.config.ResolvedOptions;
import com.rtidy.config.TidyOptions;
import com.rtidy.util.LoggerUtil;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

/**
 * Formatter plugin for R sources. Tidy failures become unsuccessful
 * results carrying a fatal error; deprecation notices become warnings on
 * the result.
 */
public class RFormatterPlugin implements FormatterPlugin, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(RFormatterPlugin.class);
    private static final int CACHE_SIZE = 100;

    private final TidySource tidySource;
    private TidyOptions options = TidyOptions.defaults();
    private List<String> optionWarnings = List.of();

    // results of recent runs, keyed by source content
    private final Map<String, TidyResult> resultCache = new LinkedHashMap<String, TidyResult>(CACHE_SIZE, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, TidyResult> eldest) {
            return size() > CACHE_SIZE;
        }
    };

    private final ReentrantReadWriteLock cacheLock = new ReentrantReadWriteLock();

    public RFormatterPlugin() {
        this(new TidySource());
    }

    public RFormatterPlugin(TidySource tidySource) {
        this.tidySource = tidySource;
    }

    /**
     * Resolves the tidy options from the configuration.
     *
     * @throws com.rtidy.api.error.ConfigException if an option is invalid
     */
    @Override
    public void initialize(FormatterConfig config) {
        ResolvedOptions resolved = config.resolveTidyOptions();
        this.options = resolved.getOptions();
        this.optionWarnings = resolved.getWarnings();
        clearCache();
        logger.fine("R plugin initialized with " + options);
    }

    public TidyOptions getOptions() {
        return options;
    }

    @Override
    public FormatterResult format(Path filePath, String sourceCode) {
        TidyResult result;
        try {
            result = tidy(sourceCode);
        } catch (TidyException e) {
            return handleTidyError(filePath, e);
        } catch (StackOverflowError e) {
            logger.warning("Expression nesting too deep to tidy: " + filePath);
            return FormatterResult.builder()
                    .successful(false)
                    .formattedCode(null)
                    .addError(new FormatterError(Severity.FATAL,
                            "Expression is nested too deeply to format", 0, 0))
                    .build();
        }

        List<FormatterError> warnings = new ArrayList<>();
        for (String warning : optionWarnings) {
            warnings.add(new FormatterError(Severity.WARNING, warning, 0, 0));
        }
        for (String warning : result.getWarnings()) {
            warnings.add(new FormatterError(Severity.WARNING, warning, 0, 0));
        }

        return FormatterResult.builder()
                .successful(true)
                .formattedCode(result.getFormattedCode())
                .maskedCode(String.join("\n", result.getTextMask()))
                .errors(warnings)
                .build();
    }

    private TidyResult tidy(String sourceCode) {
        cacheLock.readLock().lock();
        try {
            TidyResult cached = resultCache.get(sourceCode);
            if (cached != null) {
                return cached;
            }
        } finally {
            cacheLock.readLock().unlock();
        }

        TidyResult result = tidySource.tidy(sourceCode, options);

        cacheLock.writeLock().lock();
        try {
            resultCache.put(sourceCode, result);
        } finally {
            cacheLock.writeLock().unlock();
        }
        return result;
    }

    private FormatterResult handleTidyError(Path filePath, TidyException e) {
        logger.fine("Could not tidy " + filePath + ": " + e.getMessage());
        return FormatterResult.builder()
                .successful(false)
                .formattedCode(null)
                .addError(FormatterError.of(e))
                .build();
    }

    private void clearCache() {
        cacheLock.writeLock().lock();
        try {
            resultCache.clear();
        } finally {
            cacheLock.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        clearCache();
    }
}
