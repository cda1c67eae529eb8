package com.rtidy.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.rtidy.api.CodeFormatter;
import com.rtidy.api.FormatterPlugin;
import com.rtidy.api.FormatterResult;
import com.rtidy.api.error.FormatterError;
import com.rtidy.api.error.Severity;
import com.rtidy.config.FormatterConfig;
import com.rtidy.plugins.FileType;
import com.rtidy.util.LoggerUtil;

/**
 * Thread-safe formatter front end. Delegates each file to the plugin
 * registered for its type and formats whole directories on a worker pool.
 * A failure in one file never stops the others.
 */
public class TidyFormatter implements CodeFormatter, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(TidyFormatter.class);

    private final Map<FileType, FormatterPlugin> plugins = new ConcurrentHashMap<>();
    private final FormatterConfig config;

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);
    private final AtomicInteger changedCount = new AtomicInteger(0);
    private final Set<Path> changedFiles = ConcurrentHashMap.newKeySet();

    public TidyFormatter(FormatterConfig config) {
        this.config = config;
    }

    /**
     * Registers a plugin for a specific file type.
     *
     * @throws com.rtidy.api.error.ConfigException if the plugin rejects the configuration
     */
    public void registerPlugin(FileType fileType, FormatterPlugin plugin) {
        plugin.initialize(config);
        plugins.put(fileType, plugin);
        logger.fine("Registered plugin for file type: " + fileType.getDescription());
    }

    /**
     * Formats a single source using the appropriate plugin. Nothing is written.
     */
    @Override
    public FormatterResult formatFile(Path filePath, String sourceCode) {
        FileType fileType = FileType.detect(filePath);
        FormatterPlugin plugin = plugins.get(fileType);

        if (plugin == null) {
            logger.warning("No plugin found for file type: " + fileType + " - " + filePath);
            return FormatterResult.builder()
                    .successful(false)
                    .formattedCode(sourceCode)
                    .addError(new FormatterError(
                            Severity.ERROR,
                            "No plugin registered for file type: " + fileType,
                            0, 0))
                    .build();
        }

        try {
            processedFileCount.incrementAndGet();
            FormatterResult result = plugin.format(filePath, sourceCode);

            if (result.isSuccessful()) {
                successCount.incrementAndGet();
                logger.fine("Successfully formatted: " + filePath);
            } else {
                errorCount.incrementAndGet();
                logger.warning("Failed to format: " + filePath + " - " +
                        result.getErrors().stream()
                                .map(e -> e.getSeverity() + ": " + e.getMessage())
                                .collect(Collectors.joining(", ")));
            }

            return result;
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error formatting file: " + filePath, e);

            return FormatterResult.builder()
                    .successful(false)
                    .formattedCode(sourceCode)
                    .addError(new FormatterError(
                            Severity.FATAL,
                            "Unexpected error: " + e.getMessage(),
                            0, 0))
                    .build();
        }
    }

    /**
     * Formats the R files of a directory in place, using the configured
     * recursion and thread count.
     */
    @Override
    public Map<Path, FormatterResult> formatDirectory(Path directory) {
        return formatDirectory(directory, config.isRecursive(), config.getThreads(), true);
    }

    /**
     * Formats the R files of a directory.
     *
     * @param recursive   whether to descend into subdirectories
     * @param threadCount number of worker threads
     * @param write       whether to overwrite files whose formatting
     *                    succeeded and changed them
     * @return the result for every selected file
     */
    public Map<Path, FormatterResult> formatDirectory(Path directory, boolean recursive, int threadCount, boolean write) {
        ConcurrentHashMap<Path, FormatterResult> results = new ConcurrentHashMap<>();

        if (!Files.isDirectory(directory)) {
            logger.warning("Not a directory: " + directory);
            return results;
        }

        List<Path> filesToProcess;
        try {
            filesToProcess = findFiles(directory, recursive);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Error scanning directory: " + directory, e);
            return results;
        }

        logger.info("Found " + filesToProcess.size() + " files to process in " + directory);
        if (filesToProcess.isEmpty()) {
            return results;
        }

        Map<Path, Future<FormatterResult>> tasks = new LinkedHashMap<>();
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threadCount));
        try {
            for (Path file : filesToProcess) {
                tasks.put(file, executor.submit(() -> processFile(file, write)));
            }
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.MINUTES)) {
                    logger.warning("Timeout waiting for file processing to complete");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                logger.log(Level.WARNING, "Processing interrupted", e);
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        }

        for (Map.Entry<Path, Future<FormatterResult>> task : tasks.entrySet()) {
            results.put(task.getKey(), collect(task.getKey(), task.getValue()));
        }

        logger.info("Processed " + results.size() + " files");
        return results;
    }

    /**
     * Result of a finished task. A task that died with an error, or never
     * ran, still yields a failed result for its file.
     */
    private FormatterResult collect(Path file, Future<FormatterResult> task) {
        if (!task.isDone()) {
            task.cancel(true);
        }
        try {
            return task.get();
        } catch (ExecutionException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error formatting file: " + file, e.getCause());
            return failure("Unexpected error: " + e.getCause());
        } catch (CancellationException e) {
            errorCount.incrementAndGet();
            logger.warning("Formatting cancelled: " + file);
            return failure("Formatting was cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            errorCount.incrementAndGet();
            logger.warning("Interrupted while collecting the result of " + file);
            return failure("Formatting was interrupted");
        }
    }

    private FormatterResult processFile(Path file, boolean write) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            errorCount.incrementAndGet();
            logger.log(Level.WARNING, "Failed to read file: " + file, e);
            return failure("Failed to read file: " + e.getMessage());
        }

        FormatterResult result = formatFile(file, content);
        if (result.changes(content)) {
            changedFiles.add(file);
        }
        if (write && result.changes(content)) {
            try {
                Files.writeString(file, result.getFormattedCode(), StandardCharsets.UTF_8);
                changedCount.incrementAndGet();
                logger.fine("Rewrote " + file);
            } catch (IOException e) {
                errorCount.incrementAndGet();
                logger.log(Level.WARNING, "Failed to write file: " + file, e);
                return failure("Failed to write file: " + e.getMessage());
            }
        }
        return result;
    }

    private List<Path> findFiles(Path directory, boolean recursive) throws IOException {
        List<PathMatcher> ignored = config.getIgnoreFiles().stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .collect(Collectors.toList());

        try (Stream<Path> paths = recursive ? Files.walk(directory) : Files.list(directory)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(path -> FileType.detectByName(path) == FileType.R_SCRIPT)
                    .filter(path -> plugins.containsKey(FileType.R_SCRIPT))
                    .filter(path -> ignored.stream().noneMatch(m -> m.matches(directory.relativize(path))))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static FormatterResult failure(String message) {
        return FormatterResult.builder()
                .successful(false)
                .formattedCode(null)
                .addError(new FormatterError(Severity.FATAL, message, 0, 0))
                .build();
    }

    public int getProcessedFileCount() {
        return processedFileCount.get();
    }

    public int getSuccessCount() {
        return successCount.get();
    }

    public int getErrorCount() {
        return errorCount.get();
    }

    /**
     * Gets the number of files rewritten by directory runs.
     */
    public int getChangedCount() {
        return changedCount.get();
    }

    /**
     * Gets the files of directory runs whose formatted code differs from
     * their content, whether or not they were rewritten.
     */
    public Set<Path> getChangedFiles() {
        return Set.copyOf(changedFiles);
    }

    public boolean hasPluginFor(FileType fileType) {
        return plugins.containsKey(fileType);
    }

    /**
     * Closes all plugins and releases resources.
     */
    @Override
    public void close() throws Exception {
        logger.fine("Closing formatter: processed=" + processedFileCount.get() +
                ", success=" + successCount.get() + ", errors=" + errorCount.get());

        Exception firstException = null;

        for (Map.Entry<FileType, FormatterPlugin> entry : plugins.entrySet()) {
            FormatterPlugin plugin = entry.getValue();
            if (plugin instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) plugin).close();
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Error closing plugin for file type: " + entry.getKey(), e);
                    if (firstException == null) {
                        firstException = e;
                    }
                }
            }
        }

        plugins.clear();

        if (firstException != null) {
            throw firstException;
        }
    }
}
