package com.rtidy.util;

import com.rtidy.api.error.FormatterError;
import com.rtidy.api.error.Severity;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Formats diagnostics and run summaries for the console, optionally
 * with ANSI colours.
 */
public class ErrorFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    /**
     * Creates a new error formatter.
     *
     * @param useColors whether to use colors in the output
     */
    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * Formats a formatter error message.
     */
    public String formatError(FormatterError error) {
        StringBuilder sb = new StringBuilder();

        String severityStr = switch (error.getSeverity()) {
            case FATAL -> colorize(ANSI_RED, "FATAL");
            case ERROR -> colorize(ANSI_RED, "ERROR");
            case WARNING -> colorize(ANSI_YELLOW, "WARNING");
            case INFO -> colorize(ANSI_BLUE, "INFO");
        };

        sb.append(severityStr).append(": ");
        sb.append(error.getMessage());
        if (error.getLine() > 0) {
            sb.append(" (line ").append(error.getLine());
            if (error.getColumn() > 0) {
                sb.append(", column ").append(error.getColumn());
            }
            sb.append(")");
        }

        if (error.getSuggestion() != null && !error.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: "))
                    .append(error.getSuggestion());
        }

        return sb.toString();
    }

    /**
     * Formats an error reported for a file, prefixed with the file path.
     */
    public String formatFileError(Path file, FormatterError error) {
        return colorize(ANSI_BOLD, file.toString()) + ": " + formatError(error);
    }

    /**
     * Formats the outcome of a batch run: how many files were changed,
     * left as they were, and failed.
     */
    public String formatRunSummary(int changed, int unchanged, int failed) {
        StringBuilder sb = new StringBuilder();
        sb.append(colorize(ANSI_GREEN, changed + " reformatted")).append(", ");
        sb.append(unchanged).append(" unchanged");
        if (failed > 0) {
            sb.append(", ").append(colorize(ANSI_RED, failed + " failed"));
        }
        return sb.toString();
    }

    /**
     * Creates a summary of errors per file.
     */
    public String formatErrorSummary(Map<Path, List<FormatterError>> fileErrors) {
        StringBuilder sb = new StringBuilder();

        sb.append(colorize(ANSI_BOLD, "Error Summary:\n"));

        int totalErrors = 0;
        int totalWarnings = 0;
        int totalInfos = 0;
        int totalFatals = 0;

        for (Map.Entry<Path, List<FormatterError>> entry : fileErrors.entrySet()) {
            Path file = entry.getKey();
            List<FormatterError> errors = entry.getValue();

            if (errors.isEmpty()) {
                continue;
            }

            long fatals = errors.stream().filter(e -> e.getSeverity() == Severity.FATAL).count();
            long errs = errors.stream().filter(e -> e.getSeverity() == Severity.ERROR).count();
            long warnings = errors.stream().filter(e -> e.getSeverity() == Severity.WARNING).count();
            long infos = errors.stream().filter(e -> e.getSeverity() == Severity.INFO).count();

            totalFatals += fatals;
            totalErrors += errs;
            totalWarnings += warnings;
            totalInfos += infos;

            sb.append(file.getFileName()).append(": ")
                    .append(formatCounts(fatals, errs, warnings, infos)).append("\n");
        }

        sb.append("\nTotal: ").append(formatCounts(totalFatals, totalErrors, totalWarnings, totalInfos));

        return sb.toString();
    }

    private String formatCounts(long fatals, long errors, long warnings, long infos) {
        List<String> parts = new ArrayList<>();
        if (fatals > 0) {
            parts.add(colorize(ANSI_RED, fatals + " fatal"));
        }
        if (errors > 0) {
            parts.add(colorize(ANSI_RED, errors + " errors"));
        }
        if (warnings > 0) {
            parts.add(colorize(ANSI_YELLOW, warnings + " warnings"));
        }
        if (infos > 0) {
            parts.add(colorize(ANSI_BLUE, infos + " info"));
        }
        return String.join(", ", parts);
    }

    /**
     * Applies ANSI color to text if colors are enabled.
     */
    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }
}