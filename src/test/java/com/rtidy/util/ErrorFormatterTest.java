package com.rtidy.util;

import com.rtidy.api.error.ConfigException;
import com.rtidy.api.error.FormatterError;
import com.rtidy.api.error.MaskingException;
import com.rtidy.api.error.ParseException;
import com.rtidy.api.error.Severity;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorFormatterTest {

    private final ErrorFormatter plain = new ErrorFormatter(false);

    @Test
    void parseErrorShowsItsPositionOnce() {
        FormatterError error = FormatterError.of(new ParseException("Unexpected token", 3, 7, ")"));

        assertThat(plain.formatError(error))
                .isEqualTo("FATAL: Unexpected token (found ')') (line 3, column 7)");
    }

    @Test
    void maskingErrorCarriesASuggestion() {
        FormatterError error = FormatterError.of(new MaskingException("Comment has no code after it", 2));

        assertThat(plain.formatError(error))
                .startsWith("FATAL: Comment has no code after it (line 2)")
                .contains("\n  Suggestion: ");
    }

    @Test
    void configErrorNamesTheOption() {
        FormatterError error = FormatterError.of(new ConfigException("indent", "Option 'indent' has no value"));

        assertThat(error.getSeverity()).isEqualTo(Severity.ERROR);
        assertThat(error.getSuggestion()).isEqualTo("Check the value of option 'indent'");
    }

    @Test
    void fileErrorIsPrefixedWithThePath() {
        FormatterError warning = new FormatterError(Severity.WARNING, "deprecated", 0, 0);

        assertThat(plain.formatFileError(Path.of("a.R"), warning)).isEqualTo("a.R: WARNING: deprecated");
    }

    @Test
    void runSummaryMentionsFailuresOnlyWhenThereAreSome() {
        assertThat(plain.formatRunSummary(2, 1, 0)).isEqualTo("2 reformatted, 1 unchanged");
        assertThat(plain.formatRunSummary(0, 0, 1)).isEqualTo("0 reformatted, 0 unchanged, 1 failed");
    }

    @Test
    void errorSummaryCountsBySeverity() {
        Map<Path, List<FormatterError>> errors = new LinkedHashMap<>();
        errors.put(Path.of("dir", "a.R"), List.of(
                new FormatterError(Severity.FATAL, "bad", 1, 1),
                new FormatterError(Severity.WARNING, "old", 0, 0)));
        errors.put(Path.of("b.R"), List.of());

        assertThat(plain.formatErrorSummary(errors))
                .isEqualTo("Error Summary:\na.R: 1 fatal, 1 warnings\n\nTotal: 1 fatal, 1 warnings");
    }

    @Test
    void coloursWrapTextOnlyWhenEnabled() {
        assertThat(new ErrorFormatter(true).colorize(ErrorFormatter.ANSI_RED, "x"))
                .isEqualTo(ErrorFormatter.ANSI_RED + "x" + ErrorFormatter.ANSI_RESET);
        assertThat(plain.colorize(ErrorFormatter.ANSI_RED, "x")).isEqualTo("x");
    }
}
