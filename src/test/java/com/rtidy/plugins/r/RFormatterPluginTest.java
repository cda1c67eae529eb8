package com.rtidy.plugins.r;

import com.rtidy.api.FormatterResult;
import com.rtidy.api.error.ConfigException;
import com.rtidy.api.error.FormatterError;
import com.rtidy.api.error.Severity;
import com.rtidy.config.ConfigurationLoader;
import com.rtidy.config.FormatterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RFormatterPluginTest {

    private static final Path FILE = Path.of("script.R");

    private RFormatterPlugin plugin;

    @BeforeEach
    void setUp() {
        plugin = new RFormatterPlugin();
    }

    @AfterEach
    void tearDown() {
        plugin.close();
    }

    private static FormatterConfig config(Map<String, ?> tidy) {
        return ConfigurationLoader.loadDefaultConfig().withTidyOverrides(tidy);
    }

    @Test
    void formatsWithConfiguredOptions() {
        plugin.initialize(config(Map.of("arrow", true, "indent", 2)));

        FormatterResult result = plugin.format(FILE, "f=function(x){\nx\n}\n");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getFormattedCode()).isEqualTo("f <- function(x) {\n  x\n}\n");
        assertThat(result.getErrors()).isEmpty();
        assertThat(result.changes("f=function(x){\nx\n}\n")).isTrue();
    }

    @Test
    void tidySourceIsUnchanged() {
        plugin.initialize(ConfigurationLoader.loadDefaultConfig());
        String tidy = "x <- 1  # one\n";

        FormatterResult result = plugin.format(FILE, tidy);

        assertThat(result.changes(tidy)).isFalse();
        assertThat(result.getMaskedCode()).contains(Placeholders.INLINE_MARKER);
    }

    @Test
    void deprecatedOptionIsReportedAsAWarning() {
        plugin.initialize(config(Map.of("replace.assign", true)));

        FormatterResult result = plugin.format(FILE, "x = 1\n");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getFormattedCode()).isEqualTo("x <- 1\n");
        assertThat(result.getErrors()).extracting(FormatterError::getSeverity).containsExactly(Severity.WARNING);
        assertThat(result.getErrors().get(0).getMessage())
                .isEqualTo("The option 'replace.assign' is deprecated; please use 'arrow'");
    }

    @Test
    void parseErrorFailsTheFile() {
        plugin.initialize(ConfigurationLoader.loadDefaultConfig());

        FormatterResult result = plugin.format(FILE, "x <- )\n");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFormattedCode()).isNull();
        assertThat(result.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.getSeverity()).isEqualTo(Severity.FATAL);
            assertThat(error.getLine()).isEqualTo(1);
            assertThat(error.getColumn()).isEqualTo(6);
        });
    }

    @Test
    void deeplyNestedExpressionFailsTheFile() {
        plugin.initialize(ConfigurationLoader.loadDefaultConfig());
        String source = "x <- 1" + " + 1".repeat(200_000) + "\n";

        FormatterResult result = plugin.format(FILE, source);

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getErrors()).extracting(FormatterError::getSeverity).containsExactly(Severity.FATAL);
        assertThat(result.getErrors().get(0).getMessage()).contains("nested too deeply");
    }

    @Test
    void invalidOptionIsRejectedAtInitialization() {
        assertThatThrownBy(() -> plugin.initialize(config(Map.of("width.cutoff", 5))))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void repeatedSourceGivesTheSameResult() {
        plugin.initialize(ConfigurationLoader.loadDefaultConfig());

        String first = plugin.format(FILE, "y<-2\n").getFormattedCode();
        String second = plugin.format(Path.of("other.R"), "y<-2\n").getFormattedCode();

        assertThat(second).isEqualTo(first).isEqualTo("y <- 2\n");
    }
}
