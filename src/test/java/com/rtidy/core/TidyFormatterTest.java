package com.rtidy.core;

import com.rtidy.api.FormatterPlugin;
import com.rtidy.api.FormatterResult;
import com.rtidy.api.error.FormatterError;
import com.rtidy.api.error.Severity;
import com.rtidy.config.ConfigurationLoader;
import com.rtidy.config.FormatterConfig;
import com.rtidy.plugins.FileType;
import com.rtidy.plugins.r.RFormatterPlugin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TidyFormatterTest {

    @TempDir
    Path dir;

    private TidyFormatter formatter;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(dir.resolve("a.R"), "x=1\n");
        Files.writeString(dir.resolve("broken.R"), "y <- (\n");
        Files.writeString(dir.resolve("tidy.r"), "z <- 3\n");
        Files.writeString(dir.resolve("notes.txt"), "x=1\n");
        Files.createDirectories(dir.resolve("sub"));
        Files.writeString(dir.resolve("sub").resolve("c.R"), "w<-4\n");

        formatter = create(ConfigurationLoader.loadDefaultConfig());
    }

    @AfterEach
    void tearDown() throws Exception {
        formatter.close();
    }

    private static TidyFormatter create(FormatterConfig config) {
        TidyFormatter formatter = new TidyFormatter(config);
        formatter.registerPlugin(FileType.R_SCRIPT, new RFormatterPlugin());
        return formatter;
    }

    @Test
    void formatsEveryRFileAndRewritesTheChangedOnes() throws IOException {
        Map<Path, FormatterResult> results = formatter.formatDirectory(dir, false, 2, true);

        assertThat(results).containsOnlyKeys(dir.resolve("a.R"), dir.resolve("broken.R"), dir.resolve("tidy.r"));
        assertThat(Files.readString(dir.resolve("a.R"))).isEqualTo("x = 1\n");
        assertThat(Files.readString(dir.resolve("tidy.r"))).isEqualTo("z <- 3\n");
        assertThat(Files.readString(dir.resolve("notes.txt"))).isEqualTo("x=1\n");
        assertThat(formatter.getChangedFiles()).containsExactly(dir.resolve("a.R"));
        assertThat(formatter.getChangedCount()).isEqualTo(1);
    }

    @Test
    void failingFileIsLeftAloneAndDoesNotStopTheOthers() throws IOException {
        Map<Path, FormatterResult> results = formatter.formatDirectory(dir, false, 1, true);

        FormatterResult broken = results.get(dir.resolve("broken.R"));
        assertThat(broken.isSuccessful()).isFalse();
        assertThat(broken.getErrors()).isNotEmpty();
        assertThat(Files.readString(dir.resolve("broken.R"))).isEqualTo("y <- (\n");
        assertThat(results.get(dir.resolve("a.R")).isSuccessful()).isTrue();
        assertThat(formatter.getErrorCount()).isEqualTo(1);
    }

    @Test
    void fileWhosePluginDiesWithAnErrorIsStillReported() throws Exception {
        try (TidyFormatter dying = new TidyFormatter(ConfigurationLoader.loadDefaultConfig())) {
            dying.registerPlugin(FileType.R_SCRIPT, new FormatterPlugin() {
                @Override
                public void initialize(FormatterConfig config) {
                    // no options
                }

                @Override
                public FormatterResult format(Path filePath, String sourceCode) {
                    if (filePath.endsWith("broken.R")) {
                        throw new StackOverflowError();
                    }
                    return FormatterResult.builder().successful(true).formattedCode(sourceCode).build();
                }
            });

            Map<Path, FormatterResult> results = dying.formatDirectory(dir, false, 2, true);

            assertThat(results).containsOnlyKeys(dir.resolve("a.R"), dir.resolve("broken.R"), dir.resolve("tidy.r"));
            FormatterResult broken = results.get(dir.resolve("broken.R"));
            assertThat(broken.isSuccessful()).isFalse();
            assertThat(broken.getErrors()).extracting(FormatterError::getSeverity).containsExactly(Severity.FATAL);
            assertThat(results.get(dir.resolve("a.R")).isSuccessful()).isTrue();
            assertThat(dying.getErrorCount()).isEqualTo(1);
            assertThat(Files.readString(dir.resolve("broken.R"))).isEqualTo("y <- (\n");
        }
    }

    @Test
    void checkOnlyWritesNothing() throws IOException {
        formatter.formatDirectory(dir, false, 2, false);

        assertThat(Files.readString(dir.resolve("a.R"))).isEqualTo("x=1\n");
        assertThat(formatter.getChangedFiles()).containsExactly(dir.resolve("a.R"));
        assertThat(formatter.getChangedCount()).isZero();
    }

    @Test
    void recursionIncludesSubdirectories() throws IOException {
        Map<Path, FormatterResult> results = formatter.formatDirectory(dir, true, 2, true);

        assertThat(results).containsKey(dir.resolve("sub").resolve("c.R"));
        assertThat(Files.readString(dir.resolve("sub").resolve("c.R"))).isEqualTo("w <- 4\n");
    }

    @Test
    void ignoredFilesAreSkipped() throws Exception {
        FormatterConfig config = ConfigurationLoader.loadDefaultConfig()
                .withGeneral("ignoreFiles", List.of("broken.*"));
        try (TidyFormatter ignoring = create(config)) {
            Map<Path, FormatterResult> results = ignoring.formatDirectory(dir, false, 2, false);

            assertThat(results).doesNotContainKey(dir.resolve("broken.R"));
            assertThat(results).hasSize(2);
        }
    }

    @Test
    void directoryRunUsesTheConfiguredSettings() throws Exception {
        FormatterConfig config = ConfigurationLoader.loadDefaultConfig()
                .withGeneral("recursive", true)
                .withTidyOverrides(Map.of("arrow", true));
        try (TidyFormatter configured = create(config)) {
            configured.formatDirectory(dir);

            assertThat(Files.readString(dir.resolve("a.R"))).isEqualTo("x <- 1\n");
            assertThat(Files.readString(dir.resolve("sub").resolve("c.R"))).isEqualTo("w <- 4\n");
        }
    }

    @Test
    void fileWithoutAPluginFails() {
        FormatterResult result = formatter.formatFile(Path.of("style.css"), "a {}");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFormattedCode()).isEqualTo("a {}");
    }

    @Test
    void singleFileIsFormattedWithoutWriting() throws IOException {
        Path file = dir.resolve("a.R");

        FormatterResult result = formatter.formatFile(file, Files.readString(file));

        assertThat(result.getFormattedCode()).isEqualTo("x = 1\n");
        assertThat(Files.readString(file)).isEqualTo("x=1\n");
    }
}
