package com.rtidy.plugins;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FileTypeTest {

    @TempDir
    Path dir;

    @AfterEach
    void tearDown() {
        FileType.clearCache();
    }

    @Test
    void rExtensions() {
        assertThat(FileType.detectByName(Path.of("analysis.R"))).isEqualTo(FileType.R_SCRIPT);
        assertThat(FileType.detectByName(Path.of("dir", "helpers.r"))).isEqualTo(FileType.R_SCRIPT);
        assertThat(FileType.detectByName(Path.of("old.S"))).isEqualTo(FileType.R_SCRIPT);
        assertThat(FileType.detectByName(Path.of("model.q"))).isEqualTo(FileType.R_SCRIPT);
    }

    @Test
    void otherExtensions() {
        assertThat(FileType.detectByName(Path.of("report.Rmd"))).isEqualTo(FileType.UNKNOWN);
        assertThat(FileType.detectByName(Path.of("notes.txt"))).isEqualTo(FileType.UNKNOWN);
        assertThat(FileType.detectByName(Path.of("R"))).isEqualTo(FileType.UNKNOWN);
    }

    @Test
    void rscriptShebang() throws IOException {
        Path script = dir.resolve("run");
        Files.writeString(script, "#!/usr/bin/env Rscript\nx <- 1\n");
        Path shell = dir.resolve("build");
        Files.writeString(shell, "#!/bin/sh\necho hi\n");

        assertThat(FileType.detect(script)).isEqualTo(FileType.R_SCRIPT);
        assertThat(FileType.detect(shell)).isEqualTo(FileType.UNKNOWN);
    }

    @Test
    void onlyTheHeadOfAFileIsInspected() throws IOException {
        Path large = dir.resolve("large");
        Files.writeString(large, "#!/usr/bin/env Rscript\n" + "x <- 1\n".repeat(200_000));
        Path longShebang = dir.resolve("long");
        Files.writeString(longShebang, "#!/opt/" + "a".repeat(300) + "/Rscript\n");

        assertThat(FileType.detect(large)).isEqualTo(FileType.R_SCRIPT);
        assertThat(FileType.detect(longShebang)).isEqualTo(FileType.UNKNOWN);
    }

    @Test
    void missingFileIsDetectedByName() {
        assertThat(FileType.detect(dir.resolve("absent.R"))).isEqualTo(FileType.R_SCRIPT);
        assertThat(FileType.detect(dir.resolve("absent"))).isEqualTo(FileType.UNKNOWN);
    }
}
