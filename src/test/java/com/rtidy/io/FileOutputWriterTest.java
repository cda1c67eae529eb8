package com.rtidy.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FileOutputWriterTest {

    @TempDir
    Path dir;

    @Test
    void replacesContent() throws IOException {
        Path file = dir.resolve("out.R");
        Files.writeString(file, "old\n");

        new FileOutputWriter(file, false).write("new\n");

        assertThat(Files.readString(file)).isEqualTo("new\n");
    }

    @Test
    void appendsCreatingTheFile() throws IOException {
        Path file = dir.resolve("log.R");
        FileOutputWriter writer = new FileOutputWriter(file, true);

        writer.write("a\n");
        writer.write("b\n");

        assertThat(Files.readString(file)).isEqualTo("a\nb\n");
    }

    @Test
    void readersDescribeTheirSource() throws IOException {
        Path file = dir.resolve("in.R");
        Files.writeString(file, "x\n");

        assertThat(new FileSourceReader(file).read()).isEqualTo("x\n");
        assertThat(new FileSourceReader(file).describe()).isEqualTo(file.toString());
        assertThat(new TextSourceReader("y").read()).isEqualTo("y");
    }
}
