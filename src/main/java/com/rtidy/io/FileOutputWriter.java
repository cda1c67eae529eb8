package com.rtidy.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes to a file, replacing its content or appending to it.
 */
public class FileOutputWriter implements OutputWriter {
    private final Path path;
    private final boolean append;

    public FileOutputWriter(Path path, boolean append) {
        this.path = path;
        this.append = append;
    }

    @Override
    public void write(String text) throws IOException {
        if (append) {
            Files.writeString(path, text, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } else {
            Files.writeString(path, text, StandardCharsets.UTF_8);
        }
    }
}
