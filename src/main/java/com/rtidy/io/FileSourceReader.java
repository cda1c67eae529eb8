package com.rtidy.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class FileSourceReader implements SourceReader {
    private final Path path;

    public FileSourceReader(Path path) {
        this.path = path;
    }

    @Override
    public String read() throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    @Override
    public String describe() {
        return path.toString();
    }
}
