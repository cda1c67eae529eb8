package com.rtidy.io;

import java.io.PrintStream;

public class ConsoleOutputWriter implements OutputWriter {
    private final PrintStream out;

    public ConsoleOutputWriter(PrintStream out) {
        this.out = out;
    }

    @Override
    public void write(String text) {
        out.print(text);
        out.flush();
    }
}
