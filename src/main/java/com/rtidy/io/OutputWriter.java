package com.rtidy.io;

import java.io.IOException;

/**
 * Where tidy text goes.
 */
public interface OutputWriter {

    void write(String text) throws IOException;
}
