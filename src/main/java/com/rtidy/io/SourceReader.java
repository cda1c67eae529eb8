package com.rtidy.io;

import java.io.IOException;

/**
 * Where source text comes from.
 */
public interface SourceReader {

    String read() throws IOException;

    /**
     * Short description of the source, used in messages.
     */
    String describe();
}
