package com.rtidy.plugins;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.rtidy.util.LoggerUtil;

/**
 * File types the formatter knows about, detected by extension and, for
 * files without one, by an Rscript shebang line.
 */
public enum FileType {
    R_SCRIPT,
    UNKNOWN;

    private static final Logger logger = LoggerUtil.getLogger(FileType.class);

    // .R .r .S .s .Q .q
    private static final Pattern R_EXTENSION = Pattern.compile("[.][RrSsQq]$");
    private static final Pattern RSCRIPT_SHEBANG = Pattern.compile("^#!\\S*(?:/|\\s)Rscript\\b");

    private static final Map<Path, FileType> typeCache = new ConcurrentHashMap<>();
    private static final int MAX_CACHE_SIZE = 10000;
    private static final int HEAD_BYTES = 256;

    /**
     * Detects the type of a file by its name.
     */
    public static FileType detectByName(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName != null && R_EXTENSION.matcher(fileName.toString()).find()) {
            return R_SCRIPT;
        }
        return UNKNOWN;
    }

    /**
     * Detects the type of a file by its name, falling back to its first
     * line for files without an R extension.
     */
    public static FileType detect(Path filePath) {
        FileType cachedType = typeCache.get(filePath);
        if (cachedType != null) {
            return cachedType;
        }

        if (typeCache.size() > MAX_CACHE_SIZE) {
            typeCache.clear();
            logger.fine("Cleared file type detection cache");
        }

        FileType type = detectByName(filePath);
        if (type == UNKNOWN && Files.isRegularFile(filePath)) {
            type = detectByContent(filePath);
        }
        typeCache.put(filePath, type);
        return type;
    }

    private static FileType detectByContent(Path filePath) {
        try (InputStream in = Files.newInputStream(filePath)) {
            String head = new String(in.readNBytes(HEAD_BYTES), StandardCharsets.UTF_8);
            return RSCRIPT_SHEBANG.matcher(head).find() ? R_SCRIPT : UNKNOWN;
        } catch (IOException e) {
            logger.log(Level.FINE, "Error reading file for type detection: " + filePath, e);
            return UNKNOWN;
        }
    }

    public static void clearCache() {
        typeCache.clear();
    }

    public String getDescription() {
        return switch (this) {
            case R_SCRIPT -> "R source file";
            case UNKNOWN -> "Unknown file type";
        };
    }
}
