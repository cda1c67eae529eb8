package com.rtidy.config;

import com.rtidy.api.error.ConfigException;
import com.rtidy.util.LoggerUtil;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Merges named option values, including deprecated names, into
 * {@link TidyOptions}.
 *
 * <p>A deprecated name still takes effect but produces a warning. Giving
 * both a deprecated name and its replacement is accepted when the values
 * agree and rejected when they differ.
 */
public final class OptionResolver {
    private static final Logger logger = LoggerUtil.getLogger(OptionResolver.class);

    public static final String COMMENT = "comment";
    public static final String BLANK = "blank";
    public static final String ARROW = "arrow";
    public static final String BRACE_NEWLINE = "brace.newline";
    public static final String INDENT = "indent";
    public static final String WIDTH_CUTOFF = "width.cutoff";

    private static final Map<String, String> LEGACY_NAMES = new LinkedHashMap<>();

    static {
        LEGACY_NAMES.put("keep.comment", COMMENT);
        LEGACY_NAMES.put("keep.blank.line", BLANK);
        LEGACY_NAMES.put("replace.assign", ARROW);
        LEGACY_NAMES.put("left.brace.newline", BRACE_NEWLINE);
        LEGACY_NAMES.put("reindent.spaces", INDENT);
    }

    private OptionResolver() {
    }

    public static ResolvedOptions resolve(Map<String, ?> values) {
        return resolve(values, TidyOptions.defaults());
    }

    /**
     * Resolves the given values on top of a base set of options.
     *
     * @throws ConfigException on an unknown name, a value of the wrong type
     *                         or out of range, or a deprecated name that
     *                         conflicts with its replacement
     */
    public static ResolvedOptions resolve(Map<String, ?> values, TidyOptions base) {
        Map<String, Object> current = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();

        for (Map.Entry<String, ?> entry : values.entrySet()) {
            String name = entry.getKey();
            if (LEGACY_NAMES.containsKey(name)) {
                continue;
            }
            if (!isKnown(name)) {
                throw new ConfigException(name, "Unknown option '" + name + "'");
            }
            current.put(name, entry.getValue());
        }

        for (Map.Entry<String, String> legacy : LEGACY_NAMES.entrySet()) {
            if (!values.containsKey(legacy.getKey())) {
                continue;
            }
            String oldName = legacy.getKey();
            String newName = legacy.getValue();
            String warning = "The option '" + oldName + "' is deprecated; please use '" + newName + "'";
            logger.warning(warning);
            warnings.add(warning);

            Object oldValue = convert(oldName, values.get(oldName), newName);
            if (current.containsKey(newName)) {
                Object newValue = convert(newName, current.get(newName), newName);
                if (!newValue.equals(oldValue)) {
                    throw new ConfigException(newName, "Conflicting values for '" + newName
                            + "' (" + newValue + ") and deprecated '" + oldName + "' (" + oldValue + ")");
                }
            } else {
                current.put(newName, oldValue);
            }
        }

        TidyOptions.Builder builder = base.toBuilder();
        for (Map.Entry<String, Object> entry : current.entrySet()) {
            String name = entry.getKey();
            Object value = convert(name, entry.getValue(), name);
            switch (name) {
                case COMMENT -> builder.comment((Boolean) value);
                case BLANK -> builder.blank((Boolean) value);
                case ARROW -> builder.arrow((Boolean) value);
                case BRACE_NEWLINE -> builder.braceNewline((Boolean) value);
                case INDENT -> builder.indent((Integer) value);
                case WIDTH_CUTOFF -> builder.widthCutoff((Integer) value);
                default -> throw new ConfigException(name, "Unknown option '" + name + "'");
            }
        }
        return new ResolvedOptions(builder.build(), warnings);
    }

    /**
     * The current name of an option, given its current or deprecated name.
     */
    public static String canonicalName(String name) {
        return LEGACY_NAMES.getOrDefault(name, name);
    }

    public static boolean isKnown(String name) {
        return switch (name) {
            case COMMENT, BLANK, ARROW, BRACE_NEWLINE, INDENT, WIDTH_CUTOFF -> true;
            default -> LEGACY_NAMES.containsKey(name);
        };
    }

    /**
     * Converts a raw value (as given by YAML or the command line) to the
     * type the target option takes.
     */
    private static Object convert(String given, Object value, String target) {
        boolean integral = INDENT.equals(target) || WIDTH_CUTOFF.equals(target);
        if (value == null) {
            throw new ConfigException(given, "Option '" + given + "' has no value");
        }
        if (integral) {
            if (value instanceof Integer || value instanceof Long || value instanceof Short) {
                return ((Number) value).intValue();
            }
            if (value instanceof String && ((String) value).trim().matches("-?\\d{1,9}")) {
                return Integer.parseInt(((String) value).trim());
            }
            throw new ConfigException(given, "Option '" + given + "' expects an integer, got '" + value + "'");
        }
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if (text.equalsIgnoreCase("true")) {
                return Boolean.TRUE;
            }
            if (text.equalsIgnoreCase("false")) {
                return Boolean.FALSE;
            }
        }
        throw new ConfigException(given, "Option '" + given + "' expects true or false, got '" + value + "'");
    }
}
