package com.rtidy.plugins.r;

/**
 * Sentinel texts used to smuggle comments and blank lines through the
 * parser, and the escaping that turns a comment into a string payload.
 */
public final class Placeholders {
    public static final String BEGIN = ".BeGiN_TiDy_IdEnTiFiEr_HaHaHa";
    public static final String END = ".HaHaHa_EnD_TiDy_IdEnTiFiEr";
    public static final String BRACE_BEGIN = ".BrAcE_TiDy_IdEnTiFiEr_HaHaHa";
    public static final String INLINE_MARKER = "%InLiNe_IdEnTiFiEr%";

    private Placeholders() {
    }

    public static String standalone(String payload) {
        return "invisible(\"" + BEGIN + payload + END + "\")";
    }

    public static String blank() {
        return standalone("");
    }

    public static String braceTrailing(String payload) {
        return "invisible(\"" + BRACE_BEGIN + payload + END + "\")";
    }

    public static String inline(String payload) {
        return " " + INLINE_MARKER + " \"" + payload + "\"";
    }

    public static String escape(String comment) {
        return comment.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    public static String unescape(String payload) {
        StringBuilder sb = new StringBuilder(payload.length());
        for (int i = 0; i < payload.length(); i++) {
            char c = payload.charAt(i);
            if (c == '\\' && i + 1 < payload.length()) {
                c = payload.charAt(++i);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Whether the text contains any sentinel or the inline marker.
     */
    public static boolean containsSentinel(String text) {
        return text.contains(BEGIN) || text.contains(END)
                || text.contains(BRACE_BEGIN) || text.contains(INLINE_MARKER);
    }
}
