package com.rtidy.plugins.r;

import com.rtidy.util.LoggerUtil;

import java.util.function.Function;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the placeholders left by {@link CommentMasker} back into comments
 * in rendered text, repairing the positions the renderer moved them to.
 */
public class CommentUnmasker {
    private static final Logger logger = LoggerUtil.getLogger(CommentUnmasker.class);

    private static final String MARKER = Pattern.quote(Placeholders.INLINE_MARKER);
    private static final String PAYLOAD = "((?:[^\"\\\\]|\\\\.)*)";
    private static final String ANY_PAYLOAD = "(?:[^\"\\\\]|\\\\.)*";
    private static final String MARKER_CHAIN = "((?: " + MARKER + " *\"" + ANY_PAYLOAD + "\")+)";

    private static final Pattern BREAK_AFTER_MARKER = Pattern.compile(MARKER + "[ \\t]*\\n[ \\t]*");
    private static final Pattern BREAK_BEFORE_MARKER = Pattern.compile("[ \\t]*\\n[ \\t]*" + MARKER);
    private static final Pattern CHAIN_BEFORE_ELSE = Pattern.compile(MARKER_CHAIN + " else(?![\\w.])([^\\n]*)");
    private static final Pattern BRACE_TRAILING = Pattern.compile("[ \\t]*\\n?[ \\t]*invisible\\(\""
            + Pattern.quote(Placeholders.BRACE_BEGIN) + PAYLOAD + Pattern.quote(Placeholders.END) + "\"\\)");
    private static final Pattern STANDALONE = Pattern.compile("invisible\\(\""
            + Pattern.quote(Placeholders.BEGIN) + PAYLOAD + Pattern.quote(Placeholders.END) + "\"\\)");
    private static final Pattern CHAIN_AT_END_OF_LINE = Pattern.compile(MARKER_CHAIN + "(?=\\n|\\z)");
    private static final Pattern SINGLE_MARKER = Pattern.compile(" " + MARKER + " *\"" + PAYLOAD + "\"");
    private static final Pattern MARKER_BEFORE_COMMA = Pattern.compile(" " + MARKER + " *\"" + PAYLOAD + "\"[ \\t]*,[ \\t]*\\n?[ \\t]*");
    private static final Pattern MARKER_BEFORE_CODE = Pattern.compile(" " + MARKER + " *\"" + PAYLOAD + "\"[ \\t]*");

    private int restored;

    /**
     * Restores every comment and blank line in the rendered text.
     */
    public String unmask(String rendered) {
        restored = 0;
        String text = BREAK_AFTER_MARKER.matcher(rendered)
                .replaceAll(Matcher.quoteReplacement(Placeholders.INLINE_MARKER + " "));
        text = BREAK_BEFORE_MARKER.matcher(text)
                .replaceAll(Matcher.quoteReplacement(" " + Placeholders.INLINE_MARKER));

        text = replace(CHAIN_BEFORE_ELSE, text, m -> " else" + m.group(2) + m.group(1));

        text = replace(BRACE_TRAILING, text, m -> {
            restored++;
            return "  " + Placeholders.unescape(m.group(1));
        });
        text = replace(STANDALONE, text, m -> {
            restored++;
            return Placeholders.unescape(m.group(1));
        });
        text = replace(CHAIN_AT_END_OF_LINE, text, m -> {
            StringBuilder comments = new StringBuilder();
            Matcher single = SINGLE_MARKER.matcher(m.group(1));
            while (single.find()) {
                restored++;
                comments.append("  ").append(Placeholders.unescape(single.group(1)));
            }
            return comments.toString();
        });
        text = replace(MARKER_BEFORE_COMMA, text, m -> {
            restored++;
            return ",  " + Placeholders.unescape(m.group(1)) + "\n";
        });
        text = replace(MARKER_BEFORE_CODE, text, m -> {
            restored++;
            return "  " + Placeholders.unescape(m.group(1)) + "\n";
        });

        logger.fine("Restored " + restored + " comments and blank lines");
        return text;
    }

    /**
     * Number of placeholders restored by the last {@link #unmask} call.
     */
    public int getRestoredCount() {
        return restored;
    }

    private static String replace(Pattern pattern, String text, Function<Matcher, String> replacement) {
        Matcher m = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement.apply(m)));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
