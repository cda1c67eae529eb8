package com.rtidy.plugins.r;

/**
 * Scans R lines one at a time, carrying string state from line to line, and
 * reports the brackets, comment position and last code character of each.
 * Text inside strings and comments is never mistaken for code.
 */
class LineScanner {

    static final class ScannedLine {
        final boolean startsInString;
        final boolean endsInString;
        final int commentStart;
        final String brackets;
        final int leadingClosers;
        final char lastCodeChar;

        ScannedLine(boolean startsInString, boolean endsInString, int commentStart,
                    String brackets, int leadingClosers, char lastCodeChar) {
            this.startsInString = startsInString;
            this.endsInString = endsInString;
            this.commentStart = commentStart;
            this.brackets = brackets;
            this.leadingClosers = leadingClosers;
            this.lastCodeChar = lastCodeChar;
        }

        boolean hasCode() {
            return lastCodeChar != 0;
        }

        /**
         * End of the code part: the comment start, or the line length.
         */
        int codeEnd(String line) {
            return commentStart >= 0 ? commentStart : line.length();
        }
    }

    // closing quote of an open string, or the closing sequence of a raw string
    private String openString;
    private boolean raw;

    ScannedLine scan(String line) {
        boolean startsInString = openString != null;
        int i = 0;
        char lastCodeChar = 0;
        if (startsInString) {
            i = skipString(line, 0);
            if (openString == null) {
                lastCodeChar = line.charAt(i - 1);
            }
        }

        StringBuilder brackets = new StringBuilder();
        int leadingClosers = 0;
        boolean leading = !startsInString;
        int commentStart = -1;

        while (i < line.length() && openString == null) {
            char c = line.charAt(i);
            if (c == '#') {
                commentStart = i;
                break;
            }
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            boolean closer = c == ')' || c == ']' || c == '}';
            if (leading && closer) {
                leadingClosers++;
            } else {
                leading = false;
            }
            lastCodeChar = c;

            if (c == '"' || c == '\'' || c == '`') {
                openString = String.valueOf(c);
                raw = false;
                i = skipString(line, i + 1);
            } else if ((c == 'r' || c == 'R') && isRawStringStart(line, i)) {
                i = openRawString(line, i);
                i = skipString(line, i);
            } else if (c == '%') {
                int close = line.indexOf('%', i + 1);
                i = close < 0 ? line.length() : close + 1;
                lastCodeChar = '%';
            } else {
                if (c == '(' || c == '[' || c == '{' || closer) {
                    brackets.append(c);
                }
                i = Character.isLetterOrDigit(c) || c == '.' || c == '_' ? skipName(line, i) : i + 1;
            }
        }
        return new ScannedLine(startsInString, openString != null, commentStart,
                brackets.toString(), leadingClosers, lastCodeChar);
    }

    private int skipString(String line, int from) {
        if (raw) {
            int close = line.indexOf(openString, from);
            if (close < 0) {
                return line.length();
            }
            int end = close + openString.length();
            openString = null;
            raw = false;
            return end;
        }
        char quote = openString.charAt(0);
        int i = from;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote) {
                openString = null;
                return i + 1;
            } else {
                i++;
            }
        }
        return line.length();
    }

    private static boolean isRawStringStart(String line, int i) {
        if (i > 0) {
            char before = line.charAt(i - 1);
            if (Character.isLetterOrDigit(before) || before == '.' || before == '_') {
                return false;
            }
        }
        return i + 1 < line.length() && (line.charAt(i + 1) == '"' || line.charAt(i + 1) == '\'');
    }

    private int openRawString(String line, int i) {
        char quote = line.charAt(i + 1);
        int j = i + 2;
        StringBuilder dashes = new StringBuilder();
        while (j < line.length() && line.charAt(j) == '-') {
            dashes.append('-');
            j++;
        }
        char open = j < line.length() ? line.charAt(j) : '(';
        char close = open == '[' ? ']' : open == '{' ? '}' : ')';
        openString = close + dashes.toString() + quote;
        raw = true;
        return j + 1;
    }

    private static int skipName(String line, int i) {
        while (i < line.length()) {
            char c = line.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '.' && c != '_') {
                break;
            }
            i++;
        }
        return i;
    }
}
