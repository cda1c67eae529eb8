package com.rtidy.plugins.r;

import java.util.ArrayList;
import java.util.List;

/**
 * Moves an opening brace that ends a line onto a line of its own, at the
 * indentation of the line it came from. A comment after the brace moves
 * with it.
 */
public class BraceRelocator {

    public List<String> relocate(List<String> lines) {
        LineScanner scanner = new LineScanner();
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            LineScanner.ScannedLine scanned = scanner.scan(line);
            String code = line.substring(0, scanned.codeEnd(line)).stripTrailing();
            if (scanned.startsInString || scanned.endsInString || scanned.lastCodeChar != '{') {
                result.add(line);
                continue;
            }
            String before = code.substring(0, code.length() - 1).stripTrailing();
            if (before.isBlank()) {
                result.add(line);
                continue;
            }
            String indentation = line.substring(0, line.length() - line.stripLeading().length());
            String brace = indentation + "{";
            if (scanned.commentStart >= 0) {
                brace += "  " + line.substring(scanned.commentStart);
            }
            result.add(before);
            result.add(brace);
        }
        return result;
    }
}
