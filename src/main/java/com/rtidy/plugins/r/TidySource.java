package com.rtidy.plugins.r;

import com.rtidy.config.TidyOptions;
import com.rtidy.plugins.r.ast.AstEngine;
import com.rtidy.plugins.r.ast.RAstEngine;
import com.rtidy.plugins.r.ast.RNode;
import com.rtidy.util.LoggerUtil;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Tidies one R source: masks comments, parses and re-renders the code,
 * restores the comments, then reindents and restores the blank runs at
 * both ends.
 */
public class TidySource {
    private static final Logger logger = LoggerUtil.getLogger(TidySource.class);

    private final AstEngine engine;

    public TidySource() {
        this(new RAstEngine());
    }

    public TidySource(AstEngine engine) {
        this.engine = engine;
    }

    /**
     * @throws com.rtidy.api.error.ParseException   if the source is not valid R
     * @throws com.rtidy.api.error.MaskingException if a comment cannot be masked
     */
    public TidyResult tidy(String source, TidyOptions options) {
        List<String> lines = toLines(source);
        if (lines.stream().allMatch(String::isBlank)) {
            logger.fine("Source is blank, nothing to tidy");
            return new TidyResult(lines, lines, List.of(), source);
        }

        List<String> warnings = new ArrayList<>();
        if (Placeholders.containsSentinel(source)) {
            String warning = "Source contains comment placeholder text; the output may be corrupted";
            logger.warning(warning);
            warnings.add(warning);
        }

        BlankRuns runs = BlankRuns.record(lines);
        MaskedSource masked = options.isComment()
                ? new CommentMasker(options.isBlank()).mask(lines)
                : new MaskedSource(String.join("\n", lines), List.of());

        List<RNode> trees = engine.parse(masked.getText());
        if (options.isArrow() && masked.getText().contains("=")) {
            AssignmentRewriter rewriter = new AssignmentRewriter();
            trees = trees.stream().map(rewriter::rewrite).collect(Collectors.toList());
        }
        String rendered = trees.stream()
                .map(tree -> engine.render(tree, options.getWidthCutoff()))
                .collect(Collectors.joining("\n"));
        logger.fine(() -> "Rendered " + lines.size() + " input lines as " + rendered.split("\n", -1).length);

        String text = rendered;
        if (options.isComment()) {
            CommentUnmasker unmasker = new CommentUnmasker();
            text = unmasker.unmask(rendered);
            if (unmasker.getRestoredCount() != masked.getRecords().size()) {
                String warning = "Restored " + unmasker.getRestoredCount() + " comments and blank lines but masked "
                        + masked.getRecords().size();
                logger.warning(warning);
                warnings.add(warning);
            }
        }

        List<String> tidy = new Reindenter(options.getIndent()).reindent(splitRendered(text));
        if (options.isBraceNewline()) {
            tidy = new BraceRelocator().relocate(tidy);
        }
        if (options.isBlank()) {
            tidy = runs.restore(tidy);
        }
        return new TidyResult(tidy, splitRendered(rendered), warnings);
    }

    /**
     * Splits text into lines after normalizing line terminators. One final
     * terminator is dropped, as reading the text line by line would.
     */
    static List<String> toLines(String text) {
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        if (normalized.endsWith("\n")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(normalized.split("\n", -1));
    }

    private static List<String> splitRendered(String text) {
        return text.isEmpty() ? List.of() : Arrays.asList(text.split("\n", -1));
    }
}
