package com.rtidy.plugins.r;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReindenterTest {

    @Test
    void blockContentsMoveOneLevelIn() {
        List<String> out = new Reindenter(2).reindent(List.of(
                "f <- function(x) {",
                "        x + 1",
                "    }"));

        assertThat(out).containsExactly(
                "f <- function(x) {",
                "  x + 1",
                "}");
    }

    @Test
    void nestedBlocks() {
        List<String> out = new Reindenter(4).reindent(List.of(
                "if (a) {",
                "for (i in x) {",
                "print(i)",
                "}",
                "}"));

        assertThat(out).containsExactly(
                "if (a) {",
                "    for (i in x) {",
                "        print(i)",
                "    }",
                "}");
    }

    @Test
    void argumentsContinueInsideTheOpenParenthesis() {
        List<String> out = new Reindenter(4).reindent(List.of(
                "result <- c(alpha,",
                "beta)"));

        assertThat(out).containsExactly("result <- c(alpha,", "    beta)");
    }

    @Test
    void lineAfterATrailingOperatorIsAContinuation() {
        List<String> out = new Reindenter(4).reindent(List.of("x <- a +", "b", "y"));

        assertThat(out).containsExactly("x <- a +", "    b", "y");
    }

    @Test
    void closingBraceFollowedByElse() {
        List<String> out = new Reindenter(2).reindent(List.of(
                "if (a) {",
                "b",
                "} else {",
                "c",
                "}"));

        assertThat(out).containsExactly("if (a) {", "  b", "} else {", "  c", "}");
    }

    @Test
    void commentsAndBracketsInStringsAreIgnored() {
        List<String> out = new Reindenter(4).reindent(List.of(
                "f <- function() {",
                "x <- \"{ # not code\"  # {",
                "}"));

        assertThat(out).containsExactly(
                "f <- function() {",
                "    x <- \"{ # not code\"  # {",
                "}");
    }

    @Test
    void linesInsideAMultiLineStringAreKept() {
        List<String> out = new Reindenter(4).reindent(List.of(
                "{",
                "x <- \"first",
                "   second\"",
                "y",
                "}"));

        assertThat(out).containsExactly("{", "    x <- \"first", "   second\"", "    y", "}");
    }

    @Test
    void blankLinesBecomeEmpty() {
        assertThat(new Reindenter(4).reindent(List.of("x", "   ", "y"))).containsExactly("x", "", "y");
    }
}
