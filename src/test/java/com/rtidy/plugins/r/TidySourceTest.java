package com.rtidy.plugins.r;

import com.rtidy.api.error.MaskingException;
import com.rtidy.api.error.ParseException;
import com.rtidy.config.TidyOptions;
import com.rtidy.plugins.r.ast.RAstEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TidySourceTest {

    private final TidySource tidySource = new TidySource();

    private String tidy(String source) {
        return tidy(source, TidyOptions.defaults());
    }

    private String tidy(String source, TidyOptions options) {
        return tidySource.tidy(source, options).getFormattedCode();
    }

    @Nested
    @DisplayName("comments and blank lines")
    class CommentsAndBlankLines {

        @Test
        void inlineCommentAndTrailingBlankLinesWithArrow() {
            TidyOptions options = TidyOptions.builder().arrow(true).build();

            assertThat(tidy("x=1 # set x\ny=2\n\n\n", options)).isEqualTo("x <- 1  # set x\ny <- 2\n\n\n");
        }

        @Test
        void loneCommentIsKept() {
            assertThat(tidy("# just a comment\n")).isEqualTo("# just a comment\n");
        }

        @Test
        void commentBetweenBraceAndElseFollowsTheElse() {
            String source = "if (x) {\n  a\n} # comment\nelse {\n  b\n}\n";

            assertThat(tidy(source)).isEqualTo("if (x) {\n    a\n} else {  # comment\n    b\n}\n");
        }

        @Test
        void commentOnItsOwnLineBeforeElse() {
            String source = "if (x) {\n  a\n}\n# comment\nelse {\n  b\n}\n";

            assertThat(tidy(source)).isEqualTo("if (x) {\n    a\n} else {  # comment\n    b\n}\n");
        }

        @Test
        void commentsInsideAFunction() {
            String source = "f=function(x,y=2){\n# add\nx+y # sum\n}\n";

            assertThat(tidy(source)).isEqualTo("f = function(x, y = 2) {\n    # add\n    x + y  # sum\n}\n");
        }

        @Test
        void commentAfterAnArgument() {
            assertThat(tidy("f(a, # first\nb)\n")).isEqualTo("f(a,  # first\n    b)\n");
        }

        @Test
        void commentAfterOpeningBrace() {
            assertThat(tidy("g <- function() { # nothing\n1\n}\n"))
                    .isEqualTo("g <- function() {  # nothing\n    1\n}\n");
        }

        @Test
        void commentsDroppedWhenNotKept() {
            TidyOptions options = TidyOptions.builder().comment(false).build();

            assertThat(tidy("# header\nx <- 1 # c\n", options)).isEqualTo("x <- 1\n");
        }

        @Test
        void interiorBlankLineIsKept() {
            assertThat(tidy("x <- 1\n\ny <- 2\n")).isEqualTo("x <- 1\n\ny <- 2\n");
        }

        @Test
        void blankLinesDroppedWhenNotKept() {
            TidyOptions options = TidyOptions.builder().blank(false).build();

            assertThat(tidy("\nx <- 1\n\ny <- 2\n\n", options)).isEqualTo("x <- 1\ny <- 2\n");
        }

        @Test
        void leadingBlankLinesAreKept() {
            assertThat(tidy("\n\nx<-1\n")).isEqualTo("\n\nx <- 1\n");
        }
    }

    @Nested
    @DisplayName("layout options")
    class LayoutOptions {

        @Test
        void indentWidth() {
            TidyOptions options = TidyOptions.builder().indent(2).build();

            assertThat(tidy("f <- function(x) {\nx\n}\n", options)).isEqualTo("f <- function(x) {\n  x\n}\n");
        }

        @Test
        void braceOnItsOwnLine() {
            TidyOptions options = TidyOptions.builder().braceNewline(true).build();

            assertThat(tidy("if (a) {\nb\n}\n", options)).isEqualTo("if (a)\n{\n    b\n}\n");
        }

        @Test
        void longCallIsWrapped() {
            TidyOptions options = TidyOptions.builder().widthCutoff(30).build();

            assertThat(tidy("result <- c(alpha, beta, gamma, delta)\n", options))
                    .isEqualTo("result <- c(alpha, beta, gamma,\n    delta)\n");
        }

        @Test
        void arrowLeavesNamedArgumentsAlone() {
            TidyOptions options = TidyOptions.builder().arrow(true).build();

            assertThat(tidy("x = list(a = 1)\n", options)).isEqualTo("x <- list(a = 1)\n");
        }
    }

    @Nested
    @DisplayName("code without comments")
    class CodeWithoutComments {

        private final RAstEngine engine = new RAstEngine();

        @ParameterizedTest
        @ValueSource(strings = {
                "x<-1+2*3\ny=c(1,2)",
                "f=function(x,y=2){if(x>y){x}else{y}}\nz<-f(1,\n2)",
                "for(i in 1:10){\nprint(i^2)\n}",
                "result <- c(alpha, beta, gamma, delta, epsilon, zeta, eta, theta, iota, kappa, lambda, mu, nu)",
                "msg <- \"if it fails\n  else it works\n# not a comment\n{ brace\"\nprint(msg)"
        })
        void tidyEqualsTheRenderedParse(String source) {
            String rendered = engine.parse(source).stream()
                    .map(tree -> engine.render(tree, 80))
                    .collect(Collectors.joining("\n"));

            assertThat(tidy(source + "\n")).isEqualTo(rendered + "\n");
        }

        @Test
        void multiLineStringIsLeftAsWritten() {
            String source = "msg <- \"if it fails\n  else it works\n# not a comment\n{ brace\"\nprint(msg)\n";

            assertThat(tidy(source)).isEqualTo(source);
            assertThat(tidy(source, TidyOptions.builder().braceNewline(true).arrow(true).build())).isEqualTo(source);
        }

        @Test
        void multiLineStringNextToAnIfElse() {
            String source = "if (ok) {\n  x <- 'done\n  else later'\n} else {\n  x <- 'no'\n}\n";

            assertThat(tidy(source)).isEqualTo("if (ok) {\n    x <- 'done\n  else later'\n} else {\n    x <- 'no'\n}\n");
        }
    }

    @Test
    void tidyingTwiceChangesNothing() {
        String source = "f=function(x,y=2){\n# add\nif(x>y){x}else{y} # larger\n}\n\n\nz<-f(1,\n2)\n";
        String once = tidy(source);

        assertThat(tidy(once)).isEqualTo(once);
    }

    @Test
    void carriageReturnsAreNormalized() {
        assertThat(tidy("x<-1\r\ny<-2\r\n")).isEqualTo("x <- 1\ny <- 2\n");
    }

    @Test
    void blankSourceIsReturnedAsIs() {
        assertThat(tidy("\n\n")).isEqualTo("\n\n");
        assertThat(tidy("")).isEmpty();
    }

    @Test
    void maskedTextIsExposed() {
        TidyResult result = tidySource.tidy("x <- 1 # c\n", TidyOptions.defaults());

        assertThat(result.getTextMask()).containsExactly("x <- 1 " + Placeholders.INLINE_MARKER + " \"# c\"");
        assertThat(result.getTextTidy()).containsExactly("x <- 1  # c");
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void placeholderTextInCodeRaisesAWarning() {
        TidyResult result = tidySource.tidy("x <- \"" + Placeholders.BEGIN + "\"\n", TidyOptions.defaults());

        assertThat(result.getWarnings()).hasSize(1);
        assertThat(result.getFormattedCode()).isEqualTo("x <- \"" + Placeholders.BEGIN + "\"\n");
    }

    @Test
    void invalidCodeIsAParseError() {
        assertThatThrownBy(() -> tidy("x <- (1\n"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("line 1");
    }

    @Test
    void commentWithNoCodeAfterItFails() {
        assertThatThrownBy(() -> tidy("x <- # dangling\n")).isInstanceOf(MaskingException.class);
    }
}
