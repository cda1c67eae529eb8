package com.rtidy.plugins.r;

import com.rtidy.plugins.r.ast.Deparser;
import com.rtidy.plugins.r.ast.RNode;
import com.rtidy.plugins.r.ast.RParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AssignmentRewriterTest {

    private static String rewrite(String source) {
        RNode tree = RParser.parse(source).get(0);
        return Deparser.render(new AssignmentRewriter().rewrite(tree), 80);
    }

    @Test
    void equalsAssignmentBecomesArrow() {
        assertThat(rewrite("x = 1")).isEqualTo("x <- 1");
    }

    @Test
    void nestedAssignmentsAreRewritten() {
        assertThat(rewrite("f = function() {\n  y = 2\n}")).isEqualTo("f <- function() {\n    y <- 2\n}");
    }

    @Test
    void namedArgumentsAndDefaultsKeepEquals() {
        assertThat(rewrite("x = f(a = 1, b = function(k = 2) k)"))
                .isEqualTo("x <- f(a = 1, b = function(k = 2) k)");
    }

    @Test
    void otherOperatorsAreUntouched() {
        assertThat(rewrite("y == 2")).isEqualTo("y == 2");
        assertThat(rewrite("z <<- 3")).isEqualTo("z <<- 3");
    }

    @Test
    void treeWithoutAssignmentsRendersTheSame() {
        assertThat(rewrite("if (a) b else c")).isEqualTo("if (a) b else c");
    }
}
