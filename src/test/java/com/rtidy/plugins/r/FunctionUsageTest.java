package com.rtidy.plugins.r;

import com.rtidy.api.error.TidyException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FunctionUsageTest {

    @Test
    void rendersParametersAndDefaults() {
        String source = "f <- function(x, y = 2, ...) {\n  x + y\n}\n";

        assertThat(FunctionUsage.usage(source, "f", 80)).isEqualTo("f(x, y = 2, ...)");
    }

    @Test
    void lastDefinitionWins() {
        String source = "g <- function(a) a\ng = function(b, c = \"z\") b\n";

        assertThat(FunctionUsage.usage(source, "g", 80)).isEqualTo("g(b, c = \"z\")");
    }

    @Test
    void quotedNameIsMatched() {
        assertThat(FunctionUsage.usage("\"h\" <- function() NULL\n", "h", 80)).isEqualTo("h()");
    }

    @Test
    void longSignatureIsWrapped() {
        String source = "plot_it <- function(data, x_column, y_column, colour = \"red\") NULL\n";

        assertThat(FunctionUsage.usage(source, "plot_it", 30))
                .isEqualTo("plot_it(data, x_column, y_column,\n    colour = \"red\")");
    }

    @Test
    void unknownFunctionIsAnError() {
        assertThatThrownBy(() -> FunctionUsage.usage("x <- 1\n", "f", 80))
                .isInstanceOf(TidyException.class)
                .hasMessageContaining("'f'");
    }

    @Test
    void nestedDefinitionsAreNotTopLevel() {
        assertThatThrownBy(() -> FunctionUsage.usage("outer <- function() {\n  inner <- function(a) a\n}\n", "inner", 80))
                .isInstanceOf(TidyException.class);
    }
}
