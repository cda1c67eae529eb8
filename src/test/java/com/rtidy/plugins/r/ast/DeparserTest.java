package com.rtidy.plugins.r.ast;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DeparserTest {

    private static String render(String source) {
        return render(source, 80);
    }

    private static String render(String source, int width) {
        return Deparser.render(RParser.parse(source).get(0), width);
    }

    @Test
    void spacesAroundBinaryOperators() {
        assertThat(render("x<-1+2*3")).isEqualTo("x <- 1 + 2 * 3");
        assertThat(render("y~x")).isEqualTo("y ~ x");
        assertThat(render("a%in%b")).isEqualTo("a %in% b");
        assertThat(render("(a+b)*c")).isEqualTo("(a + b) * c");
    }

    @Test
    void tightOperatorsStayTight() {
        assertThat(render("x ^ 2")).isEqualTo("x^2");
        assertThat(render("1 : 10")).isEqualTo("1:10");
        assertThat(render("a $ b")).isEqualTo("a$b");
        assertThat(render("base :: paste")).isEqualTo("base::paste");
    }

    @Test
    void unaryOperators() {
        assertThat(render("- x")).isEqualTo("-x");
        assertThat(render("! done")).isEqualTo("!done");
        assertThat(render("~ x")).isEqualTo("~x");
        assertThat(render("f( - 1 )")).isEqualTo("f(-1)");
    }

    @Test
    void literalsAreWrittenAsLexed() {
        assertThat(render("x <- 'a'")).isEqualTo("x <- 'a'");
        assertThat(render("x <- 1e-3L")).isEqualTo("x <- 1e-3L");
        assertThat(render("x <- r\"(a\\b)\"")).isEqualTo("x <- r\"(a\\b)\"");
    }

    @Test
    void argumentLists() {
        assertThat(render("f(x,y=2,,z)")).isEqualTo("f(x, y = 2, , z)");
        assertThat(render("x[,1]")).isEqualTo("x[, 1]");
        assertThat(render("x[[ 'a' ]]")).isEqualTo("x[['a']]");
        assertThat(render("alist(x=)")).isEqualTo("alist(x =)");
    }

    @Test
    void functionWithBlockBody() {
        assertThat(render("f=function(x,y=2){x+y}"))
                .isEqualTo("f = function(x, y = 2) {\n    x + y\n}");
    }

    @Test
    void nestedBlocksIndentOneLevelEach() {
        assertThat(render("f<-function(){for(i in 1:3){print(i)}}"))
                .isEqualTo("f <- function() {\n    for (i in 1:3) {\n        print(i)\n    }\n}");
    }

    @Test
    void controlFlow() {
        assertThat(render("if(a){b}else{c}")).isEqualTo("if (a) {\n    b\n} else {\n    c\n}");
        assertThat(render("if(a)b")).isEqualTo("if (a) b");
        assertThat(render("for(i in 1:10)print(i)")).isEqualTo("for (i in 1:10) print(i)");
        assertThat(render("while(TRUE)break")).isEqualTo("while (TRUE) break");
        assertThat(render("repeat{break}")).isEqualTo("repeat {\n    break\n}");
    }

    @Test
    void lambda() {
        assertThat(render("\\(x)x+1")).isEqualTo("\\(x) x + 1");
    }

    @Test
    void longArgumentListBreaksAfterAComma() {
        assertThat(render("f(aaaa, bbbb, cccc)", 10)).isEqualTo("f(aaaa, bbbb,\n    cccc)");
    }

    @Test
    void longExpressionBreaksAfterAnOperator() {
        assertThat(render("aaaa + bbbb + cccc", 10)).isEqualTo("aaaa + bbbb +\n    cccc");
    }

    @Test
    void assignmentsNeverBreak() {
        assertThat(render("longer_name <- value", 10)).isEqualTo("longer_name <- value");
    }

    @Test
    void breakInsideBlockKeepsBlockIndentation() {
        assertThat(render("{\n  f(aaaa, bbbb, cccc)\n}", 14))
                .isEqualTo("{\n    f(aaaa, bbbb,\n        cccc)\n}");
    }
}
