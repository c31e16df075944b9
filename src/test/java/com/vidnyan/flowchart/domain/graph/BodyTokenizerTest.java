package com.vidnyan.flowchart.domain.graph;

import com.vidnyan.flowchart.domain.graph.BodyToken.Type;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BodyTokenizerTest {

    private static List<Type> types(List<BodyToken> tokens) {
        return tokens.stream().map(BodyToken::type).toList();
    }

    @Test
    void tokenize_ShouldSplitOneLineBlocksAndElse() {
        List<BodyToken> tokens = new BodyTokenizer().tokenize("{\n  if (a) { x(); } else { y(); }\n}");

        assertEquals(List.of(Type.OPEN, Type.IF, Type.OPEN, Type.STATEMENT, Type.CLOSE,
                Type.ELSE, Type.OPEN, Type.STATEMENT, Type.CLOSE, Type.CLOSE), types(tokens));
        assertEquals("a", tokens.get(1).text());
        assertEquals("x();", tokens.get(3).text());
        assertEquals(2, tokens.get(1).line());
    }

    @Test
    void tokenize_ShouldExtractBalancedConditionAcrossLines() {
        List<BodyToken> tokens = new BodyTokenizer().tokenize(
                "{\n  if ((a > 0) &&\n      (b < 1))\n  {\n  }\n}");

        BodyToken condition = tokens.get(1);
        assertEquals(Type.IF, condition.type());
        assertEquals("(a > 0) && (b < 1)", condition.text().replaceAll("\\s+", " "));
        assertEquals(2, condition.line());
    }

    @Test
    void tokenize_ShouldSplitElseIfAndInlineBranchStatements() {
        List<BodyToken> tokens = new BodyTokenizer().tokenize("{\n  if (a) x = 1;\n  else if (b) y = 2;\n}");

        assertEquals(List.of(Type.OPEN, Type.IF, Type.STATEMENT, Type.ELSE, Type.IF, Type.STATEMENT, Type.CLOSE),
                types(tokens));
        assertEquals("x = 1;", tokens.get(2).text());
        assertEquals("b", tokens.get(4).text());
    }

    @Test
    void tokenize_ShouldSkipCommentsLiteralsAndDirectives() {
        String body = String.join("\n",
                "{",
                "  /* a { multi",
                "     line } comment */",
                "#define BLOCK(x) \\",
                "    { x; }",
                "#ifdef MODE_A",
                "  s = \"{\"; // }",
                "#endif",
                "}");

        List<BodyToken> tokens = new BodyTokenizer().tokenize(body);

        assertEquals(List.of(Type.OPEN, Type.STATEMENT, Type.CLOSE), types(tokens));
        assertEquals("s = \"{\";", tokens.get(1).text());
        assertEquals(7, tokens.get(1).line());
    }

    @Test
    void tokenize_ShouldKeepForHeaderTogether() {
        List<BodyToken> tokens = new BodyTokenizer().tokenize("{\n  for (i = 0; i < 4; i++)\n  {\n    x();\n  }\n}");

        assertEquals("for (i = 0; i < 4; i++)", tokens.get(1).text());
        assertEquals(Type.STATEMENT, tokens.get(1).type());
    }

    @Test
    void tokenize_ShouldUsePlaceholderForMissingCondition() {
        List<BodyToken> tokens = new BodyTokenizer().tokenize("{\n  if flag\n  {\n  }\n}");

        assertEquals(Type.IF, tokens.get(1).type());
        assertEquals(BodyTokenizer.PLACEHOLDER_CONDITION, tokens.get(1).text());
    }

    @Test
    void tokenize_ShouldNotTreatIdentifiersStartingWithKeywordsAsKeywords() {
        List<BodyToken> tokens = new BodyTokenizer().tokenize("{\n  if_count = 1;\n  elsewhere();\n}");

        assertEquals(List.of(Type.OPEN, Type.STATEMENT, Type.STATEMENT, Type.CLOSE), types(tokens));
    }
}
