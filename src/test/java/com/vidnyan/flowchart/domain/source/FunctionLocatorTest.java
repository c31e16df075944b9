package com.vidnyan.flowchart.domain.source;

import com.vidnyan.flowchart.domain.error.ErrorKind;
import com.vidnyan.flowchart.domain.error.FlowChartException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FunctionLocatorTest {

    private final FunctionLocator locator = new FunctionLocator();

    @Test
    void locate_ShouldCutFunctionFromNameToClosingBrace() {
        String source = "int x;\nvoid Foo(void)\n{\n  if (a) { b(); }\n}\nvoid Bar(void) { }\n";

        SourceFunction function = locator.locate(source, "Foo");

        assertEquals("Foo", function.name());
        assertEquals("Foo(void)\n{\n  if (a) { b(); }\n}", function.rawText());
        assertEquals(source.indexOf("Foo"), function.startOffset());
        assertEquals(source.indexOf("}\nvoid Bar") + 1, function.endOffset());
        assertEquals(2, function.startLine());
        assertTrue(function.startOffset() < function.endOffset());
    }

    @Test
    void locate_ShouldSkipPrototypesAndCalls() {
        String source = "void Foo(void);\nvoid Bar(void) { Foo(); }\nvoid Foo (uint8 a)\n{\n  a++;\n}\n";

        SourceFunction function = locator.locate(source, "Foo");

        assertTrue(function.rawText().startsWith("Foo (uint8 a)"));
        assertTrue(function.rawText().endsWith("a++;\n}"));
    }

    @Test
    void locate_ShouldNotMatchLongerNames() {
        String source = "void FooBar(void) { x(); }\nvoid Foo(void) { y(); }\n";

        SourceFunction function = locator.locate(source, "Foo");

        assertEquals("Foo(void) { y(); }", function.rawText());
    }

    @Test
    void locate_ShouldIgnoreBracesInCommentsAndLiterals() {
        String source = "void Foo(void)\n{\n  /* } */\n  // }\n  s = \"}\";\n  c = '}';\n}\n";

        SourceFunction function = locator.locate(source, "Foo");

        assertTrue(function.rawText().endsWith("c = '}';\n}"));
    }

    @Test
    void locate_ShouldReportNotFoundWithPattern() {
        FlowChartException e = assertThrows(FlowChartException.class,
                () -> locator.locate("void Bar(void) { }", "Foo"));

        assertEquals(ErrorKind.NOT_FOUND, e.kind());
        assertTrue(e.getMessage().contains("Foo"));
        assertTrue(e.getMessage().contains("Pattern used"));
    }

    @Test
    void locate_ShouldReportUnbalancedBraces() {
        FlowChartException e = assertThrows(FlowChartException.class,
                () -> locator.locate("void Foo(void)\n{\n  if (a) {\n    b();\n", "Foo"));

        assertEquals(ErrorKind.UNBALANCED_BRACES, e.kind());
        assertTrue(e.getMessage().contains("depth 2"));
    }
}
