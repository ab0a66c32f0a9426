package com.autofix.render;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class VerbatimExtractorTest {

    private static final String TARGET = String.join("\n",
            "class A {",
            "  void m() {",
            "    call(  x ,",
            "          /* why */ y);",
            "  }",
            "}");

    private CompilationUnit cu;
    private VerbatimExtractor extractor;

    @BeforeEach
    void setup() {
        cu = StaticJavaParser.parse(TARGET);
        extractor = new VerbatimExtractor(SourceBuffer.of(TARGET), SourceBuffer.of("g($X)"));
    }

    @Test
    void keepsInternalWhitespaceAndComments() {
        MethodCallExpr call = cu.findFirst(MethodCallExpr.class).orElseThrow();

        Optional<String> text = extractor.extract(call, NodeProvenance.TARGET);

        assertEquals(Optional.of("call(  x ,\n          /* why */ y)"), text);
        assertTrue(TARGET.contains(text.get()), "slice must be a substring of the original buffer");
    }

    @Test
    void startsAtTheAttachedComment() {
        NameExpr y = cu.findFirst(NameExpr.class, n -> n.getNameAsString().equals("y")).orElseThrow();
        assertTrue(y.getComment().isPresent(), "fixture comment should attach to y");

        assertEquals(Optional.of("/* why */ y"), extractor.extract(y, NodeProvenance.TARGET));
    }

    @Test
    void endsAtATrailingComment() {
        String source = String.join("\n",
                "class B { void m() {",
                "    a(); // note",
                "    b();",
                "} }");
        ExpressionStmt a = StaticJavaParser.parse(source).findFirst(ExpressionStmt.class).orElseThrow();
        assertTrue(a.getComment().isPresent(), "fixture comment should attach to a();");
        VerbatimExtractor trailing = new VerbatimExtractor(SourceBuffer.of(source), SourceBuffer.of(""));

        assertEquals(Optional.of("a(); // note"), trailing.extract(a, NodeProvenance.TARGET));
    }

    @Test
    void readsTheBufferNamedByTheProvenance() {
        MethodCallExpr pattern = StaticJavaParser.parseExpression("g($X)");

        assertEquals(Optional.of("g($X)"), extractor.extract(pattern, NodeProvenance.FIX_PATTERN));
        assertEquals(Optional.of("class"), extractor.extract(pattern, NodeProvenance.TARGET),
                "same positions sliced from the target buffer");
    }

    @Test
    void nodeWithoutPositionIsUnavailable() {
        assertTrue(extractor.extract(new NameExpr("synthetic"), NodeProvenance.TARGET).isEmpty());
    }

    @Test
    void positionsBeyondTheBufferAreUnavailable() {
        MethodCallExpr call = cu.findFirst(MethodCallExpr.class).orElseThrow();
        VerbatimExtractor shortBuffers = new VerbatimExtractor(SourceBuffer.of("x"), SourceBuffer.of("y"));

        assertTrue(shortBuffers.extract(call, NodeProvenance.TARGET).isEmpty());
        assertTrue(shortBuffers.extract(call, NodeProvenance.FIX_PATTERN).isEmpty());
    }

    @Test
    void keepsCarriageReturnLineEndings() {
        String source = "foo(a,\r\n    b)";
        MethodCallExpr call = StaticJavaParser.parseExpression(source);
        VerbatimExtractor crlf = new VerbatimExtractor(SourceBuffer.of(source), SourceBuffer.of(""));

        assertEquals(Optional.of(source), crlf.extract(call, NodeProvenance.TARGET));
    }
}
