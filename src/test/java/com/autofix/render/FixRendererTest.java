package com.autofix.render;

import com.github.javaparser.JavaParser;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.UnparsableStmt;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class FixRendererTest {

    private final FixRenderer renderer = new FixRenderer();

    @Test
    void keepsTheCommentOfTheBoundExpression() throws Exception {
        // ── 1. Target `f($X, 5)` with $X matching a commented call
        String target = "f(/* keep */ a.b(), 5)";
        MethodCallExpr match = StaticJavaParser.parseExpression(target);
        Map<String, MetavariableValue> bindings = Map.of("$X", MetavariableValue.single(match.getArgument(0)));

        // ── 2. Render the fix `g($X)`
        RenderResult result = renderer.renderFix(Language.JAVA, bindings, () -> target, FixPattern.expression("g($X)"));

        assertTrue(result.isSuccess(), result.toString());
        assertEquals("g(/* keep */ a.b())", result.getText());
    }

    @Test
    void commentBeforeTheCommaBelongsToTheNextArgument() throws Exception {
        // JavaParser attaches `/* keep */` to `5`, so it is not part of the match
        String target = "f(a.b() /* keep */, 5)";
        MethodCallExpr match = StaticJavaParser.parseExpression(target);
        assertTrue(match.getArgument(0).getComment().isEmpty());
        assertTrue(match.getArgument(1).getComment().isPresent());
        Map<String, MetavariableValue> bindings = Map.of("$X", MetavariableValue.single(match.getArgument(0)));

        RenderResult result = renderer.renderFix(Language.JAVA, bindings, () -> target, FixPattern.expression("g($X)"));

        assertEquals("g(a.b())", result.getText());
    }

    @Test
    void keepsATrailingCommentOfABoundStatement() throws Exception {
        String target = String.join("\n",
                "class A { void m() {",
                "    a(); // note",
                "    b();",
                "} }");
        List<Statement> body = StaticJavaParser.parse(target).findFirst(BlockStmt.class).orElseThrow().getStatements();
        Map<String, MetavariableValue> bindings = Map.of("$...S", MetavariableValue.sequence(body));

        RenderResult result = renderer.renderFix(Language.JAVA, bindings, () -> target,
                FixPattern.block("{ $...S; done(); }"));

        assertEquals(String.join("\n",
                "{",
                "    a(); // note",
                "    b();",
                "    done();",
                "}"), result.getText().replace("\r\n", "\n"));
    }

    @Test
    void boundLocalRecordIsPrintedVerbatim() throws Exception {
        String target = String.join("\n",
                "class A { void m() {",
                "    record   P(int   x) {}",
                "} }");
        CompilationUnit cu = new JavaParser(FixPattern.defaultConfiguration()).parse(target).getResult().orElseThrow();
        LocalRecordDeclarationStmt record = cu.findFirst(LocalRecordDeclarationStmt.class).orElseThrow();
        Map<String, MetavariableValue> bindings = Map.of("$S", MetavariableValue.single(record));

        RenderResult result = renderer.renderFix(Language.JAVA, bindings, () -> target, FixPattern.block("{ $S; }"));

        assertEquals(String.join("\n",
                "{",
                "    record   P(int   x) {}",
                "}"), result.getText().replace("\r\n", "\n"));
    }

    @Test
    void reusesEachElementOfASequence() throws Exception {
        String target = "bar(1,\n    2)";
        MethodCallExpr match = StaticJavaParser.parseExpression(target);
        Map<String, MetavariableValue> bindings = Map.of("$...ARGS", MetavariableValue.sequence(match.getArguments()));

        RenderResult result = renderer.renderFix(Language.JAVA, bindings, () -> target,
                FixPattern.expression("foo($...ARGS)"));

        assertEquals("foo(1, 2)", result.getText());
    }

    @Test
    void sequenceElementsKeepTheirOwnFormatting() throws Exception {
        String target = "bar(first( 1 ),\n        second(  2  ))";
        MethodCallExpr match = StaticJavaParser.parseExpression(target);
        Map<String, MetavariableValue> bindings = Map.of("$...ARGS", MetavariableValue.sequence(match.getArguments()));

        RenderResult result = renderer.renderFix(Language.JAVA, bindings, () -> target,
                FixPattern.expression("foo($...ARGS,   3 )"));

        // elements verbatim, separators synthesized, `3` lifted from the pattern
        assertEquals("foo(first( 1 ), second(  2  ), 3)", result.getText());
    }

    @Test
    void unchangedFixPatternIsPrintedVerbatim() throws Exception {
        AtomicInteger reads = new AtomicInteger();
        Supplier<String> targetContents = () -> {
            reads.incrementAndGet();
            return "irrelevant";
        };
        FixPattern pattern = FixPattern.expression("log( \"unchanged\" )");

        RenderResult result = renderer.renderFix(Language.JAVA, Map.of(), targetContents, pattern);

        assertEquals("log( \"unchanged\" )", result.getText());
        assertEquals(0, reads.get(), "no target node was printed, so the target must not be read");
    }

    @Test
    void readsTheTargetAtMostOnce() throws Exception {
        String target = "use(alpha  , beta)";
        MethodCallExpr match = StaticJavaParser.parseExpression(target);
        AtomicInteger reads = new AtomicInteger();
        Supplier<String> targetContents = () -> {
            reads.incrementAndGet();
            return target;
        };
        Map<String, MetavariableValue> bindings = Map.of(
                "$A", MetavariableValue.single(match.getArgument(0)),
                "$B", MetavariableValue.single(match.getArgument(1)));

        RenderResult result = renderer.renderFix(Language.JAVA, bindings, targetContents,
                FixPattern.expression("swap($B, $A)"));

        assertEquals("swap(beta, alpha)", result.getText());
        assertEquals(1, reads.get());
    }

    @Test
    void rendersStatementFixes() throws Exception {
        String target = String.join("\n",
                "class A {",
                "  void m() {",
                "    Reader r = open( path );",
                "    r.read(buf,",
                "           0, n);",
                "  }",
                "}");
        CompilationUnit cu = StaticJavaParser.parse(target);
        List<Statement> body = cu.findFirst(BlockStmt.class).orElseThrow().getStatements();
        Map<String, MetavariableValue> bindings = Map.of(
                "$OPEN", MetavariableValue.single(body.get(0)),
                "$...USE", MetavariableValue.sequence(List.of(body.get(1))));
        FixPattern pattern = FixPattern.block(String.join("\n",
                "{",
                "    $OPEN;",
                "    try {",
                "        $...USE;",
                "    } finally {",
                "        r.close();",
                "    }",
                "}"));

        RenderResult result = renderer.renderFix(Language.JAVA, bindings, () -> target, pattern);

        assertEquals(String.join("\n",
                "{",
                "    Reader r = open( path );",
                "    try {",
                "        r.read(buf,",
                "           0, n);",
                "    } finally {",
                "        r.close();",
                "    }",
                "}"), result.getText().replace("\r\n", "\n"));
    }

    @Test
    void independentRendersRunInParallel() throws Exception {
        String target = "call(  value  )";
        MethodCallExpr match = StaticJavaParser.parseExpression(target);
        Map<String, MetavariableValue> bindings = Map.of("$V", MetavariableValue.single(match.getArgument(0)));
        FixPattern pattern = FixPattern.expression("wrap($V)");

        List<String> texts = IntStream.range(0, 64).parallel()
                .mapToObj(i -> renderer.renderFix(Language.JAVA, bindings, () -> target, pattern).getText())
                .collect(Collectors.toList());

        assertTrue(texts.stream().allMatch("wrap(value)"::equals), texts.toString());
    }

    @Test
    void unsupportedLanguageFailsTheSameWayEveryTime() throws Exception {
        FixPattern pattern = FixPattern.expression("g(1)");

        RenderResult first = renderer.renderFix(Language.PYTHON, Map.of(), () -> "", pattern);
        RenderResult second = renderer.renderFix(Language.PYTHON, Map.of(), () -> "", pattern);

        for (RenderResult result : List.of(first, second)) {
            assertFalse(result.isSuccess());
            assertEquals(FailureReason.UNSUPPORTED_LANGUAGE, result.getFailureReason().orElseThrow());
            assertTrue(result.toOptional().isEmpty());
            assertThrows(IllegalStateException.class, result::getText);
        }
        assertEquals(first.getMessage(), second.getMessage());
    }

    @Test
    void printerGapFailsTheRender() throws Exception {
        FixPattern pattern = FixPattern.block("{ done(); }");
        Node fixed = new BlockStmt(new NodeList<>(new UnparsableStmt()));

        RenderResult result = renderer.render(Language.JAVA, Map.of(), () -> "", pattern, fixed);

        assertEquals(FailureReason.PRINTER_FAILED, result.getFailureReason().orElseThrow());
    }

    @Test
    void unboundMetavariableFailsSubstitution() throws Exception {
        RenderResult result = renderer.renderFix(Language.JAVA, Map.of(), () -> "", FixPattern.expression("g($X)"));

        assertEquals(FailureReason.SUBSTITUTION_FAILED, result.getFailureReason().orElseThrow());
    }

    @Test
    void acceptsPatternTreeAndTextSeparately() throws Exception {
        String target = "f(x  *  y)";
        MethodCallExpr match = StaticJavaParser.parseExpression(target);
        FixPattern pattern = FixPattern.expression("Math.abs($E)");
        Map<String, MetavariableValue> bindings = Map.of("$E", MetavariableValue.single(match.getArgument(0)));
        Node fixed = MetavariableSubstitution.apply(pattern, bindings).orElseThrow();

        RenderResult result = renderer.render(Language.JAVA, bindings, () -> target,
                pattern.getAst(), pattern.getText(), fixed);

        assertEquals("Math.abs(x  *  y)", result.getText());
    }
}
