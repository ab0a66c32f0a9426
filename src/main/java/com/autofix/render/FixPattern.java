package com.autofix.render;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The replacement snippet of a rule: its text exactly as the rule author wrote
 * it, the tree parsed from that text, and the metavariables it references.
 * <p>
 * The text is the buffer verbatim slices of {@link NodeProvenance#FIX_PATTERN}
 * nodes are cut from.
 */
public final class FixPattern {

    private final String text;
    private final Node ast;
    private final ImmutableSet<String> metavariables;

    public FixPattern(String text, Node ast) {
        this.text = Preconditions.checkNotNull(text, "text");
        this.ast = Preconditions.checkNotNull(ast, "ast");
        this.metavariables = collectMetavariables(ast);
    }

    public static FixPattern expression(String text) throws FixPatternException {
        return expression(text, defaultConfiguration());
    }

    public static FixPattern expression(String text, ParserConfiguration configuration) throws FixPatternException {
        return parse(text, configuration, "expression", parser -> parser.parseExpression(parsable(text)));
    }

    public static FixPattern statement(String text) throws FixPatternException {
        return statement(text, defaultConfiguration());
    }

    public static FixPattern statement(String text, ParserConfiguration configuration) throws FixPatternException {
        return parse(text, configuration, "statement", parser -> parser.parseStatement(parsable(text)));
    }

    public static FixPattern block(String text) throws FixPatternException {
        return block(text, defaultConfiguration());
    }

    public static FixPattern block(String text, ParserConfiguration configuration) throws FixPatternException {
        return parse(text, configuration, "block", parser -> parser.parseBlock(parsable(text)));
    }

    public static ParserConfiguration defaultConfiguration() {
        return new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
    }

    private static String parsable(String text) {
        return Metavariables.toParsableText(Preconditions.checkNotNull(text, "text"));
    }

    private static FixPattern parse(String text,
            ParserConfiguration configuration,
            String kind,
            Function<JavaParser, ParseResult<? extends Node>> start) throws FixPatternException {
        ParseResult<? extends Node> result = start.apply(new JavaParser(configuration));
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems = result.getProblems().stream()
                    .map(Problem::getVerboseMessage)
                    .collect(Collectors.joining("; "));
            throw new FixPatternException("Fix pattern is not a valid Java " + kind + ": " + problems);
        }
        return new FixPattern(text, result.getResult().get());
    }

    private static ImmutableSet<String> collectMetavariables(Node ast) {
        ImmutableSet.Builder<String> names = ImmutableSet.builder();
        ast.walk(node -> {
            String identifier = null;
            if (node instanceof NameExpr)
                identifier = ((NameExpr) node).getNameAsString();
            else if (node instanceof SimpleName && !(node.getParentNode().orElse(null) instanceof NameExpr))
                identifier = ((SimpleName) node).getIdentifier();
            if (identifier != null && Metavariables.isMetavariableIdentifier(identifier))
                names.add(Metavariables.bindingName(identifier));
        });
        return names.build();
    }

    public String getText() {
        return text;
    }

    public Node getAst() {
        return ast;
    }

    /** Metavariable names as used in bindings, e.g. {@code $X} or {@code $...ARGS}. */
    public Set<String> getMetavariables() {
        return metavariables;
    }

    @Override
    public String toString() {
        return text;
    }
}
