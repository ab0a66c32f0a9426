package com.autofix.render;

import com.autofix.render.printer.StructuralPrinter;
import com.autofix.render.printer.StructuralPrinterRegistry;
import com.github.javaparser.ast.Node;
import com.google.common.base.Preconditions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Renders the fixed tree of an autofix back to source text.
 * <p>
 * Nodes lifted unchanged from the target file or from the fix pattern are
 * printed from their original text, so formatting and comments survive and the
 * resulting diff stays minimal. Only new or restructured nodes are synthesized by
 * the language's structural printer.
 * <p>
 * Every call builds its own provenance table and target buffer, so one renderer
 * may serve concurrent calls.
 */
public class FixRenderer {

    private static final Logger logger = LogManager.getLogger(FixRenderer.class);

    private final StructuralPrinterRegistry registry;

    public FixRenderer() {
        this(StructuralPrinterRegistry.defaults());
    }

    public FixRenderer(StructuralPrinterRegistry registry) {
        this.registry = Preconditions.checkNotNull(registry, "registry");
    }

    /**
     * Substitutes the bindings into the fix pattern and renders the result.
     *
     * @param language       language of the target file
     * @param bindings       metavariable bindings of the match, by metavariable name
     * @param targetContents loader of the full target file, called at most once
     * @param fixPattern     the rule's replacement snippet
     * @return the replacement text, or why there is none
     */
    public RenderResult renderFix(Language language,
            Map<String, MetavariableValue> bindings,
            Supplier<String> targetContents,
            FixPattern fixPattern) {
        Optional<Node> fixedTree = MetavariableSubstitution.apply(fixPattern, bindings);
        if (fixedTree.isEmpty()) {
            logger.info("Failed to render autofix: could not substitute metavariables into '{}'", fixPattern.getText());
            return RenderResult.failure(FailureReason.SUBSTITUTION_FAILED,
                    "could not substitute metavariables into fix pattern");
        }
        return render(language, bindings, targetContents, fixPattern, fixedTree.get());
    }

    public RenderResult render(Language language,
            Map<String, MetavariableValue> bindings,
            Supplier<String> targetContents,
            FixPattern fixPattern,
            Node fixedTree) {
        Preconditions.checkNotNull(fixPattern, "fixPattern");
        return render(language, bindings, targetContents, fixPattern.getAst(), fixPattern.getText(), fixedTree);
    }

    /**
     * Renders {@code fixedTree}, reusing the original text of every node that came
     * unchanged from a binding or from the fix pattern.
     *
     * @param language        language of the target file; selects the printer
     * @param bindings        metavariable bindings of the match, by metavariable name
     * @param targetContents  loader of the full target file, called at most once
     * @param fixPatternAst   the parsed fix pattern
     * @param fixPatternText  the source text {@code fixPatternAst} was parsed from
     * @param fixedTree       the fix pattern with bindings substituted
     * @return the replacement text, or {@link FailureReason#UNSUPPORTED_LANGUAGE} /
     *         {@link FailureReason#PRINTER_FAILED}
     */
    public RenderResult render(Language language,
            Map<String, MetavariableValue> bindings,
            Supplier<String> targetContents,
            Node fixPatternAst,
            String fixPatternText,
            Node fixedTree) {
        Preconditions.checkNotNull(language, "language");
        Preconditions.checkNotNull(targetContents, "targetContents");
        Preconditions.checkNotNull(fixPatternText, "fixPatternText");
        Preconditions.checkNotNull(fixedTree, "fixedTree");

        PrintHook hook = makeHook(bindings, targetContents, fixPatternAst, fixPatternText);
        Optional<StructuralPrinter> printer = registry.printerFor(language, hook);
        if (printer.isEmpty()) {
            logger.info("Failed to render autofix: no printer available for {}", language);
            return RenderResult.failure(FailureReason.UNSUPPORTED_LANGUAGE,
                    "unsupported language for rendering: " + language);
        }

        Optional<String> text = printer.get().print(fixedTree);
        if (text.isEmpty()) {
            logger.info("Failed to render autofix: could not print AST");
            return RenderResult.failure(FailureReason.PRINTER_FAILED, "printer could not render the tree");
        }
        return RenderResult.success(text.get());
    }

    static PrintHook makeHook(Map<String, MetavariableValue> bindings,
            Supplier<String> targetContents,
            Node fixPatternAst,
            String fixPatternText) {
        ProvenanceTable table = ProvenanceTable.build(bindings, fixPatternAst);
        VerbatimExtractor extractor = new VerbatimExtractor(
                SourceBuffer.lazy(targetContents), SourceBuffer.of(fixPatternText));
        return new HybridPrintHook(table, extractor);
    }
}
