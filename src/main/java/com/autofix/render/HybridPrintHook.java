package com.autofix.render;

import com.github.javaparser.ast.Node;
import com.google.common.base.Preconditions;

import java.util.Optional;

/**
 * Substitutes the original text of every node that the provenance table knows
 * and whose text can still be located. Anything else is left to the printer.
 */
public class HybridPrintHook implements PrintHook {

    private final ProvenanceTable table;
    private final VerbatimExtractor extractor;

    public HybridPrintHook(ProvenanceTable table, VerbatimExtractor extractor) {
        this.table = Preconditions.checkNotNull(table, "table");
        this.extractor = Preconditions.checkNotNull(extractor, "extractor");
    }

    @Override
    public Optional<String> substitute(Node node) {
        return table.lookup(node)
                .flatMap(entry -> extractor.extract(entry.getOrigin(), entry.getProvenance()));
    }
}
