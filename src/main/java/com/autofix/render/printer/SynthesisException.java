package com.autofix.render.printer;

import com.github.javaparser.ast.Node;

/**
 * Raised inside a structural printer when a node has to be synthesized but the
 * printer has no way to render it. Never escapes {@link StructuralPrinter#print}.
 */
public class SynthesisException extends RuntimeException {

    private final transient Node node;

    public SynthesisException(String message, Node node) {
        super(message);
        this.node = node;
    }

    public Node getNode() {
        return node;
    }
}
