package com.autofix.render.printer;

import com.github.javaparser.ast.Node;

import java.util.Optional;

/**
 * Renders a fixed tree to source text for one language.
 * <p>
 * Implementations consult their {@link com.autofix.render.PrintHook} before
 * every node: a substitute is emitted as-is and the node's children are not
 * visited; otherwise the node is synthesized and the same rule applies to each
 * child. Empty means some node could not be synthesized.
 */
public interface StructuralPrinter {

    Optional<String> print(Node root);
}
