package com.autofix.render;

import com.github.javaparser.ast.Node;

import java.util.Optional;

/**
 * Consulted by a structural printer before it renders a node. A present result
 * is printed in place of the node and its children are not visited.
 */
@FunctionalInterface
public interface PrintHook {

    /** A hook that never substitutes anything. */
    PrintHook NONE = node -> Optional.empty();

    Optional<String> substitute(Node node);
}
