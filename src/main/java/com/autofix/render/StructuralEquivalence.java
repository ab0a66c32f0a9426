package com.autofix.render;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.visitor.EqualsVisitor;
import com.github.javaparser.ast.visitor.HashCodeVisitor;
import com.google.common.base.Equivalence;

/**
 * Compares AST nodes by shape only. Ranges and token ranges are ignored, so a
 * node cloned into the fixed tree still matches the node it was cloned from.
 * Attached and orphan comments are part of the shape.
 */
public final class StructuralEquivalence extends Equivalence<Node> {

    private static final StructuralEquivalence INSTANCE = new StructuralEquivalence();

    public static StructuralEquivalence instance() {
        return INSTANCE;
    }

    private StructuralEquivalence() {
    }

    @Override
    protected boolean doEquivalent(Node a, Node b) {
        return EqualsVisitor.equals(a, b);
    }

    @Override
    protected int doHash(Node node) {
        return HashCodeVisitor.hashCode(node);
    }
}
