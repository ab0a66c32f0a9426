package com.autofix.render;

import com.github.javaparser.ast.Node;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The value a metavariable was bound to by the matcher: one node, or an ordered
 * sequence of nodes (e.g. the arguments captured by {@code $...ARGS}).
 * <p>
 * Sequences hold nodes only, so a sequence of sequences cannot be built.
 */
public final class MetavariableValue {

    private final ImmutableList<Node> nodes;
    private final boolean sequence;

    private MetavariableValue(ImmutableList<Node> nodes, boolean sequence) {
        this.nodes = nodes;
        this.sequence = sequence;
    }

    public static MetavariableValue single(Node node) {
        Preconditions.checkNotNull(node, "node");
        return new MetavariableValue(ImmutableList.of(node), false);
    }

    public static MetavariableValue sequence(List<? extends Node> nodes) {
        Preconditions.checkNotNull(nodes, "nodes");
        return new MetavariableValue(ImmutableList.copyOf(nodes), true);
    }

    public boolean isSequence() {
        return sequence;
    }

    /** The bound node of a single value. */
    public Node getNode() {
        Preconditions.checkState(!sequence, "sequence value has no single node");
        return nodes.get(0);
    }

    /** Every bound node, in match order. A single value yields a one-element list. */
    public List<Node> getNodes() {
        return nodes;
    }

    @Override
    public String toString() {
        return sequence ? nodes.toString() : nodes.get(0).toString();
    }
}
