package com.autofix.render;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.google.common.base.Equivalence;
import com.google.common.base.Preconditions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Records, for one fix attempt, which AST nodes were lifted unchanged from the
 * target file (through metavariable bindings) or from the rule's fix pattern.
 * <p>
 * Keys compare with {@link StructuralEquivalence}, so a node of the fixed tree
 * finds the entry of the node it was copied from. Nodes of the fix pattern are
 * all recorded, whether or not they survived substitution intact: a node that
 * was modified no longer compares equal and simply misses. Metavariable
 * placeholders and the nodes enclosing them are left out.
 * <p>
 * Sequence bindings are recorded element by element, one level deep. The
 * enclosing list never appears unchanged in a fixed tree, its elements do.
 */
public final class ProvenanceTable {

    private static final Logger logger = LogManager.getLogger(ProvenanceTable.class);

    /** A provenance together with the node it was recorded from. */
    public static final class Entry {
        private final NodeProvenance provenance;
        private final Node origin;

        Entry(NodeProvenance provenance, Node origin) {
            this.provenance = provenance;
            this.origin = origin;
        }

        public NodeProvenance getProvenance() {
            return provenance;
        }

        /** The recorded node, whose positions index the buffer of {@link #getProvenance()}. */
        public Node getOrigin() {
            return origin;
        }
    }

    private final Map<Equivalence.Wrapper<Node>, Entry> entries = new HashMap<>();

    private ProvenanceTable() {
    }

    /**
     * Builds the table: bindings first, then every node of the fix pattern that is
     * not already present. Binding entries are never overwritten by the pattern.
     */
    public static ProvenanceTable build(Map<String, MetavariableValue> bindings, Node fixPatternAst) {
        Preconditions.checkNotNull(bindings, "bindings");
        Preconditions.checkNotNull(fixPatternAst, "fixPatternAst");
        ProvenanceTable table = new ProvenanceTable();
        table.addBindings(bindings);
        table.addFixPattern(fixPatternAst);
        logger.debug("Provenance table holds {} node(s) for {} binding(s)", table.size(), bindings.size());
        return table;
    }

    private void addBindings(Map<String, MetavariableValue> bindings) {
        for (MetavariableValue value : bindings.values()) {
            // a single value contributes its node, a sequence each of its elements
            for (Node node : value.getNodes()) {
                entries.put(key(node), new Entry(NodeProvenance.TARGET, node));
            }
        }
    }

    private void addFixPattern(Node fixPatternAst) {
        Set<Node> enclosingPlaceholder = placeholdersAndAncestors(fixPatternAst);
        fixPatternAst.walk(node -> {
            if (!enclosingPlaceholder.contains(node))
                entries.putIfAbsent(key(node), new Entry(NodeProvenance.FIX_PATTERN, node));
        });
    }

    /*
     * Metavariable placeholders carry no reusable text, and neither does any node
     * around them: should one reach the printer unsubstituted it has to fail
     * synthesis instead of being copied back out of the pattern.
     */
    private static Set<Node> placeholdersAndAncestors(Node root) {
        Set<Node> marked = Collections.newSetFromMap(new IdentityHashMap<>());
        root.walk(node -> {
            if (!isPlaceholder(node))
                return;
            Node current = node;
            while (current != null && marked.add(current) && current != root) {
                current = current.getParentNode().orElse(null);
            }
        });
        return marked;
    }

    private static boolean isPlaceholder(Node node) {
        if (node instanceof NameExpr)
            return Metavariables.isMetavariableIdentifier(((NameExpr) node).getNameAsString());
        if (node instanceof SimpleName)
            return Metavariables.isMetavariableIdentifier(((SimpleName) node).getIdentifier());
        return false;
    }

    private static Equivalence.Wrapper<Node> key(Node node) {
        return StructuralEquivalence.instance().wrap(node);
    }

    public Optional<Entry> lookup(Node node) {
        return Optional.ofNullable(entries.get(key(node)));
    }

    public Optional<NodeProvenance> provenanceOf(Node node) {
        return lookup(node).map(Entry::getProvenance);
    }

    public int size() {
        return entries.size();
    }
}
