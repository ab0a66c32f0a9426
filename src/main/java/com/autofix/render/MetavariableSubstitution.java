package com.autofix.render;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.nodeTypes.NodeWithArguments;
import com.github.javaparser.ast.nodeTypes.NodeWithStatements;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.google.common.base.Preconditions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the fixed tree of a rule: a copy of the fix pattern with every
 * metavariable replaced by a copy of what it was bound to.
 * <p>
 * {@code $X} may stand for an expression, for a whole statement
 * ({@code $X;}) or for a name ({@code $F(1)}). {@code $...X} must sit in a list,
 * call arguments, array initializer values or block statements, and is replaced
 * by each bound element in order. Copies keep comments and token ranges of the nodes they come from.
 */
public final class MetavariableSubstitution {

    private static final Logger logger = LogManager.getLogger(MetavariableSubstitution.class);

    /** A metavariable that cannot be substituted. Caught in {@link #apply}. */
    private static final class Unresolvable extends Exception {
        Unresolvable(String message) {
            super(message, null, false, false);
        }
    }

    private MetavariableSubstitution() {
    }

    /**
     * Returns the fixed tree, or empty when the pattern uses a metavariable that is
     * unbound or whose value does not fit where it is used.
     */
    public static Optional<Node> apply(FixPattern pattern, Map<String, MetavariableValue> bindings) {
        Preconditions.checkNotNull(pattern, "pattern");
        Preconditions.checkNotNull(bindings, "bindings");
        Node root = pattern.getAst().clone();
        try {
            for (Node placeholder : placeholders(root)) {
                root = substitute(root, placeholder, bindings);
            }
        } catch (Unresolvable e) {
            logger.debug("Cannot substitute into fix pattern '{}': {}", pattern.getText(), e.getMessage());
            return Optional.empty();
        }
        return Optional.of(root);
    }

    private static List<Node> placeholders(Node root) {
        List<Node> found = new ArrayList<>();
        root.walk(node -> {
            if (node instanceof NameExpr) {
                if (Metavariables.isMetavariableIdentifier(((NameExpr) node).getNameAsString()))
                    found.add(node);
            } else if (node instanceof SimpleName && !(node.getParentNode().orElse(null) instanceof NameExpr)) {
                if (Metavariables.isMetavariableIdentifier(((SimpleName) node).getIdentifier()))
                    found.add(node);
            }
        });
        return found;
    }

    private static Node substitute(Node root, Node placeholder, Map<String, MetavariableValue> bindings)
            throws Unresolvable {
        String identifier = placeholder instanceof NameExpr
                ? ((NameExpr) placeholder).getNameAsString()
                : ((SimpleName) placeholder).getIdentifier();
        String name = Metavariables.bindingName(identifier);
        MetavariableValue value = bindings.get(name);
        if (value == null)
            throw new Unresolvable(name + " is not bound");

        if (Metavariables.isPlaceholder(identifier)) {
            if (!value.isSequence())
                throw new Unresolvable(name + " is bound to a single node, not a sequence");
            splice(placeholder, value.getNodes(), name);
            return root;
        }
        if (value.isSequence())
            throw new Unresolvable(name + " is bound to a sequence, use $..." + name.substring(1));

        Node bound = value.getNode();
        if (placeholder instanceof SimpleName)
            return replace(root, placeholder, nameOf(bound, name));

        Optional<Node> parent = placeholder.getParentNode();
        if (bound instanceof Statement && parent.isPresent() && parent.get() instanceof ExpressionStmt)
            return replace(root, parent.get(), bound.clone());
        if (!(bound instanceof Expression))
            throw new Unresolvable(name + " is bound to a " + bound.getClass().getSimpleName()
                    + " but used as an expression");
        return replace(root, placeholder, bound.clone());
    }

    private static SimpleName nameOf(Node bound, String name) throws Unresolvable {
        if (bound instanceof SimpleName)
            return ((SimpleName) bound).clone();
        if (bound instanceof NameExpr)
            return ((NameExpr) bound).getName().clone();
        throw new Unresolvable(name + " is bound to a " + bound.getClass().getSimpleName() + " but used as a name");
    }

    private static Node replace(Node root, Node old, Node replacement) throws Unresolvable {
        if (old == root)
            return replacement;
        if (!old.replace(replacement))
            throw new Unresolvable("cannot put a " + replacement.getClass().getSimpleName()
                    + " in place of " + old);
        return root;
    }

    private static void splice(Node placeholder, List<Node> elements, String name) throws Unresolvable {
        Node parent = placeholder.getParentNode().orElse(null);
        if (parent instanceof ExpressionStmt) {
            Node owner = parent.getParentNode().orElse(null);
            if (!(owner instanceof NodeWithStatements))
                throw new Unresolvable(name + " is not used in a statement list");
            List<Statement> copies = new ArrayList<>();
            for (Node element : elements) {
                if (element instanceof Expression)
                    copies.add(new ExpressionStmt(((Expression) element).clone()));
                else if (element instanceof Statement)
                    copies.add(((Statement) element).clone());
                else
                    throw doesNotFit(name, element);
            }
            replaceSlot(((NodeWithStatements<?>) owner).getStatements(), parent, copies, name);
            return;
        }

        NodeList<Expression> list;
        if (parent instanceof NodeWithArguments)
            list = ((NodeWithArguments<?>) parent).getArguments();
        else if (parent instanceof ArrayInitializerExpr)
            list = ((ArrayInitializerExpr) parent).getValues();
        else
            throw new Unresolvable(name + " is not used in a list");
        List<Expression> copies = new ArrayList<>();
        for (Node element : elements) {
            if (!(element instanceof Expression))
                throw doesNotFit(name, element);
            copies.add(((Expression) element).clone());
        }
        replaceSlot(list, placeholder, copies, name);
    }

    private static Unresolvable doesNotFit(String name, Node element) {
        return new Unresolvable(name + " contains a " + element.getClass().getSimpleName()
                + " which does not fit its list");
    }

    private static <T extends Node> void replaceSlot(NodeList<T> list, Node slot, List<T> copies, String name)
            throws Unresolvable {
        int index = indexOf(list, slot);
        if (index < 0)
            throw new Unresolvable(name + " is not an element of its list");
        list.remove(index);
        for (int i = 0; i < copies.size(); i++) {
            list.add(index + i, copies.get(i));
        }
    }

    // NodeList.indexOf compares structurally; the slot has to be found by identity
    private static int indexOf(NodeList<?> list, Node node) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == node)
                return i;
        }
        return -1;
    }
}
