package com.relcore.trees;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Base class for immutable plan trees.
 *
 * <p>Both logical and physical plans extend this class. Transformations never
 * modify a node; they return a new tree, sharing every subtree the rule left
 * untouched. A rule signals "does not apply" by returning its argument, so
 * callers can detect that nothing changed by reference comparison.
 *
 * @param <T> the concrete tree type
 */
public abstract class TreeNode<T extends TreeNode<T>> {

    /** Child nodes in the plan tree */
    protected final List<T> children;

    /**
     * Creates a leaf node.
     */
    protected TreeNode() {
        this.children = Collections.emptyList();
    }

    /**
     * Creates a node with a single child.
     *
     * @param child the child node
     */
    protected TreeNode(T child) {
        this.children = Collections.singletonList(child);
    }

    /**
     * Creates a node with multiple children.
     *
     * @param children the child nodes
     */
    protected TreeNode(List<T> children) {
        this.children = List.copyOf(children);
    }

    /**
     * Returns the child nodes of this node.
     *
     * @return an unmodifiable list of children
     */
    public List<T> children() {
        return children;
    }

    /**
     * Returns a copy of this node with the given children.
     *
     * @param newChildren the replacement children, same arity as {@link #children()}
     * @return the copy
     */
    public abstract T withNewChildren(List<T> newChildren);

    /**
     * Returns the arguments of this node rendered for plan dumps.
     *
     * @return the argument string, possibly empty
     */
    public abstract String argString();

    @SuppressWarnings("unchecked")
    protected final T self() {
        return (T) this;
    }

    /**
     * Applies {@code f} to each child and rebuilds this node if any child changed.
     *
     * @param f the child mapping
     * @return this node, or a copy with new children
     */
    public T mapChildren(UnaryOperator<T> f) {
        if (children.isEmpty()) {
            return self();
        }
        boolean changed = false;
        List<T> mapped = new ArrayList<>(children.size());
        for (T child : children) {
            T next = f.apply(child);
            changed |= next != child;
            mapped.add(next);
        }
        return changed ? withNewChildren(mapped) : self();
    }

    /**
     * Applies {@code rule} to this node first (pre-order), then recursively to the
     * children of the result.
     *
     * @param rule returns its argument when it does not apply
     * @return the transformed tree
     */
    public T transformDown(UnaryOperator<T> rule) {
        T afterRule = rule.apply(self());
        return afterRule.mapChildren(child -> child.transformDown(rule));
    }

    /**
     * Applies {@code rule} to the children first (post-order), then to this node.
     *
     * @param rule returns its argument when it does not apply
     * @return the transformed tree
     */
    public T transformUp(UnaryOperator<T> rule) {
        T afterChildren = mapChildren(child -> child.transformUp(rule));
        return rule.apply(afterChildren);
    }

    /**
     * Runs {@code action} on every node of the tree, pre-order.
     *
     * @param action the action
     */
    public void foreach(Consumer<T> action) {
        action.accept(self());
        for (T child : children) {
            child.foreach(action);
        }
    }

    /**
     * Returns every node of the tree matching the predicate, pre-order.
     *
     * @param predicate the node filter
     * @return the matching nodes
     */
    public List<T> collect(Predicate<T> predicate) {
        List<T> result = new ArrayList<>();
        foreach(node -> {
            if (predicate.test(node)) {
                result.add(node);
            }
        });
        return result;
    }

    /**
     * Returns the first node (pre-order) matching the predicate.
     *
     * @param predicate the node filter
     * @return the node, if any
     */
    public Optional<T> find(Predicate<T> predicate) {
        if (predicate.test(self())) {
            return Optional.of(self());
        }
        for (T child : children) {
            Optional<T> found = child.find(predicate);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the name of this node in plan dumps.
     *
     * @return the node name
     */
    public String nodeName() {
        return getClass().getSimpleName();
    }

    /**
     * Returns a one-line description of this node.
     *
     * @return the node name followed by its arguments
     */
    public String simpleString() {
        String args = argString();
        return args.isEmpty() ? nodeName() : nodeName() + " " + args;
    }

    /**
     * Renders the whole tree, one node per line, children indented below their parent.
     *
     * @return the tree string
     */
    public String treeString() {
        StringBuilder sb = new StringBuilder();
        appendTree(sb, 0);
        return sb.toString();
    }

    private void appendTree(StringBuilder sb, int depth) {
        sb.append(" ".repeat(depth)).append(simpleString()).append('\n');
        for (T child : children) {
            ((TreeNode<T>) child).appendTree(sb, depth + 1);
        }
    }

    /**
     * Renders the tree as JSON: one object per node with its name, arguments and
     * children.
     *
     * @param mapper the mapper used to create nodes
     * @return the JSON tree
     */
    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        node.put("node", nodeName());
        node.put("args", argString());
        describeJson(node);
        ArrayNode childNodes = node.putArray("children");
        for (T child : children) {
            childNodes.add(child.toJson(mapper));
        }
        return node;
    }

    /**
     * Adds subclass-specific fields to this node's JSON rendering.
     *
     * @param node the JSON object for this node
     */
    protected void describeJson(ObjectNode node) {
    }

    @Override
    public String toString() {
        return treeString();
    }
}
