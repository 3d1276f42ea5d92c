package com.relcore.expression;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An immutable set of attributes keyed by {@link ExprId}.
 *
 * <p>Membership ignores names, qualifiers and nullability: a requalified copy of
 * an attribute is the same member. Iteration follows insertion order.
 */
public final class AttributeSet implements Iterable<AttributeReference> {

    private static final AttributeSet EMPTY = new AttributeSet(Collections.emptyMap());

    private final Map<ExprId, AttributeReference> members;

    private AttributeSet(Map<ExprId, AttributeReference> members) {
        this.members = members;
    }

    public static AttributeSet empty() {
        return EMPTY;
    }

    /**
     * Creates a set from the given attributes.
     *
     * @param attributes the attributes
     * @return the set
     */
    public static AttributeSet of(AttributeReference... attributes) {
        return fromAttributes(List.of(attributes));
    }

    /**
     * Creates a set from the given attributes.
     *
     * @param attributes the attributes
     * @return the set
     */
    public static AttributeSet fromAttributes(Collection<AttributeReference> attributes) {
        Map<ExprId, AttributeReference> members = new LinkedHashMap<>();
        for (AttributeReference attribute : attributes) {
            members.putIfAbsent(attribute.exprId(), attribute);
        }
        return new AttributeSet(members);
    }

    /**
     * Creates the set of attributes referenced by any of the expressions.
     *
     * @param expressions the expressions
     * @return the referenced attributes
     */
    public static AttributeSet referencedBy(Collection<? extends Expression> expressions) {
        Map<ExprId, AttributeReference> members = new LinkedHashMap<>();
        for (Expression expression : expressions) {
            for (AttributeReference attribute : expression.references()) {
                members.putIfAbsent(attribute.exprId(), attribute);
            }
        }
        return new AttributeSet(members);
    }

    public boolean contains(AttributeReference attribute) {
        return members.containsKey(attribute.exprId());
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public int size() {
        return members.size();
    }

    /**
     * Returns whether every member of this set is also a member of {@code other}.
     *
     * @param other the candidate superset
     * @return true if this is a subset of other
     */
    public boolean subsetOf(AttributeSet other) {
        return other.members.keySet().containsAll(members.keySet());
    }

    /**
     * Returns the union of this set and {@code other}.
     *
     * @param other the set to add
     * @return the union
     */
    public AttributeSet union(AttributeSet other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        Map<ExprId, AttributeReference> merged = new LinkedHashMap<>(members);
        other.members.forEach(merged::putIfAbsent);
        return new AttributeSet(merged);
    }

    /**
     * Returns the members of this set not contained in {@code other}.
     *
     * @param other the set to remove
     * @return the difference
     */
    public AttributeSet minus(AttributeSet other) {
        Map<ExprId, AttributeReference> remaining = new LinkedHashMap<>(members);
        remaining.keySet().removeAll(other.members.keySet());
        return new AttributeSet(remaining);
    }

    /**
     * Returns the members of this set also contained in {@code other}.
     *
     * @param other the set to intersect with
     * @return the intersection
     */
    public AttributeSet intersect(AttributeSet other) {
        Map<ExprId, AttributeReference> common = new LinkedHashMap<>(members);
        common.keySet().retainAll(other.members.keySet());
        return new AttributeSet(common);
    }

    /**
     * Returns the members in insertion order.
     *
     * @return the attributes
     */
    public List<AttributeReference> toList() {
        return new ArrayList<>(members.values());
    }

    @Override
    public Iterator<AttributeReference> iterator() {
        return Collections.unmodifiableCollection(members.values()).iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeSet)) return false;
        return members.keySet().equals(((AttributeSet) o).members.keySet());
    }

    @Override
    public int hashCode() {
        return members.keySet().hashCode();
    }

    @Override
    public String toString() {
        return members.values().toString();
    }
}
