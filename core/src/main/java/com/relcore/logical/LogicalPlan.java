package com.relcore.logical;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relcore.analysis.Resolver;
import com.relcore.exception.AnalysisException;
import com.relcore.expression.AttributeReference;
import com.relcore.expression.AttributeSet;
import com.relcore.expression.Expression;
import com.relcore.expression.Expressions;
import com.relcore.trees.TreeNode;
import com.relcore.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Base class for all logical plan nodes.
 *
 * <p>A logical plan describes <em>what</em> relational result is wanted,
 * independently of how it will be executed. Each node has zero or more children
 * and exposes its output as a list of {@link AttributeReference}s.
 *
 * <p>Plans are immutable. Structural equivalence, used to match cached data,
 * is defined by {@link #sameResult(LogicalPlan)}.
 *
 * @see com.relcore.session.QueryExecution
 */
public abstract class LogicalPlan extends TreeNode<LogicalPlan> {

    /**
     * Creates a logical plan node with no children.
     */
    protected LogicalPlan() {
        super();
    }

    /**
     * Creates a logical plan node with a single child.
     *
     * @param child the child node
     */
    protected LogicalPlan(LogicalPlan child) {
        super(child);
    }

    /**
     * Creates a logical plan node with multiple children.
     *
     * @param children the child nodes
     */
    protected LogicalPlan(List<LogicalPlan> children) {
        super(children);
    }

    /**
     * Returns the attributes produced by this node.
     *
     * @return the output attributes
     */
    public abstract List<AttributeReference> output();

    /**
     * Returns the non-child constructor arguments of this node, compared (after
     * canonicalisation) by {@link #sameResult(LogicalPlan)}.
     *
     * @return the arguments
     */
    protected abstract List<Object> args();

    /**
     * Returns the expressions held directly by this node.
     *
     * @return the expressions, empty for nodes without expressions
     */
    public List<Expression> expressions() {
        return Collections.emptyList();
    }

    /**
     * Applies {@code f} to each expression held directly by this node.
     *
     * @param f the expression mapping
     * @return this node if no expression changed, otherwise a copy
     */
    public LogicalPlan mapExpressions(UnaryOperator<Expression> f) {
        return this;
    }

    /**
     * Applies an expression rule bottom-up to every expression of this node only.
     *
     * @param rule the expression rule
     * @return the transformed node
     */
    public LogicalPlan transformExpressionsUp(UnaryOperator<Expression> rule) {
        return mapExpressions(e -> e.transformUp(rule));
    }

    /**
     * Applies an expression rule to every expression of every node of the tree.
     *
     * @param rule the expression rule
     * @return the transformed tree
     */
    public LogicalPlan transformAllExpressions(UnaryOperator<Expression> rule) {
        return transformUp(plan -> plan.transformExpressionsUp(rule));
    }

    /**
     * Returns the output schema of this plan node.
     *
     * @return the output schema
     */
    public StructType schema() {
        return AttributeReference.toSchema(output());
    }

    /**
     * Returns the concatenated output of all children.
     *
     * @return the input attributes of this node
     */
    public List<AttributeReference> childrenOutput() {
        List<AttributeReference> input = new ArrayList<>();
        for (LogicalPlan child : children) {
            input.addAll(child.output());
        }
        return input;
    }

    /**
     * Returns the set of attributes available to this node's expressions.
     *
     * @return the input set
     */
    public AttributeSet inputSet() {
        return AttributeSet.fromAttributes(childrenOutput());
    }

    /**
     * Returns the attributes referenced by this node's expressions.
     *
     * @return the references
     */
    public AttributeSet references() {
        return AttributeSet.referencedBy(expressions());
    }

    /**
     * Returns whether this node and its whole subtree are resolved.
     *
     * @return true if every expression and child is resolved
     */
    public boolean resolved() {
        for (Expression expression : expressions()) {
            if (!expression.resolved()) {
                return false;
            }
        }
        return childrenResolved();
    }

    /**
     * Returns whether every child subtree is resolved.
     *
     * @return true if all children are resolved
     */
    public boolean childrenResolved() {
        for (LogicalPlan child : children) {
            if (!child.resolved()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Resolves a possibly qualified name against the output of the children.
     *
     * @param nameParts the name, split on dots
     * @param resolver the name matching policy
     * @return the matching attribute, or empty if none matches
     * @throws AnalysisException if more than one attribute matches
     */
    public Optional<AttributeReference> resolveChildren(List<String> nameParts, Resolver resolver) {
        return resolve(nameParts, childrenOutput(), resolver);
    }

    /**
     * Resolves a possibly qualified name against the output of this node.
     *
     * @param nameParts the name, split on dots
     * @param resolver the name matching policy
     * @return the matching attribute, or empty if none matches
     * @throws AnalysisException if more than one attribute matches
     */
    public Optional<AttributeReference> resolve(List<String> nameParts, Resolver resolver) {
        return resolve(nameParts, output(), resolver);
    }

    private static Optional<AttributeReference> resolve(List<String> nameParts,
                                                        List<AttributeReference> input,
                                                        Resolver resolver) {
        List<AttributeReference> candidates = new ArrayList<>();
        for (AttributeReference attribute : input) {
            if (matches(attribute, nameParts, resolver)) {
                candidates.add(attribute);
            }
        }
        if (candidates.size() > 1) {
            throw new AnalysisException("Reference '%s' is ambiguous, could be: %s".formatted(
                String.join(".", nameParts),
                candidates.stream().map(Object::toString).collect(Collectors.joining(", "))));
        }
        return candidates.stream().findFirst();
    }

    private static boolean matches(AttributeReference attribute, List<String> nameParts, Resolver resolver) {
        if (nameParts.size() == 1) {
            return resolver.resolve(attribute.name(), nameParts.get(0));
        }
        if (nameParts.size() == 2 && resolver.resolve(attribute.name(), nameParts.get(1))) {
            for (String qualifier : attribute.qualifiers()) {
                if (resolver.resolve(qualifier, nameParts.get(0))) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Returns whether this plan computes the same result as {@code other}.
     *
     * <p>Two plans have the same result when they are built from the same operators,
     * with equal arguments once expression ids are factored out, over children
     * that themselves have the same result. Independently analyzed copies of the
     * same query therefore compare equal.
     *
     * @param other the plan to compare with
     * @return true if both plans produce the same rows
     */
    public boolean sameResult(LogicalPlan other) {
        if (other == this) {
            return true;
        }
        if (other.getClass() != getClass() || other.children.size() != children.size()) {
            return false;
        }
        if (!cleanArgs().equals(other.cleanArgs())) {
            return false;
        }
        for (int i = 0; i < children.size(); i++) {
            if (!children.get(i).sameResult(other.children.get(i))) {
                return false;
            }
        }
        return true;
    }

    private List<Object> cleanArgs() {
        List<AttributeReference> input = childrenOutput();
        List<Object> clean = new ArrayList<>();
        for (Object arg : args()) {
            clean.add(cleanArg(arg, input));
        }
        return clean;
    }

    private static Object cleanArg(Object arg, List<AttributeReference> input) {
        if (arg instanceof Expression) {
            return Expressions.canonicalize((Expression) arg, input);
        }
        if (arg instanceof List) {
            List<Object> cleaned = new ArrayList<>();
            for (Object element : (List<?>) arg) {
                cleaned.add(cleanArg(element, input));
            }
            return cleaned;
        }
        return arg;
    }

    /**
     * Maps every expression of a list, returning the original list if nothing changed.
     *
     * @param expressions the expressions
     * @param f the mapping
     * @param <E> the element type
     * @return the mapped list
     */
    @SuppressWarnings("unchecked")
    protected static <E extends Expression> List<E> mapAll(List<E> expressions, UnaryOperator<Expression> f) {
        boolean changed = false;
        List<E> mapped = new ArrayList<>(expressions.size());
        for (E expression : expressions) {
            Expression next = f.apply(expression);
            changed |= next != expression;
            mapped.add((E) next);
        }
        return changed ? mapped : expressions;
    }

    @Override
    protected void describeJson(ObjectNode node) {
        if (resolved()) {
            ArrayNode output = node.putArray("output");
            for (AttributeReference attribute : output()) {
                output.add(attribute.toString());
            }
        }
    }
}
