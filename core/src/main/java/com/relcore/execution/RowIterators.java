package com.relcore.execution;

import com.relcore.expression.AttributeReference;
import com.relcore.expression.Expression;
import com.relcore.expression.Expressions;
import com.relcore.row.Row;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy transformations of row iterators shared by the physical operators.
 */
public final class RowIterators {

    private RowIterators() {}

    public static Stream<Row> stream(Iterator<Row> rows) {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(rows, Spliterator.ORDERED), false);
    }

    public static Iterator<Row> filter(Iterator<Row> rows, Predicate<Row> predicate) {
        return stream(rows).filter(predicate).iterator();
    }

    public static Iterator<Row> map(Iterator<Row> rows, Function<Row, Row> f) {
        return stream(rows).map(f).iterator();
    }

    public static Iterator<Row> limit(Iterator<Row> rows, int limit) {
        return stream(rows).limit(limit).iterator();
    }

    /**
     * Applies {@code f} to every partition.
     *
     * @param partitions the partitions
     * @param f the per-partition transformation
     * @return the transformed partitions
     */
    public static List<Iterator<Row>> mapPartitions(List<Iterator<Row>> partitions,
                                                    Function<Iterator<Row>, Iterator<Row>> f) {
        List<Iterator<Row>> result = new ArrayList<>(partitions.size());
        for (Iterator<Row> partition : partitions) {
            result.add(f.apply(partition));
        }
        return result;
    }

    /**
     * Drains every partition into one list.
     *
     * @param partitions the partitions
     * @return all rows, partition by partition
     */
    public static List<Row> collect(List<Iterator<Row>> partitions) {
        List<Row> rows = new ArrayList<>();
        for (Iterator<Row> partition : partitions) {
            partition.forEachRemaining(rows::add);
        }
        return rows;
    }

    /**
     * Returns a predicate evaluating {@code condition} against rows of {@code input}.
     * Rows for which the condition is null or false are rejected.
     *
     * @param condition the boolean condition
     * @param input the attributes of the rows
     * @return the predicate
     */
    public static Predicate<Row> predicate(Expression condition, List<AttributeReference> input) {
        Expression bound = Expressions.bindReference(condition, input);
        return row -> Boolean.TRUE.equals(bound.eval(row));
    }

    /**
     * Returns a function evaluating {@code expressions} against rows of {@code input}.
     *
     * @param expressions the expressions producing the output values
     * @param input the attributes of the rows
     * @return the projection
     */
    public static Function<Row, Row> projection(List<? extends Expression> expressions,
                                                List<AttributeReference> input) {
        List<? extends Expression> bound = Expressions.bindReferences(expressions, input);
        return row -> {
            Object[] values = new Object[bound.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = bound.get(i).eval(row);
            }
            return Row.of(values);
        };
    }

    /**
     * Returns a function selecting the given attributes from rows of {@code input}.
     *
     * @param attributes the attributes to keep, in output order
     * @param input the attributes of the rows
     * @return the projection
     */
    public static Function<Row, Row> columnPruning(List<AttributeReference> attributes,
                                                   List<AttributeReference> input) {
        int[] ordinals = new int[attributes.size()];
        for (int i = 0; i < ordinals.length; i++) {
            ordinals[i] = Expressions.indexOf(input, attributes.get(i));
            if (ordinals[i] < 0) {
                throw new IllegalStateException(
                    "Couldn't find %s in %s".formatted(attributes.get(i), input));
            }
        }
        return row -> {
            Object[] values = new Object[ordinals.length];
            for (int i = 0; i < ordinals.length; i++) {
                values[i] = row.get(ordinals[i]);
            }
            return Row.of(values);
        };
    }
}
