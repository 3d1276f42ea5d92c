package com.relcore.execution.joins;

import com.relcore.execution.RowIterators;
import com.relcore.expression.AttributeReference;
import com.relcore.expression.Expression;
import com.relcore.logical.Join.JoinType;
import com.relcore.row.Row;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Output and condition helpers shared by the join operators.
 */
final class JoinOutput {

    private JoinOutput() {}

    static List<AttributeReference> of(List<AttributeReference> left, List<AttributeReference> right,
                                       JoinType joinType) {
        if (joinType == JoinType.LEFT_SEMI) {
            return left;
        }
        boolean leftNullable = joinType == JoinType.RIGHT || joinType == JoinType.FULL;
        boolean rightNullable = joinType == JoinType.LEFT || joinType == JoinType.FULL;
        List<AttributeReference> output = new ArrayList<>(left.size() + right.size());
        for (AttributeReference attribute : left) {
            output.add(leftNullable ? attribute.withNullability(true) : attribute);
        }
        for (AttributeReference attribute : right) {
            output.add(rightNullable ? attribute.withNullability(true) : attribute);
        }
        return output;
    }

    /**
     * Returns a predicate over joined rows (left values followed by right values).
     *
     * @param condition the condition, or null to accept every pair
     * @param left the left attributes
     * @param right the right attributes
     * @return the predicate
     */
    static Predicate<Row> residual(Expression condition, List<AttributeReference> left,
                                   List<AttributeReference> right) {
        if (condition == null) {
            return row -> true;
        }
        List<AttributeReference> input = new ArrayList<>(left);
        input.addAll(right);
        return RowIterators.predicate(condition, input);
    }
}
