package com.relcore.execution;

import com.relcore.expression.Expression;
import com.relcore.expression.SortOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * How the output rows of an operator are spread over partitions.
 */
public sealed interface Partitioning {

    /**
     * Returns the number of partitions, or 0 when it is not known before execution.
     *
     * @return the partition count
     */
    int numPartitions();

    /**
     * Returns whether rows partitioned this way meet the given requirement.
     *
     * @param required the required distribution
     * @return true if no redistribution is needed
     */
    boolean satisfies(Distribution required);

    /**
     * Returns whether partition {@code i} of this partitioning can be processed
     * together with partition {@code i} of {@code other}.
     *
     * @param other the partitioning of a sibling operator
     * @return true if both are co-partitioned
     */
    boolean compatibleWith(Partitioning other);

    /**
     * Partitioning about which nothing is known.
     *
     * @param numPartitions the partition count, 0 if unknown
     */
    record UnknownPartitioning(int numPartitions) implements Partitioning {

        @Override
        public boolean satisfies(Distribution required) {
            return required == Distribution.UnspecifiedDistribution.INSTANCE;
        }

        @Override
        public boolean compatibleWith(Partitioning other) {
            return false;
        }
    }

    /**
     * All rows are in one partition.
     */
    enum SinglePartition implements Partitioning {
        INSTANCE;

        @Override
        public int numPartitions() {
            return 1;
        }

        @Override
        public boolean satisfies(Distribution required) {
            return true;
        }

        @Override
        public boolean compatibleWith(Partitioning other) {
            return other == INSTANCE;
        }
    }

    /**
     * Rows are placed by the hash of the partitioning expressions.
     *
     * @param expressions the hashed expressions
     * @param numPartitions the partition count
     */
    record HashPartitioning(List<Expression> expressions, int numPartitions) implements Partitioning {

        public HashPartitioning {
            expressions = List.copyOf(expressions);
        }

        @Override
        public boolean satisfies(Distribution required) {
            if (required == Distribution.UnspecifiedDistribution.INSTANCE) {
                return true;
            }
            if (required == Distribution.AllTuples.INSTANCE) {
                return numPartitions == 1;
            }
            if (required instanceof Distribution.ClusteredDistribution) {
                return ((Distribution.ClusteredDistribution) required).clustering().containsAll(expressions);
            }
            return false;
        }

        @Override
        public boolean compatibleWith(Partitioning other) {
            return other instanceof HashPartitioning
                && ((HashPartitioning) other).numPartitions == numPartitions
                && ((HashPartitioning) other).expressions.size() == expressions.size();
        }
    }

    /**
     * Rows are placed in contiguous ranges of the ordering.
     *
     * @param ordering the ordering
     * @param numPartitions the partition count
     */
    record RangePartitioning(List<SortOrder> ordering, int numPartitions) implements Partitioning {

        public RangePartitioning {
            ordering = List.copyOf(ordering);
        }

        @Override
        public boolean satisfies(Distribution required) {
            if (required == Distribution.UnspecifiedDistribution.INSTANCE) {
                return true;
            }
            if (required == Distribution.AllTuples.INSTANCE) {
                return numPartitions == 1;
            }
            if (required instanceof Distribution.OrderedDistribution) {
                List<SortOrder> requiredOrdering = ((Distribution.OrderedDistribution) required).ordering();
                int prefix = Math.min(requiredOrdering.size(), ordering.size());
                return ordering.subList(0, prefix).equals(requiredOrdering.subList(0, prefix));
            }
            if (required instanceof Distribution.ClusteredDistribution) {
                List<Expression> sortExpressions = new ArrayList<>();
                for (SortOrder order : ordering) {
                    sortExpressions.add(order.child());
                }
                return ((Distribution.ClusteredDistribution) required).clustering().containsAll(sortExpressions);
            }
            return false;
        }

        @Override
        public boolean compatibleWith(Partitioning other) {
            return equals(other);
        }
    }
}
