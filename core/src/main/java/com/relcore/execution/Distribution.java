package com.relcore.execution;

import com.relcore.expression.Expression;
import com.relcore.expression.SortOrder;
import java.util.List;

/**
 * How rows must be spread over partitions for an operator to compute a correct result.
 */
public sealed interface Distribution {

    /**
     * No requirement.
     */
    enum UnspecifiedDistribution implements Distribution {
        INSTANCE
    }

    /**
     * Every row must be in the same, single partition.
     */
    enum AllTuples implements Distribution {
        INSTANCE
    }

    /**
     * Rows with equal values of the clustering expressions must be in the same partition.
     *
     * @param clustering the clustering expressions
     */
    record ClusteredDistribution(List<Expression> clustering) implements Distribution {
        public ClusteredDistribution {
            clustering = List.copyOf(clustering);
        }
    }

    /**
     * Rows must be range partitioned by the ordering: every row of partition
     * {@code i} sorts before every row of partition {@code i + 1}.
     *
     * @param ordering the ordering
     */
    record OrderedDistribution(List<SortOrder> ordering) implements Distribution {
        public OrderedDistribution {
            ordering = List.copyOf(ordering);
        }
    }
}
