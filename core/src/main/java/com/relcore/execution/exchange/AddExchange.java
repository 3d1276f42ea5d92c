package com.relcore.execution.exchange;

import com.relcore.execution.Distribution;
import com.relcore.execution.Partitioning;
import com.relcore.execution.PhysicalPlan;
import com.relcore.rules.Rule;
import com.relcore.session.SQLConf;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Inserts an {@link Exchange} wherever a child's partitioning does not satisfy
 * the distribution its parent requires, or where the children of an operator
 * with several inputs are not partitioned compatibly.
 *
 * <p>Clustered requirements become hash partitioning on the clustering
 * expressions into {@link SQLConf#numShufflePartitions()} partitions, ordered
 * requirements become range partitioning, and {@code AllTuples} becomes a
 * single partition.
 */
public final class AddExchange implements Rule<PhysicalPlan> {

    private final SQLConf conf;

    public AddExchange(SQLConf conf) {
        this.conf = Objects.requireNonNull(conf, "conf must not be null");
    }

    @Override
    public PhysicalPlan apply(PhysicalPlan plan) {
        int numPartitions = conf.numShufflePartitions();
        return plan.transformUp(operator -> {
            if (meetsRequirements(operator) && compatible(operator)) {
                return operator;
            }
            List<Distribution> required = operator.requiredChildDistribution();
            List<PhysicalPlan> children = operator.children();
            List<PhysicalPlan> repartitioned = new ArrayList<>(children.size());
            boolean changed = false;
            for (int i = 0; i < children.size(); i++) {
                PhysicalPlan child = children.get(i);
                PhysicalPlan next = addExchangeIfNecessary(required.get(i), child, numPartitions);
                changed |= next != child;
                repartitioned.add(next);
            }
            return changed ? operator.withNewChildren(repartitioned) : operator;
        });
    }

    private static boolean meetsRequirements(PhysicalPlan operator) {
        List<Distribution> required = operator.requiredChildDistribution();
        for (int i = 0; i < operator.children().size(); i++) {
            if (!operator.children().get(i).outputPartitioning().satisfies(required.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean compatible(PhysicalPlan operator) {
        List<Distribution> required = operator.requiredChildDistribution();
        List<Partitioning> constrained = new ArrayList<>();
        for (int i = 0; i < operator.children().size(); i++) {
            if (required.get(i) != Distribution.UnspecifiedDistribution.INSTANCE) {
                constrained.add(operator.children().get(i).outputPartitioning());
            }
        }
        for (int i = 1; i < constrained.size(); i++) {
            if (!constrained.get(0).compatibleWith(constrained.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static PhysicalPlan addExchangeIfNecessary(Distribution required, PhysicalPlan child, int numPartitions) {
        Partitioning partitioning;
        if (required == Distribution.AllTuples.INSTANCE) {
            partitioning = Partitioning.SinglePartition.INSTANCE;
        } else if (required instanceof Distribution.ClusteredDistribution) {
            partitioning = new Partitioning.HashPartitioning(
                ((Distribution.ClusteredDistribution) required).clustering(), numPartitions);
        } else if (required instanceof Distribution.OrderedDistribution) {
            partitioning = new Partitioning.RangePartitioning(
                ((Distribution.OrderedDistribution) required).ordering(), numPartitions);
        } else {
            return child;
        }
        return child.outputPartitioning().equals(partitioning) ? child : new Exchange(partitioning, child);
    }
}
