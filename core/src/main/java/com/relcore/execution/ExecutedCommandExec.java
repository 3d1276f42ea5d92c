package com.relcore.execution;

import com.relcore.command.RunnableCommand;
import com.relcore.expression.AttributeReference;
import com.relcore.row.Row;
import com.relcore.session.Session;
import com.relcore.util.OnceCell;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Runs a {@link RunnableCommand}. The command runs on the first execution only;
 * later executions return the same rows.
 */
public final class ExecutedCommandExec extends PhysicalPlan {

    private final RunnableCommand command;
    private final OnceCell<List<Row>> sideEffectResult;

    public ExecutedCommandExec(RunnableCommand command, Session session) {
        this.command = Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(session, "session must not be null");
        this.sideEffectResult = new OnceCell<>(() -> List.copyOf(command.run(session)));
    }

    public RunnableCommand command() {
        return command;
    }

    @Override
    public List<AttributeReference> output() {
        return command.output();
    }

    @Override
    public Partitioning outputPartitioning() {
        return new Partitioning.UnknownPartitioning(1);
    }

    @Override
    public List<Iterator<Row>> execute() {
        return List.of(sideEffectResult.get().iterator());
    }

    @Override
    public List<Row> executeCollect() {
        return sideEffectResult.get();
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        return this;
    }

    @Override
    public String argString() {
        return command.simpleString();
    }
}
