package com.relcore.command;

import com.relcore.logical.LogicalPlan;
import com.relcore.row.Row;
import com.relcore.session.Session;
import java.util.List;

/**
 * A logical leaf with side effects, run once when planned.
 *
 * <p>Commands are planned into {@link com.relcore.execution.ExecutedCommandExec},
 * so they pass through the same pipeline as queries. A data frame built over a
 * command runs it eagerly.
 */
public abstract class RunnableCommand extends LogicalPlan {

    /**
     * Runs the command.
     *
     * @param session the session the command runs in
     * @return the result rows, matching {@link #output()}
     */
    public abstract List<Row> run(Session session);

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        return this;
    }
}
