package com.shardsql.pushdown;

import com.shardsql.logical.LogicalPlan;
import java.util.Optional;

/**
 * A pluggable strategy of the host planner. The host consults its strategies in
 * order and uses the first result.
 */
@FunctionalInterface
public interface PlanningStrategy {

    /**
     * Plans a logical plan.
     *
     * @param plan the host plan
     * @return the compiled query, or empty to let the next strategy plan it
     */
    Optional<CompiledQuery> apply(LogicalPlan plan);
}
