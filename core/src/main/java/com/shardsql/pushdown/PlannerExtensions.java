package com.shardsql.pushdown;

import java.util.List;

/**
 * The host planner's list of extra strategies.
 */
public interface PlannerExtensions {

    List<PlanningStrategy> strategies();

    void setStrategies(List<PlanningStrategy> strategies);
}
