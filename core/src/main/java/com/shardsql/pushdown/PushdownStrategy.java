package com.shardsql.pushdown;

import com.shardsql.catalog.RelationCatalog;
import com.shardsql.config.PushdownConfig;
import com.shardsql.logical.LogicalPlan;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Planner strategy that pushes whole plans down to the remote engine.
 *
 * <p>Registration is idempotent: {@link #install} adds a strategy only if the
 * planner has none, and {@link #uninstall} removes every one present.
 * <pre>
 *   PushdownStrategy.install(extensions, catalog);
 *   ...
 *   PushdownStrategy.uninstall(extensions);
 * </pre>
 */
public final class PushdownStrategy implements PlanningStrategy {

    private static final Logger logger = LoggerFactory.getLogger(PushdownStrategy.class);

    private final PushdownCompiler compiler;

    public PushdownStrategy(PushdownCompiler compiler) {
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
    }

    @Override
    public Optional<CompiledQuery> apply(LogicalPlan plan) {
        return compiler.compile(plan);
    }

    public PushdownCompiler compiler() {
        return compiler;
    }

    /**
     * Installs a pushdown strategy configured from {@link PushdownConfig#load()}.
     *
     * @param extensions the host planner
     * @param catalog the catalog resolving base relations
     * @return true if a strategy was added, false if one was already installed
     */
    public static boolean install(PlannerExtensions extensions, RelationCatalog catalog) {
        return install(extensions, new PushdownStrategy(new PushdownCompiler(catalog, PushdownConfig.load())));
    }

    /**
     * Installs the given strategy unless a pushdown strategy is already present.
     *
     * @param extensions the host planner
     * @param strategy the strategy to add
     * @return true if the strategy was added
     */
    public static synchronized boolean install(PlannerExtensions extensions, PushdownStrategy strategy) {
        Objects.requireNonNull(extensions, "extensions must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        if (isInstalled(extensions)) {
            logger.debug("Pushdown strategy already installed");
            return false;
        }
        List<PlanningStrategy> strategies = new ArrayList<>(extensions.strategies());
        strategies.add(strategy);
        extensions.setStrategies(strategies);
        logger.info("Installed pushdown strategy ({})", strategy.compiler().config());
        return true;
    }

    /**
     * Removes every pushdown strategy from the planner.
     *
     * @param extensions the host planner
     * @return true if anything was removed
     */
    public static synchronized boolean uninstall(PlannerExtensions extensions) {
        Objects.requireNonNull(extensions, "extensions must not be null");
        if (!isInstalled(extensions)) {
            return false;
        }
        List<PlanningStrategy> strategies = new ArrayList<>();
        for (PlanningStrategy strategy : extensions.strategies()) {
            if (!(strategy instanceof PushdownStrategy)) {
                strategies.add(strategy);
            }
        }
        extensions.setStrategies(strategies);
        logger.info("Removed pushdown strategy");
        return true;
    }

    public static boolean isInstalled(PlannerExtensions extensions) {
        for (PlanningStrategy strategy : extensions.strategies()) {
            if (strategy instanceof PushdownStrategy) {
                return true;
            }
        }
        return false;
    }
}
