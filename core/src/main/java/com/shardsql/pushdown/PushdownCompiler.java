package com.shardsql.pushdown;

import com.shardsql.catalog.RelationCatalog;
import com.shardsql.config.PushdownConfig;
import com.shardsql.exception.SQLGenerationException;
import com.shardsql.expression.AttributeReference;
import com.shardsql.logical.LogicalPlan;
import com.shardsql.logical.PlanNormalizer;
import com.shardsql.pushdown.query.AbstractQuery;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles host logical plans into remote SQL.
 *
 * <p>Compilation normalizes the plan, translates it with a fresh
 * {@link CompilationContext} and checks the resulting tree. It never throws for
 * a well-formed plan: an unsupported plan, and any internal failure while
 * compiling a supported one, both return empty so the host runs the plan
 * itself.
 *
 * <p>Example usage:
 * <pre>
 *   PushdownCompiler compiler = new PushdownCompiler(catalog, PushdownConfig.load());
 *   compiler.compile(plan).ifPresent(query -&gt; execute(query.sql()));
 * </pre>
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class PushdownCompiler {

    private static final Logger logger = LoggerFactory.getLogger(PushdownCompiler.class);

    private final RelationCatalog catalog;
    private final PushdownConfig config;

    public PushdownCompiler(RelationCatalog catalog, PushdownConfig config) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public PushdownCompiler(RelationCatalog catalog) {
        this(catalog, PushdownConfig.defaults());
    }

    public PushdownConfig config() {
        return config;
    }

    /**
     * Compiles a plan.
     *
     * @param plan the host plan
     * @return the compiled query, or empty if the plan cannot be pushed down
     */
    public Optional<CompiledQuery> compile(LogicalPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        if (!config.isEnabled()) {
            logger.debug("Pushdown is disabled");
            return Optional.empty();
        }

        try {
            LogicalPlan normalized = PlanNormalizer.normalize(plan);
            CompilationContext context = new CompilationContext(config.fieldPrefix());
            PlanTranslator translator = new PlanTranslator(catalog, config, context);

            Optional<AbstractQuery> tree = translator.translate(normalized, QueryAlias.root(config.aliasPrefix()));
            if (tree.isEmpty()) {
                return Optional.empty();
            }
            QueryTreeValidator.validate(tree.get(), normalized);

            CompiledQuery compiled = new CompiledQuery(
                tree.get().toSQL(), outputColumns(normalized, tree.get(), context), tree.get());
            logger.debug("Compiled {} into: {}", plan.getClass().getSimpleName(), compiled.sql());
            return Optional.of(compiled);

        } catch (SQLGenerationException e) {
            logger.warn("Pushdown skipped ({}): {}", FallbackReason.STRUCTURAL_INCONSISTENCY,
                e.getTechnicalMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            logger.warn("Pushdown skipped ({}) for {}", FallbackReason.STRUCTURAL_INCONSISTENCY,
                plan.getClass().getSimpleName(), e);
            return Optional.empty();
        }
    }

    private static List<OutputColumn> outputColumns(LogicalPlan plan, AbstractQuery tree, CompilationContext context) {
        List<AttributeReference> expected = plan.output();
        List<AttributeReference> produced = tree.output();
        List<OutputColumn> columns = new ArrayList<>(expected.size());
        for (int i = 0; i < expected.size(); i++) {
            AttributeReference attribute = expected.get(i);
            columns.add(new OutputColumn(attribute, produced.get(i).name(), context.displayNameOf(attribute)));
        }
        return columns;
    }
}
