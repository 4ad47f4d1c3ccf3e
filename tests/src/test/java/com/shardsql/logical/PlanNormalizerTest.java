package com.shardsql.logical;

import com.shardsql.catalog.RelationHandle;
import com.shardsql.expression.AttributeReference;
import com.shardsql.expression.BinaryExpression;
import com.shardsql.expression.Literal;
import com.shardsql.test.TestBase;
import com.shardsql.types.IntegerType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PlanNormalizer Tests")
public class PlanNormalizerTest extends TestBase {

    private final AttributeReference x = AttributeReference.of("x", IntegerType.get());
    private final BaseRelation relation = new BaseRelation(new RelationHandle("t"), List.of(x));

    @Test
    @DisplayName("Plan without rewrites is returned as is")
    void testUnchanged() {
        Filter filter = new Filter(relation, BinaryExpression.equal(x, Literal.of(1)));

        assertThat(PlanNormalizer.normalize(filter)).isSameAs(filter);
    }

    @Test
    @DisplayName("Empty projection is removed")
    void testEmptyProject() {
        assertThat(PlanNormalizer.normalize(new Project(relation, List.of()))).isSameAs(relation);
    }

    @Test
    @DisplayName("Non-empty projection is kept")
    void testNonEmptyProject() {
        Project project = new Project(relation, List.of(x));

        assertThat(PlanNormalizer.normalize(project)).isSameAs(project);
    }

    @Test
    @DisplayName("Rewrites apply below other nodes")
    void testNestedRewrites() {
        logStep("Given: Filter over SubqueryAlias over an empty Project");
        Filter filter = new Filter(
            new SubqueryAlias(new Project(relation, List.of()), "t"),
            BinaryExpression.equal(x, Literal.of(1)));

        logStep("Then: the filter sits directly on the relation");
        LogicalPlan normalized = PlanNormalizer.normalize(filter);
        assertThat(normalized).isInstanceOf(Filter.class);
        assertThat(((Filter) normalized).child()).isSameAs(relation);
        assertThat(((Filter) normalized).condition()).isEqualTo(filter.condition());
    }

    @Test
    @DisplayName("Stacked aliases collapse")
    void testStackedAliases() {
        LogicalPlan plan = new SubqueryAlias(new SubqueryAlias(relation, "a"), "b");

        assertThat(PlanNormalizer.normalize(plan)).isSameAs(relation);
    }
}
