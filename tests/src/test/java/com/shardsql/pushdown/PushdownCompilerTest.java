package com.shardsql.pushdown;

import com.shardsql.catalog.RelationCatalog;
import com.shardsql.catalog.RelationHandle;
import com.shardsql.config.PushdownConfig;
import com.shardsql.expression.AggregateFunction;
import com.shardsql.expression.Alias;
import com.shardsql.expression.AttributeReference;
import com.shardsql.expression.BinaryExpression;
import com.shardsql.expression.Literal;
import com.shardsql.expression.SortOrder;
import com.shardsql.logical.Aggregate;
import com.shardsql.logical.BaseRelation;
import com.shardsql.logical.Filter;
import com.shardsql.logical.Join;
import com.shardsql.logical.Limit;
import com.shardsql.logical.LogicalPlan;
import com.shardsql.logical.Project;
import com.shardsql.logical.Sort;
import com.shardsql.logical.SubqueryAlias;
import com.shardsql.pushdown.query.AbstractQuery;
import com.shardsql.pushdown.query.JoinQuery;
import com.shardsql.pushdown.query.PartialQuery;
import com.shardsql.test.PlanFixtures;
import com.shardsql.test.TestBase;
import com.shardsql.test.TestCategories;
import com.shardsql.types.LongType;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Integration
@DisplayName("PushdownCompiler Tests")
public class PushdownCompilerTest extends TestBase {

    private static final PlanFixtures F = new PlanFixtures();

    private final PushdownCompiler compiler = new PushdownCompiler(F.catalog);

    /** Plans that compile, covering every pushable node kind. */
    static Stream<LogicalPlan> pushablePlans() {
        Alias total = Alias.of(AggregateFunction.sum(F.orderAmount), "total");
        Join ordersWithCustomers = Join.inner(F.orders, F.customers,
            BinaryExpression.equal(F.orderCustomerId, F.customerId));
        return Stream.of(
            F.users,
            new Filter(F.users, BinaryExpression.greaterThan(F.userAge, Literal.of(30))),
            new Project(F.users, List.of(F.userName, Alias.of(F.userAge, "years"))),
            new Aggregate(F.orders, List.of(F.orderCustomerId), List.of(F.orderCustomerId, total)),
            new Sort(F.users, List.of(SortOrder.asc(F.userName))),
            Limit.of(new Sort(F.users, List.of(SortOrder.desc(F.userAge))), 10),
            ordersWithCustomers,
            new Project(
                new Filter(ordersWithCustomers, BinaryExpression.greaterThan(F.orderAmount, Literal.of(100))),
                List.of(F.customerName, F.orderAmount)),
            new Aggregate(Join.inner(ordersWithCustomers, F.countries, null),
                List.of(F.customerName), List.of(F.customerName, total)));
    }

    @Nested
    @DisplayName("Scenarios")
    class Scenarios {

        @Test
        @DisplayName("A: filter over a base relation")
        void testFilterScenario() {
            Filter plan = new Filter(F.users, BinaryExpression.greaterThan(F.userAge, Literal.of(30)));

            CompiledQuery query = compiler.compile(plan).orElseThrow();

            assertThat(query.sql()).isEqualTo("SELECT * FROM (SELECT `id`, `name`, `age` FROM `shop`.`users`)"
                + " AS `query_1` WHERE (`query_1`.`age` > 30)");
            assertThat(query.columns()).extracting(OutputColumn::fieldName).containsExactly("id", "name", "age");
        }

        @Test
        @DisplayName("B: empty aggregate is not pushable")
        void testEmptyAggregateScenario() {
            assertThat(compiler.compile(new Aggregate(F.users, List.of(), List.of()))).isEmpty();
        }

        @Test
        @DisplayName("Relation declaring no columns is not pushable")
        void testRelationWithoutColumns() {
            assertThat(compiler.compile(new BaseRelation(new RelationHandle("users"), List.of()))).isEmpty();
        }

        @Test
        @DisplayName("C: global sort without limit carries the maximum limit")
        void testSortScenario() {
            CompiledQuery query = compiler.compile(new Sort(F.users, List.of(SortOrder.asc(F.userName)))).orElseThrow();

            assertThat(query.sql()).contains("ORDER BY `query_1`.`name` ASC LIMIT " + Long.MAX_VALUE);
        }

        @Test
        @DisplayName("D: co-located join")
        void testJoinScenario() {
            Join plan = Join.inner(F.orders, F.customers, BinaryExpression.equal(F.orderCustomerId, F.customerId));

            CompiledQuery query = compiler.compile(plan).orElseThrow();

            assertThat(query.tree()).isInstanceOf(JoinQuery.class);
            assertThat(query.sql()).contains(" ON (`query_l_1`.`customer_id` = `query_r_1`.`customer_id`)");
            assertThat(query.columns()).extracting(OutputColumn::fieldName)
                .containsExactly("f_0", "f_1", "f_2", "f_3", "f_4");
            assertThat(query.columns()).extracting(OutputColumn::displayName)
                .containsExactly("order_id", "customer_id", "amount", "customer_id", "name");
        }

        @Test
        @DisplayName("E: join with incompatible distributions")
        void testIncompatibleJoinScenario() {
            Join plan = Join.inner(F.orders, F.profiles, BinaryExpression.equal(F.orderCustomerId, F.profileCustomerId));

            assertThat(compiler.compile(plan)).isEmpty();
        }

        @Test
        @DisplayName("Join of sharded tables on non-key columns is not pushable")
        void testJoinOnNonKeyColumns() {
            logStep("Given: users sharded on id, orders sharded on customer_id, joined on age = amount");
            Join plan = Join.inner(F.users, F.orders, BinaryExpression.equal(F.userAge, F.orderAmount));

            assertThat(compiler.compile(plan)).isEmpty();
        }

        @Test
        @DisplayName("Join of a side aggregated on a non-key column is not pushable")
        void testJoinAfterRegrouping() {
            logStep("Given: orders grouped by amount, so rows of one group come from many partitions");
            Alias total = Alias.of(AggregateFunction.sum(F.orderId), "total");
            Aggregate byAmount = new Aggregate(F.orders, List.of(F.orderAmount), List.of(F.orderAmount, total));
            Join plan = Join.inner(byAmount, F.customers, BinaryExpression.equal(F.orderAmount, F.customerId));

            assertThat(compiler.compile(plan)).isEmpty();
        }

        @Test
        @DisplayName("Join of a side aggregated on its shard key stays pushable")
        void testJoinAfterGroupingOnKey() {
            Alias total = Alias.of(AggregateFunction.sum(F.orderAmount), "total");
            Aggregate byCustomer = new Aggregate(F.orders, List.of(F.orderCustomerId), List.of(F.orderCustomerId, total));
            Join plan = Join.inner(byCustomer, F.customers, BinaryExpression.equal(F.orderCustomerId, F.customerId));

            CompiledQuery query = compiler.compile(plan).orElseThrow();

            assertThat(query.tree()).isInstanceOf(JoinQuery.class);
            assertThat(query.sql()).contains(" GROUP BY `query_l_2`.`customer_id`");
        }
    }

    @Nested
    @DisplayName("Properties")
    class Properties {

        @ParameterizedTest(name = "[{index}] {0}")
        @MethodSource("com.shardsql.pushdown.PushdownCompilerTest#pushablePlans")
        @DisplayName("Compiling twice yields identical trees")
        void testDeterministic(LogicalPlan plan) {
            CompiledQuery first = compiler.compile(plan).orElseThrow();
            CompiledQuery second = compiler.compile(plan).orElseThrow();

            assertThat(second).isEqualTo(first);
            assertThat(second.sql()).isEqualTo(first.sql());
        }

        @ParameterizedTest(name = "[{index}] {0}")
        @MethodSource("com.shardsql.pushdown.PushdownCompilerTest#pushablePlans")
        @DisplayName("Aliases and synthetic fields are pairwise distinct")
        void testUniqueNames(LogicalPlan plan) {
            AbstractQuery tree = compiler.compile(plan).orElseThrow().tree();

            List<String> aliases = new ArrayList<>();
            List<String> fields = new ArrayList<>();
            collect(tree, aliases, fields);

            assertThat(aliases).doesNotHaveDuplicates();
            assertThat(fields).doesNotHaveDuplicates();
        }

        @ParameterizedTest(name = "[{index}] {0}")
        @MethodSource("com.shardsql.pushdown.PushdownCompilerTest#pushablePlans")
        @DisplayName("Output columns match the plan output in count and order")
        void testOutputMatchesPlan(LogicalPlan plan) {
            CompiledQuery query = compiler.compile(plan).orElseThrow();

            assertThat(query.columns()).extracting(OutputColumn::attribute).containsExactlyElementsOf(plan.output());
            assertThat(query.tree().output()).extracting(AttributeReference::exprId)
                .containsExactlyElementsOf(plan.output().stream().map(AttributeReference::exprId).toList());
        }

        // Names introduced by a SELECT list; pass-through nodes repeat their child's names
        private void collect(AbstractQuery node, List<String> aliases, List<String> fields) {
            aliases.add(node.alias().toString());
            boolean renames = node instanceof JoinQuery
                || (node instanceof PartialQuery && ((PartialQuery) node).prefix().isPresent());
            if (renames) {
                node.output().forEach(a -> fields.add(a.name()));
            }
            node.children().forEach(child -> collect(child, aliases, fields));
        }
    }

    @Nested
    @DisplayName("Column mapping")
    class ColumnMapping {

        @Test
        @DisplayName("Display names survive repeated renaming")
        void testDisplayNames() {
            Alias years = Alias.of(F.userAge, "years");
            Project inner = new Project(F.users, List.of(F.userName, years));
            Project outer = new Project(inner, List.of(years.toAttribute()));

            CompiledQuery query = compiler.compile(outer).orElseThrow();

            assertThat(query.sql()).startsWith("SELECT `query_1`.`f_1` AS `f_2` FROM (");
            assertThat(query.columns()).containsExactly(new OutputColumn(years.toAttribute(), "f_2", "years"));
        }

        @Test
        @DisplayName("Subquery aliases and empty projections are normalized away")
        void testNormalization() {
            LogicalPlan plan = new Project(new SubqueryAlias(new Project(F.users, List.of()), "u"), List.of(F.userId));

            CompiledQuery query = compiler.compile(plan).orElseThrow();

            assertThat(query.sql()).isEqualTo("SELECT `query_1`.`id` AS `f_0` FROM "
                + "(SELECT `id`, `name`, `age` FROM `shop`.`users`) AS `query_1`");
        }

        @Test
        @DisplayName("Configured prefixes appear in the generated SQL")
        void testConfiguredPrefixes() {
            PushdownCompiler custom = new PushdownCompiler(F.catalog,
                PushdownConfig.defaults().withAliasPrefix("sub").withFieldPrefix("col_"));

            CompiledQuery query = custom.compile(new Project(F.users, List.of(F.userName))).orElseThrow();

            assertThat(query.sql()).isEqualTo("SELECT `sub_1`.`name` AS `col_0` FROM "
                + "(SELECT `id`, `name`, `age` FROM `shop`.`users`) AS `sub_1`");
        }
    }

    @Nested
    @DisplayName("Fallback")
    class Fallback {

        @Test
        @DisplayName("Disabled pushdown compiles nothing")
        void testDisabled() {
            PushdownCompiler disabled = new PushdownCompiler(F.catalog, PushdownConfig.defaults().withEnabled(false));

            assertThat(disabled.compile(F.users)).isEmpty();
        }

        @Test
        @DisplayName("Failure inside the catalog is absorbed")
        void testCatalogFailure() {
            RelationCatalog broken = handle -> {
                throw new IllegalStateException("catalog unavailable");
            };

            assertThat(new PushdownCompiler(broken).compile(F.users)).isEmpty();
        }

        @Test
        @DisplayName("Tree violating an invariant is absorbed")
        void testStructuralInconsistency() {
            logStep("Given: a relation declaring two columns of the same name");
            AttributeReference first = AttributeReference.of("id", LongType.get());
            AttributeReference second = AttributeReference.of("id", LongType.get());
            BaseRelation duplicated = new BaseRelation(new RelationHandle("users"), List.of(first, second));

            logStep("Then: compilation returns empty instead of throwing");
            assertThat(compiler.compile(duplicated)).isEmpty();
        }

        @Test
        @DisplayName("Unsupported subtree anywhere disables the whole plan")
        void testPartialFailure() {
            Join plan = Join.inner(
                new Sort(F.orders, List.of(SortOrder.asc(F.orderId)), false),
                F.customers,
                BinaryExpression.equal(F.orderCustomerId, F.customerId));

            assertThat(compiler.compile(plan)).isEmpty();
        }
    }
}
