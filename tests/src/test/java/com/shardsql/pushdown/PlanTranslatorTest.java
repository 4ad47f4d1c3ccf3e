package com.shardsql.pushdown;

import com.shardsql.catalog.RelationHandle;
import com.shardsql.config.PushdownConfig;
import com.shardsql.expression.AggregateFunction;
import com.shardsql.expression.Alias;
import com.shardsql.expression.AttributeReference;
import com.shardsql.expression.BinaryExpression;
import com.shardsql.expression.Literal;
import com.shardsql.expression.OpaqueExpression;
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
import com.shardsql.logical.Unrecognized;
import com.shardsql.pushdown.query.AbstractQuery;
import com.shardsql.pushdown.query.BaseQuery;
import com.shardsql.pushdown.query.JoinQuery;
import com.shardsql.pushdown.query.PartialQuery;
import com.shardsql.test.PlanFixtures;
import com.shardsql.test.TestBase;
import com.shardsql.test.TestCategories;
import com.shardsql.types.BooleanType;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("PlanTranslator Tests")
public class PlanTranslatorTest extends TestBase {

    private static final String USERS = "SELECT `id`, `name`, `age` FROM `shop`.`users`";

    private final PlanFixtures f = new PlanFixtures();

    private Optional<AbstractQuery> translate(LogicalPlan plan) {
        return translate(plan, PushdownConfig.defaults());
    }

    private Optional<AbstractQuery> translate(LogicalPlan plan, PushdownConfig config) {
        PlanTranslator translator = new PlanTranslator(f.catalog, config, new CompilationContext(config.fieldPrefix()));
        return translator.translate(plan, QueryAlias.root(config.aliasPrefix()));
    }

    @Nested
    @DisplayName("Base relations")
    class BaseRelations {

        @Test
        @DisplayName("Catalogued relation becomes a base query")
        void testBaseQuery() {
            AbstractQuery query = translate(f.users).orElseThrow();

            assertThat(query).isInstanceOf(BaseQuery.class);
            assertThat(query.alias()).hasToString("query_0");
            assertThat(query.toSQL()).isEqualTo(USERS);
            assertThat(query.output()).containsExactly(f.userId, f.userName, f.userAge);
        }

        @Test
        @DisplayName("Relation not backed by a remote table is not pushable")
        void testUnresolvedRelation() {
            assertThat(translate(f.localFile)).isEmpty();
        }

        @Test
        @DisplayName("Relation declaring no columns is not pushable")
        void testRelationWithoutColumns() {
            assertThat(translate(new BaseRelation(new RelationHandle("users"), List.of()))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Filters and projections")
    class FiltersAndProjections {

        @Test
        @DisplayName("Filter adds a WHERE suffix against the child alias")
        void testFilter() {
            logStep("Given: Filter(age > 30) over users");
            Filter plan = new Filter(f.users, BinaryExpression.greaterThan(f.userAge, Literal.of(30)));

            logStep("When: translating");
            AbstractQuery query = translate(plan).orElseThrow();

            logStep("Then: one subquery wraps the table with a WHERE clause");
            assertThat(query).isInstanceOf(PartialQuery.class);
            assertThat(query.toSQL()).isEqualTo(
                "SELECT * FROM (" + USERS + ") AS `query_1` WHERE (`query_1`.`age` > 30)");
            assertThat(query.output()).isEqualTo(f.users.output());
        }

        @Test
        @DisplayName("Project renames every column to a fresh field")
        void testProject() {
            Alias nextAge = Alias.of(BinaryExpression.add(f.userAge, Literal.of(1)), "next_age");
            Project plan = new Project(f.users, List.of(f.userName, nextAge));

            AbstractQuery query = translate(plan).orElseThrow();

            assertThat(query.toSQL()).isEqualTo(
                "SELECT `query_1`.`name` AS `f_0`, (`query_1`.`age` + 1) AS `f_1` FROM (" + USERS + ") AS `query_1`");
            assertThat(query.output()).extracting(AttributeReference::name).containsExactly("f_0", "f_1");
            assertThat(query.output()).extracting(AttributeReference::exprId)
                .containsExactly(f.userName.exprId(), nextAge.exprId());
        }

        @Test
        @DisplayName("Parents reference the fields their child produced")
        void testFilterOverProject() {
            Alias years = Alias.of(f.userAge, "years");
            Project project = new Project(f.users, List.of(years));
            Filter plan = new Filter(project, BinaryExpression.lessThan(years.toAttribute(), Literal.of(18)));

            AbstractQuery query = translate(plan).orElseThrow();

            assertThat(query.toSQL()).isEqualTo(
                "SELECT * FROM (SELECT `query_2`.`age` AS `f_0` FROM (" + USERS + ") AS `query_2`) AS `query_1`"
                    + " WHERE (`query_1`.`f_0` < 18)");
        }

        @Test
        @DisplayName("Subquery alias is transparent")
        void testSubqueryAlias() {
            assertThat(translate(new SubqueryAlias(f.users, "u")).orElseThrow().toSQL()).isEqualTo(USERS);
        }

        @Test
        @DisplayName("Unrenderable filter condition is not pushable")
        void testOpaqueCondition() {
            Filter plan = new Filter(f.users, new OpaqueExpression("my_udf(age)", BooleanType.get(), List.of(f.userAge)));

            assertThat(translate(plan)).isEmpty();
        }

        @Test
        @DisplayName("Condition over a column the child does not produce is not pushable")
        void testOutOfScopeCondition() {
            Filter plan = new Filter(f.users, BinaryExpression.equal(f.orderId, Literal.of(1L)));

            assertThat(translate(plan)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Aggregates")
    class Aggregates {

        @Test
        @DisplayName("Grouped aggregate renders GROUP BY")
        void testGroupedAggregate() {
            Alias count = Alias.of(AggregateFunction.countStar(), "cnt");
            Aggregate plan = new Aggregate(f.users, List.of(f.userName), List.of(f.userName, count));

            AbstractQuery query = translate(plan).orElseThrow();

            assertThat(query.toSQL()).isEqualTo(
                "SELECT `query_1`.`name` AS `f_0`, COUNT(*) AS `f_1` FROM (" + USERS + ") AS `query_1`"
                    + " GROUP BY `query_1`.`name`");
        }

        @Test
        @DisplayName("Global aggregate has no GROUP BY")
        void testGlobalAggregate() {
            Alias total = Alias.of(AggregateFunction.sum(f.userAge), "total");
            Aggregate plan = new Aggregate(f.users, List.of(), List.of(total));

            AbstractQuery query = translate(plan).orElseThrow();

            assertThat(query.toSQL()).isEqualTo("SELECT SUM(`query_1`.`age`) AS `f_0` FROM (" + USERS + ") AS `query_1`");
            assertThat(((PartialQuery) query).suffix()).isEmpty();
        }

        @Test
        @DisplayName("Aggregate with nothing to compute is left to the host")
        void testEmptyAggregate() {
            assertThat(translate(new Aggregate(f.users, List.of(), List.of()))).isEmpty();
            assertThat(translate(new Aggregate(f.users, List.of(f.userName), List.of()))).isEmpty();
        }

        @Test
        @DisplayName("Aggregate inside a grouping expression is not pushable")
        void testAggregateInGrouping() {
            Alias count = Alias.of(AggregateFunction.countStar(), "cnt");
            Aggregate plan = new Aggregate(f.users, List.of(AggregateFunction.max(f.userAge)), List.of(count));

            assertThat(translate(plan)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Sorts and limits")
    class SortsAndLimits {

        @Test
        @DisplayName("Global sort alone carries the maximum limit")
        void testSortAlone() {
            Sort plan = new Sort(f.users, List.of(SortOrder.asc(f.userName)), true);

            AbstractQuery query = translate(plan).orElseThrow();

            assertThat(query.toSQL()).isEqualTo(
                "SELECT * FROM (" + USERS + ") AS `query_1` ORDER BY `query_1`.`name` ASC LIMIT 9223372036854775807");
        }

        @Test
        @DisplayName("Limit over sort collapses into one subquery")
        void testLimitOverSort() {
            Limit plan = Limit.of(new Sort(f.users, List.of(SortOrder.desc(f.userAge))), 10);

            AbstractQuery query = translate(plan).orElseThrow();

            assertThat(((PartialQuery) query).inner()).isInstanceOf(BaseQuery.class);
            assertThat(query.toSQL()).isEqualTo(
                "SELECT * FROM (" + USERS + ") AS `query_1` ORDER BY `query_1`.`age` DESC LIMIT 10");
        }

        @Test
        @DisplayName("Sort over limit collapses into one subquery")
        void testSortOverLimit() {
            Sort plan = new Sort(Limit.of(f.users, 5), List.of(SortOrder.asc(f.userId)));

            AbstractQuery query = translate(plan).orElseThrow();

            assertThat(((PartialQuery) query).inner()).isInstanceOf(BaseQuery.class);
            assertThat(query.toSQL()).endsWith(" ORDER BY `query_1`.`id` ASC LIMIT 5");
        }

        @Test
        @DisplayName("Limit alone")
        void testLimitAlone() {
            assertThat(translate(Limit.of(f.users, 3)).orElseThrow().toSQL())
                .isEqualTo("SELECT * FROM (" + USERS + ") AS `query_1` LIMIT 3");
        }

        @Test
        @DisplayName("Per-partition sort is not pushable")
        void testLocalSort() {
            Sort local = new Sort(f.users, List.of(SortOrder.asc(f.userName)), false);

            assertThat(translate(local)).isEmpty();
            assertThat(translate(Limit.of(local, 10))).isEmpty();
        }

        @Test
        @DisplayName("Limit that is not a non-negative integral literal is not pushable")
        void testInvalidLimit() {
            assertThat(translate(new Limit(f.users, Literal.of(-1)))).isEmpty();
            assertThat(translate(new Limit(f.users, Literal.of("10")))).isEmpty();
            assertThat(translate(new Limit(f.users, f.userAge))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Joins")
    class Joins {

        @Test
        @DisplayName("Co-located inner join becomes a join query")
        void testColocatedJoin() {
            logStep("Given: orders and customers, both sharded on customer_id");
            Join plan = Join.inner(f.orders, f.customers, BinaryExpression.equal(f.orderCustomerId, f.customerId));

            logStep("When: translating");
            AbstractQuery query = translate(plan).orElseThrow();

            logStep("Then: both sides are forked subqueries and every column is re-aliased");
            assertThat(query).isInstanceOf(JoinQuery.class);
            JoinQuery join = (JoinQuery) query;
            assertThat(join.left().alias()).hasToString("query_l_1");
            assertThat(join.right().alias()).hasToString("query_r_1");
            assertThat(join.toSQL()).isEqualTo(
                "SELECT `query_l_1`.`order_id` AS `f_0`, `query_l_1`.`customer_id` AS `f_1`, "
                    + "`query_l_1`.`amount` AS `f_2`, `query_r_1`.`customer_id` AS `f_3`, `query_r_1`.`name` AS `f_4`"
                    + " FROM (SELECT `order_id`, `customer_id`, `amount` FROM `shop`.`orders`) AS `query_l_1`"
                    + " INNER JOIN (SELECT `customer_id`, `name` FROM `shop`.`customers`) AS `query_r_1`"
                    + " ON (`query_l_1`.`customer_id` = `query_r_1`.`customer_id`)");
            assertThat(join.output()).extracting(AttributeReference::exprId)
                .containsExactly(f.orderId.exprId(), f.orderCustomerId.exprId(), f.orderAmount.exprId(),
                    f.customerId.exprId(), f.customerName.exprId());
        }

        @Test
        @DisplayName("Join without a condition has no ON clause")
        void testJoinWithoutCondition() {
            JoinQuery join = (JoinQuery) translate(Join.inner(f.orders, f.countries, null)).orElseThrow();

            assertThat(join.condition()).isEmpty();
            assertThat(join.toSQL()).doesNotContain(" ON ");
        }

        @Test
        @DisplayName("Join with incompatible distributions is not pushable")
        void testIncompatibleJoin() {
            assertThat(translate(Join.inner(f.orders, f.profiles,
                BinaryExpression.equal(f.orderCustomerId, f.profileCustomerId)))).isEmpty();
            assertThat(translate(Join.inner(f.orders, f.events,
                BinaryExpression.equal(f.orderId, f.eventId)))).isEmpty();
        }

        @Test
        @DisplayName("Join must equate the shard keys of both sides")
        void testJoinOffShardKey() {
            assertThat(translate(Join.inner(f.orders, f.customers,
                BinaryExpression.equal(f.orderId, f.customerId)))).isEmpty();
            assertThat(translate(Join.inner(f.orders, f.customers, null))).isEmpty();
        }

        @Test
        @DisplayName("Projecting the shard key away below a join makes it not pushable")
        void testShardKeyProjectedAway() {
            Project amounts = new Project(f.orders, List.of(f.orderId, f.orderAmount));

            assertThat(translate(Join.inner(amounts, f.customers,
                BinaryExpression.equal(f.orderId, f.customerId)))).isEmpty();
        }

        @Test
        @DisplayName("Non-inner joins are not pushable")
        void testNonInnerJoins() {
            for (Join.JoinType type : Join.JoinType.values()) {
                if (type == Join.JoinType.INNER) {
                    continue;
                }
                Join plan = new Join(f.orders, f.customers, type,
                    type == Join.JoinType.CROSS ? null : BinaryExpression.equal(f.orderCustomerId, f.customerId));
                assertThat(translate(plan)).as(type.name()).isEmpty();
            }
        }

        @Test
        @DisplayName("Joins can be switched off")
        void testJoinsDisabled() {
            Join plan = Join.inner(f.orders, f.customers, BinaryExpression.equal(f.orderCustomerId, f.customerId));

            assertThat(translate(plan, PushdownConfig.defaults().withJoinsEnabled(false))).isEmpty();
        }

        @Test
        @DisplayName("Self-join sharing attribute ids is ambiguous and not pushable")
        void testAmbiguousSelfJoin() {
            Join plan = Join.inner(f.users, f.users, BinaryExpression.equal(f.userId, f.userId));

            assertThat(translate(plan)).isEmpty();
        }

        @Test
        @DisplayName("Nested joins get distinct aliases on every branch")
        void testNestedJoin() {
            Join inner = Join.inner(f.orders, f.customers, BinaryExpression.equal(f.orderCustomerId, f.customerId));
            Join outer = Join.inner(inner, f.countries, null);

            JoinQuery query = (JoinQuery) translate(outer).orElseThrow();
            JoinQuery left = (JoinQuery) query.left();

            assertThat(left.alias()).hasToString("query_l_1");
            assertThat(left.left().alias()).hasToString("query_l_l_2");
            assertThat(left.right().alias()).hasToString("query_l_r_2");
            assertThat(query.right().alias()).hasToString("query_r_1");
            assertThat(query.projection()).startsWith("`query_l_1`.`f_0` AS `f_5`");
        }
    }

    @Test
    @DisplayName("Unrecognized node poisons every ancestor")
    void testUnrecognized() {
        Unrecognized distinct = new Unrecognized("Distinct", List.of(f.users), f.users.output());
        Filter plan = new Filter(distinct, BinaryExpression.greaterThan(f.userAge, Literal.of(1)));

        assertThat(translate(distinct)).isEmpty();
        assertThat(translate(plan)).isEmpty();
    }
}
