package com.shardsql.logical;

import com.shardsql.expression.BinaryExpression;
import com.shardsql.test.PlanFixtures;
import com.shardsql.test.TestBase;
import com.shardsql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Join Tests")
public class JoinTest extends TestBase {

    private final PlanFixtures f = new PlanFixtures();

    @ParameterizedTest(name = "{0}")
    @EnumSource(Join.JoinType.class)
    @DisplayName("Output is the left output followed by the right output")
    void testOutput(Join.JoinType type) {
        Join join = new Join(f.orders, f.customers, type, BinaryExpression.equal(f.orderCustomerId, f.customerId));

        assertThat(join.output()).containsExactly(
            f.orderId, f.orderCustomerId, f.orderAmount, f.customerId, f.customerName);
        assertThat(join.condition()).isPresent();
    }
}
