package com.shardsql.types;

import com.shardsql.test.TestBase;
import com.shardsql.test.TestCategories;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("DataType Tests")
public class DataTypeTest extends TestBase {

    private static final List<DataType> PRIMITIVES = List.of(
        BooleanType.get(), IntegerType.get(), LongType.get(), DoubleType.get(),
        StringType.get(), DateType.get(), TimestampType.get());

    @Test
    @DisplayName("Each primitive type equals only itself")
    void testPrimitiveEquality() {
        for (DataType type : PRIMITIVES) {
            for (DataType other : PRIMITIVES) {
                if (type == other) {
                    assertThat(type).isEqualTo(other).hasSameHashCodeAs(other);
                } else {
                    assertThat(type).as("%s vs %s", type, other).isNotEqualTo(other);
                }
            }
        }
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource({
        "boolean,   false",
        "integer,   true",
        "long,      true",
        "double,    false",
        "string,    false",
        "date,      false",
        "timestamp, false"
    })
    @DisplayName("Primitive names and integrality")
    void testNames(String name, boolean integral) {
        DataType type = PRIMITIVES.stream().filter(t -> t.typeName().equals(name)).findFirst().orElseThrow();

        assertThat(type).hasToString(name);
        assertThat(type.isIntegral()).isEqualTo(integral);
    }

    @Test
    @DisplayName("Decimal types compare by precision and scale")
    void testDecimal() {
        assertThat(new DecimalType(10, 2)).isEqualTo(new DecimalType(10, 2));
        assertThat(new DecimalType(10, 2)).isNotEqualTo(new DecimalType(10, 3));
        assertThat(new DecimalType(10, 2).typeName()).isEqualTo("decimal(10,2)");
        assertThatThrownBy(() -> new DecimalType(0, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
