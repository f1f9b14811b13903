package org.pyta.checkers;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class NameStyleTest {

    @ParameterizedTest
    @CsvSource({"total_price, true",
                "_private, true",
                "__init__, true",
                "x1, true",
                "totalPrice, false",
                "Total, false"})
    void matches_snakeCase(String name, boolean expected) {
        assertThat(NameStyle.SNAKE_CASE.matches(name)).isEqualTo(expected);
    }

    @Test
    void matches_pascalAndUpperCase() {
        assertThat(NameStyle.PASCAL_CASE.matches("ShapeBase")).isTrue();
        assertThat(NameStyle.PASCAL_CASE.matches("shape_base")).isFalse();
        assertThat(NameStyle.UPPER_CASE.matches("MAX_SIZE")).isTrue();
        assertThat(NameStyle.UPPER_CASE.matches("MaxSize")).isFalse();
    }

    @ParameterizedTest
    @CsvSource({"calculateTotal, calculate_total",
                "HTTPServer, http_server",
                "_hiddenValue, _hidden_value",
                "Total_Price, total_price"})
    void convert_toSnakeCase(String name, String expected) {
        assertThat(NameStyle.SNAKE_CASE.convert(name)).isEqualTo(expected);
    }

    @Test
    void convert_toPascalAndUpperCase() {
        assertThat(NameStyle.PASCAL_CASE.convert("shape_base")).isEqualTo("ShapeBase");
        assertThat(NameStyle.UPPER_CASE.convert("maxSize")).isEqualTo("MAX_SIZE");
    }
}
