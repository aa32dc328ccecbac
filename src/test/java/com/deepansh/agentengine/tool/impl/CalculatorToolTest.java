package com.deepansh.agentengine.tool.impl;

import com.deepansh.agentengine.tool.ToolOutput;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CalculatorToolTest {

    private final CalculatorTool tool = new CalculatorTool();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "2+2                 | 4",
            "2 + 3 * 4           | 14",
            "(2 + 3) * 4         | 20",
            "2 ^ 3 ^ 2           | 512",
            "2 ** 10             | 1024",
            "-2 ^ 2              | -4",
            "10 % 3              | 1",
            "sqrt(16) + abs(-3)  | 7",
            "pow(2, 8)           | 256",
            "1.5e3 / 3           | 500",
            "floor(2.7) + ceil(2.1) | 5",
            "round(2.5)          | 3"
    })
    void execute_validExpressions_returnsFormattedResult(String expression, String expected) {
        ToolOutput output = tool.execute(Map.of("expression", expression));

        assertThat(output.isError()).isFalse();
        assertThat(output.output()).isEqualTo(expected);
    }

    @Test
    void execute_defaultPrecision_isSixDecimals() {
        assertThat(tool.execute(Map.of("expression", "1/3")).output()).isEqualTo("0.333333");
    }

    @Test
    void execute_customPrecision_isHonouredAndClamped() {
        assertThat(tool.execute(Map.of("expression", "pi", "precision", 2)).output()).isEqualTo("3.14");
        assertThat(tool.execute(Map.of("expression", "pi", "precision", "0")).output()).isEqualTo("3");
        assertThat(tool.execute(Map.of("expression", "2/3", "precision", -4)).output()).isEqualTo("1");
    }

    @Test
    void execute_divisionByZero_returnsError() {
        ToolOutput output = tool.execute(Map.of("expression", "5 / (2 - 2)"));

        assertThat(output.isError()).isTrue();
        assertThat(output.output()).isEqualTo("Error: Division by zero.");
    }

    @Test
    void execute_missingExpression_returnsError() {
        ToolOutput output = tool.execute(Map.of());

        assertThat(output.isError()).isTrue();
        assertThat(output.output()).contains("'expression' argument is required");
    }

    @Test
    void execute_syntaxError_returnsError() {
        ToolOutput output = tool.execute(Map.of("expression", "2 + * 3"));

        assertThat(output.isError()).isTrue();
        assertThat(output.output()).startsWith("Error: Could not evaluate expression");
    }

    @Test
    void execute_unknownFunction_returnsError() {
        ToolOutput output = tool.execute(Map.of("expression", "cbrt(8)"));

        assertThat(output.isError()).isTrue();
        assertThat(output.output()).contains("Unknown function 'cbrt'");
    }

    @Test
    void execute_negativeSquareRoot_returnsError() {
        assertThat(tool.execute(Map.of("expression", "sqrt(-1)")).isError()).isTrue();
    }

    @Test
    void evaluate_constantsAndTrig() {
        assertThat(CalculatorTool.evaluate("cos(0) + ln(e)")).isCloseTo(2.0, within(1e-12));
        assertThat(CalculatorTool.evaluate("sin(π / 2)")).isCloseTo(1.0, within(1e-12));
        assertThat(CalculatorTool.evaluate("log10(1000)")).isCloseTo(3.0, within(1e-12));
    }

    @Test
    void evaluate_trailingGarbage_throws() {
        assertThatThrownBy(() -> CalculatorTool.evaluate("2 2"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unexpected character");
    }

    @Test
    void format_negativeZero_isPlainZero() {
        assertThat(CalculatorTool.format(-0.0000001, 3)).isEqualTo("0");
    }
}
