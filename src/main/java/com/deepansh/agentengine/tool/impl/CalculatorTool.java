package com.deepansh.agentengine.tool.impl;

import com.deepansh.agentengine.tool.AgentTool;
import com.deepansh.agentengine.tool.ToolOutput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Evaluates arithmetic expressions with a small recursive-descent parser.
 *
 * Operators: + - * / % and ** (or ^) for power, unary minus, parentheses.
 * Functions: sqrt, sin, cos, tan (radians), log (natural), log10, abs, floor, ceil, round, pow.
 * Constants: pi, e.
 *
 * Malformed input, division by zero and domain errors come back as error outputs
 * so the model can fix the expression and try again.
 */
@Component
@Slf4j
public class CalculatorTool implements AgentTool {

    private static final int DEFAULT_PRECISION = 6;
    private static final int MAX_PRECISION = 15;

    @Override
    public String getName() {
        return "calculator";
    }

    @Override
    public String getDescription() {
        return "Evaluate mathematical expressions. Supports basic arithmetic (+, -, *, /, %), "
                + "power (**), sqrt, sin, cos, tan, log, log10, abs, floor, ceil, round, "
                + "and constants (pi, e). Returns the numerical result with the requested precision.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "expression", Map.of(
                                "type", "string",
                                "description", "The expression to calculate. Examples: '2 + 2', 'sqrt(16)', "
                                        + "'3.14 * 2 ** 2', 'sin(pi/2)'"
                        ),
                        "precision", Map.of(
                                "type", "integer",
                                "description", "Decimal places in the result (0-15). Default is 6."
                        )
                ),
                "required", List.of("expression")
        );
    }

    @Override
    public ToolOutput execute(Map<String, Object> arguments) {
        Object expression = arguments.get("expression");
        if (expression == null || expression.toString().isBlank()) {
            return ToolOutput.error("Error: 'expression' argument is required");
        }
        int precision = precisionOf(arguments.get("precision"));

        try {
            double result = evaluate(expression.toString());
            if (Double.isNaN(result) || Double.isInfinite(result)) {
                return ToolOutput.error("Error: Result is not a finite number.");
            }
            String formatted = format(result, precision);
            log.debug("calculator: {} = {}", expression, formatted);
            return ToolOutput.success(formatted);
        } catch (ArithmeticException e) {
            return ToolOutput.error("Error: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            return ToolOutput.error("Error: Could not evaluate expression '" + expression + "'. " + e.getMessage());
        }
    }

    /** Evaluates {@code expression}, throwing on syntax, division-by-zero or domain errors. */
    public static double evaluate(String expression) {
        Parser parser = new Parser(expression.toLowerCase(Locale.ROOT));
        double value = parser.parseExpression();
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw new IllegalArgumentException("Unexpected character '" + parser.peek()
                    + "' at position " + parser.pos + ".");
        }
        return value;
    }

    static String format(double value, int precision) {
        String plain = BigDecimal.valueOf(value)
                .setScale(precision, RoundingMode.HALF_UP)
                .stripTrailingZeros()
                .toPlainString();
        return "-0".equals(plain) ? "0" : plain;
    }

    private static int precisionOf(Object raw) {
        int precision = DEFAULT_PRECISION;
        if (raw instanceof Number n) {
            precision = n.intValue();
        } else if (raw != null) {
            try {
                precision = Integer.parseInt(raw.toString().trim());
            } catch (NumberFormatException ignored) {
                precision = DEFAULT_PRECISION;
            }
        }
        return Math.min(Math.max(precision, 0), MAX_PRECISION);
    }

    private static final class Parser {

        private final String input;
        private int pos;

        Parser(String input) {
            this.input = input;
        }

        // expression := term (('+' | '-') term)*
        double parseExpression() {
            double value = parseTerm();
            while (true) {
                if (consume('+')) {
                    value += parseTerm();
                } else if (consume('-')) {
                    value -= parseTerm();
                } else {
                    return value;
                }
            }
        }

        // term := unary (('*' | '/' | '%') unary)*
        double parseTerm() {
            double value = parseUnary();
            while (true) {
                skipWhitespace();
                if (lookingAt("**")) {
                    return value;
                }
                if (consume('*')) {
                    value *= parseUnary();
                } else if (consume('/')) {
                    double divisor = parseUnary();
                    if (divisor == 0) {
                        throw new ArithmeticException("Division by zero.");
                    }
                    value /= divisor;
                } else if (consume('%')) {
                    double divisor = parseUnary();
                    if (divisor == 0) {
                        throw new ArithmeticException("Division by zero.");
                    }
                    value %= divisor;
                } else {
                    return value;
                }
            }
        }

        // unary := ('-' | '+') unary | power
        double parseUnary() {
            if (consume('-')) {
                return -parseUnary();
            }
            if (consume('+')) {
                return parseUnary();
            }
            return parsePower();
        }

        // power := primary (('**' | '^') unary)?   right-associative
        double parsePower() {
            double base = parsePrimary();
            skipWhitespace();
            if (lookingAt("**")) {
                pos += 2;
                return Math.pow(base, parseUnary());
            }
            if (consume('^')) {
                return Math.pow(base, parseUnary());
            }
            return base;
        }

        double parsePrimary() {
            skipWhitespace();
            if (atEnd()) {
                throw new IllegalArgumentException("Unexpected end of expression.");
            }
            if (consume('(')) {
                double value = parseExpression();
                expect(')');
                return value;
            }
            char c = peek();
            if (Character.isDigit(c) || c == '.') {
                return parseNumber();
            }
            if (Character.isLetter(c) || c == 'π') {
                return parseIdentifier();
            }
            throw new IllegalArgumentException("Unexpected character '" + c + "' at position " + pos + ".");
        }

        private double parseNumber() {
            int start = pos;
            while (!atEnd() && (Character.isDigit(peek()) || peek() == '.')) {
                pos++;
            }
            // scientific notation: 1e3, 2.5e-4
            if (!atEnd() && peek() == 'e' && pos + 1 < input.length()
                    && (Character.isDigit(input.charAt(pos + 1))
                    || ((input.charAt(pos + 1) == '-' || input.charAt(pos + 1) == '+')
                    && pos + 2 < input.length() && Character.isDigit(input.charAt(pos + 2))))) {
                pos += 2;
                while (!atEnd() && Character.isDigit(peek())) {
                    pos++;
                }
            }
            String token = input.substring(start, pos);
            try {
                return Double.parseDouble(token);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number '" + token + "'.");
            }
        }

        private double parseIdentifier() {
            if (consume('π')) {
                return Math.PI;
            }
            int start = pos;
            while (!atEnd() && (Character.isLetterOrDigit(peek()))) {
                pos++;
            }
            String name = input.substring(start, pos);
            skipWhitespace();
            if (consume('(')) {
                List<Double> args = new ArrayList<>();
                skipWhitespace();
                if (!consume(')')) {
                    do {
                        args.add(parseExpression());
                    } while (consume(','));
                    expect(')');
                }
                return apply(name, args);
            }
            switch (name) {
                case "pi":
                    return Math.PI;
                case "e":
                    return Math.E;
                default:
                    throw new IllegalArgumentException("Unknown constant '" + name
                            + "'. Supported constants: pi, e.");
            }
        }

        private double apply(String name, List<Double> args) {
            if ("pow".equals(name)) {
                requireArity(name, args, 2);
                return Math.pow(args.get(0), args.get(1));
            }
            requireArity(name, args, 1);
            double x = args.get(0);
            switch (name) {
                case "sqrt":
                    if (x < 0) {
                        throw new ArithmeticException("Cannot take the square root of a negative number.");
                    }
                    return Math.sqrt(x);
                case "sin":
                    return Math.sin(x);
                case "cos":
                    return Math.cos(x);
                case "tan":
                    return Math.tan(x);
                case "log":
                case "ln":
                    requirePositive(name, x);
                    return Math.log(x);
                case "log10":
                    requirePositive(name, x);
                    return Math.log10(x);
                case "abs":
                    return Math.abs(x);
                case "floor":
                    return Math.floor(x);
                case "ceil":
                    return Math.ceil(x);
                case "round":
                    return Math.round(x);
                default:
                    throw new IllegalArgumentException("Unknown function '" + name + "'. Supported: "
                            + "sqrt, sin, cos, tan, log, log10, abs, floor, ceil, round, pow.");
            }
        }

        private static void requireArity(String name, List<Double> args, int arity) {
            if (args.size() != arity) {
                throw new IllegalArgumentException(name + "() takes " + arity + " argument(s), got "
                        + args.size() + ".");
            }
        }

        private static void requirePositive(String name, double x) {
            if (x <= 0) {
                throw new ArithmeticException(name + "() is only defined for positive numbers.");
            }
        }

        private boolean consume(char expected) {
            skipWhitespace();
            if (!atEnd() && peek() == expected) {
                pos++;
                return true;
            }
            return false;
        }

        private void expect(char expected) {
            if (!consume(expected)) {
                throw new IllegalArgumentException("Expected '" + expected + "' at position " + pos + ".");
            }
        }

        private boolean lookingAt(String token) {
            return input.startsWith(token, pos);
        }

        void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(peek())) {
                pos++;
            }
        }

        char peek() {
            return input.charAt(pos);
        }

        boolean atEnd() {
            return pos >= input.length();
        }
    }
}
