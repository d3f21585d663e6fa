package com.metricsentinel.core.rules;

import java.util.Locale;

/**
 * Comparison operators accepted by {@code threshold} rules.
 *
 * <p>
 * {@code =} and {@code ==} are synonyms, as are {@code !=} and {@code <>}.
 * The range operators compare against an inclusive {@code [lower, upper]}
 * interval.
 * </p>
 *
 * @since 1.0.0
 */
public enum ComparisonOperator {

    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_OR_EQUAL(">="),
    LESS_OR_EQUAL("<="),
    EQUAL("=="),
    NOT_EQUAL("!="),
    BETWEEN("between"),
    NOT_BETWEEN("not_between");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isRange() {
        return this == BETWEEN || this == NOT_BETWEEN;
    }

    /**
     * @param value     observed value
     * @param threshold single threshold, ignored for range operators
     * @param lower     inclusive lower bound, used by range operators only
     * @param upper     inclusive upper bound, used by range operators only
     * @return {@code true} if the comparison holds
     */
    public boolean test(double value, double threshold, double lower, double upper) {
        return switch (this) {
            case GREATER_THAN -> value > threshold;
            case LESS_THAN -> value < threshold;
            case GREATER_OR_EQUAL -> value >= threshold;
            case LESS_OR_EQUAL -> value <= threshold;
            case EQUAL -> Double.compare(value, threshold) == 0;
            case NOT_EQUAL -> Double.compare(value, threshold) != 0;
            case BETWEEN -> value >= lower && value <= upper;
            case NOT_BETWEEN -> value < lower || value > upper;
        };
    }

    /**
     * Parse an operator as written in a rule.
     *
     * @param symbol operator text, e.g. {@code >=} or {@code between}
     * @return the operator
     * @throws IllegalArgumentException if the symbol is blank or unknown
     */
    public static ComparisonOperator fromSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Comparison operator must not be blank");
        }
        String s = symbol.trim().toLowerCase(Locale.ROOT);
        return switch (s) {
            case ">" -> GREATER_THAN;
            case "<" -> LESS_THAN;
            case ">=" -> GREATER_OR_EQUAL;
            case "<=" -> LESS_OR_EQUAL;
            case "=", "==" -> EQUAL;
            case "!=", "<>" -> NOT_EQUAL;
            case "between" -> BETWEEN;
            case "not_between" -> NOT_BETWEEN;
            default -> throw new IllegalArgumentException("Unknown comparison operator: '" + symbol
                    + "'. Supported: >, <, >=, <=, =, ==, !=, <>, between, not_between");
        };
    }
}
