package org.lite.dispatch.enums;

import java.util.Arrays;
import java.util.Optional;

public enum AlertOperator {
    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_OR_EQUAL(">="),
    LESS_OR_EQUAL("<="),
    EQUAL("=="),
    NOT_EQUAL("!=");

    /** Tolerance applied by the equality operators. */
    public static final double EPSILON = 1e-4;

    private final String symbol;

    AlertOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean test(double value, double threshold) {
        return switch (this) {
            case GREATER_THAN -> value > threshold;
            case LESS_THAN -> value < threshold;
            case GREATER_OR_EQUAL -> value > threshold || Math.abs(value - threshold) < EPSILON;
            case LESS_OR_EQUAL -> value < threshold || Math.abs(value - threshold) < EPSILON;
            case EQUAL -> Math.abs(value - threshold) < EPSILON;
            case NOT_EQUAL -> Math.abs(value - threshold) >= EPSILON;
        };
    }

    public static Optional<AlertOperator> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        String trimmed = symbol.trim();
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(trimmed) || op.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
