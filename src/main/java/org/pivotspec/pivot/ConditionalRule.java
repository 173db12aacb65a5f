package org.pivotspec.pivot;

import java.util.Objects;
import java.util.Optional;

/**
 * Colors a data point when its value satisfies a comparison.
 *
 * @param when  the comparison
 * @param value operand, or lower bound for {@link Comparison#BETWEEN}
 * @param upper upper bound for {@link Comparison#BETWEEN}, otherwise null
 * @param color color key, may be null
 */
public record ConditionalRule(Comparison when, double value, Double upper, String color) {

    /**
     * Supported comparisons with their wire symbols.
     */
    public enum Comparison {
        GT(">"),
        GTE(">="),
        LT("<"),
        LTE("<="),
        BETWEEN("between"),
        EQUALS("equals");

        private final String symbol;

        Comparison(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static Optional<Comparison> fromSymbol(String symbol) {
            for (Comparison c : values()) {
                if (c.symbol.equals(symbol)) {
                    return Optional.of(c);
                }
            }
            return Optional.empty();
        }
    }

    public ConditionalRule {
        Objects.requireNonNull(when, "when");
        if (when == Comparison.BETWEEN && upper == null) {
            throw new IllegalArgumentException("between rule requires an upper bound");
        }
    }

    /**
     * @param x a data value
     * @return true if the rule applies to {@code x}
     */
    public boolean matches(double x) {
        return switch (when) {
            case GT -> x > value;
            case GTE -> x >= value;
            case LT -> x < value;
            case LTE -> x <= value;
            case BETWEEN -> x >= Math.min(value, upper) && x <= Math.max(value, upper);
            case EQUALS -> x == value;
        };
    }
}
