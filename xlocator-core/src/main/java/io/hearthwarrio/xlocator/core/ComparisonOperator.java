package io.hearthwarrio.xlocator.core;

import java.util.Optional;

/**
 * Comparison operators accepted inside predicates.
 */
public enum ComparisonOperator {
    EQ("="),
    NE("!="),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Looks up an operator by its source text.
     *
     * @param symbol operator text, e.g. {@code "!="}
     * @return matching operator, or empty for unsupported text such as a lone {@code "!"}
     */
    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
