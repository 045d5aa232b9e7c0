package org.pragmatica.macro.definition;

import java.util.Optional;

/**
 * Repetition operator following {@code $( ... )}.
 */
public enum Quantifier {
    ZERO_OR_MORE("*", 0, Integer.MAX_VALUE),
    ONE_OR_MORE("+", 1, Integer.MAX_VALUE),
    ZERO_OR_ONE("?", 0, 1);

    private final String symbol;
    private final int min;
    private final int max;

    Quantifier(String symbol, int min, int max) {
        this.symbol = symbol;
        this.min = min;
        this.max = max;
    }

    public String symbol() {
        return symbol;
    }

    public int min() {
        return min;
    }

    public int max() {
        return max;
    }

    public boolean allowsSeparator() {
        return this != ZERO_OR_ONE;
    }

    public static Optional<Quantifier> fromSymbol(String symbol) {
        for (var quantifier : values()) {
            if (quantifier.symbol.equals(symbol)) {
                return Optional.of(quantifier);
            }
        }
        return Optional.empty();
    }
}
