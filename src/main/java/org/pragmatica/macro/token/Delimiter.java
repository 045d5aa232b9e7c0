package org.pragmatica.macro.token;

import java.util.Optional;

/**
 * Bracket pair enclosing a {@link Token.Group}.
 */
public enum Delimiter {
    PARENTHESIS("(", ")"),
    BRACKET("[", "]"),
    BRACE("{", "}");

    private final String open;
    private final String close;

    Delimiter(String open, String close) {
        this.open = open;
        this.close = close;
    }

    public String open() {
        return open;
    }

    public String close() {
        return close;
    }

    public static Optional<Delimiter> opening(char c) {
        for (var delimiter : values()) {
            if (delimiter.open.charAt(0) == c) {
                return Optional.of(delimiter);
            }
        }
        return Optional.empty();
    }

    public static Optional<Delimiter> closing(char c) {
        for (var delimiter : values()) {
            if (delimiter.close.charAt(0) == c) {
                return Optional.of(delimiter);
            }
        }
        return Optional.empty();
    }
}
