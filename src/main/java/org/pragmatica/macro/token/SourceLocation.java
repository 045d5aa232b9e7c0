package org.pragmatica.macro.token;

/**
 * A position in the text a token was lexed from (line and column, both 1-based).
 * Tokens synthesized without source text carry {@link #UNKNOWN}.
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);
    public static final SourceLocation UNKNOWN = new SourceLocation(0, 0, -1);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    public boolean isKnown() {
        return offset >= 0;
    }

    @Override
    public String toString() {
        return isKnown() ? line + ":" + column : "?";
    }
}
