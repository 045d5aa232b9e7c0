package org.pragmatica.macro.token;

/**
 * A range of source text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static final SourceSpan UNKNOWN = new SourceSpan(SourceLocation.UNKNOWN, SourceLocation.UNKNOWN);

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public boolean isKnown() {
        return start.isKnown();
    }

    /**
     * Zero-width span at the end of this one, used to point just past the last token.
     */
    public SourceSpan endPoint() {
        return at(end);
    }

    public int length() {
        return isKnown() ? end.offset() - start.offset() : 0;
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    public SourceSpan merge(SourceSpan other) {
        if (!isKnown()) {
            return other;
        }
        if (!other.isKnown()) {
            return this;
        }
        var newStart = start.offset() <= other.start.offset() ? start : other.start;
        var newEnd = end.offset() >= other.end.offset() ? end : other.end;
        return new SourceSpan(newStart, newEnd);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
