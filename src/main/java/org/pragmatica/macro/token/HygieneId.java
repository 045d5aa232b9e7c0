package org.pragmatica.macro.token;

/**
 * Expansion identity attached to identifiers. Identifiers written at the call site carry {@link #ROOT};
 * identifiers introduced by a macro template carry the id of the expansion that produced them.
 */
public record HygieneId(long value) {

    public static final HygieneId ROOT = new HygieneId(0);

    public boolean isRoot() {
        return value == 0;
    }

    @Override
    public String toString() {
        return isRoot() ? "#root" : "#" + value;
    }
}
