package org.pragmatica.macro.token;

import java.util.Objects;

/**
 * Token tree element: an atomic lexical unit or a delimited group of tokens.
 * Tokens are immutable; record equality compares every component including span and hygiene.
 */
public sealed interface Token {

    /**
     * Source location this token was lexed from (or the template location for tokens a macro produced).
     */
    SourceSpan span();

    /**
     * Source text of this token; for groups the canonical spelling of the whole tree.
     */
    String spelling();

    /**
     * Structural comparison by spelling only, ignoring spans and hygiene.
     * This is how pattern literals are compared with invocation tokens.
     */
    default boolean spelledLike(Token other) {
        return spelling().equals(other.spelling());
    }

    default boolean isPunct(String text) {
        return this instanceof Punct punct && punct.text().equals(text);
    }

    default boolean isIdent(String name) {
        return this instanceof Ident ident && ident.name().equals(name);
    }

    /**
     * Identifier or keyword. The hygiene id takes part in name resolution, see {@link #sameIdentity(Ident)}.
     */
    record Ident(String name, HygieneId hygiene, SourceSpan span) implements Token {
        public Ident {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(hygiene, "hygiene");
            Objects.requireNonNull(span, "span");
        }

        public static Ident of(String name, SourceSpan span) {
            return new Ident(name, HygieneId.ROOT, span);
        }

        public Ident withHygiene(HygieneId id) {
            return new Ident(name, id, span);
        }

        /**
         * Two identifiers resolve to the same name only when both spelling and expansion identity agree.
         */
        public boolean sameIdentity(Ident other) {
            return name.equals(other.name) && hygiene.equals(other.hygiene);
        }

        @Override
        public String spelling() {
            return name;
        }
    }

    /**
     * Literal: number, string or character, kept as written.
     */
    record Literal(LiteralKind kind, String text, SourceSpan span) implements Token {
        @Override
        public String spelling() {
            return text;
        }
    }

    /**
     * Punctuation, possibly multi-character ({@code ::}, {@code =>}, {@code ..=}).
     */
    record Punct(String text, SourceSpan span) implements Token {
        @Override
        public String spelling() {
            return text;
        }
    }

    /**
     * Delimited group. The span covers both brackets.
     */
    record Group(Delimiter delimiter, TokenStream tokens, SourceSpan span) implements Token {
        @Override
        public String spelling() {
            return tokens.isEmpty()
                   ? delimiter.open() + " " + delimiter.close()
                   : delimiter.open() + " " + tokens.spelling() + " " + delimiter.close();
        }
    }

    enum LiteralKind {
        INTEGER,
        FLOAT,
        STRING,
        CHAR
    }
}
