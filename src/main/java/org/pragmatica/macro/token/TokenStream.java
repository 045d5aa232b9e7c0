package org.pragmatica.macro.token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Immutable ordered sequence of tokens.
 *
 * <p>{@link #slice(int, int)} returns a view sharing the underlying storage, so capturing a
 * metavariable never duplicates tokens. New storage is only allocated when output is built.
 */
public final class TokenStream implements Iterable<Token> {

    private static final TokenStream EMPTY = new TokenStream(List.of());

    private final List<Token> tokens;

    private TokenStream(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static TokenStream empty() {
        return EMPTY;
    }

    public static TokenStream of(Token... tokens) {
        return new TokenStream(List.of(tokens));
    }

    public static TokenStream of(List<? extends Token> tokens) {
        return tokens.isEmpty() ? EMPTY : new TokenStream(List.copyOf(tokens));
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    /**
     * View of tokens {@code [from, to)} backed by this stream.
     */
    public TokenStream slice(int from, int to) {
        if (from == 0 && to == tokens.size()) {
            return this;
        }
        return new TokenStream(Collections.unmodifiableList(tokens.subList(from, to)));
    }

    public List<Token> asList() {
        return Collections.unmodifiableList(tokens);
    }

    public Stream<Token> stream() {
        return tokens.stream();
    }

    @Override
    public Iterator<Token> iterator() {
        return asList().iterator();
    }

    public TokenStream concat(TokenStream other) {
        if (other.isEmpty()) {
            return this;
        }
        var joined = new ArrayList<Token>(tokens.size() + other.size());
        joined.addAll(tokens);
        joined.addAll(other.tokens);
        return new TokenStream(List.copyOf(joined));
    }

    /**
     * Span from the first to the last token, or {@link SourceSpan#UNKNOWN} for an empty stream.
     */
    public SourceSpan span() {
        if (tokens.isEmpty()) {
            return SourceSpan.UNKNOWN;
        }
        return tokens.get(0).span().merge(tokens.get(tokens.size() - 1).span());
    }

    /**
     * Canonical text form: tokens separated by single spaces, groups spelled with their brackets.
     * Two streams with equal spelling are structurally identical.
     */
    public String spelling() {
        return tokens.stream()
                     .map(Token::spelling)
                     .collect(Collectors.joining(" "));
    }

    public boolean spelledLike(TokenStream other) {
        if (size() != other.size()) {
            return false;
        }
        for (int i = 0; i < size(); i++) {
            if (!get(i).spelledLike(other.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TokenStream other && tokens.equals(other.tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return spelling();
    }
}
