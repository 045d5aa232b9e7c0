package org.pragmatica.macro.expander;

import org.pragmatica.macro.token.HygieneId;
import org.pragmatica.macro.token.Token;
import org.pragmatica.macro.token.TokenStream;

import java.util.ArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Allocates one {@link HygieneId} per expansion event and stamps template-introduced identifiers with it.
 *
 * <p>Safe for concurrent use: ids come from an atomic counter, so expansions running on different threads
 * never share an id.
 */
public final class HygieneContext {

    private final AtomicLong counter = new AtomicLong();

    public HygieneId newContext() {
        return new HygieneId(counter.incrementAndGet());
    }

    /**
     * Attach {@code id} to an identifier; identifiers inside a group are stamped recursively.
     * Literals and punctuation take no part in name resolution and are returned unchanged.
     */
    public static Token stamp(Token token, HygieneId id) {
        if (token instanceof Token.Ident ident) {
            return ident.withHygiene(id);
        }
        if (token instanceof Token.Group group) {
            var stamped = new ArrayList<Token>(group.tokens().size());
            for (var inner : group.tokens()) {
                stamped.add(stamp(inner, id));
            }
            return new Token.Group(group.delimiter(), TokenStream.of(stamped), group.span());
        }
        return token;
    }
}
