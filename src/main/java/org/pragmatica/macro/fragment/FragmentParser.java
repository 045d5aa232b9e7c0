package org.pragmatica.macro.fragment;

import org.pragmatica.macro.definition.FragmentSpecifier;
import org.pragmatica.macro.token.TokenStream;

/**
 * Grammar-aware oracle deciding how many tokens a metavariable of a given kind consumes.
 *
 * <p>The matcher knows nothing about host language syntax; it asks the oracle to parse one fragment
 * starting at a position and report how far it extends. Implementations must be stateless or thread safe,
 * since one instance serves concurrent expansions.
 */
@FunctionalInterface
public interface FragmentParser {

    /**
     * Parse one fragment of {@code kind} from {@code tokens} starting at index {@code start}.
     * The fragment must be the longest valid one; the matcher does not backtrack into shorter captures.
     */
    FragmentResult parse(FragmentSpecifier kind, TokenStream tokens, int start);
}
