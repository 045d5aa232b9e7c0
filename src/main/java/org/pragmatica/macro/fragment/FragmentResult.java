package org.pragmatica.macro.fragment;

import org.pragmatica.macro.token.SourceSpan;

/**
 * Answer of a {@link FragmentParser} for one metavariable capture attempt.
 */
public sealed interface FragmentResult {

    /**
     * Fragment spans tokens {@code [start, end)}. {@code end == start} only for fragments that may be empty.
     */
    record Parsed(int end) implements FragmentResult {}

    /**
     * The token at the start position cannot begin this fragment kind. The rule simply does not match here.
     */
    record NoMatch(String expected) implements FragmentResult {}

    /**
     * The fragment began but is syntactically invalid. Matching stops; no other rule is tried.
     */
    record Malformed(SourceSpan span, String found, String reason) implements FragmentResult {}
}
