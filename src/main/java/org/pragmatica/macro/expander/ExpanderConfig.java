package org.pragmatica.macro.expander;

import org.pragmatica.macro.fragment.DefaultFragmentGrammar;
import org.pragmatica.macro.fragment.FragmentParser;

import java.util.Objects;

/**
 * Expander configuration options.
 *
 * @param recursionLimit maximum number of nested expansions active at once, at least 1
 * @param expandNested   whether invocations appearing in expansion output are expanded as well
 * @param fragmentParser oracle deciding how far each metavariable capture extends
 */
public record ExpanderConfig(
    int recursionLimit,
    boolean expandNested,
    FragmentParser fragmentParser
) {
    public static final int DEFAULT_RECURSION_LIMIT = 128;

    public static final ExpanderConfig DEFAULT = new ExpanderConfig(
        DEFAULT_RECURSION_LIMIT,
        true,
        DefaultFragmentGrammar.INSTANCE
    );

    public ExpanderConfig {
        if (recursionLimit < 1) {
            throw new IllegalArgumentException("Recursion limit must be at least 1, got " + recursionLimit);
        }
        Objects.requireNonNull(fragmentParser, "fragmentParser");
    }
}
