package org.pragmatica.macro.expander;

import org.pragmatica.macro.error.ExpansionError;
import org.pragmatica.macro.token.SourceSpan;

/**
 * Result of matching one rule's pattern against an invocation's tokens.
 */
public sealed interface MatchResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The pattern consumed the whole input.
     */
    record Success(BindingEnvironment bindings) implements MatchResult {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * The pattern did not match. {@code progress} counts tokens consumed before the furthest failure point
     * and is used to pick the most informative rule when none match.
     */
    record Failure(int progress, SourceSpan span, String expected, String found) implements MatchResult {
        @Override
        public boolean isSuccess() {
            return false;
        }
    }

    /**
     * Matching hit an error that no other rule can recover from.
     */
    record Fatal(ExpansionError error) implements MatchResult {
        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
