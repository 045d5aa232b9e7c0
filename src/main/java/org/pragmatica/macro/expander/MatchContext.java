package org.pragmatica.macro.expander;

import org.pragmatica.macro.error.ExpansionError;
import org.pragmatica.macro.token.SourceSpan;

import java.util.Optional;

/**
 * Mutable state of one pattern match: consumed-token progress, the furthest failure seen, and a fatal error
 * that aborts matching.
 */
final class MatchContext {

    private int progress;
    private int furthestProgress;
    private SourceSpan furthestSpan;
    private String furthestExpected;
    private String furthestFound;
    private ExpansionError fatal;

    MatchContext() {
        this.progress = 0;
        this.furthestProgress = -1;
        this.furthestSpan = SourceSpan.UNKNOWN;
        this.furthestExpected = "";
        this.furthestFound = "";
    }

    // === Progress ===

    int progress() {
        return progress;
    }

    void consume(int tokens) {
        progress += tokens;
    }

    void restoreProgress(int saved) {
        progress = saved;
    }

    // === Error Tracking ===

    void updateFurthest(SourceSpan span, String expected, String found) {
        if (progress > furthestProgress) {
            furthestProgress = progress;
            furthestSpan = span;
            furthestExpected = expected;
            furthestFound = found;
        } else if (progress == furthestProgress && !furthestExpected.contains(expected)) {
            furthestExpected = furthestExpected.isEmpty()
                               ? expected
                               : furthestExpected + " or " + expected;
        }
    }

    MatchResult.Failure furthestFailure() {
        return new MatchResult.Failure(Math.max(furthestProgress, 0), furthestSpan, furthestExpected, furthestFound);
    }

    // === Fatal errors ===

    void fail(ExpansionError error) {
        if (fatal == null) {
            fatal = error;
        }
    }

    boolean hasFatal() {
        return fatal != null;
    }

    Optional<ExpansionError> fatal() {
        return Optional.ofNullable(fatal);
    }
}
