package org.pragmatica.macro.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.macro.token.SourceSpan;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeTest {

    private static final ExpansionError NOT_FOUND = new ExpansionError.NotFound("m", SourceSpan.UNKNOWN, List.of());

    // === Success ===

    @Test
    void success_mapAndFlatMap_transformValue() {
        var outcome = Outcome.success(20)
                             .map(value -> value + 1)
                             .flatMap(value -> Outcome.success(value * 2));

        assertTrue(outcome.isSuccess());
        assertEquals(42, outcome.unwrap());
    }

    @Test
    void success_error_throws() {
        assertThrows(IllegalStateException.class, () -> Outcome.success("x").error());
    }

    @Test
    void success_nullValue_rejected() {
        assertThrows(NullPointerException.class, () -> Outcome.success(null));
    }

    // === Failure ===

    @Test
    void failure_mapIsSkipped_errorPreserved() {
        var calls = new ArrayList<String>();
        Outcome<Integer> outcome = Outcome.failure(NOT_FOUND);

        var mapped = outcome.map(value -> {
            calls.add("map");
            return value + 1;
        });

        assertTrue(mapped.isFailure());
        assertSame(NOT_FOUND, mapped.error());
        assertTrue(calls.isEmpty());
    }

    @Test
    void failure_unwrap_throwsWithMessage() {
        Outcome<String> outcome = Outcome.failure(NOT_FOUND);

        var thrown = assertThrows(IllegalStateException.class, outcome::unwrap);
        assertTrue(thrown.getMessage().contains("cannot find macro `m`"));
    }

    @Test
    void fold_selectsBranch() {
        Outcome<String> failed = Outcome.failure(NOT_FOUND);

        assertEquals("E0001", failed.fold(ExpansionError::code, value -> value));
        assertEquals("ok", Outcome.success("ok").fold(ExpansionError::code, value -> value));
    }

    @Test
    void onSuccessAndOnFailure_runOnlyMatchingCallback() {
        var calls = new ArrayList<String>();

        Outcome.success("v")
               .onSuccess(value -> calls.add("success " + value))
               .onFailure(error -> calls.add("failure"));
        Outcome.<String>failure(NOT_FOUND)
               .onSuccess(value -> calls.add("success"))
               .onFailure(error -> calls.add("failure " + error.code()));

        assertEquals(List.of("success v", "failure E0001"), calls);
    }
}
