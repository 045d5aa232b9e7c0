package org.pragmatica.macro;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.pragmatica.macro.definition.MacroRegistry;
import org.pragmatica.macro.error.ExpansionError.DuplicateMetavariableBinding;
import org.pragmatica.macro.error.ExpansionError.MalformedFragment;
import org.pragmatica.macro.error.ExpansionError.NoMatchingRule;
import org.pragmatica.macro.error.ExpansionError.NotFound;
import org.pragmatica.macro.error.ExpansionError.RecursionLimitExceeded;
import org.pragmatica.macro.error.ExpansionError.RepetitionCountMismatch;
import org.pragmatica.macro.error.ExpansionFrame;
import org.pragmatica.macro.expander.Expander;
import org.pragmatica.macro.support.TestLexer;
import org.pragmatica.macro.support.TestMacros;
import org.pragmatica.macro.token.SourceLocation;
import org.pragmatica.macro.token.SourceSpan;
import org.pragmatica.macro.token.Token;
import org.pragmatica.macro.token.TokenStream;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end expansion tests: registry, matching, transcription, nested invocations and diagnostics.
 */
class MacroExpanderTest {

    private static final String LIST = """
        ($($x:expr),*) => (LIST[$($x),*]);
        ($($x:expr,)*) => (list!($($x),*))
        """;

    private static String expand(Expander expander, String name, String arguments) {
        var result = expander.expand(name, TestLexer.tokenize(arguments));
        return result.fold(error -> fail("expansion failed: " + error.message()), TokenStream::spelling);
    }

    // === Scenarios ===

    @Test
    void expand_twoExpressions_substitutesIntoTemplate() {
        var expander = MacroExpander.create(TestMacros.registry("repeat", "($e:expr; $n:expr) => (REPEAT($e,$n))"));

        var output = expander.expand("repeat", TestLexer.tokenize("1; 100")).unwrap();

        assertTrue(output.spelledLike(TestLexer.tokenize("REPEAT(1,100)")));
    }

    @Test
    void expand_separatedRepetition_emitsEachElement() {
        var expander = MacroExpander.create(TestMacros.registry("list", LIST));

        assertEquals("LIST [ 1 , 2 , 3 ]", expand(expander, "list", "1, 2, 3"));
    }

    @Test
    void expand_trailingSeparator_forwardsToSameOutput() {
        var expander = MacroExpander.create(TestMacros.registry("list", LIST));

        assertEquals(expand(expander, "list", "1, 2, 3"), expand(expander, "list", "1, 2, 3,"));
    }

    @Test
    void expand_structLiteralAsExpression_failsWithMalformedFragmentAtPath() {
        var expander = MacroExpander.create(TestMacros.registry("m", "($x:expr) => ($x)"));

        var result = expander.expand("m", TestLexer.tokenize("Foo{}"));

        assertTrue(result.isFailure());
        var error = assertInstanceOf(MalformedFragment.class, result.error());
        assertEquals(SourceLocation.at(1, 1, 0), error.span().start());
        assertEquals("`Foo`", error.found());
        assertEquals("E0007", error.code());
    }

    @Test
    void expand_prefixRangeAsExpression_isCaptured() {
        var expander = MacroExpander.create(TestMacros.registry("m", "($x:expr) => (E($x))"));

        assertEquals("E ( .. 5 )", expand(expander, "m", "..5"));
        assertEquals("E ( .. )", expand(expander, "m", ".."));
    }

    @Test
    void expand_echoOverRepetitionsOfDifferentLength_failsWithCountMismatch() {
        var expander = MacroExpander.create(TestMacros.registry(
            "zip", "($($a:ident),* ; $($b:ident),*) => ($(($a $b))*)"));

        var result = expander.expand("zip", TestLexer.tokenize("x, y, z; p, q"));

        var error = assertInstanceOf(RepetitionCountMismatch.class, result.error());
        assertEquals(3, error.lengths().get("a"));
        assertEquals(2, error.lengths().get("b"));
        assertThat(error.frames()).extracting(ExpansionFrame::macroName).containsExactly("zip");
    }

    // === Rule selection ===

    @Test
    void expand_firstMatchingRuleWins() {
        var expander = MacroExpander.create(TestMacros.registry(
            "kind", "($x:ident) => (ident); ($x:expr) => (expr); ($($t:tt)*) => (tokens)"));

        assertEquals("ident", expand(expander, "kind", "a"));
        assertEquals("expr", expand(expander, "kind", "a + 1"));
        assertEquals("tokens", expand(expander, "kind", "; ;"));
    }

    @Test
    void expand_noRuleMatches_reportsRuleThatProgressedFurthest() {
        var expander = MacroExpander.create(TestMacros.registry(
            "pick", "(a $x:expr) => ($x); (b $x:ident $y:ident) => ($x $y)"));

        var result = expander.expand("pick", TestLexer.tokenize("b c"));

        var error = assertInstanceOf(NoMatchingRule.class, result.error());
        assertEquals(1, error.ruleIndex());
        assertThat(error.expected()).contains("identifier for `$y:ident`");
        assertEquals("end of input", error.found());
        assertEquals(SourceLocation.at(1, 4, 3), error.span().start());
    }

    @Test
    void expand_duplicateBinding_isFatalAndLaterRulesAreNotTried() {
        var expander = MacroExpander.create(TestMacros.registry(
            "dup", "($x:ident $x:ident) => (); ($a:ident $b:ident) => (ok)"));

        var result = expander.expand("dup", TestLexer.tokenize("p q"));

        assertInstanceOf(DuplicateMetavariableBinding.class, result.error());
    }

    @Test
    void expand_malformedFragment_isFatalAndLaterRulesAreNotTried() {
        var expander = MacroExpander.create(TestMacros.registry(
            "m", "($x:expr) => (expr); ($($t:tt)*) => (tokens)"));

        var result = expander.expand("m", TestLexer.tokenize("Foo {}"));

        assertInstanceOf(MalformedFragment.class, result.error());
    }

    @Test
    void expand_unknownMacro_failsWithNotFound() {
        var result = MacroExpander.create(MacroRegistry.empty()).expand("nope", TokenStream.empty());

        var error = assertInstanceOf(NotFound.class, result.error());
        assertEquals("nope", error.macroName());
        assertTrue(error.frames().isEmpty());
    }

    // === Hygiene ===

    @Test
    void expand_templateIdentifier_neverCollidesWithCallerIdentifier() {
        var expander = MacroExpander.create(TestMacros.registry(
            "swap", "($a:ident, $b:ident) => { let tmp = $a; $a = $b; $b = tmp; }"));

        var output = expander.expand("swap", TestLexer.tokenize("tmp, other")).unwrap();

        assertEquals("let tmp = tmp ; tmp = other ; other = tmp ;", output.spelling());
        var introduced = (Token.Ident) output.get(1);
        var supplied = (Token.Ident) output.get(3);
        assertTrue(introduced.spelledLike(supplied));
        assertFalse(introduced.sameIdentity(supplied));
        assertTrue(supplied.hygiene().isRoot());
        assertTrue(introduced.sameIdentity((Token.Ident) output.get(11)));
    }

    @Test
    void expand_separateExpansions_getDistinctIdentities() {
        var expander = MacroExpander.create(TestMacros.registry("fresh", "() => (tmp)"));

        var first = (Token.Ident) expander.expand("fresh", TokenStream.empty()).unwrap().get(0);
        var second = (Token.Ident) expander.expand("fresh", TokenStream.empty()).unwrap().get(0);

        assertFalse(first.sameIdentity(second));
    }

    // === Nested invocations ===

    @Test
    void expand_recursiveMacro_expandsUntilBaseRule() {
        var expander = MacroExpander.create(TestMacros.registry(
            "count", "() => (0); ($head:tt $($tail:tt)*) => (1 + count!($($tail)*))"));

        assertEquals("1 + 1 + 1 + 0", expand(expander, "count", "a b c"));
    }

    @Test
    void expand_invocationSuppliedByCaller_isExpanded() {
        var expander = MacroExpander.create(TestMacros.registry(
            "list", LIST,
            "id", "($($t:tt)*) => ($($t)*)"));

        assertEquals("f ( LIST [ 1 ] )", expand(expander, "id", "f(list!(1))"));
    }

    @Test
    void expand_nestedExpansionDisabled_leavesInvocationInOutput() {
        var expander = MacroExpander.builder(TestMacros.registry("list", LIST))
                                    .expandNested(false)
                                    .build();

        assertEquals("list ! ( 1 , 2 , 3 )", expand(expander, "list", "1, 2, 3,"));
    }

    @Test
    void expandAll_expandsRegisteredInvocationsAnywhere() {
        var expander = MacroExpander.create(TestMacros.registry("list", LIST));

        var output = expander.expandAll(TestLexer.tokenize("let v = list!(1, 2); f(list![3]); other!(x)")).unwrap();

        assertEquals("let v = LIST [ 1 , 2 ] ; f ( LIST [ 3 ] ) ; other ! ( x )", output.spelling());
    }

    @Test
    void expandAll_withoutInvocations_returnsSameSpelling() {
        var expander = MacroExpander.create(MacroRegistry.empty());
        var input = TestLexer.tokenize("a + (b * [c])");

        assertEquals(input.spelling(), expander.expandAll(input).unwrap().spelling());
    }

    // === Recursion guard ===

    @ParameterizedTest
    @ValueSource(ints = {1, 5, 128})
    void expand_unboundedSelfInvocation_failsWithRecursionLimit(int limit) {
        var expander = MacroExpander.builder(TestMacros.registry("forever", "() => (forever!())"))
                                    .recursionLimit(limit)
                                    .build();
        var callSite = SourceSpan.at(SourceLocation.at(10, 5, 200));

        var result = expander.expand("forever", TokenStream.empty(), callSite);

        var error = assertInstanceOf(RecursionLimitExceeded.class, result.error());
        assertEquals(limit, error.limit());
        assertThat(error.frames()).hasSize(limit + 1);
        assertEquals(callSite, error.frames().get(0).callSite());
        assertThat(error.frames()).allMatch(frame -> frame.macroName().equals("forever"));
    }

    @Test
    void expand_selfInvocationWithLargeLimit_failsWithRecursionLimitWithoutStackOverflow() {
        var expander = MacroExpander.builder(TestMacros.registry("m", "() => (m!())"))
                                    .recursionLimit(100_000)
                                    .build();

        var result = expander.expand("m", TokenStream.empty());

        var error = assertInstanceOf(RecursionLimitExceeded.class, result.error());
        assertEquals(100_000, error.limit());
        assertThat(error.frames()).hasSize(100_001);
        assertEquals("m", error.frames().get(0).macroName());
        assertEquals(0, error.frames().get(0).ruleIndex());
    }

    @Test
    void expandAll_deeplyNestedGroups_areRebuiltInPlace() {
        var expander = MacroExpander.create(TestMacros.registry("one", "() => (1)"));
        var text = "(".repeat(20_000) + "one!()" + ")".repeat(20_000);

        var result = expander.expandAll(TestLexer.tokenize(text));

        assertTrue(result.isSuccess());
        var token = result.unwrap().get(0);
        int depth = 0;
        while (token instanceof Token.Group group) {
            depth++;
            token = group.tokens().get(0);
        }
        assertEquals(20_000, depth);
        assertEquals("1", token.spelling());
    }

    @Test
    void expand_mutualRecursion_failsWithRecursionLimit() {
        var expander = MacroExpander.builder(TestMacros.registry(
                                        "ping", "($($t:tt)*) => (pong!($($t)* x))",
                                        "pong", "($($t:tt)*) => (ping!($($t)*))"))
                                    .recursionLimit(10)
                                    .build();

        var result = expander.expand("ping", TokenStream.empty());

        var error = assertInstanceOf(RecursionLimitExceeded.class, result.error());
        assertThat(error.frames()).extracting(ExpansionFrame::macroName)
                                  .startsWith("ping", "pong", "ping");
    }

    @Test
    void builder_recursionLimitBelowOne_throws() {
        var builder = MacroExpander.builder(MacroRegistry.empty()).recursionLimit(0);

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    // === Frames and diagnostics ===

    @Test
    void expand_failureInNestedExpansion_carriesFrameChainOldestFirst() {
        var expander = MacroExpander.create(TestMacros.registry(
            "outer", "($x:expr) => (inner!($x ;))",
            "inner", "($x:expr) => ($x)"));

        var result = expander.expand("outer", TestLexer.tokenize("1"));

        var error = assertInstanceOf(NoMatchingRule.class, result.error());
        assertEquals("inner", error.macroName());
        assertThat(error.frames()).extracting(ExpansionFrame::macroName).containsExactly("outer", "inner");
        assertEquals(0, error.frames().get(0).ruleIndex());
        assertFalse(error.frames().get(1).hasRule());

        var rendered = error.toDiagnostic().format();
        assertThat(rendered).contains("error[E0003]");
        assertThat(rendered.indexOf("in this expansion of `outer!` (rule #1)"))
            .isLessThan(rendered.indexOf("in this expansion of `inner!`"));
    }

    @Test
    void expand_failure_producesNoOutput() {
        var expander = MacroExpander.create(TestMacros.registry(
            "list", LIST,
            "wrap", "($($t:tt)*) => (before list!($($t)*) after)"));

        var result = expander.expand("wrap", TestLexer.tokenize("1 ;"));

        assertTrue(result.isFailure());
        assertThrows(IllegalStateException.class, result::unwrap);
    }

    // === Definitions ===

    @Test
    void parseDefinition_delegatesToRulesParser() {
        var definition = MacroExpander.parseDefinition(TestLexer.tokenize("() => (); ($x:tt) => ($x)"));

        assertEquals(2, definition.unwrap().size());
    }

    // === Concurrency ===

    @Test
    void expand_sharedExpanderAcrossThreads_producesIdenticalResults() throws Exception {
        var expander = MacroExpander.create(TestMacros.registry("list", LIST));
        var arguments = TestLexer.tokenize("1, 2, 3,");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            var tasks = new ArrayList<Callable<String>>();
            for (int i = 0; i < 64; i++) {
                tasks.add(() -> expander.expand("list", arguments).unwrap().spelling());
            }
            List<Future<String>> futures = pool.invokeAll(tasks);
            for (var future : futures) {
                assertEquals("LIST [ 1 , 2 , 3 ]", future.get());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
