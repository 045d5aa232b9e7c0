package org.pragmatica.macro.expander;

import org.junit.jupiter.api.Test;
import org.pragmatica.macro.definition.MacroRulesParser;
import org.pragmatica.macro.definition.TemplateNode;
import org.pragmatica.macro.error.ExpansionError.InvalidDefinition;
import org.pragmatica.macro.error.ExpansionError.RepetitionCountMismatch;
import org.pragmatica.macro.error.ExpansionError.RepetitionDepthMismatch;
import org.pragmatica.macro.error.Outcome;
import org.pragmatica.macro.fragment.DefaultFragmentGrammar;
import org.pragmatica.macro.support.TestLexer;
import org.pragmatica.macro.token.HygieneId;
import org.pragmatica.macro.token.SourceSpan;
import org.pragmatica.macro.token.Token;
import org.pragmatica.macro.token.TokenStream;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for building rule output from a template and the bindings of a match.
 */
class TranscriberTest {

    private static final HygieneId EXPANSION = new HygieneId(42);

    private final Matcher matcher = Matcher.create(DefaultFragmentGrammar.INSTANCE);

    private Outcome<TokenStream> transcribe(String pattern, String input, String template) {
        var match = matcher.match(MacroRulesParser.parsePattern(TestLexer.tokenize(pattern)).unwrap(),
                                  TestLexer.tokenize(input));
        var bindings = assertInstanceOf(MatchResult.Success.class, match, () -> "no match: " + match).bindings();
        return Transcriber.transcribe(MacroRulesParser.parseTemplate(TestLexer.tokenize(template)).unwrap(),
                                      bindings,
                                      EXPANSION);
    }

    // === Substitution ===

    @Test
    void transcribe_substitutesCapturesIntoTemplate() {
        var output = transcribe("$e:expr ; $n:expr", "1 ; 100", "REPEAT($e, $n)").unwrap();

        assertEquals("REPEAT ( 1 , 100 )", output.spelling());
    }

    @Test
    void transcribe_templateIdentifiers_areStamped_capturesAreNot() {
        var output = transcribe("$x:ident", "value", "let tmp = $x;").unwrap();

        var introduced = (Token.Ident) output.get(1);
        var captured = (Token.Ident) output.get(3);
        assertEquals("tmp", introduced.name());
        assertEquals(EXPANSION, introduced.hygiene());
        assertEquals("value", captured.name());
        assertTrue(captured.hygiene().isRoot());
    }

    @Test
    void transcribe_identifiersInsideTemplateGroups_areStamped() {
        var output = transcribe("$x:expr", "a", "{ let b = $x; }").unwrap();

        var block = (Token.Group) output.get(0);
        assertEquals(EXPANSION, ((Token.Ident) block.tokens().get(1)).hygiene());
        assertTrue(((Token.Ident) block.tokens().get(3)).hygiene().isRoot());
    }

    // === Repetition echoes ===

    @Test
    void transcribe_echo_emitsOncePerIterationWithSeparator() {
        var output = transcribe("$($x:expr),*", "1, 2, 3", "LIST[$($x),*]").unwrap();

        assertEquals("LIST [ 1 , 2 , 3 ]", output.spelling());
    }

    @Test
    void transcribe_echoOverEmptyRepetition_emitsNothing() {
        var output = transcribe("$($x:expr),*", "", "LIST[$($x),*]").unwrap();

        assertEquals("LIST [ ]", output.spelling());
    }

    @Test
    void transcribe_nestedEcho_followsNestedIterations() {
        var output = transcribe("$($k:ident => [$($v:expr),*]);*",
                                "a => [1, 2]; b => []",
                                "$($k = [$($v),*]);*").unwrap();

        assertEquals("a = [ 1 , 2 ] ; b = [ ]", output.spelling());
    }

    @Test
    void transcribe_shallowVariableInsideEcho_isRepeatedEachIteration() {
        var output = transcribe("$sep:tt $($x:ident),*", "; a, b", "$($x $sep)*").unwrap();

        assertEquals("a ; b ;", output.spelling());
    }

    @Test
    void transcribe_echoLengthsDiffer_failsWithCountMismatch() {
        var result = transcribe("$($a:ident),* ; $($b:ident),*", "x, y, z; p, q", "$(($a $b))*");

        var error = assertInstanceOf(RepetitionCountMismatch.class, result.error());
        assertThat(error.lengths()).containsExactly(Map.entry("a", 3), Map.entry("b", 2));
        assertThat(error.message()).contains("`$a` repeats 3 times", "`$b` repeats 2 times");
    }

    @Test
    void transcribe_repeatingVariableOutsideEcho_failsWithDepthMismatch() {
        var result = transcribe("$($x:expr),*", "1, 2", "$x");

        var error = assertInstanceOf(RepetitionDepthMismatch.class, result.error());
        assertEquals("x", error.metavariable());
    }

    @Test
    void transcribe_echoWithoutRepeatingVariable_failsWithDepthMismatch() {
        var result = transcribe("$x:ident", "a", "$($x)*");

        var error = assertInstanceOf(RepetitionDepthMismatch.class, result.error());
        assertEquals("", error.metavariable());
        assertThat(error.message()).contains("no metavariables matched as repeating");
    }

    @Test
    void transcribe_unboundReference_failsWithInvalidDefinition() {
        var template = List.<TemplateNode>of(new TemplateNode.MetavariableRef("y", SourceSpan.UNKNOWN));

        var result = Transcriber.transcribe(template, BindingEnvironment.empty(), EXPANSION);

        assertInstanceOf(InvalidDefinition.class, result.error());
    }
}
