package org.pragmatica.macro.expander;

import org.pragmatica.macro.definition.TemplateNode;
import org.pragmatica.macro.error.ExpansionError;
import org.pragmatica.macro.error.ExpansionError.InvalidDefinition;
import org.pragmatica.macro.error.ExpansionError.RepetitionCountMismatch;
import org.pragmatica.macro.error.ExpansionError.RepetitionDepthMismatch;
import org.pragmatica.macro.error.Outcome;
import org.pragmatica.macro.token.HygieneId;
import org.pragmatica.macro.token.Token;
import org.pragmatica.macro.token.TokenStream;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Builds the output of a matched rule from its template.
 *
 * <p>Template tokens are stamped with the expansion's hygiene id. Metavariable references are replaced
 * by their captures unchanged, so caller identifiers keep their identity. A repetition echo is emitted
 * once per captured iteration; all repeating metavariables it mentions must agree on the count.
 */
public final class Transcriber {

    private final BindingEnvironment bindings;
    private final HygieneId hygiene;
    private final List<Integer> repetitionIndices = new ArrayList<>();

    private Transcriber(BindingEnvironment bindings, HygieneId hygiene) {
        this.bindings = bindings;
        this.hygiene = hygiene;
    }

    public static Outcome<TokenStream> transcribe(List<TemplateNode> template, BindingEnvironment bindings,
                                                  HygieneId hygiene) {
        var output = new ArrayList<Token>();
        return new Transcriber(bindings, hygiene).emitSequence(template, output)
                                                 .<Outcome<TokenStream>>map(Outcome::failure)
                                                 .orElseGet(() -> Outcome.success(TokenStream.of(output)));
    }

    private Optional<ExpansionError> emitSequence(List<TemplateNode> nodes, List<Token> output) {
        for (var node : nodes) {
            Optional<ExpansionError> failure = Optional.empty();
            if (node instanceof TemplateNode.Literal literal) {
                output.add(HygieneContext.stamp(literal.token(), hygiene));
            } else if (node instanceof TemplateNode.MetavariableRef ref) {
                failure = emitReference(ref, output);
            } else if (node instanceof TemplateNode.RepetitionEcho echo) {
                failure = emitRepetition(echo, output);
            } else if (node instanceof TemplateNode.Group group) {
                var inner = new ArrayList<Token>();
                failure = emitSequence(group.inner(), inner);
                output.add(new Token.Group(group.delimiter(), TokenStream.of(inner), group.span()));
            }
            if (failure.isPresent()) {
                return failure;
            }
        }
        return Optional.empty();
    }

    private Optional<ExpansionError> emitReference(TemplateNode.MetavariableRef ref, List<Token> output) {
        var bound = bindings.lookup(ref.name());
        if (bound.isEmpty()) {
            return Optional.of(InvalidDefinition.at(ref.span(), "template uses `$" + ref.name()
                                                                + "`, which the pattern does not bind"));
        }
        var binding = atCurrentDepth(bound.get());
        if (binding instanceof Binding.Repeated) {
            return Optional.of(new RepetitionDepthMismatch(ref.name(), ref.span(),
                                                           "is still repeating at this depth", List.of()));
        }
        var fragment = (Binding.Fragment) binding;
        for (var token : fragment.tokens()) {
            output.add(token);
        }
        return Optional.empty();
    }

    private Optional<ExpansionError> emitRepetition(TemplateNode.RepetitionEcho echo, List<Token> output) {
        var lengths = new LinkedHashMap<String, Integer>();
        for (var name : TemplateNode.referencedNames(echo.body())) {
            var bound = bindings.lookup(name);
            if (bound.isEmpty()) {
                return Optional.of(InvalidDefinition.at(echo.span(), "template uses `$" + name
                                                                     + "`, which the pattern does not bind"));
            }
            if (atCurrentDepth(bound.get()) instanceof Binding.Repeated repeated) {
                lengths.put(name, repeated.size());
            }
        }
        if (lengths.isEmpty()) {
            return Optional.of(new RepetitionDepthMismatch("", echo.span(),
                                                           "attempted to repeat an expression containing no "
                                                           + "metavariables matched as repeating at this depth",
                                                           List.of()));
        }
        if (lengths.values().stream().distinct().count() > 1) {
            return Optional.of(new RepetitionCountMismatch(echo.span(), lengths, List.of()));
        }

        int count = lengths.values().iterator().next();
        for (int i = 0; i < count; i++) {
            if (i > 0 && echo.separator().isPresent()) {
                output.add(HygieneContext.stamp(echo.separator().get(), hygiene));
            }
            repetitionIndices.add(i);
            var failure = emitSequence(echo.body(), output);
            repetitionIndices.remove(repetitionIndices.size() - 1);
            if (failure.isPresent()) {
                return failure;
            }
        }
        return Optional.empty();
    }

    /**
     * Descend into a binding along the indices of the enclosing repetition echoes, outermost first.
     * A binding captured at a shallower depth than the echo is reused for every inner iteration.
     */
    private Binding atCurrentDepth(Binding binding) {
        var current = binding;
        for (int index : repetitionIndices) {
            if (!(current instanceof Binding.Repeated repeated)) {
                break;
            }
            current = repeated.get(index);
        }
        return current;
    }
}
