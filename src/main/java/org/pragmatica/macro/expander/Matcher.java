package org.pragmatica.macro.expander;

import org.pragmatica.macro.definition.PatternNode;
import org.pragmatica.macro.error.ExpansionError.MalformedFragment;
import org.pragmatica.macro.fragment.FragmentParser;
import org.pragmatica.macro.fragment.FragmentResult;
import org.pragmatica.macro.token.SourceSpan;
import org.pragmatica.macro.token.Token;
import org.pragmatica.macro.token.TokenStream;

import java.util.ArrayList;
import java.util.List;

/**
 * Matches a rule pattern against invocation tokens.
 *
 * <p>Single left-to-right pass over pattern and input. Metavariables take the longest fragment the
 * {@link FragmentParser} accepts and are never shortened afterwards. Repetitions run until their body
 * stops matching; a separator is only consumed when another iteration follows it.
 */
public final class Matcher {

    private static final int MISMATCH = -1;

    private final FragmentParser fragments;

    private Matcher(FragmentParser fragments) {
        this.fragments = fragments;
    }

    public static Matcher create(FragmentParser fragments) {
        return new Matcher(fragments);
    }

    public MatchResult match(List<PatternNode> pattern, TokenStream input) {
        return match(pattern, input, input.span().endPoint());
    }

    /**
     * Match the whole of {@code input}.
     *
     * @param inputEnd location reported when the pattern expects more tokens than the input has
     */
    public MatchResult match(List<PatternNode> pattern, TokenStream input, SourceSpan inputEnd) {
        var ctx = new MatchContext();
        var binder = new BindingCollector();
        int end = matchSequence(ctx, pattern, input, 0, inputEnd, binder);

        if (ctx.hasFatal()) {
            return new MatchResult.Fatal(ctx.fatal().orElseThrow());
        }
        if (end == MISMATCH) {
            return ctx.furthestFailure();
        }
        if (end < input.size()) {
            ctx.updateFurthest(input.get(end).span(), "end of macro input", describe(input.get(end)));
            return ctx.furthestFailure();
        }
        return new MatchResult.Success(binder.toEnvironment());
    }

    private int matchSequence(MatchContext ctx, List<PatternNode> nodes, TokenStream input, int start,
                              SourceSpan end, BindingCollector binder) {
        int pos = start;
        for (var node : nodes) {
            if (node instanceof PatternNode.Literal literal) {
                pos = matchLiteral(ctx, literal, input, pos, end);
            } else if (node instanceof PatternNode.Metavariable metavariable) {
                pos = matchMetavariable(ctx, metavariable, input, pos, end, binder);
            } else if (node instanceof PatternNode.Repetition repetition) {
                pos = matchRepetition(ctx, repetition, input, pos, end, binder);
            } else if (node instanceof PatternNode.Group group) {
                pos = matchGroup(ctx, group, input, pos, end, binder);
            }
            if (pos == MISMATCH) {
                return MISMATCH;
            }
        }
        return pos;
    }

    private int matchLiteral(MatchContext ctx, PatternNode.Literal literal, TokenStream input, int pos, SourceSpan end) {
        var expected = "`" + literal.token().spelling() + "`";
        if (pos >= input.size()) {
            ctx.updateFurthest(end, expected, "end of input");
            return MISMATCH;
        }
        var token = input.get(pos);
        if (!token.spelledLike(literal.token())) {
            ctx.updateFurthest(token.span(), expected, describe(token));
            return MISMATCH;
        }
        ctx.consume(1);
        return pos + 1;
    }

    private int matchMetavariable(MatchContext ctx, PatternNode.Metavariable metavariable, TokenStream input,
                                  int pos, SourceSpan end, BindingCollector binder) {
        var result = fragments.parse(metavariable.fragment(), input, pos);

        if (result instanceof FragmentResult.Parsed parsed) {
            var captured = new Binding.Fragment(metavariable.fragment(), input.slice(pos, parsed.end()));
            var duplicate = binder.bind(metavariable.name(), captured, metavariable.span());
            if (duplicate.isPresent()) {
                ctx.fail(duplicate.get());
                return MISMATCH;
            }
            ctx.consume(parsed.end() - pos);
            return parsed.end();
        }
        if (result instanceof FragmentResult.Malformed malformed) {
            ctx.fail(new MalformedFragment(metavariable.name(),
                                           metavariable.fragment().keyword(),
                                           malformed.span(),
                                           malformed.found(),
                                           malformed.reason(),
                                           List.of()));
            return MISMATCH;
        }
        var noMatch = (FragmentResult.NoMatch) result;
        var expected = noMatch.expected() + " for `$" + metavariable.name() + ":" + metavariable.fragment().keyword() + "`";
        if (pos >= input.size()) {
            ctx.updateFurthest(end, expected, "end of input");
        } else {
            ctx.updateFurthest(input.get(pos).span(), expected, describe(input.get(pos)));
        }
        return MISMATCH;
    }

    private int matchRepetition(MatchContext ctx, PatternNode.Repetition repetition, TokenStream input,
                                int pos, SourceSpan end, BindingCollector binder) {
        var iterations = new ArrayList<BindingCollector>();
        int current = pos;

        while (iterations.size() < repetition.quantifier().max()) {
            int iterationStart = current;
            int savedProgress = ctx.progress();
            int bodyStart = current;

            if (!iterations.isEmpty() && repetition.separator().isPresent()) {
                var separator = repetition.separator().get();
                if (current >= input.size() || !input.get(current).spelledLike(separator)) {
                    if (current < input.size()) {
                        ctx.updateFurthest(input.get(current).span(), "`" + separator.spelling() + "`",
                                           describe(input.get(current)));
                    }
                    break;
                }
                ctx.consume(1);
                bodyStart = current + 1;
            }

            var iteration = binder.fork();
            int iterationEnd = matchSequence(ctx, repetition.body(), input, bodyStart, end, iteration);
            if (ctx.hasFatal()) {
                return MISMATCH;
            }
            if (iterationEnd == MISMATCH || iterationEnd == iterationStart) {
                ctx.restoreProgress(savedProgress);
                break;
            }
            iterations.add(iteration);
            current = iterationEnd;
        }

        if (iterations.size() < repetition.quantifier().min()) {
            var found = current < input.size() ? describe(input.get(current)) : "end of input";
            var span = current < input.size() ? input.get(current).span() : end;
            ctx.updateFurthest(span, "at least one repetition", found);
            return MISMATCH;
        }

        var duplicate = binder.bindRepetition(PatternNode.declaredNames(repetition.body()), iterations, repetition.span());
        if (duplicate.isPresent()) {
            ctx.fail(duplicate.get());
            return MISMATCH;
        }
        return current;
    }

    private int matchGroup(MatchContext ctx, PatternNode.Group group, TokenStream input, int pos, SourceSpan end,
                           BindingCollector binder) {
        var expected = "`" + group.delimiter().open() + "`";
        if (pos >= input.size()) {
            ctx.updateFurthest(end, expected, "end of input");
            return MISMATCH;
        }
        var token = input.get(pos);
        if (!(token instanceof Token.Group actual) || actual.delimiter() != group.delimiter()) {
            ctx.updateFurthest(token.span(), expected, describe(token));
            return MISMATCH;
        }
        ctx.consume(1);

        var inner = actual.tokens();
        var closing = actual.span().endPoint();
        int innerEnd = matchSequence(ctx, group.inner(), inner, 0, closing, binder);
        if (innerEnd == MISMATCH) {
            return MISMATCH;
        }
        if (innerEnd < inner.size()) {
            ctx.updateFurthest(inner.get(innerEnd).span(), "`" + group.delimiter().close() + "`",
                               describe(inner.get(innerEnd)));
            return MISMATCH;
        }
        return pos + 1;
    }

    static String describe(Token token) {
        if (token instanceof Token.Group group) {
            return "`" + group.delimiter().open() + "...`";
        }
        return "`" + token.spelling() + "`";
    }
}
