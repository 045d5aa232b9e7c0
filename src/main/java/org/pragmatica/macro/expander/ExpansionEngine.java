package org.pragmatica.macro.expander;

import org.pragmatica.macro.definition.MacroDefinition;
import org.pragmatica.macro.definition.MacroRegistry;
import org.pragmatica.macro.error.ExpansionError.NoMatchingRule;
import org.pragmatica.macro.error.ExpansionError.NotFound;
import org.pragmatica.macro.error.ExpansionError.RecursionLimitExceeded;
import org.pragmatica.macro.error.ExpansionFrame;
import org.pragmatica.macro.error.Outcome;
import org.pragmatica.macro.token.SourceSpan;
import org.pragmatica.macro.token.Token;
import org.pragmatica.macro.token.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Declarative macro expansion engine - interprets registered definitions to expand invocations.
 *
 * <p>Flow for one invocation: registry lookup, then each rule is matched in declaration order; the first
 * full match is transcribed with a fresh hygiene id, and invocations in the result are expanded in turn.
 * Every active expansion occupies a frame on an {@link ExpansionStack}; entering a new expansion when the
 * stack is full fails with {@code RecursionLimitExceeded} instead of growing without bound. Nested
 * invocations are found by a loop over an explicit work stack, never by host recursion.
 *
 * <p>The engine holds no per-call state and may be shared between threads.
 */
public final class ExpansionEngine implements Expander {
    private static final Logger log = LoggerFactory.getLogger(ExpansionEngine.class);

    private final MacroRegistry registry;
    private final ExpanderConfig config;
    private final Matcher matcher;
    private final HygieneContext hygiene;

    private ExpansionEngine(MacroRegistry registry, ExpanderConfig config) {
        this.registry = registry;
        this.config = config;
        this.matcher = Matcher.create(config.fragmentParser());
        this.hygiene = new HygieneContext();
    }

    public static ExpansionEngine create(MacroRegistry registry, ExpanderConfig config) {
        return new ExpansionEngine(registry, config);
    }

    public MacroRegistry registry() {
        return registry;
    }

    public ExpanderConfig config() {
        return config;
    }

    @Override
    public Outcome<TokenStream> expand(String macroName, TokenStream arguments) {
        return expand(macroName, arguments, arguments.span());
    }

    @Override
    public Outcome<TokenStream> expand(String macroName, TokenStream arguments, SourceSpan callSite) {
        var stack = new ExpansionStack(config.recursionLimit());
        var entered = enter(stack, macroName, arguments, callSite);
        if (entered.isFailure()) {
            return entered;
        }
        if (!config.expandNested()) {
            leave(stack, entered.unwrap().size());
            return entered;
        }
        return drain(stack, new Scan(entered.unwrap(), ScanKind.EXPANSION, null));
    }

    @Override
    public Outcome<TokenStream> expandAll(TokenStream tokens) {
        var stack = new ExpansionStack(config.recursionLimit());
        return drain(stack, new Scan(tokens, ScanKind.ROOT, null));
    }

    // === Invocation ===

    /**
     * Check the depth limit, push a frame and produce the selected rule's output.
     * On success the frame stays on the stack until the output has been scanned for nested invocations.
     */
    private Outcome<TokenStream> enter(ExpansionStack stack, String macroName, TokenStream arguments,
                                       SourceSpan callSite) {
        if (!stack.canPush()) {
            var chain = new ArrayList<>(stack.snapshot());
            chain.add(ExpansionFrame.enter(macroName, callSite));
            log.debug("Recursion limit {} reached while expanding `{}!`", stack.limit(), macroName);
            return Outcome.failure(new RecursionLimitExceeded(macroName, stack.limit(), callSite, chain));
        }

        var definition = registry.lookup(macroName);
        if (definition.isFailure()) {
            return Outcome.failure(new NotFound(macroName, callSite, stack.snapshot()));
        }

        stack.push(ExpansionFrame.enter(macroName, callSite));
        log.debug("Expanding `{}!` at depth {}", macroName, stack.depth());
        var result = expandWith(stack, macroName, definition.unwrap(), arguments, callSite);
        if (result.isFailure()) {
            var error = result.error().withFrames(stack.snapshot());
            stack.pop();
            return Outcome.failure(error);
        }
        return result;
    }

    private void leave(ExpansionStack stack, int outputSize) {
        var frame = stack.pop();
        log.debug("Expanded `{}!` with rule #{} into {} token(s)", frame.macroName(), frame.ruleIndex() + 1, outputSize);
    }

    private Outcome<TokenStream> expandWith(ExpansionStack stack, String macroName, MacroDefinition definition,
                                            TokenStream arguments, SourceSpan callSite) {
        var inputEnd = callSite.isKnown() ? callSite.endPoint() : arguments.span().endPoint();
        MatchResult.Failure furthest = null;
        int furthestRule = 0;

        for (int index = 0; index < definition.size(); index++) {
            var rule = definition.rule(index);
            var result = matcher.match(rule.pattern(), arguments, inputEnd);

            if (result instanceof MatchResult.Success success) {
                stack.selectRule(index);
                return Transcriber.transcribe(rule.template(), success.bindings(), hygiene.newContext());
            }
            if (result instanceof MatchResult.Fatal fatal) {
                log.debug("Rule #{} of `{}!` failed fatally: {}", index + 1, macroName, fatal.error().message());
                return Outcome.failure(fatal.error());
            }
            var failure = (MatchResult.Failure) result;
            log.trace("Rule #{} of `{}!` did not match: expected {}, found {}",
                      index + 1, macroName, failure.expected(), failure.found());
            if (furthest == null || failure.progress() > furthest.progress()) {
                furthest = failure;
                furthestRule = index;
            }
        }

        var span = furthest.span().isKnown() ? furthest.span() : callSite;
        return Outcome.failure(new NoMatchingRule(macroName, span, furthestRule, furthest.expected(),
                                                  furthest.found(), List.of()));
    }

    // === Nested invocations ===

    /**
     * Scan {@code root} for invocations, expanding each one in place.
     *
     * <p>Descending into a group or into an expansion's output pushes a {@link Scan} on an explicit work
     * stack instead of recursing, so host stack usage does not grow with the recursion limit.
     */
    private Outcome<TokenStream> drain(ExpansionStack stack, Scan root) {
        var work = new ArrayDeque<Scan>();
        work.push(root);
        while (true) {
            var scan = work.peek();
            if (scan.atEnd()) {
                work.pop();
                if (scan.kind == ScanKind.EXPANSION) {
                    leave(stack, scan.output.size());
                }
                if (work.isEmpty()) {
                    return Outcome.success(TokenStream.of(scan.output));
                }
                var parent = work.peek();
                if (scan.kind == ScanKind.GROUP) {
                    parent.output.add(new Token.Group(scan.group.delimiter(), TokenStream.of(scan.output), scan.group.span()));
                } else {
                    parent.output.addAll(scan.output);
                }
                continue;
            }

            if (isInvocation(scan.tokens, scan.index)) {
                var name = (Token.Ident) scan.tokens.get(scan.index);
                var arguments = (Token.Group) scan.tokens.get(scan.index + 2);
                scan.index += 3;
                var expanded = enter(stack, name.name(), arguments.tokens(), name.span().merge(arguments.span()));
                if (expanded.isFailure()) {
                    return expanded;
                }
                if (!config.expandNested()) {
                    scan.output.addAll(expanded.unwrap().asList());
                    leave(stack, expanded.unwrap().size());
                    continue;
                }
                work.push(new Scan(expanded.unwrap(), ScanKind.EXPANSION, null));
                continue;
            }

            var token = scan.tokens.get(scan.index++);
            if (token instanceof Token.Group group) {
                work.push(new Scan(group.tokens(), ScanKind.GROUP, group));
            } else {
                scan.output.add(token);
            }
        }
    }

    /**
     * {@code name ! group} where {@code name} is a registered macro.
     */
    private boolean isInvocation(TokenStream tokens, int index) {
        return index + 2 < tokens.size()
               && tokens.get(index) instanceof Token.Ident ident
               && tokens.get(index + 1).isPunct("!")
               && tokens.get(index + 2) instanceof Token.Group
               && registry.contains(ident.name());
    }

    private enum ScanKind {
        ROOT,
        GROUP,
        EXPANSION
    }

    /**
     * Cursor over a token sequence being scanned, with the output built from it so far.
     */
    private static final class Scan {
        private final TokenStream tokens;
        private final ScanKind kind;
        private final Token.Group group;
        private final List<Token> output;
        private int index;

        Scan(TokenStream tokens, ScanKind kind, Token.Group group) {
            this.tokens = tokens;
            this.kind = kind;
            this.group = group;
            this.output = new ArrayList<>(tokens.size());
            this.index = 0;
        }

        boolean atEnd() {
            return index >= tokens.size();
        }
    }
}
