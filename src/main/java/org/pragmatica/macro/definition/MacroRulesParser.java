package org.pragmatica.macro.definition;

import org.pragmatica.macro.error.ExpansionError.InvalidDefinition;
import org.pragmatica.macro.error.Outcome;
import org.pragmatica.macro.token.Delimiter;
import org.pragmatica.macro.token.SourceSpan;
import org.pragmatica.macro.token.Token;
import org.pragmatica.macro.token.TokenStream;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parser for declarative macro bodies.
 * Converts the token tree of a definition body into a {@link MacroDefinition}.
 *
 * <p>Body syntax:
 * <pre>
 * rules    := rule ( ';' rule )* ';'?
 * rule     := group '=>' group
 * pattern  := ( '$' ident ':' fragment | '$' '(' pattern ')' sep? op | group | token )*
 * template := ( '$' ident | '$' '(' template ')' sep? op | group | token )*
 * op       := '*' | '+' | '?'
 * </pre>
 */
public final class MacroRulesParser {

    private final TokenStream tokens;
    private int pos;

    private MacroRulesParser(TokenStream tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Parse a definition body such as {@code ($x:expr) => { $x + 1 }; () => { 0 }}.
     */
    public static Outcome<MacroDefinition> parse(TokenStream body) {
        return new MacroRulesParser(body).parseRules();
    }

    /**
     * Parse a single pattern (the contents of a rule's left-hand group).
     */
    public static Outcome<List<PatternNode>> parsePattern(TokenStream pattern) {
        var nodes = new ArrayList<PatternNode>();
        int i = 0;
        while (i < pattern.size()) {
            var token = pattern.get(i);
            if (token.isPunct("$")) {
                if (i + 1 >= pattern.size()) {
                    return failure(token.span(), "expected metavariable name or `(` after `$`");
                }
                var next = pattern.get(i + 1);
                if (next instanceof Token.Ident ident) {
                    var metavariable = parseMetavariable(pattern, i, ident);
                    if (metavariable.isFailure()) {
                        return Outcome.failure(metavariable.error());
                    }
                    nodes.add(metavariable.unwrap());
                    i += 4;
                } else if (next instanceof Token.Group group && group.delimiter() == Delimiter.PARENTHESIS) {
                    var body = parsePattern(group.tokens());
                    if (body.isFailure()) {
                        return body;
                    }
                    var suffix = parseSuffix(pattern, i + 2, group.span());
                    if (suffix.isFailure()) {
                        return Outcome.failure(suffix.error());
                    }
                    var repetition = suffix.unwrap();
                    var span = token.span().merge(pattern.get(i + 1 + repetition.length()).span());
                    nodes.add(new PatternNode.Repetition(body.unwrap(), repetition.separator(), repetition.quantifier(), span));
                    i += 2 + repetition.length();
                } else {
                    return failure(next.span(), "expected metavariable name or `(` after `$`, found `" + next.spelling() + "`");
                }
            } else if (token instanceof Token.Group group) {
                var inner = parsePattern(group.tokens());
                if (inner.isFailure()) {
                    return inner;
                }
                nodes.add(new PatternNode.Group(group.delimiter(), inner.unwrap(), group.span()));
                i++;
            } else {
                nodes.add(new PatternNode.Literal(token));
                i++;
            }
        }
        return Outcome.success(List.copyOf(nodes));
    }

    /**
     * Parse a single template (the contents of a rule's right-hand group).
     */
    public static Outcome<List<TemplateNode>> parseTemplate(TokenStream template) {
        var nodes = new ArrayList<TemplateNode>();
        int i = 0;
        while (i < template.size()) {
            var token = template.get(i);
            if (token.isPunct("$")) {
                if (i + 1 >= template.size()) {
                    return failure(token.span(), "expected metavariable name or `(` after `$`");
                }
                var next = template.get(i + 1);
                if (next instanceof Token.Ident ident) {
                    nodes.add(new TemplateNode.MetavariableRef(ident.name(), token.span().merge(ident.span())));
                    i += 2;
                } else if (next instanceof Token.Group group && group.delimiter() == Delimiter.PARENTHESIS) {
                    var body = parseTemplate(group.tokens());
                    if (body.isFailure()) {
                        return body;
                    }
                    var suffix = parseSuffix(template, i + 2, group.span());
                    if (suffix.isFailure()) {
                        return Outcome.failure(suffix.error());
                    }
                    var repetition = suffix.unwrap();
                    var span = token.span().merge(template.get(i + 1 + repetition.length()).span());
                    nodes.add(new TemplateNode.RepetitionEcho(body.unwrap(), repetition.separator(), span));
                    i += 2 + repetition.length();
                } else {
                    return failure(next.span(), "expected metavariable name or `(` after `$`, found `" + next.spelling() + "`");
                }
            } else if (token instanceof Token.Group group) {
                var inner = parseTemplate(group.tokens());
                if (inner.isFailure()) {
                    return inner;
                }
                nodes.add(new TemplateNode.Group(group.delimiter(), inner.unwrap(), group.span()));
                i++;
            } else {
                nodes.add(new TemplateNode.Literal(token));
                i++;
            }
        }
        return Outcome.success(List.copyOf(nodes));
    }

    private Outcome<MacroDefinition> parseRules() {
        var rules = new ArrayList<MacroRule>();
        while (!isAtEnd()) {
            var rule = parseRule();
            if (rule.isFailure()) {
                return Outcome.failure(rule.error());
            }
            rules.add(rule.unwrap());
            if (isAtEnd()) {
                break;
            }
            if (!peek().isPunct(";")) {
                return failure(peek().span(), "expected `;` between rules, found `" + peek().spelling() + "`");
            }
            advance();
        }
        if (rules.isEmpty()) {
            return failure(tokens.span(), "macro definition requires at least one rule");
        }
        return Outcome.success(new MacroDefinition(rules));
    }

    private Outcome<MacroRule> parseRule() {
        var start = peek();
        if (!(start instanceof Token.Group patternGroup)) {
            return failure(start.span(), "expected delimited rule pattern, found `" + start.spelling() + "`");
        }
        advance();

        if (isAtEnd() || !peek().isPunct("=>")) {
            return failure(isAtEnd() ? patternGroup.span().endPoint() : peek().span(), "expected `=>` after rule pattern");
        }
        advance();

        if (isAtEnd() || !(peek() instanceof Token.Group templateGroup)) {
            return failure(isAtEnd() ? patternGroup.span().endPoint() : peek().span(),
                           "expected delimited rule template after `=>`");
        }
        advance();

        var pattern = parsePattern(patternGroup.tokens());
        if (pattern.isFailure()) {
            return Outcome.failure(pattern.error());
        }
        var template = parseTemplate(templateGroup.tokens());
        if (template.isFailure()) {
            return Outcome.failure(template.error());
        }

        var declared = PatternNode.declaredNames(pattern.unwrap());
        for (var name : TemplateNode.referencedNames(template.unwrap())) {
            if (!declared.contains(name)) {
                return failure(templateGroup.span(), "template uses `$" + name + "`, which the pattern does not bind");
            }
        }

        var span = patternGroup.span().merge(templateGroup.span());
        return Outcome.success(new MacroRule(pattern.unwrap(), template.unwrap(), span));
    }

    private static Outcome<PatternNode> parseMetavariable(TokenStream pattern, int dollar, Token.Ident name) {
        if (dollar + 2 >= pattern.size() || !pattern.get(dollar + 2).isPunct(":")) {
            return failure(name.span(), "missing fragment specifier for `$" + name.name() + "`");
        }
        if (dollar + 3 >= pattern.size()) {
            return failure(pattern.get(dollar + 2).span(), "missing fragment specifier for `$" + name.name() + "`");
        }
        var kind = pattern.get(dollar + 3);
        if (!(kind instanceof Token.Ident kindIdent)) {
            return failure(kind.span(), "expected fragment specifier, found `" + kind.spelling() + "`");
        }
        return FragmentSpecifier.fromKeyword(kindIdent.name())
                                .<Outcome<PatternNode>>map(fragment -> Outcome.success(
                                    new PatternNode.Metavariable(name.name(), fragment,
                                                                 pattern.get(dollar).span().merge(kind.span()))))
                                .orElseGet(() -> failure(kind.span(), "unknown fragment specifier `" + kindIdent.name() + "`"));
    }

    private static Outcome<RepetitionSuffix> parseSuffix(TokenStream tokens, int at, SourceSpan bodySpan) {
        if (at >= tokens.size()) {
            return failure(bodySpan.endPoint(), "expected one of `*`, `+`, or `?` after repetition");
        }
        var first = tokens.get(at);
        var quantifier = quantifierOf(first);
        if (quantifier.isPresent()) {
            return Outcome.success(new RepetitionSuffix(Optional.empty(), quantifier.get(), 1));
        }
        if (first instanceof Token.Group || first.isPunct("$")) {
            return failure(first.span(), "`" + first.spelling() + "` cannot be used as a repetition separator");
        }
        if (at + 1 >= tokens.size()) {
            return failure(first.span().endPoint(), "expected one of `*`, `+`, or `?` after separator");
        }
        var second = quantifierOf(tokens.get(at + 1));
        if (second.isEmpty()) {
            return failure(tokens.get(at + 1).span(), "expected one of `*`, `+`, or `?` after separator");
        }
        if (!second.get().allowsSeparator()) {
            return failure(first.span(), "the `?` repetition operator does not take a separator");
        }
        return Outcome.success(new RepetitionSuffix(Optional.of(first), second.get(), 2));
    }

    private static Optional<Quantifier> quantifierOf(Token token) {
        return token instanceof Token.Punct punct
               ? Quantifier.fromSymbol(punct.text())
               : Optional.empty();
    }

    private static <T> Outcome<T> failure(SourceSpan span, String reason) {
        return Outcome.failure(InvalidDefinition.at(span, reason));
    }

    private boolean isAtEnd() {
        return pos >= tokens.size();
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private void advance() {
        pos++;
    }

    private record RepetitionSuffix(Optional<Token> separator, Quantifier quantifier, int length) {}
}
