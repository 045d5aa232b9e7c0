package org.pragmatica.macro.fragment;

import org.pragmatica.macro.definition.FragmentSpecifier;
import org.pragmatica.macro.token.Delimiter;
import org.pragmatica.macro.token.SourceSpan;
import org.pragmatica.macro.token.Token;
import org.pragmatica.macro.token.TokenStream;

import java.util.Map;
import java.util.Set;

/**
 * Fragment oracle for a Rust-like expression language, working directly on token trees.
 *
 * <p>Grammar (low to high precedence):
 * <pre>
 * expr      : unary ( binop unary | 'as' type )*
 * unary     : ( '-' | '!' | '*' | '&' 'mut'? ) unary | 'return' expr? | postfix
 * postfix   : primary ( '(' exprs ')' | '[' expr ']' | '.' IDENT | '.' INTEGER | '?' )*
 * primary   : LITERAL | 'if' expr block ( 'else' ( if | block ) )? | 'loop' block
 *           | path ( '!' group )? | '(' exprs ')' | '[' exprs | expr ';' expr ']' | block
 * path      : '::'? IDENT ( '::' IDENT | '::' generics )*
 * type      : '&' 'mut'? type | '*' ( 'const' | 'mut' ) type | '!' | '_' | '(' types ')'
 *           | '[' type ( ';' expr )? ']' | 'fn' '(' types ')' ( '->' type )?
 *           | ( 'dyn' | 'impl' ) path ( '+' path )* | path ( generics )?
 * pat       : alt ( '|' alt )*
 * alt       : '_' | '..' | '&' 'mut'? alt | '-'? LITERAL ( ( '..' | '..=' ) '-'? LITERAL )?
 *           | 'ref'? 'mut'? IDENT ( '@' alt )? | path ( '(' pats ')' | '{' ... '}' )? | '(' pats ')' | '[' pats ']'
 * stmt      : 'let' pat ( ':' type )? ( '=' expr )? | expr
 * </pre>
 *
 * A path followed directly by a brace group ({@code Foo {}}) is not an expression in this grammar and
 * is reported as malformed at the path.
 */
public final class DefaultFragmentGrammar implements FragmentParser {

    public static final DefaultFragmentGrammar INSTANCE = new DefaultFragmentGrammar();

    private static final Set<String> NON_EXPRESSION_KEYWORDS = Set.of(
        "let", "fn", "struct", "enum", "impl", "pub", "use", "mod", "trait", "type", "const",
        "static", "extern", "where", "else", "in", "as", "mut", "ref", "dyn", "_");

    private static final Set<String> EXPRESSION_PREFIX_PUNCT = Set.of("-", "!", "*", "&", "&&", "::", "..", "..=");

    private static final Map<String, Integer> BINARY_PRECEDENCE = Map.ofEntries(
        Map.entry("=", 1), Map.entry("+=", 1), Map.entry("-=", 1), Map.entry("*=", 1),
        Map.entry("/=", 1), Map.entry("%=", 1),
        Map.entry("..", 2), Map.entry("..=", 2),
        Map.entry("||", 3),
        Map.entry("&&", 4),
        Map.entry("==", 5), Map.entry("!=", 5), Map.entry("<", 5), Map.entry(">", 5),
        Map.entry("<=", 5), Map.entry(">=", 5),
        Map.entry("|", 6),
        Map.entry("^", 7),
        Map.entry("&", 8),
        Map.entry("<<", 9), Map.entry(">>", 9),
        Map.entry("+", 10), Map.entry("-", 10),
        Map.entry("*", 11), Map.entry("/", 11), Map.entry("%", 11));

    private static final int RANGE_PRECEDENCE = 2;
    private static final int CAST_PRECEDENCE = 12;

    private DefaultFragmentGrammar() {}

    @Override
    public FragmentResult parse(FragmentSpecifier kind, TokenStream tokens, int start) {
        if (kind == FragmentSpecifier.VIS) {
            return new FragmentResult.Parsed(visibility(tokens, start));
        }
        if (start >= tokens.size()) {
            return new FragmentResult.NoMatch(kind.description());
        }
        var cursor = new Cursor(tokens, start);
        if (!canBegin(kind, cursor.peek())) {
            return new FragmentResult.NoMatch(kind.description());
        }
        try {
            switch (kind) {
                case EXPR -> expression(cursor, 0);
                case IDENT, TT, BLOCK -> cursor.advance();
                case LITERAL -> literal(cursor);
                case TY -> type(cursor);
                case PATH -> path(cursor, true);
                case PAT -> pattern(cursor);
                case STMT -> statement(cursor);
                default -> throw new IllegalStateException("Unhandled fragment kind " + kind);
            }
            return new FragmentResult.Parsed(cursor.pos());
        } catch (SyntaxError e) {
            return new FragmentResult.Malformed(e.span(), e.found(), e.getMessage());
        }
    }

    // === Start sets ===

    private static boolean canBegin(FragmentSpecifier kind, Token token) {
        return switch (kind) {
            case EXPR -> canBeginExpression(token);
            case IDENT -> token instanceof Token.Ident && !token.isIdent("_");
            case LITERAL -> token instanceof Token.Literal || token.isIdent("true") || token.isIdent("false")
                            || token.isPunct("-");
            case TY -> token instanceof Token.Ident
                       || token instanceof Token.Group group && group.delimiter() != Delimiter.BRACE
                       || token.isPunct("&") || token.isPunct("&&") || token.isPunct("*")
                       || token.isPunct("!") || token.isPunct("::");
            case PATH -> token instanceof Token.Ident ident && !NON_EXPRESSION_KEYWORDS.contains(ident.name())
                         || token.isPunct("::");
            case PAT -> token instanceof Token.Literal || token instanceof Token.Ident
                        || token instanceof Token.Group group && group.delimiter() != Delimiter.BRACE
                        || token.isPunct("&") || token.isPunct("&&") || token.isPunct("-")
                        || token.isPunct("..") || token.isPunct("::");
            case BLOCK -> token instanceof Token.Group group && group.delimiter() == Delimiter.BRACE;
            case STMT -> token.isIdent("let") || canBeginExpression(token);
            case TT, VIS -> true;
        };
    }

    private static boolean canBeginExpression(Token token) {
        if (token instanceof Token.Literal || token instanceof Token.Group) {
            return true;
        }
        if (token instanceof Token.Ident ident) {
            return !NON_EXPRESSION_KEYWORDS.contains(ident.name());
        }
        return token instanceof Token.Punct punct && EXPRESSION_PREFIX_PUNCT.contains(punct.text());
    }

    // === Expressions ===

    private void expression(Cursor c, int minPrecedence) {
        unary(c);
        while (!c.atEnd()) {
            var token = c.peek();
            if (token.isIdent("as")) {
                if (CAST_PRECEDENCE < minPrecedence) {
                    return;
                }
                c.advance();
                type(c);
                continue;
            }
            if (!(token instanceof Token.Punct punct) || !BINARY_PRECEDENCE.containsKey(punct.text())) {
                return;
            }
            int precedence = BINARY_PRECEDENCE.get(punct.text());
            if (precedence < minPrecedence) {
                return;
            }
            c.advance();
            boolean isRange = precedence == RANGE_PRECEDENCE;
            if (isRange && (c.atEnd() || !canBeginExpression(c.peek()))) {
                continue;
            }
            if (c.atEnd()) {
                throw c.errorAtEnd("expected expression after `" + punct.text() + "`");
            }
            boolean rightAssociative = precedence == 1;
            expression(c, rightAssociative ? precedence : precedence + 1);
        }
    }

    private void unary(Cursor c) {
        if (c.atEnd()) {
            throw c.errorAtEnd("expected expression");
        }
        var token = c.peek();
        if (token.isPunct("-") || token.isPunct("!") || token.isPunct("*")) {
            c.advance();
            unary(c);
            return;
        }
        if (token.isPunct("&") || token.isPunct("&&")) {
            c.advance();
            if (!c.atEnd() && c.peek().isIdent("mut")) {
                c.advance();
            }
            unary(c);
            return;
        }
        if (token.isPunct("..") || token.isPunct("..=")) {
            rangeFrom(c, (Token.Punct) token);
            return;
        }
        if (token.isIdent("return") || token.isIdent("break")) {
            c.advance();
            if (!c.atEnd() && canBeginExpression(c.peek())) {
                expression(c, 0);
            }
            return;
        }
        postfix(c);
    }

    /**
     * Prefix range: {@code ..}, {@code ..end} or {@code ..=end}. Only the inclusive form requires an end.
     */
    private void rangeFrom(Cursor c, Token.Punct operator) {
        c.advance();
        boolean hasEnd = !c.atEnd() && canBeginExpression(c.peek()) && !isRangePunct(c.peek());
        if (hasEnd) {
            expression(c, RANGE_PRECEDENCE + 1);
            return;
        }
        if (operator.text().equals("..=")) {
            throw c.atEnd()
                  ? c.errorAtEnd("expected expression after `..=`")
                  : c.error("expected expression after `..=`");
        }
    }

    private static boolean isRangePunct(Token token) {
        return token.isPunct("..") || token.isPunct("..=");
    }

    private void postfix(Cursor c) {
        primary(c);
        while (!c.atEnd()) {
            var token = c.peek();
            if (token instanceof Token.Group group && group.delimiter() == Delimiter.PARENTHESIS) {
                expressionList(group.tokens());
                c.advance();
            } else if (token instanceof Token.Group group && group.delimiter() == Delimiter.BRACKET) {
                singleExpression(group);
                c.advance();
            } else if (token.isPunct(".")) {
                c.advance();
                if (c.atEnd()) {
                    throw c.errorAtEnd("expected field or method name after `.`");
                }
                var member = c.peek();
                if (!(member instanceof Token.Ident)
                    && !(member instanceof Token.Literal literal && literal.kind() == Token.LiteralKind.INTEGER)) {
                    throw c.error("expected field or method name after `.`");
                }
                c.advance();
            } else if (token.isPunct("?")) {
                c.advance();
            } else {
                return;
            }
        }
    }

    private void primary(Cursor c) {
        var token = c.peek();
        if (token instanceof Token.Literal || token.isIdent("true") || token.isIdent("false")) {
            c.advance();
            return;
        }
        if (token.isIdent("if")) {
            ifExpression(c);
            return;
        }
        if (token.isIdent("loop")) {
            c.advance();
            block(c, "expected `{` after `loop`");
            return;
        }
        if (token instanceof Token.Ident ident && NON_EXPRESSION_KEYWORDS.contains(ident.name())) {
            throw c.error("expected expression, found keyword `" + ident.name() + "`");
        }
        if (token instanceof Token.Ident || token.isPunct("::")) {
            var pathStart = c.peek();
            path(c, false);
            if (c.check("!") && c.peekAt(1) instanceof Token.Group) {
                c.advance();
                c.advance();
                return;
            }
            if (!c.restrictStructLiterals()
                && !c.atEnd()
                && c.peek() instanceof Token.Group group
                && group.delimiter() == Delimiter.BRACE) {
                throw new SyntaxError("struct literal body is not allowed after path `" + pathStart.spelling()
                                      + "` in an expression fragment",
                                      pathStart.span(),
                                      "`" + pathStart.spelling() + "`");
            }
            return;
        }
        if (token instanceof Token.Group group) {
            switch (group.delimiter()) {
                case PARENTHESIS -> expressionList(group.tokens());
                case BRACKET -> arrayContents(group.tokens());
                case BRACE -> {
                    // block contents are statements and are not checked here
                }
            }
            c.advance();
            return;
        }
        throw c.error("expected expression, found `" + token.spelling() + "`");
    }

    private void ifExpression(Cursor c) {
        c.advance();
        if (c.atEnd()) {
            throw c.errorAtEnd("expected condition after `if`");
        }
        boolean previous = c.restrictStructLiterals(true);
        try {
            expression(c, 0);
        } finally {
            c.restrictStructLiterals(previous);
        }
        block(c, "expected `{` after `if` condition");
        if (c.check("else")) {
            c.advance();
            if (!c.atEnd() && c.peek().isIdent("if")) {
                ifExpression(c);
            } else {
                block(c, "expected `{` or `if` after `else`");
            }
        }
    }

    private void block(Cursor c, String message) {
        if (c.atEnd()) {
            throw c.errorAtEnd(message);
        }
        if (!(c.peek() instanceof Token.Group group) || group.delimiter() != Delimiter.BRACE) {
            throw c.error(message);
        }
        c.advance();
    }

    private void expressionList(TokenStream tokens) {
        var inner = new Cursor(tokens, 0);
        while (!inner.atEnd()) {
            if (!canBeginExpression(inner.peek())) {
                throw inner.error("expected expression, found `" + inner.peek().spelling() + "`");
            }
            expression(inner, 0);
            if (inner.atEnd()) {
                return;
            }
            if (!inner.check(",")) {
                throw inner.error("expected `,` or end of group, found `" + inner.peek().spelling() + "`");
            }
            inner.advance();
        }
    }

    private void arrayContents(TokenStream tokens) {
        var inner = new Cursor(tokens, 0);
        if (inner.atEnd()) {
            return;
        }
        expression(inner, 0);
        if (inner.check(";")) {
            inner.advance();
            expression(inner, 0);
            inner.expectEnd();
            return;
        }
        if (inner.atEnd()) {
            return;
        }
        if (!inner.check(",")) {
            throw inner.error("expected `,`, `;` or end of array, found `" + inner.peek().spelling() + "`");
        }
        inner.advance();
        expressionList(tokens.slice(inner.pos(), tokens.size()));
    }

    private void singleExpression(Token.Group group) {
        var inner = new Cursor(group.tokens(), 0);
        if (inner.atEnd()) {
            throw new SyntaxError("expected index expression", group.span(), "`[]`");
        }
        expression(inner, 0);
        inner.expectEnd();
    }

    // === Literals ===

    private void literal(Cursor c) {
        if (c.check("-")) {
            c.advance();
            if (c.atEnd()) {
                throw c.errorAtEnd("expected numeric literal after `-`");
            }
            if (!(c.peek() instanceof Token.Literal literal)
                || (literal.kind() != Token.LiteralKind.INTEGER && literal.kind() != Token.LiteralKind.FLOAT)) {
                throw c.error("expected numeric literal after `-`");
            }
        }
        c.advance();
    }

    // === Paths and types ===

    private void path(Cursor c, boolean typeStyle) {
        if (c.check("::")) {
            c.advance();
        }
        segment(c);
        while (!c.atEnd()) {
            if (typeStyle && c.check("<")) {
                genericArguments(c);
            } else if (typeStyle
                       && c.peek() instanceof Token.Group group
                       && group.delimiter() == Delimiter.PARENTHESIS
                       && c.peekAt(1) != null
                       && c.peekAt(1).isPunct("->")) {
                typeList(group.tokens());
                c.advance();
                c.advance();
                type(c);
                return;
            } else if (c.check("::") && c.peekAt(1) != null && c.peekAt(1).isPunct("<")) {
                c.advance();
                genericArguments(c);
            } else if (c.check("::") && c.peekAt(1) instanceof Token.Ident) {
                c.advance();
                segment(c);
            } else {
                return;
            }
        }
    }

    private void segment(Cursor c) {
        if (c.atEnd()) {
            throw c.errorAtEnd("expected identifier in path");
        }
        if (!(c.peek() instanceof Token.Ident ident) || NON_EXPRESSION_KEYWORDS.contains(ident.name())) {
            throw c.error("expected identifier in path, found `" + c.peek().spelling() + "`");
        }
        c.advance();
    }

    /**
     * Skips a balanced {@code < ... >} list; {@code >>} closes two levels.
     */
    private void genericArguments(Cursor c) {
        var open = c.peek();
        c.advance();
        int depth = 1;
        while (depth > 0) {
            if (c.atEnd()) {
                throw new SyntaxError("unclosed generic argument list", open.span(), "`<`");
            }
            var token = c.peek();
            if (token.isPunct("<")) {
                depth++;
            } else if (token.isPunct("<<")) {
                depth += 2;
            } else if (token.isPunct(">")) {
                depth--;
            } else if (token.isPunct(">>")) {
                depth -= 2;
            }
            if (depth < 0) {
                throw c.error("unbalanced `>>` in generic argument list");
            }
            c.advance();
        }
    }

    private void type(Cursor c) {
        if (c.atEnd()) {
            throw c.errorAtEnd("expected type");
        }
        var token = c.peek();
        if (token.isPunct("&") || token.isPunct("&&")) {
            c.advance();
            if (c.check("mut")) {
                c.advance();
            }
            type(c);
        } else if (token.isPunct("*")) {
            c.advance();
            if (!c.check("const") && !c.check("mut")) {
                throw c.atEnd()
                      ? c.errorAtEnd("expected `const` or `mut` in raw pointer type")
                      : c.error("expected `const` or `mut` in raw pointer type");
            }
            c.advance();
            type(c);
        } else if (token.isPunct("!") || token.isIdent("_")) {
            c.advance();
        } else if (token instanceof Token.Group group && group.delimiter() == Delimiter.PARENTHESIS) {
            typeList(group.tokens());
            c.advance();
        } else if (token instanceof Token.Group group && group.delimiter() == Delimiter.BRACKET) {
            var inner = new Cursor(group.tokens(), 0);
            type(inner);
            if (inner.check(";")) {
                inner.advance();
                expression(inner, 0);
            }
            inner.expectEnd();
            c.advance();
        } else if (token.isIdent("fn")) {
            c.advance();
            if (c.atEnd() || !(c.peek() instanceof Token.Group group) || group.delimiter() != Delimiter.PARENTHESIS) {
                throw c.atEnd() ? c.errorAtEnd("expected `(` after `fn`") : c.error("expected `(` after `fn`");
            }
            typeList(group.tokens());
            c.advance();
            if (c.check("->")) {
                c.advance();
                type(c);
            }
        } else if (token.isIdent("dyn") || token.isIdent("impl")) {
            c.advance();
            path(c, true);
            while (c.check("+")) {
                c.advance();
                path(c, true);
            }
        } else if (token instanceof Token.Ident || token.isPunct("::")) {
            path(c, true);
        } else {
            throw c.error("expected type, found `" + token.spelling() + "`");
        }
    }

    private void typeList(TokenStream tokens) {
        var inner = new Cursor(tokens, 0);
        while (!inner.atEnd()) {
            type(inner);
            if (inner.atEnd()) {
                return;
            }
            if (!inner.check(",")) {
                throw inner.error("expected `,` or end of type list, found `" + inner.peek().spelling() + "`");
            }
            inner.advance();
        }
    }

    // === Patterns and statements ===

    private void pattern(Cursor c) {
        alternative(c);
        while (c.check("|")) {
            c.advance();
            alternative(c);
        }
    }

    private void alternative(Cursor c) {
        if (c.atEnd()) {
            throw c.errorAtEnd("expected pattern");
        }
        var token = c.peek();
        if (token.isIdent("_") || token.isPunct("..")) {
            c.advance();
        } else if (token.isPunct("&") || token.isPunct("&&")) {
            c.advance();
            if (c.check("mut")) {
                c.advance();
            }
            alternative(c);
        } else if (token.isPunct("-") || token instanceof Token.Literal) {
            literal(c);
            if (c.check("..") || c.check("..=")) {
                c.advance();
                if (c.atEnd()) {
                    throw c.errorAtEnd("expected range end");
                }
                literal(c);
            }
        } else if (token.isIdent("true") || token.isIdent("false")) {
            c.advance();
        } else if (token.isIdent("ref") || token.isIdent("mut")) {
            c.advance();
            if (c.check("mut")) {
                c.advance();
            }
            binding(c);
        } else if (token instanceof Token.Ident || token.isPunct("::")) {
            int start = c.pos();
            path(c, false);
            boolean simple = c.pos() == start + 1;
            if (!c.atEnd() && c.peek() instanceof Token.Group group) {
                if (group.delimiter() == Delimiter.PARENTHESIS) {
                    patternList(group.tokens());
                    c.advance();
                } else if (group.delimiter() == Delimiter.BRACE) {
                    c.advance();
                }
            } else if (simple && c.check("@")) {
                c.advance();
                alternative(c);
            }
        } else if (token instanceof Token.Group group && group.delimiter() != Delimiter.BRACE) {
            patternList(group.tokens());
            c.advance();
        } else {
            throw c.error("expected pattern, found `" + token.spelling() + "`");
        }
    }

    private void binding(Cursor c) {
        if (c.atEnd()) {
            throw c.errorAtEnd("expected binding name");
        }
        if (!(c.peek() instanceof Token.Ident)) {
            throw c.error("expected binding name, found `" + c.peek().spelling() + "`");
        }
        c.advance();
        if (c.check("@")) {
            c.advance();
            alternative(c);
        }
    }

    private void patternList(TokenStream tokens) {
        var inner = new Cursor(tokens, 0);
        while (!inner.atEnd()) {
            pattern(inner);
            if (inner.atEnd()) {
                return;
            }
            if (!inner.check(",")) {
                throw inner.error("expected `,` or end of pattern list, found `" + inner.peek().spelling() + "`");
            }
            inner.advance();
        }
    }

    private void statement(Cursor c) {
        if (!c.check("let")) {
            expression(c, 0);
            return;
        }
        c.advance();
        pattern(c);
        if (c.check(":")) {
            c.advance();
            type(c);
        }
        if (c.check("=")) {
            c.advance();
            expression(c, 0);
        }
    }

    private static int visibility(TokenStream tokens, int start) {
        if (start >= tokens.size() || !tokens.get(start).isIdent("pub")) {
            return start;
        }
        if (start + 1 < tokens.size()
            && tokens.get(start + 1) instanceof Token.Group group
            && group.delimiter() == Delimiter.PARENTHESIS) {
            return start + 2;
        }
        return start + 1;
    }

    // === Cursor ===

    private static final class Cursor {
        private final TokenStream tokens;
        private int pos;
        private boolean restrictStructLiterals;

        Cursor(TokenStream tokens, int pos) {
            this.tokens = tokens;
            this.pos = pos;
        }

        int pos() {
            return pos;
        }

        boolean atEnd() {
            return pos >= tokens.size();
        }

        Token peek() {
            return tokens.get(pos);
        }

        /**
         * Token {@code offset} positions ahead, or {@code null} past the end.
         */
        Token peekAt(int offset) {
            return pos + offset < tokens.size() ? tokens.get(pos + offset) : null;
        }

        void advance() {
            pos++;
        }

        /**
         * True when the next token is the punctuation or keyword {@code text}.
         */
        boolean check(String text) {
            return !atEnd() && (peek().isPunct(text) || peek().isIdent(text));
        }

        boolean restrictStructLiterals() {
            return restrictStructLiterals;
        }

        boolean restrictStructLiterals(boolean value) {
            var previous = restrictStructLiterals;
            restrictStructLiterals = value;
            return previous;
        }

        void expectEnd() {
            if (!atEnd()) {
                throw error("unexpected `" + peek().spelling() + "`");
            }
        }

        SyntaxError error(String message) {
            var token = peek();
            return new SyntaxError(message, token.span(), "`" + token.spelling() + "`");
        }

        SyntaxError errorAtEnd(String message) {
            var span = tokens.isEmpty() ? SourceSpan.UNKNOWN : tokens.get(tokens.size() - 1).span().endPoint();
            return new SyntaxError(message, span, "end of input");
        }
    }

    private static final class SyntaxError extends RuntimeException {
        private final SourceSpan span;
        private final String found;

        SyntaxError(String message, SourceSpan span, String found) {
            super(message, null, false, false);
            this.span = span;
            this.found = found;
        }

        SourceSpan span() {
            return span;
        }

        String found() {
            return found;
        }
    }
}
