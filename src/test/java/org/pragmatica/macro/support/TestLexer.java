package org.pragmatica.macro.support;

import org.pragmatica.macro.token.Delimiter;
import org.pragmatica.macro.token.SourceLocation;
import org.pragmatica.macro.token.SourceSpan;
import org.pragmatica.macro.token.Token;
import org.pragmatica.macro.token.TokenStream;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Lexer turning source text into token trees, so tests can write macros and invocations as text.
 */
public final class TestLexer {
    private static final List<String> OPERATORS = List.of(
        "..=", "::", "=>", "->", "==", "!=", "<=", ">=", "&&", "||", "..",
        "+=", "-=", "*=", "/=", "%=", "<<", ">>");

    private final String input;
    private int pos;
    private int line;
    private int column;

    private TestLexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static TokenStream tokenize(String input) {
        return new TestLexer(input).tokenizeAll();
    }

    private TokenStream tokenizeAll() {
        var open = new ArrayDeque<OpenGroup>();
        var current = new ArrayList<Token>();
        while (true) {
            skipWhitespace();
            if (isAtEnd()) {
                break;
            }
            var start = currentLocation();
            char c = peek();
            var opening = Delimiter.opening(c);
            if (opening.isPresent()) {
                advance();
                open.push(new OpenGroup(opening.get(), start, current));
                current = new ArrayList<>();
                continue;
            }
            var closing = Delimiter.closing(c);
            if (closing.isPresent()) {
                advance();
                current = closeGroup(open, closing.get(), start, current);
                continue;
            }
            current.add(nextToken(start));
        }
        if (!open.isEmpty()) {
            throw new IllegalArgumentException("Unclosed " + open.peek().delimiter().open() + " at " + open.peek().start());
        }
        return TokenStream.of(current);
    }

    private ArrayList<Token> closeGroup(Deque<OpenGroup> open, Delimiter delimiter, SourceLocation start,
                                        ArrayList<Token> inner) {
        if (open.isEmpty() || open.peek().delimiter() != delimiter) {
            throw new IllegalArgumentException("Unbalanced " + delimiter.close() + " at " + start);
        }
        var group = open.pop();
        group.outer().add(new Token.Group(delimiter, TokenStream.of(inner), span(group.start())));
        return group.outer();
    }

    private Token nextToken(SourceLocation start) {
        char c = peek();
        if (isIdentifierStart(c)) {
            return scanIdentifier(start);
        }
        if (isDigit(c)) {
            return scanNumber(start);
        }
        if (c == '"') {
            return scanQuoted(start, '"', Token.LiteralKind.STRING);
        }
        if (c == '\'') {
            return scanQuoted(start, '\'', Token.LiteralKind.CHAR);
        }
        return scanOperator(start);
    }

    private Token scanIdentifier(SourceLocation start) {
        var sb = new StringBuilder();
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        return Token.Ident.of(sb.toString(), span(start));
    }

    private Token scanNumber(SourceLocation start) {
        var sb = new StringBuilder();
        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }
        // 1.5 is a float, 1..5 is a range
        if (pos + 1 < input.length() && peek() == '.' && isDigit(input.charAt(pos + 1))) {
            sb.append(advance());
            while (!isAtEnd() && isDigit(peek())) {
                sb.append(advance());
            }
            return new Token.Literal(Token.LiteralKind.FLOAT, sb.toString(), span(start));
        }
        return new Token.Literal(Token.LiteralKind.INTEGER, sb.toString(), span(start));
    }

    private Token scanQuoted(SourceLocation start, char quote, Token.LiteralKind kind) {
        var sb = new StringBuilder();
        sb.append(advance());
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\\' && pos + 1 < input.length()) {
                sb.append(advance());
            }
            sb.append(advance());
        }
        if (isAtEnd()) {
            throw new IllegalArgumentException("Unterminated literal at " + start);
        }
        sb.append(advance());
        return new Token.Literal(kind, sb.toString(), span(start));
    }

    private Token scanOperator(SourceLocation start) {
        for (var operator : OPERATORS) {
            if (input.startsWith(operator, pos)) {
                for (int i = 0; i < operator.length(); i++) {
                    advance();
                }
                return new Token.Punct(operator, span(start));
            }
        }
        return new Token.Punct(String.valueOf(advance()), span(start));
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++ );
        if (c == '\n') {
            line++ ;
            column = 1;
        } else {
            column++ ;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private record OpenGroup(Delimiter delimiter, SourceLocation start, ArrayList<Token> outer) {}
}
