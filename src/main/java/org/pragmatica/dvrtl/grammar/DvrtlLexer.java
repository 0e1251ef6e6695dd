package org.pragmatica.dvrtl.grammar;

import org.pragmatica.dvrtl.tree.SourceLocation;
import org.pragmatica.dvrtl.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for circuit source text.
 */
public final class DvrtlLexer {
    private static final int DEFAULT_TOKEN_CAPACITY = 16;

    private final String input;
    private int pos;
    private int line;
    private int column;

    private DvrtlLexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static List<DvrtlToken> tokenize(String input) {
        return new DvrtlLexer(input).tokenizeAll();
    }

    private List<DvrtlToken> tokenizeAll() {
        var tokens = new ArrayList<DvrtlToken>();
        while (!isAtEnd()) {
            skipWhitespaceAndComments();
            if (!isAtEnd()) {
                tokens.add(nextToken());
            }
        }
        tokens.add(new DvrtlToken.Eof(SourceSpan.at(currentLocation())));
        return tokens;
    }

    private DvrtlToken nextToken() {
        var start = currentLocation();
        char c = peek();
        if (isIdentifierStart(c)) {
            return scanWord(start);
        }
        if (isDigit(c)) {
            return scanBit(start);
        }
        return scanOperator(start);
    }

    private DvrtlToken scanWord(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        var word = sb.toString();
        return DvrtlToken.KEYWORDS.contains(word)
               ? new DvrtlToken.Keyword(span(start), word)
               : new DvrtlToken.Identifier(span(start), word);
    }

    private DvrtlToken scanBit(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        var literal = sb.toString();
        return switch (literal) {
            case "0" -> new DvrtlToken.Bit(span(start), 0);
            case "1" -> new DvrtlToken.Bit(span(start), 1);
            default -> new DvrtlToken.Error(span(start), "literal '" + literal + "' (only 0 and 1 are bits)");
        };
    }

    private DvrtlToken scanOperator(SourceLocation start) {
        char c = advance();
        return switch (c) {
            case '-' -> {
                if (!isAtEnd() && peek() == '>') {
                    advance();
                    yield new DvrtlToken.Punct(span(start), "->");
                }
                yield new DvrtlToken.Punct(span(start), "-");
            }
            case '=', ',', ';', '(', ')', '[', ']', '{', '}', '+' -> new DvrtlToken.Punct(span(start), String.valueOf(c));
            default -> new DvrtlToken.Error(span(start), "character '" + c + "'");
        };
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '#') {
                // Line comment
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
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
}
