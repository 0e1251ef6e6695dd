package org.pragmatica.dvrtl.grammar;

import org.pragmatica.dvrtl.tree.SourceSpan;

import java.util.Set;

/**
 * Token types for the circuit lexer.
 */
public sealed interface DvrtlToken {
    Set<String> KEYWORDS = Set.of("mod", "req", "ens", "out", "assert", "assume", "mux",
                                  "xor", "and", "or", "impl", "eq", "not", "res");

    SourceSpan span();

    // Names and literals
    record Identifier(SourceSpan span, String name) implements DvrtlToken {}

    record Keyword(SourceSpan span, String word) implements DvrtlToken {}

    record Bit(SourceSpan span, int value) implements DvrtlToken {}

    // Operators and delimiters: -> = , ; ( ) [ ] { } + -
    record Punct(SourceSpan span, String text) implements DvrtlToken {}

    // Special
    record Eof(SourceSpan span) implements DvrtlToken {}

    record Error(SourceSpan span, String message) implements DvrtlToken {}

    default boolean isKeyword(String word) {
        return this instanceof Keyword keyword && keyword.word()
                                                         .equals(word);
    }

    default boolean isPunct(String text) {
        return this instanceof Punct punct && punct.text()
                                                   .equals(text);
    }

    /**
     * Human-readable form for error messages.
     */
    default String describe() {
        if (this instanceof Identifier id) {
            return "identifier '" + id.name() + "'";
        }
        if (this instanceof Keyword keyword) {
            return "keyword '" + keyword.word() + "'";
        }
        if (this instanceof Bit bit) {
            return "bit '" + bit.value() + "'";
        }
        if (this instanceof Punct punct) {
            return "'" + punct.text() + "'";
        }
        if (this instanceof Error error) {
            return error.message();
        }
        return "end of input";
    }
}
