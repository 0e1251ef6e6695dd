package org.pragmatica.dvrtl.parser;

import org.pragmatica.dvrtl.tree.CstNode;

/**
 * Parser configuration options.
 *
 * @param forwardReferences declare the names of each scope before transforming it, so a name may be used
 *                          ahead of its definition; when off, definitions must precede their uses
 * @param maxInputSize      largest accepted source text, in characters
 * @param maxDepth          deepest accepted nesting of terms, modules and parse tree nodes
 */
public record ParserConfig(
    boolean forwardReferences,
    int maxInputSize,
    int maxDepth
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        true,
        1_000_000,
        CstNode.DEFAULT_MAX_DEPTH
    );

    public ParserConfig {
        if (maxInputSize <= 0) {
            throw new IllegalArgumentException("maxInputSize must be positive: " + maxInputSize);
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
    }
}
