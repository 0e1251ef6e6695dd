package org.pragmatica.dvrtl.tree;

import java.util.List;

/**
 * Concrete parse tree node: a production label plus either token text or ordered children.
 * Punctuation and keywords are not kept; only the productions the transformer consumes appear.
 */
public sealed interface CstNode {
    /**
     * Default limit on how deeply productions may nest, both while parsing and while transforming.
     */
    int DEFAULT_MAX_DEPTH = 256;

    /**
     * The source span covered by this node.
     */
    SourceSpan span();

    /**
     * The production that produced this node.
     */
    String rule();

    /**
     * Terminal node - a leaf carrying raw token text (identifiers and bit literals).
     */
    record Terminal(SourceSpan span, String rule, String text) implements CstNode {}

    /**
     * Non-terminal node - an interior node with ordered children.
     */
    record NonTerminal(SourceSpan span, String rule, List<CstNode> children) implements CstNode {
        public NonTerminal {
            children = List.copyOf(children);
        }
    }

    /**
     * Terminal without source position, for trees assembled by hand.
     */
    static Terminal terminal(String rule, String text) {
        return new Terminal(SourceSpan.SYNTHETIC, rule, text);
    }

    /**
     * Non-terminal without source position, for trees assembled by hand.
     */
    static NonTerminal node(String rule, CstNode... children) {
        return new NonTerminal(SourceSpan.SYNTHETIC, rule, List.of(children));
    }
}
