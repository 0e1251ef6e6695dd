package org.pragmatica.dvrtl.ast;

/**
 * Common contract of every AST node: it can be rendered back to canonical surface syntax.
 * Re-parsing the rendered text yields a structurally equal node.
 */
public interface SyntaxNode {
    String serialize();
}
