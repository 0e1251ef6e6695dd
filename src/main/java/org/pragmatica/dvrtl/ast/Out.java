package org.pragmatica.dvrtl.ast;

/**
 * Output clause closing a module body.
 */
public record Out(Expr value) implements SyntaxNode {
    @Override
    public String serialize() {
        return "out " + value.serialize();
    }
}
