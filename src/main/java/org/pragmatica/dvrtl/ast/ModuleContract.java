package org.pragmatica.dvrtl.ast;

/**
 * Precondition/postcondition pair attached to a module.
 */
public record ModuleContract(Contract.PreCond requires, Contract.PostCond ensures) implements SyntaxNode {
    @Override
    public String serialize() {
        return "[" + requires.serialize() + "; " + ensures.serialize() + "]";
    }
}
