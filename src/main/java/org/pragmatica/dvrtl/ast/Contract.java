package org.pragmatica.dvrtl.ast;

/**
 * One clause of a module contract.
 */
public sealed interface Contract extends SyntaxNode permits Contract.PreCond, Contract.PostCond {
    Arith condition();

    /**
     * Requirement on the module inputs. May not mention {@code res}.
     */
    record PreCond(Arith condition) implements Contract {
        @Override
        public String serialize() {
            return "req " + condition.serialize();
        }
    }

    /**
     * Guarantee on the module output, which it refers to as {@code res}.
     */
    record PostCond(Arith condition) implements Contract {
        @Override
        public String serialize() {
            return "ens " + condition.serialize();
        }
    }
}
