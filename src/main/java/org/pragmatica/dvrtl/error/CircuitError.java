package org.pragmatica.dvrtl.error;

import org.pragmatica.dvrtl.tree.SourceSpan;

/**
 * Error raised while turning source text into a circuit.
 * Every error is fatal to the pass that raised it.
 */
public sealed interface CircuitError {
    /**
     * Source region of the offending construct.
     */
    SourceSpan span();

    /**
     * Stable error code, used by {@link Diagnostic}.
     */
    String code();

    String message();

    // === Syntax ===

    /**
     * Unexpected token.
     */
    record UnexpectedInput(SourceSpan span, String found, String expected) implements CircuitError {
        @Override
        public String code() {
            return "E0001";
        }

        @Override
        public String message() {
            return "Unexpected " + found + " at " + span.start() + ", expected " + expected;
        }
    }

    /**
     * Unexpected end of input.
     */
    record UnexpectedEof(SourceSpan span, String expected) implements CircuitError {
        @Override
        public String code() {
            return "E0002";
        }

        @Override
        public String message() {
            return "Unexpected end of input at " + span.start() + ", expected " + expected;
        }
    }

    /**
     * Source text longer than the configured limit.
     */
    record InputTooLarge(SourceSpan span, int size, int limit) implements CircuitError {
        @Override
        public String code() {
            return "E0003";
        }

        @Override
        public String message() {
            return "Input of " + size + " characters exceeds the limit of " + limit;
        }
    }

    /**
     * Constructs nested deeper than the configured limit.
     */
    record NestingTooDeep(SourceSpan span, int limit) implements CircuitError {
        @Override
        public String code() {
            return "E0004";
        }

        @Override
        public String message() {
            return "Nesting deeper than " + limit + " levels at " + span.start();
        }
    }

    // === Well-formedness ===

    /**
     * A name is bound a second time in the same scope.
     */
    record DuplicateDefinition(SourceSpan span, String name) implements CircuitError {
        @Override
        public String code() {
            return "E0101";
        }

        @Override
        public String message() {
            return "Duplicate definition of '" + name + "' at " + span.start();
        }
    }

    /**
     * A call names something that is not bound to a module.
     */
    record UnknownModule(SourceSpan span, String name) implements CircuitError {
        @Override
        public String code() {
            return "E0102";
        }

        @Override
        public String message() {
            return "'" + name + "' is not a module at " + span.start();
        }
    }

    /**
     * A call supplies a different number of arguments than the module declares parameters.
     */
    record ArityMismatch(SourceSpan span, String name, int expected, int actual) implements CircuitError {
        @Override
        public String code() {
            return "E0103";
        }

        @Override
        public String message() {
            return "Module '" + name + "' expects " + expected + " argument(s) but got " + actual + " at "
                   + span.start();
        }
    }

    /**
     * A named or nested module has no output clause.
     */
    record MissingOutput(SourceSpan span, String module) implements CircuitError {
        @Override
        public String code() {
            return "E0104";
        }

        @Override
        public String message() {
            return "Module '" + module + "' has no 'out' clause at " + span.start();
        }
    }

    /**
     * {@code res} used outside a postcondition.
     */
    record MisplacedResult(SourceSpan span, String context) implements CircuitError {
        @Override
        public String code() {
            return "E0105";
        }

        @Override
        public String message() {
            return "'res' is only valid in a postcondition, found in " + context + " at " + span.start();
        }
    }

    // === Tree shape ===

    /**
     * A production received a child shape the grammar should have prevented.
     */
    record MalformedTree(SourceSpan span, String rule, String reason) implements CircuitError {
        @Override
        public String code() {
            return "E0900";
        }

        @Override
        public String message() {
            return "Malformed '" + rule + "' node at " + span.start() + ": " + reason;
        }
    }
}
