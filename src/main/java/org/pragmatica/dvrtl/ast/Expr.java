package org.pragmatica.dvrtl.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Synthesizable expression. Operands are owned by their parent, so an expression is always a tree.
 */
public sealed interface Expr extends Bindable permits Value, Expr.Ref, Expr.Binary, Expr.Mux, Expr.Inst {

    /**
     * Boolean operators of the synthesizable language.
     */
    enum Operator {
        XOR("xor"),
        AND("and"),
        OR("or");

        private final String keyword;

        Operator(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        /**
         * Truth table of the operator.
         */
        public Value apply(Value lhs, Value rhs) {
            return switch (this) {
                case XOR -> Value.of(lhs.isSet() != rhs.isSet());
                case AND -> Value.of(lhs.isSet() && rhs.isSet());
                case OR -> Value.of(lhs.isSet() || rhs.isSet());
            };
        }
    }

    /**
     * Reference to a register, binding, parameter or free input.
     */
    record Ref(Symbol symbol) implements Expr {
        @Override
        public String serialize() {
            return symbol.serialize();
        }
    }

    /**
     * Binary operator. {@link #operands()} exposes the same two operands as a list.
     */
    record Binary(Operator operator, Expr lhs, Expr rhs) implements Expr {
        public List<Expr> operands() {
            return List.of(lhs, rhs);
        }

        @Override
        public String serialize() {
            return operator.keyword() + " " + lhs.serialize() + " " + rhs.serialize();
        }
    }

    /**
     * Two-way multiplexer: {@code (s and t) or (not s and f)}.
     */
    record Mux(Expr selector, Expr whenTrue, Expr whenFalse) implements Expr {
        public List<Expr> operands() {
            return List.of(selector, whenTrue, whenFalse);
        }

        public static Value select(Value selector, Value whenTrue, Value whenFalse) {
            return selector.isSet() ? whenTrue : whenFalse;
        }

        @Override
        public String serialize() {
            return "mux " + selector.serialize() + " " + whenTrue.serialize() + " " + whenFalse.serialize();
        }
    }

    /**
     * Instantiation of a module bound to {@code module}.
     */
    record Inst(Symbol module, List<Expr> arguments) implements Expr {
        public Inst {
            arguments = List.copyOf(arguments);
        }

        @Override
        public String serialize() {
            return module.serialize() + arguments.stream()
                                                 .map(Expr::serialize)
                                                 .collect(Collectors.joining(", ", "(", ")"));
        }
    }
}
