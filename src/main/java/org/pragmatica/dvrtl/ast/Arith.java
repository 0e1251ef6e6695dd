package org.pragmatica.dvrtl.ast;

import java.util.List;

/**
 * Arithmetic term of the assertion language: a superset of {@link Expr} used in
 * {@code assert}, {@code assume} and module contracts.
 */
public sealed interface Arith extends SyntaxNode permits Arith.Binary, Arith.Not, Arith.Res, Arith.Term {

    /**
     * True if {@code res} occurs anywhere in this term.
     */
    boolean mentionsResult();

    /**
     * Lift a synthesizable expression into the assertion language.
     */
    static Arith of(Expr expr) {
        return new Term(expr);
    }

    enum ArithOperator {
        IMPL("impl"),
        ADD("+"),
        SUB("-"),
        EQ("eq"),
        XOR("xor"),
        AND("and"),
        OR("or");

        private final String keyword;

        ArithOperator(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        /**
         * Reference semantics over integers; Boolean operators expect 0/1 operands.
         */
        public int apply(int lhs, int rhs) {
            return switch (this) {
                case IMPL -> (lhs == 0 || rhs != 0) ? 1 : 0;
                case ADD -> lhs + rhs;
                case SUB -> lhs - rhs;
                case EQ -> lhs == rhs ? 1 : 0;
                case XOR -> lhs ^ rhs;
                case AND -> lhs & rhs;
                case OR -> lhs | rhs;
            };
        }
    }

    record Binary(ArithOperator operator, Arith lhs, Arith rhs) implements Arith {
        public List<Arith> operands() {
            return List.of(lhs, rhs);
        }

        @Override
        public boolean mentionsResult() {
            return lhs.mentionsResult() || rhs.mentionsResult();
        }

        @Override
        public String serialize() {
            return operator.keyword() + " " + lhs.serialize() + " " + rhs.serialize();
        }
    }

    /**
     * Logical negation; sugar for {@code xor a 1}.
     */
    record Not(Arith operand) implements Arith {
        public Arith desugar() {
            return new Binary(ArithOperator.XOR, operand, of(Value.ONE));
        }

        @Override
        public boolean mentionsResult() {
            return operand.mentionsResult();
        }

        @Override
        public String serialize() {
            return "not " + operand.serialize();
        }
    }

    /**
     * The output value of the enclosing module. Only valid inside a postcondition.
     */
    record Res() implements Arith {
        @Override
        public boolean mentionsResult() {
            return true;
        }

        @Override
        public String serialize() {
            return "res";
        }
    }

    record Term(Expr expr) implements Arith {
        @Override
        public boolean mentionsResult() {
            return false;
        }

        @Override
        public String serialize() {
            return expr.serialize();
        }
    }
}
