package org.pragmatica.dvrtl.ast;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.dvrtl.ast.Value.ONE;
import static org.pragmatica.dvrtl.ast.Value.ZERO;

class ExprTest {

    private static Expr ref(String name) {
        return new Expr.Ref(Symbol.unbound(name));
    }

    // === Serialization ===

    @Test
    void serialize_mux_usesPrefixForm() {
        assertEquals("mux 1 0 1", new Expr.Mux(ONE, ZERO, ONE).serialize());
    }

    @Test
    void serialize_nestedBinary_isPrefixWithoutParentheses() {
        var expr = new Expr.Binary(Expr.Operator.OR,
                                   new Expr.Binary(Expr.Operator.AND, ref("A"), ref("B")),
                                   new Expr.Binary(Expr.Operator.XOR, ref("C"), ONE));

        assertEquals("or and A B xor C 1", expr.serialize());
    }

    @Test
    void serialize_instance_listsArguments() {
        var inst = new Expr.Inst(Symbol.unbound("sum"), List.of(ref("a0"), ref("b0"), ZERO));

        assertEquals("sum(a0, b0, 0)", inst.serialize());
    }

    @Test
    void operands_binary_matchNamedOperands() {
        var binary = new Expr.Binary(Expr.Operator.XOR, ref("a"), ref("b"));

        assertEquals(List.of(binary.lhs(), binary.rhs()), binary.operands());
    }

    // === Denotation ===

    @Test
    void select_mux_picksTrueBranchWhenSelectorSet() {
        assertEquals(ZERO, Expr.Mux.select(ONE, ZERO, ONE));
        assertEquals(ONE, Expr.Mux.select(ZERO, ZERO, ONE));
    }

    @Test
    void apply_operators_followTruthTables() {
        assertEquals(ONE, Expr.Operator.XOR.apply(ONE, ZERO));
        assertEquals(ZERO, Expr.Operator.XOR.apply(ONE, ONE));
        assertEquals(ZERO, Expr.Operator.AND.apply(ONE, ZERO));
        assertEquals(ONE, Expr.Operator.AND.apply(ONE, ONE));
        assertEquals(ONE, Expr.Operator.OR.apply(ZERO, ONE));
        assertEquals(ZERO, Expr.Operator.OR.apply(ZERO, ZERO));
    }

    @Test
    void value_convertsToAndFromInt() {
        assertEquals(0, ZERO.toInt());
        assertEquals(1, ONE.toInt());
        assertEquals(ONE, Value.of(1));
        assertEquals("0", ZERO.serialize());
        assertThrows(IllegalArgumentException.class, () -> Value.of(2));
    }

    @Test
    void order_serializesKeyword() {
        assertEquals("skip", Order.SKIP.serialize());
        assertEquals("fail", Order.FAIL.serialize());
    }

    // === Symbols ===

    @Test
    void symbol_equality_ignoresOwner() {
        var bound = new Symbol("A", 3);
        var unbound = Symbol.unbound("A");

        assertEquals(bound, unbound);
        assertEquals(bound.hashCode(), unbound.hashCode());
        assertNotEquals(bound, Symbol.unbound("B"));
        assertTrue(bound.isBound());
        assertFalse(unbound.isBound());
    }
}
