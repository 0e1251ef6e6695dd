package org.pragmatica.dvrtl.grammar;

import org.junit.jupiter.api.Test;
import org.pragmatica.dvrtl.error.CircuitError;
import org.pragmatica.dvrtl.error.CircuitException;
import org.pragmatica.dvrtl.tree.CstNode;
import org.pragmatica.dvrtl.tree.CstPrinter;

import static org.junit.jupiter.api.Assertions.*;

class CircuitGrammarTest {

    // === Statements ===

    @Test
    void parse_register_buildsRegNode() {
        var tree = CircuitGrammar.parse("A -> 0, A");

        var expected = """
            start
              reg
                A
                0
                A
            """;
        assertEquals(expected, CstPrinter.pretty(tree));
    }

    @Test
    void parse_emptyInput_buildsEmptyStart() {
        var tree = assertInstanceOf(CstNode.NonTerminal.class, CircuitGrammar.parse("  # nothing\n"));

        assertEquals("start", tree.rule());
        assertTrue(tree.children().isEmpty());
    }

    @Test
    void parse_semicolonSeparatedStatements_areSiblings() {
        var tree = (CstNode.NonTerminal) CircuitGrammar.parse("A -> 0, A ; A -> 1, A");

        assertEquals(2, tree.children().size());
    }

    @Test
    void parse_assertAndAssume_buildVerificationNodes() {
        var expected = """
            start
              stmt_assert
                arith_xor
                  A
                  Ap
              stmt_assume
                arith_not
                  a
            """;

        assertEquals(expected, CstPrinter.pretty(CircuitGrammar.parse("assert A xor Ap\nassume not a")));
    }

    // === Expressions ===

    @Test
    void parse_infixOperators_respectPrecedence() {
        var expected = """
            start
              bind
                x
                expr_or
                  a
                  expr_xor
                    b
                    expr_and
                      c
                      d
            """;

        assertEquals(expected, CstPrinter.pretty(CircuitGrammar.parse("x = a or b xor c and d")));
    }

    @Test
    void parse_prefixOperators_matchInfixShape() {
        var infix = CircuitGrammar.parse("x = (a and b) xor c");
        var prefix = CircuitGrammar.parse("x = xor and a b c");

        var expectedInfix = """
            start
              bind
                x
                expr_xor
                  scoped_expr
                    expr_and
                      a
                      b
                  c
            """;
        var expectedPrefix = """
            start
              bind
                x
                expr_xor
                  expr_and
                    a
                    b
                  c
            """;
        assertEquals(expectedInfix, CstPrinter.pretty(infix));
        assertEquals(expectedPrefix, CstPrinter.pretty(prefix));
    }

    @Test
    void parse_muxAndCall_buildNodes() {
        var expected = """
            start
              bind
                x
                mux
                  s
                  call
                    f
                    list_of_expr
                      a
                      1
                  0
            """;

        assertEquals(expected, CstPrinter.pretty(CircuitGrammar.parse("x = mux s f(a, 1) 0")));
    }

    @Test
    void parse_callWithoutArguments_hasEmptyArgumentList() {
        var bind = (CstNode.NonTerminal) ((CstNode.NonTerminal) CircuitGrammar.parse("x = f()")).children()
                                                                                              .get(0);
        var call = (CstNode.NonTerminal) bind.children().get(1);
        var args = (CstNode.NonTerminal) call.children().get(1);

        assertEquals("call", call.rule());
        assertTrue(args.children().isEmpty());
    }

    @Test
    void parse_nameFollowedBySpacedParenthesis_isNotACall() {
        var expected = """
            start
              bind
                x
                mux
                  a
                  scoped_expr
                    b
                  c
            """;

        assertEquals(expected, CstPrinter.pretty(CircuitGrammar.parse("x = mux a (b) c")));
    }

    @Test
    void parse_bodyOutputStartingWithParenthesis_staysSeparateFromPreviousStatement() {
        var expected = """
            start
              bind
                m
                module
                  list_of_variables
                    a
                  body
                    bind
                      y
                      a
                    out
                      scoped_expr
                        y
            """;

        assertEquals(expected, CstPrinter.pretty(CircuitGrammar.parse("m = mod(a){ y = a\n(y) }")));
    }

    // === Arithmetic ===

    @Test
    void parse_contract_buildsPreAndPostConditions() {
        var expected = """
            start
              bind
                m
                module
                  list_of_variables
                    a
                    b
                  contract
                    precond
                      a
                    postcond
                      eq
                        res
                        scoped_arith
                          add
                            a
                            b
                  body
                    out
                      expr_xor
                        a
                        b
            """;

        var tree = CircuitGrammar.parse("m = mod(a, b)[req a; ens res eq (a + b)]{ out a xor b }");

        assertEquals(expected, CstPrinter.pretty(tree));
    }

    @Test
    void parse_implication_isRightAssociative() {
        var expected = """
            start
              stmt_assert
                impl
                  a
                  impl
                    b
                    c
            """;

        assertEquals(expected, CstPrinter.pretty(CircuitGrammar.parse("assert a impl b impl c")));
    }

    @Test
    void parse_prefixArithmetic_consumesTwoOperands() {
        var expected = """
            start
              stmt_assert
                eq
                  a
                  add
                    b
                    c
            """;

        assertEquals(expected, CstPrinter.pretty(CircuitGrammar.parse("assert eq a + b c")));
    }

    // === Modules ===

    @Test
    void parse_bodyWithTrailingExpression_wrapsItInOut() {
        var expected = """
            start
              bind
                sum
                module
                  list_of_variables
                    a_in
                    b_in
                    c_in
                  body
                    bind
                      axb
                      expr_xor
                        a_in
                        b_in
                    out
                      expr_xor
                        c_in
                        axb
            """;
        var tree = CircuitGrammar.parse("""
            sum = mod(a_in, b_in, c_in) {
                axb = a_in xor b_in
                c_in xor axb
            }
            """);

        assertEquals(expected, CstPrinter.pretty(tree));
    }

    @Test
    void parse_anonymousModuleWithoutOutput_hasBodyWithStatementsOnly() {
        var tree = (CstNode.NonTerminal) CircuitGrammar.parse("mod(a){ b = a }");
        var statement = (CstNode.NonTerminal) tree.children().get(0);
        var module = (CstNode.NonTerminal) statement.children().get(0);
        var body = (CstNode.NonTerminal) module.children().get(1);

        assertEquals("ano_module", statement.rule());
        assertEquals("body", body.rule());
        assertEquals(1, body.children().size());
        assertEquals("bind", body.children().get(0).rule());
    }

    // === Errors ===

    @Test
    void parse_missingExpression_reportsEndOfInput() {
        var exception = assertThrows(CircuitException.class, () -> CircuitGrammar.parse("A -> 0,"));

        assertInstanceOf(CircuitError.UnexpectedEof.class, exception.error());
    }

    @Test
    void parse_strayToken_reportsUnexpectedInput() {
        var exception = assertThrows(CircuitException.class, () -> CircuitGrammar.parse("A -> 0, A )"));

        var error = assertInstanceOf(CircuitError.UnexpectedInput.class, exception.error());
        assertEquals("')'", error.found());
        assertEquals("statement", error.expected());
        assertEquals(1, error.span().start().line());
        assertEquals(11, error.span().start().column());
    }

    @Test
    void parse_nonBitInitialValue_reportsUnexpectedInput() {
        var exception = assertThrows(CircuitException.class, () -> CircuitGrammar.parse("A -> 2, A"));

        assertInstanceOf(CircuitError.UnexpectedInput.class, exception.error());
    }

    @Test
    void parse_registerInitialisedWithName_reportsExpectedBit() {
        var exception = assertThrows(CircuitException.class, () -> CircuitGrammar.parse("A -> B, A"));

        var error = assertInstanceOf(CircuitError.UnexpectedInput.class, exception.error());
        assertEquals("bit '0' or '1'", error.expected());
    }

    @Test
    void parse_nestingOverLimit_reportsNestingTooDeep() {
        var exception = assertThrows(CircuitException.class, () -> CircuitGrammar.parse("x = ((a))", 2));

        var error = assertInstanceOf(CircuitError.NestingTooDeep.class, exception.error());
        assertEquals(2, error.limit());
        assertEquals(7, error.span().start().column());
    }

    @Test
    void parse_nestedModulesOverLimit_reportsNestingTooDeep() {
        var exception = assertThrows(CircuitException.class,
                                     () -> CircuitGrammar.parse("m = mod(){ n = mod(){ out 1 } ; out 0 }", 1));

        assertInstanceOf(CircuitError.NestingTooDeep.class, exception.error());
    }

    @Test
    void parse_unclosedBody_reportsEndOfInput() {
        var exception = assertThrows(CircuitException.class, () -> CircuitGrammar.parse("m = mod(a){ out a"));

        var error = assertInstanceOf(CircuitError.UnexpectedEof.class, exception.error());
        assertEquals("'}'", error.expected());
    }
}
