package org.pragmatica.dvrtl.tree;

/**
 * Production labels of the circuit grammar, shared by the grammar and the tree transformer.
 */
public final class Productions {
    private Productions() {}

    // Terminals
    public static final String IDENTIFIER = "identifier";
    public static final String ZERO = "zero";
    public static final String ONE = "one";
    public static final String RES = "res";

    // Synthesizable expressions
    public static final String EXPR_XOR = "expr_xor";
    public static final String EXPR_AND = "expr_and";
    public static final String EXPR_OR = "expr_or";
    public static final String MUX = "mux";
    public static final String SCOPED_EXPR = "scoped_expr";
    public static final String CALL = "call";
    public static final String LIST_OF_EXPR = "list_of_expr";

    // Arithmetic (assertion language)
    public static final String IMPL = "impl";
    public static final String ADD = "add";
    public static final String SUB = "sub";
    public static final String EQ = "eq";
    public static final String ARITH_XOR = "arith_xor";
    public static final String ARITH_AND = "arith_and";
    public static final String ARITH_OR = "arith_or";
    public static final String ARITH_NOT = "arith_not";
    public static final String SCOPED_ARITH = "scoped_arith";

    // Modules
    public static final String LIST_OF_VARIABLES = "list_of_variables";
    public static final String PRECOND = "precond";
    public static final String POSTCOND = "postcond";
    public static final String CONTRACT = "contract";
    public static final String OUT = "out";
    public static final String BODY = "body";
    public static final String MODULE = "module";

    // Statements
    public static final String REG = "reg";
    public static final String BIND = "bind";
    public static final String STMT_ASSERT = "stmt_assert";
    public static final String STMT_ASSUME = "stmt_assume";
    public static final String ANO_MODULE = "ano_module";
    public static final String STMT_SEQ = "stmt_seq";
    public static final String START = "start";
}
