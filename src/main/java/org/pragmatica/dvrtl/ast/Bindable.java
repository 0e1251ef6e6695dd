package org.pragmatica.dvrtl.ast;

/**
 * Right-hand side of a binding: a synthesizable expression or a module definition.
 */
public sealed interface Bindable extends SyntaxNode permits Expr, Stmt.Module {}
