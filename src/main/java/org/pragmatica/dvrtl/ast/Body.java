package org.pragmatica.dvrtl.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Module body: local statements followed by the optional output expression.
 */
public record Body(List<Stmt> statements, Optional<Expr> out) implements SyntaxNode {
    public Body {
        statements = List.copyOf(statements);
    }

    public boolean hasOutput() {
        return out.isPresent();
    }

    @Override
    public String serialize() {
        var parts = new ArrayList<String>();
        statements.forEach(stmt -> parts.add(stmt.serialize()));
        out.ifPresent(expr -> parts.add(new Out(expr).serialize()));
        return parts.isEmpty()
               ? "{}"
               : "{ " + String.join("; ", parts) + " }";
    }
}
