package org.pragmatica.dvrtl.ast;

import java.util.List;
import java.util.Optional;

/**
 * Root artifact of a transform pass.
 *
 * @param statements  top-level statements in definition order
 * @param context     top-level symbols in definition order; names are unique
 * @param definitions arena of every defining statement (nested ones included), indexed by {@link Symbol#owner()}
 */
public record Circuit(List<Stmt> statements, List<Symbol> context, List<Stmt> definitions) implements SyntaxNode {
    public Circuit {
        statements = List.copyOf(statements);
        context = List.copyOf(context);
        definitions = List.copyOf(definitions);
    }

    /**
     * Find a top-level symbol by name.
     */
    public Optional<Symbol> lookup(String name) {
        return context.stream()
                      .filter(symbol -> symbol.name().equals(name))
                      .findFirst();
    }

    /**
     * Statement that introduced the symbol, if it is bound.
     */
    public Optional<Stmt> definitionOf(Symbol symbol) {
        if (!symbol.isBound() || symbol.owner() >= definitions.size()) {
            return Optional.empty();
        }
        return Optional.of(definitions.get(symbol.owner()));
    }

    /**
     * Module a symbol names, either directly or through a binding.
     */
    public Optional<Stmt.Module> moduleOf(Symbol symbol) {
        return definitionOf(symbol).flatMap(Stmt::asModule);
    }

    @Override
    public String serialize() {
        var sb = new StringBuilder();
        for (var stmt : statements) {
            sb.append(stmt.serialize())
              .append('\n');
        }
        return sb.toString();
    }
}
