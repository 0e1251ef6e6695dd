package org.pragmatica.dvrtl.transform;

import org.pragmatica.dvrtl.ast.Stmt;
import org.pragmatica.dvrtl.ast.Symbol;
import org.pragmatica.dvrtl.error.CircuitError;
import org.pragmatica.dvrtl.error.CircuitException;
import org.pragmatica.dvrtl.tree.SourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Name-binding state of a single transform pass.
 *
 * <p>Definitions live in an append-only arena; a {@link Symbol} refers to its definition by
 * arena slot. Names are resolved through a stack of scopes: the global scope plus one scope
 * per module currently being transformed.
 *
 * <p>Not thread-safe. Each pass owns its own instance.
 */
public final class SymbolContext {

    /**
     * What a pre-declared name is going to be bound to.
     */
    public enum Kind {
        REGISTER,
        BINDING,
        MODULE
    }

    private static final class Slot {
        private Kind kind;
        private final int arity;
        private Stmt definition;

        private Slot(Kind kind, int arity) {
            this.kind = kind;
            this.arity = arity;
        }
    }

    private static final class Scope {
        private final Map<String, Symbol> symbols = new LinkedHashMap<>();
        private final Set<String> defined = new HashSet<>();
    }

    private final List<Slot> arena = new ArrayList<>();
    private final Deque<Scope> scopes = new ArrayDeque<>();
    private final Scope global = new Scope();

    private SymbolContext() {
        scopes.push(global);
    }

    public static SymbolContext create() {
        return new SymbolContext();
    }

    /**
     * Most relevant binding for the name: innermost scope first.
     */
    public Optional<Symbol> lookup(String name) {
        for (var scope : scopes) {
            var symbol = scope.symbols.get(name);
            if (symbol != null) {
                return Optional.of(symbol);
            }
        }
        return Optional.empty();
    }

    /**
     * Reserve a slot for a name that the current scope is going to define.
     * A name already known to the current scope is left untouched.
     */
    public Symbol declare(String name, Kind kind, int arity) {
        var scope = current();
        var existing = scope.symbols.get(name);
        if (existing != null) {
            return existing;
        }
        arena.add(new Slot(kind, arity));
        var symbol = new Symbol(name, arena.size() - 1);
        scope.symbols.put(name, symbol);
        return symbol;
    }

    /**
     * Bind the name to its defining statement in the current scope.
     *
     * @throws CircuitException with {@link CircuitError.DuplicateDefinition} if the name is already defined here
     */
    public Symbol define(String name, Stmt stmt, SourceSpan span) {
        var symbol = claim(name, span);
        attach(symbol, stmt);
        return symbol;
    }

    /**
     * Claim the name in the current scope and return the symbol its definition will be stored under.
     * The definition itself is supplied through {@link #attach(Symbol, Stmt)}, so that the defining
     * statement can carry the bound symbol.
     *
     * @throws CircuitException with {@link CircuitError.DuplicateDefinition} if the name is already defined here
     */
    public Symbol claim(String name, SourceSpan span) {
        var scope = current();
        if (scope.defined.contains(name)) {
            throw new CircuitException(new CircuitError.DuplicateDefinition(span, name));
        }
        var symbol = scope.symbols.get(name);
        if (symbol == null || !symbol.isBound()) {
            arena.add(new Slot(Kind.BINDING, 0));
            symbol = new Symbol(name, arena.size() - 1);
            scope.symbols.put(name, symbol);
        }
        scope.defined.add(name);
        return symbol;
    }

    /**
     * Store the defining statement of a claimed symbol.
     */
    public void attach(Symbol symbol, Stmt stmt) {
        var slot = slotOf(symbol).orElseThrow(() -> new IllegalArgumentException("Symbol '" + symbol
                                                                                 + "' has no slot"));
        if (slot.definition != null) {
            throw new IllegalStateException("Slot " + symbol.owner() + " is already defined");
        }
        slot.definition = stmt;
        slot.kind = kindOf(stmt);
    }

    /**
     * Register a module parameter in the current scope. Parameters have no defining statement.
     */
    public Symbol defineParameter(String name, SourceSpan span) {
        var scope = current();
        if (scope.defined.contains(name)) {
            throw new CircuitException(new CircuitError.DuplicateDefinition(span, name));
        }
        var symbol = Symbol.unbound(name);
        scope.symbols.put(name, symbol);
        scope.defined.add(name);
        return symbol;
    }

    public boolean isModule(Symbol symbol) {
        return slotOf(symbol).map(slot -> slot.definition == null
                                          ? slot.kind == Kind.MODULE
                                          : Stmt.asModule(slot.definition).isPresent())
                             .orElse(false);
    }

    /**
     * Parameter count of the module the symbol names, or -1 if it names no module.
     */
    public int arityOf(Symbol symbol) {
        if (!isModule(symbol)) {
            return -1;
        }
        var slot = slotOf(symbol).orElseThrow();
        return slot.definition == null
               ? slot.arity
               : Stmt.asModule(slot.definition)
                     .orElseThrow()
                     .arity();
    }

    public Optional<Stmt> definitionOf(Symbol symbol) {
        return slotOf(symbol).map(slot -> slot.definition);
    }

    public void openScope() {
        scopes.push(new Scope());
    }

    public void closeScope() {
        if (scopes.size() == 1) {
            throw new IllegalStateException("Cannot close the global scope");
        }
        scopes.pop();
    }

    public boolean isGlobalScope() {
        return scopes.size() == 1;
    }

    /**
     * Symbols defined in the global scope, in definition order.
     */
    public List<Symbol> globals() {
        return List.copyOf(global.symbols.values());
    }

    /**
     * The definition arena, indexed by {@link Symbol#owner()}.
     *
     * @throws CircuitException with {@link CircuitError.MalformedTree} if a declared name was never defined
     */
    public List<Stmt> definitions() {
        var result = new ArrayList<Stmt>(arena.size());
        for (int i = 0; i < arena.size(); i++) {
            var slot = arena.get(i);
            if (slot.definition == null) {
                var reason = "name declared in slot " + i + " was never defined";
                throw new CircuitException(new CircuitError.MalformedTree(SourceSpan.SYNTHETIC, "start", reason));
            }
            result.add(slot.definition);
        }
        return List.copyOf(result);
    }

    public int size() {
        return arena.size();
    }

    private Scope current() {
        return scopes.peek();
    }

    private Optional<Slot> slotOf(Symbol symbol) {
        if (!symbol.isBound() || symbol.owner() >= arena.size()) {
            return Optional.empty();
        }
        return Optional.of(arena.get(symbol.owner()));
    }

    private static Kind kindOf(Stmt stmt) {
        if (stmt instanceof Stmt.Reg) {
            return Kind.REGISTER;
        }
        return Stmt.asModule(stmt).isPresent()
               ? Kind.MODULE
               : Kind.BINDING;
    }
}
