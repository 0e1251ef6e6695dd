package org.pragmatica.dvrtl.ast;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Statement of a circuit or module body.
 */
public sealed interface Stmt extends SyntaxNode permits Stmt.Reg, Stmt.Bind, Stmt.Assert, Stmt.Assume, Stmt.Module {

    /**
     * Module defined by a statement, either directly or through a binding.
     */
    static Optional<Module> asModule(Stmt stmt) {
        if (stmt instanceof Module module) {
            return Optional.of(module);
        }
        if (stmt instanceof Bind bind && bind.value() instanceof Module module) {
            return Optional.of(module);
        }
        return Optional.empty();
    }

    /**
     * Clocked register {@code r -> v, e}: value {@code init} at cycle 0, then {@code next}
     * evaluated with {@code name} standing for the previous-cycle value.
     */
    record Reg(Symbol name, Value init, Expr next) implements Stmt {
        @Override
        public String serialize() {
            return name.serialize() + " -> " + init.serialize() + ", " + next.serialize();
        }
    }

    /**
     * Combinational binding {@code x = e} or named module {@code x = mod(...){...}}.
     */
    record Bind(Symbol name, Bindable value) implements Stmt {
        public boolean bindsModule() {
            return value instanceof Module;
        }

        @Override
        public String serialize() {
            return name.serialize() + " = " + value.serialize();
        }
    }

    record Assert(Arith condition) implements Stmt {
        @Override
        public String serialize() {
            return "assert " + condition.serialize();
        }
    }

    record Assume(Arith condition) implements Stmt {
        @Override
        public String serialize() {
            return "assume " + condition.serialize();
        }
    }

    /**
     * Parameterized module. Only an anonymous top-level module may have a body without output.
     */
    record Module(List<Symbol> params, Optional<ModuleContract> contract, Body body) implements Stmt, Bindable {
        public Module {
            params = List.copyOf(params);
        }

        public int arity() {
            return params.size();
        }

        @Override
        public String serialize() {
            return "mod" + params.stream()
                                 .map(Symbol::serialize)
                                 .collect(Collectors.joining(", ", "(", ")"))
                   + contract.map(ModuleContract::serialize)
                             .orElse("")
                   + body.serialize();
        }
    }
}
