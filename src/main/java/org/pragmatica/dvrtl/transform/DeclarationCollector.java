package org.pragmatica.dvrtl.transform;

import org.pragmatica.dvrtl.tree.CstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.pragmatica.dvrtl.tree.Productions.*;

/**
 * Pre-pass that declares the names bound by the statements of one scope before the scope is
 * transformed, so that a name may be used ahead of its textual definition.
 *
 * <p>Only the statements directly in the scope are visited; nested module bodies are declared
 * when the transformer enters them.
 */
final class DeclarationCollector {
    private static final Logger log = LoggerFactory.getLogger(DeclarationCollector.class);

    private final SymbolContext context;

    DeclarationCollector(SymbolContext context) {
        this.context = context;
    }

    /**
     * Declare the names bound by the given scope elements.
     */
    void collect(List<CstNode> elements) {
        for (var element : elements) {
            if (!(element instanceof CstNode.NonTerminal node)) {
                continue;
            }
            switch (node.rule()) {
                case REG -> declareName(node, SymbolContext.Kind.REGISTER, 0);
                case BIND -> declareBinding(node);
                case STMT_SEQ, BODY -> collect(node.children());
                default -> {
                    // statement without a name
                }
            }
        }
    }

    private void declareBinding(CstNode.NonTerminal bind) {
        if (bind.children().size() == 2
            && bind.children().get(1) instanceof CstNode.NonTerminal value
            && MODULE.equals(value.rule())) {
            declareName(bind, SymbolContext.Kind.MODULE, parameterCount(value));
        } else {
            declareName(bind, SymbolContext.Kind.BINDING, 0);
        }
    }

    private void declareName(CstNode.NonTerminal statement, SymbolContext.Kind kind, int arity) {
        if (statement.children().isEmpty()
            || !(statement.children().get(0) instanceof CstNode.Terminal name)) {
            return;
        }
        var symbol = context.declare(name.text(), kind, arity);
        log.debug("Declared {} '{}' in slot {}", kind, symbol.name(), symbol.owner());
    }

    private static int parameterCount(CstNode.NonTerminal module) {
        if (!module.children().isEmpty()
            && module.children().get(0) instanceof CstNode.NonTerminal params
            && LIST_OF_VARIABLES.equals(params.rule())) {
            return params.children().size();
        }
        return 0;
    }
}
