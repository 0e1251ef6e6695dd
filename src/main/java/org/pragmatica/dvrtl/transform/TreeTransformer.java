package org.pragmatica.dvrtl.transform;

import org.pragmatica.dvrtl.ast.Arith;
import org.pragmatica.dvrtl.ast.Arith.ArithOperator;
import org.pragmatica.dvrtl.ast.Bindable;
import org.pragmatica.dvrtl.ast.Body;
import org.pragmatica.dvrtl.ast.Circuit;
import org.pragmatica.dvrtl.ast.Contract;
import org.pragmatica.dvrtl.ast.Expr;
import org.pragmatica.dvrtl.ast.Expr.Operator;
import org.pragmatica.dvrtl.ast.ModuleContract;
import org.pragmatica.dvrtl.ast.Out;
import org.pragmatica.dvrtl.ast.Stmt;
import org.pragmatica.dvrtl.ast.Symbol;
import org.pragmatica.dvrtl.ast.Value;
import org.pragmatica.dvrtl.error.CircuitError;
import org.pragmatica.dvrtl.error.CircuitException;
import org.pragmatica.dvrtl.tree.CstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.pragmatica.dvrtl.tree.Productions.*;

/**
 * Turns a parse tree into a {@link Circuit}.
 *
 * <p>The tree is walked post-order: every node is reduced by the {@link Production} registered
 * for its label once its children have been reduced. Entering a {@code start} or {@code module}
 * node first declares the names bound in that scope (unless forward references are disabled),
 * and a {@code module} node gets its own scope for parameters and local bindings.
 *
 * <p>A transformer is good for one pass. Any well-formedness violation aborts the pass with a
 * {@link CircuitException}; no partial circuit is produced.
 */
public final class TreeTransformer {
    private static final Logger log = LoggerFactory.getLogger(TreeTransformer.class);

    private static final String ANONYMOUS = "<anonymous>";

    // Intermediate values that never reach the AST
    private record Parameters(List<Symbol> symbols) {}

    private record Arguments(List<Expr> expressions) {}

    private record StatementList(List<Stmt> statements) {}

    private final SymbolContext context;
    private final DeclarationCollector collector;
    private final boolean forwardReferences;
    private final int maxDepth;
    private final Map<String, Production> productions = new HashMap<>();
    private boolean used;
    private int depth;

    private TreeTransformer(SymbolContext context, boolean forwardReferences, int maxDepth) {
        this.context = context;
        this.collector = new DeclarationCollector(context);
        this.forwardReferences = forwardReferences;
        this.maxDepth = maxDepth;
        registerProductions();
    }

    /**
     * Transformer for a single pass with a fresh symbol context.
     */
    public static TreeTransformer create(boolean forwardReferences) {
        return create(forwardReferences, CstNode.DEFAULT_MAX_DEPTH);
    }

    /**
     * Transformer for a single pass with a fresh symbol context, rejecting trees nested deeper than {@code maxDepth}.
     */
    public static TreeTransformer create(boolean forwardReferences, int maxDepth) {
        return new TreeTransformer(SymbolContext.create(), forwardReferences, maxDepth);
    }

    /**
     * Transform a whole tree rooted at a {@code start} node.
     *
     * @throws CircuitException if the tree is not a well-formed circuit or nests deeper than the limit
     * @throws IllegalStateException if this transformer was already used
     */
    public Circuit transform(CstNode root) {
        if (used) {
            throw new IllegalStateException("TreeTransformer instances are single-use");
        }
        used = true;
        if (!START.equals(root.rule())) {
            throw new CircuitException(new CircuitError.MalformedTree(root.span(),
                                                                      root.rule(),
                                                                      "expected a '" + START + "' root"));
        }
        log.debug("Transforming tree at {} (forward references {})",
                  root.span(),
                  forwardReferences ? "on" : "off");
        var circuit = (Circuit) visit(root);
        log.debug("Transformed {} statement(s), {} global symbol(s), {} definition(s)",
                  circuit.statements().size(),
                  circuit.context().size(),
                  circuit.definitions().size());
        return circuit;
    }

    // === Walk ===

    private Object visit(CstNode node) {
        if (node instanceof CstNode.Terminal terminal) {
            return leaf(terminal);
        }
        var nonTerminal = (CstNode.NonTerminal) node;
        if (++depth > maxDepth) {
            throw new CircuitException(new CircuitError.NestingTooDeep(nonTerminal.span(), maxDepth));
        }
        enter(nonTerminal);

        var values = new ArrayList<Object>(nonTerminal.children().size());
        for (var child : nonTerminal.children()) {
            values.add(visit(child));
        }

        var production = productions.get(nonTerminal.rule());
        if (production == null) {
            throw new CircuitException(new CircuitError.MalformedTree(nonTerminal.span(),
                                                                      nonTerminal.rule(),
                                                                      "unknown production"));
        }
        var result = production.apply(ChildValues.of(nonTerminal.rule(), nonTerminal.span(), values));
        exit(nonTerminal);
        depth--;
        return result;
    }

    private void enter(CstNode.NonTerminal node) {
        if (START.equals(node.rule())) {
            declare(node.children());
        } else if (MODULE.equals(node.rule())) {
            context.openScope();
            declare(node.children());
        }
    }

    private void exit(CstNode.NonTerminal node) {
        if (MODULE.equals(node.rule())) {
            context.closeScope();
        }
    }

    private void declare(List<CstNode> elements) {
        if (forwardReferences) {
            collector.collect(elements);
        }
    }

    private Object leaf(CstNode.Terminal terminal) {
        return switch (terminal.rule()) {
            case IDENTIFIER -> context.lookup(terminal.text())
                                      .orElseGet(() -> Symbol.unbound(terminal.text()));
            case ZERO -> Value.ZERO;
            case ONE -> Value.ONE;
            case RES -> new Arith.Res();
            default -> throw new CircuitException(new CircuitError.MalformedTree(terminal.span(),
                                                                                 terminal.rule(),
                                                                                 "unknown terminal"));
        };
    }

    // === Productions ===

    private void registerProductions() {
        // Leaves written as empty nodes
        productions.put(ZERO, values -> constant(values, Value.ZERO));
        productions.put(ONE, values -> constant(values, Value.ONE));
        productions.put(RES, values -> constant(values, new Arith.Res()));

        // Synthesizable expressions
        productions.put(EXPR_XOR, values -> foldExpr(values, Operator.XOR));
        productions.put(EXPR_AND, values -> foldExpr(values, Operator.AND));
        productions.put(EXPR_OR, values -> foldExpr(values, Operator.OR));
        productions.put(MUX, this::mux);
        productions.put(SCOPED_EXPR, TreeTransformer::scoped);
        productions.put(CALL, this::call);
        productions.put(LIST_OF_EXPR, values -> new Arguments(values.all(Expr.class)));

        // Arithmetic
        productions.put(IMPL, values -> foldArith(values, ArithOperator.IMPL));
        productions.put(ADD, values -> foldArith(values, ArithOperator.ADD));
        productions.put(SUB, values -> foldArith(values, ArithOperator.SUB));
        productions.put(EQ, values -> foldArith(values, ArithOperator.EQ));
        productions.put(ARITH_XOR, values -> foldArith(values, ArithOperator.XOR));
        productions.put(ARITH_AND, values -> foldArith(values, ArithOperator.AND));
        productions.put(ARITH_OR, values -> foldArith(values, ArithOperator.OR));
        productions.put(ARITH_NOT, values -> new Arith.Not(values.expect(1)
                                                                  .get(0, Arith.class)));
        productions.put(SCOPED_ARITH, TreeTransformer::scoped);

        // Modules
        productions.put(LIST_OF_VARIABLES, this::parameters);
        productions.put(PRECOND, values -> precondition(values, values.expect(1)
                                                                      .get(0, Arith.class)));
        productions.put(POSTCOND, values -> new Contract.PostCond(values.expect(1)
                                                                        .get(0, Arith.class)));
        productions.put(CONTRACT, this::contract);
        productions.put(OUT, values -> new Out(values.expect(1)
                                                     .get(0, Expr.class)));
        productions.put(BODY, values -> body(values, 0));
        productions.put(MODULE, this::module);

        // Statements
        productions.put(REG, this::register);
        productions.put(BIND, this::bind);
        productions.put(STMT_ASSERT, values -> new Stmt.Assert(verification(values, "assert")));
        productions.put(STMT_ASSUME, values -> new Stmt.Assume(verification(values, "assume")));
        productions.put(ANO_MODULE, this::anonymousModule);
        productions.put(STMT_SEQ, values -> new StatementList(statements(values)));
        productions.put(START, this::start);
    }

    private static Object constant(ChildValues values, Object value) {
        values.expect(0);
        return value;
    }

    private static Object scoped(ChildValues values) {
        return values.expect(1)
                     .values()
                     .get(0);
    }

    private static Expr foldExpr(ChildValues values, Operator operator) {
        if (values.size() < 2) {
            throw values.malformed("expected at least 2 operands but found " + values.size());
        }
        var result = values.get(0, Expr.class);
        for (int i = 1; i < values.size(); i++) {
            result = new Expr.Binary(operator, result, values.get(i, Expr.class));
        }
        return result;
    }

    private static Arith foldArith(ChildValues values, ArithOperator operator) {
        if (values.size() < 2) {
            throw values.malformed("expected at least 2 operands but found " + values.size());
        }
        var result = values.get(0, Arith.class);
        for (int i = 1; i < values.size(); i++) {
            result = new Arith.Binary(operator, result, values.get(i, Arith.class));
        }
        return result;
    }

    private Expr mux(ChildValues values) {
        values.expect(3);
        return new Expr.Mux(values.get(0, Expr.class), values.get(1, Expr.class), values.get(2, Expr.class));
    }

    private Expr call(ChildValues values) {
        var callee = values.get(0, Symbol.class);
        var arguments = values.size() == 2 && values.is(1, Arguments.class)
                        ? values.get(1, Arguments.class)
                                .expressions()
                        : values.from(1, Expr.class);

        if (!context.isModule(callee)) {
            throw new CircuitException(new CircuitError.UnknownModule(values.span(), callee.name()));
        }
        var arity = context.arityOf(callee);
        if (arity != arguments.size()) {
            throw new CircuitException(new CircuitError.ArityMismatch(values.span(),
                                                                      callee.name(),
                                                                      arity,
                                                                      arguments.size()));
        }
        return new Expr.Inst(callee, arguments);
    }

    private Parameters parameters(ChildValues values) {
        var symbols = new ArrayList<Symbol>(values.size());
        for (var name : values.all(Symbol.class)) {
            symbols.add(context.defineParameter(name.name(), values.span()));
        }
        return new Parameters(symbols);
    }

    private static Contract.PreCond precondition(ChildValues values, Arith condition) {
        if (condition.mentionsResult()) {
            throw new CircuitException(new CircuitError.MisplacedResult(values.span(), "a precondition"));
        }
        return new Contract.PreCond(condition);
    }

    private ModuleContract contract(ChildValues values) {
        values.expect(2);
        var requires = values.is(0, Contract.PreCond.class)
                       ? values.get(0, Contract.PreCond.class)
                       : precondition(values, values.get(0, Arith.class));
        var ensures = values.is(1, Contract.PostCond.class)
                      ? values.get(1, Contract.PostCond.class)
                      : new Contract.PostCond(values.get(1, Arith.class));
        return new ModuleContract(requires, ensures);
    }

    /**
     * Statements followed by an optional output; the output is an {@code out} node or a trailing bare expression.
     */
    private static Body body(ChildValues values, int from) {
        var statements = new ArrayList<Stmt>();
        Optional<Expr> out = Optional.empty();
        var last = values.size() - 1;

        for (int i = from; i <= last; i++) {
            var value = values.values()
                              .get(i);
            if (value instanceof Stmt stmt) {
                statements.add(stmt);
            } else if (value instanceof StatementList list) {
                statements.addAll(list.statements());
            } else if (i == last && value instanceof Out output) {
                out = Optional.of(output.value());
            } else if (i == last && values.is(i, Expr.class)) {
                out = Optional.of(values.get(i, Expr.class));
            } else {
                throw values.malformed("unexpected " + value.getClass()
                                                            .getSimpleName() + " at position " + i
                                       + " of a module body");
            }
        }
        return new Body(statements, out);
    }

    /**
     * Parameters, then an optional contract, then either a body node or the body elements inline.
     */
    private Stmt.Module module(ChildValues values) {
        var index = 0;
        List<Symbol> params = List.of();
        if (values.is(index, Parameters.class)) {
            params = values.get(index++, Parameters.class)
                           .symbols();
        }

        Optional<ModuleContract> contract = Optional.empty();
        if (values.is(index, ModuleContract.class)) {
            contract = Optional.of(values.get(index++, ModuleContract.class));
        }

        var body = values.size() == index + 1 && values.is(index, Body.class)
                   ? values.get(index, Body.class)
                   : body(values, index);
        return new Stmt.Module(params, contract, body);
    }

    private Stmt register(ChildValues values) {
        values.expect(3);
        var name = values.get(0, Symbol.class);
        if (!(values.values()
                    .get(1) instanceof Value init)) {
            throw values.malformed("register '" + name.name() + "' must be initialized with a bit");
        }
        var next = values.get(2, Expr.class);

        var symbol = context.claim(name.name(), values.span());
        var reg = new Stmt.Reg(symbol, init, next);
        context.attach(symbol, reg);
        log.debug("Defined register '{}' in slot {}", symbol.name(), symbol.owner());
        return reg;
    }

    private Stmt bind(ChildValues values) {
        values.expect(2);
        var name = values.get(0, Symbol.class);
        var value = values.values()
                          .get(1);

        if (value instanceof Stmt.Module module && !module.body()
                                                          .hasOutput()) {
            throw new CircuitException(new CircuitError.MissingOutput(values.span(), name.name()));
        }
        Bindable bound = value instanceof Stmt.Module module
                    ? module
                    : values.get(1, Expr.class);

        var symbol = context.claim(name.name(), values.span());
        var bind = new Stmt.Bind(symbol, bound);
        context.attach(symbol, bind);
        log.debug("Defined {} '{}' in slot {}",
                  bind.bindsModule() ? "module" : "binding",
                  symbol.name(),
                  symbol.owner());
        return bind;
    }

    private static Arith verification(ChildValues values, String keyword) {
        var condition = values.expect(1)
                              .get(0, Arith.class);
        if (condition.mentionsResult()) {
            throw new CircuitException(new CircuitError.MisplacedResult(values.span(), "an " + keyword));
        }
        return condition;
    }

    private Stmt anonymousModule(ChildValues values) {
        var module = values.expect(1)
                           .get(0, Stmt.Module.class);
        if (!context.isGlobalScope() && !module.body()
                                               .hasOutput()) {
            throw new CircuitException(new CircuitError.MissingOutput(values.span(), ANONYMOUS));
        }
        return module;
    }

    private static List<Stmt> statements(ChildValues values) {
        var statements = new ArrayList<Stmt>();
        for (int i = 0; i < values.size(); i++) {
            var value = values.values()
                              .get(i);
            if (value instanceof StatementList list) {
                statements.addAll(list.statements());
            } else {
                statements.add(values.get(i, Stmt.class));
            }
        }
        return statements;
    }

    private Circuit start(ChildValues values) {
        return new Circuit(statements(values), context.globals(), context.definitions());
    }
}
