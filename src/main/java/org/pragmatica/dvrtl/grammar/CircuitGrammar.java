package org.pragmatica.dvrtl.grammar;

import org.pragmatica.dvrtl.error.CircuitError;
import org.pragmatica.dvrtl.error.CircuitException;
import org.pragmatica.dvrtl.tree.CstNode;
import org.pragmatica.dvrtl.tree.SourceLocation;
import org.pragmatica.dvrtl.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

import static org.pragmatica.dvrtl.tree.Productions.*;

/**
 * Recursive-descent parser for circuit source text. Produces the labeled parse tree
 * consumed by the tree transformer; punctuation and keywords are dropped.
 *
 * <p>Accepts infix source ({@code a xor b}, {@code res eq (a + b)}) as well as the
 * self-delimiting prefix form produced by serialization ({@code xor a b}, {@code eq res + a b}).
 *
 * <pre>
 * start     <- (stmt ';'?)*
 * stmt      <- ident '->' bit ',' expr / ident '=' (module / expr)
 *            / 'assert' arith / 'assume' arith / module
 * module    <- 'mod' '(' (ident (',' ident)*)? ')' contract? '{' body '}'
 * contract  <- '[' 'req' arith ';' 'ens' arith ']'
 * body      <- (stmt ';'?)* ('out'? expr ';'?)?
 * expr      <- xor ('or' xor)*        xor  <- and ('xor' and)*       and <- term ('and' term)*
 * term      <- bit / ident ('(' args ')')? / '(' expr ')' / 'mux' term term term
 *            / ('xor' / 'and' / 'or') term term
 * arith     <- eq ('impl' arith)?     eq   <- or ('eq' or)*    ...   add <- unary (('+' / '-') unary)*
 * unary     <- 'not' unary / aterm
 * aterm     <- 'res' / '(' arith ')' / ('impl' / 'eq' / 'xor' / 'and' / 'or' / '+' / '-') unary unary
 *            / 'mux' term term term / bit / ident ('(' args ')')?
 * </pre>
 *
 * <p>The {@code '('} of a call must follow the callee name directly; {@code f (a)} is the name
 * {@code f} followed by a parenthesized expression. Terms, arithmetic, negations and modules may
 * nest at most {@code maxDepth} levels deep.
 */
public final class CircuitGrammar {

    private final List<DvrtlToken> tokens;
    private final int maxDepth;
    private int pos;
    private int depth;
    private SourceLocation lastEnd;

    private CircuitGrammar(List<DvrtlToken> tokens, int maxDepth) {
        this.tokens = tokens;
        this.maxDepth = maxDepth;
        this.pos = 0;
        this.depth = 0;
        this.lastEnd = SourceLocation.START;
    }

    /**
     * Parse source text into a parse tree rooted at a {@code start} node, with the default nesting limit.
     *
     * @throws CircuitException on the first syntax error
     */
    public static CstNode parse(String input) {
        return parse(input, CstNode.DEFAULT_MAX_DEPTH);
    }

    /**
     * Parse source text into a parse tree rooted at a {@code start} node.
     *
     * @throws CircuitException on the first syntax error, or with {@link CircuitError.NestingTooDeep}
     *                          when constructs nest deeper than {@code maxDepth}
     */
    public static CstNode parse(String input, int maxDepth) {
        var tokens = DvrtlLexer.tokenize(input);

        for (var token : tokens) {
            if (token instanceof DvrtlToken.Error error) {
                throw new CircuitException(new CircuitError.UnexpectedInput(error.span(), error.message(), "a token"));
            }
        }

        return new CircuitGrammar(tokens, maxDepth).parseStart();
    }

    private CstNode parseStart() {
        var start = peek().span()
                          .start();
        var statements = new ArrayList<CstNode>();
        skipSeparators();
        while (!isAtEnd()) {
            statements.add(parseStatement());
            skipSeparators();
        }
        return node(START, start, statements);
    }

    // === Statements ===

    private boolean isStatementStart() {
        var token = peek();
        if (token instanceof DvrtlToken.Identifier) {
            var next = lookahead(1);
            return next.isPunct("->") || next.isPunct("=");
        }
        return token.isKeyword("assert") || token.isKeyword("assume") || token.isKeyword("mod");
    }

    private CstNode parseStatement() {
        var token = peek();
        var start = token.span()
                         .start();

        if (token.isKeyword("assert")) {
            advance();
            return node(STMT_ASSERT, start, List.of(parseArith()));
        }
        if (token.isKeyword("assume")) {
            advance();
            return node(STMT_ASSUME, start, List.of(parseArith()));
        }
        if (token.isKeyword("mod")) {
            return node(ANO_MODULE, start, List.of(parseModule()));
        }
        if (token instanceof DvrtlToken.Identifier && lookahead(1).isPunct("->")) {
            var name = parseIdentifier();
            expectPunct("->");
            var init = parseBit();
            expectPunct(",");
            return node(REG, start, List.of(name, init, parseExpr()));
        }
        if (token instanceof DvrtlToken.Identifier && lookahead(1).isPunct("=")) {
            var name = parseIdentifier();
            expectPunct("=");
            var value = peek().isKeyword("mod")
                        ? parseModule()
                        : parseExpr();
            return node(BIND, start, List.of(name, value));
        }
        throw unexpected("statement");
    }

    private CstNode parseModule() {
        return nested(this::module);
    }

    private CstNode module() {
        var start = peek().span()
                          .start();
        expectKeyword("mod");
        var children = new ArrayList<CstNode>();
        children.add(parseParameters());
        if (peek().isPunct("[")) {
            children.add(parseContract());
        }
        children.add(parseBody());
        return node(MODULE, start, children);
    }

    private CstNode parseParameters() {
        var start = peek().span()
                          .start();
        expectPunct("(");
        var params = new ArrayList<CstNode>();
        if (!peek().isPunct(")")) {
            params.add(parseIdentifier());
            while (peek().isPunct(",")) {
                advance();
                params.add(parseIdentifier());
            }
        }
        expectPunct(")");
        return node(LIST_OF_VARIABLES, start, params);
    }

    private CstNode parseContract() {
        var start = peek().span()
                          .start();
        expectPunct("[");
        var preStart = peek().span()
                             .start();
        expectKeyword("req");
        var precond = node(PRECOND, preStart, List.of(parseArith()));
        expectPunct(";");
        var postStart = peek().span()
                              .start();
        expectKeyword("ens");
        var postcond = node(POSTCOND, postStart, List.of(parseArith()));
        expectPunct("]");
        return node(CONTRACT, start, List.of(precond, postcond));
    }

    private CstNode parseBody() {
        var start = peek().span()
                          .start();
        expectPunct("{");
        var elements = new ArrayList<CstNode>();
        skipSeparators();
        while (isStatementStart()) {
            elements.add(parseStatement());
            skipSeparators();
        }
        if (!peek().isPunct("}")) {
            var outStart = peek().span()
                                 .start();
            if (peek().isKeyword("out")) {
                advance();
            }
            elements.add(node(OUT, outStart, List.of(parseExpr())));
            skipSeparators();
        }
        expectPunct("}");
        return node(BODY, start, elements);
    }

    // === Synthesizable expressions ===

    private CstNode parseExpr() {
        return parseLeftAssociative(EXPR_OR, "or", this::parseExprXor);
    }

    private CstNode parseExprXor() {
        return parseLeftAssociative(EXPR_XOR, "xor", this::parseExprAnd);
    }

    private CstNode parseExprAnd() {
        return parseLeftAssociative(EXPR_AND, "and", this::parseTerm);
    }

    private CstNode parseTerm() {
        return nested(this::term);
    }

    private CstNode term() {
        var token = peek();
        var start = token.span()
                         .start();

        if (token.isKeyword("mux")) {
            return parseMux();
        }
        if (token.isKeyword("xor") || token.isKeyword("and") || token.isKeyword("or")) {
            advance();
            var rule = exprRule(((DvrtlToken.Keyword) token).word());
            var lhs = parseTerm();
            return node(rule, start, List.of(lhs, parseTerm()));
        }
        if (token.isPunct("(")) {
            advance();
            var inner = parseExpr();
            expectPunct(")");
            return node(SCOPED_EXPR, start, List.of(inner));
        }
        return parseAtom("expression");
    }

    private CstNode parseMux() {
        var start = peek().span()
                          .start();
        expectKeyword("mux");
        var selector = parseTerm();
        var whenTrue = parseTerm();
        return node(MUX, start, List.of(selector, whenTrue, parseTerm()));
    }

    private CstNode parseAtom(String expected) {
        var token = peek();
        if (token instanceof DvrtlToken.Bit) {
            return parseBit();
        }
        if (token instanceof DvrtlToken.Identifier) {
            var start = token.span()
                             .start();
            var callee = parseIdentifier();
            if (!isCallOpening(callee)) {
                return callee;
            }
            return node(CALL, start, List.of(callee, parseArguments()));
        }
        throw unexpected(expected);
    }

    private boolean isCallOpening(CstNode callee) {
        return peek().isPunct("(") && peek().span()
                                            .start()
                                            .offset() == callee.span()
                                                               .end()
                                                               .offset();
    }

    private CstNode parseArguments() {
        var start = peek().span()
                          .start();
        expectPunct("(");
        var args = new ArrayList<CstNode>();
        if (!peek().isPunct(")")) {
            args.add(parseExpr());
            while (peek().isPunct(",")) {
                advance();
                args.add(parseExpr());
            }
        }
        expectPunct(")");
        return node(LIST_OF_EXPR, start, args);
    }

    // === Arithmetic ===

    private CstNode parseArith() {
        return nested(this::arith);
    }

    private CstNode arith() {
        var start = peek().span()
                          .start();
        var lhs = parseLeftAssociative(EQ, "eq", this::parseArithOr);
        if (peek().isKeyword("impl")) {
            advance();
            return node(IMPL, start, List.of(lhs, parseArith()));
        }
        return lhs;
    }

    private CstNode parseArithOr() {
        return parseLeftAssociative(ARITH_OR, "or", this::parseArithXor);
    }

    private CstNode parseArithXor() {
        return parseLeftAssociative(ARITH_XOR, "xor", this::parseArithAnd);
    }

    private CstNode parseArithAnd() {
        return parseLeftAssociative(ARITH_AND, "and", this::parseArithAdditive);
    }

    private CstNode parseArithAdditive() {
        var start = peek().span()
                          .start();
        var result = parseUnary();
        while (peek().isPunct("+") || peek().isPunct("-")) {
            var rule = peek().isPunct("+") ? ADD : SUB;
            advance();
            result = node(rule, start, List.of(result, parseUnary()));
        }
        return result;
    }

    private CstNode parseUnary() {
        return nested(this::unary);
    }

    private CstNode unary() {
        var start = peek().span()
                          .start();
        if (peek().isKeyword("not")) {
            advance();
            return node(ARITH_NOT, start, List.of(parseUnary()));
        }
        return parseArithTerm();
    }

    private CstNode parseArithTerm() {
        var token = peek();
        var start = token.span()
                         .start();

        if (token.isKeyword("res")) {
            advance();
            return new CstNode.Terminal(token.span(), RES, "res");
        }
        if (token.isPunct("(")) {
            advance();
            var inner = parseArith();
            expectPunct(")");
            return node(SCOPED_ARITH, start, List.of(inner));
        }
        if (token.isKeyword("mux")) {
            return parseMux();
        }
        var prefixRule = arithPrefixRule(token);
        if (prefixRule != null) {
            advance();
            var lhs = parseUnary();
            return node(prefixRule, start, List.of(lhs, parseUnary()));
        }
        return parseAtom("arithmetic term");
    }

    private static String arithPrefixRule(DvrtlToken token) {
        if (token.isPunct("+")) {
            return ADD;
        }
        if (token.isPunct("-")) {
            return SUB;
        }
        if (!(token instanceof DvrtlToken.Keyword keyword)) {
            return null;
        }
        return switch (keyword.word()) {
            case "impl" -> IMPL;
            case "eq" -> EQ;
            case "xor" -> ARITH_XOR;
            case "and" -> ARITH_AND;
            case "or" -> ARITH_OR;
            default -> null;
        };
    }

    private static String exprRule(String keyword) {
        return switch (keyword) {
            case "xor" -> EXPR_XOR;
            case "and" -> EXPR_AND;
            default -> EXPR_OR;
        };
    }

    // === Shared helpers ===

    private interface Operand {
        CstNode parse();
    }

    private CstNode parseLeftAssociative(String rule, String keyword, Operand operand) {
        var start = peek().span()
                          .start();
        var result = operand.parse();
        while (peek().isKeyword(keyword)) {
            advance();
            result = node(rule, start, List.of(result, operand.parse()));
        }
        return result;
    }

    private CstNode nested(Operand operand) {
        if (++depth > maxDepth) {
            throw new CircuitException(new CircuitError.NestingTooDeep(peek().span(), maxDepth));
        }
        var result = operand.parse();
        depth--;
        return result;
    }

    private CstNode parseIdentifier() {
        var token = peek();
        if (!(token instanceof DvrtlToken.Identifier id)) {
            throw unexpected("identifier");
        }
        advance();
        return new CstNode.Terminal(token.span(), IDENTIFIER, id.name());
    }

    private CstNode parseBit() {
        var token = peek();
        if (!(token instanceof DvrtlToken.Bit bit)) {
            throw unexpected("bit '0' or '1'");
        }
        advance();
        return bit.value() == 0
               ? new CstNode.Terminal(token.span(), ZERO, "0")
               : new CstNode.Terminal(token.span(), ONE, "1");
    }

    private void skipSeparators() {
        while (peek().isPunct(";")) {
            advance();
        }
    }

    private void expectPunct(String text) {
        if (!peek().isPunct(text)) {
            throw unexpected("'" + text + "'");
        }
        advance();
    }

    private void expectKeyword(String word) {
        if (!peek().isKeyword(word)) {
            throw unexpected("'" + word + "'");
        }
        advance();
    }

    private CircuitException unexpected(String expected) {
        var token = peek();
        if (token instanceof DvrtlToken.Eof) {
            return new CircuitException(new CircuitError.UnexpectedEof(token.span(), expected));
        }
        return new CircuitException(new CircuitError.UnexpectedInput(token.span(), token.describe(), expected));
    }

    private CstNode node(String rule, SourceLocation start, List<CstNode> children) {
        return new CstNode.NonTerminal(SourceSpan.of(start, lastEnd), rule, children);
    }

    private boolean isAtEnd() {
        return peek() instanceof DvrtlToken.Eof;
    }

    private DvrtlToken peek() {
        return tokens.get(pos);
    }

    private DvrtlToken lookahead(int distance) {
        return tokens.get(Math.min(pos + distance, tokens.size() - 1));
    }

    private void advance() {
        if (!isAtEnd()) {
            lastEnd = peek().span()
                            .end();
            pos++;
        }
    }
}
