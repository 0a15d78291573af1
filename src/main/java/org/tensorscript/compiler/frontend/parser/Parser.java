package org.tensorscript.compiler.frontend.parser;

import org.tensorscript.compiler.api.SourceInfo;
import org.tensorscript.compiler.diagnostics.DiagnosticsEngine;
import org.tensorscript.compiler.frontend.lexer.Token;
import org.tensorscript.compiler.frontend.lexer.TokenType;
import org.tensorscript.compiler.frontend.parser.ast.AnnAssignNode;
import org.tensorscript.compiler.frontend.parser.ast.AssignNode;
import org.tensorscript.compiler.frontend.parser.ast.AttributeNode;
import org.tensorscript.compiler.frontend.parser.ast.BinaryOpNode;
import org.tensorscript.compiler.frontend.parser.ast.BoolOpNode;
import org.tensorscript.compiler.frontend.parser.ast.BreakNode;
import org.tensorscript.compiler.frontend.parser.ast.CallNode;
import org.tensorscript.compiler.frontend.parser.ast.CompareNode;
import org.tensorscript.compiler.frontend.parser.ast.ConstantNode;
import org.tensorscript.compiler.frontend.parser.ast.ExprNode;
import org.tensorscript.compiler.frontend.parser.ast.ExprStmtNode;
import org.tensorscript.compiler.frontend.parser.ast.ForNode;
import org.tensorscript.compiler.frontend.parser.ast.FunctionDefNode;
import org.tensorscript.compiler.frontend.parser.ast.IfNode;
import org.tensorscript.compiler.frontend.parser.ast.ImportNode;
import org.tensorscript.compiler.frontend.parser.ast.KeywordArg;
import org.tensorscript.compiler.frontend.parser.ast.ListNode;
import org.tensorscript.compiler.frontend.parser.ast.NameNode;
import org.tensorscript.compiler.frontend.parser.ast.Operator;
import org.tensorscript.compiler.frontend.parser.ast.ParameterNode;
import org.tensorscript.compiler.frontend.parser.ast.ReturnNode;
import org.tensorscript.compiler.frontend.parser.ast.SliceNode;
import org.tensorscript.compiler.frontend.parser.ast.StmtNode;
import org.tensorscript.compiler.frontend.parser.ast.SubscriptNode;
import org.tensorscript.compiler.frontend.parser.ast.TupleNode;
import org.tensorscript.compiler.frontend.parser.ast.UnaryOpNode;
import org.tensorscript.compiler.frontend.parser.ast.WhileNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The recursive-descent parser for the script language. It consumes a list of tokens
 * from the {@link org.tensorscript.compiler.frontend.lexer.Lexer} and produces an Abstract Syntax Tree (AST).
 * <p>
 * Syntax errors are reported to the {@link DiagnosticsEngine}; the parser then skips to the
 * next logical line and continues so that several errors can be reported in one run.
 */
public class Parser {

    private static final Map<TokenType, Operator> COMPARISONS = Map.of(
            TokenType.EQUAL_EQUAL, Operator.EQ,
            TokenType.BANG_EQUAL, Operator.NOT_EQ,
            TokenType.LESS, Operator.LT,
            TokenType.LESS_EQUAL, Operator.LT_E,
            TokenType.GREATER, Operator.GT,
            TokenType.GREATER_EQUAL, Operator.GT_E
    );

    private static final Map<TokenType, Operator> TERM_OPERATORS = Map.of(
            TokenType.STAR, Operator.MULT,
            TokenType.SLASH, Operator.DIV,
            TokenType.DOUBLE_SLASH, Operator.FLOOR_DIV,
            TokenType.PERCENT, Operator.MOD,
            TokenType.AT, Operator.MAT_MULT
    );

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final List<String> sourceLines;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this(tokens, diagnostics, List.of());
    }

    /**
     * Constructs a new Parser that can attach line contents to source positions.
     * @param tokens The list of tokens to parse.
     * @param diagnostics The engine for reporting errors and warnings.
     * @param sourceLines The lines of the parsed source.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, List<String> sourceLines) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.sourceLines = sourceLines;
    }

    /**
     * Parses the entire token stream and returns the list of top-level statements.
     * @return The parsed statements; statements with syntax errors are omitted.
     */
    public List<StmtNode> parse() {
        List<StmtNode> statements = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(TokenType.NEWLINE)) {
                continue;
            }
            StmtNode statement = declaration();
            if (statement != null) {
                statements.add(statement);
            }
        }
        return statements;
    }

    /**
     * Parses a single top-level statement and recovers from syntax errors.
     * @return The parsed statement, or null if an error occurs.
     */
    public StmtNode declaration() {
        try {
            return statement();
        } catch (ParseError ex) {
            synchronize();
            return null;
        }
    }

    private StmtNode statement() {
        if (check(TokenType.DEF)) return functionDef();
        if (check(TokenType.IF)) return ifStatement();
        if (check(TokenType.FOR)) return forStatement();
        if (check(TokenType.WHILE)) return whileStatement();
        StmtNode simple = simpleStatement();
        if (!isAtEnd()) {
            consume(TokenType.NEWLINE, "Expected end of line after statement.");
        }
        return simple;
    }

    private FunctionDefNode functionDef() {
        Token def = advance();
        Token name = consume(TokenType.IDENTIFIER, "Expected function name after 'def'.");
        consume(TokenType.LEFT_PAREN, "Expected '(' after function name.");
        List<ParameterNode> parameters = new ArrayList<>();
        while (!check(TokenType.RIGHT_PAREN)) {
            Token paramName = consume(TokenType.IDENTIFIER, "Expected parameter name.");
            ExprNode annotation = match(TokenType.COLON) ? expression() : null;
            ExprNode defaultValue = match(TokenType.EQUAL) ? expression() : null;
            parameters.add(new ParameterNode(paramName.text(), annotation, defaultValue, sourceOf(paramName)));
            if (!match(TokenType.COMMA)) break;
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after parameters.");
        ExprNode returns = match(TokenType.ARROW) ? expression() : null;
        consume(TokenType.COLON, "Expected ':' after function signature.");
        List<StmtNode> body = block();
        return new FunctionDefNode(name.text(), parameters, returns, body, sourceOf(def));
    }

    private IfNode ifStatement() {
        Token keyword = advance();
        ExprNode test = expression();
        consume(TokenType.COLON, "Expected ':' after condition.");
        List<StmtNode> body = block();
        List<StmtNode> orelse = List.of();
        if (check(TokenType.ELIF)) {
            orelse = List.of(ifStatement());
        } else if (match(TokenType.ELSE)) {
            consume(TokenType.COLON, "Expected ':' after 'else'.");
            orelse = block();
        }
        return new IfNode(test, body, orelse, sourceOf(keyword));
    }

    private ForNode forStatement() {
        Token keyword = advance();
        ExprNode target = targetList();
        consume(TokenType.IN, "Expected 'in' in for statement.");
        ExprNode iter = expression();
        consume(TokenType.COLON, "Expected ':' after for clause.");
        List<StmtNode> body = block();
        return new ForNode(target, iter, body, sourceOf(keyword));
    }

    private WhileNode whileStatement() {
        Token keyword = advance();
        ExprNode test = expression();
        consume(TokenType.COLON, "Expected ':' after while condition.");
        List<StmtNode> body = block();
        return new WhileNode(test, body, sourceOf(keyword));
    }

    private ExprNode targetList() {
        Token first = peek();
        List<ExprNode> targets = new ArrayList<>();
        targets.add(bitwiseOr());
        if (!check(TokenType.COMMA)) return targets.get(0);
        while (match(TokenType.COMMA) && !check(TokenType.IN)) {
            targets.add(bitwiseOr());
        }
        return new TupleNode(targets, sourceOf(first));
    }

    private List<StmtNode> block() {
        if (!match(TokenType.NEWLINE)) {
            // Single-line block such as "if done: break".
            StmtNode simple = simpleStatement();
            if (!isAtEnd()) {
                consume(TokenType.NEWLINE, "Expected end of line after statement.");
            }
            return List.of(simple);
        }
        consume(TokenType.INDENT, "Expected an indented block.");
        List<StmtNode> statements = new ArrayList<>();
        while (!check(TokenType.DEDENT) && !isAtEnd()) {
            if (match(TokenType.NEWLINE)) continue;
            statements.add(statement());
        }
        match(TokenType.DEDENT);
        return statements;
    }

    private StmtNode simpleStatement() {
        Token first = peek();
        if (match(TokenType.RETURN)) {
            ExprNode value = check(TokenType.NEWLINE) || isAtEnd() ? null : testList();
            return new ReturnNode(value, sourceOf(first));
        }
        if (match(TokenType.BREAK)) {
            return new BreakNode(sourceOf(first));
        }
        if (match(TokenType.IMPORT)) {
            StringBuilder module = new StringBuilder(consume(TokenType.IDENTIFIER, "Expected module name after 'import'.").text());
            while (match(TokenType.DOT)) {
                module.append('.').append(consume(TokenType.IDENTIFIER, "Expected module name after '.'.").text());
            }
            String alias = module.substring(module.lastIndexOf(".") + 1);
            if (match(TokenType.AS)) {
                alias = consume(TokenType.IDENTIFIER, "Expected alias after 'as'.").text();
            }
            return new ImportNode(module.toString(), alias, sourceOf(first));
        }

        ExprNode expr = testList();
        if (match(TokenType.COLON)) {
            if (!(expr instanceof NameNode target)) {
                throw error(first, "Only a single name can be annotated.");
            }
            ExprNode annotation = expression();
            consume(TokenType.EQUAL, "Expected '=' in annotated assignment.");
            return new AnnAssignNode(target, annotation, testList(), sourceOf(first));
        }
        if (check(TokenType.EQUAL)) {
            List<ExprNode> targets = new ArrayList<>();
            ExprNode value = expr;
            while (match(TokenType.EQUAL)) {
                targets.add(value);
                value = testList();
            }
            return new AssignNode(targets, value, sourceOf(first));
        }
        return new ExprStmtNode(expr, sourceOf(first));
    }

    // --- Expressions ---

    private ExprNode testList() {
        Token first = peek();
        ExprNode expr = expression();
        if (!check(TokenType.COMMA)) return expr;
        List<ExprNode> elements = new ArrayList<>();
        elements.add(expr);
        while (match(TokenType.COMMA)) {
            if (check(TokenType.NEWLINE) || check(TokenType.EQUAL) || check(TokenType.RIGHT_PAREN) || isAtEnd()) break;
            elements.add(expression());
        }
        return new TupleNode(elements, sourceOf(first));
    }

    /**
     * Parses a single expression (no top-level tuple).
     * @return The parsed expression.
     */
    public ExprNode expression() {
        return orTest();
    }

    private ExprNode orTest() {
        Token first = peek();
        ExprNode left = andTest();
        if (!check(TokenType.OR)) return left;
        List<ExprNode> values = new ArrayList<>();
        values.add(left);
        while (match(TokenType.OR)) {
            values.add(andTest());
        }
        return new BoolOpNode(Operator.OR, values, sourceOf(first));
    }

    private ExprNode andTest() {
        Token first = peek();
        ExprNode left = notTest();
        if (!check(TokenType.AND)) return left;
        List<ExprNode> values = new ArrayList<>();
        values.add(left);
        while (match(TokenType.AND)) {
            values.add(notTest());
        }
        return new BoolOpNode(Operator.AND, values, sourceOf(first));
    }

    private ExprNode notTest() {
        if (match(TokenType.NOT)) {
            Token op = previous();
            return new UnaryOpNode(Operator.NOT, notTest(), sourceOf(op));
        }
        return comparison();
    }

    private ExprNode comparison() {
        Token first = peek();
        ExprNode left = bitwiseOr();
        if (!COMPARISONS.containsKey(peek().type())) return left;
        List<Operator> ops = new ArrayList<>();
        List<ExprNode> comparators = new ArrayList<>();
        while (COMPARISONS.containsKey(peek().type())) {
            ops.add(COMPARISONS.get(advance().type()));
            comparators.add(bitwiseOr());
        }
        return new CompareNode(left, ops, comparators, sourceOf(first));
    }

    private ExprNode bitwiseOr() {
        Token first = peek();
        ExprNode expr = bitwiseAnd();
        while (match(TokenType.PIPE)) {
            expr = new BinaryOpNode(expr, Operator.BIT_OR, bitwiseAnd(), sourceOf(first));
        }
        return expr;
    }

    private ExprNode bitwiseAnd() {
        Token first = peek();
        ExprNode expr = arith();
        while (match(TokenType.AMPERSAND)) {
            expr = new BinaryOpNode(expr, Operator.BIT_AND, arith(), sourceOf(first));
        }
        return expr;
    }

    private ExprNode arith() {
        Token first = peek();
        ExprNode expr = term();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            Operator op = advance().type() == TokenType.PLUS ? Operator.ADD : Operator.SUB;
            expr = new BinaryOpNode(expr, op, term(), sourceOf(first));
        }
        return expr;
    }

    private ExprNode term() {
        Token first = peek();
        ExprNode expr = factor();
        while (TERM_OPERATORS.containsKey(peek().type())) {
            Operator op = TERM_OPERATORS.get(advance().type());
            expr = new BinaryOpNode(expr, op, factor(), sourceOf(first));
        }
        return expr;
    }

    private ExprNode factor() {
        if (match(TokenType.MINUS)) {
            Token op = previous();
            return new UnaryOpNode(Operator.USUB, factor(), sourceOf(op));
        }
        if (match(TokenType.PLUS)) {
            Token op = previous();
            return new UnaryOpNode(Operator.UADD, factor(), sourceOf(op));
        }
        return power();
    }

    private ExprNode power() {
        Token first = peek();
        ExprNode base = primary();
        if (match(TokenType.DOUBLE_STAR)) {
            return new BinaryOpNode(base, Operator.POW, factor(), sourceOf(first));
        }
        return base;
    }

    private ExprNode primary() {
        Token first = peek();
        ExprNode expr = atom();
        while (true) {
            if (match(TokenType.LEFT_PAREN)) {
                expr = finishCall(expr, first);
            } else if (match(TokenType.LEFT_BRACKET)) {
                expr = finishSubscript(expr, first);
            } else if (match(TokenType.DOT)) {
                Token attr = consume(TokenType.IDENTIFIER, "Expected attribute name after '.'.");
                expr = new AttributeNode(expr, attr.text(), sourceOf(first));
            } else {
                return expr;
            }
        }
    }

    private CallNode finishCall(ExprNode callee, Token first) {
        List<ExprNode> args = new ArrayList<>();
        List<KeywordArg> keywords = new ArrayList<>();
        while (!check(TokenType.RIGHT_PAREN)) {
            if (check(TokenType.IDENTIFIER) && checkNext(TokenType.EQUAL)) {
                String keyword = advance().text();
                advance();
                keywords.add(new KeywordArg(keyword, expression()));
            } else {
                if (!keywords.isEmpty()) {
                    throw error(peek(), "Positional argument follows keyword argument.");
                }
                args.add(expression());
            }
            if (!match(TokenType.COMMA)) break;
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments.");
        return new CallNode(callee, args, keywords, sourceOf(first));
    }

    private SubscriptNode finishSubscript(ExprNode value, Token first) {
        Token indexStart = peek();
        List<ExprNode> elements = new ArrayList<>();
        boolean trailingComma = false;
        while (!check(TokenType.RIGHT_BRACKET)) {
            elements.add(subscriptElement());
            trailingComma = match(TokenType.COMMA);
            if (!trailingComma) break;
        }
        consume(TokenType.RIGHT_BRACKET, "Expected ']' after index.");
        if (elements.isEmpty()) {
            throw error(indexStart, "Empty index expression.");
        }
        ExprNode index = elements.size() == 1 && !trailingComma
                ? elements.get(0)
                : new TupleNode(elements, sourceOf(indexStart));
        return new SubscriptNode(value, index, sourceOf(first));
    }

    private ExprNode subscriptElement() {
        Token first = peek();
        ExprNode lower = check(TokenType.COLON) ? null : expression();
        if (!match(TokenType.COLON)) {
            return lower;
        }
        ExprNode upper = isSliceBoundary() ? null : expression();
        ExprNode step = null;
        if (match(TokenType.COLON)) {
            step = isSliceBoundary() ? null : expression();
        }
        return new SliceNode(lower, upper, step, sourceOf(first));
    }

    private boolean isSliceBoundary() {
        return check(TokenType.COLON) || check(TokenType.COMMA) || check(TokenType.RIGHT_BRACKET);
    }

    private ExprNode atom() {
        Token token = advance();
        switch (token.type()) {
            case IDENTIFIER:
                return new NameNode(token.text(), sourceOf(token));
            case INTEGER:
            case FLOAT:
                return new ConstantNode(token.value(), sourceOf(token));
            case STRING: {
                StringBuilder sb = new StringBuilder((String) token.value());
                while (match(TokenType.STRING)) {
                    sb.append((String) previous().value());
                }
                return new ConstantNode(sb.toString(), sourceOf(token));
            }
            case TRUE:
                return new ConstantNode(Boolean.TRUE, sourceOf(token));
            case FALSE:
                return new ConstantNode(Boolean.FALSE, sourceOf(token));
            case NONE:
                return new ConstantNode(null, sourceOf(token));
            case LEFT_PAREN: {
                if (match(TokenType.RIGHT_PAREN)) {
                    return new TupleNode(List.of(), sourceOf(token));
                }
                ExprNode inner = testList();
                if (previous().type() == TokenType.COMMA && !(inner instanceof TupleNode)) {
                    inner = new TupleNode(List.of(inner), sourceOf(token));
                }
                consume(TokenType.RIGHT_PAREN, "Expected ')' after expression.");
                return inner;
            }
            case LEFT_BRACKET: {
                List<ExprNode> elements = new ArrayList<>();
                while (!check(TokenType.RIGHT_BRACKET)) {
                    elements.add(expression());
                    if (!match(TokenType.COMMA)) break;
                }
                consume(TokenType.RIGHT_BRACKET, "Expected ']' after list elements.");
                return new ListNode(elements, sourceOf(token));
            }
            default:
                throw error(token, "Unexpected token while parsing expression: '" + token.text() + "'.");
        }
    }

    // --- Token stream helpers ---

    private void synchronize() {
        while (!isAtEnd()) {
            if (advance().type() == TokenType.NEWLINE) return;
        }
    }

    private SourceInfo sourceOf(Token token) {
        int lineIndex = token.line() - 1;
        String content = lineIndex >= 0 && lineIndex < sourceLines.size() ? sourceLines.get(lineIndex) : "";
        return new SourceInfo(token.fileName(), token.line(), token.column(), content);
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return type == TokenType.END_OF_FILE;
        return peek().type() == type;
    }

    private boolean checkNext(TokenType type) {
        if (isAtEnd() || current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(Math.max(0, current - 1));
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(peek(), errorMessage);
    }

    private ParseError error(Token token, String message) {
        diagnostics.reportError(message, sourceOf(token));
        return new ParseError(message);
    }

    /**
     * Internal signal used to unwind to the next synchronization point.
     */
    private static final class ParseError extends RuntimeException {
        ParseError(String message) {
            super(message, null, false, false);
        }
    }
}
