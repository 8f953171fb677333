package kern.parser;

import kern.ast.Program;
import kern.ast.expr.Condition;
import kern.ast.expr.Expression;
import kern.ast.expr.Increment;
import kern.ast.stmt.BlockStmt;
import kern.ast.stmt.ForStmt;
import kern.ast.stmt.FunctionDefStmt;
import kern.ast.stmt.IfStmt;
import kern.ast.stmt.RawStmt;
import kern.ast.stmt.ReturnStmt;
import kern.ast.stmt.Stmt;
import kern.ast.stmt.VarDefStmt;
import kern.lexer.Token;
import kern.lexer.TokenType;
import kern.sema.Binder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Single-pass recursive-descent parser that binds names while it builds the
 * tree. Undefined and duplicate names are rejected as soon as they are read.
 * One instance parses one token list; create a new parser per run.
 */
public final class Parser {
    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private static final Set<TokenType> EXPRESSION_END =
            EnumSet.of(TokenType.COMMAND_END, TokenType.RIGHT_PAREN, TokenType.BLOCK_END);

    private final List<Token> tokens;
    private final Binder binder = new Binder();
    private int pos = 0;
    private int openBlocks = 0;

    public Parser(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    // ---------- entry ----------
    public Program parseProgram() {
        if (pos != 0) throw new IllegalStateException("Parser has already been used");

        consume(TokenType.PROGRAM_START);
        List<Stmt> stmts = new ArrayList<>();
        while (!isAtEnd() && !check(TokenType.PROGRAM_END)) {
            stmts.add(parseStatementOrBlock());
        }
        consume(TokenType.PROGRAM_END);

        if (openBlocks != 0) throw SyntaxException.mismatchedBlocks();

        log.debug("Parsed program: {} top-level statements, {} tokens", stmts.size(), pos);
        return new Program(stmts);
    }

    // ---------- dispatch ----------
    private Stmt parseStatementOrBlock() {
        Token token = peek();
        return switch (token.type()) {
            case BLOCK_START -> parseBlock();
            case FUNCTION_DEFINITION -> parseFunctionDefinition();
            case VARIABLE_DEFINITION -> parseVariableDefinition();
            case IF_CONDITIONAL -> parseIfConditional();
            case FOR_LOOP -> parseForLoop();
            case RETURN, PROGRAM_START, PROGRAM_END, BLOCK_END, ELSE_CONDITIONAL,
                    TYPE, IDENTIFIER, LEFT_PAREN, RIGHT_PAREN, START_STATEMENT,
                    COMMAND_END, ASSIGN, OTHER -> parseGenericStatement();
        };
    }

    // ---------- block ----------
    private BlockStmt parseBlock() {
        consume(TokenType.BLOCK_START);
        binder.enterScope();
        List<Stmt> stmts = new ArrayList<>();
        while (!isAtEnd() && !check(TokenType.BLOCK_END)) {
            stmts.add(parseStatementOrBlock());
        }
        binder.exitScope();
        consume(TokenType.BLOCK_END);
        return new BlockStmt(stmts);
    }

    // ---------- definitions ----------
    private FunctionDefStmt parseFunctionDefinition() {
        consume(TokenType.FUNCTION_DEFINITION);
        String returnType = consume(TokenType.TYPE).lexeme();
        Token name = consume(TokenType.IDENTIFIER);
        binder.declareFunction(name);

        consume(TokenType.LEFT_PAREN);
        binder.enterScope(); // parameters
        List<FunctionDefStmt.Param> params = new ArrayList<>();
        while (!isAtEnd() && !check(TokenType.RIGHT_PAREN)) {
            String type = consume(TokenType.TYPE).lexeme();
            Token paramName = consume(TokenType.IDENTIFIER);
            binder.declareParameter(type, paramName);
            params.add(new FunctionDefStmt.Param(type, paramName.lexeme()));
        }
        consume(TokenType.RIGHT_PAREN);
        consume(TokenType.START_STATEMENT);

        BlockStmt body = parseBlock();
        binder.exitScope();

        return new FunctionDefStmt(name.lexeme(), returnType, new FunctionDefStmt.Parameters(params), body);
    }

    private VarDefStmt parseVariableDefinition() {
        consume(TokenType.VARIABLE_DEFINITION);
        String type = consume(TokenType.TYPE).lexeme();
        Token name = consume(TokenType.IDENTIFIER);
        binder.declareVariable(type, name);

        Expression init = null;
        if (check(TokenType.ASSIGN)) {
            consume(TokenType.ASSIGN);
            init = parseExpression();
        }
        consume(TokenType.COMMAND_END);
        return new VarDefStmt(type, name.lexeme(), init);
    }

    // ---------- control ----------
    private IfStmt parseIfConditional() {
        consume(TokenType.IF_CONDITIONAL);
        consume(TokenType.LEFT_PAREN);
        Expression cond = parseExpression();
        consume(TokenType.RIGHT_PAREN);
        consume(TokenType.START_STATEMENT);
        BlockStmt thenB = parseBlock();

        IfStmt.ElseBranch elseB = null;
        if (check(TokenType.ELSE_CONDITIONAL)) {
            consume(TokenType.ELSE_CONDITIONAL);
            elseB = new IfStmt.ElseBranch(parseBlock());
        }
        return new IfStmt(cond, thenB, elseB);
    }

    private ForStmt parseForLoop() {
        consume(TokenType.FOR_LOOP);
        consume(TokenType.LEFT_PAREN);

        // the loop variable lands in the enclosing frame, not a frame of its own
        if (!check(TokenType.VARIABLE_DEFINITION)) throw SyntaxException.missingLoopInitializer(peek());
        VarDefStmt init = parseVariableDefinition();

        Condition cond = new Condition(flattenResolving(TokenType.COMMAND_END));
        consume(TokenType.COMMAND_END);

        Increment step = new Increment(flattenResolving(TokenType.RIGHT_PAREN));
        consume(TokenType.RIGHT_PAREN);
        consume(TokenType.START_STATEMENT);

        BlockStmt body = parseBlock();
        return new ForStmt(init, cond, step, body);
    }

    // ---------- flattened runs ----------
    private Expression parseExpression() {
        List<String> parts = new ArrayList<>();
        while (!isAtEnd() && !EXPRESSION_END.contains(peek().type())) {
            parts.add(peek().lexeme());
            pos++;
        }
        return new Expression(join(parts));
    }

    // like parseExpression, but every identifier must resolve
    private String flattenResolving(TokenType terminator) {
        List<String> parts = new ArrayList<>();
        while (!isAtEnd() && !check(terminator)) {
            Token t = peek();
            if (t.is(TokenType.IDENTIFIER)) binder.resolve(t);
            parts.add(t.lexeme());
            pos++;
        }
        return join(parts);
    }

    private Stmt parseGenericStatement() {
        Token token = peek();
        if (token.is(TokenType.RETURN)) {
            consume(TokenType.RETURN);
            Token value = consume(TokenType.IDENTIFIER);
            binder.resolve(value);
            consume(TokenType.COMMAND_END);
            return new ReturnStmt(value.lexeme());
        }
        pos++;
        return new RawStmt(token.lexeme());
    }

    // ---------- helpers ----------

    // the only place the block balance moves
    private Token consume(TokenType t) {
        Token token = peek();
        if (token == null || !token.is(t)) throw SyntaxException.unexpected(token, t);
        pos++;
        if (t == TokenType.BLOCK_START) openBlocks++;
        else if (t == TokenType.BLOCK_END) openBlocks--;
        return token;
    }

    private boolean check(TokenType t) {
        Token token = peek();
        return token != null && token.is(t);
    }

    private boolean isAtEnd() {
        return pos >= tokens.size();
    }

    private Token peek() {
        return isAtEnd() ? null : tokens.get(pos);
    }

    private static String join(List<String> parts) {
        return String.join(" ", parts).strip();
    }
}
