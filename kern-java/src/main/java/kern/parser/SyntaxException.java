package kern.parser;

import kern.diag.CompileException;
import kern.lexer.Token;
import kern.lexer.TokenType;

public final class SyntaxException extends CompileException {

    public enum Reason {
        UNEXPECTED_TOKEN,
        MISSING_LOOP_INITIALIZER,
        MISMATCHED_BLOCKS
    }

    private final Reason reason;
    private final TokenType expected;

    private SyntaxException(Reason reason, Token token, TokenType expected, String detail) {
        super(Kind.SYNTAX, token, detail);
        this.reason = reason;
        this.expected = expected;
    }

    public static SyntaxException unexpected(Token found, TokenType expected) {
        return new SyntaxException(Reason.UNEXPECTED_TOKEN, found, expected,
                "Unexpected token: " + describe(found) + ", expected: " + expected + ".");
    }

    public static SyntaxException missingLoopInitializer(Token found) {
        return new SyntaxException(Reason.MISSING_LOOP_INITIALIZER, found, TokenType.VARIABLE_DEFINITION,
                "Expected variable definition, found " + describe(found) + ".");
    }

    public static SyntaxException mismatchedBlocks() {
        return new SyntaxException(Reason.MISMATCHED_BLOCKS, null, null, "Mismatched block delimiters.");
    }

    public Reason reason() { return reason; }

    public TokenType expected() { return expected; }
}
