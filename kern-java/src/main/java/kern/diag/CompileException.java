package kern.diag;

import kern.lexer.Token;

/**
 * Base of the two fatal front-end errors. A parse run stops at the first one;
 * callers can switch on {@link #kind()} and inspect {@link #token()} instead of
 * matching message text.
 */
public abstract class CompileException extends RuntimeException {

    public enum Kind {
        SYNTAX("Syntax error"),
        SEMANTIC("Semantic error");

        private final String label;

        Kind(String label) { this.label = label; }

        public String label() { return label; }
    }

    private final Kind kind;
    private final Token token;
    private final String detail;

    protected CompileException(Kind kind, Token token, String detail) {
        super(kind.label() + ": " + detail);
        this.kind = kind;
        this.token = token;
        this.detail = detail;
    }

    public Kind kind() { return kind; }

    // null when the input ran out
    public Token token() { return token; }

    public String detail() { return detail; }

    protected static String describe(Token token) {
        return token == null ? "end of input" : token.toString();
    }
}
