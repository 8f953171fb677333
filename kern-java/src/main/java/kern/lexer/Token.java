package kern.lexer;

/**
 * One classified token. {@code kind} is the kind name as it was written in the
 * token file; {@code line} is its 1-based line there, 0 for tokens built in code.
 */
public record Token(TokenType type, String lexeme, int line, String kind) {

    public Token(TokenType type, String lexeme, int line) {
        this(type, lexeme, line, type.name());
    }

    public Token(TokenType type, String lexeme) {
        this(type, lexeme, 0);
    }

    public boolean is(TokenType t) {
        return type == t;
    }

    @Override
    public String toString() {
        return "Token(" + kind + ", " + lexeme + ")";
    }
}
