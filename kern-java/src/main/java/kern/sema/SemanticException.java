package kern.sema;

import kern.diag.CompileException;
import kern.lexer.Token;

public final class SemanticException extends CompileException {

    public enum Reason {
        FUNCTION_REDEFINED,
        PARAMETER_REDEFINED,
        VARIABLE_REDEFINED,
        UNDEFINED_VARIABLE
    }

    private final Reason reason;
    private final String identifier;

    SemanticException(Reason reason, Token token, String detail) {
        super(Kind.SEMANTIC, token, detail);
        this.reason = reason;
        this.identifier = token.lexeme();
    }

    public Reason reason() { return reason; }

    public String identifier() { return identifier; }
}
