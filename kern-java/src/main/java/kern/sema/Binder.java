package kern.sema;

import kern.lexer.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;

public final class Binder {
    private static final Logger log = LoggerFactory.getLogger(Binder.class);

    private final Set<String> functions = new HashSet<>();
    private final SymbolTable scopes = new SymbolTable();

    public void enterScope() {
        scopes.push();
        log.trace("Entered scope, depth {}", scopes.depth());
    }

    public void exitScope() {
        scopes.pop();
        log.trace("Left scope, depth {}", scopes.depth());
    }

    public void declareFunction(Token name) {
        if (!functions.add(name.lexeme())) {
            throw new SemanticException(SemanticException.Reason.FUNCTION_REDEFINED, name,
                    "Function '" + name.lexeme() + "' is already defined.");
        }
        log.debug("Defined function '{}'", name.lexeme());
    }

    public void declareParameter(String type, Token name) {
        if (!scopes.define(new VarSymbol(name.lexeme(), type))) {
            throw new SemanticException(SemanticException.Reason.PARAMETER_REDEFINED, name,
                    "Parameter '" + name.lexeme() + "' is already defined.");
        }
    }

    // innermost frame only, outer names may be shadowed
    public void declareVariable(String type, Token name) {
        if (!scopes.define(new VarSymbol(name.lexeme(), type))) {
            throw new SemanticException(SemanticException.Reason.VARIABLE_REDEFINED, name,
                    "Variable '" + name.lexeme() + "' is already defined in the current scope.");
        }
        log.debug("Defined variable '{}' of type {} at depth {}", name.lexeme(), type, scopes.depth());
    }

    public VarSymbol resolve(Token name) {
        VarSymbol sym = scopes.lookup(name.lexeme());
        if (sym == null) {
            throw new SemanticException(SemanticException.Reason.UNDEFINED_VARIABLE, name,
                    "Variable '" + name.lexeme() + "' is not defined.");
        }
        return sym;
    }

    boolean isFunctionDefined(String name) {
        return functions.contains(name);
    }

    int scopeDepth() {
        return scopes.depth();
    }
}
