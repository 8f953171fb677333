package kern.sema;

import kern.lexer.Token;
import kern.lexer.TokenType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BinderTest {

    private static Token id(String name) {
        return new Token(TokenType.IDENTIFIER, name);
    }

    @Test
    void function_names_are_global() {
        var b = new Binder();
        b.enterScope();
        b.declareFunction(id("main"));
        b.exitScope();
        assertTrue(b.isFunctionDefined("main"));

        var e = assertThrows(SemanticException.class, () -> b.declareFunction(id("main")));
        assertEquals(SemanticException.Reason.FUNCTION_REDEFINED, e.reason());
        assertEquals("main", e.identifier());
    }

    @Test
    void function_and_variable_names_do_not_clash() {
        var b = new Binder();
        b.declareFunction(id("f"));
        b.declareVariable("int", id("f"));
        assertEquals("int", b.resolve(id("f")).type());
    }

    @Test
    void parameter_clash_has_its_own_reason() {
        var b = new Binder();
        b.enterScope();
        b.declareParameter("int", id("a"));
        var e = assertThrows(SemanticException.class, () -> b.declareParameter("int", id("a")));
        assertEquals(SemanticException.Reason.PARAMETER_REDEFINED, e.reason());
    }

    @Test
    void resolve_walks_outwards() {
        var b = new Binder();
        b.declareVariable("int", id("outer"));
        b.enterScope();
        b.enterScope();
        assertEquals("outer", b.resolve(id("outer")).name());
        assertEquals(3, b.scopeDepth());
    }

    @Test
    void resolve_of_unknown_name_fails() {
        var b = new Binder();
        var e = assertThrows(SemanticException.class, () -> b.resolve(id("ghost")));
        assertEquals(SemanticException.Reason.UNDEFINED_VARIABLE, e.reason());
        assertEquals("Variable 'ghost' is not defined.", e.detail());
    }
}
