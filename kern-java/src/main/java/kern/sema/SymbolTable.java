package kern.sema;

import java.util.ArrayDeque;
import java.util.Deque;

public final class SymbolTable {
    private final Deque<Scope> scopes = new ArrayDeque<>();

    public SymbolTable() { push(); } // program scope

    public void push() { scopes.push(new Scope()); }

    public void pop() {
        if (scopes.size() == 1) throw new IllegalStateException("Cannot pop the program scope");
        scopes.pop();
    }

    public int depth() { return scopes.size(); }

    public boolean define(VarSymbol sym) { return scopes.peek().define(sym); }

    public VarSymbol lookup(String name) {
        for (Scope s : scopes) {
            VarSymbol sym = s.getLocal(name);
            if (sym != null) return sym;
        }
        return null;
    }

    boolean isDefined(String name) {
        return lookup(name) != null;
    }
}
