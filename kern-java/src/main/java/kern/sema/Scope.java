package kern.sema;

import java.util.LinkedHashMap;
import java.util.Map;

public final class Scope {
    private final Map<String, VarSymbol> symbols = new LinkedHashMap<>();

    // false on a clash, the existing symbol is kept
    public boolean define(VarSymbol sym) {
        return symbols.putIfAbsent(sym.name(), sym) == null;
    }

    public VarSymbol getLocal(String name) {
        return symbols.get(name);
    }
}
