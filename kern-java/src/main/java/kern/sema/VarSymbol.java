package kern.sema;

public record VarSymbol(String name, String type) {}
