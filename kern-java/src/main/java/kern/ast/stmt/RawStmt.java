package kern.ast.stmt;

import kern.ast.NodeKind;

public record RawStmt(String lexeme) implements Stmt {
    @Override public NodeKind kind() { return NodeKind.STATEMENT; }
    @Override public String text() { return lexeme; }
}
