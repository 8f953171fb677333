package kern.ast.stmt;

import kern.ast.NodeKind;

public record ReturnStmt(String name) implements Stmt {
    @Override public NodeKind kind() { return NodeKind.RETURN; }
    @Override public String text() { return name; }
}
