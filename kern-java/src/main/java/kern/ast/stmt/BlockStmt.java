package kern.ast.stmt;

import kern.ast.Node;
import kern.ast.NodeKind;

import java.util.List;

public record BlockStmt(List<Stmt> statements) implements Stmt {

    public BlockStmt {
        statements = List.copyOf(statements);
    }

    @Override public NodeKind kind() { return NodeKind.BLOCK; }
    @Override public String text() { return ""; }
    @Override public List<Node> children() { return List.copyOf(statements); }
}
