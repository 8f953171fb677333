package kern.ast;

import kern.ast.stmt.Stmt;

import java.util.List;

public record Program(List<Stmt> statements) implements Node {

    public Program {
        statements = List.copyOf(statements);
    }

    @Override public NodeKind kind() { return NodeKind.PROGRAM; }
    @Override public String text() { return ""; }
    @Override public List<Node> children() { return List.copyOf(statements); }
}
