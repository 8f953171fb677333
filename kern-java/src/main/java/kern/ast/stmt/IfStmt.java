package kern.ast.stmt;

import kern.ast.Node;
import kern.ast.NodeKind;
import kern.ast.expr.Expression;

import java.util.List;

public record IfStmt(
        Expression condition,
        BlockStmt thenBlock,
        ElseBranch elseBranch    // may be null
) implements Stmt {

    @Override public NodeKind kind() { return NodeKind.IF_CONDITIONAL; }
    @Override public String text() { return condition.text(); }

    @Override
    public List<Node> children() {
        return elseBranch == null ? List.of(thenBlock) : List.of(thenBlock, elseBranch);
    }

    public record ElseBranch(BlockStmt body) implements Node {
        @Override public NodeKind kind() { return NodeKind.ELSE_CONDITIONAL; }
        @Override public String text() { return ""; }
        @Override public List<Node> children() { return List.of(body); }
    }
}
