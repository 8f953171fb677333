package kern.ast.stmt;

import kern.ast.Node;
import kern.ast.NodeKind;
import kern.ast.expr.Condition;
import kern.ast.expr.Increment;

import java.util.List;

public record ForStmt(
        VarDefStmt init,
        Condition condition,
        Increment increment,
        BlockStmt body
) implements Stmt {

    @Override public NodeKind kind() { return NodeKind.FOR_LOOP; }
    @Override public String text() { return ""; }
    @Override public List<Node> children() { return List.of(init, condition, increment, body); }
}
