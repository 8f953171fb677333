package kern.ast.stmt;

import kern.ast.NodeKind;
import kern.ast.expr.Expression;

public record VarDefStmt(
        String type,
        String name,
        Expression initializer   // null when there is no "= ..."
) implements Stmt {

    public boolean hasInitializer() {
        return initializer != null;
    }

    @Override public NodeKind kind() { return NodeKind.VARIABLE_DEFINITION; }

    @Override
    public String text() {
        String decl = type + " " + name;
        return hasInitializer() ? decl + " = " + initializer.text() : decl;
    }
}
