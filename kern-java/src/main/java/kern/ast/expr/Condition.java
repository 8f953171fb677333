package kern.ast.expr;

import kern.ast.NodeKind;

public record Condition(String text) implements Clause {
    @Override public NodeKind kind() { return NodeKind.CONDITION; }
}
