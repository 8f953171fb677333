package kern.ast.expr;

import kern.ast.NodeKind;

public record Increment(String text) implements Clause {
    @Override public NodeKind kind() { return NodeKind.INCREMENT; }
}
