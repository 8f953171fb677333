package kern.ast.expr;

import kern.ast.NodeKind;

public record Expression(String text) implements Clause {
    @Override public NodeKind kind() { return NodeKind.EXPRESSION; }
}
