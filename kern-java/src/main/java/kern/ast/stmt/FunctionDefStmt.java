package kern.ast.stmt;

import kern.ast.Node;
import kern.ast.NodeKind;

import java.util.List;

public record FunctionDefStmt(
        String name,
        String returnType,
        Parameters parameters,
        BlockStmt body
) implements Stmt {

    @Override public NodeKind kind() { return NodeKind.FUNCTION_DEFINITION; }
    @Override public String text() { return name + ": " + returnType; }
    @Override public List<Node> children() { return List.of(parameters, body); }

    public record Parameters(List<Param> params) implements Node {
        public Parameters {
            params = List.copyOf(params);
        }

        @Override public NodeKind kind() { return NodeKind.PARAMETERS; }
        @Override public String text() { return ""; }
        @Override public List<Node> children() { return List.copyOf(params); }
    }

    public record Param(String type, String name) implements Node {
        @Override public NodeKind kind() { return NodeKind.PARAMETER; }
        @Override public String text() { return type + " " + name; }
    }
}
