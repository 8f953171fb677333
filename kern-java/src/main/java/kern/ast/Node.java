package kern.ast;

import java.util.List;

/**
 * Uniform view over every tree element: a kind tag, a human-readable text
 * payload and the owned children in source order. The typed records under
 * {@code kern.ast.stmt} and {@code kern.ast.expr} keep their fields; this view
 * is what {@link TreePrinter} walks.
 */
public interface Node {

    NodeKind kind();

    String text();

    default List<Node> children() {
        return List.of();
    }
}
