package kern.ast;

public final class TreePrinter {
    private static final String INDENT = "  ";

    private TreePrinter() {}

    public static String render(Node root) {
        StringBuilder sb = new StringBuilder();
        render(root, 0, sb);
        return sb.toString();
    }

    private static void render(Node node, int depth, StringBuilder sb) {
        sb.append(INDENT.repeat(depth))
                .append(node.kind().label())
                .append('(').append(node.text()).append(')')
                .append('\n');
        for (Node child : node.children()) {
            render(child, depth + 1, sb);
        }
    }

    public static int count(Node root) {
        int n = 1;
        for (Node child : root.children()) n += count(child);
        return n;
    }
}
