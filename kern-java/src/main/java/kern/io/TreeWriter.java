package kern.io;

import kern.ast.Node;
import kern.ast.TreePrinter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class TreeWriter {

    private TreeWriter() {}

    public static void write(Path path, Node root) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(path, TreePrinter.render(root), StandardCharsets.UTF_8);
    }
}
