package kern;

import kern.ast.Program;
import kern.ast.TreePrinter;
import kern.io.TokenReader;
import kern.io.TreeWriter;
import kern.lexer.Token;
import kern.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public final class FrontEnd {
    private static final Logger log = LoggerFactory.getLogger(FrontEnd.class);

    public static final Path DEFAULT_TOKENS = Path.of("tokens.krn");
    public static final Path DEFAULT_TREE = Path.of("tree.krn");

    private FrontEnd() {}

    public static Program parse(List<Token> tokens) {
        return new Parser(tokens).parseProgram();
    }

    public static Program run(Path tokensFile, Path treeFile) throws IOException {
        List<Token> tokens = TokenReader.read(tokensFile);
        log.info("Read {} tokens from {}", tokens.size(), tokensFile);

        Program program = parse(tokens);
        log.info("Parsed {} nodes", TreePrinter.count(program));

        TreeWriter.write(treeFile, program);
        log.info("Wrote tree to {}", treeFile);
        return program;
    }
}
