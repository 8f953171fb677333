package kern.io;

import kern.lexer.Token;
import kern.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a token file: one {@code KIND, VALUE} pair per line, split on the first
 * comma-space. Lines without that separator are skipped.
 */
public final class TokenReader {
    private static final Logger log = LoggerFactory.getLogger(TokenReader.class);
    private static final String SEPARATOR = ", ";

    private TokenReader() {}

    public static List<Token> read(Path path) throws IOException {
        List<Token> tokens = parse(Files.readString(path, StandardCharsets.UTF_8));
        log.debug("Read {} tokens from {}", tokens.size(), path);
        return tokens;
    }

    public static List<Token> parse(String text) {
        List<Token> tokens = new ArrayList<>();
        String[] lines = text.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            Token t = parseLine(lines[i].strip(), i + 1);
            if (t != null) tokens.add(t);
        }
        return tokens;
    }

    private static Token parseLine(String line, int lineNo) {
        int sep = line.indexOf(SEPARATOR);
        if (sep < 0) {
            if (!line.isEmpty()) log.debug("Skipping line {}: no '{}' separator", lineNo, SEPARATOR);
            return null;
        }
        String kind = line.substring(0, sep);
        String value = line.substring(sep + SEPARATOR.length());
        TokenType type = TokenType.fromName(kind);
        if (type == TokenType.OTHER) log.trace("Line {}: kind '{}' passed through as OTHER", lineNo, kind);
        return new Token(type, value, lineNo, kind);
    }
}
