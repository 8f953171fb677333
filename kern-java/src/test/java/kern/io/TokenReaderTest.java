package kern.io;

import kern.lexer.Token;
import kern.lexer.TokenType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class TokenReaderTest {

    @Test
    void reads_kind_and_value() {
        var ts = TokenReader.parse("""
            PROGRAM_START, inicio
            TYPE, int
            PROGRAM_END, fim
            """);
        assertEquals(List.of(
                new Token(TokenType.PROGRAM_START, "inicio", 1),
                new Token(TokenType.TYPE, "int", 2),
                new Token(TokenType.PROGRAM_END, "fim", 3)
        ), ts);
    }

    @Test
    void splits_on_first_separator_only() {
        var ts = TokenReader.parse("STRING, \"a, b\"\n");
        assertEquals(1, ts.size());
        assertEquals(TokenType.OTHER, ts.get(0).type());
        assertEquals("\"a, b\"", ts.get(0).lexeme());
    }

    @Test
    void unknown_kind_maps_to_other() {
        var t = TokenReader.parse("OPERATOR, +").get(0);
        assertEquals(TokenType.OTHER, t.type());
        assertEquals("+", t.lexeme());
    }

    @Test
    void handles_windows_line_endings_and_surrounding_blanks() {
        var ts = TokenReader.parse("  IDENTIFIER, x  \r\nCOMMAND_END, ;\r\n");
        assertEquals(2, ts.size());
        assertEquals("x", ts.get(0).lexeme());
        assertEquals(TokenType.COMMAND_END, ts.get(1).type());
        assertEquals(2, ts.get(1).line());
    }

    static Stream<String> malformedLines() {
        return Stream.of(
                "",
                "   ",
                "PROGRAM_START",
                "PROGRAM_START,inicio",
                "TYPE, ",
                "just some text"
        );
    }

    @ParameterizedTest
    @MethodSource("malformedLines")
    void malformed_lines_are_skipped(String line) {
        var ts = TokenReader.parse(line + "\nIDENTIFIER, x\n");
        assertEquals(1, ts.size());
        assertEquals(new Token(TokenType.IDENTIFIER, "x", 2), ts.get(0));
    }

    @Test
    void token_type_lookup() {
        assertEquals(TokenType.FOR_LOOP, TokenType.fromName("FOR_LOOP"));
        assertEquals(TokenType.OTHER, TokenType.fromName("for_loop"));
        assertEquals(TokenType.OTHER, TokenType.fromName("WHILE_LOOP"));
        assertEquals(TokenType.OTHER, TokenType.fromName("TYPE "));
    }

    @Test
    void unknown_kind_keeps_its_name() {
        var t = TokenReader.parse("NUMBER, 42").get(0);
        assertEquals(TokenType.OTHER, t.type());
        assertEquals("NUMBER", t.kind());
        assertEquals("Token(NUMBER, 42)", t.toString());
    }

    @Test
    void kind_name_is_matched_exactly() {
        var t = TokenReader.parse("TYPE , int").get(0);
        assertEquals(TokenType.OTHER, t.type());
        assertEquals("TYPE ", t.kind());
    }
}
