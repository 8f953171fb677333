package kern.lexer;

import java.util.HashMap;
import java.util.Map;

public enum TokenType {

    // program structure
    PROGRAM_START,
    PROGRAM_END,
    BLOCK_START,
    BLOCK_END,

    // keywords
    FUNCTION_DEFINITION,
    VARIABLE_DEFINITION,
    IF_CONDITIONAL,
    ELSE_CONDITIONAL,
    FOR_LOOP,
    RETURN,

    // names
    TYPE,
    IDENTIFIER,

    // symbols
    LEFT_PAREN, RIGHT_PAREN,
    START_STATEMENT,
    COMMAND_END,
    ASSIGN,

    // anything the grammar only passes through
    OTHER;

    private static final Map<String, TokenType> byName = new HashMap<>();

    static {
        for (TokenType t : values()) byName.put(t.name(), t);
    }

    public static TokenType fromName(String name) {
        return byName.getOrDefault(name, OTHER);
    }
}
