package kern.ast;

public enum NodeKind {
    PROGRAM("Program"),
    BLOCK("Block"),
    FUNCTION_DEFINITION("FunctionDefinition"),
    PARAMETERS("Parameters"),
    PARAMETER("Parameter"),
    VARIABLE_DEFINITION("VariableDefinition"),
    IF_CONDITIONAL("IfConditional"),
    ELSE_CONDITIONAL("ElseConditional"),
    FOR_LOOP("ForLoop"),
    CONDITION("Condition"),
    INCREMENT("Increment"),
    EXPRESSION("Expression"),
    RETURN("Return"),
    STATEMENT("Statement");

    private final String label;

    NodeKind(String label) { this.label = label; }

    public String label() { return label; }
}
