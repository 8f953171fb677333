package kern.ast;

import kern.ast.expr.Condition;
import kern.ast.expr.Expression;
import kern.ast.expr.Increment;
import kern.ast.stmt.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TreePrinterTest {

    @Test
    void renders_kind_and_text_per_line() {
        var p = new Program(List.of(
                new VarDefStmt("int", "x", new Expression("1")),
                new ReturnStmt("x")));
        assertEquals("""
                Program()
                  VariableDefinition(int x = 1)
                  Return(x)
                """, TreePrinter.render(p));
    }

    @Test
    void renders_function_with_parameters() {
        var f = new FunctionDefStmt("soma", "int",
                new FunctionDefStmt.Parameters(List.of(
                        new FunctionDefStmt.Param("int", "a"),
                        new FunctionDefStmt.Param("int", "b"))),
                new BlockStmt(List.of(new ReturnStmt("a"))));
        assertEquals("""
                Program()
                  FunctionDefinition(soma: int)
                    Parameters()
                      Parameter(int a)
                      Parameter(int b)
                    Block()
                      Return(a)
                """, TreePrinter.render(new Program(List.of(f))));
    }

    @Test
    void renders_if_else_and_for() {
        var ifs = new IfStmt(new Expression("x > 0"),
                new BlockStmt(List.of(new RawStmt("imprime"))),
                new IfStmt.ElseBranch(new BlockStmt(List.of())));
        var loop = new ForStmt(
                new VarDefStmt("int", "i", new Expression("0")),
                new Condition("i < 10"),
                new Increment("i ++"),
                new BlockStmt(List.of()));
        assertEquals("""
                IfConditional(x > 0)
                  Block()
                    Statement(imprime)
                  ElseConditional()
                    Block()
                """, TreePrinter.render(ifs));
        assertEquals("""
                ForLoop()
                  VariableDefinition(int i = 0)
                  Condition(i < 10)
                  Increment(i ++)
                  Block()
                """, TreePrinter.render(loop));
    }

    @Test
    void counts_every_node() {
        var p = new Program(List.of(new BlockStmt(List.of(new RawStmt("a"), new RawStmt("b")))));
        assertEquals(4, TreePrinter.count(p));
    }

    @Test
    void nodes_copy_their_children() {
        var stmts = new java.util.ArrayList<Stmt>();
        stmts.add(new RawStmt("a"));
        var block = new BlockStmt(stmts);
        stmts.add(new RawStmt("b"));
        assertEquals(1, block.statements().size());
        assertThrows(UnsupportedOperationException.class, () -> block.children().add(new RawStmt("c")));
    }
}
