package kern.ast.stmt;

import kern.ast.Node;

public sealed interface Stmt extends Node
        permits BlockStmt, FunctionDefStmt, VarDefStmt,
        IfStmt, ForStmt, ReturnStmt, RawStmt {}
