package kern.ast.expr;

import kern.ast.Node;

public sealed interface Clause extends Node
        permits Expression, Condition, Increment {}
