package org.minic.compiler.frontend.ast;

/**
 * The kind of an {@link AstNode}, together with the shape every node of that kind must have.
 */
public enum AstOperatorType {
    // region Leaves
    /** An unsigned integer literal, carries an {@link IntegerLiteralAttr}. */
    LEAF_LITERAL_UINT("uint", Shape.LEAF, 0),
    /** A variable or function name, carries an {@link IdentifierAttr}. */
    LEAF_VAR_ID("id", Shape.LEAF, 0),
    /** A declared type, carries a {@link TypeAttr}. */
    LEAF_TYPE("type", Shape.LEAF, 0),
    // endregion

    // region Containers
    /** The root: global declaration statements followed by function definitions. */
    COMPILE_UNIT("compile-unit", Shape.VARIADIC, 0),
    /** Formal parameters of a function definition. */
    FUNC_FORMAL_PARAMS("formal-params", Shape.VARIADIC, 0),
    /** Arguments of a function call. */
    FUNC_REAL_PARAMS("real-params", Shape.VARIADIC, 0),
    /** A block of statements and declarations. */
    BLOCK("block", Shape.VARIADIC, 0),
    /** A declaration statement with one {@link #VAR_DECL} per declared name. */
    DECL_STMT("decl-stmt", Shape.VARIADIC, 1),
    // endregion

    // region Declarations and statements
    /** [return type, name, body, formal parameters] */
    FUNC_DEF("func-def", Shape.FIXED, 4),
    /** [callee, real parameters] */
    FUNC_CALL("func-call", Shape.FIXED, 2),
    /** [type, name] */
    VAR_DECL("var-decl", Shape.FIXED, 2),
    /** [target, value] */
    ASSIGN("=", Shape.FIXED, 2),
    /** [value] */
    RETURN("return", Shape.FIXED, 1),
    /** [condition, then] */
    IF("if", Shape.FIXED, 2),
    /** [condition, then, else] */
    IF_ELSE("if-else", Shape.FIXED, 3),
    /** [condition, body] */
    WHILE("while", Shape.FIXED, 2),
    BREAK("break", Shape.FIXED, 0),
    CONTINUE("continue", Shape.FIXED, 0),
    // endregion

    // region Binary operators
    ADD("+", Shape.FIXED, 2),
    SUB("-", Shape.FIXED, 2),
    MUL("*", Shape.FIXED, 2),
    DIV("/", Shape.FIXED, 2),
    MOD("%", Shape.FIXED, 2),
    LT("<", Shape.FIXED, 2),
    GT(">", Shape.FIXED, 2),
    LE("<=", Shape.FIXED, 2),
    GE(">=", Shape.FIXED, 2),
    EQ("==", Shape.FIXED, 2),
    NE("!=", Shape.FIXED, 2),
    LOGICAL_AND("&&", Shape.FIXED, 2),
    LOGICAL_OR("||", Shape.FIXED, 2),
    // endregion

    // region Unary operators
    /** Arithmetic negation. */
    NEG("neg", Shape.FIXED, 1),
    LOGICAL_NOT("!", Shape.FIXED, 1);
    // endregion

    /** How the child count of a kind is constrained. */
    public enum Shape {
        /** No children, an attribute instead. */
        LEAF,
        /** Exactly the declared number of children. */
        FIXED,
        /** At least the declared number of children. */
        VARIADIC
    }

    private final String label;
    private final Shape shape;
    private final int arity;

    AstOperatorType(String label, Shape shape, int arity) {
        this.label = label;
        this.shape = shape;
        this.arity = arity;
    }

    /**
     * @return The label used in AST dumps.
     */
    public String label() {
        return label;
    }

    /**
     * @return The shape category of this kind.
     */
    public Shape shape() {
        return shape;
    }

    /**
     * @return The exact child count for fixed kinds, the minimum for variadic ones, 0 for leaves.
     */
    public int arity() {
        return arity;
    }

    /**
     * @return {@code true} if nodes of this kind carry an attribute and no children.
     */
    public boolean isLeaf() {
        return shape == Shape.LEAF;
    }

    /**
     * Checks whether a child count is valid for this kind.
     * @param childCount The number of children.
     * @return {@code true} if a node of this kind may have that many children.
     */
    public boolean accepts(int childCount) {
        return switch (shape) {
            case LEAF -> childCount == 0;
            case FIXED -> childCount == arity;
            case VARIADIC -> childCount >= arity;
        };
    }
}
