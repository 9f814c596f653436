package io.github.eutro.flowssa.core.ast;

/**
 * The kind of an {@link AstNode}. There is exactly one kind per node class.
 */
public enum Kind {
    LITERAL,
    SYMBOL,
    ASSIGN,
    CALL,
    BRACE,
    IF,
    FOR,
    WHILE,
    BREAK,
    NEXT,
    RETURN,
    FUNCTION;

    /**
     * Whether nodes of this kind transfer control, and so may only appear as statements.
     *
     * @return Whether this is a control flow kind.
     */
    public boolean isControlFlow() {
        switch (this) {
            case IF:
            case FOR:
            case WHILE:
            case BREAK:
            case NEXT:
            case RETURN:
                return true;
            default:
                return false;
        }
    }
}
