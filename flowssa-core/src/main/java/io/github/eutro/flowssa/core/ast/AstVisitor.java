package io.github.eutro.flowssa.core.ast;

/**
 * A visitor over the closed set of {@link AstNode} kinds.
 *
 * @param <R> The result type.
 */
public interface AstVisitor<R> {
    R visitLiteral(Literal node);

    R visitSymbol(Symbol node);

    R visitAssign(Assign node);

    R visitCall(Call node);

    R visitBrace(Brace node);

    R visitIf(If node);

    R visitFor(For node);

    R visitWhile(While node);

    R visitBreak(Break node);

    R visitNext(Next node);

    R visitReturn(Return node);

    R visitFunction(Function node);
}
