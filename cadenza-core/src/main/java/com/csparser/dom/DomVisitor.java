package com.csparser.dom;

/**
 * Callback interface for {@link Node#acceptVisitor(DomVisitor, Object)}.
 * Each concrete node calls exactly the method named after its own class.
 *
 * @param <C> the type of the data passed along with each node
 * @param <R> the result type
 */
public interface DomVisitor<C, R> {

    R visitBlockStatement(BlockStatement blockStatement, C data);

    R visitForStatement(ForStatement forStatement, C data);

    R visitExpressionStatement(ExpressionStatement expressionStatement, C data);

    R visitEmptyStatement(EmptyStatement emptyStatement, C data);

    R visitIdentifierExpression(IdentifierExpression identifierExpression, C data);

    R visitPrimitiveExpression(PrimitiveExpression primitiveExpression, C data);

    R visitAssignmentExpression(AssignmentExpression assignmentExpression, C data);

    R visitBinaryOperatorExpression(BinaryOperatorExpression binaryOperatorExpression, C data);

    R visitUnaryOperatorExpression(UnaryOperatorExpression unaryOperatorExpression, C data);

    R visitIdentifier(Identifier identifier, C data);

    R visitTokenNode(TokenNode tokenNode, C data);
}
