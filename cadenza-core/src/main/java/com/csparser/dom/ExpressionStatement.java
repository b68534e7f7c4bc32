package com.csparser.dom;

/**
 * Expression;
 */
public final class ExpressionStatement extends Statement {

    public ExpressionStatement() {
    }

    public ExpressionStatement(Expression expression) {
        setExpression(expression);
    }

    public Expression getExpression() {
        return getChildByRole(Roles.EXPRESSION);
    }

    public void setExpression(Expression expression) {
        setChildByRole(Roles.EXPRESSION, expression);
    }

    @Override
    public <C, R> R acceptVisitor(DomVisitor<C, R> visitor, C data) {
        return visitor.visitExpressionStatement(this, data);
    }
}
