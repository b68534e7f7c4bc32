package com.csparser.dom;

import java.util.Objects;

/**
 * Operator Expression, or Expression Operator for the postfix forms.
 */
public final class UnaryOperatorExpression extends Expression {

    public static final Role<TokenNode> OPERATOR_ROLE = new Role<>("Operator", TokenNode.class, TokenNode.NULL);

    public enum Operator {
        NOT("!", false),
        BIT_NOT("~", false),
        MINUS("-", false),
        PLUS("+", false),
        INCREMENT("++", false),
        DECREMENT("--", false),
        POST_INCREMENT("++", true),
        POST_DECREMENT("--", true);

        private final String token;
        private final boolean postfix;

        Operator(String token, boolean postfix) {
            this.token = token;
            this.postfix = postfix;
        }

        public String getToken() {
            return token;
        }

        public boolean isPostfix() {
            return postfix;
        }
    }

    private Operator operator;

    public UnaryOperatorExpression(Operator operator, Expression expression) {
        this.operator = Objects.requireNonNull(operator, "operator");
        setExpression(expression);
    }

    public Operator getOperator() {
        return operator;
    }

    public void setOperator(Operator operator) {
        this.operator = Objects.requireNonNull(operator, "operator");
    }

    public TokenNode getOperatorToken() {
        return getChildByRole(OPERATOR_ROLE);
    }

    public Expression getExpression() {
        return getChildByRole(Roles.EXPRESSION);
    }

    public void setExpression(Expression expression) {
        setChildByRole(Roles.EXPRESSION, expression);
    }

    @Override
    public <C, R> R acceptVisitor(DomVisitor<C, R> visitor, C data) {
        return visitor.visitUnaryOperatorExpression(this, data);
    }

    @Override
    public String toString() {
        return "UnaryOperatorExpression " + operator.getToken();
    }
}
