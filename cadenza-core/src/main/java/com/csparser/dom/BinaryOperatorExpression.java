package com.csparser.dom;

import java.util.Objects;

/**
 * Left Operator Right
 */
public final class BinaryOperatorExpression extends Expression {

    public static final Role<Expression> LEFT_ROLE = new Role<>("Left", Expression.class, Expression.NULL);
    public static final Role<Expression> RIGHT_ROLE = new Role<>("Right", Expression.class, Expression.NULL);
    public static final Role<TokenNode> OPERATOR_ROLE = new Role<>("Operator", TokenNode.class, TokenNode.NULL);

    public enum Operator {
        BITWISE_AND("&"),
        BITWISE_OR("|"),
        CONDITIONAL_AND("&&"),
        CONDITIONAL_OR("||"),
        EXCLUSIVE_OR("^"),
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUAL(">="),
        EQUALITY("=="),
        INEQUALITY("!="),
        LESS_THAN("<"),
        LESS_THAN_OR_EQUAL("<="),
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        MODULUS("%"),
        SHIFT_LEFT("<<"),
        SHIFT_RIGHT(">>"),
        NULL_COALESCING("??");

        private final String token;

        Operator(String token) {
            this.token = token;
        }

        public String getToken() {
            return token;
        }
    }

    private Operator operator;

    public BinaryOperatorExpression(Operator operator) {
        this.operator = Objects.requireNonNull(operator, "operator");
    }

    public BinaryOperatorExpression(Expression left, Operator operator, Expression right) {
        this(operator);
        setLeft(left);
        setRight(right);
    }

    public Operator getOperator() {
        return operator;
    }

    public void setOperator(Operator operator) {
        this.operator = Objects.requireNonNull(operator, "operator");
    }

    public Expression getLeft() {
        return getChildByRole(LEFT_ROLE);
    }

    public void setLeft(Expression left) {
        setChildByRole(LEFT_ROLE, left);
    }

    public TokenNode getOperatorToken() {
        return getChildByRole(OPERATOR_ROLE);
    }

    public Expression getRight() {
        return getChildByRole(RIGHT_ROLE);
    }

    public void setRight(Expression right) {
        setChildByRole(RIGHT_ROLE, right);
    }

    @Override
    public <C, R> R acceptVisitor(DomVisitor<C, R> visitor, C data) {
        return visitor.visitBinaryOperatorExpression(this, data);
    }

    @Override
    public String toString() {
        return "BinaryOperatorExpression " + operator.getToken();
    }
}
