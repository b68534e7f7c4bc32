package com.csparser.dom;

import java.util.Objects;

/**
 * Left Operator Right, where the operator is {@code =} or a compound assignment.
 */
public final class AssignmentExpression extends Expression {

    // shares its slots with binary operators so both can be handled alike
    public static final Role<Expression> LEFT_ROLE = BinaryOperatorExpression.LEFT_ROLE;
    public static final Role<Expression> RIGHT_ROLE = BinaryOperatorExpression.RIGHT_ROLE;

    public enum Operator {
        ASSIGN("="),
        ADD("+="),
        SUBTRACT("-="),
        MULTIPLY("*="),
        DIVIDE("/="),
        MODULUS("%="),
        SHIFT_LEFT("<<="),
        SHIFT_RIGHT(">>="),
        BITWISE_AND("&="),
        BITWISE_OR("|="),
        EXCLUSIVE_OR("^=");

        private final String token;

        Operator(String token) {
            this.token = token;
        }

        public String getToken() {
            return token;
        }
    }

    private Operator operator;

    public AssignmentExpression(Expression left, Expression right) {
        this(left, Operator.ASSIGN, right);
    }

    public AssignmentExpression(Expression left, Operator operator, Expression right) {
        this.operator = Objects.requireNonNull(operator, "operator");
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
        return getChildByRole(Roles.ASSIGN);
    }

    public Expression getRight() {
        return getChildByRole(RIGHT_ROLE);
    }

    public void setRight(Expression right) {
        setChildByRole(RIGHT_ROLE, right);
    }

    @Override
    public <C, R> R acceptVisitor(DomVisitor<C, R> visitor, C data) {
        return visitor.visitAssignmentExpression(this, data);
    }

    @Override
    public String toString() {
        return "AssignmentExpression " + operator.getToken();
    }
}
