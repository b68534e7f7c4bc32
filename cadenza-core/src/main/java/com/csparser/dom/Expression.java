package com.csparser.dom;

/**
 * Base class for expressions.
 */
public abstract sealed class Expression extends Node
    permits IdentifierExpression, PrimitiveExpression, AssignmentExpression, BinaryOperatorExpression,
        UnaryOperatorExpression, Expression.NullExpression {

    public static final Expression NULL = new NullExpression();

    static final class NullExpression extends Expression {

        @Override
        public boolean isNull() {
            return true;
        }

        @Override
        public <C, R> R acceptVisitor(DomVisitor<C, R> visitor, C data) {
            return null;
        }

        @Override
        public String toString() {
            return "Expression.NULL";
        }
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.EXPRESSION;
    }
}
