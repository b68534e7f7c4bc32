package com.csparser.dom;

/**
 * Base class for statements.
 */
public abstract sealed class Statement extends Node
    permits BlockStatement, ForStatement, ExpressionStatement, EmptyStatement, Statement.NullStatement {

    public static final Statement NULL = new NullStatement();

    static final class NullStatement extends Statement {

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
            return "Statement.NULL";
        }
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.STATEMENT;
    }
}
