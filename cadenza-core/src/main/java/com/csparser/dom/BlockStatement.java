package com.csparser.dom;

/**
 * { Statements }
 */
public sealed class BlockStatement extends Statement permits BlockStatement.NullBlockStatement {

    public static final Role<Statement> STATEMENT_ROLE = new Role<>("Statement", Statement.class, Statement.NULL);

    public static final BlockStatement NULL = new NullBlockStatement();

    static final class NullBlockStatement extends BlockStatement {

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
            return "BlockStatement.NULL";
        }
    }

    public TokenNode getLBraceToken() {
        return getChildByRole(Roles.LBRACE);
    }

    public TokenNode getRBraceToken() {
        return getChildByRole(Roles.RBRACE);
    }

    public Iterable<Statement> getStatements() {
        return getChildrenByRole(STATEMENT_ROLE);
    }

    public void setStatements(Iterable<? extends Statement> statements) {
        setChildrenByRole(STATEMENT_ROLE, statements);
    }

    /**
     * Appends a statement, keeping it in front of the closing brace if there is one.
     */
    public void addStatement(Statement statement) {
        TokenNode rbrace = getRBraceToken();
        if (rbrace.isNull()) {
            addChild(statement, STATEMENT_ROLE);
        } else {
            insertChildBefore(rbrace, statement, STATEMENT_ROLE);
        }
    }

    @Override
    public <C, R> R acceptVisitor(DomVisitor<C, R> visitor, C data) {
        return visitor.visitBlockStatement(this, data);
    }
}
