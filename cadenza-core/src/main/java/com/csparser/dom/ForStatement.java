package com.csparser.dom;

/**
 * for (Initializers; Condition; Iterators) EmbeddedStatement
 */
public final class ForStatement extends Statement {

    public static final Role<Statement> INITIALIZER_ROLE = new Role<>("Initializer", Statement.class, Statement.NULL);
    public static final Role<Statement> ITERATOR_ROLE = new Role<>("Iterator", Statement.class, Statement.NULL);

    /**
     * Gets the initializer statements.
     * <p>
     * "for (a = 2, b = 1; a > b; a--)" has one initializer per assignment, while
     * a declaration of several variables is a single initializer.
     */
    public TokenNode getForToken() {
        return getChildByRole(Roles.KEYWORD);
    }

    public TokenNode getLParToken() {
        return getChildByRole(Roles.LPAR);
    }

    /**
     * The two semicolons between the initializers, the condition and the iterators.
     */
    public Iterable<TokenNode> getSemicolonTokens() {
        return getChildrenByRole(Roles.SEMICOLON);
    }

    public TokenNode getRParToken() {
        return getChildByRole(Roles.RPAR);
    }

    public Iterable<Statement> getInitializers() {
        return getChildrenByRole(INITIALIZER_ROLE);
    }

    public void setInitializers(Iterable<? extends Statement> initializers) {
        setChildrenByRole(INITIALIZER_ROLE, initializers);
    }

    public Expression getCondition() {
        return getChildByRole(Roles.CONDITION);
    }

    public void setCondition(Expression condition) {
        setChildByRole(Roles.CONDITION, condition);
    }

    public Iterable<Statement> getIterators() {
        return getChildrenByRole(ITERATOR_ROLE);
    }

    public void setIterators(Iterable<? extends Statement> iterators) {
        setChildrenByRole(ITERATOR_ROLE, iterators);
    }

    public Statement getEmbeddedStatement() {
        return getChildByRole(Roles.EMBEDDED_STATEMENT);
    }

    public void setEmbeddedStatement(Statement embeddedStatement) {
        setChildByRole(Roles.EMBEDDED_STATEMENT, embeddedStatement);
    }

    @Override
    public <C, R> R acceptVisitor(DomVisitor<C, R> visitor, C data) {
        return visitor.visitForStatement(this, data);
    }
}
