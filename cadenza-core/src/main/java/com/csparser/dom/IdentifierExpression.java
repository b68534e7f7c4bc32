package com.csparser.dom;

/**
 * A simple name used as an expression.
 */
public final class IdentifierExpression extends Expression {

    public IdentifierExpression() {
    }

    public IdentifierExpression(String name) {
        this(new Identifier(name));
    }

    public IdentifierExpression(Identifier identifier) {
        setIdentifier(identifier);
    }

    public Identifier getIdentifier() {
        return getChildByRole(Roles.IDENTIFIER);
    }

    public void setIdentifier(Identifier identifier) {
        setChildByRole(Roles.IDENTIFIER, identifier);
    }

    public String getName() {
        return getIdentifier().getName();
    }

    @Override
    public <C, R> R acceptVisitor(DomVisitor<C, R> visitor, C data) {
        return visitor.visitIdentifierExpression(this, data);
    }

    @Override
    public String toString() {
        return "IdentifierExpression " + getName();
    }
}
