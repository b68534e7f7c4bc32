package com.csparser.dom;

import java.util.Objects;

/**
 * A literal: number, string, character, boolean or {@code null}.
 */
public final class PrimitiveExpression extends Expression {

    private final Object value;
    private final String literalValue;  // source text of the literal
    private final TextLocation startLocation;

    public PrimitiveExpression(Object value) {
        this(value, String.valueOf(value), TextLocation.EMPTY);
    }

    public PrimitiveExpression(Object value, String literalValue, TextLocation startLocation) {
        this.value = value;
        this.literalValue = Objects.requireNonNull(literalValue, "literalValue");
        this.startLocation = Objects.requireNonNull(startLocation, "startLocation");
    }

    public Object getValue() {
        return value;
    }

    public String getLiteralValue() {
        return literalValue;
    }

    @Override
    public TextLocation getStartLocation() {
        return startLocation;
    }

    @Override
    public TextLocation getEndLocation() {
        return startLocation.advance(literalValue.length());
    }

    @Override
    public <C, R> R acceptVisitor(DomVisitor<C, R> visitor, C data) {
        return visitor.visitPrimitiveExpression(this, data);
    }

    @Override
    public String toString() {
        return "PrimitiveExpression " + literalValue;
    }
}
