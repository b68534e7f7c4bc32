package com.csparser.dom;

import java.util.Objects;

/**
 * ;
 */
public final class EmptyStatement extends Statement {

    private final TextLocation location;

    public EmptyStatement() {
        this(TextLocation.EMPTY);
    }

    public EmptyStatement(TextLocation location) {
        this.location = Objects.requireNonNull(location, "location");
    }

    @Override
    public TextLocation getStartLocation() {
        return location;
    }

    @Override
    public TextLocation getEndLocation() {
        return location.advance(1);
    }

    @Override
    public <C, R> R acceptVisitor(DomVisitor<C, R> visitor, C data) {
        return visitor.visitEmptyStatement(this, data);
    }
}
