package com.csparser.dom;

import java.util.Objects;

/**
 * A name as written in the source, e.g. a variable or member name.
 */
public sealed class Identifier extends Node permits Identifier.NullIdentifier {

    public static final Identifier NULL = new NullIdentifier();

    static final class NullIdentifier extends Identifier {

        NullIdentifier() {
            super("", TextLocation.EMPTY);
        }

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
            return "Identifier.NULL";
        }
    }

    private final String name;
    private final TextLocation startLocation;

    public Identifier(String name) {
        this(name, TextLocation.EMPTY);
    }

    public Identifier(String name, TextLocation startLocation) {
        this.name = Objects.requireNonNull(name, "name");
        this.startLocation = Objects.requireNonNull(startLocation, "startLocation");
    }

    public String getName() {
        return name;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.TOKEN;
    }

    @Override
    public TextLocation getStartLocation() {
        return startLocation;
    }

    @Override
    public TextLocation getEndLocation() {
        return startLocation.advance(name.length());
    }

    @Override
    public <C, R> R acceptVisitor(DomVisitor<C, R> visitor, C data) {
        return visitor.visitIdentifier(this, data);
    }

    @Override
    public String toString() {
        return name;
    }
}
