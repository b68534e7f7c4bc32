package com.csparser.dom;

import java.util.Objects;

/**
 * A keyword or punctuation token kept in the tree, e.g. the {@code for}
 * keyword or a semicolon. Tokens only carry their position.
 */
public sealed class TokenNode extends Node permits TokenNode.NullTokenNode {

    public static final TokenNode NULL = new NullTokenNode();

    static final class NullTokenNode extends TokenNode {

        NullTokenNode() {
            super(TextLocation.EMPTY, 0);
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
            return "TokenNode.NULL";
        }
    }

    private final TextLocation startLocation;
    private final int tokenLength;

    public TokenNode(TextLocation startLocation, int tokenLength) {
        if (tokenLength < 0) {
            throw new IllegalArgumentException("tokenLength must not be negative: " + tokenLength);
        }
        this.startLocation = Objects.requireNonNull(startLocation, "startLocation");
        this.tokenLength = tokenLength;
    }

    public int getTokenLength() {
        return tokenLength;
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
        return startLocation.advance(tokenLength);
    }

    @Override
    public <C, R> R acceptVisitor(DomVisitor<C, R> visitor, C data) {
        return visitor.visitTokenNode(this, data);
    }

    @Override
    public String toString() {
        return "[Token " + startLocation + "+" + tokenLength + "]";
    }
}
