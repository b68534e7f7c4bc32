package com.csparser.dom;

/**
 * Thrown when the sibling passed to an insert operation is not a child of the
 * node being inserted into.
 */
public class InvalidAnchorException extends IllegalArgumentException {

    private final transient Node anchor;

    public InvalidAnchorException(String message, Node anchor) {
        super(message);
        this.anchor = anchor;
    }

    public Node getAnchor() {
        return anchor;
    }
}
