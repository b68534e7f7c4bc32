package com.csparser.dom;

/**
 * Thrown when a node that already has a parent, or that would end up below
 * itself, is attached to a tree.
 */
public class NodeOwnershipException extends IllegalArgumentException {

    private final transient Node node;

    public NodeOwnershipException(String message, Node node) {
        super(message);
        this.node = node;
    }

    public Node getNode() {
        return node;
    }
}
