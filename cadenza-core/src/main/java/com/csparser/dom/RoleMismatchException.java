package com.csparser.dom;

/**
 * Thrown by {@link Node#replaceWith(Node)} when the replacement is rejected by
 * the role of the node being replaced.
 */
public class RoleMismatchException extends IllegalArgumentException {

    private final transient Role<?> role;
    private final transient Node node;

    public RoleMismatchException(Role<?> role, Node node) {
        super("The new node '" + node.getClass().getSimpleName() + "' is not valid in the role " + role);
        this.role = role;
        this.node = node;
    }

    public Role<?> getRole() {
        return role;
    }

    public Node getNode() {
        return node;
    }
}
