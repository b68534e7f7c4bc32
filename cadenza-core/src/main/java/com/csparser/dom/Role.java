package com.csparser.dom;

import java.util.Objects;

/**
 * Names a child slot of a node and constrains what may occupy it.
 * <p>
 * Roles are declared once as {@code static final} constants and compared by
 * identity. Each role carries the null object that {@link Node#getChildByRole(Role)}
 * hands back when the slot is empty.
 *
 * @param <T> the node category permitted in this slot
 */
public class Role<T extends Node> {

    private final String name;
    private final Class<T> type;
    private final T nullObject;

    public Role(String name, Class<T> type, T nullObject) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.nullObject = Objects.requireNonNull(nullObject, "nullObject");
        if (!nullObject.isNull()) {
            throw new IllegalArgumentException("Role " + name + " needs a null node as its null object, got " + nullObject);
        }
    }

    public String getName() {
        return name;
    }

    public Class<T> getType() {
        return type;
    }

    public T getNullObject() {
        return nullObject;
    }

    /**
     * Whether {@code node} may be placed in this role by {@link Node#replaceWith(Node)}.
     * Subclasses may narrow the default, which accepts any instance of {@link #getType()}.
     */
    public boolean isValid(Node node) {
        return type.isInstance(node);
    }

    @Override
    public String toString() {
        return name;
    }
}
