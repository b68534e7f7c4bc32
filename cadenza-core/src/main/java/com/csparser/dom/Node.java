package com.csparser.dom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * Base class for all syntax tree nodes.
 * <p>
 * A node owns its children, which form a doubly linked list running from
 * {@link #getFirstChild()} to {@link #getLastChild()}. Every child is attached
 * under a {@link Role}. Trees are shaped only through the mutators declared here:
 * {@link #addChild}, {@link #insertChildBefore}, {@link #insertChildAfter},
 * {@link #setChildByRole}, {@link #setChildrenByRole}, {@link #remove()} and
 * {@link #replaceWith(Node)}.
 * <p>
 * Missing optional children are represented by null objects ({@link #isNull()}),
 * one shared instance per category. Null objects never take part in a tree.
 * <p>
 * Nodes are not thread-safe.
 */
public abstract sealed class Node permits Statement, Expression, Identifier, TokenNode, Node.NullNode {

    private static final Logger LOG = LoggerFactory.getLogger(Node.class);

    public static final Node NULL = new NullNode();

    static final class NullNode extends Node {

        @Override
        public NodeType getNodeType() {
            return NodeType.UNKNOWN;
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
            return "Node.NULL";
        }
    }

    private Node parent;
    private Node prevSibling;
    private Node nextSibling;
    private Node firstChild;
    private Node lastChild;
    private Role<?> role;

    public abstract NodeType getNodeType();

    public boolean isNull() {
        return false;
    }

    public TextLocation getStartLocation() {
        Node child = firstChild;
        if (child == null) {
            return TextLocation.EMPTY;
        }
        return child.getStartLocation();
    }

    public TextLocation getEndLocation() {
        Node child = lastChild;
        if (child == null) {
            return TextLocation.EMPTY;
        }
        return child.getEndLocation();
    }

    public Node getParent() {
        return parent;
    }

    /**
     * The role this node is attached under, or {@code null} while detached.
     */
    public Role<?> getRole() {
        return role;
    }

    public Node getNextSibling() {
        return nextSibling;
    }

    public Node getPrevSibling() {
        return prevSibling;
    }

    public Node getFirstChild() {
        return firstChild;
    }

    public Node getLastChild() {
        return lastChild;
    }

    public boolean hasChildren() {
        return firstChild != null;
    }

    /**
     * All direct children in document order.
     * <p>
     * The returned iterable is lazy and can be iterated repeatedly. Removing or
     * replacing the child just returned is safe while iterating; a child removed
     * before it was reached is skipped.
     */
    public Iterable<Node> getChildren() {
        return () -> new ChildIterator<>(this, null);
    }

    /**
     * Gets the first child with the specified role.
     * Returns the role's null object if there is no such child.
     */
    public <T extends Node> T getChildByRole(Role<T> role) {
        Objects.requireNonNull(role, "role");
        Node child = findChild(role);
        if (child == null) {
            return role.getNullObject();
        }
        return role.getType().cast(child);
    }

    /**
     * The children with the specified role in document order, with the same
     * iteration guarantees as {@link #getChildren()}.
     */
    public <T extends Node> Iterable<T> getChildrenByRole(Role<T> role) {
        Objects.requireNonNull(role, "role");
        return () -> new ChildIterator<>(this, role);
    }

    /**
     * Puts {@code newChild} in place of the first child with the specified role,
     * or appends it when there is none. Passing {@code null} or a null object
     * removes the existing child.
     */
    public <T extends Node> void setChildByRole(Role<T> role, T newChild) {
        Objects.requireNonNull(role, "role");
        Node oldChild = findChild(role);
        if (oldChild == null) {
            addChild(newChild, role);
        } else if (oldChild != newChild) {
            oldChild.replaceWith(newChild);
        }
    }

    /**
     * Replaces all children with the specified role by {@code newChildren}.
     * <p>
     * {@code newChildren} is copied before anything is removed, so it may be a
     * live view of the children being replaced, e.g.
     * {@code setChildrenByRole(role, getChildrenByRole(role))}. All new children
     * are checked up front; if one of them cannot be attached the tree is left
     * untouched.
     */
    public <T extends Node> void setChildrenByRole(Role<T> role, Iterable<? extends T> newChildren) {
        Objects.requireNonNull(role, "role");
        List<T> copy = new ArrayList<>();
        if (newChildren != null) {
            Set<Node> seen = Collections.newSetFromMap(new IdentityHashMap<>());
            for (T newChild : newChildren) {
                if (newChild == null || newChild.isNull()) {
                    continue;
                }
                Node node = newChild;
                if (!seen.add(node)) {
                    throw new NodeOwnershipException("Node " + node + " occurs more than once in the new children.", node);
                }
                // children that are already in this role will be detached first
                if (node.parent != this || node.role != role) {
                    checkAttachable(node, this);
                }
                copy.add(newChild);
            }
        }
        if (!copy.isEmpty() && isNull()) {
            throw new IllegalStateException("Cannot add children to null nodes");
        }

        for (T node : getChildrenByRole(role)) {
            node.remove();
        }
        for (T node : copy) {
            addChild(node, role);
        }
    }

    /**
     * Appends {@code child} as the last child of this node.
     * Does nothing if {@code child} is {@code null} or a null object.
     *
     * @throws IllegalStateException if this node is a null object
     * @throws NodeOwnershipException if {@code child} already has a parent or is this node or one of its ancestors
     */
    public <T extends Node> void addChild(T child, Role<T> role) {
        Objects.requireNonNull(role, "role");
        if (child == null || child.isNull()) {
            return;
        }
        if (this.isNull()) {
            throw new IllegalStateException("Cannot add children to null nodes");
        }
        Node node = child;
        checkAttachable(node, this);

        node.parent = this;
        node.role = role;
        if (firstChild == null) {
            lastChild = firstChild = node;
        } else {
            lastChild.nextSibling = node;
            node.prevSibling = lastChild;
            lastChild = node;
        }
        LOG.trace("Added {} as {} of {}", node, role, this);
    }

    /**
     * Inserts {@code child} directly before {@code nextSibling}. A {@code null}
     * (or null object) {@code nextSibling} appends the child instead.
     *
     * @throws NodeOwnershipException if {@code child} already has a parent
     * @throws InvalidAnchorException if {@code nextSibling} is not a child of this node
     */
    public <T extends Node> void insertChildBefore(Node nextSibling, T child, Role<T> role) {
        Objects.requireNonNull(role, "role");
        if (nextSibling == null || nextSibling.isNull()) {
            addChild(child, role);
            return;
        }
        if (child == null || child.isNull()) {
            return;
        }
        Node node = child;
        checkAttachable(node, this);
        if (nextSibling.parent != this) {
            throw new InvalidAnchorException("NextSibling is not a child of this node.", nextSibling);
        }
        // null objects have no children, so the check above also rejects them as receivers
        nextSibling.checkLinks();

        node.parent = this;
        node.role = role;
        node.nextSibling = nextSibling;
        node.prevSibling = nextSibling.prevSibling;

        if (nextSibling.prevSibling != null) {
            nextSibling.prevSibling.nextSibling = node;
        } else {
            firstChild = node;
        }
        nextSibling.prevSibling = node;
        LOG.trace("Inserted {} as {} of {} before {}", node, role, this, nextSibling);
    }

    /**
     * Inserts {@code child} directly after {@code prevSibling}. A {@code null}
     * (or null object) {@code prevSibling} inserts the child at the front.
     *
     * @throws NodeOwnershipException if {@code child} already has a parent
     * @throws InvalidAnchorException if {@code prevSibling} is not a child of this node
     */
    public <T extends Node> void insertChildAfter(Node prevSibling, T child, Role<T> role) {
        Objects.requireNonNull(role, "role");
        if (child == null || child.isNull()) {
            return;
        }
        if (prevSibling == null || prevSibling.isNull()) {
            insertChildBefore(firstChild, child, role);
            return;
        }
        if (prevSibling.parent != this) {
            throw new InvalidAnchorException("PrevSibling is not a child of this node.", prevSibling);
        }
        insertChildBefore(prevSibling.nextSibling, child, role);
    }

    /**
     * Removes this node from its parent. Does nothing if the node is detached.
     */
    public void remove() {
        if (parent == null) {
            return;
        }
        checkLinks();
        if (prevSibling != null) {
            prevSibling.nextSibling = nextSibling;
        } else {
            parent.firstChild = nextSibling;
        }
        if (nextSibling != null) {
            nextSibling.prevSibling = prevSibling;
        } else {
            parent.lastChild = prevSibling;
        }
        LOG.trace("Removed {} ({}) from {}", this, role, parent);
        parent = null;
        prevSibling = null;
        nextSibling = null;
        role = null;
    }

    /**
     * Replaces this node with {@code newNode}, which takes over this node's
     * parent, role and siblings. A {@code null} (or null object) argument
     * removes this node. Replacing a detached node has no effect.
     *
     * @throws NodeOwnershipException if {@code newNode} already has a parent
     * @throws RoleMismatchException if the role of this node does not accept {@code newNode}
     */
    public void replaceWith(Node newNode) {
        if (newNode == null || newNode.isNull()) {
            remove();
            return;
        }
        if (newNode == this) {
            return;
        }
        // TODO: allow replacing a node with one of its own descendants, e.g. unwrapping a parenthesized expression
        checkAttachable(newNode, parent);
        if (parent == null) {
            return;
        }
        // the role's type parameter is not checked at compile time here
        if (!role.isValid(newNode)) {
            throw new RoleMismatchException(role, newNode);
        }
        checkLinks();

        newNode.parent = parent;
        newNode.role = role;
        newNode.prevSibling = prevSibling;
        newNode.nextSibling = nextSibling;
        if (prevSibling != null) {
            prevSibling.nextSibling = newNode;
        } else {
            parent.firstChild = newNode;
        }
        if (nextSibling != null) {
            nextSibling.prevSibling = newNode;
        } else {
            parent.lastChild = newNode;
        }
        LOG.trace("Replaced {} by {} ({}) in {}", this, newNode, role, parent);
        parent = null;
        prevSibling = null;
        nextSibling = null;
        role = null;
    }

    public abstract <C, R> R acceptVisitor(DomVisitor<C, R> visitor, C data);

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }

    private Node findChild(Role<?> role) {
        for (Node cur = firstChild; cur != null; cur = cur.nextSibling) {
            if (cur.role == role) {
                return cur;
            }
        }
        return null;
    }

    /**
     * Checks that the neighbours of this attached node point back at it.
     */
    private void checkLinks() {
        boolean linked = (prevSibling == null ? parent.firstChild == this : prevSibling.nextSibling == this)
            && (nextSibling == null ? parent.lastChild == this : nextSibling.prevSibling == this);
        if (!linked) {
            throw new CorruptTreeException("Sibling links around " + this + " in " + parent + " are inconsistent.");
        }
    }

    private static void checkAttachable(Node node, Node newParent) {
        if (node.parent != null) {
            throw new NodeOwnershipException("Node " + node + " is already used in another tree.", node);
        }
        for (Node ancestor = newParent; ancestor != null; ancestor = ancestor.parent) {
            if (ancestor == node) {
                throw new NodeOwnershipException("Node " + node + " cannot be attached below itself.", node);
            }
        }
    }

    /**
     * Walks the children of {@code owner}, optionally restricted to one role.
     * The successor of each node is captured when the node is returned and the
     * walk continues from it while it is still a child of {@code owner}. If it
     * has left {@code owner}, the walk continues after the last returned node,
     * or after the predecessor captured with it.
     */
    private static final class ChildIterator<T extends Node> implements Iterator<T> {

        private final Node owner;
        private final Role<T> role; // null matches every child

        private boolean started;
        private Node lastReturned;
        private Node capturedPrev;
        private Node capturedNext;
        private Node pending;
        private boolean canRemove;

        ChildIterator(Node owner, Role<T> role) {
            this.owner = owner;
            this.role = role;
        }

        @Override
        public boolean hasNext() {
            if (pending == null) {
                Node cur = resumePoint();
                while (cur != null && role != null && cur.role != role) {
                    cur = cur.nextSibling;
                }
                pending = cur;
            }
            return pending != null;
        }

        @Override
        @SuppressWarnings("unchecked")
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Node result = pending;
            pending = null;
            started = true;
            lastReturned = result;
            capturedPrev = result.prevSibling;
            capturedNext = result.nextSibling;
            canRemove = true;
            // only children attached under 'role' are returned, and those are instances of T
            return (T) result;
        }

        @Override
        public void remove() {
            if (!canRemove) {
                throw new IllegalStateException();
            }
            canRemove = false;
            if (lastReturned.parent == owner) {
                lastReturned.remove();
            }
        }

        private Node resumePoint() {
            if (!started) {
                return owner.firstChild;
            }
            if (capturedNext == null) {
                return null;
            }
            if (capturedNext.parent == owner) {
                return capturedNext;
            }
            // the captured successor was removed before it was reached
            if (lastReturned.parent == owner) {
                return lastReturned.nextSibling;
            }
            if (capturedPrev == null) {
                return owner.firstChild;
            }
            if (capturedPrev.parent == owner) {
                return capturedPrev.nextSibling;
            }
            return null;
        }
    }
}
