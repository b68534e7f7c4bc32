package com.csparser.dom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Checks the linkage invariants of a subtree: parent back-pointers, sibling
 * symmetry, first/last child bounds, roles of attached nodes, absence of cycles
 * and untouched null objects.
 * <p>
 * {@link Node#addChild} does not consult {@link Role#isValid(Node)}; with
 * {@code checkRoleValidity} the verifier also reports children their role would
 * reject.
 */
public final class TreeVerifier {

    private static final Logger LOG = LoggerFactory.getLogger(TreeVerifier.class);

    private final boolean checkRoleValidity;
    private final boolean failFast;

    public TreeVerifier() {
        this(false, false);
    }

    /**
     * @param checkRoleValidity also check every child against its role's {@link Role#isValid(Node)}
     * @param failFast throw a {@link CorruptTreeException} on the first violation instead of collecting them
     */
    public TreeVerifier(boolean checkRoleValidity, boolean failFast) {
        this.checkRoleValidity = checkRoleValidity;
        this.failFast = failFast;
    }

    /**
     * Verifies the subtree rooted at {@code root}.
     *
     * @return the violations found, empty for a consistent tree
     * @throws CorruptTreeException on the first violation when fail-fast
     */
    public List<String> verify(Node root) {
        Objects.requireNonNull(root, "root");
        List<String> violations = new ArrayList<>();
        Set<Node> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(root);

        while (!pending.isEmpty()) {
            Node node = pending.pop();
            if (!visited.add(node)) {
                report(violations, node + " is reachable more than once");
                continue;
            }
            if (node.isNull()) {
                if (node.getParent() != null || node.getRole() != null
                    || node.getPrevSibling() != null || node.getNextSibling() != null || node.hasChildren()) {
                    report(violations, "null object " + node + " is linked into a tree");
                }
                continue;
            }

            Set<Node> siblings = Collections.newSetFromMap(new IdentityHashMap<>());
            Node expectedPrev = null;
            for (Node child = node.getFirstChild(); child != null; child = child.getNextSibling()) {
                if (!siblings.add(child)) {
                    report(violations, "sibling list of " + node + " loops back to " + child);
                    break;
                }
                checkChild(violations, node, child, expectedPrev);
                pending.push(child);
                expectedPrev = child;
            }
            if (node.getLastChild() != expectedPrev) {
                report(violations, "last child of " + node + " is " + node.getLastChild() + " but the sibling walk ends at " + expectedPrev);
            }
        }
        return violations;
    }

    /**
     * Verifies the subtree rooted at {@code root} and throws if it is not consistent.
     */
    public void verifyOrThrow(Node root) {
        List<String> violations = verify(root);
        if (!violations.isEmpty()) {
            throw new CorruptTreeException(violations.size() + " violation(s): " + String.join("; ", violations));
        }
    }

    private void checkChild(List<String> violations, Node parent, Node child, Node expectedPrev) {
        if (child.getParent() != parent) {
            report(violations, child + " is a child of " + parent + " but points to parent " + child.getParent());
        }
        if (child.getPrevSibling() != expectedPrev) {
            report(violations, child + " has previous sibling " + child.getPrevSibling() + ", expected " + expectedPrev);
        }
        if (child.isNull()) {
            report(violations, "null object " + child + " is a child of " + parent);
        }
        Role<?> role = child.getRole();
        if (role == null) {
            report(violations, child + " is attached to " + parent + " without a role");
        } else if (checkRoleValidity && !role.isValid(child)) {
            report(violations, child + " is not valid in the role " + role + " of " + parent);
        }
    }

    private void report(List<String> violations, String message) {
        if (failFast) {
            throw new CorruptTreeException(message);
        }
        LOG.warn("Tree violation: {}", message);
        violations.add(message);
    }
}
