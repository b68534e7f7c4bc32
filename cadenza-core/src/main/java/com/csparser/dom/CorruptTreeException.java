package com.csparser.dom;

/**
 * Thrown by {@link TreeVerifier}, or by a mutator about to relink a node whose
 * neighbours do not point back at it, when a tree violates its linkage invariants.
 */
public class CorruptTreeException extends IllegalStateException {

    public CorruptTreeException(String message) {
        super(message);
    }
}
