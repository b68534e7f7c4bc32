package com.csparser.dom;

/**
 * Coarse category of a syntax tree node.
 */
public enum NodeType {
    UNKNOWN,
    TYPE_REFERENCE,
    TYPE_DECLARATION,
    MEMBER,
    STATEMENT,
    EXPRESSION,
    TOKEN,
    WHITESPACE
}
