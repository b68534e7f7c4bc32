package com.csparser.dom;

/**
 * Roles shared by several node categories.
 */
public final class Roles {

    private Roles() {
    }

    public static final Role<Identifier> IDENTIFIER = new Role<>("Identifier", Identifier.class, Identifier.NULL);

    public static final Role<Expression> EXPRESSION = new Role<>("Expression", Expression.class, Expression.NULL);
    public static final Role<Expression> CONDITION = new Role<>("Condition", Expression.class, Expression.NULL);
    public static final Role<Statement> EMBEDDED_STATEMENT = new Role<>("EmbeddedStatement", Statement.class, Statement.NULL);

    public static final Role<TokenNode> KEYWORD = new Role<>("Keyword", TokenNode.class, TokenNode.NULL);

    // punctuation
    public static final Role<TokenNode> LPAR = new Role<>("LPar", TokenNode.class, TokenNode.NULL);
    public static final Role<TokenNode> RPAR = new Role<>("RPar", TokenNode.class, TokenNode.NULL);
    public static final Role<TokenNode> LBRACE = new Role<>("LBrace", TokenNode.class, TokenNode.NULL);
    public static final Role<TokenNode> RBRACE = new Role<>("RBrace", TokenNode.class, TokenNode.NULL);
    public static final Role<TokenNode> SEMICOLON = new Role<>("Semicolon", TokenNode.class, TokenNode.NULL);
    public static final Role<TokenNode> ASSIGN = new Role<>("Assign", TokenNode.class, TokenNode.NULL);
}
