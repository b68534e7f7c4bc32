package com.csparser.dom;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LocationTest {

    @Test
    void testLeafLocations() {
        Identifier identifier = new Identifier("count", new TextLocation(3, 5));
        assertEquals(new TextLocation(3, 5), identifier.getStartLocation());
        assertEquals(new TextLocation(3, 10), identifier.getEndLocation());

        TokenNode token = new TokenNode(new TextLocation(7, 1), 3);
        assertEquals(new TextLocation(7, 4), token.getEndLocation());
        assertEquals(3, token.getTokenLength());

        PrimitiveExpression literal = new PrimitiveExpression(42, "42", new TextLocation(1, 9));
        assertEquals(new TextLocation(1, 11), literal.getEndLocation());

        EmptyStatement empty = new EmptyStatement(new TextLocation(2, 2));
        assertEquals(new TextLocation(2, 3), empty.getEndLocation());
    }

    @Test
    void testLeavesWithoutPositionStayEmpty() {
        assertTrue(new Identifier("x").getEndLocation().isEmpty());
        assertTrue(new PrimitiveExpression(1).getEndLocation().isEmpty());
        assertTrue(new EmptyStatement().getEndLocation().isEmpty());
    }

    @Test
    void testCompositeNodesDelegateToFirstAndLastChild() {
        // x = 0;
        ExpressionStatement statement = new ExpressionStatement(new AssignmentExpression(
            new IdentifierExpression(new Identifier("x", new TextLocation(3, 5))),
            new PrimitiveExpression(0, "0", new TextLocation(3, 9))));
        statement.addChild(new TokenNode(new TextLocation(3, 10), 1), Roles.SEMICOLON);

        assertEquals(new TextLocation(3, 5), statement.getStartLocation());
        assertEquals(new TextLocation(3, 11), statement.getEndLocation());
        assertEquals(new TextLocation(3, 10), statement.getExpression().getEndLocation());
    }

    @Test
    void testOperatorTokenSitsBetweenOperands() {
        // x = 0
        AssignmentExpression assignment = new AssignmentExpression(
            new IdentifierExpression(new Identifier("x", new TextLocation(3, 5))),
            new PrimitiveExpression(0, "0", new TextLocation(3, 9)));
        assertSame(TokenNode.NULL, assignment.getOperatorToken());

        TokenNode operator = new TokenNode(new TextLocation(3, 7), 1);
        assignment.insertChildAfter(assignment.getLeft(), operator, Roles.ASSIGN);

        assertSame(operator, assignment.getOperatorToken());
        assertEquals(List.of(assignment.getLeft(), operator, assignment.getRight()), NodeTest.children(assignment));
        assertEquals(new TextLocation(3, 10), assignment.getEndLocation());
    }

    @Test
    void testLocationFollowsTreeChanges() {
        // for (...) { }
        ForStatement loop = new ForStatement();
        loop.addChild(new TokenNode(new TextLocation(2, 1), 3), Roles.KEYWORD);
        BlockStatement body = new BlockStatement();
        body.addChild(new TokenNode(new TextLocation(2, 20), 1), Roles.LBRACE);
        body.addChild(new TokenNode(new TextLocation(4, 1), 1), Roles.RBRACE);
        loop.setEmbeddedStatement(body);

        assertEquals(new TextLocation(2, 1), loop.getStartLocation());
        assertEquals(new TextLocation(4, 2), loop.getEndLocation());

        loop.getChildByRole(Roles.KEYWORD).remove();
        assertEquals(new TextLocation(2, 20), loop.getStartLocation());

        body.remove();
        assertTrue(loop.getStartLocation().isEmpty());
        assertTrue(loop.getEndLocation().isEmpty());
    }

    @Test
    void testStatementsAreKeptInsideBraces() {
        BlockStatement block = new BlockStatement();
        TokenNode lbrace = new TokenNode(new TextLocation(1, 1), 1);
        TokenNode rbrace = new TokenNode(new TextLocation(3, 1), 1);
        block.addChild(lbrace, Roles.LBRACE);
        block.addChild(rbrace, Roles.RBRACE);

        EmptyStatement statement = new EmptyStatement(new TextLocation(2, 5));
        block.addStatement(statement);

        assertEquals(List.of(lbrace, statement, rbrace), NodeTest.children(block));
        assertSame(lbrace, block.getLBraceToken());
        assertSame(rbrace, block.getRBraceToken());
        assertEquals(new TextLocation(3, 2), block.getEndLocation());
    }

    @Test
    void testChildlessNodeHasEmptyLocation() {
        assertSame(TextLocation.EMPTY, new BlockStatement().getStartLocation());
        assertSame(TextLocation.EMPTY, new ForStatement().getEndLocation());
    }

    @Test
    void testTextLocationOrdering() {
        TextLocation a = new TextLocation(1, 10);
        TextLocation b = new TextLocation(2, 1);
        TextLocation c = new TextLocation(2, 5);

        assertTrue(a.compareTo(b) < 0);
        assertTrue(c.compareTo(b) > 0);
        assertEquals(0, b.compareTo(new TextLocation(2, 1)));
        assertEquals(new TextLocation(2, 8), c.advance(3));
        assertSame(TextLocation.EMPTY, TextLocation.EMPTY.advance(3));
        assertEquals("(2, 5)", c.toString());
        assertTrue(TextLocation.EMPTY.isEmpty());
        assertFalse(a.isEmpty());
    }

    @Test
    void testNegativeTokenLengthIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TokenNode(new TextLocation(1, 1), -1));
    }
}
