package com.csparser.dom;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TreeVerifierTest {

    private static final Role<Expression> LITERAL_ONLY = new Role<>("Literal", Expression.class, Expression.NULL) {
        @Override
        public boolean isValid(Node node) {
            return node instanceof PrimitiveExpression;
        }
    };

    @Test
    void testTreeBuiltThroughMutatorsIsConsistent() {
        BlockStatement block = new BlockStatement();
        EmptyStatement a = new EmptyStatement();
        EmptyStatement b = new EmptyStatement();
        block.addStatement(a);
        block.insertChildBefore(a, b, BlockStatement.STATEMENT_ROLE);
        ForStatement loop = new ForStatement();
        loop.setCondition(new PrimitiveExpression(true));
        block.insertChildAfter(b, loop, BlockStatement.STATEMENT_ROLE);
        loop.getCondition().replaceWith(new IdentifierExpression("ready"));
        a.remove();

        TreeVerifier verifier = new TreeVerifier(true, true);
        assertEquals(List.of(), verifier.verify(block));
        verifier.verifyOrThrow(block);
    }

    @Test
    void testAddChildDoesNotCheckRoleValidity() {
        ExpressionStatement statement = new ExpressionStatement();
        IdentifierExpression identifier = new IdentifierExpression("x");

        statement.addChild(identifier, LITERAL_ONLY);

        assertSame(identifier, statement.getChildByRole(LITERAL_ONLY));
        assertEquals(List.of(), new TreeVerifier().verify(statement));

        List<String> violations = new TreeVerifier(true, false).verify(statement);
        assertEquals(1, violations.size());
        assertTrue(violations.get(0).contains("not valid in the role Literal"), violations.get(0));
    }

    @Test
    void testFailFastThrowsOnFirstViolation() {
        ExpressionStatement statement = new ExpressionStatement();
        statement.addChild(new IdentifierExpression("x"), LITERAL_ONLY);

        assertThrows(CorruptTreeException.class, () -> new TreeVerifier(true, true).verify(statement));
    }

    @Test
    void testVerifyOrThrowReportsAllViolations() {
        ExpressionStatement statement = new ExpressionStatement();
        statement.addChild(new IdentifierExpression("x"), LITERAL_ONLY);
        statement.addChild(new IdentifierExpression("y"), LITERAL_ONLY);

        CorruptTreeException e = assertThrows(CorruptTreeException.class,
            () -> new TreeVerifier(true, false).verifyOrThrow(statement));
        assertTrue(e.getMessage().startsWith("2 violation(s)"), e.getMessage());
    }

    @Test
    void testVerifyingNullObject() {
        assertEquals(List.of(), new TreeVerifier(true, true).verify(Node.NULL));
    }

    @Test
    void testVerifyRequiresRoot() {
        assertThrows(NullPointerException.class, () -> new TreeVerifier().verify(null));
    }
}
