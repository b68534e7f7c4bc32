package com.csparser.dom;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Test utility that renders the structure of a tree as JSON so it can be
 * compared with the fixtures under {@code src/test/resources/fixtures}.
 * Only type names, roles and leaf text are rendered; locations are left out.
 */
public class TreeShape {

    private static ObjectMapper instance;

    public static synchronized ObjectMapper mapper() {
        if (instance == null) {
            instance = new ObjectMapper();
        }
        return instance;
    }

    public static ObjectNode of(Node node) {
        ObjectNode json = mapper().createObjectNode();
        json.put("type", node.getClass().getSimpleName());
        if (node.getRole() != null) {
            json.put("role", node.getRole().getName());
        }

        if (node instanceof Identifier id) {
            json.put("name", id.getName());
        } else if (node instanceof PrimitiveExpression primitive) {
            json.put("value", primitive.getLiteralValue());
        } else if (node instanceof AssignmentExpression assignment) {
            json.put("operator", assignment.getOperator().getToken());
        } else if (node instanceof BinaryOperatorExpression binary) {
            json.put("operator", binary.getOperator().getToken());
        } else if (node instanceof UnaryOperatorExpression unary) {
            json.put("operator", unary.getOperator().getToken());
        }

        if (node.hasChildren()) {
            ArrayNode children = json.putArray("children");
            for (Node child : node.getChildren()) {
                children.add(of(child));
            }
        }
        return json;
    }

    public static JsonNode fixture(String name) throws IOException {
        try (InputStream in = TreeShape.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new FileNotFoundException("No fixture " + name + " on the test classpath");
            }
            return mapper().readTree(in);
        }
    }
}
