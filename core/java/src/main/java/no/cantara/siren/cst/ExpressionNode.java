package no.cantara.siren.cst;

import java.util.List;

/**
 * Right-hand side of an attribute.
 */
public sealed interface ExpressionNode {

    Origin origin();

    enum LiteralType { STRING, NUMBER, BOOLEAN, NULL }

    /**
     * @param text  literal as written, quotes and escapes included
     * @param value unescaped string content, or the token text for other literal types
     */
    record LiteralNode(LiteralType literalType, String text, String value, Origin origin) implements ExpressionNode {
    }

    record ReferenceNode(IdentifierNode identifier, Origin origin) implements ExpressionNode {
    }

    record ArrayNode(List<ExpressionNode> elements, Origin origin) implements ExpressionNode {
        public ArrayNode {
            elements = elements != null ? List.copyOf(elements) : List.of();
        }
    }
}
