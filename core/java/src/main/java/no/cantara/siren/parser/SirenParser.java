package no.cantara.siren.parser;

import no.cantara.siren.cst.AttributeNode;
import no.cantara.siren.cst.DocumentNode;
import no.cantara.siren.cst.ExpressionNode;
import no.cantara.siren.cst.ExpressionNode.ArrayNode;
import no.cantara.siren.cst.ExpressionNode.LiteralNode;
import no.cantara.siren.cst.ExpressionNode.LiteralType;
import no.cantara.siren.cst.ExpressionNode.ReferenceNode;
import no.cantara.siren.cst.IdentifierNode;
import no.cantara.siren.cst.Origin;
import no.cantara.siren.cst.ResourceNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recursive-descent parser for the Siren language.
 * <p>
 * Grammar:
 * <pre>
 * document   := resource*
 * resource   := ("task" | "milestone") identifier "complete"* "{" attribute* "}"
 * identifier := bare | quoted
 * attribute  := bare "=" expression
 * expression := string | number | "true" | "false" | "null" | reference | array
 * array      := "[" (expression ("," expression)* ","?)? "]"
 * </pre>
 * A syntax error drops the resource it occurs in; parsing resumes at the next
 * {@code task} or {@code milestone} keyword that starts a line. The parser holds no
 * state between calls.
 */
public class SirenParser implements SirenParserAdapter {

    static final String TASK = "task";
    static final String MILESTONE = "milestone";
    static final String COMPLETE = "complete";

    @Override
    public ParseResult parse(String source, String document) {
        Objects.requireNonNull(source, "source");
        SirenLexer lexer = new SirenLexer(source).tokenize();
        Session session = new Session(lexer.tokens(), document);
        DocumentNode tree = session.document(source.length());
        return new ParseResult(tree, session.errors, lexer.comments(), source);
    }

    private static final class SyntaxException extends RuntimeException {
        SyntaxException() {
            super(null, null, false, false);
        }
    }

    private static final class Session {
        private final List<Token> tokens;
        private final String document;
        private final List<ParseError> errors = new ArrayList<>();
        private int pos;

        Session(List<Token> tokens, String document) {
            this.tokens = tokens;
            this.document = document;
        }

        DocumentNode document(int length) {
            List<ResourceNode> resources = new ArrayList<>();
            while (current().type() != TokenType.EOF) {
                Token token = current();
                if (token.isKeyword(TASK) || token.isKeyword(MILESTONE)) {
                    try {
                        resources.add(resource());
                    } catch (SyntaxException e) {
                        recover();
                    }
                } else {
                    fail(token, "Expected 'task' or 'milestone' but found " + token.describe());
                    pos++;
                    recover();
                }
            }
            Token eof = current();
            return new DocumentNode(resources, document, new Origin(0, length, 0, eof.row(), 0, document));
        }

        private ResourceNode resource() {
            Token keyword = next();
            IdentifierNode identifier = identifier();
            int completeCount = 0;
            while (current().isKeyword(COMPLETE)) {
                next();
                completeCount++;
            }
            expect(TokenType.LEFT_BRACE, "Expected '{' but found ");
            List<AttributeNode> body = new ArrayList<>();
            while (current().type() != TokenType.RIGHT_BRACE) {
                Token token = current();
                if (startsLine(pos) && (token.isKeyword(TASK) || token.isKeyword(MILESTONE))) {
                    throw fail(token, "Missing '}' for " + keyword.text() + " '" + identifier.value() + "'");
                }
                body.add(attribute());
            }
            Token close = next();
            return new ResourceNode(keyword.text(), identifier, body, completeCount, span(keyword, close));
        }

        private IdentifierNode identifier() {
            Token token = current();
            if (token.type() == TokenType.IDENTIFIER) {
                next();
                return new IdentifierNode(token.text(), token.value(), false, span(token, token));
            }
            if (token.type() == TokenType.STRING) {
                next();
                return new IdentifierNode(token.text(), token.value(), true, span(token, token));
            }
            throw fail(token, "Expected resource identifier but found " + token.describe());
        }

        private AttributeNode attribute() {
            Token keyToken = current();
            if (keyToken.type() != TokenType.IDENTIFIER) {
                throw fail(keyToken, "Expected attribute name or '}' but found " + keyToken.describe());
            }
            next();
            IdentifierNode key = new IdentifierNode(keyToken.text(), keyToken.value(), false, span(keyToken, keyToken));
            expect(TokenType.EQUALS, "Expected '=' after attribute '" + key.value() + "' but found ");
            ExpressionNode value = expression();
            Origin origin = value.origin();
            return new AttributeNode(key, value, new Origin(keyToken.start(), origin.endOffset(),
                    keyToken.row(), origin.endRow(), keyToken.column(), document));
        }

        private ExpressionNode expression() {
            Token token = current();
            switch (token.type()) {
                case STRING:
                    next();
                    return new LiteralNode(LiteralType.STRING, token.text(), token.value(), span(token, token));
                case NUMBER:
                    next();
                    return new LiteralNode(LiteralType.NUMBER, token.text(), token.value(), span(token, token));
                case IDENTIFIER:
                    next();
                    switch (token.text()) {
                        case "true":
                        case "false":
                            return new LiteralNode(LiteralType.BOOLEAN, token.text(), token.text(), span(token, token));
                        case "null":
                            return new LiteralNode(LiteralType.NULL, token.text(), token.text(), span(token, token));
                        default:
                            IdentifierNode identifier = new IdentifierNode(token.text(), token.value(), false, span(token, token));
                            return new ReferenceNode(identifier, identifier.origin());
                    }
                case LEFT_BRACKET:
                    return array();
                default:
                    throw fail(token, "Expected value but found " + token.describe());
            }
        }

        private ArrayNode array() {
            Token open = next();
            List<ExpressionNode> elements = new ArrayList<>();
            while (current().type() != TokenType.RIGHT_BRACKET) {
                elements.add(expression());
                if (current().type() == TokenType.COMMA) {
                    next();
                } else if (current().type() != TokenType.RIGHT_BRACKET) {
                    throw fail(current(), "Expected ',' or ']' but found " + current().describe());
                }
            }
            Token close = next();
            return new ArrayNode(elements, span(open, close));
        }

        private void recover() {
            while (current().type() != TokenType.EOF
                    && !(startsLine(pos) && (current().isKeyword(TASK) || current().isKeyword(MILESTONE)))) {
                pos++;
            }
        }

        private boolean startsLine(int index) {
            return index == 0 || tokens.get(index - 1).endRow() < tokens.get(index).row();
        }

        private Token expect(TokenType type, String message) {
            Token token = current();
            if (token.type() != type) {
                throw fail(token, message + token.describe());
            }
            return next();
        }

        private SyntaxException fail(Token token, String message) {
            error(token, token.type() == TokenType.INVALID ? token.value() : message);
            return new SyntaxException();
        }

        private void error(Token token, String message) {
            errors.add(new ParseError(message, token.row() + 1, token.column() + 1, token.text(), document));
        }

        private Token current() {
            return tokens.get(pos);
        }

        private Token next() {
            Token token = tokens.get(pos);
            if (token.type() != TokenType.EOF) {
                pos++;
            }
            return token;
        }

        private Origin span(Token first, Token last) {
            return new Origin(first.start(), last.end(), first.row(), last.endRow(), first.column(), document);
        }
    }
}
