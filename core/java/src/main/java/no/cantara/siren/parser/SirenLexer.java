package no.cantara.siren.parser;

import no.cantara.siren.cst.CommentToken;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits Siren source into tokens, collecting comments on the side.
 */
final class SirenLexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final List<CommentToken> comments = new ArrayList<>();
    private int pos;
    private int row;
    private int column;

    SirenLexer(String source) {
        this.source = source;
    }

    List<Token> tokens() {
        return tokens;
    }

    List<CommentToken> comments() {
        return comments;
    }

    SirenLexer tokenize() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '#' || (c == '/' && peek(1) == '/')) {
                comment();
            } else if (c == '"') {
                string();
            } else if (isDigit(c)) {
                number();
            } else if (isIdentifierStart(c)) {
                identifier();
            } else {
                TokenType punctuation = switch (c) {
                    case '{' -> TokenType.LEFT_BRACE;
                    case '}' -> TokenType.RIGHT_BRACE;
                    case '[' -> TokenType.LEFT_BRACKET;
                    case ']' -> TokenType.RIGHT_BRACKET;
                    case '=' -> TokenType.EQUALS;
                    case ',' -> TokenType.COMMA;
                    default -> TokenType.INVALID;
                };
                int start = pos, startRow = row, startColumn = column;
                advance();
                String text = String.valueOf(c);
                String value = punctuation == TokenType.INVALID ? "Unexpected character '" + c + "'" : text;
                tokens.add(new Token(punctuation, text, value, start, pos, startRow, startColumn, startRow));
            }
        }
        tokens.add(new Token(TokenType.EOF, "", "", pos, pos, row, column, row));
        return this;
    }

    private void comment() {
        int start = pos, startRow = row;
        while (pos < source.length() && source.charAt(pos) != '\n') {
            advance();
        }
        int end = pos;
        if (end > start && source.charAt(end - 1) == '\r') {
            end--;
        }
        comments.add(new CommentToken(source.substring(start, end), start, end, startRow, startRow));
    }

    private void string() {
        int start = pos, startRow = row, startColumn = column;
        advance();
        StringBuilder value = new StringBuilder();
        while (pos < source.length() && source.charAt(pos) != '"') {
            char c = source.charAt(pos);
            if (c == '\\' && pos + 1 < source.length()) {
                char next = source.charAt(pos + 1);
                switch (next) {
                    case '"' -> value.append('"');
                    case '\\' -> value.append('\\');
                    case 'n' -> value.append('\n');
                    case 'r' -> value.append('\r');
                    case 't' -> value.append('\t');
                    default -> value.append(c).append(next);
                }
                advance();
                advance();
            } else {
                value.append(c);
                advance();
            }
        }
        if (pos >= source.length()) {
            tokens.add(new Token(TokenType.INVALID, source.substring(start, pos), "Unterminated string",
                    start, pos, startRow, startColumn, row));
            return;
        }
        advance();
        tokens.add(new Token(TokenType.STRING, source.substring(start, pos), value.toString(),
                start, pos, startRow, startColumn, row));
    }

    private void number() {
        int start = pos, startColumn = column;
        while (pos < source.length() && isDigit(source.charAt(pos))) {
            advance();
        }
        if (peek(0) == '.' && isDigit(peek(1))) {
            advance();
            while (pos < source.length() && isDigit(source.charAt(pos))) {
                advance();
            }
        }
        String text = source.substring(start, pos);
        tokens.add(new Token(TokenType.NUMBER, text, text, start, pos, row, startColumn, row));
    }

    private void identifier() {
        int start = pos, startColumn = column;
        while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
            advance();
        }
        String text = source.substring(start, pos);
        tokens.add(new Token(TokenType.IDENTIFIER, text, text, start, pos, row, startColumn, row));
    }

    private char peek(int ahead) {
        int i = pos + ahead;
        return i < source.length() ? source.charAt(i) : '\0';
    }

    private void advance() {
        if (source.charAt(pos) == '\n') {
            row++;
            column = 0;
        } else {
            column++;
        }
        pos++;
    }

    static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c) || c == '-';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
