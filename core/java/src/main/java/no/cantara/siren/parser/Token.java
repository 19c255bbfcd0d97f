package no.cantara.siren.parser;

/**
 * A lexical token. For {@link TokenType#STRING} {@code value} is the unescaped
 * content; for {@link TokenType#INVALID} it is the lexer's error message.
 */
record Token(
        TokenType type,
        String text,
        String value,
        int start,
        int end,
        int row,
        int column,
        int endRow
) {
    boolean isKeyword(String keyword) {
        return type == TokenType.IDENTIFIER && text.equals(keyword);
    }

    String describe() {
        return type == TokenType.EOF ? "end of input" : "'" + text + "'";
    }
}
