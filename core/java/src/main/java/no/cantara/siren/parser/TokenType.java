package no.cantara.siren.parser;

enum TokenType {
    IDENTIFIER,
    STRING,
    NUMBER,
    LEFT_BRACE,
    RIGHT_BRACE,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    EQUALS,
    COMMA,
    INVALID,
    EOF
}
