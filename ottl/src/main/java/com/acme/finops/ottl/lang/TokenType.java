package com.acme.finops.ottl.lang;

public enum TokenType {
    BYTES,
    FLOAT,
    INT,
    STRING,
    IDENT,
    COMPARISON,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    EQUAL,
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,
    COLON,
    COMMA,
    DOT,
    EOF
}
