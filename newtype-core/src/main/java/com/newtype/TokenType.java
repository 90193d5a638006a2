package com.newtype;

public enum TokenType {
    // Literals
    IDENTIFIER,
    INTEGER,
    DOUBLE,
    STRING,
    TRUE,
    FALSE,

    // Reserved words
    FROM,
    IF,
    ELSE,
    THEN,
    WHILE,
    FOR,
    GOTO,
    REQUIRE,
    IMPORT,
    AS,
    DO,
    YIELD,
    AWAIT,
    ASYNC,
    READONLY,

    // Punctuation
    LPAREN,         // (
    RPAREN,         // )
    LBRACKET,       // [
    RBRACKET,       // ]
    LBRACE,         // {
    RBRACE,         // }
    COMMA,          // ,
    COLON,          // :
    ASSIGN,         // =
    PIPE,           // |
    AMPERSAND,      // &
    QUESTION,       // ?
    MINUS,          // -
    STAR,           // *
    ARROW,          // ->

    // Comparison operators of conditionals
    EXTENDS_LEFT,   // <:
    EXTENDS_RIGHT,  // :>
    EQ,             // ==
    NOT_EQ,         // !=

    EOF
}
