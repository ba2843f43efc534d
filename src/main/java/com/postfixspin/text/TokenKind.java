package com.postfixspin.text;

public enum TokenKind {
    IDENT,
    LIFETIME,
    LITERAL,
    PUNCT
}
