package com.postfixspin.text;

public record Token(TokenKind kind, String text, Position position) implements TokenTree {

    public boolean isPunct(String value) {
        return kind == TokenKind.PUNCT && text.equals(value);
    }

    public boolean isIdent(String value) {
        return kind == TokenKind.IDENT && text.equals(value);
    }

    /**
     * 判断任意节点是否为指定文本的记号。
     */
    public static boolean matches(TokenTree tree, String value) {
        return tree instanceof Token token && token.text().equals(value);
    }

    @Override
    public String toString() {
        return text;
    }
}
