package com.postfixspin.text;

public enum Delimiter {
    PARENTHESIS('(', ')'),
    BRACE('{', '}'),
    BRACKET('[', ']'),
    NONE('\0', '\0');

    private final char open;
    private final char close;

    Delimiter(char open, char close) {
        this.open = open;
        this.close = close;
    }

    public char open() {
        return open;
    }

    public char close() {
        return close;
    }

    /**
     * 按左分隔符查找类型，不是左分隔符时返回 null。
     */
    public static Delimiter forOpen(char ch) {
        for (Delimiter delimiter : values()) {
            if (delimiter != NONE && delimiter.open == ch) {
                return delimiter;
            }
        }
        return null;
    }

    /**
     * 按右分隔符查找类型，不是右分隔符时返回 null。
     */
    public static Delimiter forClose(char ch) {
        for (Delimiter delimiter : values()) {
            if (delimiter != NONE && delimiter.close == ch) {
                return delimiter;
            }
        }
        return null;
    }
}
