package com.postfixspin.text;

/**
 * 源码中的字符位置：offset 从 0 开始，行列从 1 开始。
 */
public record Position(int offset, int line, int column) {

    public static final Position START = new Position(0, 1, 1);

    /**
     * 截取该位置所在的源码行，并在下一行用 ^ 指向所在列。
     */
    public String pointer(String source) {
        if (source == null || source.isEmpty()) {
            return "";
        }
        int safeOffset = Math.max(0, Math.min(offset, source.length()));
        int lineStart = source.lastIndexOf('\n', safeOffset - 1) + 1;
        int lineEnd = source.indexOf('\n', safeOffset);
        if (lineEnd < 0) {
            lineEnd = source.length();
        }
        String sourceLine = source.substring(lineStart, lineEnd).replace("\r", "");
        String caret = " ".repeat(Math.max(0, safeOffset - lineStart)) + "^";
        return sourceLine + System.lineSeparator() + caret;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
