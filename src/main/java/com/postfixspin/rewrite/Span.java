package com.postfixspin.rewrite;

/**
 * 兄弟序列中的半开区间 [start, end)。
 */
record Span(int start, int end) {

    static final Span NONE = new Span(0, 0);

    boolean contains(int index) {
        return index >= start && index < end;
    }
}
