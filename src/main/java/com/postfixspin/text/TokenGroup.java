package com.postfixspin.text;

import java.util.List;

/**
 * 由分隔符包围的有序子节点序列；根节点使用 {@link Delimiter#NONE}。
 *
 * @param delimiter 分隔符类型
 * @param children  子节点，构造时复制为不可变列表
 * @param position  左分隔符位置
 */
public record TokenGroup(Delimiter delimiter, List<TokenTree> children, Position position) implements TokenTree {

    public TokenGroup {
        children = List.copyOf(children);
    }

    public static TokenGroup root(List<TokenTree> children) {
        return new TokenGroup(Delimiter.NONE, children, Position.START);
    }

    public boolean is(Delimiter expected) {
        return delimiter == expected;
    }

    public int size() {
        return children.size();
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }
}
