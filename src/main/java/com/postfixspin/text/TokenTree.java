package com.postfixspin.text;

/**
 * 记号树节点：原子记号或由分隔符包围的记号分组。
 */
public sealed interface TokenTree permits Token, TokenGroup {

    /**
     * 节点在源码中的起始位置。
     */
    Position position();
}
