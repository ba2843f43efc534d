package com.postfixspin.rewrite;

import com.postfixspin.config.Constants;
import com.postfixspin.text.Delimiter;
import com.postfixspin.text.Token;
import com.postfixspin.text.TokenGroup;
import com.postfixspin.text.TokenTree;

import java.util.List;
import java.util.Optional;

/**
 * 在单层兄弟序列中查找后缀标记，不进入子分组。
 */
public class MarkerScanner {

    /**
     * 从 fromIndex 开始返回本层第一个标记出现。
     */
    public Optional<Occurrence> next(List<TokenTree> siblings, int fromIndex) {
        for (int index = Math.max(0, fromIndex); index < siblings.size(); index++) {
            if (isMarker(siblings, index)) {
                return Optional.of(new Occurrence(index, (Token) siblings.get(index)));
            }
        }
        return Optional.empty();
    }

    /**
     * 统计整棵树中所有层级的标记数量。
     */
    public int countAll(TokenGroup group) {
        int count = 0;
        List<TokenTree> children = group.children();
        for (int index = 0; index < children.size(); index++) {
            if (isMarker(children, index)) {
                count++;
            }
            if (children.get(index) instanceof TokenGroup nested) {
                count += countAll(nested);
            }
        }
        return count;
    }

    /**
     * {@code ::} 后跟括号或方括号分组、或位于序列末尾时视为标记；
     * 后跟花括号（use a::{b, c}）或普通记号（路径、turbofish）时不是标记。
     */
    private boolean isMarker(List<TokenTree> siblings, int index) {
        if (!(siblings.get(index) instanceof Token token) || !token.isPunct(Constants.MARKER)) {
            return false;
        }
        if (index + 1 >= siblings.size()) {
            return true;
        }
        return siblings.get(index + 1) instanceof TokenGroup group && !group.is(Delimiter.BRACE);
    }
}
