package com.postfixspin.rewrite;

import com.postfixspin.text.Delimiter;
import com.postfixspin.text.TokenGroup;
import com.postfixspin.text.TokenTree;

import java.util.ArrayList;
import java.util.List;

/**
 * 按目标构造的前缀语法拼装替换记号：关键字与绑定、操作数、构造体。
 */
public class ConstructSynthesizer {
    private final boolean wrapCompoundOperands;

    public ConstructSynthesizer(boolean wrapCompoundOperands) {
        this.wrapCompoundOperands = wrapCompoundOperands;
    }

    /**
     * 生成替换序列。多记号操作数包裹一层圆括号以保持优先级，代码块类构造的操作数原样放置。
     */
    public List<TokenTree> synthesize(Occurrence occurrence, List<TokenTree> operand, ConstructKind kind, List<TokenTree> body) {
        List<TokenTree> replacement = new ArrayList<>(kind.prefix());
        if (needsParentheses(operand, kind)) {
            replacement.add(new TokenGroup(Delimiter.PARENTHESIS, operand, occurrence.marker().position()));
        } else {
            replacement.addAll(operand);
        }
        replacement.addAll(body);
        return replacement;
    }

    private boolean needsParentheses(List<TokenTree> operand, ConstructKind kind) {
        return wrapCompoundOperands
                && operand.size() > 1
                && kind.form() != ConstructKind.Form.BLOCK_OPERAND;
    }
}
