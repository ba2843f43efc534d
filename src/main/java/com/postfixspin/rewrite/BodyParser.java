package com.postfixspin.rewrite;

import com.postfixspin.text.Delimiter;
import com.postfixspin.text.Token;
import com.postfixspin.text.TokenGroup;
import com.postfixspin.text.TokenTree;

import java.util.ArrayList;
import java.util.List;

/**
 * 读取构造头之后的花括号构造体，内容原样保留，嵌套标记由驱动器递归处理。
 */
public class BodyParser {

    /**
     * 读取从 bodyIndex 开始的构造体；if 构造同时吸收紧随其后的 else / else if 分支链。
     */
    public Body parse(List<TokenTree> siblings, int bodyIndex, ConstructKind kind, TokenGroup head) {
        List<TokenTree> trees = new ArrayList<>();
        int cursor = expectBlock(siblings, bodyIndex, head, trees);
        if (!kind.acceptsElse()) {
            return new Body(trees, cursor);
        }

        while (cursor < siblings.size() && Token.matches(siblings.get(cursor), "else")) {
            Token elseToken = (Token) siblings.get(cursor);
            trees.add(elseToken);
            cursor++;
            if (cursor < siblings.size() && isBlock(siblings.get(cursor))) {
                trees.add(siblings.get(cursor));
                return new Body(trees, cursor + 1);
            }
            if (cursor >= siblings.size() || !Token.matches(siblings.get(cursor), "if")) {
                throw new SpinRewriteException(ErrorKind.EXPECTED_BODY,
                        "else 后必须是代码块或 if", elseToken.position());
            }
            // else if 的条件原样保留，直到下一个花括号分组
            while (cursor < siblings.size() && !isBlock(siblings.get(cursor))) {
                trees.add(siblings.get(cursor));
                cursor++;
            }
            cursor = expectBlock(siblings, cursor, elseToken, trees);
        }
        return new Body(trees, cursor);
    }

    /**
     * 断言指定位置为花括号分组并追加，返回其后的下标。
     */
    private int expectBlock(List<TokenTree> siblings, int index, TokenTree anchor, List<TokenTree> trees) {
        if (index >= siblings.size()) {
            throw new SpinRewriteException(ErrorKind.EXPECTED_BODY,
                    "缺少花括号构造体", anchor.position());
        }
        TokenTree candidate = siblings.get(index);
        if (!isBlock(candidate)) {
            throw new SpinRewriteException(ErrorKind.EXPECTED_BODY,
                    "构造体必须是花括号代码块", candidate.position());
        }
        trees.add(candidate);
        return index + 1;
    }

    private boolean isBlock(TokenTree tree) {
        return tree instanceof TokenGroup group && group.is(Delimiter.BRACE);
    }

    /**
     * 构造体记号（含 else 分支链）及其在兄弟序列中的结束下标（不含）。
     */
    public record Body(List<TokenTree> trees, int endIndex) {
        public Body {
            trees = List.copyOf(trees);
        }

        public static Body none(int endIndex) {
            return new Body(List.of(), endIndex);
        }
    }
}
