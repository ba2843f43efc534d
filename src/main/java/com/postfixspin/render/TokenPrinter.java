package com.postfixspin.render;

import com.postfixspin.text.Delimiter;
import com.postfixspin.text.Token;
import com.postfixspin.text.TokenGroup;
import com.postfixspin.text.TokenKind;
import com.postfixspin.text.TokenTree;

import java.util.List;
import java.util.Set;

/**
 * 将记号树还原为单行源码文本，供宿主替换调用处。
 *
 * <p>只保证输出可被重新词法分析为同一棵记号树，不保留原始排版。
 */
public class TokenPrinter {
    private static final Set<String> NO_SPACE_BEFORE = Set.of(",", ";", ".", "?", ":", "::");
    private static final Set<String> NO_SPACE_AFTER = Set.of(".", "::", "#");
    private static final Set<String> KEYWORDS = Set.of(
            "as", "async", "await", "box", "break", "const", "continue", "crate", "dyn", "else", "enum",
            "extern", "fn", "for", "if", "impl", "in", "let", "loop", "match", "mod", "move", "mut", "pub",
            "ref", "return", "static", "struct", "trait", "try", "type", "unsafe", "use", "where", "while",
            "yield");

    /**
     * 打印分组内容；根分组（NONE）不输出分隔符。
     */
    public String print(TokenGroup group) {
        StringBuilder builder = new StringBuilder();
        if (group.is(Delimiter.NONE)) {
            appendChildren(builder, group.children());
        } else {
            appendGroup(builder, group);
        }
        return builder.toString();
    }

    private void appendChildren(StringBuilder builder, List<TokenTree> children) {
        TokenTree previous = null;
        for (TokenTree child : children) {
            if (previous != null && needsSpace(previous, child)) {
                builder.append(' ');
            }
            if (child instanceof Token token) {
                builder.append(token.text());
            } else {
                appendGroup(builder, (TokenGroup) child);
            }
            previous = child;
        }
    }

    /**
     * 非空花括号内侧留空格，圆括号与方括号紧贴内容。
     */
    private void appendGroup(StringBuilder builder, TokenGroup group) {
        boolean padded = group.is(Delimiter.BRACE) && !group.isEmpty();
        builder.append(group.delimiter().open());
        if (padded) {
            builder.append(' ');
        }
        appendChildren(builder, group.children());
        if (padded) {
            builder.append(' ');
        }
        builder.append(group.delimiter().close());
    }

    /**
     * 判断相邻节点之间是否需要空格。
     */
    private boolean needsSpace(TokenTree previous, TokenTree next) {
        if (isPunct(previous) && isPunct(next)) {
            // 相邻运算符紧贴会被重新识别为更长的运算符
            return true;
        }
        if (next instanceof Token nextToken && nextToken.kind() == TokenKind.PUNCT
                && NO_SPACE_BEFORE.contains(nextToken.text())) {
            return false;
        }
        if (previous instanceof Token previousToken && previousToken.kind() == TokenKind.PUNCT
                && NO_SPACE_AFTER.contains(previousToken.text())) {
            return false;
        }
        if (next instanceof Token nextToken && nextToken.isPunct("!") && isPlainIdent(previous)) {
            // 宏调用 name!
            return false;
        }
        if (next instanceof TokenGroup nextGroup && !nextGroup.is(Delimiter.BRACE)) {
            return !isCallee(previous);
        }
        return true;
    }

    /**
     * 圆括号或方括号紧跟在被调用者之后：非关键字标识符、宏的 !、或另一个圆括号/方括号分组。
     */
    private boolean isCallee(TokenTree previous) {
        if (previous instanceof TokenGroup previousGroup) {
            return !previousGroup.is(Delimiter.BRACE);
        }
        Token previousToken = (Token) previous;
        return isPlainIdent(previousToken) || previousToken.isPunct("!");
    }

    private boolean isPunct(TokenTree tree) {
        return tree instanceof Token token && token.kind() == TokenKind.PUNCT;
    }

    private boolean isPlainIdent(TokenTree tree) {
        return tree instanceof Token token && token.kind() == TokenKind.IDENT && !KEYWORDS.contains(token.text());
    }
}
