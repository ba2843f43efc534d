package com.postfixspin.rewrite;

import com.postfixspin.text.Delimiter;
import com.postfixspin.text.Token;
import com.postfixspin.text.TokenGroup;
import com.postfixspin.text.TokenKind;
import com.postfixspin.text.TokenTree;

import java.util.List;
import java.util.Set;

/**
 * 从标记位置向前确定操作数的起点。分组整体视为一个原子。
 */
public class OperandExtractor {
    private static final String STATEMENT_TERMINATOR = ";";
    private static final Set<String> BINDING_PUNCTS = Set.of(
            "=", "+=", "-=", "*=", "/=", "%=", "^=", "&=", "|=", "<<=", ">>=", "=>", ",");
    private static final Set<String> SUFFIX_PUNCTS = Set.of(".", "?");
    private static final Set<String> OPERAND_KEYWORDS = Set.of(
            "return", "break", "yield", "in", "if", "while", "match", "let");

    /**
     * 返回操作数起始下标，操作数区间为 [start, markerIndex)。
     *
     * @param previous 本层本轮上一次改写产生的替换区间：紧邻标记或其后紧跟后缀（{@code .}、{@code ?}、调用、索引）时
     *                 整体并入操作数，否则其末尾即边界，末尾之后的二元运算符不属于操作数
     */
    int extract(List<TokenTree> siblings, Occurrence occurrence, Span previous) {
        int markerIndex = occurrence.markerIndex();
        int start = 0;
        for (int index = markerIndex - 1; index >= 0; index--) {
            if (previous.contains(index)) {
                start = afterReplacement(siblings, previous, markerIndex);
                break;
            }
            if (isBoundary(siblings, index, markerIndex)) {
                start = index + 1;
                break;
            }
        }
        if (start >= markerIndex) {
            throw new SpinRewriteException(ErrorKind.MALFORMED_OPERAND, "标记前缺少操作数", occurrence.marker().position());
        }
        return start;
    }

    private int afterReplacement(List<TokenTree> siblings, Span previous, int markerIndex) {
        if (previous.end() >= markerIndex) {
            return previous.start();
        }
        TokenTree gapHead = siblings.get(previous.end());
        if (isSuffix(gapHead)) {
            return previous.start();
        }
        if (gapHead instanceof Token token && token.kind() == TokenKind.PUNCT) {
            return previous.end() + 1;
        }
        return previous.end();
    }

    private boolean isSuffix(TokenTree tree) {
        if (tree instanceof TokenGroup group) {
            return !group.is(Delimiter.BRACE);
        }
        Token token = (Token) tree;
        return token.kind() == TokenKind.PUNCT && SUFFIX_PUNCTS.contains(token.text());
    }

    /**
     * 校验操作数是否满足构造要求：代码块类构造要求操作数恰为一个花括号分组。
     */
    void requireForm(List<TokenTree> operand, ConstructKind kind, Occurrence occurrence) {
        if (kind.form() != ConstructKind.Form.BLOCK_OPERAND) {
            return;
        }
        boolean singleBlock = operand.size() == 1
                && operand.get(0) instanceof TokenGroup group
                && group.is(Delimiter.BRACE);
        if (!singleBlock) {
            throw new SpinRewriteException(ErrorKind.MALFORMED_OPERAND,
                    kind.displayName() + " 要求操作数为花括号代码块", operand.get(0).position());
        }
    }

    /**
     * 语句结束符、赋值与绑定引入符、引入操作数位置的关键字都终止向前扫描。
     * 花括号分组后紧跟标识符、字面量或生命周期时，分组结束了上一条语句。
     */
    private boolean isBoundary(List<TokenTree> siblings, int index, int markerIndex) {
        TokenTree tree = siblings.get(index);
        if (tree instanceof TokenGroup group) {
            return group.is(Delimiter.BRACE) && index + 1 < markerIndex && startsStatement(siblings.get(index + 1));
        }
        Token token = (Token) tree;
        if (token.kind() == TokenKind.PUNCT) {
            return token.text().equals(STATEMENT_TERMINATOR) || BINDING_PUNCTS.contains(token.text());
        }
        return token.kind() == TokenKind.IDENT && OPERAND_KEYWORDS.contains(token.text());
    }

    private boolean startsStatement(TokenTree tree) {
        if (!(tree instanceof Token token)) {
            return false;
        }
        return switch (token.kind()) {
            case IDENT -> !token.text().equals("else");
            case LITERAL, LIFETIME -> true;
            default -> false;
        };
    }
}
