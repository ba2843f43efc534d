package com.postfixspin.rewrite;

import com.postfixspin.text.Delimiter;
import com.postfixspin.text.Token;
import com.postfixspin.text.TokenGroup;
import com.postfixspin.text.TokenKind;
import com.postfixspin.text.TokenTree;

import java.util.List;

/**
 * 解析标记后的括号构造头，归类为 {@link ConstructKind} 并提取绑定记号。
 */
public class ConstructHeadParser {

    /**
     * 解析紧跟标记的构造头分组。
     */
    public ConstructKind parse(List<TokenTree> siblings, Occurrence occurrence) {
        if (occurrence.headIndex() >= siblings.size()) {
            throw new SpinRewriteException(ErrorKind.EXPECTED_HEAD_GROUP,
                    "标记后缺少括号构造头", occurrence.marker().position());
        }
        TokenTree next = siblings.get(occurrence.headIndex());
        if (!(next instanceof TokenGroup head) || !head.is(Delimiter.PARENTHESIS)) {
            throw new SpinRewriteException(ErrorKind.EXPECTED_HEAD_GROUP,
                    "构造头必须使用圆括号", next.position());
        }
        return parseHead(head);
    }

    /**
     * 解析构造头内容：可选标签，然后是构造关键字及其绑定。
     */
    private ConstructKind parseHead(TokenGroup head) {
        Cursor cursor = new Cursor(head);
        if (cursor.atEnd()) {
            throw new SpinRewriteException(ErrorKind.MALFORMED_HEAD, "构造头为空", head.position());
        }

        if (cursor.currentIsKind(TokenKind.LIFETIME)) {
            ConstructKind.Label label = parseLabel(cursor);
            return parseLabeled(cursor, label);
        }

        Token keyword = cursor.keyword();
        ConstructKind kind = switch (keyword.text()) {
            case "match" -> new ConstructKind.Match(keyword);
            case "if" -> parseIf(cursor, keyword);
            case "while" -> parseWhile(cursor, null, keyword);
            case "for" -> parseFor(cursor, null, keyword);
            case "loop" -> new ConstructKind.Loop(null, keyword);
            case "unsafe" -> new ConstructKind.Unsafe(keyword);
            case "async" -> new ConstructKind.Async(keyword, cursor.matchIdent("move"));
            case "try" -> new ConstructKind.TryBlock(keyword);
            case "box" -> new ConstructKind.Box(keyword);
            case "*", "!", "-" -> new ConstructKind.Unary(keyword);
            case "&", "&&" -> new ConstructKind.Reference(keyword, cursor.matchIdent("mut"));
            case "let" -> parseLet(cursor, keyword);
            case "break" -> new ConstructKind.Break(keyword, cursor.matchKind(TokenKind.LIFETIME));
            case "return" -> new ConstructKind.Return(keyword);
            case "yield" -> new ConstructKind.Yield(keyword);
            default -> throw new SpinRewriteException(ErrorKind.UNKNOWN_CONSTRUCT,
                    "未知构造关键字: " + keyword.text(), keyword.position());
        };
        cursor.expectEnd(kind);
        return kind;
    }

    /**
     * 解析 {@code 'label:}，生命周期后必须紧跟冒号。
     */
    private ConstructKind.Label parseLabel(Cursor cursor) {
        Token lifetime = cursor.advanceToken();
        Token colon = cursor.matchPunct(":");
        if (colon == null) {
            throw new SpinRewriteException(ErrorKind.MALFORMED_HEAD,
                    "标签 " + lifetime.text() + " 后缺少冒号", lifetime.position());
        }
        return new ConstructKind.Label(lifetime, colon);
    }

    /**
     * 标签之后只允许 while、for、loop 或留空（带标签代码块）。
     */
    private ConstructKind parseLabeled(Cursor cursor, ConstructKind.Label label) {
        if (cursor.atEnd()) {
            return new ConstructKind.LabeledBlock(label);
        }
        Token keyword = cursor.keyword();
        ConstructKind kind = switch (keyword.text()) {
            case "while" -> parseWhile(cursor, label, keyword);
            case "for" -> parseFor(cursor, label, keyword);
            case "loop" -> new ConstructKind.Loop(label, keyword);
            default -> throw new SpinRewriteException(ErrorKind.UNKNOWN_CONSTRUCT,
                    "标签后只能是 loop、while、for 或代码块: " + keyword.text(), keyword.position());
        };
        cursor.expectEnd(kind);
        return kind;
    }

    private ConstructKind parseIf(Cursor cursor, Token ifKeyword) {
        Token letKeyword = cursor.matchIdent("let");
        if (letKeyword == null) {
            return new ConstructKind.If(ifKeyword);
        }
        List<TokenTree> pattern = cursor.bindingUntil("=", letKeyword);
        return new ConstructKind.IfLet(ifKeyword, letKeyword, pattern, cursor.lastToken());
    }

    private ConstructKind parseWhile(Cursor cursor, ConstructKind.Label label, Token whileKeyword) {
        Token letKeyword = cursor.matchIdent("let");
        if (letKeyword == null) {
            return new ConstructKind.While(label, whileKeyword);
        }
        List<TokenTree> pattern = cursor.bindingUntil("=", letKeyword);
        return new ConstructKind.WhileLet(label, whileKeyword, letKeyword, pattern, cursor.lastToken());
    }

    private ConstructKind parseFor(Cursor cursor, ConstructKind.Label label, Token forKeyword) {
        List<TokenTree> pattern = cursor.bindingUntil("in", forKeyword);
        return new ConstructKind.ForIn(label, forKeyword, pattern, cursor.lastToken());
    }

    private ConstructKind parseLet(Cursor cursor, Token letKeyword) {
        List<TokenTree> pattern = cursor.bindingUntil("=", letKeyword);
        return new ConstructKind.Let(letKeyword, pattern, cursor.lastToken());
    }

    /**
     * 构造头内部的游标，每次解析独立创建。
     */
    private static final class Cursor {
        private final List<TokenTree> trees;
        private int pos;

        private Cursor(TokenGroup head) {
            this.trees = head.children();
        }

        private boolean atEnd() {
            return pos >= trees.size();
        }

        private boolean currentIsKind(TokenKind kind) {
            return !atEnd() && trees.get(pos) instanceof Token token && token.kind() == kind;
        }

        /**
         * 消费构造关键字；分组不能作为关键字。
         */
        private Token keyword() {
            TokenTree current = trees.get(pos);
            if (!(current instanceof Token token)) {
                throw new SpinRewriteException(ErrorKind.UNKNOWN_CONSTRUCT,
                        "构造头必须以关键字开头", current.position());
            }
            pos++;
            return token;
        }

        private Token advanceToken() {
            return (Token) trees.get(pos++);
        }

        private Token matchIdent(String text) {
            if (!atEnd() && trees.get(pos) instanceof Token token && token.isIdent(text)) {
                pos++;
                return token;
            }
            return null;
        }

        private Token matchPunct(String text) {
            if (!atEnd() && trees.get(pos) instanceof Token token && token.isPunct(text)) {
                pos++;
                return token;
            }
            return null;
        }

        private Token matchKind(TokenKind kind) {
            if (currentIsKind(kind)) {
                return advanceToken();
            }
            return null;
        }

        /**
         * 读取直到构造头末尾的绑定模式，末尾必须是 terminator（in 或 =），模式不能为空。
         */
        private List<TokenTree> bindingUntil(String terminator, Token introducer) {
            if (atEnd() || !Token.matches(trees.get(trees.size() - 1), terminator)) {
                TokenTree anchor = atEnd() ? introducer : trees.get(trees.size() - 1);
                throw new SpinRewriteException(ErrorKind.MALFORMED_HEAD,
                        introducer.text() + " 构造头必须以 " + terminator + " 结尾", anchor.position());
            }
            List<TokenTree> pattern = trees.subList(pos, trees.size() - 1);
            if (pattern.isEmpty()) {
                throw new SpinRewriteException(ErrorKind.MALFORMED_HEAD,
                        introducer.text() + " 后缺少绑定模式", introducer.position());
            }
            pos = trees.size();
            return pattern;
        }

        private Token lastToken() {
            return (Token) trees.get(trees.size() - 1);
        }

        private void expectEnd(ConstructKind kind) {
            if (!atEnd()) {
                TokenTree extra = trees.get(pos);
                String text = extra instanceof Token token ? token.text() : String.valueOf(((TokenGroup) extra).delimiter().open());
                throw new SpinRewriteException(ErrorKind.MALFORMED_HEAD,
                        kind.displayName() + " 构造头存在多余内容: " + text, extra.position());
            }
        }
    }
}
