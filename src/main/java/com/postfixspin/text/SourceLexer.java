package com.postfixspin.text;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 将源码片段切分为记号，并按配对的括号、花括号、方括号组织为记号树。
 *
 * <p>实例保存扫描状态，不可在线程间共享。
 */
public class SourceLexer {
    private static final List<String> MULTI_CHAR_PUNCTS = List.of(
            "<<=", ">>=", "...", "..=",
            "::", "->", "=>", "==", "!=", "<=", ">=", "&&", "||",
            "+=", "-=", "*=", "/=", "%=", "^=", "&=", "|=", "<<", ">>", "..");
    private static final String SINGLE_CHAR_PUNCTS = "+-*/%^!&|=<>@.,;:#$?~";

    private String source;
    private int index;
    private int line;
    private int column;

    /**
     * 对完整源码分词，返回以 NONE 为分隔符的根分组。
     */
    public TokenGroup tokenize(String text) {
        if (text == null) {
            throw new SourceParseException("源码不能为空", Position.START, "");
        }
        this.source = text;
        this.index = 0;
        this.line = 1;
        this.column = 1;

        Deque<GroupFrame> frames = new ArrayDeque<>();
        GroupFrame rootFrame = new GroupFrame(Delimiter.NONE, Position.START);
        frames.push(rootFrame);

        while (index < source.length()) {
            char currentChar = source.charAt(index);
            if (Character.isWhitespace(currentChar)) {
                advance();
                continue;
            }
            if (currentChar == '/' && peek(1) == '/') {
                skipLineComment();
                continue;
            }
            if (currentChar == '/' && peek(1) == '*') {
                skipBlockComment();
                continue;
            }

            Delimiter opening = Delimiter.forOpen(currentChar);
            if (opening != null) {
                frames.push(new GroupFrame(opening, position()));
                advance();
                continue;
            }
            Delimiter closing = Delimiter.forClose(currentChar);
            if (closing != null) {
                closeGroup(frames, closing);
                continue;
            }

            Token token = readToken();
            frames.peek().children.add(token);
        }

        if (frames.size() > 1) {
            GroupFrame unclosed = frames.peek();
            throw new SourceParseException("未闭合的分隔符: " + unclosed.delimiter.open(), unclosed.position, source);
        }
        return rootFrame.build();
    }

    /**
     * 弹出当前分组并挂到父分组下，校验左右分隔符配对。
     */
    private void closeGroup(Deque<GroupFrame> frames, Delimiter closing) {
        if (frames.size() == 1) {
            throw new SourceParseException("多余的右分隔符: " + closing.close(), position(), source);
        }
        GroupFrame frame = frames.peek();
        if (frame.delimiter != closing) {
            throw new SourceParseException(
                    "分隔符不匹配: 期望 " + frame.delimiter.close() + "，实际 " + closing.close(), position(), source);
        }
        frames.pop();
        frames.peek().children.add(frame.build());
        advance();
    }

    /**
     * 读取一个原子记号：字面量、生命周期标签、标识符或运算符。
     */
    private Token readToken() {
        Position start = position();
        char currentChar = source.charAt(index);

        if (currentChar == '"') {
            return readQuoted(start, index);
        }
        if (isPrefixedLiteralStart()) {
            return readPrefixedLiteral(start);
        }
        if (currentChar == '\'') {
            return readQuoteOrLifetime(start);
        }
        if (Character.isDigit(currentChar)) {
            return readNumber(start);
        }
        if (isIdentStart(currentChar)) {
            return readIdent(start);
        }
        Token punct = readPunct(start);
        if (punct != null) {
            return punct;
        }
        throw new SourceParseException("无法识别字符: " + currentChar, start, source);
    }

    /**
     * 读取普通或字节字符串，literalStart 指向前缀起点。
     */
    private Token readQuoted(Position start, int literalStart) {
        advance();
        while (index < source.length()) {
            char currentChar = source.charAt(index);
            if (currentChar == '\\' && index + 1 < source.length()) {
                advance();
                advance();
                continue;
            }
            advance();
            if (currentChar == '"') {
                return new Token(TokenKind.LITERAL, source.substring(literalStart, index), start);
            }
        }
        throw new SourceParseException("未闭合字符串", start, source);
    }

    /**
     * 判断当前位置是否为 b"..."、b'.'、r"..."、r#"..."#、br"..." 形式的字面量。
     */
    private boolean isPrefixedLiteralStart() {
        char currentChar = source.charAt(index);
        if (currentChar == 'b') {
            char next = peek(1);
            if (next == '"' || next == '\'') {
                return true;
            }
            return next == 'r' && isRawStringOpening(2);
        }
        return currentChar == 'r' && isRawStringOpening(1);
    }

    private boolean isRawStringOpening(int lookahead) {
        int cursor = index + lookahead;
        while (cursor < source.length() && source.charAt(cursor) == '#') {
            cursor++;
        }
        return cursor < source.length() && source.charAt(cursor) == '"';
    }

    private Token readPrefixedLiteral(Position start) {
        int literalStart = index;
        if (source.charAt(index) == 'b') {
            advance();
            if (source.charAt(index) == '"') {
                return readQuoted(start, literalStart);
            }
            if (source.charAt(index) == '\'') {
                Token quote = readQuoteOrLifetime(start);
                return new Token(TokenKind.LITERAL, "b" + quote.text(), start);
            }
        }
        // 原始字符串：r 后可跟若干 #，结尾需要同样数量的 #
        advance();
        int hashes = 0;
        while (source.charAt(index) == '#') {
            hashes++;
            advance();
        }
        advance();
        String terminator = "\"" + "#".repeat(hashes);
        int end = source.indexOf(terminator, index);
        if (end < 0) {
            throw new SourceParseException("未闭合原始字符串", start, source);
        }
        while (index < end + terminator.length()) {
            advance();
        }
        return new Token(TokenKind.LITERAL, source.substring(literalStart, index), start);
    }

    /**
     * 区分字符字面量 'x' 与生命周期标签 'label。
     */
    private Token readQuoteOrLifetime(Position start) {
        int literalStart = index;
        if (peek(1) == '\\') {
            advance();
            advance();
            advance();
            while (index < source.length() && source.charAt(index) != '\'' && source.charAt(index) != '\n') {
                advance();
            }
            if (index >= source.length() || source.charAt(index) != '\'') {
                throw new SourceParseException("未闭合字符字面量", start, source);
            }
            advance();
            return new Token(TokenKind.LITERAL, source.substring(literalStart, index), start);
        }
        int width = Character.isHighSurrogate(peek(1)) ? 2 : 1;
        if (peek(1 + width) == '\'' && peek(1) != '\0') {
            for (int step = 0; step < width + 2; step++) {
                advance();
            }
            return new Token(TokenKind.LITERAL, source.substring(literalStart, index), start);
        }
        if (isIdentStart(peek(1))) {
            advance();
            while (index < source.length() && isIdentPart(source.charAt(index))) {
                advance();
            }
            return new Token(TokenKind.LIFETIME, source.substring(literalStart, index), start);
        }
        throw new SourceParseException("未闭合字符字面量", start, source);
    }

    /**
     * 读取数字字面量，支持下划线、类型后缀、小数与指数；0..3 中的 .. 不计入数字。
     */
    private Token readNumber(Position start) {
        int literalStart = index;
        boolean radixPrefixed = source.charAt(index) == '0' && (peek(1) == 'x' || peek(1) == 'o' || peek(1) == 'b');
        while (index < source.length()) {
            char currentChar = source.charAt(index);
            if (isIdentPart(currentChar)) {
                boolean exponent = !radixPrefixed && (currentChar == 'e' || currentChar == 'E')
                        && (peek(1) == '+' || peek(1) == '-') && Character.isDigit(peek(2));
                advance();
                if (exponent) {
                    advance();
                }
                continue;
            }
            if (currentChar == '.' && Character.isDigit(peek(1)) && !radixPrefixed) {
                advance();
                continue;
            }
            break;
        }
        return new Token(TokenKind.LITERAL, source.substring(literalStart, index), start);
    }

    /**
     * 读取标识符或关键字，支持 r#ident 原始标识符。
     */
    private Token readIdent(Position start) {
        int identStart = index;
        if (source.charAt(index) == 'r' && peek(1) == '#' && isIdentStart(peek(2))) {
            advance();
            advance();
        }
        while (index < source.length() && isIdentPart(source.charAt(index))) {
            advance();
        }
        return new Token(TokenKind.IDENT, source.substring(identStart, index), start);
    }

    /**
     * 按最长匹配读取运算符，无法识别时返回 null。
     */
    private Token readPunct(Position start) {
        for (String candidate : MULTI_CHAR_PUNCTS) {
            if (source.startsWith(candidate, index)) {
                for (int step = 0; step < candidate.length(); step++) {
                    advance();
                }
                return new Token(TokenKind.PUNCT, candidate, start);
            }
        }
        char currentChar = source.charAt(index);
        if (SINGLE_CHAR_PUNCTS.indexOf(currentChar) >= 0) {
            advance();
            return new Token(TokenKind.PUNCT, String.valueOf(currentChar), start);
        }
        return null;
    }

    private void skipLineComment() {
        while (index < source.length() && source.charAt(index) != '\n') {
            advance();
        }
    }

    /**
     * 跳过可嵌套的块注释。
     */
    private void skipBlockComment() {
        Position start = position();
        int depth = 0;
        while (index < source.length()) {
            if (source.startsWith("/*", index)) {
                depth++;
                advance();
                advance();
                continue;
            }
            if (source.startsWith("*/", index)) {
                depth--;
                advance();
                advance();
                if (depth == 0) {
                    return;
                }
                continue;
            }
            advance();
        }
        throw new SourceParseException("未闭合块注释", start, source);
    }

    private boolean isIdentStart(char ch) {
        return ch == '_' || Character.isLetter(ch);
    }

    private boolean isIdentPart(char ch) {
        return ch == '_' || Character.isLetterOrDigit(ch);
    }

    private char peek(int lookahead) {
        int target = index + lookahead;
        return target < source.length() ? source.charAt(target) : '\0';
    }

    private Position position() {
        return new Position(index, line, column);
    }

    /**
     * 前进一个字符并维护行列号。
     */
    private void advance() {
        if (source.charAt(index) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        index++;
    }

    private static final class GroupFrame {
        private final Delimiter delimiter;
        private final Position position;
        private final List<TokenTree> children = new ArrayList<>();

        private GroupFrame(Delimiter delimiter, Position position) {
            this.delimiter = delimiter;
            this.position = position;
        }

        private TokenGroup build() {
            return new TokenGroup(delimiter, children, position);
        }
    }
}
