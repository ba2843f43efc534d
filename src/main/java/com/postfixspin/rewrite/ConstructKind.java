package com.postfixspin.rewrite;

import com.postfixspin.text.Token;
import com.postfixspin.text.TokenTree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 后缀标记可识别的前缀构造。每个变体携带改写时需要放回操作数前的关键字与绑定记号。
 */
public sealed interface ConstructKind permits ConstructKind.Match, ConstructKind.If, ConstructKind.IfLet,
        ConstructKind.While, ConstructKind.WhileLet, ConstructKind.ForIn, ConstructKind.Loop,
        ConstructKind.Unsafe, ConstructKind.Async, ConstructKind.TryBlock, ConstructKind.LabeledBlock,
        ConstructKind.Box, ConstructKind.Unary, ConstructKind.Reference, ConstructKind.Let,
        ConstructKind.Break, ConstructKind.Return, ConstructKind.Yield {

    /** 构造对操作数与构造体的要求 */
    enum Form {
        /** 构造头后必须跟花括号构造体 */
        BODY,
        /** 操作数本身必须是花括号代码块 */
        BLOCK_OPERAND,
        /** 仅在操作数前加前缀，无构造体 */
        PREFIX
    }

    Form form();

    /**
     * 按目标构造语法顺序排列、放在操作数之前的记号。
     */
    List<TokenTree> prefix();

    /**
     * 构造关键字，用于日志与诊断。
     */
    String displayName();

    /**
     * 是否允许构造体后接 else 分支链。
     */
    default boolean acceptsElse() {
        return false;
    }

    /** 循环与代码块标签 {@code 'name:} */
    record Label(Token lifetime, Token colon) {
    }

    record Match(Token keyword) implements ConstructKind {
        @Override
        public Form form() {
            return Form.BODY;
        }

        @Override
        public List<TokenTree> prefix() {
            return concat(keyword);
        }

        @Override
        public String displayName() {
            return "match";
        }
    }

    record If(Token keyword) implements ConstructKind {
        @Override
        public Form form() {
            return Form.BODY;
        }

        @Override
        public List<TokenTree> prefix() {
            return concat(keyword);
        }

        @Override
        public String displayName() {
            return "if";
        }

        @Override
        public boolean acceptsElse() {
            return true;
        }
    }

    record IfLet(Token ifKeyword, Token letKeyword, List<TokenTree> pattern, Token equals) implements ConstructKind {
        public IfLet {
            pattern = List.copyOf(pattern);
        }

        @Override
        public Form form() {
            return Form.BODY;
        }

        @Override
        public List<TokenTree> prefix() {
            return concat(ifKeyword, letKeyword, pattern, equals);
        }

        @Override
        public String displayName() {
            return "if let";
        }

        @Override
        public boolean acceptsElse() {
            return true;
        }
    }

    record While(Label label, Token keyword) implements ConstructKind {
        @Override
        public Form form() {
            return Form.BODY;
        }

        @Override
        public List<TokenTree> prefix() {
            return concat(label, keyword);
        }

        @Override
        public String displayName() {
            return "while";
        }
    }

    record WhileLet(Label label, Token whileKeyword, Token letKeyword, List<TokenTree> pattern, Token equals)
            implements ConstructKind {
        public WhileLet {
            pattern = List.copyOf(pattern);
        }

        @Override
        public Form form() {
            return Form.BODY;
        }

        @Override
        public List<TokenTree> prefix() {
            return concat(label, whileKeyword, letKeyword, pattern, equals);
        }

        @Override
        public String displayName() {
            return "while let";
        }
    }

    record ForIn(Label label, Token keyword, List<TokenTree> pattern, Token in) implements ConstructKind {
        public ForIn {
            pattern = List.copyOf(pattern);
        }

        @Override
        public Form form() {
            return Form.BODY;
        }

        @Override
        public List<TokenTree> prefix() {
            return concat(label, keyword, pattern, in);
        }

        @Override
        public String displayName() {
            return "for";
        }
    }

    record Loop(Label label, Token keyword) implements ConstructKind {
        @Override
        public Form form() {
            return Form.BLOCK_OPERAND;
        }

        @Override
        public List<TokenTree> prefix() {
            return concat(label, keyword);
        }

        @Override
        public String displayName() {
            return "loop";
        }
    }

    record Unsafe(Token keyword) implements ConstructKind {
        @Override
        public Form form() {
            return Form.BLOCK_OPERAND;
        }

        @Override
        public List<TokenTree> prefix() {
            return concat(keyword);
        }

        @Override
        public String displayName() {
            return "unsafe";
        }
    }

    record Async(Token keyword, Token capture) implements ConstructKind {
        @Override
        public Form form() {
            return Form.BLOCK_OPERAND;
        }

        @Override
        public List<TokenTree> prefix() {
            return concat(keyword, capture);
        }

        @Override
        public String displayName() {
            return "async";
        }
    }

    record TryBlock(Token keyword) implements ConstructKind {
        @Override
        public Form form() {
            return Form.BLOCK_OPERAND;
        }

        @Override
        public List<TokenTree> prefix() {
            return concat(keyword);
        }

        @Override
        public String displayName() {
            return "try";
        }
    }

    record LabeledBlock(Label label) implements ConstructKind {
        @Override
        public Form form() {
            return Form.BLOCK_OPERAND;
        }

        @Override
        public List<TokenTree> prefix() {
            return concat(label);
        }

        @Override
        public String displayName() {
            return label.lifetime().text() + ":";
        }
    }

    record Box(Token keyword) implements ConstructKind {
        @Override
        public Form form() {
            return Form.PREFIX;
        }

        @Override
        public List<TokenTree> prefix() {
            return concat(keyword);
        }

        @Override
        public String displayName() {
            return "box";
        }
    }

    /** 一元运算 {@code * ! -} */
    record Unary(Token operator) implements ConstructKind {
        @Override
        public Form form() {
            return Form.PREFIX;
        }

        @Override
        public List<TokenTree> prefix() {
            return concat(operator);
        }

        @Override
        public String displayName() {
            return operator.text();
        }
    }

    record Reference(Token ampersand, Token mutability) implements ConstructKind {
        @Override
        public Form form() {
            return Form.PREFIX;
        }

        @Override
        public List<TokenTree> prefix() {
            return concat(ampersand, mutability);
        }

        @Override
        public String displayName() {
            return mutability == null ? ampersand.text() : ampersand.text() + "mut";
        }
    }

    record Let(Token keyword, List<TokenTree> pattern, Token equals) implements ConstructKind {
        public Let {
            pattern = List.copyOf(pattern);
        }

        @Override
        public Form form() {
            return Form.PREFIX;
        }

        @Override
        public List<TokenTree> prefix() {
            return concat(keyword, pattern, equals);
        }

        @Override
        public String displayName() {
            return "let";
        }
    }

    record Break(Token keyword, Token label) implements ConstructKind {
        @Override
        public Form form() {
            return Form.PREFIX;
        }

        @Override
        public List<TokenTree> prefix() {
            return concat(keyword, label);
        }

        @Override
        public String displayName() {
            return "break";
        }
    }

    record Return(Token keyword) implements ConstructKind {
        @Override
        public Form form() {
            return Form.PREFIX;
        }

        @Override
        public List<TokenTree> prefix() {
            return concat(keyword);
        }

        @Override
        public String displayName() {
            return "return";
        }
    }

    record Yield(Token keyword) implements ConstructKind {
        @Override
        public Form form() {
            return Form.PREFIX;
        }

        @Override
        public List<TokenTree> prefix() {
            return concat(keyword);
        }

        @Override
        public String displayName() {
            return "yield";
        }
    }

    /**
     * 依次展开记号、标签与记号列表，跳过缺省（null）的可选成分。
     */
    private static List<TokenTree> concat(Object... parts) {
        List<TokenTree> tokens = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof TokenTree tree) {
                tokens.add(tree);
            } else if (part instanceof Label label) {
                tokens.add(label.lifetime());
                tokens.add(label.colon());
            } else if (part instanceof Collection<?> trees) {
                for (Object element : trees) {
                    tokens.add((TokenTree) element);
                }
            }
        }
        return List.copyOf(tokens);
    }
}
