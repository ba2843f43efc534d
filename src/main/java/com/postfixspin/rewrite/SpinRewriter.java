package com.postfixspin.rewrite;

import com.postfixspin.config.RewriterConfig;
import com.postfixspin.render.TokenPrinter;
import com.postfixspin.text.SourceLexer;
import com.postfixspin.text.TokenGroup;
import com.postfixspin.text.TokenTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 后缀构造改写驱动器。
 *
 * <p>每一轮自左向右扫描每层兄弟序列：找到标记后依次提取操作数、解析构造头与构造体、拼装替换并原地拼接，
 * 然后从替换之后继续扫描，使链式标记以刚生成的构造作为操作数；本层扫描结束后递归进入每个子分组。
 * 整轮无改写即到达不动点。输入树不会被修改，失败时不产生部分输出。
 */
public class SpinRewriter {
    private static final Logger logger = LoggerFactory.getLogger(SpinRewriter.class);

    private final RewriterConfig config;
    private final MarkerScanner scanner;
    private final OperandExtractor operandExtractor;
    private final ConstructHeadParser headParser;
    private final BodyParser bodyParser;
    private final ConstructSynthesizer synthesizer;

    /**
     * 使用默认上限构造改写器。
     */
    public SpinRewriter() {
        this(RewriterConfig.defaults());
    }

    /**
     * 使用 RewriterConfig 注入上限与操作数包裹策略。
     */
    public SpinRewriter(RewriterConfig config) {
        this.config = config;
        this.scanner = new MarkerScanner();
        this.operandExtractor = new OperandExtractor();
        this.headParser = new ConstructHeadParser();
        this.bodyParser = new BodyParser();
        this.synthesizer = new ConstructSynthesizer(config.isWrapCompoundOperands());
    }

    /**
     * 改写整棵记号树，首个错误转为 Failure 返回。
     */
    public RewriteResult rewrite(TokenGroup root) {
        try {
            return rewriteOrThrow(root);
        } catch (SpinRewriteException exception) {
            logger.debug("改写失败: {}", exception.getMessage());
            return new RewriteResult.Failure(exception.toDiagnostic());
        }
    }

    /**
     * 改写整棵记号树直到不动点，失败时抛出 SpinRewriteException。
     */
    public RewriteResult.Success rewriteOrThrow(TokenGroup root) {
        RewriteBudget budget = new RewriteBudget(config.getMaxRewrites());
        TokenGroup current = root;
        int passes = 0;
        while (true) {
            if (passes >= config.getMaxPasses()) {
                logger.warn("改写在 {} 轮内未收敛", config.getMaxPasses());
                throw new SpinRewriteException(ErrorKind.REWRITE_LIMIT_EXCEEDED,
                        "改写在 " + config.getMaxPasses() + " 轮内未收敛", root.position());
            }
            passes++;
            int before = budget.rewrites();
            current = rewriteGroup(current, budget, 0);
            int performed = budget.rewrites() - before;
            logger.debug("第 {} 轮完成，改写 {} 处", passes, performed);
            if (performed == 0) {
                return new RewriteResult.Success(current, budget.rewrites(), passes);
            }
        }
    }

    /**
     * 对源码文本执行 词法分析 → 改写 → 打印，错误信息附带源码行指针。
     */
    public String rewriteSource(String source) {
        TokenGroup root = new SourceLexer().tokenize(source);
        try {
            return new TokenPrinter().print(rewriteOrThrow(root).output());
        } catch (SpinRewriteException exception) {
            throw exception.withSource(source);
        }
    }

    /**
     * 处理单个分组：本层自左向右改写，然后递归子分组。
     */
    private TokenGroup rewriteGroup(TokenGroup group, RewriteBudget budget, int depth) {
        if (depth > config.getMaxDepth()) {
            logger.warn("分组嵌套深度超过上限 {}", config.getMaxDepth());
            throw new SpinRewriteException(ErrorKind.REWRITE_LIMIT_EXCEEDED,
                    "分组嵌套深度超过上限 " + config.getMaxDepth(), group.position());
        }

        List<TokenTree> siblings = new ArrayList<>(group.children());
        Span previous = Span.NONE;
        Optional<Occurrence> occurrence = scanner.next(siblings, 0);
        while (occurrence.isPresent()) {
            previous = rewriteOccurrence(siblings, occurrence.get(), previous, budget);
            occurrence = scanner.next(siblings, previous.end());
        }

        List<TokenTree> rewritten = new ArrayList<>(siblings.size());
        for (TokenTree child : siblings) {
            if (child instanceof TokenGroup nested) {
                rewritten.add(rewriteGroup(nested, budget, depth + 1));
            } else {
                rewritten.add(child);
            }
        }
        return new TokenGroup(group.delimiter(), rewritten, group.position());
    }

    /**
     * 改写一次标记出现并原地拼接，返回替换在兄弟序列中的区间。
     */
    private Span rewriteOccurrence(List<TokenTree> siblings, Occurrence occurrence, Span previous, RewriteBudget budget) {
        int start = operandExtractor.extract(siblings, occurrence, previous);
        ConstructKind kind = headParser.parse(siblings, occurrence);
        List<TokenTree> operand = List.copyOf(siblings.subList(start, occurrence.markerIndex()));
        operandExtractor.requireForm(operand, kind, occurrence);

        BodyParser.Body body = kind.form() == ConstructKind.Form.BODY
                ? bodyParser.parse(siblings, occurrence.afterHead(), kind, (TokenGroup) siblings.get(occurrence.headIndex()))
                : BodyParser.Body.none(occurrence.afterHead());
        List<TokenTree> replacement = synthesizer.synthesize(occurrence, operand, kind, body.trees());
        budget.consume(occurrence.marker().position());

        List<TokenTree> replaced = siblings.subList(start, body.endIndex());
        replaced.clear();
        replaced.addAll(replacement);
        logger.debug("改写 {} 于 {}：操作数 {} 个节点，替换为 {} 个节点",
                kind.displayName(), occurrence.marker().position(), operand.size(), replacement.size());
        return new Span(start, start + replacement.size());
    }
}
