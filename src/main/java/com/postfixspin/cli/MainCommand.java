package com.postfixspin.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.postfixspin.config.Constants;
import com.postfixspin.config.RewriterConfig;
import com.postfixspin.render.TokenPrinter;
import com.postfixspin.rewrite.MarkerScanner;
import com.postfixspin.rewrite.RewriteResult;
import com.postfixspin.rewrite.SpinRewriteException;
import com.postfixspin.rewrite.SpinRewriter;
import com.postfixspin.text.SourceLexer;
import com.postfixspin.text.SourceParseException;
import com.postfixspin.text.TokenGroup;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "spin",
    description = "🌀 后缀构造改写器：将 expr::(head){body} 改写为前缀形式",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.RewriteSubcommand.class,
        MainCommand.CheckSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--config"}, description = "JSON 配置文件路径")
    private Path configFile;

    @Option(names = {"--max-rewrites"}, description = "单次调用最大改写次数")
    private Integer maxRewrites;

    @Option(names = {"--max-passes"}, description = "最大扫描轮数")
    private Integer maxPasses;

    @Option(names = {"--no-wrap"}, description = "不为多记号操作数添加圆括号")
    private boolean noWrap;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🌀 后缀构造改写器");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 合并配置文件与命令行参数，命令行优先。
     */
    RewriterConfig resolveConfig() throws IOException {
        RewriterConfig config = configFile == null ? RewriterConfig.defaults() : RewriterConfig.load(configFile);
        if (maxRewrites != null) {
            config.setMaxRewrites(sanitizeMaxRewrites(maxRewrites));
        }
        if (maxPasses != null) {
            config.setMaxPasses(sanitizeMaxPasses(maxPasses));
        }
        if (noWrap) {
            config.setWrapCompoundOperands(false);
        }
        return config;
    }

    private int sanitizeMaxRewrites(int rawLimit) {
        if (rawLimit <= 0) {
            System.err.printf("⚠️ 非法改写上限 %d，已回退为默认值 %d%n", rawLimit, Constants.DEFAULT_MAX_REWRITES);
            return Constants.DEFAULT_MAX_REWRITES;
        }
        if (rawLimit > Constants.MAX_REWRITES_CEILING) {
            System.err.printf("⚠️ 改写上限 %d 超过安全上限 %d，已自动限制%n", rawLimit, Constants.MAX_REWRITES_CEILING);
            return Constants.MAX_REWRITES_CEILING;
        }
        return rawLimit;
    }

    private int sanitizeMaxPasses(int rawPasses) {
        if (rawPasses <= 0) {
            System.err.printf("⚠️ 非法轮数 %d，已回退为默认值 %d%n", rawPasses, Constants.DEFAULT_MAX_PASSES);
            return Constants.DEFAULT_MAX_PASSES;
        }
        return rawPasses;
    }

    /**
     * 读取源文件，未指定文件时读取标准输入。
     */
    String readSource(Path sourceFile) throws IOException {
        String source;
        if (sourceFile == null) {
            InputStream input = System.in;
            source = new String(input.readAllBytes(), StandardCharsets.UTF_8);
        } else {
            source = Files.readString(sourceFile, StandardCharsets.UTF_8);
        }
        if (source.length() > Constants.MAX_SOURCE_LENGTH) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "源码长度超过限制（最大 " + Constants.MAX_SOURCE_LENGTH + " 字符）");
        }
        return source;
    }

    @Command(name = "rewrite", description = "✏️ 改写源码并输出前缀形式")
    static class RewriteSubcommand implements Callable<Integer> {

        @Parameters(description = "源文件路径，省略时读取标准输入", arity = "0..1")
        private Path sourceFile;

        @Option(names = {"-o", "--output"}, description = "输出文件路径（text 与 json 格式均写入该文件），省略时输出到标准输出")
        private Path outputFile;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                String source = main.readSource(sourceFile);
                long start = System.currentTimeMillis();
                TokenGroup root = new SourceLexer().tokenize(source);
                RewriteResult result = new SpinRewriter(main.resolveConfig()).rewrite(root);
                if (!result.isSuccess()) {
                    return reportFailure(source, (RewriteResult.Failure) result);
                }

                RewriteResult.Success success = (RewriteResult.Success) result;
                String output = new TokenPrinter().print(success.output());
                long elapsed = System.currentTimeMillis() - start;
                boolean json = "json".equalsIgnoreCase(format);
                String rendered = json
                        ? toJson(new RewriteReport(source, output, success.rewrites(), success.passes(), elapsed))
                        : output;
                if (outputFile != null) {
                    Files.writeString(outputFile, rendered + System.lineSeparator(), StandardCharsets.UTF_8);
                    System.out.println("✅ 改写完成: " + success.rewrites() + " 处，" + success.passes() + " 轮，用时 " + elapsed + "ms");
                    System.out.println("📄 输出文件: " + outputFile);
                } else {
                    System.out.println(rendered);
                }
                return 0;
            } catch (SourceParseException exception) {
                System.err.println("❌ 词法分析失败: " + exception.getMessage());
                return 1;
            } catch (IOException exception) {
                System.err.println("❌ 读写失败: " + exception.getMessage());
                return 1;
            }
        }

        private int reportFailure(String source, RewriteResult.Failure failure) throws IOException {
            if ("json".equalsIgnoreCase(format)) {
                System.out.println(toJson(failure.diagnostic()));
            }
            SpinRewriteException exception = SpinRewriteException.from(failure.diagnostic()).withSource(source);
            System.err.println("❌ 改写失败: " + exception.getMessage());
            return 1;
        }

        private String toJson(Object value) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        }
    }

    @Command(name = "check", description = "🔎 校验标记是否都能改写，不输出改写结果")
    static class CheckSubcommand implements Callable<Integer> {

        @Parameters(description = "源文件路径，省略时读取标准输入", arity = "0..1")
        private Path sourceFile;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                String source = main.readSource(sourceFile);
                TokenGroup root = new SourceLexer().tokenize(source);
                int markers = new MarkerScanner().countAll(root);
                RewriteResult result = new SpinRewriter(main.resolveConfig()).rewrite(root);
                if (result instanceof RewriteResult.Failure failure) {
                    SpinRewriteException exception = SpinRewriteException.from(failure.diagnostic()).withSource(source);
                    System.err.println("❌ 校验失败: " + exception.getMessage());
                    return 1;
                }
                RewriteResult.Success success = (RewriteResult.Success) result;

                System.out.println("📊 校验结果");
                System.out.println("═══════════");
                System.out.println("🔖 标记数: " + markers);
                System.out.println("✏️ 改写数: " + success.rewrites());
                System.out.println("🔁 轮数: " + success.passes());
                System.out.println("✅ 校验通过");
                return 0;
            } catch (SourceParseException exception) {
                System.err.println("❌ 词法分析失败: " + exception.getMessage());
                return 1;
            } catch (IOException exception) {
                System.err.println("❌ 读取失败: " + exception.getMessage());
                return 1;
            }
        }
    }
}
