package com.postfixspin.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.postfixspin.config.Constants;
import com.postfixspin.config.RewriterConfig;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.lang.reflect.Field;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import picocli.CommandLine.ParseResult;

class MainCommandTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream outputBuffer = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errorBuffer = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void captureStreams() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outputBuffer, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(errorBuffer, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void testCallPrintsBanner() {
        MainCommand command = new MainCommand();
        assertEquals(0, command.call());
        assertTrue(stdout().contains("--help"));
    }

    @Test
    void testHelpOptionReturnsZero() {
        int exitCode = new CommandLine(new MainCommand()).execute("--help");
        assertEquals(0, exitCode);
    }

    @Test
    void testParseGlobalOptionsAndSubcommand() {
        CommandLine commandLine = new CommandLine(new MainCommand());
        ParseResult parseResult = commandLine.parseArgs("--max-rewrites", "5", "--no-wrap", "rewrite", "-f", "json", "a.rs");

        assertNotNull(parseResult.subcommand());
        assertEquals("rewrite", parseResult.subcommand().commandSpec().name());
        assertEquals(5, (Integer) parseResult.matchedOptionValue("--max-rewrites", 0));
    }

    @Test
    void testUnknownOptionIsUsageError() {
        int exitCode = new CommandLine(new MainCommand()).execute("rewrite", "--bogus");
        assertEquals(2, exitCode);
    }

    @Test
    void testRewriteFileToStdout() throws Exception {
        Path source = writeSource("let y = x::(match){A => 1};");

        assertEquals(0, rewriteCommand(new MainCommand(), source, "text").call());
        assertTrue(stdout().contains("let y = match x { A => 1 };"));
    }

    @Test
    void testRewriteToOutputFile() throws Exception {
        Path source = writeSource("v::(box)");
        Path target = tempDir.resolve("out.rs");

        MainCommand.RewriteSubcommand rewriteSubcommand = rewriteCommand(new MainCommand(), source, "text");
        setField(rewriteSubcommand, "outputFile", target);

        assertEquals(0, rewriteSubcommand.call());
        assertEquals("box v", Files.readString(target).strip());
        assertTrue(stdout().contains("改写完成: 1 处"));
    }

    @Test
    void testRewriteJsonReport() throws Exception {
        Path source = writeSource("a::(match){A}::(match){B}");

        assertEquals(0, rewriteCommand(new MainCommand(), source, "json").call());
        String outputText = stdout();
        assertTrue(outputText.contains("\"output\""));
        assertTrue(outputText.contains("\"rewrites\" : 2"));
        assertTrue(outputText.contains("\"passes\" : 2"));
    }

    @Test
    void testRewriteJsonReportToOutputFile() throws Exception {
        Path source = writeSource("v::(box)");
        Path target = tempDir.resolve("report.json");

        MainCommand.RewriteSubcommand rewriteSubcommand = rewriteCommand(new MainCommand(), source, "json");
        setField(rewriteSubcommand, "outputFile", target);

        assertEquals(0, rewriteSubcommand.call());
        String written = Files.readString(target);
        assertTrue(written.contains("\"output\" : \"box v\""));
        assertTrue(written.contains("\"rewrites\" : 1"));
        assertFalse(stdout().contains("\"output\""));
        assertTrue(stdout().contains("输出文件: " + target));
    }

    @Test
    void testRewriteFailureReturnsOne() throws Exception {
        Path source = writeSource("let y = x::(nope){}");

        assertEquals(1, rewriteCommand(new MainCommand(), source, "json").call());
        assertTrue(stdout().contains("\"kind\" : \"UNKNOWN_CONSTRUCT\""));
        assertTrue(stderr().contains("❌ 改写失败"));
        assertTrue(stderr().contains("let y = x::(nope){}"));
    }

    @Test
    void testLexFailureReturnsOne() throws Exception {
        Path source = writeSource("f(a");

        assertEquals(1, rewriteCommand(new MainCommand(), source, "text").call());
        assertTrue(stderr().contains("词法分析失败"));
    }

    @Test
    void testMissingFileReturnsOne() throws Exception {
        assertEquals(1, rewriteCommand(new MainCommand(), tempDir.resolve("missing.rs"), "text").call());
        assertTrue(stderr().contains("读写失败"));
    }

    @Test
    void testRewriteReadsStdinWhenNoFile() throws Exception {
        InputStream originalIn = System.in;
        try {
            System.setIn(new ByteArrayInputStream("x::(return);".getBytes(StandardCharsets.UTF_8)));
            assertEquals(0, rewriteCommand(new MainCommand(), null, "text").call());
        } finally {
            System.setIn(originalIn);
        }
        assertTrue(stdout().contains("return x;"));
    }

    @Test
    void testCheckSubcommand() throws Exception {
        Path source = writeSource("a::(match){ B => c::(box) }");

        assertEquals(0, checkCommand(new MainCommand(), source).call());
        String outputText = stdout();
        assertTrue(outputText.contains("标记数: 2"));
        assertTrue(outputText.contains("✅ 校验通过"));
    }

    @Test
    void testCheckSubcommandFailure() throws Exception {
        Path source = writeSource("x::(match);");

        assertEquals(1, checkCommand(new MainCommand(), source).call());
        assertTrue(stderr().contains("EXPECTED_BODY"));
    }

    @Test
    void testGlobalLimitAppliesEndToEnd() throws Exception {
        Path source = writeSource("a::(box); b::(box);");

        int exitCode = new CommandLine(new MainCommand()).execute("--max-rewrites", "1", "rewrite", source.toString());

        assertEquals(1, exitCode);
        assertTrue(stderr().contains("REWRITE_LIMIT_EXCEEDED"));
    }

    @Test
    void testResolveConfigSanitizesOptions() throws Exception {
        MainCommand mainCommand = new MainCommand();
        setField(mainCommand, "maxRewrites", -1);
        setField(mainCommand, "maxPasses", 0);
        setField(mainCommand, "noWrap", true);

        RewriterConfig config = mainCommand.resolveConfig();

        assertEquals(Constants.DEFAULT_MAX_REWRITES, config.getMaxRewrites());
        assertEquals(Constants.DEFAULT_MAX_PASSES, config.getMaxPasses());
        assertFalse(config.isWrapCompoundOperands());
        assertTrue(stderr().contains("⚠️"));

        setField(mainCommand, "maxRewrites", Constants.MAX_REWRITES_CEILING + 1);
        assertEquals(Constants.MAX_REWRITES_CEILING, mainCommand.resolveConfig().getMaxRewrites());
    }

    @Test
    void testResolveConfigOverridesFile() throws Exception {
        Path configFile = tempDir.resolve("spin.json");
        Files.writeString(configFile, "{\"maxRewrites\": 7, \"maxPasses\": 9}");
        MainCommand mainCommand = new MainCommand();
        setField(mainCommand, "configFile", configFile);
        setField(mainCommand, "maxPasses", 4);

        RewriterConfig config = mainCommand.resolveConfig();

        assertEquals(7, config.getMaxRewrites());
        assertEquals(4, config.getMaxPasses());
    }

    private MainCommand.RewriteSubcommand rewriteCommand(MainCommand mainCommand, Path source, String format) throws Exception {
        MainCommand.RewriteSubcommand rewriteSubcommand = new MainCommand.RewriteSubcommand();
        setField(rewriteSubcommand, "main", mainCommand);
        setField(rewriteSubcommand, "sourceFile", source);
        setField(rewriteSubcommand, "format", format);
        return rewriteSubcommand;
    }

    private Callable<Integer> checkCommand(MainCommand mainCommand, Path source) throws Exception {
        MainCommand.CheckSubcommand checkSubcommand = new MainCommand.CheckSubcommand();
        setField(checkSubcommand, "main", mainCommand);
        setField(checkSubcommand, "sourceFile", source);
        return checkSubcommand;
    }

    private Path writeSource(String content) throws Exception {
        Path file = tempDir.resolve("input.rs");
        Files.writeString(file, content);
        return file;
    }

    private String stdout() {
        return outputBuffer.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return errorBuffer.toString(StandardCharsets.UTF_8);
    }

    private static void setField(Object target, String fieldName, Object value) throws Exception {
        Field field = target.getClass().getDeclaredField(fieldName);
        field.setAccessible(true);
        field.set(target, value);
    }
}
