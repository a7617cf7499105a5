package com.lumilang.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.util.concurrent.Callable;

/**
 * Lumi CLI 入口点（picocli）
 */
@Command(name = "lumi", version = "Lumi v0.1.0",
         mixinStandardHelpOptions = true,
         subcommands = {FmtCommand.class, TreeCommand.class})
public class Main implements Callable<Integer> {

    @Option(names = "-e", description = "读取表达式并输出打印结果")
    String expression;

    @Option(names = "--canonical", description = "只输出规范调用形式，不使用缩写")
    boolean canonical;

    @Override
    public Integer call() {
        if (expression != null) {
            return new SourceRunner(System.out, System.err).echo(expression, canonical);
        }
        new ReplRunner(System.out, System.err).run();
        return 0;
    }

    public static void main(String[] args) {
        // Windows 控制台可能不是 UTF-8，按操作系统原生编码输出
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = new CommandLine(new Main());
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(new CommandLine(new Main()).execute(args));
        }
    }

    /**
     * 控制台实际使用的字符编码名（native.encoding，JDK 17+）
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
