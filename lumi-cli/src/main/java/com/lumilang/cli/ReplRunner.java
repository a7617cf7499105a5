package com.lumilang.cli;

import com.lumilang.reader.form.Form;
import com.lumilang.reader.lexer.Lexer;
import com.lumilang.reader.parser.FormReader;
import com.lumilang.reader.parser.ParseException;
import com.lumilang.reader.parser.ReadResult;
import com.lumilang.reader.parser.SyntaxErrorKind;
import com.lumilang.reader.printer.FormPrinter;
import com.lumilang.reader.printer.PrintConfig;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * jline REPL 交互模式：读取输入并回显打印结果
 */
public class ReplRunner {

    private static final String VERSION = "0.1.0";
    private static final String PROMPT = "lumi> ";
    private static final String CONTINUATION_PROMPT = "... ";

    private final PrintStream out;
    private final PrintStream err;
    private final FormPrinter printer = new FormPrinter();
    private final StringBuilder multilineBuffer = new StringBuilder();

    private boolean canonical;

    public ReplRunner(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    /**
     * 启动 REPL 交互模式
     */
    public void run() {
        printBanner();
        out.println("输入 :help 获取帮助，:quit 退出");
        out.println();

        try {
            Terminal terminal = TerminalBuilder.builder().system(true).build();
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .parser(new DefaultParser())
                    .variable(LineReader.SECONDARY_PROMPT_PATTERN, CONTINUATION_PROMPT)
                    .build();

            runLoop(reader);
        } catch (IOException e) {
            err.println("终端初始化失败: " + e.getMessage());
            runFallbackLoop(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        }

        out.println("\n再见！");
    }

    /**
     * jline 主循环
     */
    private void runLoop(LineReader reader) {
        while (true) {
            try {
                String line = reader.readLine(isContinuing() ? CONTINUATION_PROMPT : PROMPT);
                if (line == null || !submit(line)) break;
            } catch (UserInterruptException e) {
                // Ctrl+C: 取消当前输入
                multilineBuffer.setLength(0);
            } catch (EndOfFileException e) {
                // Ctrl+D: 退出
                break;
            }
        }
    }

    /**
     * 回退循环（jline 初始化失败时使用 BufferedReader）
     */
    void runFallbackLoop(BufferedReader reader) {
        while (true) {
            try {
                out.print(isContinuing() ? CONTINUATION_PROMPT : PROMPT);
                out.flush();

                String line = reader.readLine();
                if (line == null || !submit(line)) break;
            } catch (IOException e) {
                err.println("读取输入时出错: " + e.getMessage());
                break;
            }
        }
    }

    /**
     * 是否正在等待后续行
     */
    boolean isContinuing() {
        return multilineBuffer.length() > 0;
    }

    /**
     * 处理一行输入
     *
     * @return true 继续循环，false 退出
     */
    boolean submit(String line) {
        if (!isContinuing() && line.startsWith(":")) {
            return handleReplCommand(line.trim());
        }

        multilineBuffer.append(line).append('\n');
        String source = multilineBuffer.toString();
        if (source.trim().isEmpty()) {
            multilineBuffer.setLength(0);
            return true;
        }

        ReadResult result = new FormReader(new Lexer(source, "<repl>", silentStream()), "<repl>").tryReadAll();
        if (result.hasError() && needsMoreInput(result.getError())) {
            return true;
        }
        multilineBuffer.setLength(0);

        if (result.hasError()) {
            err.println("语法错误: " + result.getError().getMessage());
            return true;
        }
        PrintConfig config = canonical ? PrintConfig.canonical() : new PrintConfig();
        for (Form form : result.getForms()) {
            out.println(printer.print(form, config));
        }
        return true;
    }

    /**
     * 未闭合的字面量、括号或缺少操作数的前缀符号在输入末尾时，等待下一行
     */
    static boolean needsMoreInput(ParseException e) {
        if (!e.isAtEndOfInput()) return false;
        return e.getKind() == SyntaxErrorKind.UNTERMINATED_LITERAL
                || e.getKind() == SyntaxErrorKind.UNBALANCED_DELIMITER
                || e.getKind() == SyntaxErrorKind.DANGLING_SIGIL;
    }

    // 续行期间的词法错误由 ReadResult 报告，不重复输出
    private static PrintStream silentStream() {
        return new PrintStream(new ByteArrayOutputStream(), true);
    }

    /**
     * 处理 REPL 命令
     *
     * @return true 继续循环，false 退出
     */
    private boolean handleReplCommand(String command) {
        if (":quit".equals(command) || ":q".equals(command) || ":exit".equals(command)) {
            return false;
        }

        if (":help".equals(command) || ":h".equals(command)) {
            printReplHelp();
            return true;
        }

        if (":clear".equals(command) || ":c".equals(command)) {
            out.print("\033[H\033[2J");
            out.flush();
            return true;
        }

        if (":version".equals(command)) {
            out.println("Lumi v" + VERSION);
            out.println("Java: " + System.getProperty("java.version"));
            return true;
        }

        if (":canonical".equals(command)) {
            canonical = !canonical;
            out.println(canonical ? "输出规范调用形式" : "输出缩写形式");
            return true;
        }

        out.println("未知命令: " + command);
        out.println("输入 :help 获取帮助");
        return true;
    }

    private void printBanner() {
        out.println("Lumi v" + VERSION + " - 读取/打印 REPL");
        out.println();
    }

    private void printReplHelp() {
        out.println("REPL 命令:");
        out.println("  :help, :h        显示此帮助");
        out.println("  :quit, :q, :exit 退出 REPL");
        out.println("  :clear, :c       清屏");
        out.println("  :version         显示版本");
        out.println("  :canonical       切换缩写/规范调用形式输出");
        out.println();
        out.println("示例:");
        out.println("  'x                 => 'x");
        out.println("  (quote x)          => 'x");
        out.println("  [coll key]         访问缩写");
        out.println("  \"a {b} c\"          模板字符串");
        out.println();
        out.println("提示:");
        out.println("  - 未闭合的括号或字符串会自动进入多行模式");
    }
}
