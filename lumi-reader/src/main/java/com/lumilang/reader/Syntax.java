package com.lumilang.reader;

import com.lumilang.reader.form.Form;
import com.lumilang.reader.lexer.Lexer;
import com.lumilang.reader.parser.FormReader;
import com.lumilang.reader.parser.ReadResult;
import com.lumilang.reader.printer.FormPrinter;
import com.lumilang.reader.printer.PrintConfig;

import java.util.List;

/**
 * 读取/打印入口
 *
 * <pre>{@code
 * Form form = Syntax.read("(f a ..b)");
 * String text = Syntax.print(form);      // (f a ..b)
 * Syntax.printCanonical(Syntax.read("'x")); // (quote x)
 * }</pre>
 */
public final class Syntax {

    private static final String DEFAULT_FILE = "<input>";
    private static final FormPrinter PRINTER = new FormPrinter();

    private Syntax() {}

    /**
     * 读取恰好一个 Form
     *
     * @throws com.lumilang.reader.parser.ParseException 语法错误、空输入或多余输入
     */
    public static Form read(String source) {
        return newReader(source).readSingle();
    }

    /**
     * 读取全部顶层 Form
     */
    public static List<Form> readAll(String source) {
        return newReader(source).readAll();
    }

    /**
     * 读取全部顶层 Form，失败时返回带错误的结果
     */
    public static ReadResult tryReadAll(String source) {
        return newReader(source).tryReadAll();
    }

    /**
     * 打印 Form，尽可能使用缩写
     */
    public static String print(Form form) {
        return PRINTER.print(form);
    }

    /**
     * 打印 Form，全部使用规范调用形式
     */
    public static String printCanonical(Form form) {
        return PRINTER.print(form, PrintConfig.canonical());
    }

    private static FormReader newReader(String source) {
        return new FormReader(new Lexer(source, DEFAULT_FILE), DEFAULT_FILE);
    }
}
