package com.lumilang.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.lumilang.reader.form.Form;
import com.lumilang.reader.lexer.Lexer;
import com.lumilang.reader.parser.FormReader;
import com.lumilang.reader.parser.ParseException;
import com.lumilang.reader.printer.FormPrinter;
import com.lumilang.reader.printer.PrintConfig;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * 文件与表达式的读取/打印执行器，方法返回进程退出码
 */
public class SourceRunner {

    private final PrintStream out;
    private final PrintStream err;
    private final FormPrinter printer = new FormPrinter();

    public SourceRunner(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    /**
     * 格式化文件：每个顶层 Form 一行，输出到标准输出或写回文件
     */
    public int formatFile(String filePath, boolean canonical, boolean write) {
        Path path = Paths.get(filePath);
        String source = readSource(path);
        if (source == null) return 1;

        try {
            List<Form> forms = read(source, path.getFileName().toString());
            String formatted = format(forms, canonical);
            if (write) {
                Files.write(path, formatted.getBytes(StandardCharsets.UTF_8));
                out.println("已格式化: " + filePath);
            } else {
                out.print(formatted);
            }
            return 0;
        } catch (ParseException e) {
            err.println("语法错误: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("写入文件失败: " + e.getMessage());
            return 1;
        }
    }

    /**
     * 以 JSON 输出文件的 Form 树；语法错误时输出错误对象
     */
    public int dumpTree(String filePath, boolean pretty, boolean locations) {
        Path path = Paths.get(filePath);
        String source = readSource(path);
        if (source == null) return 1;

        GsonBuilder builder = new GsonBuilder().disableHtmlEscaping();
        if (pretty) {
            builder.setPrettyPrinting();
        }
        Gson gson = builder.create();
        try {
            List<Form> forms = read(source, path.getFileName().toString());
            out.println(gson.toJson(new FormJson(locations).toJson(forms)));
            return 0;
        } catch (ParseException e) {
            out.println(gson.toJson(FormJson.error(e)));
            return 1;
        }
    }

    /**
     * 读取表达式文本并输出打印结果，每个顶层 Form 一行
     */
    public int echo(String text, boolean canonical) {
        try {
            out.print(format(read(text, "<expr>"), canonical));
            return 0;
        } catch (ParseException e) {
            err.println("语法错误: " + e.getMessage());
            return 1;
        }
    }

    private List<Form> read(String source, String fileName) {
        return new FormReader(new Lexer(source, fileName, err), fileName).readAll();
    }

    private String format(List<Form> forms, boolean canonical) {
        PrintConfig config = canonical ? PrintConfig.canonical() : new PrintConfig();
        StringBuilder sb = new StringBuilder();
        for (Form form : forms) {
            sb.append(printer.print(form, config)).append('\n');
        }
        return sb.toString();
    }

    private String readSource(Path path) {
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + path);
            return null;
        }
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("读取文件失败: " + e.getMessage());
            return null;
        }
    }
}
