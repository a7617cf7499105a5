package com.lumilang.reader.printer;

/**
 * 打印上下文，跟踪输出缓冲区和嵌套深度
 */
public class PrinterContext {
    private final StringBuilder output = new StringBuilder();
    private final PrintConfig config;
    private int depth = 0;

    public PrinterContext(PrintConfig config) {
        this.config = config;
    }

    public PrintConfig getConfig() {
        return config;
    }

    /**
     * 进入一层复合形式
     *
     * @throws IllegalStateException 超过配置的最大深度
     */
    public void enter() {
        if (++depth > config.getMaxDepth()) {
            throw new IllegalStateException("Form nested deeper than " + config.getMaxDepth() + " levels");
        }
    }

    public void exit() {
        if (depth > 0) {
            depth--;
        }
    }

    public void append(String text) {
        output.append(text);
    }

    public void append(char c) {
        output.append(c);
    }

    public void space() {
        output.append(' ');
    }

    /**
     * 获取当前输出
     */
    public String getOutput() {
        return output.toString();
    }
}
