package com.lumilang.reader.form;

/**
 * Form 在源文本中覆盖的区间
 * <p>
 * 起点用行号、列号（均从 1 开始）和字符偏移表示，终点只记录偏移。
 * 复合形式的区间从开括号一直覆盖到闭括号；缩写展开后的形式从前缀符号覆盖到操作数末尾。
 * 位置不参与 Form 的结构相等比较。
 */
public final class SourceLocation {

    /** 手工构造的 Form 没有源码位置 */
    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0, 0, 0);

    private final String source;
    private final int line;
    private final int column;
    private final int start;
    private final int end;

    /**
     * @param source 来源名称（文件名、{@code <repl>} 等）
     * @param length 区间覆盖的字符数
     */
    public SourceLocation(String source, int line, int column, int offset, int length) {
        if (length < 0) {
            throw new IllegalArgumentException("Negative span length: " + length);
        }
        this.source = source;
        this.line = line;
        this.column = column;
        this.start = offset;
        this.end = offset + length;
    }

    public String getFile() {
        return source;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** 区间起点的字符偏移 */
    public int getOffset() {
        return start;
    }

    /** 区间终点（不含）的字符偏移 */
    public int getEndOffset() {
        return end;
    }

    public int getLength() {
        return end - start;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    /**
     * offset 是否落在区间内
     */
    public boolean contains(int offset) {
        return isKnown() && offset >= start && offset < end;
    }

    /**
     * 从本区间起点覆盖到 last 终点的区间；任一方未知时返回本区间
     */
    public SourceLocation extendTo(SourceLocation last) {
        if (!isKnown() || last == null || !last.isKnown() || last.end <= end) {
            return this;
        }
        return new SourceLocation(source, line, column, start, last.end - start);
    }

    /**
     * 截取 text 中本区间覆盖的源码，未知位置或越界时返回空串
     */
    public String excerpt(CharSequence text) {
        if (!isKnown() || end > text.length()) return "";
        return text.subSequence(start, end).toString();
    }

    @Override
    public String toString() {
        return source + ":" + line + ":" + column;
    }
}
