package com.lumilang.reader.printer;

/**
 * 打印配置
 */
public class PrintConfig {
    public static final int DEFAULT_MAX_DEPTH = 1024;

    private boolean abbreviate = true;
    private int maxDepth = DEFAULT_MAX_DEPTH;

    public PrintConfig() {
    }

    /**
     * 只输出规范调用形式、不使用任何缩写的配置
     */
    public static PrintConfig canonical() {
        PrintConfig config = new PrintConfig();
        config.setAbbreviate(false);
        return config;
    }

    public boolean isAbbreviate() {
        return abbreviate;
    }

    public void setAbbreviate(boolean abbreviate) {
        this.abbreviate = abbreviate;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }
}
