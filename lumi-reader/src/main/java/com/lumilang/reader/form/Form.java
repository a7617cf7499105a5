package com.lumilang.reader.form;

/**
 * 语法树节点基类
 *
 * <p>Form 构造后不可变。{@link #equals(Object)} 比较结构（形状、原子值、展开标记、模板分段），
 * 不比较源码位置。</p>
 */
public abstract class Form {
    protected final SourceLocation location;

    protected Form(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public abstract <R, C> R accept(FormVisitor<R, C> visitor, C context);

    /**
     * 是否为给定名称的符号
     */
    public boolean isSymbol(String name) {
        return false;
    }
}
