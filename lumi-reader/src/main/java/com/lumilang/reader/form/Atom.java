package com.lumilang.reader.form;

/**
 * 原子：符号、数字或字符串
 */
public abstract class Atom extends Form {

    protected Atom(SourceLocation location) {
        super(location);
    }

    /**
     * 原子的载荷值（符号名、Long/Double、字符串内容）
     */
    public abstract Object getValue();

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return getValue().equals(((Atom) o).getValue());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode() * 31 + getValue().hashCode();
    }
}
