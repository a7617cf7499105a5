package com.lumilang.reader.form;

/**
 * 字符串原子（普通字符串、原始字符串，以及模板字符串中的字面量分段）
 */
public final class StringAtom extends Atom {
    private final String value;

    public StringAtom(String value) {
        this(value, SourceLocation.UNKNOWN);
    }

    public StringAtom(String value, SourceLocation location) {
        super(location);
        if (value == null) {
            throw new IllegalArgumentException("String value must not be null");
        }
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(FormVisitor<R, C> visitor, C context) {
        return visitor.visitString(this, context);
    }

    @Override
    public String toString() {
        return "\"" + value + "\"";
    }
}
