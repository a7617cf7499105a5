package com.lumilang.reader.form;

import com.lumilang.reader.lexer.Lexer;

/**
 * 符号原子
 */
public final class Symbol extends Atom {
    private final String name;

    public Symbol(String name) {
        this(name, SourceLocation.UNKNOWN);
    }

    /**
     * @throws IllegalArgumentException 名称无法被词法分析器读回同一个符号时
     */
    public Symbol(String name, SourceLocation location) {
        super(location);
        if (name == null || !Lexer.isValidSymbolName(name)) {
            throw new IllegalArgumentException("Invalid symbol name: " + name);
        }
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public Object getValue() {
        return name;
    }

    @Override
    public boolean isSymbol(String name) {
        return this.name.equals(name);
    }

    @Override
    public <R, C> R accept(FormVisitor<R, C> visitor, C context) {
        return visitor.visitSymbol(this, context);
    }

    @Override
    public String toString() {
        return name;
    }
}
