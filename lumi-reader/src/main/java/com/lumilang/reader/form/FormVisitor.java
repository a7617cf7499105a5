package com.lumilang.reader.form;

/**
 * 语法树访问者
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface FormVisitor<R, C> {

    R visitSymbol(Symbol node, C context);

    R visitNumber(NumberAtom node, C context);

    R visitString(StringAtom node, C context);

    R visitCompound(Compound node, C context);
}
