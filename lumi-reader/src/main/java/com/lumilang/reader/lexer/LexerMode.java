package com.lumilang.reader.lexer;

/**
 * 词法分析模式
 */
public enum LexerMode {
    /** 代码模式：扫描 Form */
    CODE,
    /** 模板文本模式：扫描字符串字面量字符 */
    TEMPLATE_TEXT
}
