package com.lumilang.reader.lexer;

/**
 * Lumi 词法单元类型
 */
public enum TokenType {
    // === 分隔符 ===
    LPAREN,                 // (
    RPAREN,                 // )
    LBRACKET,               // [
    RBRACKET,               // ]

    // === 前缀符号（缩写） ===
    QUOTE,                  // '
    BACKQUOTE,              // `
    UNQUOTE,                // ~
    SPLAY,                  // ..
    ATSIGN,                 // @
    DOT,                    // .

    // === 原子 ===
    SYMBOL,
    NUMBER,
    RAW_STRING,             // r"..." / r#"..."#

    // === 字符串/模板字符串 ===
    STRING_OPEN,            // 开引号 "
    STRING_CHUNK,           // 字面量字符片段
    STRING_CLOSE,           // 闭引号 "
    TEMPLATE_BRACE_OPEN,    // 模板内的 {
    TEMPLATE_BRACE_CLOSE,   // 模板内的 }

    // === 特殊 ===
    EOF,
    ERROR;

    /**
     * 是否为闭合分隔符（不能作为 Form 的开头）
     */
    public boolean isCloser() {
        switch (this) {
            case RPAREN:
            case RBRACKET:
            case TEMPLATE_BRACE_CLOSE:
                return true;
            default:
                return false;
        }
    }
}
