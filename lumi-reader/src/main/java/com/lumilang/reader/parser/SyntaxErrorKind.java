package com.lumilang.reader.parser;

/**
 * 语法错误类别
 */
public enum SyntaxErrorKind {
    /** 字符串、模板字符串或原始字符串没有闭合 */
    UNTERMINATED_LITERAL,
    /** 缺失或错配的 ) ] } */
    UNBALANCED_DELIMITER,
    /** 前缀符号后没有操作数 */
    DANGLING_SIGIL,
    /** 没有对应 { 的 } */
    UNEXPECTED_CLOSE_BRACE,
    /** 嵌套层数超过上限 */
    RECURSION_DEPTH_EXCEEDED,
    /** 无法识别的字符、无效转义或数字 */
    INVALID_TOKEN,
    /** 语法上不允许出现在此处的 token（空的 {}、多余输入等） */
    UNEXPECTED_TOKEN
}
