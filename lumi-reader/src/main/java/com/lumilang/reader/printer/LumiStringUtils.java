package com.lumilang.reader.printer;

/**
 * Lumi 源码字符串转义/反转义工具
 */
public final class LumiStringUtils {

    private LumiStringUtils() {}

    /**
     * 反转义：将转义字符标识符转为实际字符。
     * <p>给定反斜杠后面的字符（如 'n'），返回对应的实际字符（如 '\n'）。
     * Unicode 转义 (&#92;uXXXX) 由调用者自行处理。</p>
     *
     * @return 反转义后的字符，未识别的转义返回 -1
     */
    public static int unescapeChar(char c) {
        switch (c) {
            case 'n':  return '\n';
            case 'r':  return '\r';
            case 't':  return '\t';
            case '0':  return '\0';
            case '\\': return '\\';
            case '\'': return '\'';
            case '"':  return '"';
            default:   return -1;
        }
    }

    /**
     * 转义字符串内容（用于双引号包裹的字符串和模板分段）。
     * 花括号写成 {{ 和 }}，因为双引号字符串总是按模板文本扫描。
     */
    public static String escapeString(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '\0': sb.append("\\0"); break;
                case '{': sb.append("{{"); break;
                case '}': sb.append("}}"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * 加上双引号的字符串字面量
     */
    public static String quote(String s) {
        return "\"" + escapeString(s) + "\"";
    }
}
