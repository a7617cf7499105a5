package com.lumilang.reader.lexer;

import com.lumilang.reader.parser.SyntaxErrorKind;
import com.lumilang.reader.printer.LumiStringUtils;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Lumi 词法分析器
 *
 * <p>按需产出 token（{@link #nextToken()}）。内部维护模式栈：栈顶为 {@link LexerMode#CODE}
 * 时扫描 Form，为 {@link LexerMode#TEMPLATE_TEXT} 时扫描字符串字面量字符。
 * {@code "} 压入模板文本模式，模板内的 {@code {} 压入代码模式，对应的 {@code }} 与
 * {@code "} 弹出，因此 {@code {...}} 中嵌套的模板字符串各自独立进出模式。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final PrintStream errStream;

    private final Deque<LexerMode> modes = new ArrayDeque<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    public Lexer(String source, String fileName) {
        this(source, fileName, System.err);
    }

    public Lexer(String source, String fileName, PrintStream errStream) {
        this.source = source;
        this.fileName = fileName;
        this.errStream = errStream;
        modes.push(LexerMode.CODE);
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 当前模式（模式栈栈顶）
     */
    public LexerMode getMode() {
        return modes.peek();
    }

    /**
     * 模式栈深度，顶层代码模式为 1
     */
    public int getModeDepth() {
        return modes.size();
    }

    /**
     * 获取下一个 Token（流式接口）
     *
     * @return 下一个 Token；输入结束时返回 EOF，出错时返回 ERROR
     */
    public Token nextToken() {
        if (modes.peek() == LexerMode.TEMPLATE_TEXT) {
            markStart();
            return scanTemplateText();
        }

        skipWhitespaceAndComments();
        markStart();

        if (isAtEnd()) {
            return makeToken(TokenType.EOF, null);
        }
        return scanToken();
    }

    /**
     * 一次性扫描全部 token（含末尾的 EOF 或 ERROR），供测试和工具使用
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            Token token = nextToken();
            tokens.add(token);
            if (token.isOneOf(TokenType.EOF, TokenType.ERROR)) {
                return tokens;
            }
        }
    }

    // === 代码模式 ===

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t') {
                advance();
            } else if (c == '\n') {
                advance();
                newLine();
            } else if (c == ';') {
                // 单行注释
                while (peek() != '\n' && !isAtEnd()) advance();
            } else {
                break;
            }
        }
    }

    private Token scanToken() {
        char c = advance();
        switch (c) {
            case '(': return makeToken(TokenType.LPAREN, null);
            case ')': return makeToken(TokenType.RPAREN, null);
            case '[': return makeToken(TokenType.LBRACKET, null);
            case ']': return makeToken(TokenType.RBRACKET, null);

            // 前缀符号
            case '\'': return makeToken(TokenType.QUOTE, null);
            case '`': return makeToken(TokenType.BACKQUOTE, null);
            case '~': return makeToken(TokenType.UNQUOTE, null);
            case '@': return makeToken(TokenType.ATSIGN, null);
            case '.':
                return makeToken(match('.') ? TokenType.SPLAY : TokenType.DOT, null);

            case '"':
                modes.push(LexerMode.TEMPLATE_TEXT);
                return makeToken(TokenType.STRING_OPEN, null);

            case '{':
                return error(SyntaxErrorKind.INVALID_TOKEN,
                        "'{' is only allowed inside a template string");

            case '}':
                // 栈中除底层代码模式外还有帧，说明处于模板的 {...} 内
                if (modes.size() > 1) {
                    modes.pop();
                    return makeToken(TokenType.TEMPLATE_BRACE_CLOSE, null);
                }
                return error(SyntaxErrorKind.UNEXPECTED_CLOSE_BRACE, "Unmatched '}'");

            case 'r':
                if (isRawStringStart()) {
                    return rawString();
                }
                return symbol();

            default:
                if (isDigit(c) || ((c == '+' || c == '-') && isDigit(peek()))) {
                    return number();
                }
                if (isSymbolStart(c)) {
                    return symbol();
                }
                return error(SyntaxErrorKind.INVALID_TOKEN, "Unexpected character: " + c);
        }
    }

    private Token symbol() {
        while (!isAtEnd() && isSymbolPart(peek())) advance();
        return makeToken(TokenType.SYMBOL, null);
    }

    /**
     * 数字：可选符号、整数部分、可选小数部分和指数部分。
     * 先按符号字符贪婪扫描，再整体校验，避免 "1a" 被拆成数字和符号。
     */
    private Token number() {
        while (!isAtEnd() && isSymbolPart(peek())) advance();
        String text = source.substring(start, current);
        if (!text.matches("[+-]?[0-9]+(\\.[0-9]+)?([eE][+-]?[0-9]+)?")) {
            return error(SyntaxErrorKind.INVALID_TOKEN, "Invalid number literal: " + text);
        }
        boolean floating = text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0;
        try {
            if (floating) {
                double value = Double.parseDouble(text);
                if (Double.isInfinite(value)) {
                    return error(SyntaxErrorKind.INVALID_TOKEN, "Float literal out of range: " + text);
                }
                return makeToken(TokenType.NUMBER, value);
            }
            return makeToken(TokenType.NUMBER, Long.parseLong(text.startsWith("+") ? text.substring(1) : text));
        } catch (NumberFormatException e) {
            return error(SyntaxErrorKind.INVALID_TOKEN, "Integer literal out of range: " + text);
        }
    }

    /**
     * 已消费 'r'，判断后面是否为 {@code "} 或 {@code #...#"}
     */
    private boolean isRawStringStart() {
        int i = current;
        while (i < source.length() && source.charAt(i) == '#') i++;
        return i < source.length() && source.charAt(i) == '"';
    }

    /**
     * 原始字符串 r"..." / r#"..."#，花括号与反斜杠都按字面处理
     */
    private Token rawString() {
        int hashes = 0;
        while (match('#')) hashes++;
        advance(); // 开引号

        int contentStart = current;
        while (!isAtEnd()) {
            if (peek() == '"' && closesRawString(hashes)) {
                String value = source.substring(contentStart, current);
                advance(); // 闭引号
                for (int i = 0; i < hashes; i++) advance();
                return makeToken(TokenType.RAW_STRING, value);
            }
            if (advance() == '\n') newLine();
        }
        markStart();
        return error(SyntaxErrorKind.UNTERMINATED_LITERAL, "Unterminated raw string");
    }

    private boolean closesRawString(int hashes) {
        for (int i = 1; i <= hashes; i++) {
            int index = current + i;
            if (index >= source.length() || source.charAt(index) != '#') return false;
        }
        return true;
    }

    // === 模板文本模式 ===

    private Token scanTemplateText() {
        if (isAtEnd()) {
            return error(SyntaxErrorKind.UNTERMINATED_LITERAL, "Unterminated string literal");
        }

        char c = peek();
        if (c == '"') {
            advance();
            modes.pop();
            return makeToken(TokenType.STRING_CLOSE, null);
        }
        if (c == '{' && peekNext() != '{') {
            advance();
            modes.push(LexerMode.CODE);
            return makeToken(TokenType.TEMPLATE_BRACE_OPEN, null);
        }
        if (c == '}' && peekNext() != '}') {
            advance();
            return error(SyntaxErrorKind.UNEXPECTED_CLOSE_BRACE,
                    "Unmatched '}' in template string (write '}}' for a literal brace)");
        }

        StringBuilder value = new StringBuilder();
        while (!isAtEnd()) {
            c = peek();
            if (c == '"') break;
            if (c == '{' || c == '}') {
                if (peekNext() != c) break;
                // {{ 和 }} 是转义的花括号
                advance();
                advance();
                value.append(c);
            } else if (c == '\\') {
                int escapeStart = current;
                int escapeLine = line;
                int escapeColumn = column;
                advance();
                int unescaped = escapeChar();
                if (unescaped < 0) {
                    start = escapeStart;
                    startLine = escapeLine;
                    startColumn = escapeColumn;
                    return error(SyntaxErrorKind.INVALID_TOKEN, "Invalid escape sequence");
                }
                value.append((char) unescaped);
            } else {
                advance();
                if (c == '\n') newLine();
                value.append(c);
            }
        }
        return makeToken(TokenType.STRING_CHUNK, value.toString());
    }

    /**
     * 已消费反斜杠，返回转义结果；无效转义返回 -1
     */
    private int escapeChar() {
        if (isAtEnd()) return -1;
        char c = advance();
        if (c == 'u') {
            if (current + 4 > source.length()) return -1;
            // 恰好四位十六进制数字，不接受符号
            int value = 0;
            for (int i = 0; i < 4; i++) {
                char ch = source.charAt(current + i);
                int digit = Character.digit(ch, 16);
                if (digit < 0 || ch > 'f') return -1;
                value = value * 16 + digit;
            }
            for (int i = 0; i < 4; i++) advance();
            return value;
        }
        return LumiStringUtils.unescapeChar(c);
    }

    // === 字符分类 ===

    private static final String SYMBOL_PUNCTUATION = "!$%&*+-/:<=>?^_|#";

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    /**
     * 符号首字符：字母或 {@code ! $ % & * + - / : < = > ? ^ _ | #}
     */
    public static boolean isSymbolStart(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               SYMBOL_PUNCTUATION.indexOf(c) >= 0 ||
               Character.isLetter(c);
    }

    /**
     * 符号后续字符：首字符集合加数字和 '.'
     */
    public static boolean isSymbolPart(char c) {
        return isSymbolStart(c) || isDigit(c) || c == '.';
    }

    /**
     * name 是否会被词法分析为恰好一个同名 SYMBOL token
     */
    public static boolean isValidSymbolName(String name) {
        if (name.isEmpty() || !isSymbolStart(name.charAt(0))) return false;
        char first = name.charAt(0);
        if ((first == '+' || first == '-') && name.length() > 1 && isDigit(name.charAt(1))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            if (!isSymbolPart(name.charAt(i))) return false;
        }
        return true;
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private void markStart() {
        start = current;
        startLine = line;
        startColumn = column;
    }

    // === Token 构建 ===

    private Token makeToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        return new Token(type, lexeme, literal, startLine, startColumn, start);
    }

    private Token error(SyntaxErrorKind kind, String message) {
        String errorMsg = String.format("[%s:%d:%d] Lexer error: %s",
                fileName, startLine, startColumn, message);
        errStream.println(errorMsg);
        return Token.error(kind, message, source.substring(start, current), startLine, startColumn, start);
    }
}
