package com.lumilang.reader.parser;

import com.lumilang.reader.lexer.Token;
import com.lumilang.reader.lexer.TokenType;

/**
 * 解析异常
 *
 * <p>携带错误类别和检测到错误时所在的 token。一次读取调用遇到它即失败，不返回部分语法树。</p>
 */
public class ParseException extends RuntimeException {
    private final SyntaxErrorKind kind;
    private final Token token;
    private final String expected;
    private final boolean atEndOfInput;

    public ParseException(SyntaxErrorKind kind, String message, Token token) {
        this(kind, message, token, null);
    }

    public ParseException(SyntaxErrorKind kind, String message, Token token, String expected) {
        this(kind, message, token, expected, false);
    }

    /**
     * @param atEndOfInput 报告位置不在输入末尾、但错误由输入提前结束引起时为 true
     */
    public ParseException(SyntaxErrorKind kind, String message, Token token, String expected,
                          boolean atEndOfInput) {
        super(message);
        this.kind = kind;
        this.token = token;
        this.expected = expected;
        this.atEndOfInput = atEndOfInput;
    }

    public SyntaxErrorKind getKind() {
        return kind;
    }

    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    public int getLine() {
        return token != null ? token.getLine() : 0;
    }

    public int getColumn() {
        return token != null ? token.getColumn() : 0;
    }

    public int getOffset() {
        return token != null ? token.getOffset() : 0;
    }

    /**
     * 错误是否发生在输入末尾（REPL 据此判断是否继续读入下一行）。
     * 未闭合的字面量总是在读到输入末尾时才能确定。
     */
    public boolean isAtEndOfInput() {
        if (atEndOfInput || kind == SyntaxErrorKind.UNTERMINATED_LITERAL) {
            return true;
        }
        return token != null && token.getType() == TokenType.EOF;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (token != null) {
            sb.append(" at line ").append(token.getLine());
            sb.append(", column ").append(token.getColumn());
            if (token.getType() == TokenType.EOF || token.getLexeme().isEmpty()) {
                sb.append(" (found end of input)");
            } else {
                sb.append(" (found '").append(token.getLexeme()).append("')");
            }
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
