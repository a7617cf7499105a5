package com.lumilang.reader.lexer;

import com.lumilang.reader.form.SourceLocation;
import com.lumilang.reader.parser.SyntaxErrorKind;

/**
 * 词法单元
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int line;
    private final int column;
    private final int offset;
    private final SyntaxErrorKind errorKind;

    public Token(TokenType type, String lexeme, Object literal, int line, int column, int offset) {
        this(type, lexeme, literal, line, column, offset, null);
    }

    private Token(TokenType type, String lexeme, Object literal, int line, int column, int offset,
                  SyntaxErrorKind errorKind) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.errorKind = errorKind;
    }

    /**
     * 构造 ERROR token，字面量为错误信息
     */
    public static Token error(SyntaxErrorKind kind, String message, String lexeme,
                              int line, int column, int offset) {
        return new Token(TokenType.ERROR, lexeme, message, line, column, offset, kind);
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    /**
     * 字面量载荷：NUMBER 为 Long/Double，STRING_CHUNK/RAW_STRING 为反转义后的文本，ERROR 为错误信息
     */
    public Object getLiteral() {
        return literal;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    /**
     * ERROR token 的错误类别，其他 token 为 null
     */
    public SyntaxErrorKind getErrorKind() {
        return errorKind;
    }

    /**
     * 该 token 覆盖的源码范围
     */
    public SourceLocation toLocation(String file) {
        return new SourceLocation(file, line, column, offset, lexeme.length());
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType t : types) {
            if (this.type == t) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        if (literal != null) {
            return String.format("%s(%s, %s) at %d:%d",
                    type, lexeme, literal, line, column);
        }
        return String.format("%s(%s) at %d:%d",
                type, lexeme, line, column);
    }
}
