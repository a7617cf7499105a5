package com.lumilang.reader.parser;

import com.lumilang.reader.form.Abbreviation;
import com.lumilang.reader.form.Compound;
import com.lumilang.reader.form.Element;
import com.lumilang.reader.form.Form;
import com.lumilang.reader.form.NumberAtom;
import com.lumilang.reader.form.SourceLocation;
import com.lumilang.reader.form.StringAtom;
import com.lumilang.reader.form.Symbol;
import com.lumilang.reader.lexer.Lexer;
import com.lumilang.reader.lexer.Token;
import com.lumilang.reader.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.lumilang.reader.lexer.TokenType.*;

/**
 * Lumi 读取器（递归下降）
 *
 * <p>从词法分析器按需取 token，把每个缩写展开为规范调用形式。{@code ..x} 的含义取决于位置：
 * 直接位于 {@code (...)} 或 {@code [...]} 中时是元素的展开标记，其他位置是 {@code (splay x)}。</p>
 *
 * <p>只向前看一个 token：词法分析器在产出 {@code "}、{@code {}、{@code }} 时切换模式，
 * 读取器按顺序消费即可保持两者同步。</p>
 */
public class FormReader {

    public static final int DEFAULT_MAX_DEPTH = 512;

    private final Lexer lexer;
    private final String fileName;
    private Token current;
    private Token previous;

    private int maxDepth = DEFAULT_MAX_DEPTH;
    private int depth;

    public FormReader(Lexer lexer, String fileName) {
        this.lexer = lexer;
        this.fileName = fileName;
    }

    public FormReader(Lexer lexer) {
        this(lexer, lexer.getFileName());
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * 设置最大嵌套深度，超过时报告 {@link SyntaxErrorKind#RECURSION_DEPTH_EXCEEDED}
     */
    public void setMaxDepth(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    // ============ 读取入口 ============

    /**
     * 读取下一个顶层 Form
     *
     * @return 下一个 Form，输入结束时返回 null
     * @throws ParseException 语法错误
     */
    public Form read() {
        start();
        failOnLexError();
        if (check(EOF)) {
            return null;
        }
        return parseForm();
    }

    /**
     * 读取全部顶层 Form
     */
    public List<Form> readAll() {
        List<Form> forms = new ArrayList<Form>();
        Form form;
        while ((form = read()) != null) {
            forms.add(form);
        }
        return forms;
    }

    /**
     * 读取恰好一个 Form，输入为空或之后还有内容时报错
     */
    public Form readSingle() {
        Form form = read();
        if (form == null) {
            throw new ParseException(SyntaxErrorKind.UNEXPECTED_TOKEN, "Expected a form", current);
        }
        failOnLexError();
        if (current.getType().isCloser()) {
            throw new ParseException(SyntaxErrorKind.UNBALANCED_DELIMITER,
                    "Unexpected '" + current.getLexeme() + "'", current, "end of input");
        }
        if (!check(EOF)) {
            throw new ParseException(SyntaxErrorKind.UNEXPECTED_TOKEN,
                    "Unexpected input after form", current, "end of input");
        }
        return form;
    }

    /**
     * 读取全部顶层 Form，语法错误以结果对象返回而不是抛出
     */
    public ReadResult tryReadAll() {
        try {
            return ReadResult.success(readAll());
        } catch (ParseException e) {
            return ReadResult.failure(e);
        }
    }

    // ============ 基础方法 ============

    private void start() {
        if (current == null) {
            advance();
        }
    }

    private Token advance() {
        previous = current;
        current = lexer.nextToken();
        return previous;
    }

    private boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 当前 token 是词法错误时抛出对应的解析异常
     */
    private void failOnLexError() {
        if (check(ERROR)) {
            throw new ParseException(current.getErrorKind(), (String) current.getLiteral(), current);
        }
    }

    private SourceLocation location(Token token) {
        return token.toLocation(fileName);
    }

    private void enter() {
        if (++depth > maxDepth) {
            throw new ParseException(SyntaxErrorKind.RECURSION_DEPTH_EXCEEDED,
                    "Forms nested deeper than " + maxDepth + " levels", current);
        }
    }

    // ============ Form 解析 ============

    /**
     * 解析一个普通位置上的 Form（splay 符号展开为 {@code (splay x)}）
     */
    private Form parseForm() {
        enter();
        try {
            failOnLexError();
            Token token = current;
            switch (token.getType()) {
                case SYMBOL:
                    advance();
                    return new Symbol(token.getLexeme(), location(token));
                case NUMBER:
                    advance();
                    return new NumberAtom((Number) token.getLiteral(), location(token));
                case RAW_STRING:
                    advance();
                    return new StringAtom((String) token.getLiteral(), location(token));
                case STRING_OPEN:
                    return parseString();
                case LPAREN:
                    return parseList();
                case LBRACKET:
                    return parseAccess();
                case QUOTE:
                case BACKQUOTE:
                case UNQUOTE:
                case SPLAY:
                case ATSIGN:
                case DOT:
                    return parseSigil();
                case RPAREN:
                case RBRACKET:
                case TEMPLATE_BRACE_CLOSE:
                    throw new ParseException(SyntaxErrorKind.UNBALANCED_DELIMITER,
                            "Unexpected '" + token.getLexeme() + "'", token);
                default:
                    throw new ParseException(SyntaxErrorKind.UNEXPECTED_TOKEN, "Expected a form", token);
            }
        } finally {
            depth--;
        }
    }

    /**
     * 参数列表中的一个元素：{@code ..x} 记为带展开标记的 x
     */
    private Element parseElement() {
        if (check(SPLAY)) {
            Token sigil = advance();
            return Element.splayed(parseOperand(sigil));
        }
        return Element.of(parseForm());
    }

    /**
     * 前缀符号：{@code 'x} → {@code (quote x)}
     */
    private Form parseSigil() {
        Token sigil = advance();
        Abbreviation abbrv = Abbreviation.forToken(sigil.getType());
        Form operand = parseOperand(sigil);
        return abbrv.expand(location(sigil), operand);
    }

    /**
     * 前缀符号的操作数：恰好一个 Form
     */
    private Form parseOperand(Token sigil) {
        failOnLexError();
        if (check(EOF)) {
            // 输入在前缀符号之后结束，补上后续输入即可继续
            throw new ParseException(SyntaxErrorKind.DANGLING_SIGIL,
                    "'" + sigil.getLexeme() + "' must be followed by a form", sigil, null, true);
        }
        if (current.getType().isCloser()) {
            throw new ParseException(SyntaxErrorKind.DANGLING_SIGIL,
                    "'" + sigil.getLexeme() + "' must be followed by a form", sigil);
        }
        return parseForm();
    }

    private Form parseList() {
        Token open = advance();
        List<Element> elements = parseElements(open, RPAREN, ")");
        Token close = advance();
        return new Compound(location(open).extendTo(location(close)), elements);
    }

    /**
     * {@code [coll key ...]} → {@code (access coll key ...)}
     */
    private Form parseAccess() {
        Token open = advance();
        List<Element> arguments = parseElements(open, RBRACKET, "]");
        Token close = advance();
        return Abbreviation.ACCESS.expand(location(open).extendTo(location(close)), arguments);
    }

    private List<Element> parseElements(Token open, TokenType closer, String closerText) {
        List<Element> elements = new ArrayList<Element>();
        while (true) {
            failOnLexError();
            if (check(closer)) {
                return elements;
            }
            if (check(EOF)) {
                throw new ParseException(SyntaxErrorKind.UNBALANCED_DELIMITER,
                        "Unclosed '" + open.getLexeme() + "' opened at line " + open.getLine()
                                + ", column " + open.getColumn(),
                        current, "'" + closerText + "'");
            }
            if (current.getType().isCloser()) {
                throw new ParseException(SyntaxErrorKind.UNBALANCED_DELIMITER,
                        "Mismatched '" + current.getLexeme() + "'", current, "'" + closerText + "'");
            }
            elements.add(parseElement());
        }
    }

    // ============ 字符串与模板字符串 ============

    /**
     * 没有嵌入 Form 的字符串读为 {@link StringAtom}；否则读为
     * {@code (template-str seg form seg ... seg)}，字符串分段与嵌入 Form 严格交替，空分段也保留
     */
    private Form parseString() {
        Token open = advance();
        List<Element> parts = new ArrayList<Element>();
        StringBuilder segment = new StringBuilder();
        SourceLocation segmentLocation = location(current);

        while (true) {
            failOnLexError();
            switch (current.getType()) {
                case STRING_CHUNK:
                    segment.append((String) current.getLiteral());
                    advance();
                    break;
                case TEMPLATE_BRACE_OPEN:
                    parts.add(Element.of(new StringAtom(segment.toString(), segmentLocation)));
                    segment.setLength(0);
                    parts.add(Element.of(parseTemplateSlot(advance())));
                    segmentLocation = location(current);
                    break;
                case STRING_CLOSE: {
                    Token close = advance();
                    SourceLocation whole = location(open).extendTo(location(close));
                    if (parts.isEmpty()) {
                        return new StringAtom(segment.toString(), whole);
                    }
                    parts.add(Element.of(new StringAtom(segment.toString(), segmentLocation)));
                    return Abbreviation.TEMPLATE_STR.expand(whole, parts);
                }
                default:
                    throw new ParseException(SyntaxErrorKind.UNEXPECTED_TOKEN,
                            "Unexpected token in string literal", current);
            }
        }
    }

    /**
     * 模板中 {@code {...}} 内的恰好一个 Form
     */
    private Form parseTemplateSlot(Token brace) {
        failOnLexError();
        if (check(TEMPLATE_BRACE_CLOSE)) {
            throw new ParseException(SyntaxErrorKind.UNEXPECTED_TOKEN,
                    "Empty '{}' in template string (write '{{}}' for literal braces)", current);
        }
        if (check(EOF)) {
            throw new ParseException(SyntaxErrorKind.UNBALANCED_DELIMITER,
                    "Unclosed '{' opened at line " + brace.getLine() + ", column " + brace.getColumn(),
                    current, "'}'");
        }
        Form form = parseForm();
        failOnLexError();
        if (check(EOF)) {
            throw new ParseException(SyntaxErrorKind.UNBALANCED_DELIMITER,
                    "Unclosed '{' opened at line " + brace.getLine() + ", column " + brace.getColumn(),
                    current, "'}'");
        }
        if (current.getType().isCloser() && !check(TEMPLATE_BRACE_CLOSE)) {
            throw new ParseException(SyntaxErrorKind.UNBALANCED_DELIMITER,
                    "Mismatched '" + current.getLexeme() + "'", current, "'}'");
        }
        if (!check(TEMPLATE_BRACE_CLOSE)) {
            throw new ParseException(SyntaxErrorKind.UNEXPECTED_TOKEN,
                    "Template slot holds more than one form", current, "'}'");
        }
        advance();
        return form;
    }
}
