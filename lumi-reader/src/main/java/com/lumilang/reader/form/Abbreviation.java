package com.lumilang.reader.form;

import com.lumilang.reader.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 缩写表：表面语法与规范调用形式的对应关系
 *
 * <p>读取器按此表展开，打印器按此表收缩，两个方向共用同一份名称与形状规则。</p>
 */
public enum Abbreviation {
    QUOTE("quote", "'", TokenType.QUOTE, Shape.UNARY),
    BACKQUOTE("backquote", "`", TokenType.BACKQUOTE, Shape.UNARY),
    UNQUOTE("unquote", "~", TokenType.UNQUOTE, Shape.UNARY),
    SPLAY("splay", "..", TokenType.SPLAY, Shape.UNARY),
    ATSIGN("atsign", "@", TokenType.ATSIGN, Shape.UNARY),
    MET_NAME("met-name", ".", TokenType.DOT, Shape.UNARY),
    ACCESS("access", "[", TokenType.LBRACKET, Shape.ACCESS),
    TEMPLATE_STR("template-str", "\"", TokenType.STRING_OPEN, Shape.TEMPLATE);

    /**
     * 参数形状规则
     */
    public enum Shape {
        /** 恰好一个未展开的参数 */
        UNARY,
        /** 集合加至少一个键 */
        ACCESS,
        /** 字符串分段与嵌入 Form 严格交替，首尾均为分段；只有一个分段时等同普通字符串 */
        TEMPLATE
    }

    private static final Map<String, Abbreviation> BY_NAME;
    private static final Map<TokenType, Abbreviation> BY_TOKEN;

    static {
        Map<String, Abbreviation> byName = new HashMap<>();
        Map<TokenType, Abbreviation> byToken = new HashMap<>();
        for (Abbreviation abbrv : values()) {
            byName.put(abbrv.canonicalName, abbrv);
            byToken.put(abbrv.tokenType, abbrv);
        }
        BY_NAME = Collections.unmodifiableMap(byName);
        BY_TOKEN = Collections.unmodifiableMap(byToken);
    }

    private final String canonicalName;
    private final String prefix;
    private final TokenType tokenType;
    private final Shape shape;

    Abbreviation(String canonicalName, String prefix, TokenType tokenType, Shape shape) {
        this.canonicalName = canonicalName;
        this.prefix = prefix;
        this.tokenType = tokenType;
        this.shape = shape;
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    /**
     * 表面语法的起始文本（前缀符号、'[' 或 '"'）
     */
    public String getPrefix() {
        return prefix;
    }

    public TokenType getTokenType() {
        return tokenType;
    }

    public Shape getShape() {
        return shape;
    }

    public boolean isSigil() {
        return shape == Shape.UNARY;
    }

    /**
     * 按规范名称查找，未知名称返回 null
     */
    public static Abbreviation forName(String name) {
        return BY_NAME.get(name);
    }

    /**
     * 按引入该缩写的 token 类型查找，其余类型返回 null
     */
    public static Abbreviation forToken(TokenType type) {
        return BY_TOKEN.get(type);
    }

    /**
     * 查找 compound 可以收缩成的缩写；首元素不是规范名称或形状不符时返回 null
     */
    public static Abbreviation matching(Compound compound) {
        if (compound.isEmpty()) return null;
        Element head = compound.get(0);
        if (head.isSplayed() || !(head.getForm() instanceof Symbol)) return null;
        Abbreviation abbrv = BY_NAME.get(((Symbol) head.getForm()).getName());
        if (abbrv == null || !abbrv.matches(compound)) return null;
        return abbrv;
    }

    /**
     * compound 的首元素与参数形状是否符合本缩写
     */
    public boolean matches(Compound compound) {
        if (!compound.hasHead(canonicalName)) return false;
        List<Element> args = compound.getArguments();
        switch (shape) {
            case UNARY:
                return args.size() == 1 && !args.get(0).isSplayed();
            case ACCESS:
                return args.size() >= 2;
            case TEMPLATE:
                if (args.size() % 2 == 0) return false;
                for (int i = 0; i < args.size(); i++) {
                    Element arg = args.get(i);
                    if (arg.isSplayed()) return false;
                    if (i % 2 == 0 && !(arg.getForm() instanceof StringAtom)) return false;
                }
                return true;
            default:
                return false;
        }
    }

    /**
     * 展开一元缩写：{@code 'x} → {@code (quote x)}
     */
    public Compound expand(SourceLocation location, Form operand) {
        if (shape != Shape.UNARY) {
            throw new IllegalStateException(canonicalName + " is not a prefix abbreviation");
        }
        List<Element> elements = new ArrayList<>(2);
        elements.add(Element.of(new Symbol(canonicalName, location)));
        elements.add(Element.of(operand));
        return new Compound(location.extendTo(operand.getLocation()), elements);
    }

    /**
     * 展开多参数缩写：{@code [a b]} → {@code (access a b)}
     */
    public Compound expand(SourceLocation location, List<Element> arguments) {
        List<Element> elements = new ArrayList<>(arguments.size() + 1);
        elements.add(Element.of(new Symbol(canonicalName, location)));
        elements.addAll(arguments);
        return new Compound(location, elements);
    }
}
