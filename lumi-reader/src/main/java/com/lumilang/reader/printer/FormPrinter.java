package com.lumilang.reader.printer;

import com.lumilang.reader.form.Abbreviation;
import com.lumilang.reader.form.Compound;
import com.lumilang.reader.form.Element;
import com.lumilang.reader.form.Form;
import com.lumilang.reader.form.FormVisitor;
import com.lumilang.reader.form.NumberAtom;
import com.lumilang.reader.form.StringAtom;
import com.lumilang.reader.form.Symbol;

import java.util.List;

/**
 * Lumi 语法树打印器
 *
 * <p>遍历 Form 树输出源码。形状符合 {@link Abbreviation} 的复合形式输出缩写，其余输出
 * {@code (name arg ...)}。输出文本经 {@link com.lumilang.reader.parser.FormReader} 读回后
 * 与原树结构相等。</p>
 */
public class FormPrinter implements FormVisitor<Void, PrinterContext> {

    /**
     * 打印 Form
     */
    public String print(Form form, PrintConfig config) {
        PrinterContext ctx = new PrinterContext(config);
        form.accept(this, ctx);
        return ctx.getOutput();
    }

    /**
     * 使用默认配置（启用缩写）打印
     */
    public String print(Form form) {
        return print(form, new PrintConfig());
    }

    // ============ 原子 ============

    @Override
    public Void visitSymbol(Symbol node, PrinterContext ctx) {
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitNumber(NumberAtom node, PrinterContext ctx) {
        // Double.toString 总带小数点或指数，读回仍是浮点数
        ctx.append(node.getValue().toString());
        return null;
    }

    @Override
    public Void visitString(StringAtom node, PrinterContext ctx) {
        ctx.append(LumiStringUtils.quote(node.getValue()));
        return null;
    }

    // ============ 复合形式 ============

    @Override
    public Void visitCompound(Compound node, PrinterContext ctx) {
        ctx.enter();
        try {
            Abbreviation abbrv = ctx.getConfig().isAbbreviate() ? Abbreviation.matching(node) : null;
            if (abbrv == null) {
                formatCall(node, ctx);
                return null;
            }
            switch (abbrv.getShape()) {
                case UNARY:
                    formatSigil(abbrv, node.getArguments().get(0).getForm(), ctx);
                    break;
                case ACCESS:
                    ctx.append('[');
                    formatElements(node.getArguments(), ctx);
                    ctx.append(']');
                    break;
                case TEMPLATE:
                    formatTemplate(node.getArguments(), ctx);
                    break;
                default:
                    formatCall(node, ctx);
            }
            return null;
        } finally {
            ctx.exit();
        }
    }

    private void formatCall(Compound node, PrinterContext ctx) {
        ctx.append('(');
        formatElements(node.getElements(), ctx);
        ctx.append(')');
    }

    private void formatElements(List<Element> elements, PrinterContext ctx) {
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                ctx.space();
            }
            formatElement(elements.get(i), ctx);
        }
    }

    /**
     * 参数列表中的元素：展开标记输出为 ..x；
     * 未标记的 (splay x) 必须保持调用形式，否则读回时会变成标记
     */
    private void formatElement(Element element, PrinterContext ctx) {
        Form form = element.getForm();
        if (element.isSplayed()) {
            ctx.append(Abbreviation.SPLAY.getPrefix());
            form.accept(this, ctx);
        } else if (form instanceof Compound && Abbreviation.SPLAY.matches((Compound) form)) {
            ctx.enter();
            try {
                formatCall((Compound) form, ctx);
            } finally {
                ctx.exit();
            }
        } else {
            form.accept(this, ctx);
        }
    }

    private void formatSigil(Abbreviation abbrv, Form operand, PrinterContext ctx) {
        ctx.append(abbrv.getPrefix());
        // ". .x" 中的空格防止两个点被合并成 ..
        if (abbrv == Abbreviation.MET_NAME && startsWithDot(operand, ctx)) {
            ctx.space();
        }
        operand.accept(this, ctx);
    }

    private boolean startsWithDot(Form form, PrinterContext ctx) {
        if (!(form instanceof Compound) || !ctx.getConfig().isAbbreviate()) {
            return false;
        }
        Abbreviation abbrv = Abbreviation.matching((Compound) form);
        return abbrv == Abbreviation.MET_NAME || abbrv == Abbreviation.SPLAY;
    }

    /**
     * 偶数位置是字符串分段（转义并加倍花括号），奇数位置是嵌入的 Form。
     * 单分段的 (template-str "s") 与字符串 "s" 输出相同
     */
    private void formatTemplate(List<Element> arguments, PrinterContext ctx) {
        ctx.append('"');
        for (int i = 0; i < arguments.size(); i++) {
            Form part = arguments.get(i).getForm();
            if (i % 2 == 0) {
                ctx.append(LumiStringUtils.escapeString(((StringAtom) part).getValue()));
            } else {
                ctx.append('{');
                part.accept(this, ctx);
                ctx.append('}');
            }
        }
        ctx.append('"');
    }
}
