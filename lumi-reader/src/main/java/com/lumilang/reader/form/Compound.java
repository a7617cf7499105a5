package com.lumilang.reader.form;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 复合形式（调用/列表），独占其子元素
 */
public final class Compound extends Form {
    private final List<Element> elements;

    public Compound(SourceLocation location, List<Element> elements) {
        super(location);
        this.elements = Collections.unmodifiableList(new ArrayList<Element>(elements));
    }

    public Compound(List<Element> elements) {
        this(SourceLocation.UNKNOWN, elements);
    }

    /**
     * 由不带展开标记的子 Form 构造
     */
    public static Compound of(Form... forms) {
        List<Element> elements = new ArrayList<Element>(forms.length);
        for (Form form : forms) {
            elements.add(Element.of(form));
        }
        return new Compound(elements);
    }

    /**
     * 构造以符号 head 开头的调用形式 {@code (head arg...)}
     */
    public static Compound call(String head, Form... args) {
        Form[] forms = new Form[args.length + 1];
        forms[0] = new Symbol(head);
        System.arraycopy(args, 0, forms, 1, args.length);
        return of(forms);
    }

    public List<Element> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public Element get(int index) {
        return elements.get(index);
    }

    /**
     * 首元素的 Form，空列表返回 null
     */
    public Form getHead() {
        return elements.isEmpty() ? null : elements.get(0).getForm();
    }

    /**
     * 首元素是否为未展开的给定名称符号
     */
    public boolean hasHead(String name) {
        if (elements.isEmpty()) return false;
        Element head = elements.get(0);
        return !head.isSplayed() && head.getForm().isSymbol(name);
    }

    /**
     * 除首元素外的参数
     */
    public List<Element> getArguments() {
        return elements.isEmpty() ? elements : elements.subList(1, elements.size());
    }

    @Override
    public <R, C> R accept(FormVisitor<R, C> visitor, C context) {
        return visitor.visitCompound(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Compound)) return false;
        return elements.equals(((Compound) o).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) sb.append(' ');
            sb.append(elements.get(i));
        }
        return sb.append(')').toString();
    }
}
