package com.lumilang.reader.form;

/**
 * 复合形式中的一个元素：子 Form 加展开标记
 *
 * <p>展开标记对应参数列表中直接写出的 {@code ..x}，它不是独立的 Form 变体。</p>
 */
public final class Element {
    private final Form form;
    private final boolean splayed;

    public Element(Form form, boolean splayed) {
        if (form == null) {
            throw new IllegalArgumentException("Element form must not be null");
        }
        this.form = form;
        this.splayed = splayed;
    }

    public static Element of(Form form) {
        return new Element(form, false);
    }

    public static Element splayed(Form form) {
        return new Element(form, true);
    }

    public Form getForm() {
        return form;
    }

    public boolean isSplayed() {
        return splayed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Element)) return false;
        Element other = (Element) o;
        return splayed == other.splayed && form.equals(other.form);
    }

    @Override
    public int hashCode() {
        return form.hashCode() * 2 + (splayed ? 1 : 0);
    }

    @Override
    public String toString() {
        return splayed ? ".." + form : form.toString();
    }
}
