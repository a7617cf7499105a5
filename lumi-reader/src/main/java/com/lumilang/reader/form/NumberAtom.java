package com.lumilang.reader.form;

/**
 * 数字原子，载荷为 {@link Long} 或 {@link Double}
 */
public final class NumberAtom extends Atom {
    private final Number value;

    public NumberAtom(long value) {
        this(Long.valueOf(value), SourceLocation.UNKNOWN);
    }

    public NumberAtom(double value) {
        this(Double.valueOf(value), SourceLocation.UNKNOWN);
    }

    /**
     * @throws IllegalArgumentException 值不是 Long/Double，或为 NaN/无穷大
     */
    public NumberAtom(Number value, SourceLocation location) {
        super(location);
        if (value instanceof Double) {
            double d = (Double) value;
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("Number has no literal syntax: " + d);
            }
        } else if (!(value instanceof Long)) {
            throw new IllegalArgumentException("Unsupported number type: "
                    + (value == null ? "null" : value.getClass().getName()));
        }
        this.value = value;
    }

    @Override
    public Number getValue() {
        return value;
    }

    public boolean isInteger() {
        return value instanceof Long;
    }

    @Override
    public <R, C> R accept(FormVisitor<R, C> visitor, C context) {
        return visitor.visitNumber(this, context);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
