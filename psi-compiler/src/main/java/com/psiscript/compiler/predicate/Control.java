package com.psiscript.compiler.predicate;

/**
 * 单个控制条件：量子比特下标及其要求的取值（0 或 1）
 */
public final class Control {
    private final int index;
    private final int value;

    public Control(int index, int value) {
        this.index = index;
        this.value = value;
    }

    public int getIndex() {
        return index;
    }

    public int getValue() {
        return value;
    }

    /** 要求取值为 0 时需要用 X 门共轭 */
    public boolean isNegated() {
        return value == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Control)) return false;
        Control other = (Control) o;
        return index == other.index && value == other.value;
    }

    @Override
    public int hashCode() {
        return 31 * index + value;
    }

    @Override
    public String toString() {
        return "(" + index + ", " + value + ")";
    }
}
