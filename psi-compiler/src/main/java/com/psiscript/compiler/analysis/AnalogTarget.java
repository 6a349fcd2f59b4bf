package com.psiscript.compiler.analysis;

import java.util.Objects;

/**
 * 模拟层上下文：{@code Analog(...)} 或 {@code branch} 子树中脉冲子句默认继承的目标。
 */
public final class AnalogTarget {
    private final String register;
    private final Integer index;

    public AnalogTarget(String register, Integer index) {
        this.register = register;
        this.index = index;
    }

    public String getRegister() {
        return register;
    }

    /** 目标下标，未指定时为 null */
    public Integer getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnalogTarget)) return false;
        AnalogTarget other = (AnalogTarget) o;
        return register.equals(other.register) && Objects.equals(index, other.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(register, index);
    }

    @Override
    public String toString() {
        return index == null ? register : register + "[" + index + "]";
    }
}
