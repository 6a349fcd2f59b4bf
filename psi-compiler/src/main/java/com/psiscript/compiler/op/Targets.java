package com.psiscript.compiler.op;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 目标量子比特集合：显式下标列表，或表示"寄存器全部比特"的哨兵。
 */
public final class Targets {

    public static final Targets ALL = new Targets(Collections.<Integer>emptyList(), true);
    public static final Targets NONE = new Targets(Collections.<Integer>emptyList(), false);

    private final List<Integer> indices;
    private final boolean all;

    private Targets(List<Integer> indices, boolean all) {
        this.indices = indices;
        this.all = all;
    }

    public static Targets of(int... indices) {
        List<Integer> list = new ArrayList<>(indices.length);
        for (int i : indices) {
            list.add(i);
        }
        return of(list);
    }

    public static Targets of(List<Integer> indices) {
        if (indices.isEmpty()) {
            return NONE;
        }
        return new Targets(Collections.unmodifiableList(new ArrayList<>(indices)), false);
    }

    public boolean isAll() {
        return all;
    }

    public boolean isEmpty() {
        return !all && indices.isEmpty();
    }

    /** 显式下标（ALL 哨兵时为空） */
    public List<Integer> getIndices() {
        return indices;
    }

    /** 第一个显式下标，没有时返回 null */
    public Integer first() {
        return indices.isEmpty() ? null : indices.get(0);
    }

    /** 展开为具体下标；ALL 展开为 0..width-1 */
    public List<Integer> resolve(int width) {
        if (!all) {
            return indices;
        }
        List<Integer> expanded = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            expanded.add(i);
        }
        return expanded;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Targets)) return false;
        Targets other = (Targets) o;
        return all == other.all && indices.equals(other.indices);
    }

    @Override
    public int hashCode() {
        return 31 * indices.hashCode() + (all ? 1 : 0);
    }

    @Override
    public String toString() {
        return all ? "[ALL]" : indices.toString();
    }
}
