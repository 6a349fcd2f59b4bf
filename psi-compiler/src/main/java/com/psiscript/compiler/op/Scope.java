package com.psiscript.compiler.op;

/**
 * 操作的来源作用域
 */
public enum Scope {
    LOGIC("logic"),
    ANALOG("analog"),
    ALIGN("align");

    private final String label;

    Scope(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
