package com.psiscript.backend.qasm;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单次编译独占的电路构建器：寄存器分配（含临时经典寄存器计数器）与指令收集。
 */
public class QasmBuilder {

    private final Map<String, Integer> qregs = new LinkedHashMap<>();
    private final Map<String, Integer> cregs = new LinkedHashMap<>();
    private final List<String> lines = new ArrayList<>();
    private int tmpCounter = 0;

    public QasmBuilder(String register, int width) {
        qregs.put(register, width);
    }

    public void emit(String line) {
        lines.add(line);
    }

    public void emitAll(List<String> group) {
        lines.addAll(group);
    }

    /**
     * 声明经典寄存器；已存在时扩展到较大的宽度，声明位置不变
     */
    public void ensureCreg(String name, int size) {
        Integer existing = cregs.get(name);
        cregs.put(name, existing == null ? size : Math.max(existing, size));
    }

    /**
     * 分配新的临时经典寄存器 tmp0、tmp1 ...
     */
    public String tmpCreg(int size) {
        String name = "tmp" + (tmpCounter++);
        ensureCreg(name, size);
        return name;
    }

    public int getTmpCounter() {
        return tmpCounter;
    }

    /**
     * 声明量子寄存器；已存在时扩展到较大的宽度
     */
    public void ensureQreg(String name, int size) {
        Integer existing = qregs.get(name);
        qregs.put(name, existing == null ? size : Math.max(existing, size));
    }

    public Integer qregSize(String name) {
        return qregs.get(name);
    }

    public GateCircuit build() {
        return new GateCircuit(qregs, cregs, lines);
    }
}
