package com.psiscript.backend.qasm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 门级电路：量子寄存器（含合成的辅助寄存器）、经典寄存器和有序指令行。
 */
public final class GateCircuit {

    public static final String DIALECT = "OPENQASM 2.0;";
    public static final String INCLUDE = "include \"qelib1.inc\";";

    private final Map<String, Integer> quantumRegisters;
    private final Map<String, Integer> classicalRegisters;
    private final List<String> instructions;

    public GateCircuit(Map<String, Integer> quantumRegisters, Map<String, Integer> classicalRegisters,
                       List<String> instructions) {
        this.quantumRegisters = Collections.unmodifiableMap(new LinkedHashMap<>(quantumRegisters));
        this.classicalRegisters = Collections.unmodifiableMap(new LinkedHashMap<>(classicalRegisters));
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
    }

    public Map<String, Integer> getQuantumRegisters() {
        return quantumRegisters;
    }

    public Map<String, Integer> getClassicalRegisters() {
        return classicalRegisters;
    }

    public List<String> getInstructions() {
        return instructions;
    }

    /**
     * 渲染为 OpenQASM 文本（以换行结尾）
     */
    public String render() {
        List<String> lines = new ArrayList<>();
        lines.add(DIALECT);
        lines.add(INCLUDE);
        for (Map.Entry<String, Integer> entry : quantumRegisters.entrySet()) {
            lines.add("qreg " + entry.getKey() + "[" + entry.getValue() + "];");
        }
        for (Map.Entry<String, Integer> entry : classicalRegisters.entrySet()) {
            lines.add("creg " + entry.getKey() + "[" + entry.getValue() + "];");
        }
        lines.addAll(instructions);
        return String.join("\n", lines) + "\n";
    }

    @Override
    public String toString() {
        return render();
    }
}
