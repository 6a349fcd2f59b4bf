package com.psiscript.backend;

import com.psiscript.backend.pulse.PulseSchedule;
import com.psiscript.backend.qasm.GateCircuit;

/**
 * 一次编译的产物
 */
public final class CompileResult {
    private final String register;
    private final GateCircuit circuit;
    private final PulseSchedule schedule;

    public CompileResult(String register, GateCircuit circuit, PulseSchedule schedule) {
        this.register = register;
        this.circuit = circuit;
        this.schedule = schedule;
    }

    public String getRegister() {
        return register;
    }

    public GateCircuit getCircuit() {
        return circuit;
    }

    public String getQasm() {
        return circuit.render();
    }

    /** 未请求调度表时为 null */
    public PulseSchedule getSchedule() {
        return schedule;
    }

    public boolean hasSchedule() {
        return schedule != null;
    }
}
