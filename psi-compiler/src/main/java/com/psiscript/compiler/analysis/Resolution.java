package com.psiscript.compiler.analysis;

import com.psiscript.compiler.op.Operation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 解析结果：按文档顺序排列的操作流 + 寄存器表
 */
public final class Resolution {
    private final List<Operation> operations;
    private final RegisterTable registers;
    private final String defaultRegister;

    public Resolution(List<Operation> operations, RegisterTable registers, String defaultRegister) {
        this.operations = Collections.unmodifiableList(new ArrayList<>(operations));
        this.registers = registers;
        this.defaultRegister = defaultRegister;
    }

    public List<Operation> getOperations() {
        return operations;
    }

    public RegisterTable getRegisters() {
        return registers;
    }

    public String getDefaultRegister() {
        return defaultRegister;
    }

    /** 只保留作用于指定寄存器的操作 */
    public List<Operation> operationsFor(String register) {
        List<Operation> result = new ArrayList<>();
        for (Operation op : operations) {
            if (op.getRegister().equals(register)) {
                result.add(op);
            }
        }
        return result;
    }
}
