package com.psiscript.backend.qasm;

import com.psiscript.compiler.CompileException;
import com.psiscript.compiler.op.Operation;
import com.psiscript.compiler.op.OperationVisitor;
import com.psiscript.compiler.predicate.Control;
import com.psiscript.compiler.predicate.ControlDecomposer;
import com.psiscript.compiler.predicate.ControlDecomposition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 门级降级后端：把一个寄存器上的操作流翻译为 OpenQASM 2.0 指令。
 *
 * <p>无法降级的构造不会中止编译，而是以 {@code // unsupported: ...} 注释行保留在输出中。
 * 每个实例只服务一次编译。</p>
 */
public class QasmLowering implements OperationVisitor<Void> {

    private static final Logger LOG = Logger.getLogger(QasmLowering.class.getName());

    private final String register;
    private final int width;
    private final QasmBuilder builder;
    private final MultiControlSynthesizer synthesizer;
    private final ClassicalGuard guard;

    public QasmLowering(String register, int width) {
        this.register = register;
        this.width = width;
        this.builder = new QasmBuilder(register, width);
        this.synthesizer = new MultiControlSynthesizer(builder, register);
        this.guard = new ClassicalGuard(builder);
    }

    /**
     * 降级操作流；不属于目标寄存器的操作先被过滤掉
     */
    public GateCircuit lower(List<Operation> operations) {
        for (Operation op : operations) {
            if (!op.getRegister().equals(register)) {
                continue;
            }
            op.accept(this);
        }
        return builder.build();
    }

    // ============ 逻辑层 ============

    @Override
    public Void visitSuperpose(Operation op) {
        for (int index : op.getTargets().resolve(width)) {
            builder.emit("h " + q(index) + ";");
        }
        return null;
    }

    @Override
    public Void visitPhase(Operation op) {
        String angle = formatAngle(op.getAngle());
        ControlDecomposition decomposition = ControlDecomposer.decompose(op.getWhere(), register);
        if (!decomposition.isSupported()) {
            unsupported("Phase(" + angle + ") where " + op.getWhere() + " (predicate not decomposable)");
            return null;
        }
        List<Control> controls = checkControls(decomposition.getControls(), op);
        switch (controls.size()) {
            case 0:
                // 无谓词：全局相位，仅作标记
                emitGuarded(Collections.singletonList("u1(" + angle + ") " + q(0) + "; // global phase marker"), op);
                break;
            case 1:
                emitGuarded(conjugate(controls,
                        Collections.singletonList("u1(" + angle + ") " + q(controls.get(0).getIndex()) + ";")), op);
                break;
            case 2:
                emitGuarded(conjugate(controls, Collections.singletonList("cu1(" + angle + ") "
                        + q(controls.get(0).getIndex()) + "," + q(controls.get(1).getIndex()) + ";")), op);
                break;
            default:
                unsupported("multi-control phase for predicate '" + op.getWhere() + "' not lowered");
                break;
        }
        return null;
    }

    @Override
    public Void visitFlip(Operation op) {
        int target = op.getTargets().first();
        ControlDecomposition decomposition = ControlDecomposer.decompose(op.getWhere(), register);
        if (!decomposition.isSupported()) {
            unsupported("Flip target " + target + " where " + op.getWhere() + " (predicate not decomposable)");
            return null;
        }
        List<Control> controls = checkControls(decomposition.getControls(), op);
        List<Integer> indices = new ArrayList<>();
        for (Control control : controls) {
            if (control.getIndex() == target) {
                unsupported("Flip target " + target + " is also a control in '" + op.getWhere() + "'");
                return null;
            }
            indices.add(control.getIndex());
        }
        emitGuarded(conjugate(controls, synthesizer.multiControlX(indices, target)), op);
        return null;
    }

    @Override
    public Void visitReflect(Operation op) {
        String axis = op.getAxis() == null ? "" : op.getAxis().toUpperCase();
        if (!axis.contains("MEAN")) {
            unsupported("Reflect axis '" + op.getAxis() + "' not lowered");
            return null;
        }
        // Grover 扩散算子：H^n X^n (多控制 Z) X^n H^n
        List<String> lines = new ArrayList<>();
        layer(lines, "h");
        layer(lines, "x");
        List<Integer> controls = new ArrayList<>();
        for (int i = 0; i < width - 1; i++) {
            controls.add(i);
        }
        lines.addAll(synthesizer.multiControlZ(controls, width - 1));
        layer(lines, "x");
        layer(lines, "h");
        emitGuarded(lines, op);
        return null;
    }

    @Override
    public Void visitMeasure(Operation op) {
        if (op.isMeasureAll()) {
            String dest = op.getClassicalTarget() != null
                    ? op.getClassicalTarget()
                    : "meas_" + register + "_" + builder.getTmpCounter();
            builder.ensureCreg(dest, width);
            builder.emit("measure " + register + " -> " + dest + ";");
            return null;
        }
        String dest = op.getClassicalTarget() != null ? op.getClassicalTarget() : builder.tmpCreg(1);
        builder.ensureCreg(dest, 1);
        builder.emit("measure " + q(op.getTargets().first()) + " -> " + dest + "[0];");
        return null;
    }

    // ============ 结构（不可降级，保留为注释） ============

    @Override
    public Void visitAnalog(Operation op) {
        Integer index = op.getTargets().first();
        String target = index == null ? register : q(index);
        builder.emit("// Analog scope for " + target + ": " + op.getRaw());
        return null;
    }

    @Override
    public Void visitAlign(Operation op) {
        builder.emit("// Align block start: " + op.getRaw());
        return null;
    }

    @Override
    public Void visitBranch(Operation op) {
        builder.emit("// Align branch " + op.getLabel());
        return null;
    }

    // ============ 脉冲层（不可降级，保留为注释） ============

    @Override
    public Void visitRotate(Operation op) {
        builder.emit("// Rotate (pulse) not lowered: " + op.getRaw());
        return null;
    }

    @Override
    public Void visitWait(Operation op) {
        builder.emit("// Wait (pulse) not lowered: " + op.getRaw());
        return null;
    }

    @Override
    public Void visitShiftPhase(Operation op) {
        builder.emit("// ShiftPhase (virtual Z) not lowered: " + op.getRaw());
        return null;
    }

    @Override
    public Void visitSetFreq(Operation op) {
        builder.emit("// SetFreq (frame) not lowered: " + op.getRaw());
        return null;
    }

    @Override
    public Void visitPlay(Operation op) {
        builder.emit("// Play (waveform) not lowered: " + op.getRaw());
        return null;
    }

    @Override
    public Void visitAcquire(Operation op) {
        builder.emit("// Acquire (readout) not lowered: " + op.getRaw());
        return null;
    }

    // ============ 辅助方法 ============

    private void emitGuarded(List<String> gates, Operation op) {
        builder.emitAll(guard.wrap(gates, op.getWhen()));
    }

    /**
     * 取值要求为 0 的控制线在门序列前后各加一个 X
     */
    private List<String> conjugate(List<Control> controls, List<String> body) {
        List<String> pre = new ArrayList<>();
        for (Control control : controls) {
            if (control.isNegated()) {
                pre.add("x " + q(control.getIndex()) + ";");
            }
        }
        List<String> lines = new ArrayList<>(pre);
        lines.addAll(body);
        lines.addAll(pre);
        return lines;
    }

    private List<Control> checkControls(List<Control> controls, Operation op) {
        for (Control control : controls) {
            if (control.getIndex() >= width) {
                throw new CompileException("Control index " + control.getIndex() + " out of range for register '"
                        + register + "' of width " + width + " (in: " + op.getRaw() + ")");
            }
        }
        return controls;
    }

    private void layer(List<String> lines, String gate) {
        for (int i = 0; i < width; i++) {
            lines.add(gate + " " + q(i) + ";");
        }
    }

    private void unsupported(String detail) {
        LOG.fine("Not lowered: " + detail);
        builder.emit("// unsupported: " + detail);
    }

    private String q(int index) {
        return register + "[" + index + "]";
    }

    static String formatAngle(Double angle) {
        return Double.toString(angle == null ? 0.0 : angle);
    }
}
