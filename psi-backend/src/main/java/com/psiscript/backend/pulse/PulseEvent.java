package com.psiscript.backend.pulse;

import com.psiscript.compiler.op.Operation;
import com.psiscript.compiler.op.OperationKind;

import java.util.Comparator;
import java.util.Map;

/**
 * 带时间戳的脉冲事件（时间单位：纳秒）
 */
public final class PulseEvent {

    /** 对外可见的排序：(开始时间, 寄存器, 目标下标)，无目标视为 -1 */
    public static final Comparator<PulseEvent> ORDER = Comparator
            .comparingDouble(PulseEvent::getStartNs)
            .thenComparing(PulseEvent::getRegister)
            .thenComparingInt(e -> e.getTarget() == null ? -1 : e.getTarget());

    private final OperationKind kind;
    private final String register;
    private final Integer target;
    private final double startNs;
    private final double durationNs;
    private final String axis;
    private final Double angle;
    private final String shape;
    private final String waveform;
    private final String channel;
    private final String frequency;
    private final String kernel;
    private final String when;
    private final String branch;
    private final Map<String, String> metadata;
    private final String raw;

    private PulseEvent(Operation op, double startNs, double durationNs, String branch) {
        this.kind = op.getKind();
        this.register = op.getRegister();
        this.target = op.getTargets().first();
        this.startNs = startNs;
        this.durationNs = durationNs;
        this.axis = op.getAxis();
        this.angle = op.getAngle();
        this.shape = op.getShape();
        this.waveform = op.getWaveform();
        this.channel = op.getChannel();
        this.frequency = op.getFrequency();
        this.kernel = op.getKernel();
        this.when = op.getWhen();
        this.branch = branch;
        this.metadata = op.getMetadata();
        this.raw = op.getRaw();
    }

    /**
     * 由脉冲层操作创建事件
     *
     * @param branch 所在 Align 分支的标签，不在分支内时为 null
     */
    public static PulseEvent of(Operation op, double startNs, double durationNs, String branch) {
        return new PulseEvent(op, startNs, durationNs, branch);
    }

    public OperationKind getKind() {
        return kind;
    }

    public String getRegister() {
        return register;
    }

    /** 目标下标，未指定时为 null */
    public Integer getTarget() {
        return target;
    }

    public double getStartNs() {
        return startNs;
    }

    public double getDurationNs() {
        return durationNs;
    }

    public double getEndNs() {
        return startNs + durationNs;
    }

    public String getAxis() {
        return axis;
    }

    public Double getAngle() {
        return angle;
    }

    public String getShape() {
        return shape;
    }

    public String getWaveform() {
        return waveform;
    }

    public String getChannel() {
        return channel;
    }

    public String getFrequency() {
        return frequency;
    }

    public String getKernel() {
        return kernel;
    }

    public String getWhen() {
        return when;
    }

    public String getBranch() {
        return branch;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public String getRaw() {
        return raw;
    }

    /** 通道名：{@code q[0]}，无目标时为寄存器名 */
    public String getChannelKey() {
        return target == null ? register : register + "[" + target + "]";
    }

    @Override
    public String toString() {
        return kind + "@" + startNs + "+" + durationNs + " " + getChannelKey();
    }
}
