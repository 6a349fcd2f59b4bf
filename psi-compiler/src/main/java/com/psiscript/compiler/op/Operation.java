package com.psiscript.compiler.op;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 解析后的操作记录（不可变）。
 *
 * <p>公共字段：种类、寄存器、目标下标、来源作用域、原始文本；
 * 其余字段按种类可选，未出现时为 null。</p>
 */
public final class Operation {

    /** 分支标签在 metadata 中的键 */
    public static final String LABEL_KEY = "label";

    private final OperationKind kind;
    private final String register;
    private final Targets targets;
    private final Scope scope;
    private final String raw;

    private final Double angle;
    private final String where;
    private final String when;
    private final String axis;
    private final String classicalTarget;
    private final boolean measureAll;
    private final String duration;
    private final String shape;
    private final String waveform;
    private final String channel;
    private final String frequency;
    private final String kernel;
    private final Map<String, String> metadata;

    private Operation(Builder b) {
        this.kind = b.kind;
        this.register = b.register;
        this.targets = b.targets;
        this.scope = b.scope;
        this.raw = b.raw;
        this.angle = b.angle;
        this.where = b.where;
        this.when = b.when;
        this.axis = b.axis;
        this.classicalTarget = b.classicalTarget;
        this.measureAll = b.measureAll;
        this.duration = b.duration;
        this.shape = b.shape;
        this.waveform = b.waveform;
        this.channel = b.channel;
        this.frequency = b.frequency;
        this.kernel = b.kernel;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
    }

    public static Builder builder(OperationKind kind, String register) {
        return new Builder(kind, register);
    }

    public <R> R accept(OperationVisitor<R> visitor) {
        return kind.dispatch(visitor, this);
    }

    public OperationKind getKind() {
        return kind;
    }

    public String getRegister() {
        return register;
    }

    public Targets getTargets() {
        return targets;
    }

    public Scope getScope() {
        return scope;
    }

    public String getRaw() {
        return raw;
    }

    public Double getAngle() {
        return angle;
    }

    /** 量子谓词（{@code where:}），原样保留 */
    public String getWhere() {
        return where;
    }

    /** 经典条件（{@code when:}），原样保留 */
    public String getWhen() {
        return when;
    }

    public String getAxis() {
        return axis;
    }

    public String getClassicalTarget() {
        return classicalTarget;
    }

    public boolean isMeasureAll() {
        return measureAll;
    }

    public String getDuration() {
        return duration;
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

    public Map<String, String> getMetadata() {
        return metadata;
    }

    /** branch 操作的标签（引用原文，如 {@code q[0]}） */
    public String getLabel() {
        return metadata.get(LABEL_KEY);
    }

    @Override
    public String toString() {
        return kind + " " + register + targets + (raw.isEmpty() ? "" : " <" + raw + ">");
    }

    public static final class Builder {
        private final OperationKind kind;
        private final String register;
        private Targets targets = Targets.NONE;
        private Scope scope = Scope.LOGIC;
        private String raw = "";
        private Double angle;
        private String where;
        private String when;
        private String axis;
        private String classicalTarget;
        private boolean measureAll;
        private String duration;
        private String shape;
        private String waveform;
        private String channel;
        private String frequency;
        private String kernel;
        private final Map<String, String> metadata = new LinkedHashMap<>();

        private Builder(OperationKind kind, String register) {
            this.kind = kind;
            this.register = register;
        }

        public Builder targets(Targets targets) {
            this.targets = targets;
            return this;
        }

        public Builder scope(Scope scope) {
            this.scope = scope;
            return this;
        }

        public Builder raw(String raw) {
            this.raw = raw;
            return this;
        }

        public Builder angle(Double angle) {
            this.angle = angle;
            return this;
        }

        public Builder where(String where) {
            this.where = where;
            return this;
        }

        public Builder when(String when) {
            this.when = when;
            return this;
        }

        public Builder axis(String axis) {
            this.axis = axis;
            return this;
        }

        public Builder classicalTarget(String classicalTarget) {
            this.classicalTarget = classicalTarget;
            return this;
        }

        public Builder measureAll(boolean measureAll) {
            this.measureAll = measureAll;
            return this;
        }

        public Builder duration(String duration) {
            this.duration = duration;
            return this;
        }

        public Builder shape(String shape) {
            this.shape = shape;
            return this;
        }

        public Builder waveform(String waveform) {
            this.waveform = waveform;
            return this;
        }

        public Builder channel(String channel) {
            this.channel = channel;
            return this;
        }

        public Builder frequency(String frequency) {
            this.frequency = frequency;
            return this;
        }

        public Builder kernel(String kernel) {
            this.kernel = kernel;
            return this;
        }

        public Builder metadata(String key, String value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, String> entries) {
            this.metadata.putAll(entries);
            return this;
        }

        public Operation build() {
            return new Operation(this);
        }
    }
}
