package com.psiscript.compiler.op;

/**
 * 操作种类（封闭集合）。
 *
 * <p>每个常量自行完成到 {@link OperationVisitor} 的分派：新增种类而不补充分派实现会直接编译失败。</p>
 */
public enum OperationKind {
    SUPERPOSE("superpose", false) {
        @Override
        <R> R dispatch(OperationVisitor<R> visitor, Operation op) {
            return visitor.visitSuperpose(op);
        }
    },
    PHASE("phase", false) {
        @Override
        <R> R dispatch(OperationVisitor<R> visitor, Operation op) {
            return visitor.visitPhase(op);
        }
    },
    FLIP("flip", false) {
        @Override
        <R> R dispatch(OperationVisitor<R> visitor, Operation op) {
            return visitor.visitFlip(op);
        }
    },
    REFLECT("reflect", false) {
        @Override
        <R> R dispatch(OperationVisitor<R> visitor, Operation op) {
            return visitor.visitReflect(op);
        }
    },
    MEASURE("measure", false) {
        @Override
        <R> R dispatch(OperationVisitor<R> visitor, Operation op) {
            return visitor.visitMeasure(op);
        }
    },
    ANALOG("analog", false) {
        @Override
        <R> R dispatch(OperationVisitor<R> visitor, Operation op) {
            return visitor.visitAnalog(op);
        }
    },
    ALIGN("align", false) {
        @Override
        <R> R dispatch(OperationVisitor<R> visitor, Operation op) {
            return visitor.visitAlign(op);
        }
    },
    BRANCH("branch", false) {
        @Override
        <R> R dispatch(OperationVisitor<R> visitor, Operation op) {
            return visitor.visitBranch(op);
        }
    },
    ROTATE("rotate", true) {
        @Override
        <R> R dispatch(OperationVisitor<R> visitor, Operation op) {
            return visitor.visitRotate(op);
        }
    },
    WAIT("wait", true) {
        @Override
        <R> R dispatch(OperationVisitor<R> visitor, Operation op) {
            return visitor.visitWait(op);
        }
    },
    SHIFT_PHASE("shiftphase", true) {
        @Override
        <R> R dispatch(OperationVisitor<R> visitor, Operation op) {
            return visitor.visitShiftPhase(op);
        }
    },
    SET_FREQ("setfreq", true) {
        @Override
        <R> R dispatch(OperationVisitor<R> visitor, Operation op) {
            return visitor.visitSetFreq(op);
        }
    },
    PLAY("play", true) {
        @Override
        <R> R dispatch(OperationVisitor<R> visitor, Operation op) {
            return visitor.visitPlay(op);
        }
    },
    ACQUIRE("acquire", true) {
        @Override
        <R> R dispatch(OperationVisitor<R> visitor, Operation op) {
            return visitor.visitAcquire(op);
        }
    };

    private final String label;
    private final boolean pulse;

    OperationKind(String label, boolean pulse) {
        this.label = label;
        this.pulse = pulse;
    }

    /** 小写名称（用于输出与序列化） */
    public String getLabel() {
        return label;
    }

    /** 是否为脉冲层操作（可被调度为带时长的事件） */
    public boolean isPulse() {
        return pulse;
    }

    abstract <R> R dispatch(OperationVisitor<R> visitor, Operation op);

    @Override
    public String toString() {
        return label;
    }
}
