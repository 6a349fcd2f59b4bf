package com.psiscript.compiler.op;

/**
 * 操作访问者接口
 *
 * <p>与 AST 访问者不同，这里不提供默认实现：每个后端必须显式处理每一种操作。</p>
 */
public interface OperationVisitor<R> {

    // ============ 逻辑层 ============

    R visitSuperpose(Operation op);

    R visitPhase(Operation op);

    R visitFlip(Operation op);

    R visitReflect(Operation op);

    R visitMeasure(Operation op);

    // ============ 结构 ============

    R visitAnalog(Operation op);

    R visitAlign(Operation op);

    R visitBranch(Operation op);

    // ============ 脉冲层 ============

    R visitRotate(Operation op);

    R visitWait(Operation op);

    R visitShiftPhase(Operation op);

    R visitSetFreq(Operation op);

    R visitPlay(Operation op);

    R visitAcquire(Operation op);
}
