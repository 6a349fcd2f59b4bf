package com.psiscript.compiler.analysis;

import com.psiscript.compiler.op.Operation;

/**
 * 单个子句的解析结果：可选的操作，以及其子树应使用的上下文。
 */
public final class ClauseResult {
    private final Operation operation;
    private final ResolveContext childContext;

    public ClauseResult(Operation operation, ResolveContext childContext) {
        this.operation = operation;
        this.childContext = childContext;
    }

    /** 不产生操作、不覆盖上下文 */
    public static ClauseResult none(ResolveContext context) {
        return new ClauseResult(null, context);
    }

    /** 解析出的操作；声明子句或未识别子句为 null */
    public Operation getOperation() {
        return operation;
    }

    public boolean hasOperation() {
        return operation != null;
    }

    public ResolveContext getChildContext() {
        return childContext;
    }
}
