package com.psiscript.compiler.analysis;

import com.psiscript.compiler.op.Scope;

/**
 * 自父语句向子语句传递的解析上下文（不可变）。
 *
 * <p>子句处理器返回的覆盖上下文只作用于该子句自己的子树，不影响兄弟语句。</p>
 */
public final class ResolveContext {
    private final Scope scope;
    private final String defaultRegister;
    private final AnalogTarget analogTarget;

    public ResolveContext(Scope scope, String defaultRegister, AnalogTarget analogTarget) {
        this.scope = scope;
        this.defaultRegister = defaultRegister;
        this.analogTarget = analogTarget;
    }

    public static ResolveContext initial(String defaultRegister) {
        return new ResolveContext(Scope.LOGIC, defaultRegister, null);
    }

    public Scope getScope() {
        return scope;
    }

    public String getDefaultRegister() {
        return defaultRegister;
    }

    /** 当前模拟层目标，不在 Analog/branch 子树内时为 null */
    public AnalogTarget getAnalogTarget() {
        return analogTarget;
    }

    public ResolveContext withScope(Scope scope) {
        return new ResolveContext(scope, defaultRegister, analogTarget);
    }

    public ResolveContext withTarget(String register, AnalogTarget analogTarget) {
        return new ResolveContext(scope, register, analogTarget);
    }

    @Override
    public String toString() {
        return "ResolveContext{" + scope + ", " + defaultRegister + ", " + analogTarget + "}";
    }
}
