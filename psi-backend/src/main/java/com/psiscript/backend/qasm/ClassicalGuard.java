package com.psiscript.backend.qasm;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 经典条件包装：{@code when: c == 0|1} 变为逐行的 {@code if (c==1) ...}。
 *
 * <p>其他形状的条件无法降级：输出一行说明注释后仍原样输出门序列。</p>
 */
public class ClassicalGuard {

    private static final Logger LOG = Logger.getLogger(ClassicalGuard.class.getName());
    private static final Pattern CONDITION = Pattern.compile("^(\\w+)\\s*==\\s*([01])$");

    private final QasmBuilder builder;

    public ClassicalGuard(QasmBuilder builder) {
        this.builder = builder;
    }

    public List<String> wrap(List<String> gates, String when) {
        if (when == null || when.trim().isEmpty()) {
            return gates;
        }
        String condition = lower(when);
        List<String> lines = new ArrayList<>();
        if (condition == null) {
            LOG.fine("Classical guard not lowered: " + when);
            lines.add("// unsupported: when guard '" + when + "' not lowered");
            lines.addAll(gates);
            return lines;
        }
        for (String gate : gates) {
            lines.add("if (" + condition + ") " + gate);
        }
        return lines;
    }

    /**
     * 降级条件表达式，并确保对应的 1 位经典寄存器已声明；不支持时返回 null
     */
    String lower(String when) {
        Matcher m = CONDITION.matcher(when.trim());
        if (!m.matches()) {
            return null;
        }
        String name = m.group(1);
        builder.ensureCreg(name, 1);
        return name + "==" + m.group(2);
    }
}
