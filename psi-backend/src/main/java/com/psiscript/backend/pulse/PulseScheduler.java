package com.psiscript.backend.pulse;

import com.psiscript.compiler.CompileException;
import com.psiscript.compiler.analysis.ClauseResolver;
import com.psiscript.compiler.analysis.ClauseResult;
import com.psiscript.compiler.analysis.RegisterTable;
import com.psiscript.compiler.analysis.ResolveContext;
import com.psiscript.compiler.ast.Statement;
import com.psiscript.compiler.op.Operation;
import com.psiscript.compiler.op.OperationKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 脉冲调度器：带时间游标递归遍历语句树，生成带时间戳的事件。
 *
 * <ul>
 *   <li>脉冲子句：在游标处生成一个事件，游标前进其时长</li>
 *   <li>{@code Analog} 等带子块的子句：子块从当前游标顺序执行，游标前进子块总时长</li>
 *   <li>{@code Align}：各分支从同一游标起步，游标前进各分支时长的最大值（关键路径）</li>
 * </ul>
 *
 * <p>寄存器过滤只丢弃事件，不影响时间推进。</p>
 */
public class PulseScheduler {

    private static final Logger LOG = Logger.getLogger(PulseScheduler.class.getName());

    private final ClauseResolver clauses;
    private final String defaultRegister;
    private final String registerFilter;

    /**
     * 不带前缀的子句绑定到第一个声明的寄存器，过滤不改变这一绑定。
     *
     * @param registers      寄存器表
     * @param registerFilter 只保留该寄存器的事件，null 表示不过滤
     * @throws CompileException 过滤寄存器未声明
     */
    public PulseScheduler(RegisterTable registers, String registerFilter) {
        if (registerFilter != null && !registers.contains(registerFilter)) {
            throw new CompileException("Register '" + registerFilter + "' not declared.");
        }
        this.clauses = new ClauseResolver(registers);
        this.defaultRegister = registers.first();
        this.registerFilter = registerFilter;
    }

    public PulseSchedule schedule(List<Statement> statements) {
        List<PulseEvent> events = new ArrayList<>();
        double total = compileBlock(statements, ResolveContext.initial(defaultRegister), 0.0, null, events);
        LOG.fine("Scheduled " + events.size() + " pulse events over " + total + " ns");
        return new PulseSchedule(events);
    }

    /**
     * 顺序执行一组语句
     *
     * @return 该组语句占用的总时长
     */
    private double compileBlock(List<Statement> statements, ResolveContext context, double start,
                                String branch, List<PulseEvent> out) {
        double cursor = start;
        for (Statement stmt : statements) {
            ClauseResult result = clauses.resolve(stmt.getText(), context);
            Operation op = result.getOperation();

            if (op != null && op.getKind().isPulse()) {
                cursor += lowerPulse(op, cursor, branch, out);
                continue;
            }

            if (op != null && op.getKind() == OperationKind.ALIGN) {
                cursor += compileAlign(stmt.getChildren(), result.getChildContext(), cursor, branch, out);
                continue;
            }

            // Analog 块及其他带子块的子句：以覆盖后的上下文顺序执行子块
            if (stmt.hasChildren()) {
                cursor += compileBlock(stmt.getChildren(), result.getChildContext(), cursor, branch, out);
            }
        }
        return cursor - start;
    }

    /**
     * 并行分支：全部从 start 起步，返回最长分支的时长
     */
    private double compileAlign(List<Statement> children, ResolveContext context, double start,
                                String enclosingBranch, List<PulseEvent> out) {
        double longest = 0.0;
        for (Statement child : children) {
            ClauseResult result = clauses.resolve(child.getText(), context);
            Operation op = result.getOperation();
            double duration;
            if (op != null && op.getKind() == OperationKind.BRANCH) {
                duration = compileBlock(child.getChildren(), result.getChildContext(), start, op.getLabel(), out);
            } else {
                // 非 branch 子句自成一个无标签的并行分支
                duration = compileBlock(Collections.singletonList(child), context, start, enclosingBranch, out);
            }
            longest = Math.max(longest, duration);
        }
        return longest;
    }

    private double lowerPulse(Operation op, double start, String branch, List<PulseEvent> out) {
        double duration = DurationParser.parse(op.getDuration());
        if (registerFilter == null || registerFilter.equals(op.getRegister())) {
            out.add(PulseEvent.of(op, start, duration, branch));
        } else {
            LOG.fine("Filtered pulse event on register " + op.getRegister() + ": " + op.getRaw());
        }
        return duration;
    }
}
