package com.psiscript.compiler.analysis;

import com.psiscript.compiler.CompileException;
import com.psiscript.compiler.op.Operation;
import com.psiscript.compiler.op.OperationKind;
import com.psiscript.compiler.op.Scope;
import com.psiscript.compiler.op.Targets;
import com.psiscript.compiler.parser.LiteralHelper;
import com.psiscript.compiler.parser.ParseException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 单个子句的分类器：把子句文本解析为操作记录，并给出其子树的上下文覆盖。
 *
 * <p>无状态，{@link OperationResolver} 与脉冲调度器共用同一套规则。</p>
 */
public class ClauseResolver {

    private static final Logger LOG = Logger.getLogger(ClauseResolver.class.getName());

    private static final Pattern CALL = Pattern.compile(
            "^(?:let\\s+(\\w+)\\s*=\\s*)?(?:(\\w+)\\s*\\.\\s*)?([A-Za-z_]\\w*)\\s*\\((.*)\\)$", Pattern.DOTALL);
    private static final Pattern ALIGN = Pattern.compile("^Align(?:\\s*\\(\\s*\\))?$");
    private static final Pattern BRANCH = Pattern.compile("^branch\\s+(.+)$");
    private static final Pattern REFERENCE = Pattern.compile("^(\\w+)\\s*(?:\\[\\s*(\\d+)\\s*\\])?$");
    private static final Pattern INDEX = Pattern.compile("^\\d+$");

    private static final Set<String> PULSE_KEYS = new HashSet<>(Arrays.asList(
            "target", "duration", "axis", "angle", "shape", "waveform", "channel",
            "hz", "freq", "frequency", "kernel", "when"));

    private final RegisterTable registers;

    public ClauseResolver(RegisterTable registers) {
        this.registers = registers;
    }

    public RegisterTable getRegisters() {
        return registers;
    }

    /**
     * 解析一个子句
     *
     * @param text    子句文本
     * @param context 该子句所处的上下文
     * @return 操作（可能为空）及子树上下文
     */
    public ClauseResult resolve(String text, ResolveContext context) {
        String clause = text.trim();
        if (clause.isEmpty() || RegisterTable.DECLARATION.matcher(clause).find()) {
            return ClauseResult.none(context);
        }

        if (ALIGN.matcher(clause).matches()) {
            Operation op = Operation.builder(OperationKind.ALIGN, context.getDefaultRegister())
                    .scope(context.getScope())
                    .raw(clause)
                    .build();
            return new ClauseResult(op, context.withScope(Scope.ALIGN));
        }

        Matcher branch = BRANCH.matcher(clause);
        if (branch.matches()) {
            if (context.getScope() == Scope.ALIGN) {
                return branch(branch.group(1).trim(), clause, context);
            }
            LOG.fine("branch outside Align ignored: " + clause);
            return ClauseResult.none(context);
        }

        Matcher call = CALL.matcher(clause);
        if (call.matches()) {
            String binding = call.group(1);
            String prefix = call.group(2);
            String name = call.group(3);
            ClauseArguments args = ClauseArguments.parse(call.group(4));
            switch (name) {
                case "Superpose": return single(superpose(prefix, args, clause, context), context);
                case "Phase":     return single(phase(prefix, args, clause, context), context);
                case "Flip":      return single(flip(prefix, args, clause, context), context);
                case "Reflect":   return single(reflect(prefix, args, clause, context), context);
                case "Measure":   return single(measure(binding, prefix, args, clause, context), context);
                case "Analog":    return analog(args, clause, context);
                case "Rotate":    return single(pulse(OperationKind.ROTATE, prefix, args, clause, context), context);
                case "Wait":      return single(pulse(OperationKind.WAIT, prefix, args, clause, context), context);
                case "ShiftPhase": return single(pulse(OperationKind.SHIFT_PHASE, prefix, args, clause, context), context);
                case "SetFreq":   return single(pulse(OperationKind.SET_FREQ, prefix, args, clause, context), context);
                case "Play":      return single(pulse(OperationKind.PLAY, prefix, args, clause, context), context);
                case "Acquire":   return single(pulse(OperationKind.ACQUIRE, prefix, args, clause, context), context);
                default:
                    break;
            }
        }

        LOG.fine("Unrecognized clause: " + clause);
        return ClauseResult.none(context);
    }

    // ============ 逻辑层 ============

    private Operation superpose(String prefix, ClauseArguments args, String raw, ResolveContext ctx) {
        String ref = args.get("targets");
        if (ref == null) {
            ref = args.getPositional().isEmpty() ? "ALL" : args.getPositional().get(0);
        }
        return validate(Operation.builder(OperationKind.SUPERPOSE, registerFor(prefix, ctx))
                .targets(parseTargets(ref, raw))
                .scope(ctx.getScope())
                .raw(raw)
                .metadata(extras(args, "targets"))
                .build());
    }

    private Operation phase(String prefix, ClauseArguments args, String raw, ResolveContext ctx) {
        return validate(Operation.builder(OperationKind.PHASE, registerFor(prefix, ctx))
                .angle(AngleEvaluator.evaluate(args.get("angle", "0")))
                .where(args.get("where"))
                .when(args.get("when"))
                .scope(ctx.getScope())
                .raw(raw)
                .metadata(extras(args, "angle", "where", "when"))
                .build());
    }

    private Operation flip(String prefix, ClauseArguments args, String raw, ResolveContext ctx) {
        AnalogTarget target = reference(args.get("target", "0"), registerFor(prefix, ctx), raw);
        if (target.getIndex() == null) {
            throw new ParseException("Flip requires an indexed target in: " + raw);
        }
        return validate(Operation.builder(OperationKind.FLIP, target.getRegister())
                .targets(Targets.of(target.getIndex()))
                .where(args.get("where"))
                .when(args.get("when"))
                .scope(ctx.getScope())
                .raw(raw)
                .metadata(extras(args, "target", "where", "when"))
                .build());
    }

    private Operation reflect(String prefix, ClauseArguments args, String raw, ResolveContext ctx) {
        return validate(Operation.builder(OperationKind.REFLECT, registerFor(prefix, ctx))
                .axis(args.get("axis", "Axis.MEAN"))
                .when(args.get("when"))
                .scope(ctx.getScope())
                .raw(raw)
                .metadata(extras(args, "axis", "when"))
                .build());
    }

    private Operation measure(String binding, String prefix, ClauseArguments args, String raw, ResolveContext ctx) {
        Operation.Builder builder;
        if (args.getPositional().isEmpty()) {
            // reg.Measure() 或裸 Measure()：测量整个寄存器
            builder = Operation.builder(OperationKind.MEASURE, registerFor(prefix, ctx)).measureAll(true);
        } else {
            AnalogTarget ref = reference(args.getPositional().get(0), registerFor(prefix, ctx), raw);
            builder = Operation.builder(OperationKind.MEASURE, ref.getRegister());
            if (ref.getIndex() == null) {
                builder.measureAll(true);
            } else {
                builder.targets(Targets.of(ref.getIndex()));
            }
        }
        return validate(builder
                .classicalTarget(binding)
                .scope(ctx.getScope())
                .raw(raw)
                .metadata(args.getNamed())
                .build());
    }

    // ============ 模拟层 ============

    private ClauseResult analog(ClauseArguments args, String raw, ResolveContext ctx) {
        String ref = args.get("target");
        if (ref == null && !args.getPositional().isEmpty()) {
            ref = args.getPositional().get(0);
        }
        AnalogTarget target = ref == null
                ? new AnalogTarget(ctx.getDefaultRegister(), null)
                : reference(ref, ctx.getDefaultRegister(), raw);
        Operation op = validate(Operation.builder(OperationKind.ANALOG, target.getRegister())
                .targets(target.getIndex() == null ? Targets.NONE : Targets.of(target.getIndex()))
                .scope(ctx.getScope())
                .raw(raw)
                .metadata(extras(args, "target"))
                .build());
        ResolveContext child = new ResolveContext(Scope.ANALOG, target.getRegister(), target);
        return new ClauseResult(op, child);
    }

    private ClauseResult branch(String ref, String raw, ResolveContext ctx) {
        AnalogTarget target = reference(ref, ctx.getDefaultRegister(), raw);
        Operation op = validate(Operation.builder(OperationKind.BRANCH, target.getRegister())
                .targets(target.getIndex() == null ? Targets.NONE : Targets.of(target.getIndex()))
                .scope(ctx.getScope())
                .raw(raw)
                .metadata(Operation.LABEL_KEY, ref)
                .build());
        return new ClauseResult(op, ctx.withTarget(target.getRegister(), target));
    }

    private Operation pulse(OperationKind kind, String prefix, ClauseArguments args, String raw, ResolveContext ctx) {
        AnalogTarget target = pulseTarget(prefix, args.get("target"), ctx, raw);
        String angle = args.get("angle");
        String frequency = args.get("hz");
        if (frequency == null) frequency = args.get("freq");
        if (frequency == null) frequency = args.get("frequency");
        Map<String, String> metadata = extras(args, PULSE_KEYS.toArray(new String[0]));
        return validate(Operation.builder(kind, target.getRegister())
                .targets(target.getIndex() == null ? Targets.NONE : Targets.of(target.getIndex()))
                .scope(ctx.getScope())
                .raw(raw)
                .duration(args.get("duration"))
                .axis(args.get("axis"))
                .angle(angle == null ? null : AngleEvaluator.evaluate(angle))
                .shape(args.get("shape"))
                .waveform(args.get("waveform"))
                .channel(args.get("channel"))
                .frequency(frequency)
                .kernel(args.get("kernel"))
                .when(args.get("when"))
                .metadata(metadata)
                .build());
    }

    /**
     * 脉冲子句的目标：显式 target 优先；否则继承模拟层目标；都没有时退回默认寄存器、无下标
     */
    private AnalogTarget pulseTarget(String prefix, String ref, ResolveContext ctx, String raw) {
        AnalogTarget ambient = ctx.getAnalogTarget();
        if (ref != null) {
            String fallback = prefix != null ? prefix
                    : ambient != null ? ambient.getRegister() : ctx.getDefaultRegister();
            return reference(ref, fallback, raw);
        }
        if (prefix != null) {
            Integer index = ambient != null && ambient.getRegister().equals(prefix) ? ambient.getIndex() : null;
            return new AnalogTarget(prefix, index);
        }
        if (ambient != null) {
            return ambient;
        }
        return new AnalogTarget(ctx.getDefaultRegister(), null);
    }

    // ============ 辅助方法 ============

    private static ClauseResult single(Operation op, ResolveContext context) {
        return new ClauseResult(op, context);
    }

    private static String registerFor(String prefix, ResolveContext ctx) {
        return prefix != null ? prefix : ctx.getDefaultRegister();
    }

    /**
     * 解析寄存器引用：{@code q[1]}、{@code q}，或纯下标 {@code 1}（使用 fallback 寄存器）
     */
    private static AnalogTarget reference(String ref, String fallbackRegister, String raw) {
        String text = ref.trim();
        if (INDEX.matcher(text).matches()) {
            return new AnalogTarget(fallbackRegister, LiteralHelper.parseIndex(text, raw));
        }
        Matcher m = REFERENCE.matcher(text);
        if (!m.matches()) {
            throw new ParseException("Invalid register reference '" + text + "' in: " + raw);
        }
        Integer index = m.group(2) != null ? Integer.valueOf(LiteralHelper.parseIndex(m.group(2), raw)) : null;
        return new AnalogTarget(m.group(1), index);
    }

    private static Targets parseTargets(String ref, String raw) {
        String text = ref.trim();
        if (text.equalsIgnoreCase("ALL")) {
            return Targets.ALL;
        }
        if (text.startsWith("[") && text.endsWith("]")) {
            text = text.substring(1, text.length() - 1);
        }
        List<Integer> indices = new ArrayList<>();
        for (String part : text.split(",")) {
            String item = part.trim();
            if (item.isEmpty()) {
                continue;
            }
            if (!INDEX.matcher(item).matches()) {
                throw new ParseException("Invalid target '" + item + "' in: " + raw);
            }
            indices.add(LiteralHelper.parseIndex(item, raw));
        }
        return Targets.of(indices);
    }

    private static Map<String, String> extras(ClauseArguments args, String... known) {
        Set<String> skip = new HashSet<>(Arrays.asList(known));
        Map<String, String> extra = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : args.getNamed().entrySet()) {
            if (!skip.contains(entry.getKey())) {
                extra.put(entry.getKey(), entry.getValue());
            }
        }
        return extra;
    }

    /**
     * 寄存器必须已声明，目标下标必须小于寄存器宽度
     */
    private Operation validate(Operation op) {
        if (!registers.contains(op.getRegister())) {
            throw new CompileException("Register '" + op.getRegister() + "' not declared (in: " + op.getRaw() + ")");
        }
        int width = registers.widthOf(op.getRegister());
        for (int index : op.getTargets().getIndices()) {
            if (index >= width) {
                throw new CompileException("Target index " + index + " out of range for register '"
                        + op.getRegister() + "' of width " + width + " (in: " + op.getRaw() + ")");
            }
        }
        return op;
    }
}
