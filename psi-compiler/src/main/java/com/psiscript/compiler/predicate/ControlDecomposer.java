package com.psiscript.compiler.predicate;

import com.psiscript.compiler.parser.LiteralHelper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 合取谓词分解器。
 *
 * <p>把形如 {@code q[0] == 1 && q[2] == 0 && q[3]} 的谓词拆成有序的 (下标, 取值) 列表。
 * 出现 {@code ||}、引用其他寄存器或任何其他形状的项都返回"不支持"。
 * 同一下标重复出现时合并为一个控制（保留首次出现的位置）；取值互相矛盾时返回"不支持"。</p>
 */
public final class ControlDecomposer {

    private static final String DISJUNCTION = "||";
    private static final String CONJUNCTION = "&&";

    private ControlDecomposer() {
    }

    /**
     * @param predicate 谓词原文，可为 null（无控制）
     * @param register  谓词必须引用的寄存器
     */
    public static ControlDecomposition decompose(String predicate, String register) {
        if (predicate == null) {
            return ControlDecomposition.of(new ArrayList<Control>());
        }
        if (predicate.contains(DISJUNCTION)) {
            return ControlDecomposition.unsupported();
        }

        String reg = Pattern.quote(register);
        Pattern equality = Pattern.compile("^" + reg + "\\s*\\[\\s*(\\d+)\\s*\\]\\s*==\\s*([01])$");
        Pattern bare = Pattern.compile("^" + reg + "\\s*\\[\\s*(\\d+)\\s*\\]$");

        // 下标 → 取值；同一下标重复出现时取值必须一致
        Map<Integer, Integer> values = new LinkedHashMap<>();
        for (String part : predicate.split(Pattern.quote(CONJUNCTION), -1)) {
            String term = part.trim();
            String lower = term.toLowerCase();
            if (lower.isEmpty() || lower.equals("true") || lower.equals("1")) {
                continue;
            }
            int index;
            int value;
            Matcher m = equality.matcher(term);
            if (m.matches()) {
                index = LiteralHelper.parseIndex(m.group(1), predicate);
                value = Integer.parseInt(m.group(2));
            } else {
                m = bare.matcher(term);
                if (!m.matches()) {
                    return ControlDecomposition.unsupported();
                }
                index = LiteralHelper.parseIndex(m.group(1), predicate);
                value = 1;
            }
            Integer previous = values.put(index, value);
            if (previous != null && previous != value) {
                // q[i] == 0 && q[i] == 1：恒假
                return ControlDecomposition.unsupported();
            }
        }
        List<Control> controls = new ArrayList<>();
        for (Map.Entry<Integer, Integer> entry : values.entrySet()) {
            controls.add(new Control(entry.getKey(), entry.getValue()));
        }
        return ControlDecomposition.of(controls);
    }
}
