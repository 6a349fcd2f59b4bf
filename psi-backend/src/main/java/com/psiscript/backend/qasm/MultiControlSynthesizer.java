package com.psiscript.backend.qasm;

import java.util.ArrayList;
import java.util.List;

/**
 * 多控制门合成。
 *
 * <p>k 个控制、1 个目标：k ≤ 2 直接使用 x / cx / ccx；k ≥ 3 时在辅助寄存器 {@code anc_<reg>}
 * 中分配 k-2 个辅助比特，按 计算 → 作用 → 逆计算 的顺序展开，逆计算严格是计算序列的逆序，
 * 保证辅助比特归零后可被后续合成复用。</p>
 */
public class MultiControlSynthesizer {

    private final QasmBuilder builder;
    private final String register;

    public MultiControlSynthesizer(QasmBuilder builder, String register) {
        this.builder = builder;
        this.register = register;
    }

    public String ancillaRegister() {
        return "anc_" + register;
    }

    /**
     * 多控制 X
     */
    public List<String> multiControlX(List<Integer> controls, int target) {
        List<String> lines = new ArrayList<>();
        int k = controls.size();
        if (k == 0) {
            lines.add("x " + q(target) + ";");
            return lines;
        }
        if (k == 1) {
            lines.add("cx " + q(controls.get(0)) + "," + q(target) + ";");
            return lines;
        }
        if (k == 2) {
            lines.add(ccx(q(controls.get(0)), q(controls.get(1)), q(target)));
            return lines;
        }

        int ancillaCount = k - 2;
        String anc = ancillaRegister();
        builder.ensureQreg(anc, ancillaCount);

        List<String> compute = new ArrayList<>();
        compute.add(ccx(q(controls.get(0)), q(controls.get(1)), anc + "[0]"));
        for (int i = 2; i <= k - 2; i++) {
            compute.add(ccx(q(controls.get(i)), anc + "[" + (i - 2) + "]", anc + "[" + (i - 1) + "]"));
        }

        lines.addAll(compute);
        lines.add(ccx(q(controls.get(k - 1)), anc + "[" + (ancillaCount - 1) + "]", q(target)));
        for (int i = compute.size() - 1; i >= 0; i--) {
            lines.add(compute.get(i));
        }
        return lines;
    }

    /**
     * 多控制 Z = H(target) · 多控制 X · H(target)
     */
    public List<String> multiControlZ(List<Integer> controls, int target) {
        List<String> lines = new ArrayList<>();
        if (controls.isEmpty()) {
            lines.add("z " + q(target) + ";");
            return lines;
        }
        lines.add("h " + q(target) + ";");
        lines.addAll(multiControlX(controls, target));
        lines.add("h " + q(target) + ";");
        return lines;
    }

    private String q(int index) {
        return register + "[" + index + "]";
    }

    private static String ccx(String c1, String c2, String target) {
        return "ccx " + c1 + "," + c2 + "," + target + ";";
    }
}
