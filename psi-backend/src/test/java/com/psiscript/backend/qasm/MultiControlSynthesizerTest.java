package com.psiscript.backend.qasm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MultiControlSynthesizer 测试")
class MultiControlSynthesizerTest {

    private QasmBuilder builder;
    private MultiControlSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        builder = new QasmBuilder("q", 6);
        synthesizer = new MultiControlSynthesizer(builder, "q");
    }

    @Test
    @DisplayName("k 个控制分配 k-2 个辅助比特")
    void testAncillaCount() {
        List<String> lines = synthesizer.multiControlX(Arrays.asList(0, 1, 2, 3, 4), 5);
        assertThat(builder.qregSize("anc_q")).isEqualTo(3);
        // 3 条计算 + 1 条作用 + 3 条逆计算
        assertThat(lines).hasSize(7);
        assertThat(lines.get(3)).isEqualTo("ccx q[4],anc_q[2],q[5];");
    }

    @Test
    @DisplayName("逆计算是计算序列的逆序")
    void testUncomputeMirrorsCompute() {
        List<String> lines = synthesizer.multiControlX(Arrays.asList(0, 1, 2, 3, 4), 5);
        for (int i = 0; i < 3; i++) {
            assertThat(lines.get(i)).isEqualTo(lines.get(lines.size() - 1 - i));
        }
        assertThat(lines.subList(0, 3)).containsExactly(
                "ccx q[0],q[1],anc_q[0];",
                "ccx q[2],anc_q[0],anc_q[1];",
                "ccx q[3],anc_q[1],anc_q[2];");
    }

    @Test
    @DisplayName("辅助寄存器扩展到最大需求")
    void testAncillaGrowth() {
        synthesizer.multiControlX(Arrays.asList(0, 1, 2, 3), 5);
        synthesizer.multiControlX(Arrays.asList(0, 1, 2), 5);
        assertThat(builder.qregSize("anc_q")).isEqualTo(2);
    }

    @Test
    @DisplayName("少量控制不需要辅助比特")
    void testSmallControlCounts() {
        assertThat(synthesizer.multiControlX(Collections.<Integer>emptyList(), 2)).containsExactly("x q[2];");
        assertThat(synthesizer.multiControlX(Collections.singletonList(1), 2)).containsExactly("cx q[1],q[2];");
        assertThat(synthesizer.multiControlX(Arrays.asList(0, 1), 2)).containsExactly("ccx q[0],q[1],q[2];");
        assertThat(builder.qregSize("anc_q")).isNull();
    }

    @Test
    @DisplayName("多控制 Z 由 H 包夹")
    void testMultiControlZ() {
        assertThat(synthesizer.multiControlZ(Collections.<Integer>emptyList(), 0)).containsExactly("z q[0];");
        assertThat(synthesizer.multiControlZ(Collections.singletonList(0), 1))
                .containsExactly("h q[1];", "cx q[0],q[1];", "h q[1];");
    }
}
