package com.psiscript.backend.pulse;

import com.psiscript.backend.PsiCompiler;
import com.psiscript.compiler.CompileException;
import com.psiscript.compiler.op.OperationKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * 脉冲调度测试
 */
class PulseSchedulerTest {

    private static final double EPS = 1e-9;

    static final String SEQUENTIAL = String.join("\n",
            "let q = Register(1);",
            "Analog(target: q[0]) {",
            "    Rotate(axis: X, angle: PI/2, duration: 10ns);",
            "    Wait(duration: 5ns);",
            "    ShiftPhase(angle: PI/4);",
            "    Acquire(duration: 20ns, kernel: boxcar);",
            "}");

    static final String PARALLEL = String.join("\n",
            "let q = Register(2);",
            "Align {",
            "    branch q[0] {",
            "        Rotate(axis: Z, angle: PI, duration: 10ns);",
            "    }",
            "    branch q[1] {",
            "        Wait(duration: 25ns);",
            "    }",
            "}");

    private PulseSchedule schedule(String source) {
        return schedule(source, null);
    }

    private PulseSchedule schedule(String source, String filter) {
        return new PsiCompiler().schedule(source, "test.psi", filter);
    }

    @Nested
    @DisplayName("顺序执行")
    class SequentialTests {

        @Test
        @DisplayName("Analog 块内事件依次排列")
        void testSimplePulseSchedule() {
            PulseSchedule schedule = schedule(SEQUENTIAL);
            List<PulseEvent> events = schedule.getEvents();

            assertThat(events).extracting(PulseEvent::getKind).containsExactly(
                    OperationKind.ROTATE, OperationKind.WAIT, OperationKind.SHIFT_PHASE, OperationKind.ACQUIRE);
            assertEquals(0.0, events.get(0).getStartNs(), EPS);
            assertEquals(10.0, events.get(1).getStartNs(), EPS);
            assertEquals(15.0, events.get(2).getStartNs(), EPS);
            assertEquals(15.0, events.get(3).getStartNs(), EPS);
            assertEquals(20.0, events.get(3).getDurationNs(), EPS);
            assertEquals(35.0, schedule.getDurationNs(), EPS);
        }

        @Test
        @DisplayName("连续的 Analog 块累加时间")
        void testConsecutiveBlocks() {
            PulseSchedule schedule = schedule("let q = Register(2);\n"
                    + "Analog(target: q[0]) { Rotate(duration: 10ns); }\n"
                    + "Analog(target: q[1]) { Rotate(duration: 1us); }");
            assertThat(schedule.getEvents()).extracting(PulseEvent::getStartNs).containsExactly(0.0, 10.0);
            assertEquals(1010.0, schedule.getDurationNs(), EPS);
        }

        @Test
        @DisplayName("逻辑子句不占用时间")
        void testLogicClausesTakeNoTime() {
            PulseSchedule schedule = schedule("let q = Register(1); Superpose(); Flip(target: 0);"
                    + " Wait(duration: 3dt);");
            assertThat(schedule.size()).isEqualTo(1);
            assertEquals(0.0, schedule.getEvents().get(0).getStartNs(), EPS);
            assertEquals(3.0, schedule.getDurationNs(), EPS);
        }

        @Test
        @DisplayName("没有脉冲子句时调度表为空")
        void testEmpty() {
            PulseSchedule schedule = schedule("let q = Register(1); Superpose();");
            assertThat(schedule.isEmpty()).isTrue();
            assertEquals(0.0, schedule.getDurationNs(), EPS);
        }
    }

    @Nested
    @DisplayName("Align 并行分支")
    class AlignTests {

        @Test
        @DisplayName("各分支从同一时刻开始")
        void testAlignBranchesShareStart() {
            PulseSchedule schedule = schedule(PARALLEL);
            assertThat(schedule.size()).isEqualTo(2);

            Map<Integer, PulseEvent> byTarget = new HashMap<>();
            for (PulseEvent event : schedule.getEvents()) {
                byTarget.put(event.getTarget(), event);
            }
            assertEquals(0.0, byTarget.get(0).getStartNs(), EPS);
            assertEquals(0.0, byTarget.get(1).getStartNs(), EPS);
            assertEquals(10.0, byTarget.get(0).getDurationNs(), EPS);
            assertEquals(25.0, byTarget.get(1).getDurationNs(), EPS);
            assertEquals(25.0, schedule.getDurationNs(), EPS);
            assertEquals("q[0]", byTarget.get(0).getBranch());
            assertEquals("q[1]", byTarget.get(1).getBranch());
        }

        @Test
        @DisplayName("Align 之后的子句从最长分支结束处开始")
        void testCursorAfterAlign() {
            PulseSchedule schedule = schedule(PARALLEL + "\nAnalog(target: q[0]) { Acquire(duration: 4ns); }");
            PulseEvent acquire = schedule.getEvents().get(schedule.size() - 1);
            assertThat(acquire.getKind()).isEqualTo(OperationKind.ACQUIRE);
            assertEquals(25.0, acquire.getStartNs(), EPS);
            assertThat(acquire.getBranch()).isNull();
        }

        @Test
        @DisplayName("非 branch 子句各自成为并行分支")
        void testUnlabeledChildren() {
            PulseSchedule schedule = schedule("let q = Register(1); Align { Wait(duration: 5ns); Wait(duration: 8ns); }");
            assertThat(schedule.getEvents()).extracting(PulseEvent::getStartNs).containsExactly(0.0, 0.0);
            assertThat(schedule.getEvents()).extracting(PulseEvent::getBranch).containsOnlyNulls();
            assertEquals(8.0, schedule.getDurationNs(), EPS);
        }

        @Test
        @DisplayName("分支内嵌套 Align 的最长路径计入外层分支")
        void testNestedAlign() {
            PulseSchedule schedule = schedule(String.join("\n",
                    "let q = Register(2);",
                    "Align {",
                    "    branch q[0] {",
                    "        Rotate(duration: 10ns);",
                    "        Align {",
                    "            branch q[0] { Wait(duration: 5ns); }",
                    "            branch q[1] { Wait(duration: 20ns); }",
                    "        }",
                    "    }",
                    "    branch q[1] { Wait(duration: 15ns); }",
                    "}"));
            List<PulseEvent> events = schedule.getEvents();
            assertThat(events).extracting(PulseEvent::getStartNs).containsExactly(0.0, 0.0, 10.0, 10.0);
            assertThat(events).extracting(PulseEvent::getTarget).containsExactly(0, 1, 0, 1);
            assertEquals(30.0, schedule.getDurationNs(), EPS);
        }
    }

    @Nested
    @DisplayName("寄存器过滤")
    class FilterTests {

        @Test
        @DisplayName("被过滤的事件仍推进时间")
        void testFilterKeepsTiming() {
            String source = "let q = Register(1); let r = Register(1);\n"
                    + "Analog(target: r[0]) { Wait(duration: 10ns); }\n"
                    + "Analog(target: q[0]) { Rotate(duration: 5ns); }";
            PulseSchedule filtered = schedule(source, "q");
            assertThat(filtered.size()).isEqualTo(1);
            assertEquals(10.0, filtered.getEvents().get(0).getStartNs(), EPS);
            assertThat(schedule(source).size()).isEqualTo(2);
        }

        @Test
        @DisplayName("过滤寄存器未声明时报错")
        void testUnknownFilter() {
            assertThatThrownBy(() -> schedule(SEQUENTIAL, "zz")).isInstanceOf(CompileException.class);
        }
    }
}
