package com.psiscript.compiler.predicate;

import com.psiscript.compiler.parser.ParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ControlDecomposer 测试")
class ControlDecomposerTest {

    @Test
    @DisplayName("合取谓词按出现顺序拆分")
    void testConjunction() {
        ControlDecomposition result = ControlDecomposer.decompose("q[0] == 1 && q[2] == 0 && q[3]", "q");
        assertThat(result.isSupported()).isTrue();
        assertThat(result.getControls()).containsExactly(
                new Control(0, 1), new Control(2, 0), new Control(3, 1));
        assertThat(result.getControls().get(1).isNegated()).isTrue();
    }

    @Test
    @DisplayName("null 谓词没有控制")
    void testNull() {
        ControlDecomposition result = ControlDecomposer.decompose(null, "q");
        assertThat(result.isSupported()).isTrue();
        assertThat(result.size()).isZero();
    }

    @Test
    @DisplayName("恒真项被跳过")
    void testTrivialTerms() {
        ControlDecomposition result = ControlDecomposer.decompose("true && q[1]==0 && 1", "q");
        assertThat(result.getControls()).containsExactly(new Control(1, 0));
    }

    @Test
    @DisplayName("析取不支持")
    void testDisjunction() {
        assertThat(ControlDecomposer.decompose("q[0] == 1 || q[1] == 1", "q").isSupported()).isFalse();
    }

    @Test
    @DisplayName("其他寄存器或其他形状的项不支持")
    void testUnsupportedTerms() {
        assertThat(ControlDecomposer.decompose("r[0] == 1", "q").isSupported()).isFalse();
        assertThat(ControlDecomposer.decompose("q[0] == 2", "q").isSupported()).isFalse();
        assertThat(ControlDecomposer.decompose("q[0] != 1", "q").isSupported()).isFalse();
    }

    @Test
    @DisplayName("不支持的分解没有控制列表")
    void testUnsupportedControls() {
        ControlDecomposition result = ControlDecomposition.unsupported();
        assertThatThrownBy(result::getControls).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("重复的下标合并，保留首次出现的位置")
    void testDuplicateIndices() {
        ControlDecomposition result = ControlDecomposer.decompose("q[2] == 0 && q[0] && q[2] == 0 && q[0] == 1", "q");
        assertThat(result.getControls()).containsExactly(new Control(2, 0), new Control(0, 1));
    }

    @Test
    @DisplayName("同一下标取值矛盾时不支持")
    void testContradiction() {
        assertThat(ControlDecomposer.decompose("q[0] == 1 && q[0] == 0", "q").isSupported()).isFalse();
        assertThat(ControlDecomposer.decompose("q[1] && q[1] == 0", "q").isSupported()).isFalse();
    }

    @Test
    @DisplayName("超出 int 范围的下标是解析错误")
    void testOversizedIndex() {
        assertThatThrownBy(() -> ControlDecomposer.decompose("q[99999999999] == 1", "q"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("'99999999999' is too large");
    }
}
