package com.psiscript.compiler.parser;

import com.psiscript.compiler.ast.Statement;
import com.psiscript.compiler.lexer.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("StatementParser 测试")
class StatementParserTest {

    private List<Statement> parse(String source) {
        return new StatementParser(new Lexer(source, "test.psi")).parse();
    }

    @Nested
    @DisplayName("语句树结构")
    class TreeTests {

        @Test
        @DisplayName("分号分隔的叶子语句")
        void testLeaves() {
            List<Statement> statements = parse("let q = Register(2); Superpose(); Flip(target: 1);");
            assertThat(statements).extracting(Statement::getText)
                    .containsExactly("let q = Register(2)", "Superpose()", "Flip(target: 1)");
            assertThat(statements).noneMatch(Statement::hasChildren);
        }

        @Test
        @DisplayName("花括号打开子作用域")
        void testNestedBlock() {
            List<Statement> statements = parse(
                    "Align {\n  branch q[0] { Rotate(duration: 10ns); }\n  branch q[1] { Wait(duration: 25ns); }\n}");
            assertThat(statements).hasSize(1);
            Statement align = statements.get(0);
            assertThat(align.getText()).isEqualTo("Align");
            assertThat(align.getChildren()).extracting(Statement::getText)
                    .containsExactly("branch q[0]", "branch q[1]");
            assertThat(align.getChildren().get(1).getChildren().get(0).getText())
                    .isEqualTo("Wait(duration: 25ns)");
        }

        @Test
        @DisplayName("最后一条语句可以省略分号")
        void testTrailingClause() {
            assertThat(parse("Superpose(); Measure()")).extracting(Statement::getText)
                    .containsExactly("Superpose()", "Measure()");
        }

        @Test
        @DisplayName("空子句被丢弃")
        void testEmptyClauses() {
            assertThat(parse(";;  ; Superpose();;")).hasSize(1);
        }

        @Test
        @DisplayName("裸块成为文本为空的语句")
        void testBareBlock() {
            List<Statement> statements = parse("{ Superpose(); }");
            assertThat(statements).hasSize(1);
            assertThat(statements.get(0).getText()).isEmpty();
            assertThat(statements.get(0).getChildren()).hasSize(1);
        }

        @Test
        @DisplayName("语句携带源位置")
        void testLocation() {
            Statement stmt = parse("\nFlip(target: 0);").get(0);
            assertThat(stmt.getLocation().getFile()).isEqualTo("test.psi");
            assertThat(stmt.getLocation().getLine()).isEqualTo(2);
        }

        @Test
        @DisplayName("子语句列表不可修改")
        void testImmutableChildren() {
            Statement align = parse("Align { Wait(duration: 1ns); }").get(0);
            assertThatThrownBy(() -> align.getChildren().clear())
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("花括号不平衡")
    class UnbalancedTests {

        @Test
        @DisplayName("多余的右花括号")
        void testExtraClose() {
            assertThatThrownBy(() -> parse("Superpose(); }"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("unexpected '}'")
                    .hasMessageContaining("at line 1, column 14");
        }

        @Test
        @DisplayName("未闭合的块")
        void testUnclosed() {
            assertThatThrownBy(() -> parse("Analog(target: q[0])\n{ Wait(duration: 5ns);"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("never closed")
                    .hasMessageContaining("at line 2, column 1");
        }
    }
}
