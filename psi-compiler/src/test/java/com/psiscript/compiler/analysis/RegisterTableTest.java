package com.psiscript.compiler.analysis;

import com.psiscript.compiler.CompileException;
import com.psiscript.compiler.ast.Statement;
import com.psiscript.compiler.lexer.Lexer;
import com.psiscript.compiler.parser.ParseException;
import com.psiscript.compiler.parser.StatementParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RegisterTable 测试")
class RegisterTableTest {

    private List<Statement> parse(String source) {
        return new StatementParser(new Lexer(source)).parse();
    }

    @Test
    @DisplayName("按声明顺序收集寄存器，包括嵌套块中的声明")
    void testScan() {
        RegisterTable table = RegisterTable.scan(parse("let q = Register(2); Analog(target: q[0]) { r = Register(3); }"));
        assertThat(table.asMap()).containsExactly(entry("q", 2), entry("r", 3));
        assertThat(table.first()).isEqualTo("q");
        assertThat(table.widthOf("r")).isEqualTo(3);
    }

    @Test
    @DisplayName("没有声明时报错")
    void testNoRegisters() {
        assertThatThrownBy(() -> RegisterTable.scan(parse("Superpose();")))
                .isInstanceOf(CompileException.class)
                .hasMessage("No registers declared in the PsiScript.");
    }

    @Test
    @DisplayName("相同宽度重复声明可以接受，不同宽度报错")
    void testRedeclare() {
        RegisterTable table = new RegisterTable();
        table.declare("q", 2);
        table.declare("q", 2);
        assertThat(table.size()).isEqualTo(1);
        assertThatThrownBy(() -> table.declare("q", 3)).isInstanceOf(CompileException.class);
    }

    @Test
    @DisplayName("宽度必须为正")
    void testZeroWidth() {
        assertThatThrownBy(() -> new RegisterTable().declare("q", 0)).isInstanceOf(CompileException.class);
    }

    @Test
    @DisplayName("查询未声明的寄存器")
    void testUndeclared() {
        RegisterTable table = new RegisterTable();
        table.declare("q", 1);
        assertThat(table.contains("r")).isFalse();
        assertThatThrownBy(() -> table.widthOf("r"))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("'r'");
    }

    @Test
    @DisplayName("超出 int 范围的宽度是解析错误")
    void testOversizedWidth() {
        assertThatThrownBy(() -> RegisterTable.scan(parse("let q = Register(99999999999);")))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("let q = Register(99999999999)");
    }
}
