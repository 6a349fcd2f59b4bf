package com.psiscript.compiler.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    /** 扫描源码，返回所有 token（含 EOF） */
    private List<Token> scan(String source) {
        return new Lexer(source, "<test>").scanTokens();
    }

    /** 扫描源码，返回非 EOF 的 token 类型 */
    private List<TokenType> types(String source) {
        return scan(source).stream()
                .filter(t -> t.getType() != TokenType.EOF)
                .map(Token::getType)
                .collect(Collectors.toList());
    }

    @Nested
    @DisplayName("控制字符")
    class ControlCharTests {

        @Test
        @DisplayName("分号与花括号")
        void testDelimiters() {
            assertEquals(Arrays.asList(TokenType.CLAUSE, TokenType.LBRACE, TokenType.CLAUSE,
                            TokenType.SEMICOLON, TokenType.RBRACE),
                    types("Analog(target: q[0]) { Wait(duration: 5ns); }"));
        }

        @Test
        @DisplayName("空输入只有 EOF")
        void testEmpty() {
            List<Token> tokens = scan("");
            assertEquals(1, tokens.size());
            assertEquals(TokenType.EOF, tokens.get(0).getType());
        }

        @Test
        @DisplayName("null 源码视为空输入")
        void testNullSource() {
            assertEquals(TokenType.EOF, new Lexer(null).scanTokens().get(0).getType());
        }
    }

    @Nested
    @DisplayName("子句正文")
    class ClauseTests {

        @Test
        @DisplayName("连续空白折叠为单个空格")
        void testWhitespaceCollapse() {
            List<Token> tokens = scan("Rotate(axis: X,\n        angle:   PI/2)");
            assertEquals("Rotate(axis: X, angle: PI/2)", tokens.get(0).getLexeme());
        }

        @Test
        @DisplayName("行注释被剥离")
        void testLineComment() {
            List<Token> tokens = scan("let q = Register(2); // 两个比特\nSuperpose()");
            assertEquals("let q = Register(2)", tokens.get(0).getLexeme());
            assertEquals(TokenType.SEMICOLON, tokens.get(1).getType());
            assertEquals("Superpose()", tokens.get(2).getLexeme());
        }

        @Test
        @DisplayName("单个斜杠保留在子句中")
        void testSingleSlash() {
            assertEquals("Phase(angle: PI/4)", scan("Phase(angle: PI/4)").get(0).getLexeme());
        }

        @Test
        @DisplayName("记录子句起始位置")
        void testLocation() {
            Token token = scan("\n   Flip(target: 1)").get(0);
            assertEquals(2, token.getLine());
            assertEquals(4, token.getColumn());
            assertEquals(4, token.getOffset());
        }
    }
}
