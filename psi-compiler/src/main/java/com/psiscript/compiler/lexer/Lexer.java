package com.psiscript.compiler.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * PsiScript 词法分析器
 *
 * <p>只识别 {@code ;}、{@code {}、{@code }} 三个控制字符和 {@code //} 行注释，
 * 其余字符原样累积为子句正文。子句内部的连续空白（含换行）折叠为单个空格。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;

    private int current = 0;
    private int line = 1;
    private int column = 1;

    // 当前子句的起始位置
    private int clauseLine = 1;
    private int clauseColumn = 1;
    private int clauseOffset = 0;
    private final StringBuilder clause = new StringBuilder();

    public Lexer(String source, String fileName) {
        this.source = source != null ? source : "";
        this.fileName = fileName;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        while (!isAtEnd()) {
            char c = peek();
            switch (c) {
                case ';':
                    flushClause(tokens);
                    tokens.add(new Token(TokenType.SEMICOLON, ";", line, column, current));
                    advance();
                    break;
                case '{':
                    flushClause(tokens);
                    tokens.add(new Token(TokenType.LBRACE, "{", line, column, current));
                    advance();
                    break;
                case '}':
                    flushClause(tokens);
                    tokens.add(new Token(TokenType.RBRACE, "}", line, column, current));
                    advance();
                    break;
                case '/':
                    if (peekNext() == '/') {
                        // 单行注释
                        while (!isAtEnd() && peek() != '\n') advance();
                    } else {
                        append(advance());
                    }
                    break;
                default:
                    append(advance());
                    break;
            }
        }
        flushClause(tokens);
        tokens.add(new Token(TokenType.EOF, "", line, column, current));
        return tokens;
    }

    // === 辅助方法 ===

    private void append(char c) {
        if (Character.isWhitespace(c)) {
            if (clause.length() > 0 && clause.charAt(clause.length() - 1) != ' ') {
                clause.append(' ');
            }
            return;
        }
        if (clause.length() == 0) {
            clauseLine = line;
            clauseColumn = column - 1;
            clauseOffset = current - 1;
        }
        clause.append(c);
    }

    private void flushClause(List<Token> tokens) {
        String text = clause.toString().trim();
        clause.setLength(0);
        if (!text.isEmpty()) {
            tokens.add(new Token(TokenType.CLAUSE, text, clauseLine, clauseColumn, clauseOffset));
        }
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }
}
