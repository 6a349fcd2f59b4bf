package com.psiscript.compiler.lexer;

/**
 * 词法单元类型
 *
 * <p>语句树只关心三个控制字符，其余文本一律作为子句正文保留。</p>
 */
public enum TokenType {
    /** 子句正文（已去除注释、首尾空白） */
    CLAUSE,
    /** ; */
    SEMICOLON,
    /** { */
    LBRACE,
    /** } */
    RBRACE,
    EOF
}
