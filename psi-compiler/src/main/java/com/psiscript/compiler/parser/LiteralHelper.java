package com.psiscript.compiler.parser;

/**
 * 字面量解析辅助类：下标与寄存器宽度
 */
public final class LiteralHelper {

    private LiteralHelper() {
    }

    /**
     * 解析非负整数字面量
     *
     * @param digits  已由正则匹配为纯数字的文本
     * @param context 所在子句原文，用于错误信息
     * @throws ParseException 超出 int 范围
     */
    public static int parseIndex(String digits, String context) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new ParseException("Integer literal '" + digits + "' is too large in: " + context);
        }
    }
}
