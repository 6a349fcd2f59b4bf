package com.psiscript.compiler.analysis;

import com.psiscript.compiler.parser.ParseException;

/**
 * 角度表达式常量折叠器（递归下降）。
 *
 * <p>只接受数字、{@code + - * /}、一元正负号、括号，以及常量 {@code PI}/{@code pi}/{@code π}
 * 和 {@code TAU}/{@code tau}/{@code τ}。其他任何内容都视为解析错误。</p>
 */
public final class AngleEvaluator {

    private final String text;
    private int pos;

    private AngleEvaluator(String text) {
        this.text = text;
    }

    /**
     * 求值角度表达式（弧度）
     *
     * @throws ParseException 表达式为空或包含不支持的内容
     */
    public static double evaluate(String expression) {
        if (expression == null || expression.trim().isEmpty()) {
            throw new ParseException("Empty angle expression");
        }
        AngleEvaluator evaluator = new AngleEvaluator(expression);
        double value = evaluator.parseSum();
        evaluator.skipWhitespace();
        if (evaluator.pos < evaluator.text.length()) {
            throw evaluator.error("unexpected '" + evaluator.text.charAt(evaluator.pos) + "'");
        }
        return value;
    }

    // 加减
    private double parseSum() {
        double left = parseProduct();
        while (true) {
            skipWhitespace();
            if (match('+')) {
                left += parseProduct();
            } else if (match('-')) {
                left -= parseProduct();
            } else {
                return left;
            }
        }
    }

    // 乘除
    private double parseProduct() {
        double left = parseUnary();
        while (true) {
            skipWhitespace();
            if (match('*')) {
                left *= parseUnary();
            } else if (match('/')) {
                double right = parseUnary();
                if (right == 0.0) {
                    throw error("division by zero");
                }
                left /= right;
            } else {
                return left;
            }
        }
    }

    private double parseUnary() {
        skipWhitespace();
        if (match('-')) {
            return -parseUnary();
        }
        if (match('+')) {
            return parseUnary();
        }
        return parsePrimary();
    }

    private double parsePrimary() {
        skipWhitespace();
        if (pos >= text.length()) {
            throw error("unexpected end of expression");
        }
        char c = text.charAt(pos);
        if (c == '(') {
            pos++;
            double value = parseSum();
            skipWhitespace();
            if (!match(')')) {
                throw error("missing ')'");
            }
            return value;
        }
        if (Character.isDigit(c) || c == '.') {
            return number();
        }
        if (c == 'π') {
            pos++;
            return Math.PI;
        }
        if (c == 'τ') {
            pos++;
            return 2 * Math.PI;
        }
        if (Character.isLetter(c)) {
            return constant();
        }
        throw error("unexpected '" + c + "'");
    }

    private double number() {
        int start = pos;
        while (pos < text.length() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
            pos++;
        }
        if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                while (pos < text.length() && Character.isDigit(text.charAt(pos))) pos++;
            } else {
                pos = mark;
            }
        }
        String literal = text.substring(start, pos);
        try {
            return Double.parseDouble(literal);
        } catch (NumberFormatException e) {
            throw error("invalid number '" + literal + "'");
        }
    }

    private double constant() {
        int start = pos;
        while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
            pos++;
        }
        String name = text.substring(start, pos);
        switch (name) {
            case "PI":
            case "pi":
                return Math.PI;
            case "TAU":
            case "tau":
                return 2 * Math.PI;
            default:
                throw error("unknown name '" + name + "'");
        }
    }

    // === 辅助方法 ===

    private boolean match(char expected) {
        if (pos < text.length() && text.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private ParseException error(String detail) {
        return new ParseException("Invalid angle expression '" + text + "': " + detail);
    }
}
