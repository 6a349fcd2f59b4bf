package com.psiscript.compiler.analysis;

import com.psiscript.compiler.CompileException;
import com.psiscript.compiler.ast.Statement;
import com.psiscript.compiler.parser.LiteralHelper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 寄存器表：寄存器名 → 声明的量子比特宽度（保持声明顺序）。
 */
public final class RegisterTable {

    static final Pattern DECLARATION = Pattern.compile("(?:\\blet\\s+)?\\b(\\w+)\\s*=\\s*Register\\s*\\(\\s*(\\d+)\\s*\\)");

    private final Map<String, Integer> widths = new LinkedHashMap<>();

    /**
     * 扫描整棵语句树中的寄存器声明。没有任何声明时抛出 {@link CompileException}。
     */
    public static RegisterTable scan(List<Statement> statements) {
        RegisterTable table = new RegisterTable();
        table.collect(statements);
        if (table.isEmpty()) {
            throw new CompileException("No registers declared in the PsiScript.");
        }
        return table;
    }

    private void collect(List<Statement> statements) {
        for (Statement stmt : statements) {
            Matcher m = DECLARATION.matcher(stmt.getText());
            while (m.find()) {
                declare(m.group(1), LiteralHelper.parseIndex(m.group(2), stmt.getText()));
            }
            collect(stmt.getChildren());
        }
    }

    public void declare(String name, int width) {
        if (width <= 0) {
            throw new CompileException("Register '" + name + "' must have a positive width, got " + width);
        }
        Integer existing = widths.get(name);
        if (existing != null && existing != width) {
            throw new CompileException("Register '" + name + "' redeclared with width " + width
                    + " (previously " + existing + ")");
        }
        widths.put(name, width);
    }

    public boolean contains(String name) {
        return widths.containsKey(name);
    }

    /**
     * 获取寄存器宽度；未声明时抛出 {@link CompileException}
     */
    public int widthOf(String name) {
        Integer width = widths.get(name);
        if (width == null) {
            throw new CompileException("Register '" + name + "' not declared.");
        }
        return width;
    }

    /** 第一个声明的寄存器名 */
    public String first() {
        if (widths.isEmpty()) {
            throw new CompileException("No registers declared in the PsiScript.");
        }
        return widths.keySet().iterator().next();
    }

    public boolean isEmpty() {
        return widths.isEmpty();
    }

    public int size() {
        return widths.size();
    }

    public Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(widths);
    }

    @Override
    public String toString() {
        return widths.toString();
    }
}
