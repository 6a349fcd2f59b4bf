package com.psiscript.compiler.analysis;

import com.psiscript.compiler.CompileException;
import com.psiscript.compiler.ast.Statement;
import com.psiscript.compiler.op.Operation;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 操作解析器：按文档顺序（先序）遍历语句树，把每个子句解析为操作，
 * 并把上下文从父语句显式传递给子语句。
 */
public class OperationResolver {

    private static final Logger LOG = Logger.getLogger(OperationResolver.class.getName());

    /**
     * 解析语句树
     *
     * @param statements      顶层语句
     * @param defaultRegister 初始默认寄存器；为 null 时取第一个声明的寄存器
     * @return 操作流与寄存器表
     * @throws CompileException 没有寄存器声明，或指定的默认寄存器未声明
     */
    public Resolution resolve(List<Statement> statements, String defaultRegister) {
        RegisterTable registers = RegisterTable.scan(statements);
        String initial = defaultRegister != null ? defaultRegister : registers.first();
        if (!registers.contains(initial)) {
            throw new CompileException("Register '" + initial + "' not declared.");
        }

        ClauseResolver clauses = new ClauseResolver(registers);
        List<Operation> operations = new ArrayList<>();
        walk(statements, ResolveContext.initial(initial), clauses, operations);
        LOG.fine("Resolved " + operations.size() + " operations over registers " + registers);
        return new Resolution(operations, registers, initial);
    }

    private void walk(List<Statement> statements, ResolveContext context, ClauseResolver clauses,
                      List<Operation> out) {
        for (Statement stmt : statements) {
            ClauseResult result = clauses.resolve(stmt.getText(), context);
            if (result.hasOperation()) {
                out.add(result.getOperation());
            }
            // 覆盖上下文只作用于自己的子树
            walk(stmt.getChildren(), result.getChildContext(), clauses, out);
        }
    }
}
