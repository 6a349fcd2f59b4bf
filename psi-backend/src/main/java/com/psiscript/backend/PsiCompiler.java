package com.psiscript.backend;

import com.psiscript.backend.pulse.PulseSchedule;
import com.psiscript.backend.pulse.PulseScheduler;
import com.psiscript.backend.qasm.GateCircuit;
import com.psiscript.backend.qasm.QasmLowering;
import com.psiscript.compiler.CompileException;
import com.psiscript.compiler.analysis.OperationResolver;
import com.psiscript.compiler.analysis.RegisterTable;
import com.psiscript.compiler.analysis.Resolution;
import com.psiscript.compiler.ast.Statement;
import com.psiscript.compiler.lexer.Lexer;
import com.psiscript.compiler.parser.StatementParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * PsiScript 编译器门面。
 * 管线：源码 → 语句树 → (操作流, 寄存器表) → {OpenQASM 电路, 脉冲调度表}。
 *
 * <p>每次调用都新建后端实例，调用之间不共享任何可变状态。</p>
 */
public class PsiCompiler {

    private static final Logger LOG = Logger.getLogger(PsiCompiler.class.getName());

    /**
     * 构建语句树
     */
    public List<Statement> parse(String source, String fileName) {
        return new StatementParser(new Lexer(source, fileName)).parse();
    }

    /**
     * 解析操作流。不带前缀的子句绑定到第一个声明的寄存器。
     */
    public Resolution resolve(String source, String fileName) {
        return new OperationResolver().resolve(parse(source, fileName), null);
    }

    /**
     * 编译为 OpenQASM 电路
     *
     * @param register 要降级的寄存器，null 表示第一个声明的寄存器；只过滤操作，不改变子句的寄存器绑定
     */
    public GateCircuit compileQasm(String source, String fileName, String register) {
        Resolution resolution = resolve(source, fileName);
        return lower(resolution, targetOf(resolution, register));
    }

    /**
     * 构建脉冲调度表
     *
     * @param filter 只保留该寄存器的事件，null 表示全部保留
     */
    public PulseSchedule schedule(String source, String fileName, String filter) {
        List<Statement> statements = parse(source, fileName);
        RegisterTable registers = RegisterTable.scan(statements);
        return new PulseScheduler(registers, filter).schedule(statements);
    }

    /**
     * 按配置完整编译
     */
    public CompileResult compile(String source, String fileName, CompileOptions options) {
        List<Statement> statements = parse(source, fileName);
        Resolution resolution = new OperationResolver().resolve(statements, null);
        String target = targetOf(resolution, options.getRegister());
        GateCircuit circuit = lower(resolution, target);

        PulseSchedule schedule = null;
        if (options.isBuildSchedule()) {
            String filter = options.isFilterPulses() ? target : null;
            schedule = new PulseScheduler(resolution.getRegisters(), filter).schedule(statements);
        }
        LOG.fine("Compiled " + fileName + " for register " + target);
        return new CompileResult(target, circuit, schedule);
    }

    /**
     * 编译文件
     */
    public CompileResult compileFile(Path file, CompileOptions options) throws IOException {
        String source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return compile(source, file.getFileName().toString(), options);
    }

    /**
     * 编译目标寄存器：显式指定的寄存器必须已声明
     */
    private static String targetOf(Resolution resolution, String register) {
        if (register == null) {
            return resolution.getDefaultRegister();
        }
        if (!resolution.getRegisters().contains(register)) {
            throw new CompileException("Register '" + register + "' not declared.");
        }
        return register;
    }

    private GateCircuit lower(Resolution resolution, String target) {
        int width = resolution.getRegisters().widthOf(target);
        return new QasmLowering(target, width).lower(resolution.getOperations());
    }
}
