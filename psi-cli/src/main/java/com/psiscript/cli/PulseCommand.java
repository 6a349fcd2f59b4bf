package com.psiscript.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * picocli pulse 子命令：只构建并打印脉冲调度表
 */
@Command(name = "pulse", description = "从 PsiScript 程序构建脉冲调度表")
public class PulseCommand implements Callable<Integer> {

    @Parameters(index = "0", description = ".psi 文件路径")
    String script;

    @Option(names = "--register", description = "只保留该寄存器的事件（默认全部）")
    String register;

    @Option(names = "--json", description = "输出 JSON 而不是文本表格")
    boolean json;

    @Option(names = {"-v", "--verbose"}, description = "输出详细日志")
    boolean verbose;

    @Override
    public Integer call() {
        Main.configureLogging(verbose);
        return new CompileRunner(System.out, System.err).scheduleFile(script, register, json);
    }
}
