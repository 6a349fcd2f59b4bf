package com.psiscript.cli;

import com.psiscript.backend.CompileOptions;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.util.concurrent.Callable;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PsiScript CLI 入口点（picocli）
 */
@Command(name = "psi", version = "PsiScript v0.1.0",
         mixinStandardHelpOptions = true,
         description = "将 PsiScript 程序编译为 OpenQASM 2.0 与脉冲调度表",
         subcommands = {PulseCommand.class})
public class Main implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "要编译的 .psi 文件")
    String script;

    @Option(names = "--register", description = "要编译的寄存器（默认第一个声明的寄存器）")
    String register;

    @Option(names = {"-o", "--out"}, description = "输出 .qasm 文件（省略时打印到标准输出）")
    String output;

    @Option(names = "--pulse-json", description = "将脉冲调度表写入 JSON 文件（'-' 表示标准输出）")
    String pulseJson;

    @Option(names = "--pulse-table", description = "打印脉冲调度表的文本表格")
    boolean pulseTable;

    @Option(names = "--simulate-pulses", description = "将脉冲调度表回放到日志后端")
    boolean simulatePulses;

    @Option(names = {"-v", "--verbose"}, description = "输出详细日志")
    boolean verbose;

    @Override
    public Integer call() {
        configureLogging(verbose);
        if (script == null) {
            System.err.println("错误: 缺少脚本文件参数");
            return 1;
        }
        CompileOptions options = new CompileOptions();
        options.setRegister(register);
        options.setBuildSchedule(pulseJson != null || pulseTable || simulatePulses);
        options.setFilterPulses(true);
        return new CompileRunner(System.out, System.err)
                .compileFile(script, output, options, pulseJson, pulseTable, simulatePulses);
    }

    /**
     * 调整 com.psiscript 日志级别：默认 INFO（编译里程碑），verbose 时输出 FINE 级别日志
     */
    static void configureLogging(boolean verbose) {
        Logger logger = Logger.getLogger("com.psiscript");
        if (!verbose) {
            logger.setLevel(Level.INFO);
            return;
        }
        logger.setLevel(Level.FINE);
        boolean hasHandler = false;
        for (Handler handler : logger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                hasHandler = true;
            }
        }
        if (!hasHandler) {
            ConsoleHandler handler = new ConsoleHandler();
            handler.setLevel(Level.FINE);
            logger.addHandler(handler);
        }
    }

    public static void main(String[] args) {
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = new CommandLine(new Main());
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(new CommandLine(new Main()).execute(args));
        }
    }

    /**
     * 获取控制台实际使用的字符编码名（native.encoding 反映操作系统原生编码）
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
