package com.psiscript.cli;

import com.psiscript.backend.CompileOptions;
import com.psiscript.backend.CompileResult;
import com.psiscript.backend.PsiCompiler;
import com.psiscript.backend.pulse.LoggingPulseBackend;
import com.psiscript.backend.pulse.PulseSchedule;
import com.psiscript.backend.pulse.PulseSimulator;
import com.psiscript.backend.pulse.SimulationSummary;
import com.psiscript.compiler.CompileException;
import com.psiscript.compiler.parser.ParseException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 编译执行器：负责文件读写与结果输出，返回进程退出码
 */
public class CompileRunner {

    private static final Logger LOG = Logger.getLogger(CompileRunner.class.getName());

    private final PrintStream out;
    private final PrintStream err;
    private final PsiCompiler compiler = new PsiCompiler();

    public CompileRunner(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    /**
     * 编译文件为 OpenQASM，并按需输出脉冲调度表
     */
    public int compileFile(String filePath, String outputPath, CompileOptions options,
                           String pulseJson, boolean pulseTable, boolean simulatePulses) {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + filePath);
            return 1;
        }

        try {
            CompileResult result = compiler.compileFile(path, options);
            LOG.info("Compiled " + path.getFileName() + " (register " + result.getRegister() + ")");

            if (outputPath != null) {
                writeText(Paths.get(outputPath), result.getQasm());
                out.println("Wrote OpenQASM to " + outputPath);
            } else {
                out.println(result.getQasm());
            }

            PulseSchedule schedule = result.hasSchedule() ? result.getSchedule() : PulseSchedule.empty();
            if (pulseJson != null) {
                if (pulseJson.equals("-")) {
                    out.println(schedule.toJson());
                } else {
                    writeText(Paths.get(pulseJson), schedule.toJson());
                    out.println("Wrote pulse schedule to " + pulseJson);
                }
            }
            if (pulseTable) {
                out.println(schedule.toTable());
            }
            if (simulatePulses) {
                SimulationSummary summary = new PulseSimulator<>(new LoggingPulseBackend()).run(schedule);
                out.println("Pulse simulation complete: " + summary);
            }
            return 0;
        } catch (ParseException | CompileException e) {
            err.println("编译错误: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            LOG.log(Level.WARNING, "读写文件失败: " + filePath, e);
            err.println("错误: " + e.getMessage());
            return 1;
        }
    }

    /**
     * 只构建脉冲调度表
     */
    public int scheduleFile(String filePath, String register, boolean json) {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + filePath);
            return 1;
        }

        try {
            String source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
            PulseSchedule schedule = compiler.schedule(source, path.getFileName().toString(), register);
            LOG.info("Scheduled " + schedule.size() + " pulse events from " + path.getFileName());
            out.println(json ? schedule.toJson() : schedule.toTable());
            return 0;
        } catch (ParseException | CompileException e) {
            err.println("编译错误: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            LOG.log(Level.WARNING, "读取文件失败: " + filePath, e);
            err.println("错误: " + e.getMessage());
            return 1;
        }
    }

    private static void writeText(Path target, String text) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(target, text.getBytes(StandardCharsets.UTF_8));
    }
}
