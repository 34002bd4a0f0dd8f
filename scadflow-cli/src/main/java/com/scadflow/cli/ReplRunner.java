package com.scadflow.cli;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import scadflow.runtime.Result;
import scadflow.runtime.geometry.GeometryNode;
import scadflow.runtime.integration.IntegrationConfiguration;
import scadflow.runtime.integration.IntegrationError;
import scadflow.runtime.integration.IntegrationPipeline;
import scadflow.runtime.integration.ProcessingResult;
import scadflow.runtime.perf.PerformanceMetrics;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * jline REPL 交互模式
 *
 * <p>每次输入与此前成功的输入拼接后整体处理，因此模块定义和变量在会话内保留。</p>
 */
public class ReplRunner {

    private final IntegrationPipeline pipeline;
    private final StringBuilder session = new StringBuilder();
    private PerformanceMetrics lastMetrics;

    public ReplRunner(IntegrationConfiguration configuration) {
        this.pipeline = new IntegrationPipeline(configuration);
    }

    public void run() {
        Result<Void, IntegrationError> init = pipeline.initialize();
        if (init.isErr()) {
            System.err.println("错误: " + init.getError().getMessage());
            return;
        }
        System.out.println("ScadFlow " + Main.VERSION);
        System.out.println("输入 :help 获取帮助，:quit 退出");
        System.out.println();

        try {
            Terminal terminal = TerminalBuilder.builder().system(true).build();
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .parser(new DefaultParser())
                    .variable(LineReader.SECONDARY_PROMPT_PATTERN, "... ")
                    .build();
            runLoop(reader);
        } catch (IOException e) {
            System.err.println("终端初始化失败: " + e.getMessage());
            runFallbackLoop();
        }
        System.out.println("\n再见！");
    }

    private void runLoop(LineReader reader) {
        StringBuilder buffer = new StringBuilder();
        while (true) {
            try {
                String line = reader.readLine(buffer.length() > 0 ? "... " : "scad> ");
                if (line == null) break;
                if (!accept(buffer, line)) break;
            } catch (UserInterruptException e) {
                buffer.setLength(0);
            } catch (EndOfFileException e) {
                break;
            }
        }
    }

    private void runFallbackLoop() {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        StringBuilder buffer = new StringBuilder();
        while (true) {
            try {
                System.out.print(buffer.length() > 0 ? "... " : "scad> ");
                System.out.flush();
                String line = reader.readLine();
                if (line == null) break;
                if (!accept(buffer, line)) break;
            } catch (IOException e) {
                System.err.println("读取输入时出错: " + e.getMessage());
                break;
            }
        }
    }

    /**
     * @return false 表示退出
     */
    boolean accept(StringBuilder buffer, String line) {
        if (buffer.length() == 0 && line.trim().startsWith(":")) {
            return handleCommand(line.trim());
        }
        buffer.append(line).append('\n');
        if (hasUnclosedBrackets(buffer)) {
            return true;
        }
        String input = buffer.toString();
        buffer.setLength(0);
        if (!input.trim().isEmpty()) {
            evaluate(input);
        }
        return true;
    }

    void evaluate(String input) {
        Result<ProcessingResult, IntegrationError> result = pipeline.processCode(session + input);
        if (result.isErr()) {
            IntegrationError error = result.getError();
            System.err.println(error.getCategory().getLabel() + ": " + error.getMessage());
            for (String suggestion : error.getRecoverySuggestions()) {
                System.err.println("  - " + suggestion);
            }
            return;
        }
        session.append(input);
        ProcessingResult value = result.getValue();
        lastMetrics = value.getProcessingMetadata().getPerformanceMetrics();
        for (String echo : value.getProcessingMetadata().getEchoMessages()) {
            System.out.println(echo);
        }
        printTree(value.getGeometryNodes(), "");
    }

    private void printTree(List<GeometryNode> nodes, String indent) {
        for (GeometryNode node : nodes) {
            System.out.println(indent + node.getId() + " " + node.getGeometry());
            printTree(node.getChildren(), indent + "  ");
        }
    }

    static boolean hasUnclosedBrackets(CharSequence text) {
        int depth = 0;
        boolean inString = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"': inString = true; break;
                case '{': case '(': case '[': depth++; break;
                case '}': case ')': case ']': depth--; break;
                default: break;
            }
        }
        return depth > 0;
    }

    private boolean handleCommand(String command) {
        switch (command) {
            case ":quit":
            case ":q":
                return false;
            case ":help":
            case ":h":
                printHelp();
                return true;
            case ":reset":
                session.setLength(0);
                lastMetrics = null;
                System.out.println("会话已重置");
                return true;
            case ":metrics":
                System.out.println(lastMetrics != null ? lastMetrics : "没有可用的性能指标");
                return true;
            default:
                System.out.println("未知命令: " + command);
                System.out.println("输入 :help 获取帮助");
                return true;
        }
    }

    private void printHelp() {
        System.out.println("REPL 命令:");
        System.out.println("  :help, :h     显示此帮助");
        System.out.println("  :quit, :q     退出 REPL");
        System.out.println("  :reset        清空会话中的模块与变量");
        System.out.println("  :metrics      显示上次处理的性能指标");
        System.out.println();
        System.out.println("示例:");
        System.out.println("  cube([2, 3, 4]);");
        System.out.println("  module box(s) { cube(s); }");
        System.out.println("  for (i = [0:2]) translate([i * 10, 0, 0]) box(5);");
        System.out.println();
        System.out.println("未闭合的括号会自动进入多行模式");
    }
}
