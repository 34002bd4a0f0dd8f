package com.scadflow.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import scadflow.runtime.integration.IntegrationConfiguration;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.concurrent.Callable;

/**
 * ScadFlow CLI 入口点（picocli）
 */
@Command(name = "scadflow", version = "ScadFlow v" + Main.VERSION,
         mixinStandardHelpOptions = true,
         description = "将 OpenSCAD 源码处理为 JSON 几何树")
public class Main implements Callable<Integer> {

    static final String VERSION = "0.1.0";

    @Parameters(arity = "0..1", description = ".scad 源码文件")
    String file;

    @Option(names = "-e", description = "处理代码片段")
    String expression;

    @Option(names = "--config", description = "配置文件（scadflow.* 键的 properties）")
    String configFile;

    @Option(names = "--no-modules", description = "关闭模块展开")
    boolean noModules;

    @Option(names = "--no-loops", description = "关闭循环展开")
    boolean noLoops;

    @Option(names = "--no-conditionals", description = "关闭条件展开")
    boolean noConditionals;

    @Option(names = "--no-cache", description = "关闭缓存")
    boolean noCache;

    @Option(names = "--metrics", description = "输出性能指标")
    boolean metrics;

    @Option(names = {"-v", "--verbose"}, description = "输出详细日志")
    boolean verbose;

    @Override
    public Integer call() throws IOException {
        LoggingSetup.configure(verbose);
        IntegrationConfiguration configuration = buildConfiguration();

        if (expression != null) {
            return new RenderRunner(configuration, metrics, System.out, System.err).render(expression);
        }
        if (file != null) {
            return new RenderRunner(configuration, metrics, System.out, System.err).renderFile(file);
        }
        new ReplRunner(configuration).run();
        return 0;
    }

    IntegrationConfiguration buildConfiguration() throws IOException {
        IntegrationConfiguration base = IntegrationConfiguration.defaults();
        if (configFile != null) {
            Properties props = new Properties();
            try (InputStream in = Files.newInputStream(Paths.get(configFile))) {
                props.load(in);
            }
            base = IntegrationConfiguration.fromProperties(props);
        }
        IntegrationConfiguration.Builder builder = base.toBuilder();
        if (noModules) builder.enableModuleProcessing(false);
        if (noLoops) builder.enableLoopProcessing(false);
        if (noConditionals) builder.enableConditionalProcessing(false);
        if (noCache) builder.enableCaching(false);
        if (metrics) builder.enablePerformanceTracking(true);
        return builder.build();
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
