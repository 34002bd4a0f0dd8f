package com.scadflow.cli;

import scadflow.runtime.Result;
import scadflow.runtime.integration.IntegrationConfiguration;
import scadflow.runtime.integration.IntegrationError;
import scadflow.runtime.integration.IntegrationPipeline;
import scadflow.runtime.integration.ProcessingResult;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 渲染文件或代码片段为 JSON 几何树
 */
public class RenderRunner {

    private final IntegrationConfiguration configuration;
    private final boolean metrics;
    private final PrintStream out;
    private final PrintStream err;

    public RenderRunner(IntegrationConfiguration configuration, boolean metrics, PrintStream out, PrintStream err) {
        this.configuration = configuration;
        this.metrics = metrics;
        this.out = out;
        this.err = err;
    }

    /**
     * @return 退出码
     */
    public int renderFile(String filePath) {
        Path path = Paths.get(filePath);
        if (!Files.isReadable(path)) {
            err.println("错误: 无法读取文件 - " + filePath);
            return 1;
        }
        String source;
        try {
            source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("错误: 读取文件失败 - " + e.getMessage());
            return 1;
        }
        return render(source);
    }

    public int render(String source) {
        JsonOutput json = new JsonOutput(true);
        Result<ProcessingResult, IntegrationError> result = IntegrationPipeline.processSource(source, configuration);
        if (result.isErr()) {
            IntegrationError error = result.getError();
            err.println(error.getCategory().getLabel() + " (" + error.getStage().getLabel() + "): "
                    + error.getMessage());
            out.println(json.render(error));
            return 1;
        }
        out.println(json.render(result.getValue(), metrics));
        return 0;
    }
}
