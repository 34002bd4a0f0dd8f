package com.scadflow.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * 从类路径加载日志配置，根 logger 只挂一个输出到 stderr 的 ConsoleHandler
 */
final class LoggingSetup {

    static final String CONFIG_RESOURCE = "/scadflow-logging.properties";

    private LoggingSetup() {
    }

    static void configure(boolean verbose) {
        try (InputStream in = LoggingSetup.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("日志配置加载失败: " + e.getMessage());
        }
        if (verbose) {
            Logger.getLogger("").setLevel(Level.FINE);
        }
    }
}
