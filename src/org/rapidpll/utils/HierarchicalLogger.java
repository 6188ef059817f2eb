package org.rapidpll.utils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

public class HierarchicalLogger {
    public static class LevelPrefixFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            return record.getLevel() + ": " + formatMessage(record) + "\n";
        }
    }

    private final Logger logger;
    private int logHierDepth = 0;

    public HierarchicalLogger(String name) {
        logger = Logger.getLogger(name);
        logger.setUseParentHandlers(false);
    }

    public void setLevel(Level level) {
        logger.setLevel(level);
    }

    public boolean isLoggable(Level level) {
        return logger.isLoggable(level);
    }

    public void addHandler(Handler handler) {
        logger.addHandler(handler);
    }

    // closes and detaches every handler, including ones left by an earlier logger of the same name
    public void close() {
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
            handler.close();
        }
    }

    public int getHandlerNum() {
        return logger.getHandlers().length;
    }

    public void log(Level level, String msg) {
        if (logHierDepth > 0) {
            msg = "#".repeat(logHierDepth) + " " + msg;
        }
        logger.log(level, msg);
    }

    public void severe(String msg) {
        this.log(Level.SEVERE, msg);
    }

    public void warning(String msg) {
        this.log(Level.WARNING, msg);
    }

    public void info(String msg) {
        this.log(Level.INFO, msg);
    }

    public void config(String msg) {
        this.log(Level.CONFIG, msg);
    }

    public void fine(String msg) {
        this.log(Level.FINE, msg);
    }

    public void finest(String msg) {
        this.log(Level.FINEST, msg);
    }

    public void newSubStep() {
        logHierDepth++;
    }

    public void endSubStep() {
        if (logHierDepth > 0) {
            logHierDepth--;
        }
    }

    public int getHierDepth() {
        return logHierDepth;
    }

    public void logHeader(Level level, String headerName) {
        int headerLen = 80;
        int headerNameLen = headerName.length();
        String separatorStr = "=".repeat(headerLen);
        int frontBlankSpace = Math.max(0, (headerLen - 4 - headerNameLen) / 2);
        int backBlankSpace = Math.max(0, headerLen - 4 - headerNameLen - frontBlankSpace);
        String nameStr = "==" + " ".repeat(frontBlankSpace) + headerName + " ".repeat(backBlankSpace) + "==";
        log(level, separatorStr);
        log(level, nameStr);
        log(level, separatorStr);
    }

    public void infoHeader(String name) {
        logHeader(Level.INFO, name);
    }

    public void logKeyValues(Level level, String title, Map<String, ?> entries) {
        if (!logger.isLoggable(level)) {
            return;
        }
        int keyWidth = 0;
        for (String key : entries.keySet()) {
            keyWidth = Math.max(keyWidth, key.length());
        }
        log(level, title);
        newSubStep();
        for (Map.Entry<String, ?> entry : entries.entrySet()) {
            String key = entry.getKey();
            log(level, key + " ".repeat(keyWidth - key.length()) + " : " + entry.getValue());
        }
        endSubStep();
    }

    public static HierarchicalLogger createLogger(String logName, Path logFilePath, boolean enableConsole, Level level) {
        HierarchicalLogger logger = new HierarchicalLogger(logName);
        logger.close();

        if (logFilePath != null) {
            try {
                FileHandler fileHandler = new FileHandler(logFilePath.toString(), false);
                fileHandler.setFormatter(new LevelPrefixFormatter());
                fileHandler.setLevel(Level.ALL);
                logger.addHandler(fileHandler);
            } catch (IOException e) {
                throw new UncheckedIOException("Fail to open log file: " + logFilePath, e);
            }
        }

        if (enableConsole) {
            ConsoleHandler consoleHandler = new ConsoleHandler();
            consoleHandler.setFormatter(new LevelPrefixFormatter());
            consoleHandler.setLevel(Level.ALL);
            logger.addHandler(consoleHandler);
        }
        logger.setLevel(level);

        return logger;
    }

    public static HierarchicalLogger createLogger(String logName, Path logFilePath, boolean enableConsole) {
        return createLogger(logName, logFilePath, enableConsole, Level.INFO);
    }

    public static HierarchicalLogger createPseudoLogger(String logName) {
        return createLogger(logName, null, false, Level.INFO);
    }
}
