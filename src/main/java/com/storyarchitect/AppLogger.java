package com.storyarchitect;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Simple logging utility that writes to both console and file.
 * Before {@link #initialize} is called (tests, embedded use) it logs to the
 * console only.
 */
public class AppLogger {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final PrintStream fileOutput;
    private final PrintStream consoleOutput;
    private final boolean consoleEnabled;

    private static volatile AppLogger instance;

    private AppLogger(PrintStream fileOutput, boolean consoleEnabled) {
        this.consoleOutput = System.out;
        this.consoleEnabled = consoleEnabled;
        this.fileOutput = fileOutput;
    }

    private static AppLogger openFile(Path logFile, boolean consoleEnabled) throws IOException {
        // Open log file in append mode
        FileOutputStream fos = new FileOutputStream(logFile.toFile(), true);
        PrintStream out = new PrintStream(fos, true, "UTF-8");

        String separator = "=".repeat(60);
        out.println();
        out.println(separator);
        out.println("Story Architect Started at " + LocalDateTime.now().format(TIME_FORMAT));
        out.println(separator);
        return new AppLogger(out, consoleEnabled);
    }

    public static synchronized void initialize(Path logFile, boolean consoleEnabled) throws IOException {
        if (instance == null || instance.fileOutput == null) {
            instance = openFile(logFile, consoleEnabled);
        }
    }

    public static AppLogger get() {
        AppLogger current = instance;
        if (current == null) {
            synchronized (AppLogger.class) {
                if (instance == null) {
                    instance = new AppLogger(null, true);
                }
                current = instance;
            }
        }
        return current;
    }

    public void info(String message) {
        log("INFO", message);
    }

    public void warn(String message) {
        log("WARN", message);
    }

    public void error(String message) {
        log("ERROR", message);
    }

    public void error(String message, Throwable t) {
        log("ERROR", message);
        if (fileOutput != null) {
            t.printStackTrace(fileOutput);
        }
        if (consoleEnabled) {
            t.printStackTrace(consoleOutput);
        }
    }

    private synchronized void log(String level, String message) {
        String timestamp = LocalDateTime.now().format(TIME_FORMAT);
        String line = String.format("[%s] [%s] [%s] %s", timestamp, level, Thread.currentThread().getName(), message);

        if (fileOutput != null) {
            fileOutput.println(line);
        }

        if (consoleEnabled) {
            consoleOutput.println(line);
        }
    }

    /**
     * Print to console only (for startup banners, etc.)
     */
    public void console(String message) {
        if (consoleEnabled) {
            consoleOutput.println(message);
        }
        if (fileOutput != null) {
            fileOutput.println(message);
        }
    }

    /**
     * View of this logger that prefixes every line with the project id.
     */
    public ScopedLog forProject(String projectId) {
        return new ScopedLog(this, "Project " + projectId);
    }

    public ScopedLog forScope(String scope) {
        return new ScopedLog(this, scope);
    }

    public static final class ScopedLog {
        private final AppLogger logger;
        private final String prefix;

        private ScopedLog(AppLogger logger, String scope) {
            this.logger = logger;
            this.prefix = scope + ": ";
        }

        public void info(String message) {
            logger.info(prefix + message);
        }

        public void warn(String message) {
            logger.warn(prefix + message);
        }

        public void error(String message, Throwable t) {
            logger.error(prefix + message, t);
        }
    }

    public void close() {
        if (fileOutput != null) {
            fileOutput.close();
        }
    }
}
