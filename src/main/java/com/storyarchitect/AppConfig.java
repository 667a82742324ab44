package com.storyarchitect;

import com.storyarchitect.models.Severity;
import com.storyarchitect.pipeline.PipelineSettings;
import com.storyarchitect.pipeline.RetryPolicy;
import com.storyarchitect.prompt.PromptBudget;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Application configuration handling platform-specific paths and settings.
 */
public class AppConfig {

    private static final String APP_NAME = "Story-Architect";

    private final Path projectsPath;
    private final Path logPath;
    private final int port;
    private final boolean devMode;
    private final PipelineSettings pipelineSettings;

    private AppConfig(Path projectsPath, Path logPath, int port, boolean devMode, PipelineSettings pipelineSettings) {
        this.projectsPath = projectsPath;
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
        this.pipelineSettings = pipelineSettings;
    }

    public Path getProjectsPath() {
        return projectsPath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    public PipelineSettings getPipelineSettings() {
        return pipelineSettings;
    }

    /**
     * Get the default projects path based on the operating system.
     * Windows: %USERPROFILE%\Documents\Story-Architect\projects
     * macOS: ~/Documents/Story-Architect/projects
     * Linux: ~/Story-Architect/projects
     */
    public static Path getDefaultProjectsPath() {
        String os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String documents = System.getenv("USERPROFILE");
            if (documents == null) {
                documents = userHome;
            }
            return Paths.get(documents, "Documents", APP_NAME, "projects");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Documents", APP_NAME, "projects");
        } else {
            return Paths.get(userHome, APP_NAME, "projects");
        }
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\Story-Architect\logs
     * macOS: ~/Library/Logs/Story-Architect
     * Linux: ~/.local/share/Story-Architect/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME, "logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
        }
    }

    public static Path getLogFilePath() {
        return getLogDirectory().resolve("story-architect.log");
    }

    /**
     * Find an available port, starting with the preferred port.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            for (int port = preferredPort + 1; port < preferredPort + 100; port++) {
                if (isPortAvailable(port)) {
                    return port;
                }
            }
        }
        // Let the server fail later with a clear error
        return preferredPort;
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static Path ensureLogDirectory() throws IOException {
        Path logDir = getLogDirectory();
        Files.createDirectories(logDir);
        return getLogFilePath();
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private Path projectsPath = null;
        private int preferredPort = 8080;
        private boolean devMode = false;
        private int chapters = PipelineSettings.DEFAULT_CHAPTER_COUNT;
        private int maxAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;
        private int promptBudget = PromptBudget.DEFAULT_MAX_TOKENS;
        private Severity blockOn = null;

        public Builder projectsPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.projectsPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        /**
         * Accepts {@code --name=value} and {@code --name value}. Malformed
         * numbers are rejected with {@link IllegalArgumentException}.
         */
        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                String name = arg;
                String value = null;
                int eq = arg.indexOf('=');
                if (arg.startsWith("--") && eq > 0) {
                    name = arg.substring(0, eq);
                    value = arg.substring(eq + 1);
                }

                if ("--dev".equals(name)) {
                    this.devMode = true;
                    continue;
                }
                if (!isValueOption(name)) {
                    continue;
                }
                if (value == null) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Missing value for " + name);
                    }
                    value = args[++i];
                }
                switch (name) {
                    case "--projects-dir":
                        projectsPath(value);
                        break;
                    case "--port":
                        this.preferredPort = parseInt(name, value);
                        break;
                    case "--chapters":
                        this.chapters = parseInt(name, value);
                        break;
                    case "--max-attempts":
                        this.maxAttempts = parseInt(name, value);
                        break;
                    case "--prompt-budget":
                        this.promptBudget = parseInt(name, value);
                        break;
                    case "--block-on":
                        this.blockOn = Severity.parseThreshold(value);
                        break;
                    default:
                        break;
                }
            }
            return this;
        }

        public PipelineSettings buildPipelineSettings() {
            return new PipelineSettings.Builder()
                .defaultChapterCount(chapters)
                .retryPolicy(RetryPolicy.defaults().withMaxAttempts(maxAttempts))
                .promptBudgetTokens(promptBudget)
                .blockingSeverity(blockOn)
                .build();
        }

        public AppConfig build() throws IOException {
            Path projects = projectsPath != null ? projectsPath : getDefaultProjectsPath();
            Files.createDirectories(projects);
            int port = findAvailablePort(preferredPort);
            Path logPath = ensureLogDirectory();
            return new AppConfig(projects, logPath, port, devMode, buildPipelineSettings());
        }

        private static boolean isValueOption(String name) {
            switch (name) {
                case "--projects-dir":
                case "--port":
                case "--chapters":
                case "--max-attempts":
                case "--prompt-budget":
                case "--block-on":
                    return true;
                default:
                    return false;
            }
        }

        private static int parseInt(String name, String value) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + name + ": " + value, e);
            }
        }
    }
}
