package com.promptqueue.app;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Settings for the queue process.
 *
 * <p><b>Sources</b>, later ones overriding earlier ones:</p>
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>the classpath resource {@code prompt-queue.properties}</li>
 *   <li>{@code <storage>/config.properties}, when present</li>
 *   <li>command-line options</li>
 * </ol>
 * <p>The storage directory is resolved first, since it locates the third source: command
 * line, then the {@code PROMPT_QUEUE_DIR} environment variable, then the classpath
 * resource, then {@code ~/.prompt-queue}.</p>
 */
public final class QueueConfig {
    private static final Logger logger = Logger.getLogger(QueueConfig.class.getName());

    public static final String STORAGE_DIR = "storage.dir";
    public static final String AGENT_COMMAND = "agent.command";
    public static final String CHECK_INTERVAL = "scheduler.check-interval-seconds";
    public static final String AGENT_TIMEOUT = "agent.timeout-seconds";
    public static final String RATE_LIMIT_BUFFER = "scheduler.rate-limit-buffer-seconds";
    public static final String EXTRA_PATTERNS = "rate-limit.extra-patterns";
    public static final String VCS_ENABLED = "vcs.enabled";

    static final String CLASSPATH_RESOURCE = "/prompt-queue.properties";
    static final String STORAGE_CONFIG_FILE = "config.properties";
    static final String STORAGE_DIR_ENV = "PROMPT_QUEUE_DIR";

    private final Path storageDir;
    private final String agentCommand;
    private final Duration checkInterval;
    private final Duration agentTimeout;
    private final Duration rateLimitBuffer;
    private final List<String> extraPatterns;
    private final boolean vcsEnabled;

    private QueueConfig(Path storageDir, Properties props) {
        this.storageDir = storageDir;
        this.agentCommand = props.getProperty(AGENT_COMMAND, "claude").strip();
        this.checkInterval = Duration.ofSeconds(positive(props, CHECK_INTERVAL, 30));
        this.agentTimeout = Duration.ofSeconds(positive(props, AGENT_TIMEOUT, 3600));
        this.rateLimitBuffer = Duration.ofSeconds(nonNegative(props, RATE_LIMIT_BUFFER, 60));
        this.extraPatterns = splitList(props.getProperty(EXTRA_PATTERNS, ""));
        this.vcsEnabled = Boolean.parseBoolean(props.getProperty(VCS_ENABLED, "true").strip());
        if (agentCommand.isEmpty()) {
            throw new IllegalArgumentException("Invalid value for " + AGENT_COMMAND + ": must not be empty");
        }
    }

    /**
     * Load the configuration for this process.
     *
     * @param cliOverrides values given on the command line, keyed like the properties
     * @return the resolved configuration
     * @throws IOException if a configuration file exists but cannot be read
     */
    public static QueueConfig load(Map<String, String> cliOverrides) throws IOException {
        Properties classpath = new Properties();
        try (InputStream in = QueueConfig.class.getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in != null) {
                classpath.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            }
        }
        return load(classpath, System.getenv(), cliOverrides);
    }

    /**
     * Resolve a configuration from explicit sources.
     *
     * @param classpath properties from the classpath resource
     * @param env the process environment
     * @param cliOverrides command-line values
     */
    static QueueConfig load(Properties classpath, Map<String, String> env, Map<String, String> cliOverrides)
            throws IOException {
        Properties props = new Properties();
        props.putAll(classpath);

        String dir = cliOverrides.get(STORAGE_DIR);
        if (dir == null) {
            dir = env.get(STORAGE_DIR_ENV);
        }
        if (dir == null) {
            dir = classpath.getProperty(STORAGE_DIR);
        }
        if (dir == null || dir.isBlank()) {
            dir = "~/.prompt-queue";
        }
        Path storageDir = expandHome(dir.strip());

        Path storageConfig = storageDir.resolve(STORAGE_CONFIG_FILE);
        if (Files.isRegularFile(storageConfig)) {
            try (Reader reader = Files.newBufferedReader(storageConfig, StandardCharsets.UTF_8)) {
                Properties fromStorage = new Properties();
                fromStorage.load(reader);
                fromStorage.remove(STORAGE_DIR);
                props.putAll(fromStorage);
            }
            logger.fine("Loaded " + storageConfig);
        }

        props.putAll(cliOverrides);
        return new QueueConfig(storageDir, props);
    }

    static Path expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home") + path.substring(1));
        }
        return Paths.get(path);
    }

    private static long positive(Properties props, String key, long defaultValue) {
        long value = number(props, key, defaultValue);
        if (value <= 0) {
            throw new IllegalArgumentException("Invalid value for " + key + ": must be positive, got " + value);
        }
        return value;
    }

    private static long nonNegative(Properties props, String key, long defaultValue) {
        long value = number(props, key, defaultValue);
        if (value < 0) {
            throw new IllegalArgumentException("Invalid value for " + key + ": must not be negative, got " + value);
        }
        return value;
    }

    private static long number(Properties props, String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + raw, e);
        }
    }

    private static List<String> splitList(String raw) {
        List<String> values = new ArrayList<>();
        for (String part : raw.split(",")) {
            if (!part.isBlank()) {
                values.add(part.strip());
            }
        }
        return Collections.unmodifiableList(values);
    }

    public Path getStorageDir() { return storageDir; }
    public String getAgentCommand() { return agentCommand; }
    public Duration getCheckInterval() { return checkInterval; }
    public Duration getAgentTimeout() { return agentTimeout; }
    public Duration getRateLimitBuffer() { return rateLimitBuffer; }
    public List<String> getExtraPatterns() { return extraPatterns; }
    public boolean isVcsEnabled() { return vcsEnabled; }

    @Override
    public String toString() {
        return "QueueConfig{storageDir=" + storageDir + ", agentCommand='" + agentCommand
                + "', checkInterval=" + checkInterval.getSeconds() + "s, timeout=" + agentTimeout.getSeconds()
                + "s, buffer=" + rateLimitBuffer.getSeconds() + "s, vcs=" + vcsEnabled + "}";
    }
}
