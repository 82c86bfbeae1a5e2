package com.promptqueue.app;

import com.promptqueue.core.InvalidTransitionException;
import com.promptqueue.core.Job;
import com.promptqueue.core.JobStatus;
import com.promptqueue.core.LogEntry;
import com.promptqueue.core.QueueState;
import com.promptqueue.engine.AgentExecutor;
import com.promptqueue.engine.CommandAgentExecutor;
import com.promptqueue.engine.PostExecutionHook;
import com.promptqueue.engine.RateLimitDetector;
import com.promptqueue.engine.Scheduler;
import com.promptqueue.store.JobStore;
import com.promptqueue.store.StorageUnavailableException;
import com.promptqueue.vcs.JujutsuBookmarkHook;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command-line entry point.
 *
 * <pre>
 * prompt-queue [global options] &lt;command&gt; [command options]
 *
 * global options: --storage-dir DIR  --agent-command CMD  --check-interval N  --timeout N  -v|--verbose
 * commands:       add start next status list cancel delete retry path test help
 * </pre>
 *
 * <p>Exit codes: 0 success, 1 failure, 2 usage error.</p>
 */
public class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);
    private static final Duration ABORT_GRACE = Duration.ofSeconds(10);

    private final PrintStream out;
    private final PrintStream err;
    private final Clock clock;

    Main(PrintStream out, PrintStream err, Clock clock) {
        this.out = out;
        this.err = err;
        this.clock = clock;
    }

    public static void main(String[] args) {
        System.exit(new Main(System.out, System.err, Clock.systemDefaultZone()).run(args));
    }

    /**
     * Parse arguments and run one command.
     *
     * @return the process exit code
     */
    int run(String[] args) {
        Map<String, String> overrides = new HashMap<>();
        boolean verbose = false;
        int i = 0;
        try {
            // === GLOBAL OPTIONS ===
            while (i < args.length && (args[i].startsWith("--") || args[i].equals("-v"))) {
                String option = args[i];
                switch (option) {
                    case "--storage-dir" -> overrides.put(QueueConfig.STORAGE_DIR, value(args, i++, option));
                    case "--agent-command" -> overrides.put(QueueConfig.AGENT_COMMAND, value(args, i++, option));
                    case "--check-interval" -> overrides.put(QueueConfig.CHECK_INTERVAL, value(args, i++, option));
                    case "--timeout" -> overrides.put(QueueConfig.AGENT_TIMEOUT, value(args, i++, option));
                    case "-v", "--verbose" -> verbose = true;
                    case "--help" -> {
                        printHelp();
                        return EXIT_OK;
                    }
                    default -> throw new UsageException("Unknown option: " + option);
                }
                i++;
            }
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (i >= args.length) {
            printHelp();
            return EXIT_USAGE;
        }

        String command = args[i].strip().toLowerCase();
        String[] tail = Arrays.copyOfRange(args, i + 1, args.length);
        if (command.equals("help")) {
            printHelp();
            return EXIT_OK;
        }
        if (command.equals("start") || command.equals("next")) {
            try {
                verbose |= verboseFlag(command, tail);
            } catch (UsageException e) {
                err.println("Error: " + e.getMessage());
                return EXIT_USAGE;
            }
        }
        configureLogging(verbose, command.equals("start"));

        try {
            QueueConfig config = QueueConfig.load(overrides);
            logger.fine("Configuration: " + config);
            return dispatch(command, tail, config);
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (StorageUnavailableException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalArgumentException | IllegalStateException | InvalidTransitionException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Command '" + command + "' failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int dispatch(String command, String[] tail, QueueConfig config) throws IOException {
        switch (command) {
            case "add":
                return add(tail, openScheduler(config));
            case "start":
            case "next": {
                AgentExecutor executor = createExecutor(config);
                if (!agentAvailable(executor)) {
                    return EXIT_FAILURE;
                }
                Scheduler scheduler = openScheduler(config, executor);
                return command.equals("start") ? start(scheduler) : next(scheduler);
            }
            case "status":
                return status(tail, openStore(config));
            case "list":
                return list(tail, openStore(config));
            case "cancel":
                return cancel(tail, openScheduler(config));
            case "delete":
                return delete(tail, openScheduler(config));
            case "retry":
                return retry(tail, openScheduler(config));
            case "path":
                return path(tail, openStore(config));
            case "test":
                noArguments(command, tail);
                return test(createExecutor(config));
            default:
                throw new UsageException("Unknown command: " + command + " (try 'help')");
        }
    }

    // ==================== COMMANDS ====================

    private int add(String[] tail, Scheduler scheduler) throws IOException {
        Job job = new Job();
        String prompt = null;
        Path file = null;
        for (int i = 0; i < tail.length; i++) {
            String arg = tail[i];
            switch (arg) {
                case "--file" -> file = Path.of(value(tail, i++, arg));
                case "-p", "--priority" -> job.setPriority(intValue(tail, i++, arg));
                case "-d", "--working-dir" -> job.setWorkingDirectory(value(tail, i++, arg));
                case "-f", "--context-files" -> {
                    List<String> files = new ArrayList<>(job.getContextFiles());
                    while (i + 1 < tail.length && !tail[i + 1].startsWith("-")) {
                        files.add(tail[++i]);
                    }
                    job.setContextFiles(files);
                }
                case "-r", "--max-retries" -> job.setMaxRetries(intValue(tail, i++, arg));
                case "-t", "--estimated-tokens" -> job.setEstimatedTokens(intValue(tail, i++, arg));
                case "--permission-mode" -> job.setPermissionMode(value(tail, i++, arg));
                case "--allowed-tools" -> {
                    List<String> tools = new ArrayList<>();
                    while (i + 1 < tail.length && !tail[i + 1].startsWith("-")) {
                        tools.add(tail[++i]);
                    }
                    if (tools.isEmpty()) {
                        throw new UsageException("Missing value for " + arg);
                    }
                    job.setAllowedTools(tools);
                }
                case "--prompt-timeout" -> {
                    int timeout = intValue(tail, i++, arg);
                    if (timeout <= 0) {
                        throw new UsageException("--prompt-timeout must be positive");
                    }
                    job.setTimeoutSeconds(timeout);
                }
                case "-m", "--model" -> job.setModel(value(tail, i++, arg));
                case "-b", "--bookmark" -> job.setVcsBookmark(value(tail, i++, arg));
                default -> {
                    if (arg.startsWith("-") || prompt != null) {
                        throw new UsageException("Unexpected argument for add: " + arg);
                    }
                    prompt = arg;
                }
            }
        }
        Job created;
        if (file != null) {
            if (tail.length != 2) {
                throw new UsageException("add --file takes no prompt or other options; put them in the file header");
            }
            if (!Files.isRegularFile(file)) {
                throw new UsageException("Prompt file not found: " + file);
            }
            created = scheduler.importJob(file);
        } else {
            if (prompt == null || prompt.isBlank()) {
                throw new UsageException("add requires a prompt");
            }
            job.setContent(prompt);
            created = scheduler.addJob(job);
        }
        out.println("Added prompt " + created.getId() + " to queue (priority " + created.getPriority() + ")");
        return EXIT_OK;
    }

    private int start(Scheduler scheduler) throws IOException {
        Thread schedulerThread = new Thread(scheduler::start, "scheduler");
        schedulerThread.setDaemon(false);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("=== Shutdown signal received ===");
            scheduler.shutdown();
            try {
                schedulerThread.join(SHUTDOWN_GRACE.toMillis());
                if (schedulerThread.isAlive()) {
                    logger.warning("Job still running after " + SHUTDOWN_GRACE.getSeconds() + "s, aborting it");
                    scheduler.abortInFlight();
                    schedulerThread.join(ABORT_GRACE.toMillis());
                }
            } catch (InterruptedException e) {
                logger.log(Level.WARNING, "Interrupted while waiting for the scheduler to stop", e);
                Thread.currentThread().interrupt();
            }
            logger.info("=== Prompt Queue Stopped ===");
        }, "Shutdown-Hook"));

        logger.info("=== Prompt Queue Starting ===");
        out.println("Queue processor started. Press Ctrl+C to stop.");
        schedulerThread.start();
        try {
            schedulerThread.join();
        } catch (InterruptedException e) {
            logger.info("Main thread interrupted");
            scheduler.shutdown();
            Thread.currentThread().interrupt();
        }
        return EXIT_OK;
    }

    private int next(Scheduler scheduler) throws IOException {
        scheduler.recoverInterrupted();
        Optional<Job> processed = scheduler.processNext();
        if (processed.isEmpty()) {
            QueueState state = scheduler.getState();
            if (state.isRateLimited() && state.getEstimatedResetAt() != null) {
                out.println("No eligible prompts (rate limited until "
                        + LogEntry.TIMESTAMP_FORMAT.format(state.getEstimatedResetAt()) + ")");
            } else {
                out.println("No eligible prompts");
            }
            return EXIT_OK;
        }
        Job job = processed.get();
        out.println("Prompt " + job.getId() + " -> " + job.getStatus());
        List<LogEntry> log = job.getExecutionLog();
        if (!log.isEmpty()) {
            out.println(log.get(log.size() - 1).format());
        }
        return EXIT_OK;
    }

    private int status(String[] tail, JobStore store) throws IOException {
        boolean json = false;
        boolean detailed = false;
        for (String arg : tail) {
            switch (arg) {
                case "--json" -> json = true;
                case "-d", "--detailed" -> detailed = true;
                default -> throw new UsageException("Unexpected argument for status: " + arg);
            }
        }
        QueueReport report = new QueueReport(store.loadState(), store.loadAll());
        out.print(json ? report.statusJson().toString(2) + "\n" : report.statusText(detailed));
        return EXIT_OK;
    }

    private int list(String[] tail, JobStore store) throws IOException {
        boolean json = false;
        boolean all = false;
        JobStatus status = null;
        for (int i = 0; i < tail.length; i++) {
            String arg = tail[i];
            switch (arg) {
                case "--json" -> json = true;
                case "-a", "--all" -> all = true;
                case "--status" -> {
                    String name = value(tail, i++, arg);
                    try {
                        status = JobStatus.fromDisplayName(name);
                    } catch (IllegalArgumentException e) {
                        throw new UsageException(e.getMessage());
                    }
                }
                default -> throw new UsageException("Unexpected argument for list: " + arg);
            }
        }
        QueueReport report = new QueueReport(new QueueState(), store.loadAll());
        List<Job> selected = report.filter(status, all);
        out.print(json ? report.listJson(selected).toString(2) + "\n"
                : report.listText(selected, LocalDateTime.now(clock)));
        return EXIT_OK;
    }

    private int cancel(String[] tail, Scheduler scheduler) throws IOException {
        String id = singleId("cancel", tail);
        if (!scheduler.cancelJob(id)) {
            err.println("Prompt " + id + " not found");
            return EXIT_FAILURE;
        }
        out.println("Cancelled prompt " + id);
        return EXIT_OK;
    }

    private int delete(String[] tail, Scheduler scheduler) throws IOException {
        if (tail.length == 0) {
            throw new UsageException("delete requires at least one prompt id");
        }
        int exit = EXIT_OK;
        for (String id : tail) {
            try {
                if (scheduler.deleteJob(id)) {
                    out.println("Deleted prompt " + id);
                } else {
                    err.println("Prompt " + id + " not found");
                    exit = EXIT_FAILURE;
                }
            } catch (IllegalStateException e) {
                err.println("Error: " + e.getMessage());
                exit = EXIT_FAILURE;
            }
        }
        return exit;
    }

    private int retry(String[] tail, Scheduler scheduler) throws IOException {
        boolean deleteOriginal = false;
        List<String> ids = new ArrayList<>();
        for (String arg : tail) {
            if (arg.equals("-d") || arg.equals("--delete")) {
                deleteOriginal = true;
            } else if (arg.startsWith("-")) {
                throw new UsageException("Unexpected argument for retry: " + arg);
            } else {
                ids.add(arg);
            }
        }
        String id = singleId("retry", ids.toArray(new String[0]));
        Optional<Job> copy = scheduler.retryJob(id, deleteOriginal);
        if (copy.isEmpty()) {
            err.println("Prompt " + id + " not found");
            return EXIT_FAILURE;
        }
        out.println("Queued prompt " + copy.get().getId() + " as a retry of " + id
                + (deleteOriginal ? " (original deleted)" : ""));
        return EXIT_OK;
    }

    private int path(String[] tail, JobStore store) throws IOException {
        String id = singleId("path", tail);
        if (id.equals("next")) {
            Optional<Job> next = Scheduler.selectNext(store.loadPending(), LocalDateTime.now(clock));
            if (next.isEmpty()) {
                err.println("No prompts in queue");
                return EXIT_FAILURE;
            }
            id = next.get().getId();
        }
        Optional<Path> path = store.pathOf(id);
        if (path.isEmpty()) {
            err.println("Prompt " + id + " not found");
            return EXIT_FAILURE;
        }
        out.println(path.get());
        return EXIT_OK;
    }

    private boolean agentAvailable(AgentExecutor executor) {
        try {
            logger.fine("Agent check: " + executor.testConnection());
            return true;
        } catch (IOException e) {
            err.println("Agent command is not available: " + e.getMessage());
            return false;
        }
    }

    private int test(AgentExecutor executor) {
        try {
            String answer = executor.testConnection();
            out.println("Agent command is available" + (answer.isEmpty() ? "" : ": " + answer));
            return EXIT_OK;
        } catch (IOException e) {
            err.println("Agent command is not available: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    // ==================== WIRING ====================

    private JobStore openStore(QueueConfig config) throws IOException {
        Path dir = config.getStorageDir();
        if (!Files.exists(dir)) {
            Files.createDirectories(dir);
            logger.info("Created storage directory " + dir);
        }
        return JobStore.open(dir);
    }

    private Scheduler openScheduler(QueueConfig config) throws IOException {
        return openScheduler(config, createExecutor(config));
    }

    private Scheduler openScheduler(QueueConfig config, AgentExecutor executor) throws IOException {
        RateLimitDetector detector = new RateLimitDetector(clock).withExtraPatterns(config.getExtraPatterns());
        PostExecutionHook hook = config.isVcsEnabled() ? new JujutsuBookmarkHook() : PostExecutionHook.none();
        return new Scheduler(openStore(config), executor, detector, hook, clock,
                config.getCheckInterval(), config.getRateLimitBuffer());
    }

    private static AgentExecutor createExecutor(QueueConfig config) {
        return new CommandAgentExecutor(config.getAgentCommand(), config.getAgentTimeout());
    }

    static void configureLogging(boolean verbose, boolean daemon) {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not read logging configuration: " + e.getMessage());
        }
        Level level = verbose ? Level.FINE : daemon ? Level.INFO : Level.WARNING;
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(level);
        }
    }

    // ==================== ARGUMENTS ====================

    private static String value(String[] args, int index, String option) {
        if (index + 1 >= args.length) {
            throw new UsageException("Missing value for " + option);
        }
        return args[index + 1];
    }

    private static int intValue(String[] args, int index, String option) {
        String raw = value(args, index, option);
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new UsageException("Invalid number for " + option + ": " + raw);
        }
    }

    private static String singleId(String command, String[] tail) {
        if (tail.length != 1 || tail[0].startsWith("-")) {
            throw new UsageException(command + " requires exactly one prompt id");
        }
        return tail[0];
    }

    // start and next take only the verbose flag
    private static boolean verboseFlag(String command, String[] tail) {
        boolean verbose = false;
        for (String arg : tail) {
            if (arg.equals("-v") || arg.equals("--verbose")) {
                verbose = true;
            } else {
                throw new UsageException("Unexpected argument for " + command + ": " + arg);
            }
        }
        return verbose;
    }

    private static void noArguments(String command, String[] tail) {
        if (tail.length > 0) {
            throw new UsageException("Unexpected argument for " + command + ": " + tail[0]);
        }
    }

    private void printHelp() {
        out.println("Usage: prompt-queue [global options] <command> [options]");
        out.println();
        out.println("Global options:");
        out.println("  --storage-dir DIR      queue storage directory (default ~/.prompt-queue)");
        out.println("  --agent-command CMD    agent executable (default claude)");
        out.println("  --check-interval N     seconds between polls when idle (default 30)");
        out.println("  --timeout N            agent timeout in seconds (default 3600)");
        out.println("  -v, --verbose          debug logging");
        out.println();
        out.println("Commands:");
        out.println("  add <prompt> [-p N] [-d DIR] [-f FILE...] [-r N] [-t TOKENS] [-m MODEL] [-b BOOKMARK]");
        out.println("      [--permission-mode MODE] [--allowed-tools TOOL...] [--prompt-timeout N]");
        out.println("  add --file PATH                move a Markdown prompt file into the queue");
        out.println("  start [-v]                     process the queue until interrupted");
        out.println("  next [-v]                      process one eligible prompt and exit");
        out.println("  status [--json] [-d|--detailed] counters and rate-limit state");
        out.println("  list [--status S] [-a|--all] [--json]");
        out.println("  cancel <id>                    cancel a queued prompt");
        out.println("  delete <id>...                 permanently delete prompts");
        out.println("  retry <id> [-d|--delete]       queue a copy of a prompt");
        out.println("  path <id|next>                 print the file path of a prompt");
        out.println("  test                           check the agent command is available");
    }

    /**
     * Bad command-line input. Reported with exit code 2.
     */
    static class UsageException extends IllegalArgumentException {
        UsageException(String message) {
            super(message);
        }
    }
}
