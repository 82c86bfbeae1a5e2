package com.promptqueue.engine;

import com.promptqueue.core.ExecutionResult;
import com.promptqueue.core.Job;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the agent as an operating-system process.
 *
 * <p>The command line is</p>
 * <pre>
 * &lt;command&gt; --print [--model M] [--permission-mode P] [--allowed-tools a,b] "&lt;prompt&gt;"
 * </pre>
 * <p>where the prompt is the job content, preceded by one {@code @path} reference per
 * context file. The process runs in the job's working directory, which is created when
 * missing. Stdout and stderr are captured through temporary files so a chatty agent can
 * never block on a full pipe.</p>
 *
 * <p>A run that outlives its timeout (the job's own, else the global one) is killed and
 * reported as a timeout failure.</p>
 */
public class CommandAgentExecutor implements AgentExecutor {
    private static final Logger logger = Logger.getLogger(CommandAgentExecutor.class.getName());

    private static final long CONNECTION_TEST_TIMEOUT_SECONDS = 10;

    private final List<String> command;
    private final Duration defaultTimeout;
    private final AtomicReference<Process> current = new AtomicReference<>();
    private final AtomicBoolean aborted = new AtomicBoolean(false);

    /**
     * @param command the agent executable, optionally followed by fixed arguments
     * @param defaultTimeout timeout for jobs that do not set their own
     */
    public CommandAgentExecutor(String command, Duration defaultTimeout) {
        List<String> parts = new ArrayList<>(Arrays.asList(command.strip().split("\\s+")));
        if (parts.isEmpty() || parts.get(0).isEmpty()) {
            throw new IllegalArgumentException("Agent command must not be empty");
        }
        this.command = List.copyOf(parts);
        this.defaultTimeout = defaultTimeout;
    }

    /**
     * Build the full argument list for a job.
     */
    public List<String> buildCommand(Job job) {
        List<String> cmd = new ArrayList<>(command);
        cmd.add("--print");
        if (job.getModel() != null) {
            cmd.add("--model");
            cmd.add(job.getModel());
        }
        if (job.getPermissionMode() != null) {
            cmd.add("--permission-mode");
            cmd.add(job.getPermissionMode());
        }
        if (job.getAllowedTools() != null && !job.getAllowedTools().isEmpty()) {
            cmd.add("--allowed-tools");
            cmd.add(String.join(",", job.getAllowedTools()));
        }
        cmd.add(buildPrompt(job));
        return cmd;
    }

    static String buildPrompt(Job job) {
        if (job.getContextFiles().isEmpty()) {
            return job.getContent();
        }
        StringBuilder prompt = new StringBuilder();
        for (String file : job.getContextFiles()) {
            prompt.append('@').append(file).append(' ');
        }
        prompt.append("\n\n").append(job.getContent());
        return prompt.toString();
    }

    @Override
    public ExecutionResult execute(Job job) {
        long startNanos = System.nanoTime();
        if (aborted.get()) {
            return ExecutionResult.interrupted("", Duration.ZERO);
        }

        Duration timeout = job.getTimeoutSeconds() != null
                ? Duration.ofSeconds(job.getTimeoutSeconds())
                : defaultTimeout;
        Path stdout = null;
        Path stderr = null;
        try {
            Path workDir = Paths.get(job.getWorkingDirectory()).toAbsolutePath();
            Files.createDirectories(workDir);
            stdout = Files.createTempFile("agent-" + job.getId() + "-", ".out");
            stderr = Files.createTempFile("agent-" + job.getId() + "-", ".err");

            ProcessBuilder builder = new ProcessBuilder(buildCommand(job))
                    .directory(workDir.toFile())
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile());
            logger.info("Launching agent for job " + job.getId() + " in " + workDir);

            Process process = builder.start();
            current.set(process);
            process.getOutputStream().close();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor();
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            String output = Files.readString(stdout, StandardCharsets.UTF_8);
            String error = Files.readString(stderr, StandardCharsets.UTF_8);

            if (aborted.get()) {
                return ExecutionResult.interrupted(output, elapsed);
            }
            if (!finished) {
                logger.warning("Agent for job " + job.getId() + " timed out after " + timeout.getSeconds() + "s");
                return ExecutionResult.timeout(output, timeout);
            }

            int exitCode = process.exitValue();
            if (exitCode == 0) {
                return ExecutionResult.success(output, elapsed);
            }
            String message = error.isBlank() ? "Agent exited with code " + exitCode : error.strip();
            return ExecutionResult.failure(output, message, elapsed);

        } catch (InterruptedException e) {
            Process process = current.get();
            if (process != null) {
                process.destroyForcibly();
            }
            Thread.currentThread().interrupt();
            return ExecutionResult.interrupted("", Duration.ofNanos(System.nanoTime() - startNanos));
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to run agent for job " + job.getId(), e);
            return ExecutionResult.failure("", "Agent execution failed: " + e.getMessage(),
                    Duration.ofNanos(System.nanoTime() - startNanos));
        } finally {
            current.set(null);
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    @Override
    public void abort() {
        aborted.set(true);
        Process process = current.get();
        if (process != null) {
            logger.warning("Aborting running agent process " + process.pid());
            process.destroyForcibly();
        }
    }

    /**
     * Run {@code <command> --help} and report the first line it prints.
     */
    @Override
    public String testConnection() throws IOException {
        List<String> cmd = new ArrayList<>(command);
        cmd.add("--help");
        Process process = new ProcessBuilder(cmd).redirectErrorStream(true).start();
        process.getOutputStream().close();
        try {
            if (!process.waitFor(CONNECTION_TEST_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new IOException("'" + String.join(" ", cmd) + "' did not answer within "
                        + CONNECTION_TEST_TIMEOUT_SECONDS + "s");
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while testing the agent command", e);
        }
        String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).strip();
        if (process.exitValue() != 0) {
            throw new IOException("'" + String.join(" ", cmd) + "' exited with code " + process.exitValue()
                    + (output.isEmpty() ? "" : ": " + output));
        }
        int newline = output.indexOf('\n');
        return newline < 0 ? output : output.substring(0, newline);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.log(Level.FINE, "Could not delete temporary file " + file, e);
        }
    }
}
