package com.promptqueue.vcs;

import com.promptqueue.core.Job;
import com.promptqueue.engine.PostExecutionHook;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Moves a Jujutsu bookmark to the working copy after a job completes.
 *
 * <p>Runs only for jobs that name a bookmark, when {@code jj} is on the PATH and the
 * working directory lies inside a {@code .jj} repository. The bookmark is moved with
 * {@code jj bookmark set} when it exists and created with {@code jj bookmark create}
 * otherwise.</p>
 */
public class JujutsuBookmarkHook implements PostExecutionHook {
    private static final Logger logger = Logger.getLogger(JujutsuBookmarkHook.class.getName());

    private static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(10);

    private final String jjCommand;

    public JujutsuBookmarkHook() {
        this("jj");
    }

    public JujutsuBookmarkHook(String jjCommand) {
        this.jjCommand = jjCommand;
    }

    @Override
    public void afterSuccess(Job job) throws IOException, InterruptedException {
        String bookmark = job.getVcsBookmark();
        if (bookmark == null || bookmark.isBlank()) {
            return;
        }
        Path workDir = Paths.get(job.getWorkingDirectory()).toAbsolutePath().normalize();
        if (!isOnPath(jjCommand)) {
            logger.info("Skipping bookmark " + bookmark + " for job " + job.getId() + ": jj not in PATH");
            return;
        }
        if (!isJujutsuRepository(workDir)) {
            logger.info("Skipping bookmark " + bookmark + " for job " + job.getId() + ": not a jj repository");
            return;
        }

        boolean exists = bookmarkExists(workDir, bookmark);
        CommandOutput result = run(workDir, jjCommand, "bookmark", exists ? "set" : "create", bookmark);
        if (result.exitCode != 0) {
            throw new IOException("Failed to " + (exists ? "set" : "create") + " bookmark '" + bookmark + "': "
                    + result.text);
        }
        logger.info((exists ? "Set" : "Created") + " bookmark '" + bookmark + "' for job " + job.getId());
    }

    /**
     * Whether {@code dir} or one of its parents contains a {@code .jj} directory.
     */
    public static boolean isJujutsuRepository(Path dir) {
        Path current = dir.toAbsolutePath().normalize();
        while (current != null) {
            if (Files.isDirectory(current.resolve(".jj"))) {
                return true;
            }
            current = current.getParent();
        }
        return false;
    }

    static boolean isOnPath(String command) {
        if (command.contains(File.separator)) {
            return Files.isExecutable(Paths.get(command));
        }
        String path = System.getenv("PATH");
        if (path == null) {
            return false;
        }
        for (String entry : path.split(File.pathSeparator)) {
            if (!entry.isEmpty() && Files.isExecutable(Paths.get(entry, command))) {
                return true;
            }
        }
        return false;
    }

    private boolean bookmarkExists(Path workDir, String bookmark) throws IOException, InterruptedException {
        CommandOutput result = run(workDir, jjCommand, "bookmark", "list", "--all");
        if (result.exitCode != 0) {
            return false;
        }
        for (String line : result.text.split("\n")) {
            int colon = line.indexOf(':');
            String name = (colon >= 0 ? line.substring(0, colon) : line).strip();
            if (name.equals(bookmark)) {
                return true;
            }
        }
        return false;
    }

    private static CommandOutput run(Path workDir, String... command) throws IOException, InterruptedException {
        List<String> cmd = new ArrayList<>(List.of(command));
        // read only after exit, so the output must not sit in a bounded pipe
        Path output = Files.createTempFile("jj-", ".out");
        try {
            Process process = new ProcessBuilder(cmd)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .start();
            process.getOutputStream().close();
            if (!process.waitFor(COMMAND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IOException("Timeout while running " + String.join(" ", cmd));
            }
            String text = new String(Files.readAllBytes(output), StandardCharsets.UTF_8).strip();
            return new CommandOutput(process.exitValue(), text);
        } finally {
            deleteQuietly(output);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.fine("Could not delete temporary file " + file + ": " + e.getMessage());
        }
    }

    private static final class CommandOutput {
        final int exitCode;
        final String text;

        CommandOutput(int exitCode, String text) {
            this.exitCode = exitCode;
            this.text = text;
        }
    }
}
