package com.promptqueue.app;

import com.promptqueue.engine.MutableClock;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {
    private static final Pattern ADDED = Pattern.compile("Added prompt ([0-9a-f]{8}) to queue");

    @TempDir
    Path tempDir;

    private Path storage;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    public void setUp() {
        storage = tempDir.resolve("queue-home");
    }

    private int run(String... args) {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        List<String> full = new ArrayList<>(List.of("--storage-dir", storage.toString()));
        full.addAll(Arrays.asList(args));
        Main main = new Main(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                new MutableClock(LocalDateTime.of(2026, 10, 19, 14, 30)));
        return main.run(full.toArray(new String[0]));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private String add(String... args) {
        assertEquals(Main.EXIT_OK, run(concat("add", args)), stderr());
        Matcher m = ADDED.matcher(stdout());
        assertTrue(m.find(), stdout());
        return m.group(1);
    }

    private static String[] concat(String first, String... rest) {
        String[] all = new String[rest.length + 1];
        all[0] = first;
        System.arraycopy(rest, 0, all, 1, rest.length);
        return all;
    }

    @Test
    public void testHelpAndUsageErrors() {
        assertEquals(Main.EXIT_OK, run("help"));
        assertTrue(stdout().contains("Usage: prompt-queue"));

        assertEquals(Main.EXIT_USAGE, run());
        assertEquals(Main.EXIT_USAGE, run("frobnicate"));
        assertTrue(stderr().contains("Unknown command: frobnicate"));
        assertEquals(Main.EXIT_USAGE, run("--bogus", "list"));
        assertEquals(Main.EXIT_USAGE, run("add"));
        assertEquals(Main.EXIT_USAGE, run("add", "x", "--priority", "high"));
        assertEquals(Main.EXIT_USAGE, run("cancel"));
        assertEquals(Main.EXIT_USAGE, run("list", "--status", "sleeping"));
    }

    @Test
    public void testAddCreatesStorageAndRecord() throws Exception {
        String id = add("Fix the login bug", "-p", "2", "-f", "src/Login.java", "docs/auth.md", "-m", "opus",
                "--allowed-tools", "Read", "Edit", "-r", "5", "-t", "900", "-b", "fix-login");

        assertTrue(stdout().contains("(priority 2)"));
        assertTrue(Files.isDirectory(storage.resolve("queue")));

        assertEquals(Main.EXIT_OK, run("list", "--json"));
        JSONArray list = new JSONArray(stdout());
        assertEquals(1, list.length());
        JSONObject job = list.getJSONObject(0);
        assertEquals(id, job.getString("id"));
        assertEquals(2, job.getInt("priority"));
        assertEquals(5, job.getInt("max_retries"));
        assertEquals(900, job.getInt("estimated_tokens"));
        assertEquals("opus", job.getString("model"));
        assertEquals("fix-login", job.getString("bookmark"));
        assertEquals(List.of("src/Login.java", "docs/auth.md"), job.getJSONArray("context_files").toList());
    }

    @Test
    public void testInvalidPermissionModeFails() {
        assertEquals(Main.EXIT_FAILURE, run("add", "x", "--permission-mode", "yolo"));
        assertTrue(stderr().contains("Invalid permission mode"));
    }

    @Test
    public void testStatusJson() {
        add("one");
        add("two");

        assertEquals(Main.EXIT_OK, run("status", "--json"));
        JSONObject status = new JSONObject(stdout());
        assertEquals(2, status.getInt("total_added"));
        assertEquals(2, status.getJSONObject("status_counts").getInt("queued"));
        assertFalse(status.getJSONObject("current_rate_limit").getBoolean("is_rate_limited"));

        assertEquals(Main.EXIT_OK, run("status", "-d"));
        assertTrue(stdout().contains("Prompt Queue Status"));
        assertTrue(stdout().contains("No failed prompts"));
    }

    @Test
    public void testPath() {
        String low = add("low priority", "-p", "5");
        String high = add("high priority", "-p", "1");

        assertEquals(Main.EXIT_OK, run("path", low));
        Path file = Paths.get(stdout().strip());
        assertTrue(Files.isRegularFile(file));
        assertTrue(file.getFileName().toString().startsWith(low + "-low-priority"));

        assertEquals(Main.EXIT_OK, run("path", "next"));
        assertTrue(Paths.get(stdout().strip()).getFileName().toString().startsWith(high));

        assertEquals(Main.EXIT_FAILURE, run("path", "00000000"));
        assertTrue(stderr().contains("not found"));
    }

    @Test
    public void testCancelDeleteRetry() {
        String id = add("cancel me");

        assertEquals(Main.EXIT_OK, run("cancel", id));
        assertEquals(Main.EXIT_FAILURE, run("cancel", id));
        assertTrue(stderr().contains("Illegal transition"));

        assertEquals(Main.EXIT_OK, run("list", "--status", "cancelled"));
        assertTrue(stdout().contains(id + "  P0  cancelled"));

        assertEquals(Main.EXIT_OK, run("retry", id, "--delete"));
        assertTrue(stdout().contains("as a retry of " + id + " (original deleted)"));
        assertEquals(Main.EXIT_FAILURE, run("path", id));

        assertEquals(Main.EXIT_FAILURE, run("delete", id, "00000000"));
        assertEquals(Main.EXIT_OK, run("list"));
        assertTrue(stdout().contains("Found 1 prompt(s)"));
    }

    @Test
    public void testListEmpty() {
        assertEquals(Main.EXIT_OK, run("list"));
        assertEquals("No prompts found\n", stdout());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    public void testNextRunsAgent() throws Exception {
        Path agent = tempDir.resolve("agent.sh");
        Files.writeString(agent, "#!/bin/sh\necho all done\n");
        agent.toFile().setExecutable(true);
        String id = add("-d", tempDir.toString(), "run me");

        assertEquals(Main.EXIT_OK, run("--agent-command", agent.toString(), "next"));
        assertTrue(stdout().contains("Prompt " + id + " -> completed"), stdout());
        assertTrue(stdout().contains("SUCCESS"));

        assertEquals(Main.EXIT_OK, run("--agent-command", agent.toString(), "next"));
        assertEquals("No eligible prompts\n", stdout());
    }

    @Test
    public void testUnavailableAgent() {
        assertEquals(Main.EXIT_FAILURE, run("--agent-command", tempDir.resolve("missing").toString(), "test"));
        assertTrue(stderr().startsWith("Agent command is not available"));
    }

    @Test
    public void testStartAndNextRefuseMissingAgent() throws Exception {
        String id = add("never runs");
        String missing = tempDir.resolve("missing").toString();

        assertEquals(Main.EXIT_FAILURE, run("--agent-command", missing, "next"));
        assertTrue(stderr().startsWith("Agent command is not available"), stderr());
        assertEquals(Main.EXIT_FAILURE, run("--agent-command", missing, "start"));
        assertTrue(stderr().startsWith("Agent command is not available"), stderr());

        assertEquals(Main.EXIT_OK, run("list", "--json"));
        JSONObject job = new JSONArray(stdout()).getJSONObject(0);
        assertEquals(id, job.getString("id"));
        assertEquals("queued", job.getString("status"));
        assertEquals(0, job.getInt("retry_count"));
    }

    @Test
    public void testAddFromFile() throws Exception {
        Path prompt = tempDir.resolve("idea.md");
        Files.writeString(prompt, "---\npriority: 4\nmodel: opus\n---\nWrite the release notes.\n");

        assertEquals(Main.EXIT_OK, run("add", "--file", prompt.toString()));
        Matcher m = ADDED.matcher(stdout());
        assertTrue(m.find(), stdout());
        assertTrue(stdout().contains("(priority 4)"));
        assertFalse(Files.exists(prompt));

        assertEquals(Main.EXIT_OK, run("list", "--json"));
        JSONObject job = new JSONArray(stdout()).getJSONObject(0);
        assertEquals(m.group(1), job.getString("id"));
        assertEquals("opus", job.getString("model"));

        assertEquals(Main.EXIT_USAGE, run("add", "--file", tempDir.resolve("gone.md").toString()));
        assertEquals(Main.EXIT_USAGE, run("add", "--file", prompt.toString(), "-p", "1"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    public void testShortFlags() throws Exception {
        Path agent = tempDir.resolve("agent.sh");
        Files.writeString(agent, "#!/bin/sh\necho all done\n");
        agent.toFile().setExecutable(true);
        String id = add("-d", tempDir.toString(), "run me");

        assertEquals(Main.EXIT_OK, run("--agent-command", agent.toString(), "next", "-v"));
        assertTrue(stdout().contains("Prompt " + id + " -> completed"), stdout());
        assertEquals(Main.EXIT_USAGE, run("--agent-command", agent.toString(), "next", "--now"));
        assertEquals(Main.EXIT_OK, run("-v", "list"));
        assertEquals("No prompts found\n", stdout());

        assertEquals(Main.EXIT_OK, run("list", "-a"));
        assertTrue(stdout().contains(id + "  P0  completed"), stdout());

        assertEquals(Main.EXIT_OK, run("retry", id, "-d"));
        assertTrue(stdout().contains("as a retry of " + id + " (original deleted)"));
        assertEquals(Main.EXIT_FAILURE, run("path", id));
    }

    @Test
    public void testStorageLocationThatIsAFile() throws Exception {
        Files.writeString(storage, "not a directory");
        assertEquals(Main.EXIT_FAILURE, run("list"));
        assertTrue(stderr().contains("not a directory"));
    }
}
