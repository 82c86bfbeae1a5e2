package com.promptqueue.vcs;

import com.promptqueue.core.Job;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JujutsuBookmarkHookTest {

    @TempDir
    Path tempDir;

    private Path repo;
    private Path calls;

    @BeforeEach
    public void setUp() throws IOException {
        repo = tempDir.resolve("repo");
        Files.createDirectories(repo.resolve(".jj"));
        Files.createDirectories(repo.resolve("src/deep"));
        calls = tempDir.resolve("calls.txt");
    }

    private Job job(String bookmark, Path workDir) {
        Job job = new Job("implement feature");
        job.setId("feed0001");
        job.setVcsBookmark(bookmark);
        job.setWorkingDirectory(workDir.toString());
        return job;
    }

    // fake jj: records its arguments and knows one existing bookmark
    private String fakeJj(int exitCode) throws IOException {
        Path script = tempDir.resolve("jj");
        Files.writeString(script, "#!/bin/sh\n"
                + "echo \"$*\" >> '" + calls + "'\n"
                + "if [ \"$2\" = list ]; then echo 'existing: qpvuntsm 1234abcd feature'; exit 0; fi\n"
                + "exit " + exitCode + "\n");
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        return script.toString();
    }

    @Test
    public void testRepositoryDetectionWalksParents() {
        assertTrue(JujutsuBookmarkHook.isJujutsuRepository(repo));
        assertTrue(JujutsuBookmarkHook.isJujutsuRepository(repo.resolve("src/deep")));
        assertFalse(JujutsuBookmarkHook.isJujutsuRepository(tempDir));
    }

    @Test
    public void testSkipsWithoutBookmark() throws Exception {
        new JujutsuBookmarkHook(tempDir.resolve("does-not-exist").toString()).afterSuccess(job(null, repo));
        new JujutsuBookmarkHook(tempDir.resolve("does-not-exist").toString()).afterSuccess(job(" ", repo));
        assertFalse(Files.exists(calls));
    }

    @Test
    public void testSkipsWhenJjIsMissing() throws Exception {
        assertFalse(JujutsuBookmarkHook.isOnPath(tempDir.resolve("does-not-exist").toString()));
        new JujutsuBookmarkHook(tempDir.resolve("does-not-exist").toString()).afterSuccess(job("feature", repo));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    public void testSkipsOutsideRepository() throws Exception {
        Path plain = Files.createDirectories(tempDir.resolve("plain"));
        new JujutsuBookmarkHook(fakeJj(0)).afterSuccess(job("feature", plain));
        assertFalse(Files.exists(calls));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    public void testCreatesNewBookmark() throws Exception {
        new JujutsuBookmarkHook(fakeJj(0)).afterSuccess(job("feature-x", repo.resolve("src")));
        assertEquals(List.of("bookmark list --all", "bookmark create feature-x"), Files.readAllLines(calls));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    public void testMovesExistingBookmark() throws Exception {
        new JujutsuBookmarkHook(fakeJj(0)).afterSuccess(job("existing", repo));
        assertEquals(List.of("bookmark list --all", "bookmark set existing"), Files.readAllLines(calls));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    public void testReadsBookmarkListLargerThanPipeBuffer() throws Exception {
        Path script = tempDir.resolve("jj");
        Files.writeString(script, "#!/bin/sh\n"
                + "echo \"$*\" >> '" + calls + "'\n"
                + "if [ \"$2\" = list ]; then\n"
                + "  i=0\n"
                + "  while [ $i -lt 5000 ]; do\n"
                + "    echo \"bookmark-$i: qpvuntsm 1234abcd a fairly long description of this change\"\n"
                + "    i=$((i+1))\n"
                + "  done\n"
                + "  echo 'existing: qpvuntsm 1234abcd feature'\n"
                + "fi\n"
                + "exit 0\n");
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));

        assertTimeoutPreemptively(Duration.ofSeconds(30),
                () -> new JujutsuBookmarkHook(script.toString()).afterSuccess(job("existing", repo)));
        assertEquals(List.of("bookmark list --all", "bookmark set existing"), Files.readAllLines(calls));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    public void testFailingJjRaises() throws IOException {
        String jj = fakeJj(1);
        IOException e = assertThrows(IOException.class,
                () -> new JujutsuBookmarkHook(jj).afterSuccess(job("feature-y", repo)));
        assertTrue(e.getMessage().contains("Failed to create bookmark 'feature-y'"));
    }
}
