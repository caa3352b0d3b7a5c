package com.lineage.core.git;

import com.lineage.testsupport.TestRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class SourceSnapshotReaderTest {

    @TempDir
    Path dir;

    private TestRepository repo;
    private GitHistoryReader reader;

    @BeforeEach
    void setUp() {
        assumeTrue(TestRepository.gitAvailable(), "git is not installed");
        repo = TestRepository.init(dir);
        repo.write("src/Main.java", "class Main {}\n");
        repo.write("logo.png", "not really an image");
        repo.write("package-lock.json", "{}");
        repo.commit("A");
    }

    @Test
    @DisplayName("renders text files and skips binary and ignored ones")
    void snapshot() {
        reader = new GitHistoryReader(repo.runner());
        var snapshots = new SourceSnapshotReader(reader, List.of("*-lock.*"), 10_000);

        SourceSnapshotReader.SourceSnapshot snapshot = snapshots.read(repo.id("A"));

        assertTrue(snapshot.text().contains("--- src/Main.java ---\nclass Main {}"));
        assertTrue(snapshot.text().contains("--- a.txt ---"));
        assertTrue(snapshot.skipped().containsAll(List.of("logo.png", "package-lock.json")));
        assertFalse(snapshot.text().contains("logo.png"));
    }

    @Test
    @DisplayName("skips files that would exceed the token budget")
    void budget() {
        repo.write("big.txt", "x".repeat(4000));
        repo.commit("B");
        reader = new GitHistoryReader(repo.runner());
        var snapshots = new SourceSnapshotReader(reader, List.of(), 100);

        SourceSnapshotReader.SourceSnapshot snapshot = snapshots.read(repo.id("B"));

        assertTrue(snapshot.skipped().contains("big.txt"));
        assertTrue(snapshot.text().contains("--- b.txt ---"));
    }

    @Test
    @DisplayName("glob patterns match basenames only")
    void globs() {
        assertTrue(SourceSnapshotReader.globToPattern("*.min.*").matcher("app.min.js").matches());
        assertFalse(SourceSnapshotReader.globToPattern("*.min.*").matcher("app.js").matches());
        assertTrue(SourceSnapshotReader.isBinary("images/Logo.PNG"));
        assertFalse(SourceSnapshotReader.isBinary("README"));
    }
}
