package com.lineage.core.git;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommitMetadataTest {

    private static final String ID = "0123456789abcdef0123456789abcdef01234567";
    private static final String OTHER = "fedcba9876543210fedcba9876543210fedcba98";

    @Test
    @DisplayName("a step message carries a parseable original line")
    void stepMessage() {
        String message = CommitMetadata.stepMessage("Describe the parser", ID, "add parser",
                List.of(OTHER, ID), "gpt-4o-mini");

        assertTrue(message.startsWith("lineage: Describe the parser\n\n"));
        assertTrue(message.contains("Original: " + ID + " \"add parser\""));
        assertTrue(message.contains("Window: fedcba98..01234567"));
        assertTrue(message.contains("Processor: gpt-4o-mini"));
        assertEquals(ID, CommitMetadata.parseOriginalId(message).orElseThrow());
    }

    @Test
    @DisplayName("a merge message names the segments being joined")
    void mergeMessage() {
        String message = CommitMetadata.mergeMessage("Merge feature", ID, "Merge branch-x",
                "trunk-0", List.of("branch-0", "branch-1"), "gpt-4o");

        assertTrue(message.contains("Merge: trunk-0 + branch-0 + branch-1"));
        assertEquals(ID, CommitMetadata.parseOriginalId(message).orElseThrow());
    }

    @Test
    @DisplayName("a reconciliation message has no original line")
    void reconciliationMessage() {
        String message = CommitMetadata.reconciliationMessage("Reconcile", ID);

        assertTrue(message.contains("Reconciled-After: " + ID));
        assertTrue(CommitMetadata.parseOriginalId(message).isEmpty());
    }

    @Test
    @DisplayName("the first original line wins and short or malformed ids are ignored")
    void parsing() {
        assertEquals(ID, CommitMetadata.parseOriginalId(
                "x\n\nOriginal: " + ID + " \"a\"\nOriginal: " + OTHER + " \"b\"\n").orElseThrow());
        assertTrue(CommitMetadata.parseOriginalId("Original: 0123abcd \"short\"").isEmpty());
        assertTrue(CommitMetadata.parseOriginalId("Note: Original: " + ID).isEmpty());
        assertTrue(CommitMetadata.parseOriginalId(null).isEmpty());
    }

    @Test
    @DisplayName("SHA-256 ids are read in full and ids of other lengths are rejected")
    void sha256Ids() {
        String sha256 = ID + ID.substring(0, 24);
        assertEquals(64, sha256.length());

        assertEquals(sha256, CommitMetadata.parseOriginalId(
                CommitMetadata.stepMessage("s", sha256, "a", List.of(), "p")).orElseThrow());
        assertTrue(CommitMetadata.parseOriginalId("Original: " + ID + "abcd \"44 chars\"").isEmpty());
        assertEquals(ID, CommitMetadata.parseOriginalId("Original: " + ID).orElseThrow());
    }

    @Test
    @DisplayName("summaries are cut to their first line and blanks are replaced")
    void summaries() {
        String message = CommitMetadata.stepMessage("first line\nsecond line", ID, " ", List.of(), "p");

        assertTrue(message.startsWith("lineage: first line\n"));
        assertTrue(message.contains("\"(no summary)\""));
        assertTrue(message.contains("Window: .."));
    }

    @Test
    @DisplayName("shortId keeps eight characters")
    void shortId() {
        assertEquals("01234567", CommitMetadata.shortId(ID));
        assertEquals("abc", CommitMetadata.shortId("abc"));
    }
}
