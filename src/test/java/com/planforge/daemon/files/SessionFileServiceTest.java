package com.planforge.daemon.files;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class SessionFileServiceTest {

    @TempDir
    Path sessionsDir;

    private SessionFileService service;

    @BeforeEach
    void setUp() throws Exception {
        service = new SessionFileService(sessionsDir);
        Path session = Files.createDirectories(sessionsDir.resolve("s-1"));
        Files.writeString(session.resolve("plan.md"), "# Plan\n");
        Files.writeString(session.resolve("feedback.md"), "looks good");
        Files.createDirectories(session.resolve("logs"));
        Files.writeString(sessionsDir.resolve("secret.txt"), "top secret");
    }

    private static void assertDenied(Runnable call) {
        var ex = assertThrows(FileAccessException.class, call::run);
        assertEquals(FileAccessError.PERMISSION_DENIED, ex.error());
    }

    // -- Listing ---------------------------------------------------------------

    @Nested
    class Listing {

        @Test
        @DisplayName("lists directories first, then files by name")
        void order() {
            var entries = service.listSessionFiles("s-1");

            assertEquals(3, entries.size());
            assertEquals("logs", entries.get(0).name());
            assertTrue(entries.get(0).isDir());
            assertEquals(0, entries.get(0).size());
            assertEquals("feedback.md", entries.get(1).name());
            assertEquals("plan.md", entries.get(2).name());
            assertEquals(7, entries.get(2).size());
        }

        @Test
        @DisplayName("an unknown session fails with SESSION_NOT_FOUND")
        void unknownSession() {
            var ex = assertThrows(FileAccessException.class, () -> service.listSessionFiles("s-2"));
            assertEquals(FileAccessError.SESSION_NOT_FOUND, ex.error());
        }

        @Test
        @DisplayName("session ids that escape the sessions directory are refused")
        void traversingSessionId() {
            assertDenied(() -> service.listSessionFiles(".."));
            assertDenied(() -> service.listSessionFiles("../s-1"));
            assertDenied(() -> service.listSessionFiles(""));
        }
    }

    // -- Reading ---------------------------------------------------------------

    @Nested
    class Reading {

        @Test
        @DisplayName("reads a file in full")
        void readsFile() {
            FileReadResult result = service.readSessionFile("s-1", "plan.md");

            assertEquals("# Plan\n", result.content());
            assertFalse(result.truncated());
            assertEquals(7, result.totalSize());
        }

        @Test
        @DisplayName("path traversal and nested names are refused")
        void traversal() {
            assertDenied(() -> service.readSessionFile("s-1", "../../etc/passwd"));
            assertDenied(() -> service.readSessionFile("s-1", "../secret.txt"));
            assertDenied(() -> service.readSessionFile("s-1", "logs/x.log"));
            assertDenied(() -> service.readSessionFile("s-1", "..\\secret.txt"));
            assertDenied(() -> service.readSessionFile("s-1", "/etc/passwd"));
            assertDenied(() -> service.readSessionFile("s-1", "plan.md\0.txt"));
        }

        @Test
        @DisplayName("a symlink pointing outside the session is refused")
        void symlinkEscape() throws Exception {
            Path link = sessionsDir.resolve("s-1").resolve("escape.txt");
            try {
                Files.createSymbolicLink(link, sessionsDir.resolve("secret.txt"));
            } catch (UnsupportedOperationException | IOException e) {
                return;
            }

            assertDenied(() -> service.readSessionFile("s-1", "escape.txt"));
        }

        @Test
        @DisplayName("a missing file fails with FILE_NOT_FOUND")
        void missingFile() {
            var ex = assertThrows(FileAccessException.class, () -> service.readSessionFile("s-1", "nope.md"));
            assertEquals(FileAccessError.FILE_NOT_FOUND, ex.error());
        }

        @Test
        @DisplayName("reading a directory fails with IO_ERROR")
        void directory() {
            var ex = assertThrows(FileAccessException.class, () -> service.readSessionFile("s-1", "logs"));
            assertEquals(FileAccessError.IO_ERROR, ex.error());
        }

        @Test
        @DisplayName("content beyond 1 MiB is truncated")
        void truncation() throws Exception {
            byte[] big = new byte[SessionFileService.MAX_READ_BYTES + 10];
            Arrays.fill(big, (byte) 'a');
            Files.write(sessionsDir.resolve("s-1").resolve("big.log"), big);

            FileReadResult result = service.readSessionFile("s-1", "big.log");

            assertTrue(result.truncated());
            assertEquals(SessionFileService.MAX_READ_BYTES, result.content().length());
            assertEquals(big.length, result.totalSize());
        }

        @Test
        @DisplayName("truncation never splits a multi-byte character")
        void truncationAtCharBoundary() throws Exception {
            byte[] prefix = new byte[SessionFileService.MAX_READ_BYTES - 1];
            Arrays.fill(prefix, (byte) 'a');
            byte[] euro = "\u20AC".getBytes(StandardCharsets.UTF_8);
            byte[] content = new byte[prefix.length + euro.length];
            System.arraycopy(prefix, 0, content, 0, prefix.length);
            System.arraycopy(euro, 0, content, prefix.length, euro.length);
            Files.write(sessionsDir.resolve("s-1").resolve("utf8.txt"), content);

            FileReadResult result = service.readSessionFile("s-1", "utf8.txt");

            assertTrue(result.truncated());
            assertEquals(prefix.length, result.content().length());
            assertFalse(result.content().contains("\uFFFD"));
        }
    }
}
