package com.planforge.daemon;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.core.persistence.JsonSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DaemonDiscoveryTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = JsonSupport.newObjectMapper();

    // -- Tokens ----------------------------------------------------------------

    @Nested
    class Tokens {

        @Test
        @DisplayName("generated tokens are 32 alphanumeric characters and differ")
        void generate() {
            String first = AuthToken.generate();
            String second = AuthToken.generate();

            assertEquals(AuthToken.LENGTH, first.length());
            assertTrue(first.chars().allMatch(Character::isLetterOrDigit));
            assertNotEquals(first, second);
        }

        @Test
        @DisplayName("matches only the exact token")
        void matches() {
            String token = AuthToken.generate();

            assertTrue(AuthToken.matches(token, token));
            assertFalse(AuthToken.matches(token, token.substring(1)));
            assertFalse(AuthToken.matches(token, null));
            assertFalse(AuthToken.matches(null, token));
        }
    }

    // -- Port file -------------------------------------------------------------

    @Nested
    class PortFiles {

        @Test
        @DisplayName("the port file uses snake_case keys and reads back")
        void writeAndRead() throws Exception {
            Path path = new DaemonPaths(tempDir).portFile();
            var portFile = new PortFile(41000, 41001, "abc");

            portFile.write(path, objectMapper);

            String json = Files.readString(path);
            assertTrue(json.contains("\"subscriber_port\":41001"));
            assertEquals(portFile, PortFile.read(path, objectMapper));
        }

        @Test
        @DisplayName("the port file is readable by its owner only")
        void ownerOnly() throws Exception {
            Path path = new DaemonPaths(tempDir).portFile();
            new PortFile(1, 2, "t").write(path, objectMapper);

            if (Files.getFileStore(path).supportsFileAttributeView("posix")) {
                assertEquals(Set.of(PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE),
                        Files.getPosixFilePermissions(path));
            }
        }
    }

    // -- Build info ------------------------------------------------------------

    @Nested
    class Builds {

        @Test
        @DisplayName("only a strictly newer build supersedes the daemon")
        void supersededBy() {
            var build = new BuildInfo("abc123", 1_700_000_000L);

            assertTrue(build.isSupersededBy(1_700_000_001L));
            assertFalse(build.isSupersededBy(1_700_000_000L));
            assertFalse(build.isSupersededBy(1_600_000_000L));
        }

        @Test
        @DisplayName("a daemon with an unknown build time is never superseded")
        void unknownTimestamp() {
            assertFalse(new BuildInfo("dev", 0).isSupersededBy(Long.MAX_VALUE));
        }
    }
}
