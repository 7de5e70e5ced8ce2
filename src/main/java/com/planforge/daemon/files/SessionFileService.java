package com.planforge.daemon.files;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only access to the files of a session directory ({@code <home>/sessions/<id>}).
 * <p>
 * A file name must be a single plain path component. Names with separators, look-alike
 * separators or null bytes are refused before the file system is touched. Whatever passes
 * is resolved to its canonical path, which must still lie inside the session directory.
 */
public class SessionFileService {

    private static final Logger log = LoggerFactory.getLogger(SessionFileService.class);

    public static final int MAX_READ_BYTES = 1_048_576;

    private final Path sessionsDir;

    public SessionFileService(Path sessionsDir) {
        this.sessionsDir = sessionsDir;
    }

    public List<FileEntry> listSessionFiles(String sessionId) {
        Path sessionDir = sessionDir(sessionId);
        List<FileEntry> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(sessionDir)) {
            for (Path path : stream) {
                entries.add(describe(path));
            }
        } catch (IOException e) {
            throw FileAccessException.ioError("failed to list " + sessionDir + ": " + e.getMessage(), e);
        }
        entries.sort(FileEntry.LISTING_ORDER);
        return entries;
    }

    /**
     * Reads a file of the session as UTF-8 text, keeping at most {@link #MAX_READ_BYTES} bytes.
     */
    public FileReadResult readSessionFile(String sessionId, String filename) {
        requireSingleComponent(filename);
        Path sessionDir = sessionDir(sessionId);

        Path canonicalFile;
        try {
            canonicalFile = sessionDir.resolve(filename).toRealPath();
        } catch (IOException e) {
            throw FileAccessException.fileNotFound(filename);
        }
        Path canonicalDir;
        try {
            canonicalDir = sessionDir.toRealPath();
        } catch (IOException e) {
            throw FileAccessException.ioError("cannot resolve session directory " + sessionDir, e);
        }
        if (!canonicalFile.startsWith(canonicalDir)) {
            log.warn("Refused read of {} outside session directory {}", canonicalFile, canonicalDir);
            throw FileAccessException.permissionDenied(filename);
        }
        if (Files.isDirectory(canonicalFile)) {
            throw FileAccessException.ioError(filename + " is a directory", null);
        }
        return read(canonicalFile);
    }

    private FileReadResult read(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            long totalSize = Files.size(file);
            byte[] bytes = in.readNBytes(MAX_READ_BYTES + 1);
            boolean truncated = bytes.length > MAX_READ_BYTES;
            int length = truncated ? charBoundary(bytes, MAX_READ_BYTES) : bytes.length;
            return new FileReadResult(new String(bytes, 0, length, StandardCharsets.UTF_8), truncated,
                    Math.max(totalSize, bytes.length));
        } catch (IOException e) {
            throw FileAccessException.ioError("cannot read " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /** Largest cut at or below {@code limit} that does not split a UTF-8 sequence. */
    private static int charBoundary(byte[] bytes, int limit) {
        int cut = limit;
        while (cut > 0 && (bytes[cut] & 0xC0) == 0x80) {
            cut--;
        }
        return cut;
    }

    private Path sessionDir(String sessionId) {
        requireSingleComponent(sessionId);
        if (sessionId.equals(".") || sessionId.equals("..")) {
            throw FileAccessException.permissionDenied(sessionId);
        }
        Path dir = sessionsDir.resolve(sessionId);
        if (!Files.isDirectory(dir)) {
            throw FileAccessException.sessionNotFound(sessionId);
        }
        return dir;
    }

    private FileEntry describe(Path path) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        return new FileEntry(path.getFileName().toString(), attrs.isDirectory(),
                attrs.isDirectory() ? 0 : attrs.size(), attrs.lastModifiedTime().toInstant());
    }

    /**
     * Refuses anything but one plain path component.
     */
    static void requireSingleComponent(String name) {
        if (name == null || name.isEmpty()) {
            throw FileAccessException.permissionDenied(String.valueOf(name));
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '\0' || c == '/' || c == '\\' || c == '\u2215' || c == '\u2044') {
                throw FileAccessException.permissionDenied(name);
            }
        }
        Path path;
        try {
            path = Path.of(name);
        } catch (InvalidPathException e) {
            throw FileAccessException.permissionDenied(name);
        }
        if (path.isAbsolute() || path.getNameCount() != 1) {
            throw FileAccessException.permissionDenied(name);
        }
    }
}
