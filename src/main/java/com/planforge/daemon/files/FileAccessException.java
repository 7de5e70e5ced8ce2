package com.planforge.daemon.files;

/**
 * Failure to list or read a session file.
 */
public class FileAccessException extends RuntimeException {

    private final FileAccessError error;

    public FileAccessException(FileAccessError error, String message) {
        super(message);
        this.error = error;
    }

    public FileAccessException(FileAccessError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public static FileAccessException sessionNotFound(String sessionId) {
        return new FileAccessException(FileAccessError.SESSION_NOT_FOUND, "session not found: " + sessionId);
    }

    public static FileAccessException fileNotFound(String filename) {
        return new FileAccessException(FileAccessError.FILE_NOT_FOUND, "file not found: " + filename);
    }

    public static FileAccessException permissionDenied(String filename) {
        return new FileAccessException(FileAccessError.PERMISSION_DENIED, "access denied: " + filename);
    }

    public static FileAccessException ioError(String message, Throwable cause) {
        return new FileAccessException(FileAccessError.IO_ERROR, message, cause);
    }

    public FileAccessError error() {
        return error;
    }
}
