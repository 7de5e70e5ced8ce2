package com.planforge.daemon.files;

public enum FileAccessError {
    SESSION_NOT_FOUND,
    FILE_NOT_FOUND,
    PERMISSION_DENIED,
    IO_ERROR
}
