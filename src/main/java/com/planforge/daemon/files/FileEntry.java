package com.planforge.daemon.files;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Comparator;

/**
 * One entry of a session directory listing.
 */
public record FileEntry(
        @JsonProperty("name") String name,
        @JsonProperty("is_dir") boolean isDir,
        @JsonProperty("size") long size,
        @JsonProperty("modified_at") Instant modifiedAt) {

    /** Directories first, then by name. */
    public static final Comparator<FileEntry> LISTING_ORDER =
            Comparator.comparing((FileEntry e) -> !e.isDir()).thenComparing(FileEntry::name);
}
