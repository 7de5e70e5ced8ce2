package com.planforge.daemon.files;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Content of a session file, possibly cut short.
 *
 * @param content   file text, at most {@link SessionFileService#MAX_READ_BYTES} bytes of it
 * @param truncated whether content was cut
 * @param totalSize size of the whole file in bytes
 */
public record FileReadResult(
        @JsonProperty("content") String content,
        @JsonProperty("truncated") boolean truncated,
        @JsonProperty("total_size") long totalSize) {
}
