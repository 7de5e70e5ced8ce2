package com.planforge.core.persistence;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.planforge.core.workflow.WorkflowEvent;

import java.time.Instant;
import java.util.Map;

/**
 * One line of the event log.
 *
 * @param aggregateId  workflow the event belongs to
 * @param sequence     per-aggregate position, gap-free from 1
 * @param recordedAt   when the line was written
 * @param eventType    discriminator of the payload, checked on load
 * @param eventVersion payload schema version, checked on load
 * @param payload      the event itself
 * @param metadata     free-form context such as the originating command
 */
public record StoredEvent(
        @JsonProperty("aggregate_id") String aggregateId,
        long sequence,
        @JsonProperty("recorded_at") Instant recordedAt,
        @JsonProperty("event_type") String eventType,
        @JsonProperty("event_version") String eventVersion,
        WorkflowEvent payload,
        Map<String, String> metadata
) {
}
