package io.tasklink.state;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * The last time an implant was heard from, and from where.
 */
public record Sighting(
        @JsonProperty("ID") String id,
        @JsonProperty("From") String from,
        @JsonProperty("When") Instant when
) {
}
