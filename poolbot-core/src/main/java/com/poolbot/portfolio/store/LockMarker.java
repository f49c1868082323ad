package com.poolbot.portfolio.store;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Contents of the {@code <state>.lock} marker file.
 */
public record LockMarker(
    Instant timestamp,
    @JsonProperty("process_id") long processId,
    String hostname
) {

  public String holder() {
    return processId + "@" + hostname;
  }
}
