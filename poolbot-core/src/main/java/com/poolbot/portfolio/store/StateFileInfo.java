package com.poolbot.portfolio.store;

import java.time.Instant;

public record StateFileInfo(
    String path,
    boolean exists,
    long sizeBytes,
    Instant lastModified,
    boolean locked,
    LockMarker lock
) {
}
