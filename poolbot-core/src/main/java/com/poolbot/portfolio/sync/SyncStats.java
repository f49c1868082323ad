package com.poolbot.portfolio.sync;

import java.time.Instant;

/**
 * @param conflictCount   local allocations replaced or dropped by merges
 * @param lockContentions sync attempts that could not get the lock in time
 * @param stateCorruptions sync attempts that found an invalid shared document
 */
public record SyncStats(
    Instant lastSync,
    long syncCount,
    long conflictCount,
    long successfulSyncs,
    long failedSyncs,
    double averageSyncMillis,
    int activeBots,
    int deadBots,
    Instant lastConflict,
    long lockContentions,
    long stateCorruptions
) {
}
