package com.poolbot.portfolio.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poolbot.portfolio.error.PortfolioErrorCode;
import com.poolbot.portfolio.error.PortfolioException;
import com.poolbot.portfolio.model.PortfolioState;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.UUID;

/**
 * {@link StateStore} backed by a JSON file.
 *
 * Writes go to {@code <path>.tmp} and are moved over the document atomically. Cross-process
 * exclusion uses a {@code <path>.lock} marker created with {@code CREATE_NEW}; a marker older than
 * the stale-lock age is assumed to belong to a dead process and is removed.
 */
@Slf4j
public class FileStateStore implements StateStore {

  public static final Duration DEFAULT_STALE_LOCK_AGE = Duration.ofMinutes(5);

  private static final DateTimeFormatter BACKUP_SUFFIX =
      DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);
  private static final long LOCK_RETRY_MILLIS = 50;

  private final Path path;
  private final Path lockPath;
  private final Path tempPath;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Duration staleLockAge;
  private final long processId = ProcessHandle.current().pid();
  private final String hostname = resolveHostname();

  private LockMarker heldMarker;

  public FileStateStore(Path path, ObjectMapper objectMapper, Clock clock, Duration staleLockAge) {
    this.path = path.toAbsolutePath();
    this.lockPath = sibling(".lock");
    this.tempPath = sibling(".tmp");
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.staleLockAge = staleLockAge == null ? DEFAULT_STALE_LOCK_AGE : staleLockAge;
  }

  public FileStateStore(Path path, Clock clock) {
    this(path, PortfolioJson.objectMapper(), clock, DEFAULT_STALE_LOCK_AGE);
  }

  public Path path() {
    return path;
  }

  @Override
  public synchronized PortfolioState save(PortfolioState state) {
    PortfolioState stamped = heldMarker == null
        ? state.stamped(clock.instant(), null, null)
        : state.stamped(clock.instant(), heldMarker.holder(), heldMarker.timestamp());
    try {
      writeAtomically(objectMapper.writeValueAsBytes(stamped));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to save portfolio state to " + path, e);
    }
    log.debug("Saved portfolio state to {} ({} allocations)", path,
        stamped.allocations() == null ? 0 : stamped.allocations().size());
    return stamped;
  }

  @Override
  public PortfolioState load() {
    if (!Files.exists(path)) {
      throw PortfolioException.corrupted("state file " + path + " does not exist", null);
    }
    return read(path);
  }

  @Override
  public boolean exists() {
    return Files.exists(path);
  }

  @Override
  public synchronized void lock() {
    if (heldMarker != null) {
      throw PortfolioException.locked("lock on " + path + " is already held by this store");
    }
    try {
      heldMarker = createMarker();
    } catch (FileAlreadyExistsException e) {
      if (!removeStaleMarker()) {
        throw PortfolioException.locked("state is locked by " + describeHolder());
      }
      try {
        heldMarker = createMarker();
      } catch (FileAlreadyExistsException raced) {
        throw PortfolioException.locked("state was re-locked by " + describeHolder());
      } catch (IOException io) {
        throw new PortfolioException(PortfolioErrorCode.PORTFOLIO_LOCKED, null, "failed to create lock " + lockPath, io);
      }
    } catch (IOException e) {
      throw new PortfolioException(PortfolioErrorCode.PORTFOLIO_LOCKED, null, "failed to create lock " + lockPath, e);
    }
    log.debug("Acquired state lock {}", lockPath);
  }

  @Override
  public void lock(Duration timeout) {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (true) {
      try {
        lock();
        return;
      } catch (PortfolioException e) {
        if (!e.is(PortfolioErrorCode.PORTFOLIO_LOCKED) || System.nanoTime() >= deadline) {
          throw e;
        }
      }
      try {
        Thread.sleep(LOCK_RETRY_MILLIS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw PortfolioException.locked("interrupted while waiting for lock " + lockPath);
      }
    }
  }

  @Override
  public synchronized void unlock() {
    if (heldMarker == null) {
      return;
    }
    LockMarker current = readMarker();
    try {
      if (heldMarker.equals(current)) {
        Files.deleteIfExists(lockPath);
        log.debug("Released state lock {}", lockPath);
      } else {
        log.warn("Lock {} no longer belongs to this process (now {}), leaving it in place",
            lockPath, current == null ? "absent" : current.holder());
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to release lock " + lockPath, e);
    } finally {
      heldMarker = null;
    }
  }

  /**
   * Whether this store currently holds the lock.
   */
  @Override
  public synchronized boolean isLocked() {
    return heldMarker != null;
  }

  @Override
  public Path backupState() {
    if (!Files.exists(path)) {
      throw PortfolioException.corrupted("no state file to back up at " + path, null);
    }
    Path backup = sibling(".backup_" + BACKUP_SUFFIX.format(clock.instant()));
    try {
      Files.copy(path, backup, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to back up " + path, e);
    }
    log.info("Backed up portfolio state to {}", backup);
    return backup;
  }

  @Override
  public synchronized void restoreFromBackup(Path backup) {
    PortfolioState state = read(backup);
    if (Files.exists(path)) {
      backupState();
    }
    try {
      writeAtomically(objectMapper.writeValueAsBytes(state));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to restore " + path + " from " + backup, e);
    }
    log.info("Restored portfolio state from {}", backup);
  }

  @Override
  public StateFileInfo describe() {
    boolean exists = Files.exists(path);
    long size = 0;
    Instant modified = null;
    if (exists) {
      try {
        size = Files.size(path);
        modified = Files.getLastModifiedTime(path).toInstant();
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to stat " + path, e);
      }
    }
    return new StateFileInfo(path.toString(), exists, size, modified, Files.exists(lockPath), readMarker());
  }

  private PortfolioState read(Path source) {
    PortfolioState state;
    try {
      state = objectMapper.readValue(source.toFile(), PortfolioState.class);
    } catch (JsonProcessingException e) {
      throw PortfolioException.corrupted("failed to parse " + source + ": " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw PortfolioException.corrupted("failed to read " + source + ": " + e.getMessage(), e);
    }
    StateValidator.validateStructure(state);
    return state;
  }

  private void writeAtomically(byte[] bytes) throws IOException {
    Path parent = path.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try {
      Files.write(tempPath, bytes);
      try {
        Files.move(tempPath, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      try {
        Files.deleteIfExists(tempPath);
      } catch (IOException cleanup) {
        e.addSuppressed(cleanup);
      }
      throw e;
    }
  }

  private LockMarker createMarker() throws IOException {
    LockMarker marker = new LockMarker(clock.instant(), processId, hostname);
    Files.write(lockPath, objectMapper.writeValueAsBytes(marker), StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    return marker;
  }

  /**
   * Removes the existing marker when it is older than the stale-lock age. A marker that cannot be
   * parsed is aged by its file modification time.
   *
   * @return true when the marker is gone and creation may be retried
   */
  private boolean removeStaleMarker() {
    Instant now = clock.instant();
    try {
      byte[] observed = Files.readAllBytes(lockPath);
      LockMarker marker = parseMarker(observed);
      Instant createdAt;
      if (marker != null && marker.timestamp() != null) {
        createdAt = marker.timestamp();
      } else {
        createdAt = Files.getLastModifiedTime(lockPath).toInstant();
      }
      Duration age = Duration.between(createdAt, now);
      if (age.compareTo(staleLockAge) <= 0) {
        return false;
      }
      if (!discardMarker(observed)) {
        log.info("Stale lock {} was replaced by another process before removal", lockPath);
        return false;
      }
      log.warn("Removed stale lock {} held by {} for {}s", lockPath,
          marker == null ? "unknown" : marker.holder(), age.toSeconds());
      return true;
    } catch (NoSuchFileException e) {
      return true;
    } catch (IOException e) {
      throw new PortfolioException(PortfolioErrorCode.PORTFOLIO_LOCKED, null, "failed to inspect lock " + lockPath, e);
    }
  }

  /**
   * Moves the marker to a private tombstone and deletes it only when it still holds {@code observed}.
   * A marker written by another contender in the meantime is put back.
   *
   * @return true when the aged marker is gone
   */
  boolean discardMarker(byte[] observed) throws IOException {
    Path tombstone = sibling(".lock." + UUID.randomUUID() + ".stale");
    try {
      Files.move(lockPath, tombstone, StandardCopyOption.ATOMIC_MOVE);
    } catch (NoSuchFileException e) {
      return true;
    }
    if (Arrays.equals(observed, Files.readAllBytes(tombstone))) {
      Files.delete(tombstone);
      return true;
    }
    try {
      Files.move(tombstone, lockPath);
    } catch (FileAlreadyExistsException e) {
      log.warn("Lock {} was re-acquired while restoring a live marker", lockPath);
      Files.deleteIfExists(tombstone);
    }
    return false;
  }

  private LockMarker parseMarker(byte[] bytes) {
    try {
      return objectMapper.readValue(bytes, LockMarker.class);
    } catch (IOException e) {
      log.debug("Lock marker {} unreadable: {}", lockPath, e.toString());
      return null;
    }
  }

  private LockMarker readMarker() {
    try {
      return objectMapper.readValue(lockPath.toFile(), LockMarker.class);
    } catch (IOException e) {
      log.debug("Lock marker {} unreadable: {}", lockPath, e.toString());
      return null;
    }
  }

  private String describeHolder() {
    LockMarker marker = readMarker();
    return marker == null ? "an unknown process" : marker.holder() + " since " + marker.timestamp();
  }

  private Path sibling(String suffix) {
    return path.resolveSibling(path.getFileName() + suffix);
  }

  private static String resolveHostname() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      log.debug("Falling back to 'localhost' as lock hostname: {}", e.toString());
      return "localhost";
    }
  }
}
