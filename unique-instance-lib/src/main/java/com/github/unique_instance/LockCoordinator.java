// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.file.Path;

import static com.github.unique_instance.UniqueInstanceLogger.LOGGER;

/// Elects the leader among the launches of one application through the two lock regions of its
/// [LockFile].
///
/// 1. Open the lock file, creating it when absent.
/// 2. Take the data lock, blocking. This waits for a leader that is still publishing its port.
/// 3. Try the instance lock without blocking. Success makes us the leader, which keeps the data lock
///    until it has published its port. Failure makes us a follower: we drop the data lock and read the
///    port the leader wrote while it held the data lock.
///
/// A leader deletes the lock file before releasing the instance lock. A launch that opened the file just
/// before the deletion can then win the instance lock of a file nobody else will ever open again, so
/// after winning we check the path still names the file we opened and otherwise run the election again.
public class LockCoordinator {

  static final int MAX_ELECTION_ATTEMPTS = 5;

  /// How a round gets its handle on the lock file.
  @FunctionalInterface
  interface LockFileOpener {
    LockFile open(Path directory, String appId) throws IOException;
  }

  private final Path lockDirectory;
  private final LockFileOpener opener;

  public LockCoordinator(Path lockDirectory) {
    this(lockDirectory, LockFile::open);
  }

  LockCoordinator(Path lockDirectory, LockFileOpener opener) {
    this.lockDirectory = lockDirectory;
    this.opener = opener;
  }

  public InstanceRole acquire(@NotNull String appId) throws IOException {
    for (int attempt = 1; attempt <= MAX_ELECTION_ATTEMPTS; attempt++) {
      final var role = elect(appId);
      if (role != null) {
        return role;
      }
      final int failedAttempt = attempt;
      LOGGER.fine(() -> "Lock file of " + appId + " vanished during election attempt " + failedAttempt + ", retrying");
    }
    throw new IOException("Failed to elect a unique instance for " + appId + " after " + MAX_ELECTION_ATTEMPTS + " attempts");
  }

  /// One election round, null when the lock file was deleted under us.
  private InstanceRole elect(String appId) throws IOException {
    final var lockFile = opener.open(lockDirectory, appId);
    try {
      lockFile.dataLock().acquireBlocking();
      if (lockFile.instanceLock().tryAcquire()) {
        if (!lockFile.isCurrent()) {
          closeQuietly(lockFile);
          return null;
        }
        LOGGER.fine(() -> "Unique instance starting with " + lockFile);
        return new InstanceRole.Leader(lockFile);
      }
      lockFile.dataLock().release();
      final int port = lockFile.readPort();
      lockFile.close();
      if (port <= 0 || port > 0xFFFF) {
        throw new IOException("Invalid port " + port + " in " + lockFile);
      }
      LOGGER.fine(() -> "Unique instance already running on port " + port + ", delegating command execution");
      return new InstanceRole.Follower(port);
    } catch (IOException | RuntimeException e) {
      closeQuietly(lockFile);
      throw e;
    }
  }

  private static void closeQuietly(LockFile lockFile) {
    try {
      lockFile.close();
    } catch (IOException e) {
      LOGGER.warning(() -> "Failed to close " + lockFile + ": " + e.getMessage());
    }
  }
}
