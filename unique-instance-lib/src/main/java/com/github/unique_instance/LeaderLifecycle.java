// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.github.unique_instance.UniqueInstanceLogger.LOGGER;

/// Releases what a leader holds when it goes away. The lock file is deleted before the instance lock is
/// released so that a launch never finds a live-looking port in a file whose leader is gone.
///
/// Runs once, either from the JVM shutdown hook or when the application shuts the instance down itself.
/// Every step is best effort: a failure is logged and the next step still runs.
public class LeaderLifecycle {

  private final LockFile lockFile;
  private final ListenerState state;
  private final AtomicBoolean done = new AtomicBoolean();
  private final Thread hook;

  public LeaderLifecycle(LockFile lockFile, ListenerState state) {
    this.lockFile = lockFile;
    this.state = state;
    this.hook = new Thread(this::cleanup, "unique-instance-shutdown");
  }

  public void registerShutdownHook() {
    Runtime.getRuntime().addShutdownHook(hook);
  }

  /// Cleans up now rather than at JVM exit.
  public void shutdown() {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException e) {
      LOGGER.finer(() -> "JVM already shutting down, hook stays registered");
    }
    cleanup();
  }

  public boolean isDone() {
    return done.get();
  }

  void cleanup() {
    if (!done.compareAndSet(false, true)) {
      return;
    }
    LOGGER.fine(() -> "Releasing unique instance " + lockFile);
    state.requestStop();
    try {
      lockFile.delete();
    } catch (IOException e) {
      LOGGER.warning(() -> "Failed to delete lock file " + lockFile.path() + ": " + e.getMessage());
    }
    try {
      lockFile.instanceLock().release();
    } catch (IOException e) {
      LOGGER.warning(() -> "Failed to release instance lock: " + e.getMessage());
    }
    try {
      lockFile.close();
    } catch (IOException e) {
      LOGGER.warning(() -> "Failed to close lock file: " + e.getMessage());
    }
  }
}
