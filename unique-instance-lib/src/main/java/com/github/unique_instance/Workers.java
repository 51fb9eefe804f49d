// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import java.time.Duration;

/// Runs units of background work: the acceptor loop, one task per connection, the stdin forwarder.
/// The protocol code only depends on this so the threading model can change underneath.
public interface Workers {

  Worker spawn(String name, Runnable task);

  /// Waits for every task spawned so far to finish.
  ///
  /// @return true when all finished within the timeout
  boolean awaitAll(Duration timeout) throws InterruptedException;

  interface Worker {
    /// @return true when the task finished within the timeout
    boolean await(Duration timeout) throws InterruptedException;

    boolean isDone();
  }
}
