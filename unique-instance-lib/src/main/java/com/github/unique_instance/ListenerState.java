// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import java.io.IOException;
import java.net.ServerSocket;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static com.github.unique_instance.UniqueInstanceLogger.LOGGER;

/// State of a leader listener shared by the acceptor and connection threads. The stop flag and the server
/// socket are each written once, so readers need no further synchronisation; at worst one more accept is
/// attempted after a stop and fails on the closed socket.
public class ListenerState {

  /// ```
  /// ELECTING -> PUBLISHING -> ACCEPTING -> STOPPING -> STOPPED
  /// ```
  /// Only the move to STOPPING is triggered from outside, and it may happen in any earlier phase.
  public enum Phase {ELECTING, PUBLISHING, ACCEPTING, STOPPING, STOPPED}

  private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.ELECTING);
  private final AtomicBoolean stopping = new AtomicBoolean();
  private volatile ServerSocket server;

  public Phase phase() {
    return phase.get();
  }

  /// Records the bound server. A stop requested before it was bound closes it right away.
  void publishing(ServerSocket server) {
    this.server = server;
    advance(Phase.ELECTING, Phase.PUBLISHING);
    if (stopping.get()) {
      closeServer(server);
    }
  }

  void accepting() {
    advance(Phase.PUBLISHING, Phase.ACCEPTING);
  }

  void stopped() {
    phase.set(Phase.STOPPED);
  }

  /// Sets the stop flag and closes the server socket so that a blocked accept returns. Idempotent.
  public void requestStop() {
    if (!stopping.compareAndSet(false, true)) {
      return;
    }
    final var previous = phase.getAndUpdate(p -> p == Phase.STOPPED ? p : Phase.STOPPING);
    LOGGER.fine(() -> "Unique instance stopping from phase " + previous);
    final var current = server;
    if (current != null) {
      closeServer(current);
    }
  }

  private static void closeServer(ServerSocket server) {
    try {
      server.close();
    } catch (IOException e) {
      LOGGER.warning(() -> "Failed to close local server socket: " + e.getMessage());
    }
  }

  public boolean isStopping() {
    return stopping.get();
  }

  ServerSocket server() {
    return server;
  }

  private void advance(Phase from, Phase to) {
    if (!phase.compareAndSet(from, to)) {
      LOGGER.finer(() -> "Listener left in phase " + phase.get() + " instead of " + to);
    }
  }
}
