// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static com.github.unique_instance.UniqueInstanceLogger.LOGGER;

/// The leader side: a loopback listener whose port is published in the lock file, serving each follower
/// on its own worker once the leader has run its own command.
public class LeaderListener {

  private final LockFile lockFile;
  private final CommandHandler handler;
  private final ListenerState state;
  private final Workers workers;
  private final int backlog;

  public LeaderListener(LockFile lockFile, CommandHandler handler, ListenerState state, Workers workers, int backlog) {
    this.lockFile = lockFile;
    this.handler = handler;
    this.state = state;
    this.workers = workers;
    this.backlog = backlog;
  }

  /// Binds an ephemeral loopback port, writes it to the lock file and releases the data lock so that
  /// waiting launches can read it.
  ///
  /// @return the published port
  public int publish() throws IOException {
    final var server = new ServerSocket(0, backlog, InetAddress.getLoopbackAddress());
    state.publishing(server);
    try {
      lockFile.writePort(server.getLocalPort());
      lockFile.dataLock().release();
    } catch (IOException e) {
      server.close();
      throw e;
    }
    LOGGER.fine(() -> "Unique instance listening on port " + server.getLocalPort());
    return server.getLocalPort();
  }

  /// Runs the local command once `ready` completes, then starts accepting followers. Followers are
  /// therefore always served after the leader's own command.
  ///
  /// @return completes once the acceptor runs; fails with the `ready` failure (no acceptor is started
  /// then) or with the local command failure (the acceptor still starts)
  public CompletableFuture<Void> serve(List<String> args, CompletionStage<?> ready, SystemStreams streams) {
    final var started = new CompletableFuture<Void>();
    ready.whenComplete((ignored, readyFailure) -> {
      if (readyFailure != null) {
        LOGGER.fine(() -> "Application not ready, not serving other instances: " + readyFailure);
        started.completeExceptionally(readyFailure);
        return;
      }
      runLocal(args, streams).whenComplete((result, failure) -> {
        final Throwable outcome = failure == null && result == null
            ? new IllegalStateException("Command returned no result")
            : failure;
        try {
          if (outcome == null) {
            streams.print(result);
          }
        } finally {
          startAcceptor();
        }
        if (outcome != null) {
          LOGGER.fine(() -> "Own command failed: " + outcome.getMessage());
          started.completeExceptionally(outcome);
        } else {
          started.complete(null);
        }
      });
    });
    return started;
  }

  private CompletionStage<CommandResult> runLocal(List<String> args, SystemStreams streams) {
    try {
      final var stage = handler.handle(args, streams.in());
      return stage != null ? stage : CompletableFuture.failedFuture(new IllegalStateException("Command returned no stage"));
    } catch (Exception e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  void startAcceptor() {
    state.accepting();
    workers.spawn("acceptor", this::acceptLoop);
  }

  void acceptLoop() {
    final var server = state.server();
    while (!state.isStopping()) {
      try {
        final var socket = server.accept();
        LOGGER.finer(() -> "Accepted connection from port " + socket.getPort());
        workers.spawn("connection", new ConnectionHandler(socket, handler, state));
      } catch (IOException e) {
        // accept fails once the server socket is closed by a stop request
        if (!state.isStopping()) {
          LOGGER.warning(() -> "Failed to accept connection: " + e.getMessage());
        }
      }
    }
    state.stopped();
    LOGGER.fine("Unique instance acceptor stopped");
  }
}
