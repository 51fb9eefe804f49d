// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import org.jetbrains.annotations.TestOnly;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;

import static com.github.unique_instance.UniqueInstanceLogger.LOGGER;

/// Unique instance application handling.
///
/// Either this launch is the first one of the application to run, in which case it becomes the leader
/// and executes commands, or another launch already leads and this one passes its command arguments and
/// stdin to it, then exits with the result code it gets back.
///
/// A lock file per application id tells the launches apart (see [LockCoordinator]) and holds the loopback
/// port the leader listens on (see [LeaderListener]). A follower connects to that port (see
/// [FollowerForwarder]). Only one request and one result travel over a connection.
///
/// There are two kinds of failure codes: [CommandResult#CODE_ERROR] for lock, I/O and connection issues,
/// where retrying the launch may help, and [CommandResult#CODE_CMD_ERROR] when the command itself failed.
///
/// ```java
/// new UniqueInstance().start("my-app", handler, List.of(args), CompletableFuture.completedFuture(null));
/// ```
public class UniqueInstance {

  private final UniqueInstanceConfig config;
  private final Workers workers;
  private final ProcessTerminator terminator;
  private final ListenerState state = new ListenerState();
  private final AtomicBoolean started = new AtomicBoolean();
  private volatile InstanceRole role;
  private volatile LeaderLifecycle lifecycle;

  public UniqueInstance() {
    this(UniqueInstanceConfig.fromSystemProperties());
  }

  public UniqueInstance(UniqueInstanceConfig config) {
    this(config, new DaemonWorkers("unique-instance"), ProcessTerminator.SYSTEM_EXIT);
  }

  public UniqueInstance(UniqueInstanceConfig config, Workers workers, ProcessTerminator terminator) {
    this.config = config;
    this.workers = workers;
    this.terminator = terminator;
  }

  public CompletableFuture<Void> start(String appId, CommandHandler handler, List<String> args, CompletionStage<?> ready) {
    return start(appId, handler, args, ready, SystemStreams.system());
  }

  /// Starts the instance.
  ///
  /// For the leader the arguments are processed once `ready` completes successfully, so this usually
  /// returns before they are. Arguments from followers are only processed after these, each on its own
  /// worker.
  ///
  /// For a follower the arguments are handed to the leader and the process is terminated with the
  /// result code; with the default [ProcessTerminator] this method does not return.
  ///
  /// @param appId   the application id, unique per application
  /// @param handler executes commands on the leader
  /// @param args    the command arguments of this launch
  /// @param ready   completes when the application is ready to execute commands; it may already be complete
  /// @param streams the stdio of this launch
  /// @return for the leader, completes once its own command ran and followers are being served
  public CompletableFuture<Void> start(String appId, CommandHandler handler, List<String> args,
                                       CompletionStage<?> ready, SystemStreams streams) {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Unique instance already started");
    }
    try {
      role = new LockCoordinator(config.lockDirectory()).acquire(appId);
      if (role instanceof InstanceRole.Leader leader) {
        return startLeader(leader.lockFile(), handler, args, ready, streams);
      }
      final int port = ((InstanceRole.Follower) role).port();
      final int code = new FollowerForwarder(streams, workers, config.inputDrainTimeout())
          .forward(port, new CommandRequest(args));
      terminator.terminate(code);
      return CompletableFuture.completedFuture(null);
    } catch (IOException | RuntimeException e) {
      LOGGER.log(Level.SEVERE, "Failed to start instance: " + e.getMessage(), e);
      terminator.terminate(CommandResult.CODE_ERROR);
      return CompletableFuture.failedFuture(e);
    }
  }

  private CompletableFuture<Void> startLeader(LockFile lockFile, CommandHandler handler, List<String> args,
                                              CompletionStage<?> ready, SystemStreams streams) throws IOException {
    final var listener = new LeaderListener(lockFile, handler, state, workers, config.serverBacklog());
    try {
      listener.publish();
    } catch (IOException e) {
      lockFile.close();
      throw e;
    }
    final var leaderLifecycle = new LeaderLifecycle(lockFile, state);
    leaderLifecycle.registerShutdownHook();
    lifecycle = leaderLifecycle;
    return listener.serve(args, ready, streams);
  }

  /// Stops serving other instances. Requests arriving meanwhile are answered with an error. Idempotent.
  public void stop() {
    state.requestStop();
  }

  /// Stops serving and gives up leadership right away instead of at JVM exit: the lock file is deleted
  /// and its locks released, so a later launch becomes the new leader.
  public void shutdown() {
    final var current = lifecycle;
    if (current != null) {
      current.shutdown();
    } else {
      state.requestStop();
    }
  }

  public boolean isLeader() {
    return role instanceof InstanceRole.Leader;
  }

  @TestOnly
  public ListenerState.Phase phase() {
    return state.phase();
  }
}
