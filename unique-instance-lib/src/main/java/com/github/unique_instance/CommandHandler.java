// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import java.io.InputStream;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/// Application callback that executes a command on the leader, for its own launch and for every
/// follower. Calls for different followers run concurrently so implementations must be thread safe.
@FunctionalInterface
public interface CommandHandler {

  /// @param args  the command arguments of the launch
  /// @param input the stdin of the launch; for a follower it ends when the follower stdin ends
  /// @return the result, possibly completed later
  CompletionStage<CommandResult> handle(List<String> args, InputStream input) throws Exception;

  /// Adapts a handler that computes its result on the calling thread.
  static CommandHandler blocking(BlockingCommandHandler handler) {
    return (args, input) -> {
      try {
        return CompletableFuture.completedFuture(handler.handle(args, input));
      } catch (Exception e) {
        return CompletableFuture.failedFuture(e);
      }
    };
  }

  @FunctionalInterface
  interface BlockingCommandHandler {
    CommandResult handle(List<String> args, InputStream input) throws Exception;
  }
}
