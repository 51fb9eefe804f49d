// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import java.util.Objects;
import java.util.Optional;

/// The outcome of a command: an exit code and optional textual output.
/// An empty output string is the same as no output as the wire format cannot tell them apart.
///
/// @param code   the exit code the follower process terminates with
/// @param output the text to print, on stdout when the code is zero else on stderr
public record CommandResult(int code, Optional<String> output) {

  /// Success.
  public static final int CODE_SUCCESS = 0;
  /// Infrastructure failure: lock, I/O, connection or protocol.
  public static final int CODE_ERROR = 100;
  /// The command handler failed.
  public static final int CODE_CMD_ERROR = 101;

  public CommandResult {
    Objects.requireNonNull(output, "output cannot be null");
    output = output.filter(s -> !s.isEmpty());
  }

  public CommandResult(int code) {
    this(code, Optional.empty());
  }

  public CommandResult(int code, String output) {
    this(code, Optional.ofNullable(output));
  }

  public static CommandResult success() {
    return new CommandResult(CODE_SUCCESS);
  }

  public static CommandResult success(String output) {
    return new CommandResult(CODE_SUCCESS, output);
  }

  public static CommandResult error(String message) {
    return new CommandResult(CODE_ERROR, message);
  }

  public static CommandResult commandError(String message) {
    return new CommandResult(CODE_CMD_ERROR, message);
  }

  public boolean isSuccess() {
    return code == CODE_SUCCESS;
  }
}
