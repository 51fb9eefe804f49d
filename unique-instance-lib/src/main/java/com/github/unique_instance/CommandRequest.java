// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import java.util.Arrays;
import java.util.List;

/// The argument vector a follower hands over to the leader.
public record CommandRequest(List<String> args) {

  public CommandRequest {
    args = List.copyOf(args);
  }

  public static CommandRequest of(String... args) {
    return new CommandRequest(Arrays.asList(args));
  }
}
