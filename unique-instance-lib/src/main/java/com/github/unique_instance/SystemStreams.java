// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import java.io.InputStream;
import java.io.PrintStream;

/// The standard streams a launch reads its input from and prints results to. Applications that replace
/// `System.in/out/err` can hand over the originals instead.
public record SystemStreams(InputStream in, PrintStream out, PrintStream err) {

  /// The current `System` streams.
  public static SystemStreams system() {
    return new SystemStreams(System.in, System.out, System.err);
  }

  /// Prints the result output if any: to `out` on success, to `err` otherwise.
  public void print(CommandResult result) {
    result.output().ifPresent(text -> {
      final var target = result.isSuccess() ? out : err;
      target.println(text);
      target.flush();
    });
  }
}
