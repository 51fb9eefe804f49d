// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance.demo;

import com.github.unique_instance.CommandHandler;
import com.github.unique_instance.CommandResult;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static com.github.unique_instance.UniqueInstanceLogger.LOGGER;

/// The commands the demo leader executes, for its own launch and for every follower.
///
/// | argv | result |
/// |---|---|
/// | `echo w1 w2` | 0, the words joined by a space |
/// | `cat` | 0, the whole stdin |
/// | `exit N [text]` | N, the optional text |
/// | `args` or nothing | 0, the argument count then each argument in brackets |
/// | `fail` | the handler throws |
/// | `stop` | 0, `stopping`, then the leader shuts down |
public class DemoCommands implements CommandHandler.BlockingCommandHandler {

  static final int CODE_UNKNOWN = 2;

  private final Runnable onStop;

  public DemoCommands(Runnable onStop) {
    this.onStop = onStop;
  }

  @Override
  public CommandResult handle(List<String> args, InputStream input) throws Exception {
    LOGGER.fine(() -> "Executing " + args);
    if (args.isEmpty()) {
      return describe(args);
    }
    final var rest = args.subList(1, args.size());
    return switch (args.get(0)) {
      case "echo" -> CommandResult.success(String.join(" ", rest));
      case "cat" -> CommandResult.success(readAll(input));
      case "exit" -> exit(rest);
      case "args" -> describe(rest);
      case "fail" -> throw new IllegalStateException("failing on request");
      case "stop" -> {
        onStop.run();
        yield CommandResult.success("stopping");
      }
      default -> new CommandResult(CODE_UNKNOWN, "unknown command: " + args.get(0));
    };
  }

  private static CommandResult exit(List<String> rest) {
    if (rest.isEmpty()) {
      return new CommandResult(CODE_UNKNOWN, "usage: exit N [text]");
    }
    final int code;
    try {
      code = Integer.parseInt(rest.get(0));
    } catch (NumberFormatException e) {
      return new CommandResult(CODE_UNKNOWN, "not an exit code: " + rest.get(0));
    }
    return new CommandResult(code, String.join(" ", rest.subList(1, rest.size())));
  }

  private static CommandResult describe(List<String> args) {
    final var lines = args.stream()
        .map(arg -> "[" + arg + "]")
        .collect(Collectors.joining("\n"));
    return CommandResult.success(lines.isEmpty() ? "argc=0" : "argc=" + args.size() + "\n" + lines);
  }

  private static String readAll(InputStream input) throws IOException {
    return new String(input.readAllBytes(), StandardCharsets.UTF_8);
  }
}
