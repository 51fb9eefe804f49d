// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.github.unique_instance.UniqueInstanceLogger.LOGGER;

/// Binary encoding of the follower/leader exchange. The type of each field is fixed by its position:
///
/// ```
/// Request (follower to leader):
///   argc:    int32
///   argc times:
///     len:   int32
///     bytes: len bytes UTF-8
///   then the raw forwarded stdin up to the follower shutting down its output
///
/// Result (leader to follower):
///   code:    int32
///   len:     int32, 0 means no output
///   bytes:   len bytes UTF-8
/// ```
///
/// All integers are big-endian as written by [DataOutputStream].
public class ProtocolPickle {

  /// Upper bound of a single encoded string.
  public static final int MAX_STRING_BYTES = 16 * 1024 * 1024;
  /// Upper bound of the number of arguments in a request.
  public static final int MAX_ARGUMENTS = 65536;

  private ProtocolPickle() {
  }

  /// Reads exactly `n` bytes, failing with an `EOFException` if the stream ends first.
  public static byte[] readExact(DataInputStream in, int n) throws IOException {
    if (n < 0) {
      throw new ProtocolException("Negative length: " + n);
    }
    final var bytes = new byte[n];
    in.readFully(bytes);
    return bytes;
  }

  public static int readInt(DataInputStream in) throws IOException {
    return in.readInt();
  }

  public static void writeInt(DataOutputStream out, int value) throws IOException {
    out.writeInt(value);
  }

  public static String readString(DataInputStream in) throws IOException {
    final int length = in.readInt();
    if (length < 0 || length > MAX_STRING_BYTES) {
      throw new ProtocolException("Invalid string length: " + length);
    }
    return new String(readExact(in, length), StandardCharsets.UTF_8);
  }

  public static void writeString(DataOutputStream out, String value) throws IOException {
    final var bytes = value.getBytes(StandardCharsets.UTF_8);
    out.writeInt(bytes.length);
    out.write(bytes);
  }

  /// Reads a string where an empty one stands for no value. The peer may have gone away already
  /// so any failure also yields no value.
  public static Optional<String> readOptionalString(DataInputStream in) {
    try {
      return Optional.of(readString(in)).filter(s -> !s.isEmpty());
    } catch (IOException e) {
      LOGGER.finer(() -> "No optional string to read: " + e);
      return Optional.empty();
    }
  }

  public static void writeOptionalString(DataOutputStream out, Optional<String> value) throws IOException {
    writeString(out, value.orElse(""));
  }

  public static CommandRequest readRequest(DataInputStream in) throws IOException {
    final int argc = in.readInt();
    if (argc < 0 || argc > MAX_ARGUMENTS) {
      throw new ProtocolException("Invalid argument count: " + argc);
    }
    final var args = new ArrayList<String>(argc);
    for (int i = 0; i < argc; i++) {
      args.add(readString(in));
    }
    return new CommandRequest(args);
  }

  public static void writeRequest(DataOutputStream out, CommandRequest request) throws IOException {
    final List<String> args = request.args();
    out.writeInt(args.size());
    for (String arg : args) {
      writeString(out, arg);
    }
    out.flush();
  }

  /// Reads a result. The code is mandatory whereas a missing output is tolerated.
  public static CommandResult readResult(DataInputStream in) throws IOException {
    final int code = in.readInt();
    return new CommandResult(code, readOptionalString(in));
  }

  public static void writeResult(DataOutputStream out, CommandResult result) throws IOException {
    out.writeInt(result.code());
    writeOptionalString(out, result.output());
    out.flush();
  }
}
