// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import static com.github.unique_instance.UniqueInstanceLogger.LOGGER;

/// Copies the local stdin of a follower to the leader connection.
///
/// Each round reads what the source says is available, at least one byte and at most
/// [#BUFFER_SIZE], then writes and flushes it. The [Cancellation] is checked after every round. A
/// read already blocked on the source cannot be cut short so cancelling only prevents the next round.
///
/// Once the loop ends the source is closed and the end-of-input action runs, which for a socket half
/// closes its output so the leader reads EOF while the follower can still read the result.
public class InputForwarder implements Runnable {

  static final int BUFFER_SIZE = 8192;

  @FunctionalInterface
  public interface EndOfInput {
    void signal() throws IOException;
  }

  private final InputStream source;
  private final OutputStream sink;
  private final EndOfInput endOfInput;
  private final Cancellation cancellation;
  private volatile long forwarded;

  public InputForwarder(InputStream source, OutputStream sink, EndOfInput endOfInput, Cancellation cancellation) {
    this.source = source;
    this.sink = sink;
    this.endOfInput = endOfInput;
    this.cancellation = cancellation;
  }

  @Override
  public void run() {
    try {
      pump();
    } finally {
      finish();
    }
  }

  /// @return the number of bytes forwarded so far
  public long forwarded() {
    return forwarded;
  }

  private void pump() {
    final var buffer = new byte[BUFFER_SIZE];
    try {
      while (!cancellation.isCancelled()) {
        final int available = source.available();
        final int wanted = Math.max(1, Math.min(available, buffer.length));
        final int read = source.read(buffer, 0, wanted);
        if (read < 0) {
          LOGGER.finer(() -> "Local input ended after " + forwarded + " bytes");
          return;
        }
        if (cancellation.isCancelled()) {
          return;
        }
        sink.write(buffer, 0, read);
        sink.flush();
        forwarded += read;
      }
      LOGGER.finer(() -> "Input forwarding cancelled after " + forwarded + " bytes");
    } catch (IOException e) {
      LOGGER.fine(() -> "Input forwarding stopped: " + e.getMessage());
    }
  }

  private void finish() {
    try {
      source.close();
    } catch (IOException e) {
      LOGGER.fine(() -> "Failed to close local input: " + e.getMessage());
    }
    try {
      endOfInput.signal();
    } catch (IOException e) {
      LOGGER.fine(() -> "Failed to signal end of input: " + e.getMessage());
    }
  }
}
