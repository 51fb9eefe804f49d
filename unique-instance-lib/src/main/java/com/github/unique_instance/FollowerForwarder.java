// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.net.InetAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.logging.Level;

import static com.github.unique_instance.UniqueInstanceLogger.LOGGER;

/// The follower side: hands the arguments and stdin of this launch to the leader and reports its result.
public class FollowerForwarder {

  private final SystemStreams streams;
  private final Workers workers;
  private final Duration drainTimeout;

  public FollowerForwarder(SystemStreams streams, Workers workers, Duration drainTimeout) {
    this.streams = streams;
    this.workers = workers;
    this.drainTimeout = drainTimeout;
  }

  /// Forwards the request to the leader on `port`, prints the output of the result and returns its
  /// code, or [CommandResult#CODE_ERROR] when the exchange fails.
  public int forward(int port, CommandRequest request) {
    final var cancellation = new Cancellation();
    try (var socket = new Socket(InetAddress.getLoopbackAddress(), port)) {
      final var out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream()));
      final var in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
      ProtocolPickle.writeRequest(out, request);
      LOGGER.finer(() -> "Sent " + request.args().size() + " arguments to port " + port);

      final var forwarder = new InputForwarder(streams.in(), socket.getOutputStream(), socket::shutdownOutput, cancellation);
      final var worker = workers.spawn("stdin", forwarder);

      final var result = ProtocolPickle.readResult(in);
      LOGGER.finer(() -> "Received result code " + result.code() + " after forwarding " + forwarder.forwarded() + " bytes");

      cancellation.cancel();
      awaitForwarder(worker);
      streams.print(result);
      return result.code();
    } catch (IOException e) {
      LOGGER.log(Level.SEVERE, "Failed to execute command on unique instance: " + e.getMessage(), e);
      return CommandResult.CODE_ERROR;
    } finally {
      cancellation.cancel();
    }
  }

  private void awaitForwarder(Workers.Worker worker) {
    try {
      if (!worker.await(drainTimeout)) {
        LOGGER.fine(() -> "Input forwarding still blocked after " + drainTimeout + ", giving up on it");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.fine("Interrupted while waiting for input forwarding to end");
    }
  }
}
