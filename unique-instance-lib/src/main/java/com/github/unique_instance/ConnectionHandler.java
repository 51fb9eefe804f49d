// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.logging.Level;

import static com.github.unique_instance.UniqueInstanceLogger.LOGGER;

/// Serves one follower connection: reads its arguments, runs the command with the rest of the
/// connection as stdin, writes back the result and closes. Failures stay within this connection.
public class ConnectionHandler implements Runnable {

  static final String STOPPING_MESSAGE = "Program is stopping";

  /// How long unread forwarded input is drained after the result went out.
  static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(5);

  private static final int BUFFER_SIZE = 8192;

  private final Socket socket;
  private final CommandHandler handler;
  private final ListenerState state;

  public ConnectionHandler(Socket socket, CommandHandler handler, ListenerState state) {
    this.socket = socket;
    this.handler = handler;
    this.state = state;
  }

  @Override
  public void run() {
    try {
      final var in = new DataInputStream(new BufferedInputStream(socket.getInputStream(), BUFFER_SIZE));
      done(respond(in));
      drain(in);
    } catch (IOException e) {
      LOGGER.warning(() -> "Failed to open connection streams: " + e.getMessage());
    } finally {
      close();
    }
  }

  private CommandResult respond(DataInputStream in) {
    final CommandRequest request;
    try {
      request = ProtocolPickle.readRequest(in);
    } catch (IOException e) {
      final var message = "Failed to read arguments from socket: " + e.getMessage();
      LOGGER.severe(message);
      return CommandResult.error(message);
    }
    LOGGER.finer(() -> "Received " + request.args().size() + " arguments from port " + socket.getPort());
    return execute(request.args(), in);
  }

  CommandResult execute(List<String> args, InputStream input) {
    if (state.isStopping()) {
      return CommandResult.error(STOPPING_MESSAGE);
    }
    try {
      final var stage = handler.handle(args, input);
      final var result = stage == null ? null : stage.toCompletableFuture().get();
      if (result == null) {
        return failed(new IllegalStateException("no result"));
      }
      return result;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return failed(e);
    } catch (ExecutionException | CompletionException e) {
      return failed(e.getCause() != null ? e.getCause() : e);
    } catch (Exception e) {
      return failed(e);
    }
  }

  private static CommandResult failed(Throwable cause) {
    final var message = "Failed to process arguments: " + cause.getMessage();
    LOGGER.log(Level.SEVERE, message, cause);
    return CommandResult.commandError(message);
  }

  private void done(CommandResult result) {
    // send the result before closing the socket
    try {
      final var out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream(), BUFFER_SIZE));
      ProtocolPickle.writeResult(out, result);
      socket.shutdownOutput();
    } catch (IOException e) {
      LOGGER.warning(() -> "Failed to return response code through socket: " + e.getMessage());
    }
  }

  /// Consumes forwarded input the command left unread until the follower signals its end. Closing with
  /// unread data pending would reset the connection and could lose the result on the follower side.
  private void drain(InputStream in) {
    try {
      socket.setSoTimeout((int) DRAIN_TIMEOUT.toMillis());
      final long skipped = in.transferTo(OutputStream.nullOutputStream());
      if (skipped > 0) {
        LOGGER.finer(() -> "Discarded " + skipped + " bytes of unread input");
      }
    } catch (IOException e) {
      LOGGER.finer(() -> "Stopped draining input: " + e.getMessage());
    }
  }

  private void close() {
    try {
      socket.close();
    } catch (IOException e) {
      LOGGER.warning(() -> "Failed to close socket: " + e.getMessage());
    }
  }
}
