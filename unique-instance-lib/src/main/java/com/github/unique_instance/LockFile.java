// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import org.jetbrains.annotations.NotNull;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;

import static com.github.unique_instance.UniqueInstanceLogger.LOGGER;

/// The file every launch of an application opens to find out who leads.
///
/// ```
/// offset 0, 4 bytes: int32 big-endian port of the leader listener, 0 while undetermined
/// offset 4, 1 byte:  sentinel, never read, only locked
/// ```
///
/// The port region doubles as the data lock, held while the port is written or about to be read.
/// The sentinel byte is the instance lock which the leader holds for its whole lifetime.
public class LockFile implements Closeable {

  static final int PORT_SIZE = 4;
  static final int INSTANCE_REGION_SIZE = 1;

  private static final String ILLEGAL_FILENAME_CHARS = "\\/:*?\"<>|";

  /// Identity of a file already gone when it was opened; equal to no other key.
  private static final Object VANISHED = new Object();

  private final Path path;
  private final FileChannel channel;
  private final Object fileKey;
  private final ExclusiveRegionLock dataLock;
  private final ExclusiveRegionLock instanceLock;

  LockFile(Path path, FileChannel channel, Object fileKey) {
    this.path = path;
    this.channel = channel;
    this.fileKey = fileKey;
    this.dataLock = new FileChannelRegionLock(channel, 0, PORT_SIZE);
    this.instanceLock = new FileChannelRegionLock(channel, PORT_SIZE, INSTANCE_REGION_SIZE);
  }

  /// Opens the lock file of an application, creating it if absent.
  public static LockFile open(@NotNull Path directory, @NotNull String appId) throws IOException {
    final var path = pathFor(directory, appId);
    final var channel = FileChannel.open(path,
        StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
    final Object fileKey;
    try {
      fileKey = fileKey(path);
    } catch (IOException e) {
      channel.close();
      throw e;
    }
    LOGGER.finer(() -> "Opened lock file " + path + " with key " + fileKey);
    return new LockFile(path, channel, fileKey);
  }

  /// The platform file key of whatever `path` names now, [#VANISHED] when nothing. Platforms without
  /// file keys yield null, in which case only the existence of the path can be checked.
  private static Object fileKey(Path path) throws IOException {
    try {
      return Files.readAttributes(path, BasicFileAttributes.class).fileKey();
    } catch (NoSuchFileException e) {
      return VANISHED;
    }
  }

  public static Path pathFor(Path directory, String appId) {
    return directory.resolve("." + sanitizeFilename(appId));
  }

  /// Replaces the characters that are not allowed in a file name on common platforms.
  public static String sanitizeFilename(@NotNull String name) {
    final var sb = new StringBuilder(name.length());
    name.codePoints().forEach(cp -> {
      if (Character.isISOControl(cp) || ILLEGAL_FILENAME_CHARS.indexOf(cp) >= 0) {
        sb.append('_');
      } else {
        sb.appendCodePoint(cp);
      }
    });
    final var sanitized = sb.toString().strip();
    return sanitized.isEmpty() ? "_" : sanitized;
  }

  public Path path() {
    return path;
  }

  public ExclusiveRegionLock dataLock() {
    return dataLock;
  }

  public ExclusiveRegionLock instanceLock() {
    return instanceLock;
  }

  /// Writes the leader port and forces it to storage. The data lock must be held.
  public void writePort(int port) throws IOException {
    final var bb = ByteBuffer.allocate(PORT_SIZE);
    bb.putInt(port);
    bb.flip();
    final int written = channel.write(bb, 0);
    if (written != PORT_SIZE) {
      throw new IOException("Failed to write local port in lock file " + path + ": wrote " + written + " bytes");
    }
    channel.force(false);
  }

  /// Reads the leader port. Only meaningful once the data lock was obtained after the leader released it.
  public int readPort() throws IOException {
    final var bb = ByteBuffer.allocate(PORT_SIZE);
    while (bb.hasRemaining()) {
      if (channel.read(bb, bb.position()) < 0) {
        throw new IOException("Failed to read socket port from lock file " + path + ": got " + bb.position() + " bytes");
      }
    }
    return bb.getInt(0);
  }

  public boolean exists() {
    return Files.exists(path);
  }

  /// Whether the path still names the file this handle opened. A leader deletes the file on exit and
  /// the next launch creates a new one under the same path, so a handle may outlive its file.
  public boolean isCurrent() {
    if (fileKey == VANISHED) {
      return false;
    }
    try {
      final var current = fileKey(path);
      return current != VANISHED && Objects.equals(fileKey, current);
    } catch (IOException e) {
      LOGGER.fine(() -> "Failed to read identity of " + path + ": " + e.getMessage());
      return false;
    }
  }

  public void delete() throws IOException {
    Files.deleteIfExists(path);
  }

  public boolean isOpen() {
    return channel.isOpen();
  }

  /// Closes the channel which also drops any region still locked through it.
  @Override
  public void close() throws IOException {
    channel.close();
  }

  @Override
  public String toString() {
    return "LockFile[" + path + "]";
  }
}
