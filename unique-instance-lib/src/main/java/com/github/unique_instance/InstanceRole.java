// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

/// The outcome of an election. The leader keeps the open lock file with both regions held; a follower
/// only learns where to connect.
public sealed interface InstanceRole permits InstanceRole.Leader, InstanceRole.Follower {

  /// This process won the instance lock. The data lock is still held until the port is published.
  record Leader(LockFile lockFile) implements InstanceRole {
  }

  /// Another process leads and listens on the given loopback port.
  record Follower(int port) implements InstanceRole {
  }
}
