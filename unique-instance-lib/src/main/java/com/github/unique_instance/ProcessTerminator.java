// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

/// Ends the process of a launch that did not become the leader.
@FunctionalInterface
public interface ProcessTerminator {

  ProcessTerminator SYSTEM_EXIT = System::exit;

  void terminate(int code);
}
