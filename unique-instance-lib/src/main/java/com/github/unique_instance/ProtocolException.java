// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import java.io.IOException;

/// A frame on the wire is malformed, e.g. a negative or oversized length prefix.
public class ProtocolException extends IOException {
  public ProtocolException(String message) {
    super(message);
  }
}
