// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node;

/// Thrown by [JsonPickle] and [MessageReader] when input does not decode to a [com.github.maelstrom_node.msg.Message].
public class DeserializationException extends Exception {
  public DeserializationException(String message) {
    super(message);
  }

  public DeserializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
