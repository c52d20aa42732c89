// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node;

/// The ways a step can fail. None of them are recovered locally. The first one stops the node.
public enum ErrorKind {
  /// The input was not a well-formed message: bad JSON, a missing or mistyped field, or an unknown `type`.
  DESERIALIZATION,
  /// A well-formed message that this node must never receive, which is any reply type.
  PROTOCOL_VIOLATION,
  /// The output rejected the reply, for example a closed pipe.
  WRITE,
  /// The reply counter is at `Long.MAX_VALUE` and cannot number another reply.
  COUNTER_EXHAUSTED
}
