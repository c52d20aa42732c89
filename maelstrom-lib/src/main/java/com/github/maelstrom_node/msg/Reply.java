// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node.msg;

/// A payload that answers a [Request]. This node only sends replies. Receiving one is a protocol violation.
public sealed interface Reply extends Payload permits EchoOk, GenerateOk, InitOk {
  /// @return the type of the request that this reply answers.
  PayloadType answers();
}
