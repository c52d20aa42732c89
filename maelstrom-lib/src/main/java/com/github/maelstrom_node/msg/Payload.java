// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node.msg;

/// Payload is the kind specific content of a message body. It is a closed set of records so that dispatching on
/// [#type()] with a switch expression without a default branch fails to compile when a new kind is added.
public sealed interface Payload permits Request, Reply {
  /// @return the discriminator written as the `type` field of the body.
  PayloadType type();
}
