// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node.msg;

/// Asks the node for a fresh identifier.
public record Generate() implements Request {
  @Override
  public PayloadType type() {
    return PayloadType.Generate;
  }
}
