// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node.msg;

import java.util.Objects;

/// Asks the node to send back the string unchanged.
public record Echo(String echo) implements Request {
  public Echo {
    Objects.requireNonNull(echo, "echo");
  }

  @Override
  public PayloadType type() {
    return PayloadType.Echo;
  }
}
