// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node.msg;

import java.util.Objects;

/// @param echo exactly the string of the [Echo] being answered.
public record EchoOk(String echo) implements Reply {
  public EchoOk {
    Objects.requireNonNull(echo, "echo");
  }

  @Override
  public PayloadType type() {
    return PayloadType.EchoOk;
  }

  @Override
  public PayloadType answers() {
    return PayloadType.Echo;
  }
}
