// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node.msg;

public record InitOk() implements Reply {
  @Override
  public PayloadType type() {
    return PayloadType.InitOk;
  }

  @Override
  public PayloadType answers() {
    return PayloadType.Init;
  }
}
