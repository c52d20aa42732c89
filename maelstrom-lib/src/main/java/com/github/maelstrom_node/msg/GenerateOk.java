// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node.msg;

import java.util.Objects;

/// @param id the identifier made by the answering node. See `UniqueIdGenerator` for the format.
public record GenerateOk(String id) implements Reply {
  public GenerateOk {
    Objects.requireNonNull(id, "id");
  }

  @Override
  public PayloadType type() {
    return PayloadType.GenerateOk;
  }

  @Override
  public PayloadType answers() {
    return PayloadType.Generate;
  }
}
