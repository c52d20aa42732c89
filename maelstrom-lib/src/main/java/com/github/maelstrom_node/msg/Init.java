// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node.msg;

import java.util.List;
import java.util.Objects;

/// The handshake sent once to every node before any other message.
///
/// @param nodeId  the identity of the receiving node.
/// @param nodeIds every node in the cluster in the order given by the workbench. It includes `nodeId`.
public record Init(String nodeId, List<String> nodeIds) implements Request {
  public Init {
    Objects.requireNonNull(nodeId, "nodeId");
    nodeIds = List.copyOf(nodeIds);
  }

  @Override
  public PayloadType type() {
    return PayloadType.Init;
  }
}
