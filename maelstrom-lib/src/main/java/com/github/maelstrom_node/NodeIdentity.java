// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node;

import java.util.List;
import java.util.Objects;

/// What the last `init` told this node about itself and the cluster. Nothing in the reply logic depends on it yet.
public record NodeIdentity(String nodeId, List<String> nodeIds) {
  public NodeIdentity {
    Objects.requireNonNull(nodeId, "nodeId");
    nodeIds = List.copyOf(nodeIds);
  }
}
