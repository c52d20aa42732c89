// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node;

import com.github.maelstrom_node.msg.Message;

import java.io.Closeable;
import java.io.IOException;

/// Where a node writes its replies. The node is agnostic to what sits behind it. Implementations must write each
/// reply as one unit so that replies from successive steps never interleave, and must have finished writing when
/// [#send(Message)] returns normally as the node counts the reply as sent at that point.
public interface ReplySink extends Closeable {
  void send(Message reply) throws IOException;
}
