// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node;

/// Makes the identifiers returned in `generate_ok` replies. An id is three fields joined by underscores:
///
/// 1. The Unix epoch time in whole seconds.
/// 2. The destination of the `generate` request, which is the id of the node answering it.
/// 3. The numeric id of the answering node, which is its reply counter.
///
/// For example `1700000000_n1_42`. Ids from one node sort by time on their leading field and are distinct within a
/// second as the counter never repeats. Ids from nodes with distinct names never collide.
///
/// The format is kept exactly as it is because consumers may parse it. It has two known flaws:
///
/// * The counter is not zero padded and the node id is free text, so ids are not a fixed width. Lexicographic order
///   only matches time order while the seconds field has the same number of digits, and a fixed number of bits cannot
///   hold an id.
/// * With one second resolution two ids in the same second collide whenever they share both the destination and the
///   counter. That happens if two processes are started with the same node id, or a node restarts within a second and
///   its counter starts again at zero.
///
/// A fixed width alternative would reset a fixed width counter every second which caps the ids per second, and would
/// use milliseconds to raise that cap.
public class UniqueIdGenerator {

  /// Tests override this to fix the time.
  protected long currentEpochSecond() {
    return System.currentTimeMillis() / 1000L;
  }

  /// @param nodeNumericId     the answering node's counter. Must be non-negative.
  /// @param destinationNodeId the destination of the request being answered.
  public String generate(long nodeNumericId, String destinationNodeId) {
    if (nodeNumericId < 0) {
      throw new IllegalArgumentException("nodeNumericId must be non-negative: " + nodeNumericId);
    }
    return currentEpochSecond() + "_" + destinationNodeId + "_" + nodeNumericId;
  }
}
