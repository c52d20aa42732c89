// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node;

import com.github.maelstrom_node.msg.Message;

import java.util.Objects;

/// The outcome of giving one message to a [MaelstromNode]. A step either wrote exactly one reply or failed.
/// The caller decides what a failure means for the process. [NodeEngine] stops on the first one.
public sealed interface StepResult permits StepResult.Replied, StepResult.Failed {

  /// @param reply the reply that was written to the [ReplySink].
  record Replied(Message reply) implements StepResult {
    public Replied {
      Objects.requireNonNull(reply, "reply");
    }
  }

  record Failed(StepFailure failure) implements StepResult {
    public Failed {
      Objects.requireNonNull(failure, "failure");
    }
  }
}
