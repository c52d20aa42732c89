// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node.msg;

/// A payload that a client sends to this node and that this node answers with exactly one [Reply].
public sealed interface Request extends Payload permits Echo, Generate, Init {
}
