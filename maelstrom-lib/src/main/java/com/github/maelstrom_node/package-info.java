/// This package contains a single node of the Maelstrom workbench protocol.
///
/// Maelstrom runs a node as a process and talks to it with one JSON message per line on standard input and standard
/// output. This library holds everything except the process itself.
///
/// Key classes and interfaces in this package:
/// - 'MaelstromNode': The request/reply state machine. It owns the numeric id used as the `msg_id` of every reply and
///   answers `init`, `echo` and `generate`. It fails on any reply type as it never sends requests.
/// - 'NodeEngine': Reads messages from a stream and steps the node one message at a time under a mutex. The first
///   failed step stops it.
/// - 'JsonPickle': Encodes and decodes the flattened JSON wire shape of messages.
/// - 'MessageReader': Decodes a stream of whitespace separated JSON values one message at a time.
/// - 'UniqueIdGenerator': Makes the time ordered ids returned by `generate_ok`.
/// - 'ReplySink': An interface for where replies are written. `StreamReplySink` writes lines to an output stream.
/// - 'StepResult': The outcome of one step which is either the written reply or a `StepFailure` of an `ErrorKind`.
package com.github.maelstrom_node;
