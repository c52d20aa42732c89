// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node;

import com.github.maelstrom_node.msg.Echo;
import com.github.maelstrom_node.msg.Message;
import com.github.maelstrom_node.msg.MessageBody;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;

public class NodeEngineTests {
  static {
    LoggerConfig.initializeUnlessDisabled();
  }

  static final String INIT = "{\"src\":\"c1\",\"dest\":\"n1\",\"body\":{\"msg_id\":1,\"type\":\"init\",\"node_id\":\"n1\",\"node_ids\":[\"n1\"]}}";
  static final String ECHO = "{\"src\":\"c1\",\"dest\":\"n1\",\"body\":{\"msg_id\":2,\"type\":\"echo\",\"echo\":\"hello\"}}";
  static final String INIT_OK = "{\"src\":\"n1\",\"dest\":\"c1\",\"body\":{\"msg_id\":0,\"in_reply_to\":1,\"type\":\"init_ok\"}}";
  static final String ECHO_OK = "{\"src\":\"n1\",\"dest\":\"c1\",\"body\":{\"msg_id\":1,\"in_reply_to\":2,\"type\":\"echo_ok\",\"echo\":\"hello\"}}";

  ByteArrayOutputStream out;
  NodeEngine engine;

  @BeforeEach
  void setup() {
    out = new ByteArrayOutputStream();
    engine = new NodeEngine(new MaelstromNode(new StreamReplySink(out), new FixedTimeIdGenerator(1700000000L), 0L));
  }

  static InputStream input(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  String output() {
    return out.toString(StandardCharsets.UTF_8);
  }

  @Test
  void repliesToEachLineInOrder() {
    final var status = engine.run(input(INIT + "\n" + ECHO + "\n"));

    assertThat(status).isEqualTo(NodeEngine.EXIT_OK);
    assertThat(output()).isEqualTo(INIT_OK + "\n" + ECHO_OK + "\n");
    assertThat(engine.node().numericId()).isEqualTo(2L);
    assertThat(engine.steps()).isEqualTo(2L);
    assertThat(engine.failure()).isEmpty();
  }

  @Test
  void acceptsValuesSeparatedByAnyWhitespace() {
    final var status = engine.run(input("  " + INIT + " \t\r\n\n" + ECHO));

    assertThat(status).isEqualTo(NodeEngine.EXIT_OK);
    assertThat(output()).isEqualTo(INIT_OK + "\n" + ECHO_OK + "\n");
  }

  @Test
  void emptyInputExitsCleanlyWithNoOutput() {
    assertThat(engine.run(input(""))).isEqualTo(NodeEngine.EXIT_OK);
    assertThat(output()).isEmpty();
    assertThat(engine.steps()).isZero();
  }

  @Test
  void malformedValueStopsAfterEarlierReplies() {
    // Given a good message followed by broken JSON and another good message
    final var status = engine.run(input(INIT + "\n{\"src\":\"c1\",]\n" + ECHO + "\n"));

    // Then only the first is answered and the engine reports the second step failed
    assertThat(status).isEqualTo(NodeEngine.EXIT_FAILURE);
    assertThat(output()).isEqualTo(INIT_OK + "\n");
    assertThat(engine.steps()).isEqualTo(2L);
    assertThat(engine.failure()).get()
        .extracting(StepFailure::kind)
        .isEqualTo(ErrorKind.DESERIALIZATION);
  }

  @Test
  void unknownTypeIsADeserializationFailure() {
    final var status = engine.run(input(INIT + "\n{\"src\":\"c1\",\"dest\":\"n1\",\"body\":{\"msg_id\":2,\"type\":\"topology\"}}\n"));

    assertThat(status).isEqualTo(NodeEngine.EXIT_FAILURE);
    assertThat(engine.steps()).isEqualTo(2L);
    assertThat(engine.failure().orElseThrow().kind()).isEqualTo(ErrorKind.DESERIALIZATION);
    assertThat(engine.failure().orElseThrow().detail()).contains("topology");
    assertThat(engine.node().numericId()).isEqualTo(1L);
  }

  @Test
  void replyTypeInputIsAProtocolViolationWithNoOutput() {
    final var status = engine.run(input("{\"src\":\"n2\",\"dest\":\"n1\",\"body\":{\"in_reply_to\":3,\"type\":\"echo_ok\",\"echo\":\"x\"}}\n" + ECHO));

    assertThat(status).isEqualTo(NodeEngine.EXIT_FAILURE);
    assertThat(output()).isEmpty();
    assertThat(engine.failure().orElseThrow().kind()).isEqualTo(ErrorKind.PROTOCOL_VIOLATION);
    assertThat(engine.steps()).isEqualTo(1L);
  }

  @Test
  void writeFailureStopsTheEngine() {
    final var broken = new NodeEngine(new MaelstromNode(new StreamReplySink(new OutputStream() {
      @Override
      public void write(int b) throws IOException {
        throw new IOException("Broken pipe");
      }
    })));

    final var status = broken.run(input(INIT + "\n" + ECHO));

    assertThat(status).isEqualTo(NodeEngine.EXIT_FAILURE);
    assertThat(broken.failure().orElseThrow().kind()).isEqualTo(ErrorKind.WRITE);
    assertThat(broken.node().numericId()).isZero();
  }

  @Test
  void repeatedKeyStopsTheEngine() {
    final var status = engine.run(input(INIT + "\n{\"src\":\"c1\",\"dest\":\"n1\",\"dest\":\"n2\",\"body\":{\"type\":\"generate\"}}\n"));

    assertThat(status).isEqualTo(NodeEngine.EXIT_FAILURE);
    assertThat(output()).isEqualTo(INIT_OK + "\n");
    assertThat(engine.failure().orElseThrow().kind()).isEqualTo(ErrorKind.DESERIALIZATION);
  }

  @Test
  void exhaustedCounterStopsTheEngineWithoutOutput() {
    final var full = new NodeEngine(new MaelstromNode(new StreamReplySink(out), new FixedTimeIdGenerator(1L), Long.MAX_VALUE));

    final var status = full.run(input(ECHO));

    assertThat(status).isEqualTo(NodeEngine.EXIT_FAILURE);
    assertThat(output()).isEmpty();
    assertThat(full.failure().orElseThrow().kind()).isEqualTo(ErrorKind.COUNTER_EXHAUSTED);
  }

  @Test
  void unreadableInputIsReportedAsDeserialization() {
    final var status = engine.run(new InputStream() {
      @Override
      public int read() throws IOException {
        throw new IOException("stdin closed abruptly");
      }
    });

    assertThat(status).isEqualTo(NodeEngine.EXIT_FAILURE);
    assertThat(engine.failure().orElseThrow().kind()).isEqualTo(ErrorKind.DESERIALIZATION);
  }

  @Test
  void concurrentStepsNeverReuseAMsgId() throws Exception {
    // Given many threads stepping one engine
    final var sink = new RecordingSink();
    final var shared = new NodeEngine(new MaelstromNode(sink));
    final int threads = 8;
    final int perThread = 250;
    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      final List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        final var client = "c" + t;
        futures.add(executor.submit(() -> {
          for (int i = 0; i < perThread; i++) {
            shared.step(new Message(client, "n1", new MessageBody(i, new Echo(client + ":" + i))));
          }
        }));
      }
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    // Then the msg_ids are exactly 0..n-1 in the order they were written
    final var expected = LongStream.range(0, threads * perThread).boxed().collect(Collectors.toList());
    assertThat(sink.sent)
        .extracting(m -> m.body().msgId().orElseThrow())
        .containsExactlyElementsOf(expected);
  }

  @Test
  void closeClosesTheOutput() throws Exception {
    final var sink = new RecordingSink();
    final var closing = new NodeEngine(new MaelstromNode(sink));

    closing.close();

    assertThat(sink.closed).isTrue();
  }
}
