package ca.gc.cra.feedback.adapter.kafka;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.feedback.domain.queue.AckToken;
import ca.gc.cra.feedback.domain.queue.MessageHandle;
import ca.gc.cra.feedback.testutil.RecordingMetricsPort;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class KafkaMessageSourceTest {
  private static final String TOPIC = "customer-feedback";
  private static final TopicPartition TP = new TopicPartition(TOPIC, 0);

  private MockConsumer<String, byte[]> consumer;
  private RecordingMetricsPort metrics;
  private KafkaMessageSource source;

  @BeforeEach
  void setUp() {
    consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    metrics = new RecordingMetricsPort();
    source = new KafkaMessageSource(consumer, TOPIC, Duration.ofMillis(10), metrics);
    consumer.rebalance(List.of(TP));
    consumer.updateBeginningOffsets(Map.of(TP, 0L));
  }

  @Test
  void pullHandsOutAtMostMaxCount() {
    addRecords(0, 5);

    assertEquals(2, source.pull(2).size());
    assertEquals(2, source.pull(2).size());
    List<MessageHandle> last = source.pull(2);
    assertEquals(1, last.size());
    assertArrayEquals("payload-4".getBytes(StandardCharsets.UTF_8), last.get(0).payload());
  }

  @Test
  void commitsOnlyTheContiguousAcknowledgedPrefix() {
    addRecords(0, 3);
    List<MessageHandle> handles = source.pull(3);

    source.acknowledge(handles.get(0).ackToken());
    source.acknowledge(handles.get(2).ackToken());
    source.pull(1);
    assertEquals(1L, committedOffset());

    source.acknowledge(handles.get(1).ackToken());
    source.pull(1);
    assertEquals(3L, committedOffset());
  }

  @Test
  void releaseRedeliversOnlyTheReleasedRecord() {
    addRecords(0, 3);
    List<MessageHandle> handles = source.pull(3);

    source.acknowledge(handles.get(0).ackToken());
    source.release(handles.get(1).ackToken());
    source.pull(10);

    assertEquals(1L, consumer.position(TP));
    assertEquals(1L, committedOffset());
    assertEquals(1, metrics.count("queue.release.rewind"));

    source.acknowledge(handles.get(2).ackToken());
    addRecords(1, 2);
    List<MessageHandle> redelivered = source.pull(10);

    assertEquals(0, metrics.count("queue.settlement.stale"));
    assertEquals(1, redelivered.size());
    assertEquals(1L, offsetOf(redelivered.get(0)));
    assertEquals(1, metrics.count("queue.redelivery.skipped"));
    assertEquals(1L, committedOffset());

    source.acknowledge(redelivered.get(0).ackToken());
    source.pull(1);
    assertEquals(3L, committedOffset());
  }

  @Test
  void repeatedlyReleasedRecordNeverRedeliversItsAcknowledgedNeighbour() {
    Map<Long, Integer> deliveries = new HashMap<>();
    for (int round = 0; round < 5; round++) {
      consumer.addRecord(record(0, "not json"));
      consumer.addRecord(record(1, "{\"feedback_id\":\"fb-1\",\"comment\":\"fine\"}"));
      for (MessageHandle handle : source.pull(10)) {
        long offset = offsetOf(handle);
        deliveries.merge(offset, 1, Integer::sum);
        if (offset == 0L) {
          source.release(handle.ackToken());
        } else {
          source.acknowledge(handle.ackToken());
        }
      }
    }

    assertEquals(5, deliveries.get(0L));
    assertEquals(1, deliveries.get(1L));
    source.pull(1);
    assertEquals(-1L, committedOffset());
    assertEquals(0, metrics.count("queue.settlement.stale"));
  }

  @Test
  void inFlightRecordsSurviveARewindAndSettleNormally() {
    addRecords(0, 3);
    List<MessageHandle> handles = source.pull(3);

    source.release(handles.get(2).ackToken());
    source.release(handles.get(0).ackToken());
    source.pull(10);
    assertEquals(0L, consumer.position(TP));
    assertEquals(1, metrics.count("queue.release.rewind"));

    addRecords(0, 3);
    List<MessageHandle> redelivered = source.pull(10);
    assertEquals(List.of(0L, 2L), redelivered.stream().map(KafkaMessageSourceTest::offsetOf).toList());

    source.acknowledge(handles.get(1).ackToken());
    redelivered.forEach(handle -> source.acknowledge(handle.ackToken()));
    source.pull(1);

    assertEquals(0, metrics.count("queue.settlement.stale"));
    assertEquals(3L, committedOffset());
  }

  @Test
  void secondSettlementOfTheSameDeliveryIsStale() {
    addRecords(0, 1);
    MessageHandle handle = source.pull(1).get(0);

    source.acknowledge(handle.ackToken());
    source.release(handle.ackToken());
    source.pull(1);

    assertEquals(1, metrics.count("queue.settlement.stale"));
    assertEquals(0, metrics.count("queue.release.rewind"));
    assertEquals(1L, committedOffset());
  }

  @Test
  void releaseDropsBufferedRecordsAtOrAfterTheOffset() {
    addRecords(0, 4);
    List<MessageHandle> first = source.pull(1);

    source.release(first.get(0).ackToken());
    List<MessageHandle> next = source.pull(10);

    assertTrue(next.isEmpty());
    assertEquals(0L, consumer.position(TP));
  }

  @Test
  void rejectsTokensFromOtherSources() {
    AckToken foreign = new AckToken() {};
    assertThrows(IllegalArgumentException.class, () -> source.acknowledge(foreign));
    assertThrows(IllegalArgumentException.class, () -> source.pull(0));
  }

  @Test
  void closeAppliesSettlementsAndClosesConsumer() {
    addRecords(0, 2);
    List<MessageHandle> handles = source.pull(2);
    handles.forEach(handle -> source.acknowledge(handle.ackToken()));

    source.close();

    assertTrue(consumer.closed());
  }

  @Test
  void nothingIsCommittedBeforeAnyAcknowledgement() {
    addRecords(0, 2);
    source.pull(2);
    source.pull(1);

    assertNull(consumer.committed(Set.of(TP)).get(TP));
  }

  private void addRecords(long fromOffset, int count) {
    for (long offset = fromOffset; offset < fromOffset + count; offset++) {
      consumer.addRecord(record(offset, "payload-" + offset));
    }
  }

  private static ConsumerRecord<String, byte[]> record(long offset, String payload) {
    return new ConsumerRecord<>(TOPIC, 0, offset, "key-" + offset, payload.getBytes(StandardCharsets.UTF_8));
  }

  private static long offsetOf(MessageHandle handle) {
    return ((KafkaAckToken) handle.ackToken()).offset();
  }

  private long committedOffset() {
    OffsetAndMetadata committed = consumer.committed(Set.of(TP)).get(TP);
    return committed == null ? -1L : committed.offset();
  }
}
