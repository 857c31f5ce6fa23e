package ca.gc.cra.feedback.adapter.kafka;

import ca.gc.cra.feedback.application.port.MessageSource;
import ca.gc.cra.feedback.application.port.MetricsPort;
import ca.gc.cra.feedback.domain.queue.AckToken;
import ca.gc.cra.feedback.domain.queue.MessageHandle;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Properties;
import java.util.Queue;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MessageSource} that gives a Kafka consumer group per-message
 * acknowledge and release semantics.
 * <p><strong>Role:</strong> Infrastructure adapter for the inbound feedback topic.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hand out at most {@code maxCount} buffered records per pull.</li>
 *   <li>Commit, per partition, the offset after the longest contiguous run of acknowledged records.</li>
 *   <li>On release, rewind the partition to the released offset. Re-polled records that are already
 *   acknowledged or still in flight are skipped, so only the released record and records never
 *   handed out are delivered again.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #pull(int)} and {@link #close()} must run on one thread at a
 * time (the coordinator thread). {@link #acknowledge(AckToken)} and {@link #release(AckToken)} may be
 * called from any thread; they enqueue settlements that the next pull applies.</p>
 * <p><strong>Observability:</strong> Emits {@code queue.commit.failure}, {@code queue.release.rewind},
 * {@code queue.redelivery.skipped} and {@code queue.settlement.stale}.</p>
 *
 * @implNote Auto-commit is disabled. A released offset stays in the ledger as a pending entry, so the
 * committed offset never moves past it until its redelivery is acknowledged.
 * @since 0.1.0
 */
public final class KafkaMessageSource implements MessageSource {
  private static final Logger log = LoggerFactory.getLogger(KafkaMessageSource.class);
  private static final int MAX_POLL_RECORDS = 100;
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final Consumer<String, byte[]> consumer;
  private final Duration pollTimeout;
  private final MetricsPort metrics;
  private final Queue<Settlement> settlements = new ConcurrentLinkedQueue<>();
  private final Map<TopicPartition, PartitionLedger> ledgers = new HashMap<>();
  private final Deque<ConsumerRecord<String, byte[]>> buffered = new ArrayDeque<>();

  /**
   * Creates a source subscribed to {@code topic} as a member of {@code groupId}.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers; must not be blank
   * @param topic inbound feedback topic
   * @param groupId consumer group shared by all pipeline instances
   * @param pollTimeout maximum wait of one broker poll
   * @param metrics metrics sink
   */
  public KafkaMessageSource(
      String bootstrapServers, String topic, String groupId, Duration pollTimeout, MetricsPort metrics) {
    this(createConsumer(bootstrapServers, groupId), topic, pollTimeout, metrics);
  }

  KafkaMessageSource(Consumer<String, byte[]> consumer, String topic, Duration pollTimeout, MetricsPort metrics) {
    this.consumer = Objects.requireNonNull(consumer, "consumer");
    this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.consumer.subscribe(List.of(sanitizeTopic(topic)), new LedgerRebalanceListener());
  }

  @Override
  public List<MessageHandle> pull(int maxCount) {
    if (maxCount <= 0) {
      throw new IllegalArgumentException("maxCount must be positive");
    }
    applySettlements();
    commitReady();

    if (buffered.size() < maxCount) {
      ConsumerRecords<String, byte[]> records = consumer.poll(buffered.isEmpty() ? pollTimeout : Duration.ZERO);
      for (ConsumerRecord<String, byte[]> record : records) {
        buffered.addLast(record);
      }
    }

    List<MessageHandle> handles = new ArrayList<>(Math.min(maxCount, buffered.size()));
    while (handles.size() < maxCount && !buffered.isEmpty()) {
      ConsumerRecord<String, byte[]> record = buffered.pollFirst();
      TopicPartition partition = new TopicPartition(record.topic(), record.partition());
      PartitionLedger ledger = ledgers.computeIfAbsent(partition, tp -> new PartitionLedger());
      if (!ledger.needsDelivery(record.offset())) {
        metrics.increment("queue.redelivery.skipped");
        log.debug("Skipping re-polled {}@{}; already acknowledged or in flight", partition, record.offset());
        continue;
      }
      int epoch = ledger.dispatched(record.offset());
      byte[] payload = record.value() == null ? new byte[0] : record.value();
      handles.add(new MessageHandle(payload, new KafkaAckToken(partition, record.offset(), epoch)));
    }
    return handles;
  }

  @Override
  public void acknowledge(AckToken token) {
    settlements.add(new Settlement(cast(token), true));
  }

  @Override
  public void release(AckToken token) {
    settlements.add(new Settlement(cast(token), false));
  }

  /**
   * Applies outstanding settlements, commits what is contiguous, and closes the consumer.
   */
  @Override
  public void close() {
    try {
      applySettlements();
      commitReady();
    } finally {
      consumer.close(CLOSE_TIMEOUT);
    }
  }

  private void applySettlements() {
    Map<TopicPartition, Long> rewinds = new HashMap<>();
    Settlement settlement;
    while ((settlement = settlements.poll()) != null) {
      KafkaAckToken token = settlement.token();
      PartitionLedger ledger = ledgers.get(token.partition());
      if (ledger == null || !ledger.owns(token)) {
        metrics.increment("queue.settlement.stale");
        log.debug("Ignoring stale settlement for {}@{}", token.partition(), token.offset());
        continue;
      }
      if (settlement.ack()) {
        ledger.acked(token.offset());
      } else {
        ledger.released(token.offset());
        rewinds.merge(token.partition(), token.offset(), Math::min);
      }
    }
    rewinds.forEach(this::rewind);
  }

  private void rewind(TopicPartition partition, long offset) {
    Iterator<ConsumerRecord<String, byte[]>> it = buffered.iterator();
    while (it.hasNext()) {
      ConsumerRecord<String, byte[]> record = it.next();
      if (record.partition() == partition.partition()
          && record.topic().equals(partition.topic())
          && record.offset() >= offset) {
        it.remove();
      }
    }
    // Never seek forward past records an earlier rewind still has to redeliver.
    long target = Math.min(offset, consumer.position(partition));
    consumer.seek(partition, target);
    metrics.increment("queue.release.rewind");
    log.debug("Rewound {} to offset {} for redelivery", partition, target);
  }

  private void commitReady() {
    Map<TopicPartition, OffsetAndMetadata> offsets = new HashMap<>();
    ledgers.forEach((partition, ledger) -> {
      long next = ledger.committable();
      if (next > ledger.committed) {
        offsets.put(partition, new OffsetAndMetadata(next));
      }
    });
    if (offsets.isEmpty()) {
      return;
    }
    try {
      consumer.commitSync(offsets);
      offsets.forEach((partition, offset) -> {
        PartitionLedger ledger = ledgers.get(partition);
        if (ledger != null) {
          ledger.committed = offset.offset();
        }
      });
    } catch (KafkaException ex) {
      metrics.increment("queue.commit.failure");
      log.warn("Offset commit failed for {}; will retry on next pull", offsets.keySet(), ex);
    }
  }

  private static KafkaAckToken cast(AckToken token) {
    Objects.requireNonNull(token, "token");
    if (token instanceof KafkaAckToken kafkaToken) {
      return kafkaToken;
    }
    throw new IllegalArgumentException("Token was not issued by a Kafka source: " + token.getClass().getName());
  }

  private static Consumer<String, byte[]> createConsumer(String bootstrapServers, String groupId) {
    Objects.requireNonNull(bootstrapServers, "bootstrapServers");
    String trimmed = bootstrapServers.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("bootstrapServers must not be blank");
    }
    if (groupId == null || groupId.isBlank()) {
      throw new IllegalArgumentException("groupId must not be blank");
    }
    Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, trimmed);
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId.trim());
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
    props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, MAX_POLL_RECORDS);
    return new KafkaConsumer<>(props);
  }

  private static String sanitizeTopic(String topic) {
    if (topic == null) {
      throw new IllegalArgumentException("topic must not be null");
    }
    String trimmed = topic.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("topic must not be blank");
    }
    return trimmed;
  }

  private record Settlement(KafkaAckToken token, boolean ack) {}

  /**
   * Uncommitted offsets of one partition. An entry is in flight, acknowledged, or released and
   * waiting for redelivery; each dispatch gets a fresh epoch so a token only settles its own delivery.
   */
  private static final class PartitionLedger {
    private final NavigableMap<Long, Entry> outstanding = new TreeMap<>();
    private int epoch;
    private long committed = -1L;
    private long committable = -1L;

    boolean needsDelivery(long offset) {
      if (offset < committable) {
        return false;
      }
      Entry entry = outstanding.get(offset);
      return entry == null || entry.state == EntryState.RELEASED;
    }

    int dispatched(long offset) {
      int assigned = epoch++;
      outstanding.put(offset, new Entry(assigned));
      return assigned;
    }

    boolean owns(KafkaAckToken token) {
      Entry entry = outstanding.get(token.offset());
      return entry != null && entry.state == EntryState.IN_FLIGHT && entry.epoch == token.epoch();
    }

    void acked(long offset) {
      outstanding.get(offset).state = EntryState.ACKED;
    }

    void released(long offset) {
      outstanding.get(offset).state = EntryState.RELEASED;
    }

    long committable() {
      while (!outstanding.isEmpty() && outstanding.firstEntry().getValue().state == EntryState.ACKED) {
        committable = outstanding.pollFirstEntry().getKey() + 1;
      }
      return committable;
    }
  }

  private enum EntryState { IN_FLIGHT, ACKED, RELEASED }

  private static final class Entry {
    private final int epoch;
    private EntryState state = EntryState.IN_FLIGHT;

    Entry(int epoch) {
      this.epoch = epoch;
    }
  }

  private final class LedgerRebalanceListener implements ConsumerRebalanceListener {
    @Override
    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
      applySettlements();
      commitReady();
      forget(partitions);
    }

    @Override
    public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
      log.info("Assigned partitions {}", partitions);
    }

    @Override
    public void onPartitionsLost(Collection<TopicPartition> partitions) {
      forget(partitions);
    }

    private void forget(Collection<TopicPartition> partitions) {
      for (TopicPartition partition : partitions) {
        ledgers.remove(partition);
      }
      buffered.removeIf(record -> partitions.contains(new TopicPartition(record.topic(), record.partition())));
      if (!partitions.isEmpty()) {
        log.info("Dropped state for revoked partitions {}", partitions);
      }
    }
  }
}
