package ca.gc.cra.feedback.adapter.kafka;

import ca.gc.cra.feedback.application.json.JsonSupport;
import ca.gc.cra.feedback.application.port.EnrichedStore;
import ca.gc.cra.feedback.application.port.StorageException;
import ca.gc.cra.feedback.domain.feedback.EnrichedFeedbackRecord;
import ca.gc.cra.feedback.domain.feedback.Topic;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.StringSerializer;

/**
 * {@link EnrichedStore} that publishes analytical records as JSON to a Kafka topic keyed by
 * {@code feedback_id}. Each append blocks until the broker acknowledges the write.
 *
 * <p>Document shape: {@code {"feedback_id", "sentiment", "topics": [...], "analyzed_at"}} with
 * {@code analyzed_at} in ISO-8601.</p>
 *
 * @since 0.1.0
 */
public final class KafkaEnrichedStore implements EnrichedStore {
  private static final Duration DEFAULT_SEND_TIMEOUT = Duration.ofSeconds(30);

  private final Producer<String, String> producer;
  private final String topic;
  private final Duration sendTimeout;
  private final JsonSupport json = new JsonSupport();

  public KafkaEnrichedStore(String bootstrapServers, String topic) {
    this(createProducer(bootstrapServers), topic, DEFAULT_SEND_TIMEOUT);
  }

  KafkaEnrichedStore(Producer<String, String> producer, String topic, Duration sendTimeout) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = sanitizeTopic(topic);
    this.sendTimeout = Objects.requireNonNull(sendTimeout, "sendTimeout");
  }

  @Override
  public void append(EnrichedFeedbackRecord record) throws StorageException {
    Objects.requireNonNull(record, "record");
    ProducerRecord<String, String> message = new ProducerRecord<>(topic, record.feedbackId(), toJson(record));
    try {
      producer.send(message).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new StorageException("Interrupted while publishing analysis for " + record.feedbackId(), ex);
    } catch (ExecutionException ex) {
      throw new StorageException("Broker rejected analysis for " + record.feedbackId(), ex.getCause());
    } catch (TimeoutException ex) {
      throw new StorageException("Timed out publishing analysis for " + record.feedbackId(), ex);
    } catch (KafkaException | IllegalStateException ex) {
      throw new StorageException("Failed to publish analysis for " + record.feedbackId(), ex);
    }
  }

  String toJson(EnrichedFeedbackRecord record) {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("feedback_id", record.feedbackId());
    doc.put("sentiment", record.result().sentiment().name());
    List<String> topics = record.result().topics().stream().map(Topic::name).collect(Collectors.toList());
    doc.put("topics", topics);
    doc.put("analyzed_at", record.analyzedAt().toString());
    return json.write(doc);
  }

  @Override
  public void close() {
    producer.flush();
    producer.close(Duration.ofSeconds(5));
  }

  private static Producer<String, String> createProducer(String bootstrapServers) {
    Objects.requireNonNull(bootstrapServers, "bootstrapServers");
    String trimmed = bootstrapServers.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("bootstrapServers must not be blank");
    }
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, trimmed);
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    return new KafkaProducer<>(props);
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
}
