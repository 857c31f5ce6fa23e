package ca.gc.cra.feedback.adapter.kafka;

import ca.gc.cra.feedback.domain.queue.AckToken;
import java.util.Objects;
import org.apache.kafka.common.TopicPartition;

/**
 * Settlement capability for one Kafka delivery.
 *
 * @param partition source partition
 * @param offset record offset
 * @param epoch dispatch sequence within the partition; a settlement for an older dispatch is stale
 */
record KafkaAckToken(TopicPartition partition, long offset, int epoch) implements AckToken {
  KafkaAckToken {
    Objects.requireNonNull(partition, "partition");
  }
}
