package ca.gc.cra.faultline.adapter.kafka;

import ca.gc.cra.faultline.application.port.SendResult;
import ca.gc.cra.faultline.application.port.Transport;
import ca.gc.cra.faultline.domain.event.Event;
import ca.gc.cra.faultline.infrastructure.json.EventJsonWriter;
import ca.gc.cra.faultline.validation.Net;
import ca.gc.cra.faultline.validation.Strings;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link Transport} that publishes event JSON to a Kafka topic keyed by event id.
 * <p><strong>Why:</strong> Lets deployments route errors through an existing Kafka pipeline instead of calling the
 * collector directly.</p>
 * <p><strong>Thread-safety:</strong> {@link KafkaProducer} is thread-safe; dispatcher workers share one producer.</p>
 * <p><strong>Performance:</strong> Each send waits for the broker acknowledgement up to the configured timeout so the
 * outcome reflects delivery.</p>
 *
 * @since 0.1.0
 */
public final class KafkaTransport implements Transport {
  private static final Logger log = LoggerFactory.getLogger(KafkaTransport.class);

  private final Producer<String, String> producer;
  private final String topic;
  private final EventJsonWriter writer;
  private final Duration ackTimeout;

  /**
   * Creates a transport with its own producer.
   *
   * @param bootstrapServers comma-separated {@code host:port} list
   * @param topic destination topic
   * @param writer event serializer
   * @param ackTimeout maximum wait for broker acknowledgement
   */
  public KafkaTransport(String bootstrapServers, String topic, EventJsonWriter writer, Duration ackTimeout) {
    this(createProducer(bootstrapServers), topic, writer, ackTimeout);
  }

  KafkaTransport(Producer<String, String> producer, String topic, EventJsonWriter writer, Duration ackTimeout) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = Strings.sanitizeTopic("topic", topic);
    this.writer = Objects.requireNonNull(writer, "writer");
    this.ackTimeout = Objects.requireNonNull(ackTimeout, "ackTimeout");
  }

  @Override
  public SendResult send(Event event) {
    Objects.requireNonNull(event, "event");
    try {
      String payload = writer.writeString(event);
      RecordMetadata metadata = producer.send(new ProducerRecord<>(topic, event.eventId(), payload))
          .get(ackTimeout.toMillis(), TimeUnit.MILLISECONDS);
      log.debug("Event {} published to {}-{}@{}", event.eventId(), metadata.topic(), metadata.partition(),
          metadata.offset());
      return new SendResult.Success(event.eventId());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return SendResult.Failure.of("interrupted while publishing");
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      log.warn("Kafka rejected event {}: {}", event.eventId(), cause.toString());
      return SendResult.Failure.of(cause.getClass().getSimpleName() + ": " + cause.getMessage());
    } catch (TimeoutException ex) {
      log.warn("Timed out publishing event {} to {}", event.eventId(), topic);
      return SendResult.Failure.of("publish timed out after " + ackTimeout.toMillis() + " ms");
    } catch (KafkaException | UncheckedIOException ex) {
      log.warn("Failed to publish event {}", event.eventId(), ex);
      return SendResult.Failure.of(ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }
  }

  @Override
  public void close() {
    producer.flush();
    producer.close(Duration.ofSeconds(5));
  }

  private static Producer<String, String> createProducer(String bootstrapServers) {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, Net.validateHostPortList(bootstrapServers));
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.RETRIES_CONFIG, 0);
    props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, false);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    return new KafkaProducer<>(props);
  }
}
