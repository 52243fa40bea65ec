package ca.gc.cra.faultline.infrastructure.json;

import ca.gc.cra.faultline.domain.event.Breadcrumb;
import ca.gc.cra.faultline.domain.event.Event;
import ca.gc.cra.faultline.domain.event.ExceptionValue;
import ca.gc.cra.faultline.domain.event.Frame;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Serializes {@link Event}s to the collector's store-endpoint JSON schema.
 * <p><strong>Why:</strong> HTTP and Kafka transports publish the same body.</p>
 * <p><strong>Format:</strong> snake_case field names; timestamps as UTC ISO-8601 without an offset suffix
 * (e.g., {@code 2024-05-01T12:30:00}); frames under {@code stacktrace.frames}, outer to inner.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the thread-safe {@link JsonFactory}.</p>
 * <p><strong>Performance:</strong> Streams through {@link JsonGenerator}; no intermediate tree.</p>
 *
 * @since 0.1.0
 */
public final class EventJsonWriter {
  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss").withZone(ZoneOffset.UTC);

  private final JsonFactory factory;

  /** Creates a writer with a private {@link JsonFactory}. */
  public EventJsonWriter() {
    this(new JsonFactory());
  }

  /**
   * Creates a writer sharing an existing factory.
   *
   * @param factory Jackson factory
   */
  public EventJsonWriter(JsonFactory factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  /**
   * Formats an instant the way event timestamps are written.
   *
   * @param instant instant; {@code null} yields {@code null}
   * @return formatted timestamp
   */
  public static String formatTimestamp(Instant instant) {
    return instant == null ? null : TIMESTAMP.format(instant);
  }

  /**
   * Serializes an event to UTF-8 JSON.
   *
   * @param event event to serialize
   * @return JSON bytes
   * @throws UncheckedIOException if the generator fails
   */
  public byte[] write(Event event) {
    Objects.requireNonNull(event, "event");
    ByteArrayOutputStream out = new ByteArrayOutputStream(1_024);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      writeEvent(gen, event);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to serialize event " + event.eventId(), ex);
    }
    return out.toByteArray();
  }

  /**
   * Serializes an event to a JSON string.
   *
   * @param event event to serialize
   * @return JSON text
   */
  public String writeString(Event event) {
    return new String(write(event), StandardCharsets.UTF_8);
  }

  private void writeEvent(JsonGenerator gen, Event event) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("event_id", event.eventId());
    gen.writeStringField("message", event.message());
    gen.writeStringField("timestamp", formatTimestamp(event.timestamp()));
    gen.writeStringField("level", event.level().wireName());
    gen.writeStringField("platform", event.platform());
    gen.writeStringField("culprit", event.culprit());
    gen.writeStringField("server_name", event.serverName());
    gen.writeStringField("release", event.release());
    gen.writeStringField("environment", event.environment());

    gen.writeFieldName("tags");
    writeValue(gen, event.tags());
    gen.writeFieldName("extra");
    writeValue(gen, event.extra());

    gen.writeArrayFieldStart("breadcrumbs");
    for (Breadcrumb crumb : event.breadcrumbs()) {
      gen.writeStartObject();
      gen.writeStringField("timestamp", formatTimestamp(crumb.timestamp()));
      gen.writeStringField("category", crumb.category());
      gen.writeStringField("message", crumb.message());
      gen.writeStringField("level", crumb.level().wireName());
      gen.writeFieldName("data");
      writeValue(gen, crumb.data());
      gen.writeEndObject();
    }
    gen.writeEndArray();

    gen.writeFieldName("user");
    writeValue(gen, event.user());

    gen.writeArrayFieldStart("exception");
    for (ExceptionValue exception : event.exceptions()) {
      gen.writeStartObject();
      gen.writeStringField("type", exception.type());
      gen.writeStringField("value", exception.value());
      if (exception.module() != null) {
        gen.writeStringField("module", exception.module());
      }
      gen.writeEndObject();
    }
    gen.writeEndArray();

    gen.writeObjectFieldStart("stacktrace");
    gen.writeArrayFieldStart("frames");
    for (Frame frame : event.frames()) {
      writeFrame(gen, frame);
    }
    gen.writeEndArray();
    gen.writeEndObject();

    gen.writeEndObject();
  }

  private void writeFrame(JsonGenerator gen, Frame frame) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("filename", frame.filename());
    gen.writeStringField("function", frame.function());
    gen.writeStringField("module", frame.module());
    gen.writeNumberField("lineno", frame.lineno());
    if (frame.colno() == null) {
      gen.writeNullField("colno");
    } else {
      gen.writeNumberField("colno", frame.colno());
    }
    gen.writeStringField("abs_path", frame.absPath());
    gen.writeStringField("context_line", frame.contextLine());
    gen.writeFieldName("pre_context");
    writeValue(gen, frame.preContext());
    gen.writeFieldName("post_context");
    writeValue(gen, frame.postContext());
    gen.writeBooleanField("in_app", frame.inApp());
    gen.writeFieldName("vars");
    writeValue(gen, frame.vars());
    gen.writeEndObject();
  }

  // Extra and user data hold arbitrary caller values; unknown types fall back to toString().
  private void writeValue(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof String text) {
      gen.writeString(text);
    } else if (value instanceof Boolean bool) {
      gen.writeBoolean(bool);
    } else if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte) {
      gen.writeNumber(((Number) value).longValue());
    } else if (value instanceof Double || value instanceof Float) {
      double number = ((Number) value).doubleValue();
      if (Double.isFinite(number)) {
        gen.writeNumber(number);
      } else {
        gen.writeString(Double.toString(number));
      }
    } else if (value instanceof Number number) {
      gen.writeNumber(number.toString());
    } else if (value instanceof Map<?, ?> map) {
      gen.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        gen.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(gen, entry.getValue());
      }
      gen.writeEndObject();
    } else if (value instanceof Collection<?> items) {
      gen.writeStartArray();
      for (Object item : items) {
        writeValue(gen, item);
      }
      gen.writeEndArray();
    } else if (value instanceof Object[] items) {
      writeValue(gen, Arrays.asList(items));
    } else if (value instanceof Instant instant) {
      gen.writeString(instant.toString());
    } else {
      gen.writeString(value.toString());
    }
  }
}
