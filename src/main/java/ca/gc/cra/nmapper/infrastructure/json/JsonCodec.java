package ca.gc.cra.nmapper.infrastructure.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Objects;

/**
 * Thin wrapper over a configured {@link ObjectMapper}: ISO-8601 instants, unknown properties ignored and
 * enum names matched case-insensitively on read.
 * <p>Failures surface as {@link IllegalArgumentException} so each caller can map them to its own error
 * category.</p>
 *
 * @since 0.1.0
 */
public final class JsonCodec {
  private final ObjectMapper mapper;
  private final ObjectMapper prettyMapper;

  /** Creates a codec with the monitor's mapper settings. */
  public JsonCodec() {
    this.mapper = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .build();
    this.prettyMapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
  }

  /**
   * Serializes a value to compact JSON.
   *
   * @param value value to write
   * @return JSON text
   * @throws IllegalArgumentException if the value cannot be serialized
   */
  public String write(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("cannot serialize " + describe(value), ex);
    }
  }

  /**
   * Serializes a value to indented JSON for human output.
   *
   * @param value value to write
   * @return JSON text
   */
  public String writePretty(Object value) {
    try {
      return prettyMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("cannot serialize " + describe(value), ex);
    }
  }

  /**
   * Reads JSON into a type.
   *
   * @param json JSON text
   * @param type target class
   * @param <T> target type
   * @return parsed value
   * @throws IllegalArgumentException if the text is not valid for {@code type}
   */
  public <T> T read(String json, Class<T> type) {
    Objects.requireNonNull(json, "json");
    try {
      return mapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("invalid " + type.getSimpleName() + " JSON: " + ex.getOriginalMessage(), ex);
    }
  }

  /**
   * Reads JSON into a generic type.
   *
   * @param json JSON text
   * @param type target type reference
   * @param <T> target type
   * @return parsed value
   * @throws IllegalArgumentException if the text is not valid for {@code type}
   */
  public <T> T read(String json, TypeReference<T> type) {
    Objects.requireNonNull(json, "json");
    try {
      return mapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("invalid JSON: " + ex.getOriginalMessage(), ex);
    }
  }

  /**
   * Underlying mapper for tree-model parsing.
   *
   * @return shared mapper; do not reconfigure
   */
  public ObjectMapper mapper() {
    return mapper;
  }

  private static String describe(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }
}
