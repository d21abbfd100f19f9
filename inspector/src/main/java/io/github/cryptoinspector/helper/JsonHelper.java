package io.github.cryptoinspector.helper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Produces the canonical text forms that get hashed: compact JSON for audit and hit details,
 * indented JSON for snapshot payloads. Map keys are always sorted so equal inputs give equal
 * bytes.
 */
@Singleton
public class JsonHelper {

  private final ObjectWriter compactWriter;
  private final ObjectWriter snapshotWriter;

  /**
   * Instantiates a new Json helper.
   *
   * @param objectMapper the object mapper
   */
  @Inject
  public JsonHelper(final ObjectMapper objectMapper) {
    this.compactWriter = objectMapper.writer()
        .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .without(SerializationFeature.INDENT_OUTPUT);
    this.snapshotWriter = objectMapper.writer()
        .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .withDefaultPrettyPrinter();
  }

  /**
   * Compact form of a detail map. A null or empty map becomes {@code {}}.
   *
   * @param detail the detail
   * @return the json
   */
  public String detail(final Map<String, ?> detail) {
    if (detail == null || detail.isEmpty()) {
      return "{}";
    }
    try {
      return compactWriter.writeValueAsString(detail);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Detail is not serializable", e);
    }
  }

  /**
   * Snapshot bytes of a collector payload.
   *
   * @param payload the payload
   * @return the bytes
   * @throws JsonProcessingException if the payload cannot be serialized
   */
  public byte[] snapshot(final Object payload) throws JsonProcessingException {
    return snapshotWriter.writeValueAsBytes(payload);
  }
}
