package com.codeheadsystems.hashchain.converter;

import com.codeheadsystems.hashchain.model.ContentField;
import com.codeheadsystems.hashchain.model.FieldType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts content fields to and from the JSON array persisted with each record:
 * {@code [{"name":"event","type":"STRING","value":"CREATE"}, ...]}. Field order is preserved.
 */
@Singleton
public class ContentFieldConverter {

  private static final Logger log = LoggerFactory.getLogger(ContentFieldConverter.class);
  private static final String NAME = "name";
  private static final String TYPE = "type";
  private static final String VALUE = "value";

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Content field converter.
   *
   * @param objectMapper the object mapper
   */
  @Inject
  public ContentFieldConverter(final ObjectMapper objectMapper) {
    log.info("ContentFieldConverter({})", objectMapper);
    this.objectMapper = objectMapper;
  }

  /**
   * To json string.
   *
   * @param content the content
   * @return the string
   */
  public String toJson(final List<ContentField> content) {
    log.trace("toJson({})", content);
    final ArrayNode array = objectMapper.createArrayNode();
    for (ContentField field : content) {
      final ObjectNode node = array.addObject();
      node.put(NAME, field.name());
      node.put(TYPE, field.type().name());
      if (field.value().isPresent()) {
        node.put(VALUE, field.value().get());
      } else {
        node.putNull(VALUE);
      }
    }
    try {
      return objectMapper.writeValueAsString(array);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unable to serialize content", e);
    }
  }

  /**
   * From json list.
   *
   * @param json the json
   * @return the list
   */
  public List<ContentField> fromJson(final String json) {
    log.trace("fromJson({})", json);
    final JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unable to parse stored content", e);
    }
    if (root == null || !root.isArray()) {
      throw new IllegalArgumentException("Stored content is not a JSON array");
    }
    final List<ContentField> fields = new ArrayList<>(root.size());
    for (JsonNode node : root) {
      final JsonNode value = node.get(VALUE);
      fields.add(ContentField.of(
          node.path(NAME).asText(),
          FieldType.valueOf(node.path(TYPE).asText()),
          value == null || value.isNull() ? null : value.asText()));
    }
    return fields;
  }
}
