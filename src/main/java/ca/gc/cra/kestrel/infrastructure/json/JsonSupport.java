package ca.gc.cra.kestrel.infrastructure.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Streaming JSON reader producing the {@link Map}/{@link List} graphs stored in the results map.
 *
 * <p>Objects keep their field order. Integers surface as {@link Integer}, {@link Long} or
 * {@link java.math.BigInteger} depending on magnitude.</p>
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses a JSON document held in memory.
   *
   * @param json JSON document
   * @return parsed object graph; an empty map for an empty document
   * @throws IllegalArgumentException when parsing fails
   */
  public Object parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      return readDocument(parser);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  /**
   * Parses a JSON file.
   *
   * @param file file to read
   * @return parsed object graph; an empty map for an empty file
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the content is not valid JSON
   */
  public Object parse(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    try (InputStream in = Files.newInputStream(file)) {
      JsonParser parser = factory.createParser(in);
      try {
        return readDocument(parser);
      } catch (JsonProcessingException ex) {
        throw new IllegalArgumentException("Invalid JSON in " + file + ": " + ex.getOriginalMessage(), ex);
      } finally {
        parser.close();
      }
    }
  }

  private Object readDocument(JsonParser parser) throws IOException {
    JsonToken token = parser.nextToken();
    if (token == null) {
      return Map.of();
    }
    Object value = readValue(parser, token);
    JsonToken trailing = parser.nextToken();
    if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
      throw new IllegalArgumentException("JSON document contains trailing content");
    }
    return value;
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.currentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }
}
