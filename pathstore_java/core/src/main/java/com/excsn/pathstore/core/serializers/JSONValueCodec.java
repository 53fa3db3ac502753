package com.excsn.pathstore.core.serializers;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Map;

public class JSONValueCodec implements ValueDeserializer<String>, ValueSerializer<String> {

  private final ObjectMapper _objectMapper;

  public JSONValueCodec(ObjectMapper objectMapper) {
    _objectMapper = objectMapper;
  }

  public static JSONValueCodec create() {

    var objectMapper = new ObjectMapper();

    return new JSONValueCodec(objectMapper);
  }

  @Override
  public <Value> Value deserialize(String data) {

    try {
      return (Value) _objectMapper.readValue(data, Map.class);
    } catch (IOException e) {
      return null;
    }
  }

  @Override
  public <Value> Value deserialize(String data, Class<Value> deserializationType) {

    try {
      return _objectMapper.readValue(data, deserializationType);
    } catch (IOException e) {
      return null;
    }
  }

  @Override
  public String serialize(Object value) throws IOException {

    return _objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
  }
}
