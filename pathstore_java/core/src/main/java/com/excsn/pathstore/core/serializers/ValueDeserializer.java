package com.excsn.pathstore.core.serializers;

public interface ValueDeserializer<Input> {

  /**
   * @return the deserialized value, or null if data could not be parsed
   */
  <Value> Value deserialize(Input data);

  <Value> Value deserialize(Input data, Class<Value> deserializationType);
}
