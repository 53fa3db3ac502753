package com.excsn.pathstore.core.serializers;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

public class YAMLValueCodec implements ValueDeserializer<String>, ValueSerializer<String> {

  private final Yaml _yaml;

  public YAMLValueCodec() {

    var dumperOptions = new DumperOptions();
    dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);

    _yaml = new Yaml(dumperOptions);
  }

  @Override
  public <Value> Value deserialize(String data) {

    try {
      return _yaml.load(data);
    } catch (YAMLException e) {
      return null;
    }
  }

  @Override
  public <Value> Value deserialize(String data, Class<Value> deserializationType) {

    try {
      return _yaml.loadAs(data, deserializationType);
    } catch (YAMLException e) {
      return null;
    }
  }

  @Override
  public String serialize(Object value) {

    return _yaml.dump(value);
  }
}
