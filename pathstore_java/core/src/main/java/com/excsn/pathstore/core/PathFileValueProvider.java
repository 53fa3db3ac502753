package com.excsn.pathstore.core;

import com.excsn.pathstore.core.serializers.JSONValueCodec;
import com.excsn.pathstore.core.serializers.ValueDeserializer;
import com.excsn.pathstore.core.serializers.ValueSerializer;
import com.excsn.pathstore.core.serializers.YAMLValueCodec;
import com.excsn.pathstore.core.telemetry.Logger;
import com.google.common.base.Preconditions;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.excsn.pathstore.core.PathStoreConsts.P_PROVIDERS;
import static com.excsn.pathstore.core.PathStoreConsts.P_SYSTEM_CONFIG;
import static com.excsn.pathstore.core.PathStoreConsts.SEP;

/**
 * Mounts a JSON or YAML document below a path of the tree.
 * <p>
 * Maps become children, lists become children named "1", "2", ... and scalars become values. Saving
 * writes the subtree below the mount back as nested maps, in list order.
 */
public class PathFileValueProvider implements PathValueProvider {

  private final String _name;
  private final String _mountPath;
  private final Path _filePath;
  private final String _format;
  private final Charset _encoding;
  private final Map<String, ValueDeserializer<String>> _deserializers;
  private final Map<String, ValueSerializer<String>> _serializers;
  private final Logger _logger;

  public PathFileValueProvider(
    String name,
    String mountPath,
    Path filePath,
    String format,
    Charset encoding,
    Map<String, ValueDeserializer<String>> deserializers,
    Map<String, ValueSerializer<String>> serializers,
    Logger logger
  ) {
    Preconditions.checkArgument(name != null && !name.isEmpty() && name.indexOf(SEP) < 0,
      "invalid provider name `%s`", name);
    Preconditions.checkNotNull(mountPath, "mountPath is null");

    var normMountPath = PathStoreUtils.normalize(mountPath);
    // A reload clears the mount, which must not take the provider records along
    Preconditions.checkArgument(!PathStoreUtils.isPathPrefix(normMountPath, P_SYSTEM_CONFIG)
        && !PathStoreUtils.isPathPrefix(P_PROVIDERS, normMountPath),
      "mount path `%s` overlaps %s", mountPath, P_PROVIDERS);
    Preconditions.checkArgument(deserializers.containsKey(format) && serializers.containsKey(format),
      "no codec for format `%s`", format);

    _name = name;
    _mountPath = normMountPath;
    _filePath = filePath.toAbsolutePath();
    _format = format;
    _encoding = encoding;
    _deserializers = deserializers;
    _serializers = serializers;
    _logger = logger;
  }

  /**
   * Picks json or yaml from the file extension.
   */
  public static PathFileValueProvider createDefault(String name, String mountPath, Path filePath, Logger logger) {

    var extension = com.google.common.io.Files.getFileExtension(filePath.getFileName().toString());
    var format = "yml".equals(extension) ? "yaml" : extension;

    var jsonCodec = JSONValueCodec.create();
    var yamlCodec = new YAMLValueCodec();

    var deserializers = new HashMap<String, ValueDeserializer<String>>();
    deserializers.put("json", jsonCodec);
    deserializers.put("yaml", yamlCodec);

    var serializers = new HashMap<String, ValueSerializer<String>>();
    serializers.put("json", jsonCodec);
    serializers.put("yaml", yamlCodec);

    return new PathFileValueProvider(name, mountPath, filePath, format, StandardCharsets.UTF_8, deserializers,
      serializers, logger);
  }

  @Override
  public String name() {
    return _name;
  }

  public String mountPath() {
    return _mountPath;
  }

  @Override
  public void init(PathTree tree) {

    var configPath = P_PROVIDERS + SEP + _name;

    tree.set(configPath + "/path", _filePath.toString());
    tree.set(configPath + "/format", _format);

    if (!tree.exists(_mountPath)) {
      tree.set(_mountPath, null);
    }
  }

  @Override
  public void load(PathTree tree) throws IOException {

    if (!Files.exists(_filePath)) {
      _logger.debug("File '" + _filePath + "' does not exist, leaving " + _mountPath + " empty");
      return;
    }

    var fileContents = Files.readString(_filePath, _encoding);
    Object deserializedValue = _deserializers.get(_format).deserialize(fileContents);

    if (deserializedValue == null && fileContents.isBlank()) {
      return;
    }

    if (!(deserializedValue instanceof Map)) {
      throw new IOException("File '" + _filePath + "' does not hold a " + _format + " mapping");
    }

    var flatData = new LinkedHashMap<String, String>();
    PathStoreUtils.buildFlatMap((Map<?, ?>) deserializedValue, flatData, _mountPath);

    // Reloading replaces whatever an earlier load left below the mount
    for (var child : tree.ls(_mountPath)) {
      tree.rm(child);
    }

    for (var entry : flatData.entrySet()) {
      tree.set(entry.getKey(), entry.getValue());
    }

    _logger.debug("Loaded " + flatData.size() + " entries from '" + _filePath + "' into " + _mountPath);
  }

  @Override
  public void save(PathTree tree) throws IOException {

    var data = _buildNestedMap(tree, _mountPath);
    var contents = _serializers.get(_format).serialize(data);

    var parentDir = _filePath.getParent();
    if (parentDir != null) {
      Files.createDirectories(parentDir);
    }

    Files.writeString(_filePath, contents, _encoding);
  }

  private Map<String, Object> _buildNestedMap(PathTree tree, String path) {

    var data = new LinkedHashMap<String, Object>();

    for (var child : tree.ls(path)) {

      var key = child.substring(child.lastIndexOf(SEP) + 1);

      if (tree.countChildren(child) > 0) {
        if (tree.get(child) != null) {
          _logger.warn("Value of " + child + " cannot be saved next to its children, dropping it");
        }
        data.put(key, _buildNestedMap(tree, child));
      } else {
        data.put(key, tree.get(child));
      }
    }

    return data;
  }
}
