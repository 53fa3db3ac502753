package com.excsn.pathstore.core;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

import java.nio.file.Path;
import java.util.*;

import static com.excsn.pathstore.core.PathStoreConsts.SEP;

public final class PathStoreUtils {

  private PathStoreUtils() {}

  public static Collection<Path> defaultConfigFilePaths(String configDir, String env) {

    var filePaths = new ArrayList<Path>();

    filePaths.add(Path.of(configDir, "common.yaml").toAbsolutePath());
    filePaths.add(Path.of(configDir, env + ".yaml").toAbsolutePath());

    return filePaths;
  }

  /**
   * @return length of the path, not counting a single trailing separator
   */
  public static int pathLength(String path) {

    var len = path.length();
    if (len > 0 && path.charAt(len - 1) == SEP) {
      len--;
    }

    return len;
  }

  public static String normalize(String path) {

    return path.substring(0, pathLength(path));
  }

  /**
   * Hierarchical prefix test: "/a/b" is a prefix of "/a/b" and "/a/b/c" but not of "/a/bc".
   */
  public static boolean isPathPrefix(String prefix, String path) {

    if (prefix == null || path == null) {
      return false;
    }

    var len = pathLength(prefix);

    return path.regionMatches(0, prefix, 0, len) && (path.length() == len || path.charAt(len) == SEP);
  }

  /**
   * @return the path up to (not including) its last separator, or null if it has none
   */
  public static String parentPath(String path) {

    var idx = path.lastIndexOf(SEP);

    return idx < 0 ? null : path.substring(0, idx);
  }

  /**
   * Flattens nested maps and lists into slash separated paths below keyPath. Lists become children
   * named by their 1-based position. Empty containers and nulls map to valueless entries.
   */
  public static void buildFlatMap(Map<?, ?> origData, Map<String, String> flattenData, String keyPath) {

    for (var entry : origData.entrySet()) {

      _flattenValue(entry.getValue(), flattenData, keyPath + SEP + entry.getKey());
    }
  }

  private static void _flattenValue(Object value, Map<String, String> flattenData, String keyPath) {

    if (value instanceof Map) {

      var nextData = (Map<?, ?>) value;

      if (nextData.isEmpty()) {
        flattenData.put(keyPath, null);
      } else {
        buildFlatMap(nextData, flattenData, keyPath);
      }
    } else if (value instanceof List) {

      var items = (List<?>) value;

      if (items.isEmpty()) {
        flattenData.put(keyPath, null);
      }

      for (int i = 0; i < items.size(); i++) {
        _flattenValue(items.get(i), flattenData, keyPath + SEP + (i + 1));
      }
    } else {

      flattenData.put(keyPath, value == null ? null : value.toString());
    }
  }

  /**
   * Merged newMap into original
   * @param original
   * @param newMap
   */
  static void deepMerge(Map original, Map newMap) {

    if (original == null || newMap == null) {
      return;
    }

    for (var entry : (Set<Map.Entry>) newMap.entrySet()) {

      var key = entry.getKey();
      var value = entry.getValue();

      if (original.containsKey(key)) {
        var originalValue = original.get(key);

        if (Objects.equal(originalValue, value)) {
          continue;
        }

        if (originalValue instanceof Collection) {
          Preconditions.checkArgument(value instanceof Collection,
            "a non-collection collided with a collection: %s%n\t%s",
            value, originalValue);

          ((Collection) originalValue).addAll((Collection) value);

          continue;
        }

        if (originalValue instanceof Map) {
          Preconditions.checkArgument(value instanceof Map,
            "a non-map collided with a map: %s%n\t%s",
            value, originalValue);

          deepMerge((Map) originalValue, (Map) value);

          continue;
        }

        original.put(key, value);

      } else
        original.put(key, value);
    }
  }
}
