package com.excsn.pathstore.core;

import com.excsn.pathstore.core.telemetry.Logger;
import com.excsn.pathstore.core.telemetry.StatsRecorder;
import com.google.common.base.Preconditions;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.excsn.pathstore.core.PathStoreConsts.*;

/**
 * Ordered store of path/value entries.
 * <p>
 * Entries live on a circular doubly linked list headed by {@code /system}. The list holds entries in the
 * order in which they were created, unless {@link #insert(String, String)} moved them, and is unordered
 * otherwise: parents are not kept next to their children. Hierarchy is always derived from the path
 * strings. A path index backs exact lookups.
 * <p>
 * Not thread safe.
 */
public class PathTree {

  private final Logger _logger;
  private final StatsRecorder _statsRecorder;
  private final Map<String, PathNode> _index = new HashMap<>();
  private final PathNode _head;

  public PathTree(Logger logger, StatsRecorder statsRecorder) {
    _logger = logger;
    _statsRecorder = statsRecorder;

    _head = new PathNode(P_SYSTEM);
    var config = new PathNode(P_SYSTEM_CONFIG);

    _head.next = config;
    _head.prev = config;
    config.next = _head;
    config.prev = _head;

    _index.put(_head.path, _head);
    _index.put(config.path, config);
  }

  PathNode find(String path) {

    Preconditions.checkNotNull(path, "path is null");

    return _index.get(PathStoreUtils.normalize(path));
  }

  public String get(String path) {

    _statsRecorder.recordCounterIncrement(STATS_TAGS, "get_attempts");
    var node = find(path);

    return node == null ? null : node.value;
  }

  /**
   * Creates the entry, and any missing ancestors, if it does not exist yet. A null value leaves the entry
   * without a value.
   */
  public void set(String path, String value) {

    _statsRecorder.recordCounterIncrement(STATS_TAGS, "set_attempts");
    var node = find(path);

    if (node == null) {
      node = _make(path, _head);
    }

    node.value = value;
  }

  public boolean exists(String path) {

    _statsRecorder.recordCounterIncrement(STATS_TAGS, "exists_attempts");

    return find(path) != null;
  }

  /**
   * Places path right before sibling. An existing path keeps its value and is only moved; a new one is
   * created without a value.
   *
   * @return false, leaving the tree untouched, if path and sibling are equal, do not share the same parent
   *   or sibling does not exist
   */
  public boolean insert(String path, String sibling) {

    var normPath = _checkPath(path);
    var normSibling = _checkPath(sibling);

    if (normPath.equals(normSibling)) {
      return false;
    }

    if (!PathStoreUtils.parentPath(normPath).equals(PathStoreUtils.parentPath(normSibling))) {
      return false;
    }

    var siblingNode = _index.get(normSibling);
    if (siblingNode == null) {
      return false;
    }

    var node = _index.get(normPath);

    if (node == null) {
      _make(normPath, siblingNode);
    } else {
      _detach(node);
      _attach(node, siblingNode);
    }

    return true;
  }

  /**
   * Removes path and everything below it. The two anchors survive any removal. The root {@code /} names
   * no entry and is rejected like any relative path.
   *
   * @return number of removed entries
   */
  public int rm(String path) {

    var normPath = _checkPath(path);
    var count = 0;

    // The head is an anchor, so the scan can start past it
    var node = _head.next;

    while (node != _head) {

      var next = node.next;

      if (PathStoreUtils.isPathPrefix(normPath, node.path) && !_isAnchor(node)) {
        _detach(node);
        _index.remove(node.path);
        count++;
      }

      node = next;
    }

    if (count > 0) {
      _logger.debug("Removed " + count + " entries under `" + normPath + "`");
      _statsRecorder.recordGauge(STATS_TAGS, "rm_removed", count);
    }

    return count;
  }

  /**
   * @return immediate children of path, in list order
   */
  public List<String> ls(String path) {

    Preconditions.checkNotNull(path, "path is null");
    var children = new ArrayList<String>();
    var node = _head;

    do {
      if (_isChild(path, node.path)) {
        children.add(node.path);
      }
      node = node.next;
    } while (node != _head);

    return children;
  }

  public int countChildren(String path) {

    Preconditions.checkNotNull(path, "path is null");
    var count = 0;
    var node = _head;

    do {
      if (_isChild(path, node.path)) {
        count++;
      }
      node = node.next;
    } while (node != _head);

    return count;
  }

  /**
   * Matches every path against a glob pattern.
   *
   * @param matches receives at most capacity matching paths, in list order
   * @return total number of matches, which may exceed capacity
   */
  public int match(String pattern, List<String> matches, int capacity) {

    Preconditions.checkArgument(capacity >= 0, "capacity %s is negative", capacity);
    Preconditions.checkArgument(matches != null || capacity == 0, "matches is null");

    var glob = GlobPattern.compile(pattern);
    var count = 0;
    var node = _head;

    do {
      if (glob.matches(node.path)) {
        if (count < capacity) {
          matches.add(node.path);
        }
        count++;
      }
      node = node.next;
    } while (node != _head);

    return count;
  }

  public List<String> match(String pattern) {

    var matches = new ArrayList<String>();
    match(pattern, matches, Integer.MAX_VALUE);

    return matches;
  }

  /**
   * Writes "path = value" (or just "path") for every entry whose path starts with the given string, or for
   * every entry if it is null. Broken list links found on the way are logged, not repaired.
   *
   * @return number of broken links seen
   */
  public int print(PrintStream out, String path) {

    Preconditions.checkNotNull(out, "out is null");
    var prefix = path == null ? null : PathStoreUtils.normalize(path);
    var linkErrors = 0;
    var node = _head;

    do {
      if (node != node.prev.next) {
        _logger.warn("Wrong prev->next for " + node.path);
        linkErrors++;
      }
      if (node != node.next.prev) {
        _logger.warn("Wrong next->prev for " + node.path);
        linkErrors++;
      }

      if (prefix == null || node.path.startsWith(prefix)) {
        out.println(node);
      }
      node = node.next;
    } while (node != _head);

    for (int i = 0; i < linkErrors; i++) {
      _statsRecorder.recordCounterIncrement(STATS_TAGS, "link_errors");
    }

    return linkErrors;
  }

  public int size() {

    return _index.size();
  }

  /**
   * @return every path, in list order
   */
  public List<String> paths() {

    var paths = new ArrayList<String>(_index.size());
    var node = _head;

    do {
      paths.add(node.path);
      node = node.next;
    } while (node != _head);

    return paths;
  }

  private boolean _isChild(String parent, String candidate) {

    var len = PathStoreUtils.pathLength(parent);

    return PathStoreUtils.isPathPrefix(parent, candidate)
      && candidate.length() > len + 1
      && candidate.indexOf(SEP, len + 1) < 0;
  }

  /**
   * Creates path right before next. Missing ancestors are appended at the end of the list, right before
   * the head, not next to path.
   */
  private PathNode _make(String path, PathNode next) {

    var normPath = _checkPath(path);

    for (int pos = 1; pos < normPath.length(); pos++) {

      if (normPath.charAt(pos) != SEP) {
        continue;
      }

      var ancestor = PathStoreUtils.normalize(normPath.substring(0, pos));

      if (!ancestor.isEmpty() && !_index.containsKey(ancestor)) {
        _link(ancestor, _head);
      }
    }

    return _link(normPath, next);
  }

  private PathNode _link(String path, PathNode next) {

    var node = new PathNode(path);
    _attach(node, next);
    _index.put(path, node);

    return node;
  }

  private static void _attach(PathNode node, PathNode next) {

    node.next = next;
    node.prev = next.prev;
    node.next.prev = node;
    node.prev.next = node;
  }

  private static void _detach(PathNode node) {

    node.prev.next = node.next;
    node.next.prev = node.prev;
  }

  private static boolean _isAnchor(PathNode node) {

    return P_SYSTEM.equals(node.path) || P_SYSTEM_CONFIG.equals(node.path);
  }

  private static String _checkPath(String path) {

    Preconditions.checkNotNull(path, "path is null");
    Preconditions.checkArgument(!path.isEmpty() && path.charAt(0) == SEP, "path `%s` is not absolute", path);

    var normPath = PathStoreUtils.normalize(path);
    Preconditions.checkArgument(!normPath.isEmpty(), "path `%s` names no entry", path);

    return normPath;
  }
}
