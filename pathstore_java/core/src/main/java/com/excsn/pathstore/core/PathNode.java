package com.excsn.pathstore.core;

/**
 * One entry of the circular node list. Links are only rewired by {@link PathTree}.
 */
final class PathNode {

  final String path;
  String value;
  PathNode prev;
  PathNode next;

  PathNode(String path) {
    this.path = path;
  }

  @Override
  public String toString() {
    return value == null ? path : path + " = " + value;
  }
}
