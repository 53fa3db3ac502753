package com.excsn.pathstore.core;

import java.io.PrintStream;
import java.util.List;

public interface PathStore {

  /**
   * Runs init and load of every provider, in registration order. Can be called again to reload.
   */
  void init() throws PathStoreException;

  String get(String path);

  void set(String path, String value);

  boolean exists(String path);

  boolean insert(String path, String sibling);

  int rm(String path);

  List<String> ls(String path);

  int countChildren(String path);

  /**
   * @return total number of matches, even when more than capacity
   */
  int match(String pattern, List<String> matches, int capacity);

  List<String> match(String pattern);

  void save() throws PathStoreException;

  /**
   * @param path prefix of the entries to print, null for all
   */
  void print(PrintStream out, String path);
}
