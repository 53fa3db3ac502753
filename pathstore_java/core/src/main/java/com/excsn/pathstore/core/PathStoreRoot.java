package com.excsn.pathstore.core;

import java.io.PrintStream;
import java.util.List;

public class PathStoreRoot implements PathStore {

  private final PathTree _tree;
  private final ProviderRegistry _providerRegistry;

  PathStoreRoot(PathTree tree, ProviderRegistry providerRegistry) {
    _tree = tree;
    _providerRegistry = providerRegistry;
  }

  @Override
  public void init() throws PathStoreException {

    _providerRegistry.initAndLoad(_tree);
  }

  @Override
  public String get(String path) {

    return _tree.get(path);
  }

  @Override
  public void set(String path, String value) {

    _tree.set(path, value);
  }

  @Override
  public boolean exists(String path) {

    return _tree.exists(path);
  }

  @Override
  public boolean insert(String path, String sibling) {

    return _tree.insert(path, sibling);
  }

  @Override
  public int rm(String path) {

    return _tree.rm(path);
  }

  @Override
  public List<String> ls(String path) {

    return _tree.ls(path);
  }

  @Override
  public int countChildren(String path) {

    return _tree.countChildren(path);
  }

  @Override
  public int match(String pattern, List<String> matches, int capacity) {

    return _tree.match(pattern, matches, capacity);
  }

  @Override
  public List<String> match(String pattern) {

    return _tree.match(pattern);
  }

  @Override
  public void save() throws PathStoreException {

    _providerRegistry.save(_tree);
  }

  @Override
  public void print(PrintStream out, String path) {

    _tree.print(out, path);
  }
}
