package com.excsn.pathstore.core;

import java.io.IOException;

/**
 * Translates between the path tree and one external source.
 */
public interface PathValueProvider {

  /**
   * @return unique name of this provider within a store
   */
  String name();

  /**
   * Prepares the provider's namespace in the tree.
   */
  void init(PathTree tree) throws IOException;

  /**
   * Reads the backing source and pushes its entries into the tree.
   */
  void load(PathTree tree) throws IOException;

  /**
   * Writes the provider's entries from the tree back to the backing source.
   */
  void save(PathTree tree) throws IOException;
}
