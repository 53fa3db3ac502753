package com.excsn.pathstore.core;

/**
 * Raised when a provider fails to init, load or save.
 */
public class PathStoreException extends Exception {

  private final String _providerName;

  public PathStoreException(String providerName, String message, Throwable cause) {
    super(message, cause);
    _providerName = providerName;
  }

  public String getProviderName() {
    return _providerName;
  }
}
