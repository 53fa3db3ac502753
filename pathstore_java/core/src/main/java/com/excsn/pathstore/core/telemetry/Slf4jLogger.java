package com.excsn.pathstore.core.telemetry;

import org.slf4j.LoggerFactory;

/**
 * {@link Logger} backed by SLF4J. This is the default when no logger is configured.
 */
public class Slf4jLogger implements Logger {

  private final org.slf4j.Logger _delegate;

  public Slf4jLogger(org.slf4j.Logger delegate) {
    _delegate = delegate;
  }

  public static Slf4jLogger create(Class<?> owner) {

    return new Slf4jLogger(LoggerFactory.getLogger(owner));
  }

  @Override
  public void debug(String message) {

    _delegate.debug(message);
  }

  @Override
  public void info(String message) {

    _delegate.info(message);
  }

  @Override
  public void warn(String message) {

    _delegate.warn(message);
  }

  @Override
  public void error(String message, Throwable throwable) {

    _delegate.error(message, throwable);
  }
}
