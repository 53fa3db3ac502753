package com.excsn.pathstore.core;

import com.excsn.pathstore.core.telemetry.Logger;
import com.excsn.pathstore.core.telemetry.StatsRecorder;
import com.google.common.collect.ImmutableList;

import java.io.IOException;
import java.util.List;

import static com.excsn.pathstore.core.PathStoreConsts.STATS_TAGS;

/**
 * Fixed, ordered list of providers. Every phase runs over the providers in registration order and stops
 * at the first failure; entries already pushed into the tree stay there.
 */
class ProviderRegistry {

  private final List<PathValueProvider> _providers;
  private final Logger _logger;
  private final StatsRecorder _statsRecorder;

  ProviderRegistry(List<PathValueProvider> providers, Logger logger, StatsRecorder statsRecorder) {
    _providers = ImmutableList.copyOf(providers);
    _logger = logger;
    _statsRecorder = statsRecorder;
  }

  void initAndLoad(PathTree tree) throws PathStoreException {

    for (var provider : _providers) {

      _run(provider, "init", () -> provider.init(tree));
      _run(provider, "load", () -> provider.load(tree));

      _logger.debug("Loaded " + provider.name() + " Value Provider");
    }
  }

  void save(PathTree tree) throws PathStoreException {

    for (var provider : _providers) {

      _run(provider, "save", () -> provider.save(tree));

      _logger.debug("Saved " + provider.name() + " Value Provider");
    }
  }

  private void _run(PathValueProvider provider, String phase, ProviderCall call) throws PathStoreException {

    try {
      call.run();
    } catch (IOException | RuntimeException e) {

      var message = "Value Provider `" + provider.name() + "` failed to " + phase;

      _logger.error(message, e);
      _statsRecorder.recordCounterIncrement(STATS_TAGS, "provider_errors");

      throw new PathStoreException(provider.name(), message, e);
    }
  }

  @FunctionalInterface
  private interface ProviderCall {
    void run() throws IOException;
  }
}
