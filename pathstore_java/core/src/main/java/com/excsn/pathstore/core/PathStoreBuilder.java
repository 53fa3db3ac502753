package com.excsn.pathstore.core;

import com.excsn.pathstore.core.serializers.YAMLValueCodec;
import com.excsn.pathstore.core.telemetry.Logger;
import com.excsn.pathstore.core.telemetry.NoopStatsRecorder;
import com.excsn.pathstore.core.telemetry.Slf4jLogger;
import com.excsn.pathstore.core.telemetry.StatsRecorder;
import com.google.common.base.Preconditions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static com.excsn.pathstore.core.PathStoreConsts.P_SYSTEM_CONFIG;

public class PathStoreBuilder {

  private Collection<Path> _configSeedFilePaths = Collections.emptyList();
  private Logger _logger;
  private StatsRecorder _statsRecorder;
  private final List<PathValueProvider> _providers = new ArrayList<>();

  private PathStoreBuilder() {}

  public static PathStoreBuilder builder() {
    return new PathStoreBuilder();
  }

  /**
   * @param paths YAML files merged in order and loaded below /system/config. Missing files are skipped.
   */
  public PathStoreBuilder setConfigFilePaths(Collection<Path> paths) {
    this._configSeedFilePaths = paths;
    return this;
  }

  public PathStoreBuilder setTelemetry(Logger logger, StatsRecorder statsRecorder) {
    this._logger = logger;
    this._statsRecorder = statsRecorder;
    return this;
  }

  /**
   * Providers run in the order they are added.
   */
  public PathStoreBuilder addProvider(PathValueProvider provider) {

    Preconditions.checkNotNull(provider, "provider is null");

    for (var existing : _providers) {
      Preconditions.checkArgument(!existing.name().equals(provider.name()),
        "a provider named `%s` was already added", provider.name());
    }

    _providers.add(provider);
    return this;
  }

  /**
   * The returned store holds the anchors and the seed configuration; providers load on
   * {@link PathStore#init()}.
   */
  public PathStoreRoot build() {

    var logger = _logger != null ? _logger : Slf4jLogger.create(PathStore.class);
    var statsRecorder = _statsRecorder != null ? _statsRecorder : NoopStatsRecorder.INSTANCE;

    var tree = new PathTree(logger, statsRecorder);
    var providerRegistry = new ProviderRegistry(_providers, logger, statsRecorder);

    var seedData = _extractConfigFromSeedFiles(logger);
    var flatData = new LinkedHashMap<String, String>();
    PathStoreUtils.buildFlatMap(seedData, flatData, P_SYSTEM_CONFIG);

    for (var configDataEntry : flatData.entrySet()) {

      tree.set(configDataEntry.getKey(), configDataEntry.getValue());
    }

    logger.debug("Built path store with " + _providers.size() + " Value Providers and " + flatData.size()
      + " seed entries");

    return new PathStoreRoot(tree, providerRegistry);
  }

  private Map<String, Object> _extractConfigFromSeedFiles(Logger logger) {

    var yaml = new YAMLValueCodec();
    var rawConfigData = new LinkedHashMap<String, Object>();

    for (var configFilePath : _configSeedFilePaths) {

      if (!Files.exists(configFilePath)) {

        continue;
      }

      try {
        var fileContents = Files.readString(configFilePath);
        Object configFileYaml = yaml.deserialize(fileContents);

        if (configFileYaml instanceof Map) {
          PathStoreUtils.deepMerge(rawConfigData, (Map<?, ?>) configFileYaml);
        } else if (!fileContents.isBlank()) {
          logger.warn("Config file `" + configFilePath + "` is not a YAML mapping, skipping it");
        }
      } catch(IOException e) {
        logger.error("Error while loading config from `" + configFilePath + "`", e);
      }
    }

    return rawConfigData;
  }
}
