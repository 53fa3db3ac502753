package com.excsn.pathstore.core;

import java.util.Map;

public final class PathStoreConsts {

  public static final char SEP = '/';

  /** Head of the node list. Never removed. */
  public static final String P_SYSTEM = "/system";
  public static final String P_SYSTEM_CONFIG = "/system/config";

  public static final String P_PROVIDERS = P_SYSTEM_CONFIG + "/providers";

  static final Map<String, Object> STATS_TAGS = Map.of("group", "pathstore");

  private PathStoreConsts() {}
}
