package ca.gc.cra.beacon.api;

import java.util.Map;

/**
 * Removes CLI-only keys before the remaining arguments are merged as configuration overrides.
 */
final class ConfigCliUtils {
  static final String DEFAULT_PROFILE = "demo";

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    return extract(args, "config", "--config");
  }

  static String extractProfile(Map<String, String> args) {
    String profile = extract(args, "profile", "--profile");
    return profile == null ? DEFAULT_PROFILE : profile;
  }

  private static String extract(Map<String, String> args, String... keys) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String found = null;
    for (String key : keys) {
      String value = args.remove(key);
      if (found == null && value != null && !value.isBlank()) {
        found = value.trim();
      }
    }
    return found;
  }
}
