package ca.gc.cra.beacon.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from YAML, environment and explicit overrides while enforcing precedence.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence overrides &gt; environment &gt; YAML.
   *
   * <p>Keys absent from every source fall back to the record defaults when the map is parsed by
   * {@link LogConfig#fromMap(Map)}.</p>
   *
   * @param yaml optional YAML-derived settings for the active profile
   * @param env environment-derived settings (may be {@code null})
   * @param overrides explicit key/value overrides such as CLI arguments (may be {@code null})
   * @param warn consumer invoked when a higher-precedence source replaces a YAML key (may be {@code null})
   * @return immutable merged configuration map
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> env,
      Map<String, String> overrides,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> envCopy = env == null ? Map.of() : env;
    Map<String, String> overridesCopy = overrides == null ? Map.of() : overrides;

    Map<String, String> merged = new LinkedHashMap<>(yamlCopy);
    apply(merged, yamlCopy, envCopy, "Environment", warn);
    apply(merged, yamlCopy, overridesCopy, "Override", warn);
    return Map.copyOf(merged);
  }

  /**
   * Merges and parses in one step.
   *
   * @param yaml optional YAML-derived settings
   * @param env environment-derived settings
   * @param overrides explicit overrides
   * @return typed configuration
   * @throws IllegalArgumentException when a merged value fails validation
   */
  public static LogConfig resolve(
      Optional<Map<String, String>> yaml, Map<String, String> env, Map<String, String> overrides) {
    return LogConfig.fromMap(buildEffectiveConfig(yaml, env, overrides, null));
  }

  private static void apply(
      Map<String, String> merged,
      Map<String, String> yaml,
      Map<String, String> source,
      String label,
      Consumer<String> warn) {
    for (Map.Entry<String, String> entry : source.entrySet()) {
      String key = entry.getKey();
      String value = entry.getValue();
      if (key == null || value == null) {
        continue;
      }
      if (yaml.containsKey(key) && warn != null) {
        warn.accept(label + " overrides YAML for key: " + key);
      }
      merged.put(key, value);
    }
  }
}
