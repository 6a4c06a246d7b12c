package ca.gc.cra.beacon.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reads logging settings from {@code BEACON_LOG_*} environment variables into flat configuration keys.
 *
 * <ul>
 *   <li>{@code BEACON_LOG_LEVEL} &rarr; {@code level}</li>
 *   <li>{@code BEACON_LOG_FORMAT} &rarr; {@code format}</li>
 *   <li>{@code BEACON_LOG_NAME} &rarr; {@code name}</li>
 *   <li>{@code BEACON_LOG_DIR} &rarr; {@code logDir} (enables a file handler in that directory)</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class EnvironmentConfigLoader {

  public static final String LEVEL = "BEACON_LOG_LEVEL";
  public static final String FORMAT = "BEACON_LOG_FORMAT";
  public static final String NAME = "BEACON_LOG_NAME";
  public static final String DIR = "BEACON_LOG_DIR";

  private static final Map<String, String> KEYS = Map.of(
      LEVEL, "level",
      FORMAT, "format",
      NAME, "name",
      DIR, "logDir");

  private EnvironmentConfigLoader() {}

  /**
   * Reads the process environment.
   *
   * @return flat map holding only the variables that are set and non-blank
   */
  public static Map<String, String> load() {
    return load(System.getenv());
  }

  /**
   * Reads the given environment view.
   *
   * @param env environment variables; must not be {@code null}
   * @return flat map holding only the variables that are set and non-blank
   */
  public static Map<String, String> load(Map<String, String> env) {
    Objects.requireNonNull(env, "env");
    Map<String, String> flat = new LinkedHashMap<>();
    for (String variable : new String[] {LEVEL, FORMAT, NAME, DIR}) {
      String value = env.get(variable);
      if (value != null && !value.isBlank()) {
        flat.put(KEYS.get(variable), value.trim());
      }
    }
    return Map.copyOf(flat);
  }
}
