package ca.gc.cra.beacon.config;

import java.util.Map;
import java.util.Objects;

/**
 * Model-training event logging settings.
 *
 * @param enabled whether training and model events are emitted at all
 * @param logMetrics include metric maps on step and end events
 * @param logCheckpoints emit checkpoint events
 * @param logValidation emit validation events
 * @param logHyperparameters include hyperparameters on start events
 * @since 0.1.0
 */
public record TrainingLoggingConfig(
    boolean enabled,
    boolean logMetrics,
    boolean logCheckpoints,
    boolean logValidation,
    boolean logHyperparameters) {

  public static TrainingLoggingConfig defaults() {
    return new TrainingLoggingConfig(true, true, true, true, true);
  }

  public static TrainingLoggingConfig fromMap(Map<String, String> kv) {
    Objects.requireNonNull(kv, "kv");
    TrainingLoggingConfig d = defaults();
    return new TrainingLoggingConfig(
        ConfigValues.parseBoolean("training.enabled", kv.get("enabled"), d.enabled()),
        ConfigValues.parseBoolean("training.logMetrics", kv.get("logMetrics"), d.logMetrics()),
        ConfigValues.parseBoolean("training.logCheckpoints", kv.get("logCheckpoints"), d.logCheckpoints()),
        ConfigValues.parseBoolean("training.logValidation", kv.get("logValidation"), d.logValidation()),
        ConfigValues.parseBoolean(
            "training.logHyperparameters", kv.get("logHyperparameters"), d.logHyperparameters()));
  }
}
