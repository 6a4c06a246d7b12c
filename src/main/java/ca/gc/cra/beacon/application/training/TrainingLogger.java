package ca.gc.cra.beacon.application.training;

import ca.gc.cra.beacon.application.port.LogSink;
import ca.gc.cra.beacon.config.TrainingLoggingConfig;
import ca.gc.cra.beacon.domain.log.LogLevel;
import ca.gc.cra.beacon.domain.value.LogValue;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Emits structured events for model-training sessions and model artifacts.
 * <p><strong>Why:</strong> Training runs are long-lived; step, validation and checkpoint events let operators
 * follow progress from the same log pipeline as the serving application.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Log session events as {@code "Training event: <type>"} with {@code session_id} and {@code event_type}.</li>
 *   <li>Log artifact events as {@code "Model event: <type>"} with {@code model_id} and {@code event_type}.</li>
 *   <li>Apply the configuration gates for hyperparameters, metrics, validation and checkpoints.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable collaborators.</p>
 *
 * @since 0.1.0
 */
public final class TrainingLogger {
  public static final String TRAINING_START = "training_start";
  public static final String TRAINING_STEP = "training_step";
  public static final String VALIDATION = "validation";
  public static final String CHECKPOINT_SAVED = "checkpoint_saved";
  public static final String TRAINING_END = "training_end";
  public static final String MODEL_SAVED = "model_saved";
  public static final String MODEL_LOADED = "model_loaded";

  private final LogSink sink;
  private final TrainingLoggingConfig config;

  public TrainingLogger(LogSink sink, TrainingLoggingConfig config) {
    this.sink = Objects.requireNonNull(sink, "sink");
    this.config = Objects.requireNonNull(config, "config");
  }

  public TrainingLoggingConfig config() {
    return config;
  }

  /**
   * Logs a training-session event.
   *
   * @param sessionId training session identifier
   * @param eventType event type, for example {@value #TRAINING_STEP}
   * @param data additional attributes; may be {@code null}
   */
  public void logTrainingEvent(String sessionId, String eventType, Map<String, LogValue> data) {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(eventType, "eventType");
    if (!config.enabled()) {
      return;
    }
    Map<String, LogValue> attributes = new LinkedHashMap<>();
    attributes.put("session_id", LogValue.of(sessionId));
    attributes.put("event_type", LogValue.of(eventType));
    if (data != null) {
      attributes.putAll(data);
    }
    sink.emit(LogLevel.INFO, "Training event: " + eventType, attributes);
  }

  /**
   * Logs a model-artifact event.
   *
   * @param modelId model identifier
   * @param eventType event type, for example {@value #MODEL_SAVED}
   * @param data additional attributes; may be {@code null}
   */
  public void logModelEvent(long modelId, String eventType, Map<String, LogValue> data) {
    Objects.requireNonNull(eventType, "eventType");
    if (!config.enabled()) {
      return;
    }
    Map<String, LogValue> attributes = new LinkedHashMap<>();
    attributes.put("model_id", LogValue.of(modelId));
    attributes.put("event_type", LogValue.of(eventType));
    if (data != null) {
      attributes.putAll(data);
    }
    sink.emit(LogLevel.INFO, "Model event: " + eventType, attributes);
  }

  /**
   * Logs the start of a training session. Hyperparameters are included only when enabled in the configuration.
   *
   * @param sessionId session identifier
   * @param modelName model being trained
   * @param hyperparameters hyperparameters; may be {@code null}
   * @param datasetInfo dataset description; may be {@code null}
   * @param extras additional attributes; may be {@code null}
   */
  public void logTrainingStart(
      String sessionId,
      String modelName,
      Map<String, LogValue> hyperparameters,
      Map<String, LogValue> datasetInfo,
      Map<String, LogValue> extras) {
    Map<String, LogValue> data = new LinkedHashMap<>();
    data.put("model_name", LogValue.of(Objects.requireNonNull(modelName, "modelName")));
    if (config.logHyperparameters() && notEmpty(hyperparameters)) {
      data.put("hyperparameters", LogValue.of(hyperparameters));
    }
    if (notEmpty(datasetInfo)) {
      data.put("dataset_info", LogValue.of(datasetInfo));
    }
    putAll(data, extras);
    logTrainingEvent(sessionId, TRAINING_START, data);
  }

  /**
   * Logs one optimization step. Metrics are included only when enabled in the configuration.
   *
   * @param sessionId session identifier
   * @param step global step
   * @param epoch current epoch
   * @param loss loss at this step
   * @param metrics additional metrics; may be {@code null}
   * @param extras additional attributes; may be {@code null}
   */
  public void logTrainingStep(
      String sessionId, long step, long epoch, double loss, Map<String, LogValue> metrics,
      Map<String, LogValue> extras) {
    Map<String, LogValue> data = new LinkedHashMap<>();
    data.put("step", LogValue.of(step));
    data.put("epoch", LogValue.of(epoch));
    data.put("loss", LogValue.of(loss));
    if (config.logMetrics() && notEmpty(metrics)) {
      data.put("metrics", LogValue.of(metrics));
    }
    putAll(data, extras);
    logTrainingEvent(sessionId, TRAINING_STEP, data);
  }

  /**
   * Logs a validation pass. Validation metrics are included only when enabled in the configuration.
   *
   * @param sessionId session identifier
   * @param epoch epoch validated
   * @param validationLoss validation loss
   * @param validationMetrics validation metrics; may be {@code null}
   * @param extras additional attributes; may be {@code null}
   */
  public void logValidation(
      String sessionId, long epoch, double validationLoss, Map<String, LogValue> validationMetrics,
      Map<String, LogValue> extras) {
    Map<String, LogValue> data = new LinkedHashMap<>();
    data.put("epoch", LogValue.of(epoch));
    data.put("validation_loss", LogValue.of(validationLoss));
    if (config.logValidation() && notEmpty(validationMetrics)) {
      data.put("validation_metrics", LogValue.of(validationMetrics));
    }
    putAll(data, extras);
    logTrainingEvent(sessionId, VALIDATION, data);
  }

  /**
   * Logs a saved checkpoint. Metrics are included only when checkpoint logging is enabled.
   *
   * @param sessionId session identifier
   * @param checkpointPath checkpoint location
   * @param epoch epoch at checkpoint
   * @param metrics metrics at checkpoint; may be {@code null}
   * @param extras additional attributes; may be {@code null}
   */
  public void logCheckpoint(
      String sessionId, String checkpointPath, long epoch, Map<String, LogValue> metrics,
      Map<String, LogValue> extras) {
    Map<String, LogValue> data = new LinkedHashMap<>();
    data.put("checkpoint_path", LogValue.of(Objects.requireNonNull(checkpointPath, "checkpointPath")));
    data.put("epoch", LogValue.of(epoch));
    if (config.logCheckpoints() && notEmpty(metrics)) {
      data.put("metrics", LogValue.of(metrics));
    }
    putAll(data, extras);
    logTrainingEvent(sessionId, CHECKPOINT_SAVED, data);
  }

  /**
   * Logs the end of a training session.
   *
   * @param sessionId session identifier
   * @param finalMetrics final metrics, included when metric logging is enabled; may be {@code null}
   * @param trainingTimeSeconds total training time; {@code null} or zero omits the attribute
   * @param extras additional attributes; may be {@code null}
   */
  public void logTrainingEnd(
      String sessionId, Map<String, LogValue> finalMetrics, Double trainingTimeSeconds,
      Map<String, LogValue> extras) {
    Map<String, LogValue> data = new LinkedHashMap<>();
    if (config.logMetrics() && notEmpty(finalMetrics)) {
      data.put("final_metrics", LogValue.of(finalMetrics));
    }
    if (trainingTimeSeconds != null && trainingTimeSeconds != 0d) {
      data.put("training_time", LogValue.of(trainingTimeSeconds.doubleValue()));
    }
    putAll(data, extras);
    logTrainingEvent(sessionId, TRAINING_END, data);
  }

  /**
   * Logs a saved model artifact.
   *
   * @param modelId model identifier
   * @param modelPath artifact location
   * @param modelInfo model description; may be {@code null}
   * @param extras additional attributes; may be {@code null}
   */
  public void logModelSave(
      long modelId, String modelPath, Map<String, LogValue> modelInfo, Map<String, LogValue> extras) {
    Map<String, LogValue> data = new LinkedHashMap<>();
    data.put("model_path", LogValue.of(Objects.requireNonNull(modelPath, "modelPath")));
    if (notEmpty(modelInfo)) {
      data.put("model_info", LogValue.of(modelInfo));
    }
    putAll(data, extras);
    logModelEvent(modelId, MODEL_SAVED, data);
  }

  /**
   * Logs a loaded model artifact.
   *
   * @param modelId model identifier
   * @param modelPath artifact location
   * @param extras additional attributes; may be {@code null}
   */
  public void logModelLoad(long modelId, String modelPath, Map<String, LogValue> extras) {
    Map<String, LogValue> data = new LinkedHashMap<>();
    data.put("model_path", LogValue.of(Objects.requireNonNull(modelPath, "modelPath")));
    putAll(data, extras);
    logModelEvent(modelId, MODEL_LOADED, data);
  }

  private static boolean notEmpty(Map<String, LogValue> map) {
    return map != null && !map.isEmpty();
  }

  private static void putAll(Map<String, LogValue> target, Map<String, LogValue> extras) {
    if (extras != null) {
      target.putAll(extras);
    }
  }
}
