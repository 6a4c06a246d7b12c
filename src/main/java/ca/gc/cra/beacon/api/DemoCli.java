package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.application.port.ClockPort;
import ca.gc.cra.beacon.config.BeaconRuntime;
import ca.gc.cra.beacon.config.ConfigMerger;
import ca.gc.cra.beacon.config.EnvironmentConfigLoader;
import ca.gc.cra.beacon.config.FileHandlerConfig;
import ca.gc.cra.beacon.config.LogConfig;
import ca.gc.cra.beacon.config.YamlConfigLoader;
import ca.gc.cra.beacon.infrastructure.logging.Slf4jLogSink;
import ca.gc.cra.beacon.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.beacon.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the logging walkthrough with configuration merged from YAML, environment and arguments.
 *
 * @since 0.1.0
 */
final class DemoCli {
  private static final Logger log = LoggerFactory.getLogger(DemoCli.class);
  private static final String SUMMARY_USAGE =
      "usage: beacon demo [config=PATH] [profile=NAME] [logDir=PATH] [level=LEVEL] [format=text|json|structured] "
          + "[KEY=VALUE ...] [metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      Beacon logging walkthrough

      Usage:
        beacon demo [options]

      Options:
        config=PATH              YAML file; 'common' is merged with the selected profile
        profile=NAME             Profile section to merge (default demo)
        logDir=PATH              Also write beacon.log, app.log, errors.log, performance.log and requests.log
        level=LEVEL              DEBUG, INFO, WARNING, ERROR or CRITICAL
        format=FORMAT            text, json or structured
        KEY=VALUE                Any dotted setting, for example performance.thresholdMs=100
        metricsExporter=otlp|none  OpenTelemetry metrics exporter (default none)
        otelEndpoint=URL           OTLP endpoint when metricsExporter=otlp
        --verbose                Enable DEBUG logging
        --help                   Show this message

      Precedence: arguments > BEACON_LOG_* environment variables > YAML > defaults.
      """;

  private DemoCli() {}

  static ExitCode run(boolean help, String[] args) {
    if (help) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(args);
      TelemetryConfigurator.configureMetrics(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    String profile = ConfigCliUtils.extractProfile(kv);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, profile);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    LogConfig config;
    Logger demoLogger;
    try {
      Map<String, String> effective =
          ConfigMerger.buildEffectiveConfig(yaml, EnvironmentConfigLoader.load(), kv, log::warn);
      config = LogConfig.fromMap(effective);
      demoLogger = configureLogging(config);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid logging configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalStateException ex) {
      log.error("Unable to configure logging backend: {}", ex.getMessage());
      return ExitCode.RUNTIME_FAILURE;
    }

    try (OpenTelemetryMetricsAdapter metrics = OpenTelemetryMetricsAdapter.fromEnvironment()) {
      BeaconRuntime runtime = new BeaconRuntime(config, metrics, ClockPort.SYSTEM, Slf4jLogSink::forLogger);
      DemoWalkthrough walkthrough = new DemoWalkthrough(demoLogger, runtime);
      walkthrough.run();
      walkthrough.printStatistics();
      metrics.forceFlush();
      return ExitCode.SUCCESS;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while running the demo", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception while running the demo", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static Logger configureLogging(LogConfig config) {
    Optional<Path> logDir = config.fileHandler().map(FileHandlerConfig::directory);
    logDir.ifPresent(dir -> LoggingConfigurator.setupLogAggregation(dir, config));
    Logger logger = LoggingConfigurator.setupLogging(config);
    log.debug("Demo logging configured (logDir={})", logDir.map(Path::toString).orElse("none"));
    return logger;
  }
}
