package ca.gc.cra.beacon.api;

/**
 * <strong>What:</strong> Process exit codes returned by the Beacon command-line tool.
 * <p><strong>Why:</strong> Scripts running the demo can tell bad arguments from configuration, IO and runtime
 * failures.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** A file could not be read or written. */
  IO_ERROR(3),
  /** Configuration values failed validation. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric status handed to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
