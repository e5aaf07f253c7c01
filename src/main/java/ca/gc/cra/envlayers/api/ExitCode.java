package ca.gc.cra.envlayers.api;

/**
 * <strong>What:</strong> Exit codes shared by envlayers commands.
 * <p><strong>Why:</strong> Scripts that start a service after {@code envlayers show} can tell bad arguments
 * apart from a missing required variable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** A required environment variable was unset or empty. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
