package ca.gc.cra.didagent.api;

/**
 * <strong>What:</strong> Process exit codes returned by the agent command line.
 * <p><strong>Role:</strong> Adapter-facing enum returned by CLI entry points.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Agent ran and shut down cleanly, or help was printed. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** A configuration file or transport could not be read or opened. */
  IO_ERROR(3),
  /** Effective configuration was rejected. */
  CONFIG_ERROR(4),
  /** Startup failed for any other reason. */
  RUNTIME_FAILURE(5),
  /** The launching thread was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
