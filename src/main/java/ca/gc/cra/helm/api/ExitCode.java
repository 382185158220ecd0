package ca.gc.cra.helm.api;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Process exit status reported by HELM commands.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  SUCCESS(0),
  /** Arguments could not be parsed. */
  INVALID_ARGS(2),
  /** Standard input or a configuration file could not be read. */
  IO_ERROR(3),
  /** Arguments parsed but a configuration value was rejected. */
  CONFIG_ERROR(4),
  /** The session could not run, e.g. its id was already registered. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /**
   * Classifies a failure that ended a command.
   *
   * @param failure exception raised while preparing or running the command
   * @return {@link #IO_ERROR} for I/O failures, {@link #CONFIG_ERROR} for rejected values, otherwise
   *     {@link #RUNTIME_FAILURE}
   */
  public static ExitCode forFailure(Throwable failure) {
    if (failure instanceof IOException || failure instanceof UncheckedIOException) {
      return IO_ERROR;
    }
    if (failure instanceof IllegalArgumentException) {
      return CONFIG_ERROR;
    }
    return RUNTIME_FAILURE;
  }
}
