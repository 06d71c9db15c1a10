package com.todoservice.config;

import com.todoservice.common.status.Status;
import com.todoservice.common.status.StatusOr;
import java.time.Duration;
import java.util.Optional;

/**
 * HTTP listener settings.
 *
 * @param port The port the REST server listens on
 * @param shutdownTimeout How long a graceful stop waits for in-flight requests
 */
public record ServerConfig(int port, Duration shutdownTimeout) {

  public static final String PORT_VARIABLE = "PORT";
  public static final String SHUTDOWN_TIMEOUT_VARIABLE = "SHUTDOWN_TIMEOUT_SECONDS";

  public static final int DEFAULT_PORT = 9010;
  public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  /** Returns the defaults: port 9010, five second shutdown bound. */
  public static ServerConfig defaults() {
    return new ServerConfig(DEFAULT_PORT, DEFAULT_SHUTDOWN_TIMEOUT);
  }

  /**
   * Builds the configuration from the environment, falling back to the defaults for unset keys.
   *
   * @param environment the source of configuration values
   * @return the configuration, or INVALID_ARGUMENT for a non-numeric or out-of-range value
   */
  public static StatusOr<ServerConfig> fromEnvironment(Environment environment) {
    StatusOr<Integer> portOr =
        parseInt(environment.get(PORT_VARIABLE), PORT_VARIABLE, DEFAULT_PORT, 0, 65535);
    if (portOr.isNotOk()) {
      return StatusOr.ofStatus(portOr.getStatus());
    }
    StatusOr<Integer> timeoutOr =
        parseInt(
            environment.get(SHUTDOWN_TIMEOUT_VARIABLE),
            SHUTDOWN_TIMEOUT_VARIABLE,
            (int) DEFAULT_SHUTDOWN_TIMEOUT.toSeconds(),
            0,
            Integer.MAX_VALUE);
    if (timeoutOr.isNotOk()) {
      return StatusOr.ofStatus(timeoutOr.getStatus());
    }
    return StatusOr.ofValue(
        new ServerConfig(portOr.getValue(), Duration.ofSeconds(timeoutOr.getValue())));
  }

  private static StatusOr<Integer> parseInt(
      Optional<String> raw, String name, int defaultValue, int min, int max) {
    if (raw.isEmpty()) {
      return StatusOr.ofValue(defaultValue);
    }
    try {
      int value = Integer.parseInt(raw.get());
      if (value < min || value > max) {
        return StatusOr.ofStatus(
            Status.invalidArgument(name + " must be between " + min + " and " + max));
      }
      return StatusOr.ofValue(value);
    } catch (NumberFormatException e) {
      return StatusOr.ofStatus(Status.invalidArgument(name + " is not a number: " + raw.get()));
    }
  }
}
