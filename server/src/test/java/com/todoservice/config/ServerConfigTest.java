package com.todoservice.config;

import static org.junit.jupiter.api.Assertions.*;

import com.todoservice.common.status.StatusCode;
import com.todoservice.common.status.StatusOr;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class ServerConfigTest {

  @Test
  void testFromEnvironment_Defaults() {
    StatusOr<ServerConfig> configOr = ServerConfig.fromEnvironment(Environment.of(Map.of()));

    assertTrue(configOr.isOk());
    assertEquals(ServerConfig.defaults(), configOr.getValue());
    assertEquals(9010, configOr.getValue().port());
    assertEquals(Duration.ofSeconds(5), configOr.getValue().shutdownTimeout());
  }

  @Test
  void testFromEnvironment_Overrides() {
    StatusOr<ServerConfig> configOr =
        ServerConfig.fromEnvironment(
            Environment.of(Map.of("PORT", "8080", "SHUTDOWN_TIMEOUT_SECONDS", "12")));

    assertTrue(configOr.isOk());
    assertEquals(new ServerConfig(8080, Duration.ofSeconds(12)), configOr.getValue());
  }

  @Test
  void testFromEnvironment_NonNumericPort() {
    StatusOr<ServerConfig> configOr =
        ServerConfig.fromEnvironment(Environment.of(Map.of("PORT", "http")));

    assertEquals(StatusCode.INVALID_ARGUMENT, configOr.getStatus().getCode());
    assertEquals("PORT is not a number: http", configOr.getStatus().getMessage());
  }

  @Test
  void testFromEnvironment_OutOfRangeValues() {
    StatusOr<ServerConfig> portOr =
        ServerConfig.fromEnvironment(Environment.of(Map.of("PORT", "70000")));
    StatusOr<ServerConfig> timeoutOr =
        ServerConfig.fromEnvironment(Environment.of(Map.of("SHUTDOWN_TIMEOUT_SECONDS", "-1")));

    assertEquals(StatusCode.INVALID_ARGUMENT, portOr.getStatus().getCode());
    assertEquals("PORT must be between 0 and 65535", portOr.getStatus().getMessage());
    assertEquals(StatusCode.INVALID_ARGUMENT, timeoutOr.getStatus().getCode());
  }
}
