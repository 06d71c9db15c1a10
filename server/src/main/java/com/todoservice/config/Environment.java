package com.todoservice.config;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.todoservice.common.status.Status;
import com.todoservice.common.status.StatusOr;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.tinylog.Logger;

/**
 * Key/value view over the process environment, optionally backed by a {@code .env} file.
 *
 * <p>Variables set in the process environment always win; the file only fills in keys that are
 * absent. A missing file is not an error.
 */
public final class Environment {

  private final Map<String, String> values;

  private Environment(Map<String, String> values) {
    this.values = ImmutableMap.copyOf(values);
  }

  /** Creates an environment over a fixed set of values. */
  public static Environment of(Map<String, String> values) {
    return new Environment(values);
  }

  /**
   * Loads the process environment, merged with the given dotenv file if it exists.
   *
   * @param dotEnvFile path of the optional {@code .env} file
   * @return the merged environment, or INTERNAL if the file exists but cannot be read
   */
  public static StatusOr<Environment> load(Path dotEnvFile) {
    Map<String, String> merged = new HashMap<>();
    if (Files.isRegularFile(dotEnvFile)) {
      try {
        merged.putAll(parseDotEnv(Files.readAllLines(dotEnvFile, StandardCharsets.UTF_8)));
        Logger.info("Loaded environment defaults from {}", dotEnvFile.toAbsolutePath());
      } catch (IOException e) {
        return StatusOr.ofStatus(Status.internal("Failed to read " + dotEnvFile, e));
      }
    }
    merged.putAll(System.getenv());
    return StatusOr.ofValue(new Environment(merged));
  }

  /**
   * Parses {@code KEY=VALUE} lines. Blank lines and {@code #} comments are skipped, a leading
   * {@code export} is accepted, and matching surrounding quotes are removed from the value.
   */
  static Map<String, String> parseDotEnv(List<String> lines) {
    Map<String, String> parsed = new HashMap<>();
    for (String rawLine : lines) {
      String line = rawLine.trim();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      if (line.startsWith("export ")) {
        line = line.substring("export ".length()).trim();
      }
      List<String> parts = Splitter.on('=').limit(2).trimResults().splitToList(line);
      if (parts.size() != 2 || parts.get(0).isEmpty()) {
        Logger.warn("Ignoring malformed .env line: {}", rawLine);
        continue;
      }
      parsed.put(parts.get(0), unquote(parts.get(1)));
    }
    return parsed;
  }

  private static String unquote(String value) {
    if (value.length() >= 2) {
      char first = value.charAt(0);
      char last = value.charAt(value.length() - 1);
      if ((first == '"' || first == '\'') && first == last) {
        return value.substring(1, value.length() - 1);
      }
    }
    return value;
  }

  /** Returns the value for the key, or empty if it is unset or blank. */
  public Optional<String> get(String key) {
    String value = values.get(key);
    if (Strings.isNullOrEmpty(value) || CharMatcher.whitespace().matchesAllOf(value)) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  /** Returns the value for the key, or the default if it is unset or blank. */
  public String get(String key, String defaultValue) {
    return get(key).orElse(defaultValue);
  }
}
