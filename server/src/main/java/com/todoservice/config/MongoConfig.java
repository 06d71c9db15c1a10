package com.todoservice.config;

import com.google.common.base.MoreObjects;
import com.mongodb.ConnectionString;
import com.todoservice.common.status.Status;
import com.todoservice.common.status.StatusOr;
import java.util.Optional;

/**
 * Configuration record for the MongoDB document store.
 *
 * <p>The connection string may carry credentials, so it is never logged directly; use
 * {@link #toSecureString()} instead.
 *
 * @param connectionUri The MongoDB connection string (e.g., "mongodb://localhost:27017")
 * @param databaseName The database holding the todo collection
 * @param collectionName The collection holding todo documents
 */
public record MongoConfig(String connectionUri, String databaseName, String collectionName) {

  public static final String URI_VARIABLE = "MONGO_URI";
  public static final String DATABASE_VARIABLE = "MONGO_DATABASE";
  public static final String COLLECTION_VARIABLE = "MONGO_COLLECTION";

  public static final String DEFAULT_DATABASE = "demo_todo";
  public static final String DEFAULT_COLLECTION = "todo";

  /**
   * Builds the configuration from the environment.
   *
   * @param environment the source of configuration values
   * @return the configuration, or INVALID_ARGUMENT if {@code MONGO_URI} is missing or malformed
   */
  public static StatusOr<MongoConfig> fromEnvironment(Environment environment) {
    Optional<String> uri = environment.get(URI_VARIABLE);
    if (uri.isEmpty()) {
      return StatusOr.ofStatus(
          Status.invalidArgument(URI_VARIABLE + " environment variable is not set"));
    }
    try {
      new ConnectionString(uri.get());
    } catch (IllegalArgumentException e) {
      return StatusOr.ofStatus(
          Status.invalidArgument(URI_VARIABLE + " is not a valid connection string: " + e.getMessage()));
    }
    return StatusOr.ofValue(
        new MongoConfig(
            uri.get(),
            environment.get(DATABASE_VARIABLE, DEFAULT_DATABASE),
            environment.get(COLLECTION_VARIABLE, DEFAULT_COLLECTION)));
  }

  /**
   * Returns a string representation of this object that lists the hosts instead of the full
   * connection string, so user names and passwords stay out of the logs.
   */
  public String toSecureString() {
    return MoreObjects.toStringHelper(this)
        .add("hosts", new ConnectionString(connectionUri).getHosts())
        .add("databaseName", databaseName)
        .add("collectionName", collectionName)
        .toString();
  }
}
