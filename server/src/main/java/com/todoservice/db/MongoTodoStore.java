package com.todoservice.db;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoSocketReadTimeoutException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Updates;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import com.todoservice.common.status.Status;
import com.todoservice.common.status.StatusOr;
import com.todoservice.config.MongoConfig;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nonnull;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.tinylog.Logger;

/**
 * {@link TodoStore} backed by a MongoDB collection.
 *
 * <p>Every call is bounded by {@link #OPERATION_TIMEOUT_SECONDS}: server selection, connection
 * pool checkout, connect and socket reads are capped on the client, and queries also carry a
 * server-side {@code maxTime}.
 * Timeouts come back as DEADLINE_EXCEEDED, unreachable servers as UNAVAILABLE, anything else the
 * driver reports as INTERNAL.
 */
public final class MongoTodoStore implements TodoStore, AutoCloseable {

  public static final int OPERATION_TIMEOUT_SECONDS = 5;

  static final String ID_FIELD = "_id";
  static final String TITLE_FIELD = "title";
  static final String COMPLETED_FIELD = "completed";
  static final String CREATED_AT_FIELD = "createAt";

  private final MongoClient client;
  private final MongoCollection<Document> collection;

  /**
   * Creates a store over an existing collection. The caller keeps ownership of the client behind
   * it; {@link #close()} is then a no-op.
   *
   * @param collection the collection holding todo documents
   */
  public MongoTodoStore(MongoCollection<Document> collection) {
    this(null, collection);
  }

  private MongoTodoStore(MongoClient client, MongoCollection<Document> collection) {
    this.client = client;
    this.collection = collection;
  }

  /**
   * Connects to the configured deployment and selects the todo collection. The driver connects
   * lazily, so an unreachable server only shows up on the first operation (see {@link #ping()}).
   *
   * @param config the connection settings
   * @return StatusOr containing the store, which owns and closes its client
   */
  @Nonnull
  public static StatusOr<MongoTodoStore> open(MongoConfig config) {
    try {
      MongoClient client = MongoClients.create(clientSettings(config));
      MongoCollection<Document> collection =
          client.getDatabase(config.databaseName()).getCollection(config.collectionName());
      Logger.info("Opened MongoDB todo store: {}", config.toSecureString());
      return StatusOr.ofValue(new MongoTodoStore(client, collection));
    } catch (MongoException | IllegalArgumentException e) {
      return StatusOr.ofStatus(
          Status.internal("Failed to open MongoDB client: " + e.getMessage(), e));
    }
  }

  /**
   * Client settings for the given configuration. Server selection, pool checkout, connect and
   * socket reads are each capped at {@link #OPERATION_TIMEOUT_SECONDS}.
   */
  static MongoClientSettings clientSettings(MongoConfig config) {
    return MongoClientSettings.builder()
        .applyConnectionString(new ConnectionString(config.connectionUri()))
        .applyToClusterSettings(
            builder -> builder.serverSelectionTimeout(OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS))
        .applyToConnectionPoolSettings(
            builder -> builder.maxWaitTime(OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS))
        .applyToSocketSettings(
            builder ->
                builder
                    .connectTimeout(OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                    .readTimeout(OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS))
        .build();
  }

  /**
   * Checks that the deployment answers by reading at most one document from the collection.
   *
   * @return OK if the deployment answered, otherwise the failure
   */
  @Nonnull
  public Status ping() {
    try {
      collection
          .find()
          .limit(1)
          .maxTime(OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)
          .first();
      return Status.ok();
    } catch (MongoException e) {
      return toStatus("Ping", e);
    }
  }

  @Nonnull
  @Override
  public StatusOr<List<Todo>> findAll() {
    List<Document> documents;
    try {
      documents =
          collection
              .find()
              .maxTime(OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)
              .into(new ArrayList<>());
    } catch (MongoException e) {
      return StatusOr.ofStatus(toStatus("Find", e));
    }
    List<Todo> result = new ArrayList<>(documents.size());
    for (Document document : documents) {
      StatusOr<Todo> todoOr = fromDocument(document);
      if (todoOr.isNotOk()) {
        return StatusOr.ofStatus(todoOr.getStatus());
      }
      result.add(todoOr.getValue());
    }
    return StatusOr.ofValue(ImmutableList.copyOf(result));
  }

  @Nonnull
  @Override
  public StatusOr<ObjectId> insert(Todo todo) {
    try {
      collection.insertOne(toDocument(todo));
      return StatusOr.ofValue(todo.id());
    } catch (MongoException e) {
      return StatusOr.ofStatus(toStatus("Insert", e));
    }
  }

  @Nonnull
  @Override
  public StatusOr<Long> deleteById(ObjectId id) {
    try {
      DeleteResult result = collection.deleteOne(Filters.eq(ID_FIELD, id));
      return StatusOr.ofValue(result.getDeletedCount());
    } catch (MongoException e) {
      return StatusOr.ofStatus(toStatus("Delete", e));
    }
  }

  @Nonnull
  @Override
  public StatusOr<Long> updateById(ObjectId id, TodoUpdate update) {
    try {
      UpdateResult result =
          collection.updateOne(
              Filters.eq(ID_FIELD, id),
              Updates.combine(
                  Updates.set(TITLE_FIELD, update.title()),
                  Updates.set(COMPLETED_FIELD, update.completed())));
      return StatusOr.ofValue(result.getMatchedCount());
    } catch (MongoException e) {
      return StatusOr.ofStatus(toStatus("Update", e));
    }
  }

  /** Closes the client if this store opened it. */
  @Override
  public void close() {
    if (client != null) {
      Logger.info("Closing MongoDB client");
      client.close();
    }
  }

  static Document toDocument(Todo todo) {
    return new Document(ID_FIELD, todo.id())
        .append(TITLE_FIELD, todo.title())
        .append(COMPLETED_FIELD, todo.completed())
        .append(CREATED_AT_FIELD, todo.createdAt() == null ? null : Date.from(todo.createdAt()));
  }

  /**
   * Decodes a stored document. Missing fields decode to an empty title, {@code false} and a null
   * creation time; a field holding the wrong BSON type is a decode failure.
   */
  static StatusOr<Todo> fromDocument(Document document) {
    try {
      ObjectId id = document.getObjectId(ID_FIELD);
      if (id == null) {
        return StatusOr.ofStatus(Status.internal("Todo document has no _id", null));
      }
      Date createdAt = document.getDate(CREATED_AT_FIELD);
      return StatusOr.ofValue(
          new Todo(
              id,
              Strings.nullToEmpty(document.getString(TITLE_FIELD)),
              document.getBoolean(COMPLETED_FIELD, false),
              createdAt == null ? null : createdAt.toInstant()));
    } catch (ClassCastException e) {
      return StatusOr.ofStatus(
          Status.internal("Failed to decode todo document " + document.get(ID_FIELD), e));
    }
  }

  static Status toStatus(String operation, MongoException e) {
    if (e instanceof MongoTimeoutException
        || e instanceof MongoExecutionTimeoutException
        || e instanceof MongoSocketReadTimeoutException) {
      return Status.deadlineExceeded(operation + " timed out: " + e.getMessage(), e);
    }
    if (e instanceof MongoSocketException) {
      return Status.unavailable(operation + " failed, store unreachable: " + e.getMessage(), e);
    }
    return Status.internal(operation + " failed: " + e.getMessage(), e);
  }
}
