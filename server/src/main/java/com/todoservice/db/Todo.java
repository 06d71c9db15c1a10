package com.todoservice.db;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import org.bson.types.ObjectId;

/**
 * Represents a document in the todo collection.
 *
 * @param id The store identifier, assigned once at creation
 * @param title The task text
 * @param completed Whether the task is done
 * @param createdAt Timestamp when the document was created; never updated
 */
public record Todo(ObjectId id, String title, boolean completed, Instant createdAt) {

  /**
   * Creates a new, not yet stored todo with a fresh identifier, {@code completed = false} and the
   * given creation time truncated to the millisecond precision BSON dates hold.
   */
  public static Todo newTodo(String title, Instant now) {
    return new Todo(new ObjectId(), title, false, now.truncatedTo(ChronoUnit.MILLIS));
  }
}
