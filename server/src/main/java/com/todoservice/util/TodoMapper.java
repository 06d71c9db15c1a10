package com.todoservice.util;

import com.google.common.base.Strings;
import com.todoservice.common.status.Status;
import com.todoservice.common.status.StatusOr;
import com.todoservice.db.Todo;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import org.bson.types.ObjectId;

/**
 * Converts between stored todos ({@link Todo}) and their REST representation
 * ({@link com.todoservice.rest.dto.Todo}).
 */
public final class TodoMapper {

  private TodoMapper() {
    // Utility class, no instances
  }

  /**
   * Builds the wire view of a stored todo.
   *
   * @param todo the stored todo
   * @return the view, with the identifier as hex and the creation time as ISO-8601
   */
  @Nonnull
  public static com.todoservice.rest.dto.Todo toView(@Nonnull Todo todo) {
    return new com.todoservice.rest.dto.Todo(
        todo.id().toHexString(),
        todo.title(),
        todo.completed(),
        todo.createdAt() == null ? null : todo.createdAt().toString());
  }

  /** Builds the wire views of a list of stored todos, keeping their order. */
  @Nonnull
  public static List<com.todoservice.rest.dto.Todo> toViews(@Nonnull List<Todo> todos) {
    return todos.stream().map(TodoMapper::toView).collect(Collectors.toList());
  }

  /**
   * Parses a wire view back into a stored todo.
   *
   * @param view the wire view
   * @return StatusOr containing the todo, or INVALID_ARGUMENT if the identifier or the creation
   *     time is malformed
   */
  @Nonnull
  public static StatusOr<Todo> toRecord(@Nonnull com.todoservice.rest.dto.Todo view) {
    StatusOr<ObjectId> idOr = parseId(view.id());
    if (idOr.isNotOk()) {
      return StatusOr.ofStatus(idOr.getStatus());
    }
    Instant createdAt = null;
    if (!Strings.isNullOrEmpty(view.createdAt())) {
      try {
        createdAt = Instant.parse(view.createdAt());
      } catch (DateTimeParseException e) {
        return StatusOr.ofStatus(
            Status.invalidArgument("Invalid creation time: " + view.createdAt()));
      }
    }
    return StatusOr.ofValue(
        new Todo(idOr.getValue(), view.title(), view.completed(), createdAt));
  }

  /**
   * Parses a todo identifier. Surrounding whitespace is ignored.
   *
   * @param hex the 24 character hex form of an ObjectId
   * @return StatusOr containing the identifier, or INVALID_ARGUMENT if it is not a valid ObjectId
   */
  @Nonnull
  public static StatusOr<ObjectId> parseId(String hex) {
    if (Strings.isNullOrEmpty(hex)) {
      return StatusOr.ofStatus(Status.invalidArgument("Todo ID cannot be null or empty"));
    }
    String trimmed = hex.trim();
    if (!ObjectId.isValid(trimmed)) {
      return StatusOr.ofStatus(Status.invalidArgument("Invalid todo ID format: " + hex));
    }
    return StatusOr.ofValue(new ObjectId(trimmed));
  }
}
