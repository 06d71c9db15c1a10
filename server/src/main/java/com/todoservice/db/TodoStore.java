package com.todoservice.db;

import com.todoservice.common.status.StatusOr;
import java.util.List;
import javax.annotation.Nonnull;
import org.bson.types.ObjectId;

/**
 * Storage operations over the todo collection.
 *
 * <p>Implementations must be safe for concurrent use; the REST layer calls them from many request
 * threads at once. Failures are reported through the returned {@link StatusOr}, never thrown.
 */
public interface TodoStore {

  /**
   * Loads every todo. No ordering is guaranteed.
   *
   * @return StatusOr containing all todos or an error
   */
  @Nonnull
  StatusOr<List<Todo>> findAll();

  /**
   * Stores a new todo.
   *
   * @param todo the todo to store, with its identifier already assigned
   * @return StatusOr containing the stored identifier or an error
   */
  @Nonnull
  StatusOr<ObjectId> insert(Todo todo);

  /**
   * Deletes the todo with the given identifier.
   *
   * @param id the identifier to delete
   * @return StatusOr containing the number of deleted documents (0 when absent) or an error
   */
  @Nonnull
  StatusOr<Long> deleteById(ObjectId id);

  /**
   * Sets the title and completion flag of the todo with the given identifier.
   *
   * @param id the identifier to update
   * @param update the new field values
   * @return StatusOr containing the number of matched documents (0 when absent) or an error
   */
  @Nonnull
  StatusOr<Long> updateById(ObjectId id, TodoUpdate update);
}
