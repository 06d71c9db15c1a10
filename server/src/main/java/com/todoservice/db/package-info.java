/**
 * The storage layer for the todo service.
 *
 * <p>{@link com.todoservice.db.Todo} is the stored form of a todo, {@link
 * com.todoservice.db.TodoStore} the operations the REST layer needs, and {@link
 * com.todoservice.db.MongoTodoStore} their MongoDB implementation. Operations return {@code
 * StatusOr<T>} so that store failures reach the handlers as values rather than exceptions.
 */
package com.todoservice.db;
