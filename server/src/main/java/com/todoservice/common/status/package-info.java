/**
 * Result types for operations that can fail without throwing.
 *
 * <ul>
 *   <li>{@link com.todoservice.common.status.StatusCode} - error taxonomy, each code bound to an
 *       HTTP status</li>
 *   <li>{@link com.todoservice.common.status.Status} - a code with an optional message and cause</li>
 *   <li>{@link com.todoservice.common.status.StatusOr} - either a value or a non-OK status</li>
 * </ul>
 *
 * <p>Validation problems are {@code INVALID_ARGUMENT}, missing todos {@code NOT_FOUND}, and store
 * failures {@code INTERNAL}, {@code UNAVAILABLE} or {@code DEADLINE_EXCEEDED}.
 */
package com.todoservice.common.status;
