package com.todoservice.rest;

import com.todoservice.common.status.Status;
import com.todoservice.common.status.StatusOr;
import com.todoservice.rest.dto.MessageResponse;
import io.javalin.http.Context;
import org.tinylog.Logger;

/**
 * Base interface for REST adapters.
 *
 * <p>Provides the error envelope and request body decoding shared by every handler, so a handler
 * only has to decide which status and message to send.
 */
public interface RestAdapter {

  /**
   * Sets an error response for a failed operation. The HTTP status comes from the status code.
   * Client errors (4xx) carry only the message; for server errors the status message is exposed
   * as the {@code error} field.
   *
   * @param ctx The Javalin context to set the error on
   * @param message The error message to include in the response
   * @param status The failure that ended the request
   */
  default void setError(Context ctx, String message, Status status) {
    if (status.getCode().isClientError()) {
      ctx.status(status.getHttpCode()).json(new MessageResponse(message));
      Logger.warn("Error response: {} - {} ({})", status.getHttpCode(), message, status);
      return;
    }
    ctx.status(status.getHttpCode()).json(new MessageResponse(message, status.getMessage()));
    if (status.getCause() != null) {
      Logger.error(
          status.getCause(), "Error response: {} - {} ({})", status.getHttpCode(), message, status);
    } else {
      Logger.error("Error response: {} - {} ({})", status.getHttpCode(), message, status);
    }
  }

  /**
   * Decodes the JSON request body.
   *
   * @param ctx The Javalin context holding the request
   * @param type The class to decode into
   * @return StatusOr containing the body, or INVALID_ARGUMENT if it is empty or not valid JSON
   *     for the type
   */
  default <T> StatusOr<T> parseBody(Context ctx, Class<T> type) {
    T body;
    try {
      body = ctx.bodyAsClass(type);
    } catch (Exception e) {
      return StatusOr.ofStatus(Status.invalidArgument("Malformed request body: " + e.getMessage()));
    }
    if (body == null) {
      return StatusOr.ofStatus(Status.invalidArgument("Request body is empty"));
    }
    return StatusOr.ofValue(body);
  }

  /**
   * Registers the REST endpoints handled by this adapter.
   *
   * <p>Called from inside {@code RouterConfig.apiBuilder}, so implementations declare their routes
   * with the static {@code io.javalin.apibuilder.ApiBuilder} methods.
   */
  void registerRoutes();
}
