package com.todoservice.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;

/**
 * Message envelope used for update and delete confirmations and for every error response.
 *
 * <p>{@code error} carries the underlying store failure for 500 responses and is left out of the
 * JSON otherwise.
 */
@OpenApiName("MessageResponse")
@OpenApiDescription("A human readable outcome, with error details for server failures.")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageResponse(
    @OpenApiExample("Todo not found")
    @JsonProperty("message")
    String message,

    @OpenApiDescription("Details of the underlying failure, present only on server errors.")
    @OpenApiNullable
    @JsonProperty("error")
    String error
) {

  public MessageResponse(String message) {
    this(message, null);
  }
}
