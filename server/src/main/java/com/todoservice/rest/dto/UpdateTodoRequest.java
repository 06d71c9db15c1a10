package com.todoservice.rest.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;
import io.javalin.openapi.OpenApiRequired;
import io.javalin.openapi.OpenApiStringValidation;

/**
 * Request body for {@code PUT /todo/{id}}. Both fields are written; an absent {@code completed}
 * counts as {@code false}.
 */
@OpenApiName("TodoUpdateRequest")
@OpenApiDescription("Request body for updating a todo.")
@JsonIgnoreProperties(ignoreUnknown = true)
public record UpdateTodoRequest(
    @OpenApiDescription("The new task text. Must not be empty.")
    @OpenApiExample("Buy milk")
    @OpenApiRequired
    @OpenApiStringValidation(minLength = "1")
    @JsonProperty("title")
    String title,

    @OpenApiDescription("The new completion flag. Defaults to false when omitted.")
    @OpenApiExample("true")
    @OpenApiNullable
    @JsonProperty("completed")
    Boolean completed
) {

  /** Returns the completion flag, treating an omitted value as {@code false}. */
  public boolean completedOrDefault() {
    return completed != null && completed;
  }
}
