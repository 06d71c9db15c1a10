package com.todoservice.rest.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiRequired;
import io.javalin.openapi.OpenApiStringValidation;

/**
 * Request body for {@code POST /todo/}.
 *
 * <p>Only the title is read. Any other field a client sends (including {@code completed}) is
 * ignored: new todos always start out not completed.
 */
@OpenApiName("TodoCreationRequest")
@OpenApiDescription("Request body for creating a todo.")
@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateTodoRequest(
    @OpenApiDescription("The task text. Must not be empty.")
    @OpenApiExample("Buy milk")
    @OpenApiRequired
    @OpenApiStringValidation(minLength = "1")
    @JsonProperty("title")
    String title
) {}
