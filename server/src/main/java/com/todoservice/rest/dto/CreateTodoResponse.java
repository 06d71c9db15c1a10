package com.todoservice.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;

/** Response body for a successful {@code POST /todo/}. */
@OpenApiName("CreateTodoResponse")
@OpenApiDescription("Confirmation of a created todo, with its identifier.")
public record CreateTodoResponse(
    @OpenApiExample("Todo successfully saved")
    @JsonProperty("message")
    String message,

    @OpenApiDescription("Identifier of the new todo.")
    @OpenApiExample("65f1c2a9e4b0a1b2c3d4e5f6")
    @JsonProperty("Todo ID")
    String todoId
) {}
