package com.todoservice.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;

/**
 * Wire representation of a todo, as returned by {@code GET /todo/}.
 *
 * <p>The identifier is the 24 character hex form of the store's ObjectId and the creation time is
 * an ISO-8601 instant. The JSON name of the creation time is {@code create_at}.
 */
@OpenApiName("Todo")
@OpenApiDescription("A task item.")
public record Todo(
    @OpenApiDescription("Unique identifier of the todo.")
    @OpenApiExample("65f1c2a9e4b0a1b2c3d4e5f6")
    @JsonProperty("id")
    String id,

    @OpenApiDescription("The task text.")
    @OpenApiExample("Buy milk")
    @JsonProperty("title")
    String title,

    @OpenApiDescription("Whether the task is done.")
    @OpenApiExample("false")
    @JsonProperty("completed")
    boolean completed,

    @OpenApiDescription("When the todo was created, as an ISO-8601 instant.")
    @OpenApiExample("2024-03-13T10:15:30.123Z")
    @OpenApiNullable
    @JsonProperty("create_at")
    String createdAt
) {}
