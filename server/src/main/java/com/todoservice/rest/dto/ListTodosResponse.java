package com.todoservice.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiName;
import java.util.List;

/** Response body for {@code GET /todo/}. An empty collection yields an empty array. */
@OpenApiName("ListTodosResponse")
@OpenApiDescription("All stored todos.")
public record ListTodosResponse(
    @OpenApiDescription("The todos, in no particular order.")
    @JsonProperty("data")
    List<Todo> data
) {}
