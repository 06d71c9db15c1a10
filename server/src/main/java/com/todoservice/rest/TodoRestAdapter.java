package com.todoservice.rest;

import static io.javalin.apibuilder.ApiBuilder.delete;
import static io.javalin.apibuilder.ApiBuilder.get;
import static io.javalin.apibuilder.ApiBuilder.path;
import static io.javalin.apibuilder.ApiBuilder.post;
import static io.javalin.apibuilder.ApiBuilder.put;

import com.google.common.base.Strings;
import com.todoservice.common.status.Status;
import com.todoservice.common.status.StatusOr;
import com.todoservice.db.Todo;
import com.todoservice.db.TodoStore;
import com.todoservice.db.TodoUpdate;
import com.todoservice.rest.dto.CreateTodoRequest;
import com.todoservice.rest.dto.CreateTodoResponse;
import com.todoservice.rest.dto.ListTodosResponse;
import com.todoservice.rest.dto.MessageResponse;
import com.todoservice.rest.dto.UpdateTodoRequest;
import com.todoservice.util.TodoMapper;
import io.javalin.http.Context;
import io.javalin.openapi.HttpMethod;
import io.javalin.openapi.OpenApi;
import io.javalin.openapi.OpenApiContent;
import io.javalin.openapi.OpenApiParam;
import io.javalin.openapi.OpenApiRequestBody;
import io.javalin.openapi.OpenApiResponse;
import java.time.Clock;
import java.util.List;
import org.bson.types.ObjectId;
import org.tinylog.Logger;

/**
 * REST adapter for the todo endpoints under {@code /todo}.
 *
 * <p>Each handler validates its input, calls the {@link TodoStore} once, and writes a JSON
 * response. Identifiers are checked for ObjectId syntax before the store is contacted. Store
 * failures become 500 responses carrying the failure in the {@code error} field.
 */
public class TodoRestAdapter implements RestAdapter {

  static final String INVALID_ID = "Invalid ID";
  static final String INVALID_PAYLOAD = "Invalid request payload";
  static final String TITLE_REQUIRED = "Title field is required";
  static final String NOT_FOUND = "Todo not found";

  private final TodoStore store;
  private final Clock clock;

  /**
   * Creates a new TodoRestAdapter.
   *
   * @param store The store holding the todos
   * @param clock The clock used to stamp new todos
   */
  public TodoRestAdapter(TodoStore store, Clock clock) {
    this.store = store;
    this.clock = clock;
  }

  @Override
  public void registerRoutes() {
    path(
        "/todo",
        () -> {
          get(this::handleListTodos);
          post(this::handleCreateTodo);
          path(
              "{id}",
              () -> {
                put(this::handleUpdateTodo);
                delete(this::handleDeleteTodo);
              });
        });
  }

  /**
   * Handles a REST request to list every todo.
   *
   * @param ctx The Javalin context containing the request and response
   */
  @OpenApi(
      path = "/todo/",
      methods = {HttpMethod.GET},
      summary = "List todos",
      description = "Returns every stored todo, in no particular order and without pagination.",
      operationId = "listTodos",
      tags = "Todos",
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "Successfully retrieved todos",
            content = @OpenApiContent(from = ListTodosResponse.class)),
        @OpenApiResponse(
            status = "500",
            description = "The store could not be read",
            content = @OpenApiContent(from = MessageResponse.class))
      })
  public void handleListTodos(Context ctx) {
    Logger.info("REST ListTodos request");

    StatusOr<List<Todo>> todosOr = store.findAll();
    if (todosOr.isNotOk()) {
      setError(ctx, "Failed to fetch todo", todosOr.getStatus());
      return;
    }

    ctx.json(new ListTodosResponse(TodoMapper.toViews(todosOr.getValue())));
  }

  /**
   * Handles a REST request to create a todo. New todos always start out not completed.
   *
   * @param ctx The Javalin context containing the request and response
   */
  @OpenApi(
      path = "/todo/",
      methods = {HttpMethod.POST},
      summary = "Create a todo",
      description = "Stores a new todo with the given title. The completion flag starts out false.",
      operationId = "createTodo",
      tags = "Todos",
      requestBody =
          @OpenApiRequestBody(
              description = "The todo to create",
              required = true,
              content =
                  @OpenApiContent(
                      from = CreateTodoRequest.class,
                      example = """
                          {
                            "title": "Buy milk"
                          }
                          """)),
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "Successfully created todo",
            content = @OpenApiContent(from = CreateTodoResponse.class)),
        @OpenApiResponse(
            status = "400",
            description = "Invalid request - malformed JSON or missing title",
            content = @OpenApiContent(from = MessageResponse.class)),
        @OpenApiResponse(
            status = "500",
            description = "The todo could not be stored",
            content = @OpenApiContent(from = MessageResponse.class))
      })
  public void handleCreateTodo(Context ctx) {
    Logger.info("REST CreateTodo request");

    StatusOr<CreateTodoRequest> requestOr = parseBody(ctx, CreateTodoRequest.class);
    if (requestOr.isNotOk()) {
      setError(ctx, INVALID_PAYLOAD, requestOr.getStatus());
      return;
    }
    CreateTodoRequest requestDto = requestOr.getValue();
    if (Strings.isNullOrEmpty(requestDto.title())) {
      setError(ctx, TITLE_REQUIRED, Status.invalidArgument("Todo title is empty"));
      return;
    }

    Todo todo = Todo.newTodo(requestDto.title(), clock.instant());
    StatusOr<ObjectId> idOr = store.insert(todo);
    if (idOr.isNotOk()) {
      setError(ctx, "Failed to save todo", idOr.getStatus());
      return;
    }

    Logger.info("Created todo {}", idOr.getValue());
    ctx.json(new CreateTodoResponse("Todo successfully saved", idOr.getValue().toHexString()));
  }

  /**
   * Handles a REST request to update the title and completion flag of a todo.
   *
   * @param ctx The Javalin context containing the request and response
   */
  @OpenApi(
      path = "/todo/{id}",
      methods = {HttpMethod.PUT},
      summary = "Update a todo",
      description =
          "Replaces the title and completion flag of a todo. The identifier and creation time never change.",
      operationId = "updateTodo",
      tags = "Todos",
      pathParams = {
        @OpenApiParam(
            name = "id",
            description = "The identifier of the todo to update",
            required = true,
            type = String.class,
            example = "65f1c2a9e4b0a1b2c3d4e5f6")
      },
      requestBody =
          @OpenApiRequestBody(
              description = "The new field values",
              required = true,
              content =
                  @OpenApiContent(
                      from = UpdateTodoRequest.class,
                      example = """
                          {
                            "title": "Buy milk",
                            "completed": true
                          }
                          """)),
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "Successfully updated todo",
            content = @OpenApiContent(from = MessageResponse.class)),
        @OpenApiResponse(
            status = "400",
            description = "Invalid request - malformed ID, malformed JSON or missing title",
            content = @OpenApiContent(from = MessageResponse.class)),
        @OpenApiResponse(
            status = "404",
            description = "Not found - no todo has this identifier",
            content = @OpenApiContent(from = MessageResponse.class)),
        @OpenApiResponse(
            status = "500",
            description = "The todo could not be updated",
            content = @OpenApiContent(from = MessageResponse.class))
      })
  public void handleUpdateTodo(Context ctx) {
    String todoIdHex = ctx.pathParam("id");
    Logger.info("REST UpdateTodo request for ID: {}", todoIdHex);

    StatusOr<ObjectId> idOr = TodoMapper.parseId(todoIdHex);
    if (idOr.isNotOk()) {
      setError(ctx, INVALID_ID, idOr.getStatus());
      return;
    }

    StatusOr<UpdateTodoRequest> requestOr = parseBody(ctx, UpdateTodoRequest.class);
    if (requestOr.isNotOk()) {
      setError(ctx, INVALID_PAYLOAD, requestOr.getStatus());
      return;
    }
    UpdateTodoRequest requestDto = requestOr.getValue();
    if (Strings.isNullOrEmpty(requestDto.title())) {
      setError(ctx, TITLE_REQUIRED, Status.invalidArgument("Todo title is empty"));
      return;
    }

    StatusOr<Long> matchedOr =
        store.updateById(
            idOr.getValue(), new TodoUpdate(requestDto.title(), requestDto.completedOrDefault()));
    if (matchedOr.isNotOk()) {
      setError(ctx, "Failed to update todo", matchedOr.getStatus());
      return;
    }
    if (matchedOr.getValue() == 0) {
      setError(ctx, NOT_FOUND, Status.notFound("No todo matched ID " + idOr.getValue()));
      return;
    }

    ctx.json(new MessageResponse("Successfully updated TODO"));
  }

  /**
   * Handles a REST request to delete a todo.
   *
   * @param ctx The Javalin context containing the request and response
   */
  @OpenApi(
      path = "/todo/{id}",
      methods = {HttpMethod.DELETE},
      summary = "Delete a todo",
      description = "Permanently removes a todo. This operation cannot be undone.",
      operationId = "deleteTodo",
      tags = "Todos",
      pathParams = {
        @OpenApiParam(
            name = "id",
            description = "The identifier of the todo to delete",
            required = true,
            type = String.class,
            example = "65f1c2a9e4b0a1b2c3d4e5f6")
      },
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "Successfully deleted todo",
            content = @OpenApiContent(from = MessageResponse.class)),
        @OpenApiResponse(
            status = "400",
            description = "Invalid request - malformed ID",
            content = @OpenApiContent(from = MessageResponse.class)),
        @OpenApiResponse(
            status = "404",
            description = "Not found - no todo has this identifier",
            content = @OpenApiContent(from = MessageResponse.class)),
        @OpenApiResponse(
            status = "500",
            description = "The todo could not be deleted",
            content = @OpenApiContent(from = MessageResponse.class))
      })
  public void handleDeleteTodo(Context ctx) {
    String todoIdHex = ctx.pathParam("id");
    Logger.info("REST DeleteTodo request for ID: {}", todoIdHex);

    StatusOr<ObjectId> idOr = TodoMapper.parseId(todoIdHex);
    if (idOr.isNotOk()) {
      setError(ctx, INVALID_ID, idOr.getStatus());
      return;
    }

    StatusOr<Long> deletedOr = store.deleteById(idOr.getValue());
    if (deletedOr.isNotOk()) {
      setError(ctx, "Failed to delete TODO", deletedOr.getStatus());
      return;
    }
    if (deletedOr.getValue() == 0) {
      setError(ctx, NOT_FOUND, Status.notFound("No todo matched ID " + idOr.getValue()));
      return;
    }

    ctx.json(new MessageResponse("Successfully deleted TODO"));
  }
}
