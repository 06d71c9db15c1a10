package com.todoservice.rest;

import com.todoservice.db.TodoStore;
import io.javalin.config.RouterConfig;
import java.time.Clock;
import java.util.List;

/**
 * Factory for the REST adapters of the todo service.
 *
 * <p>The store is created once at startup and handed to every adapter that needs it; no adapter
 * looks up shared state on its own.
 */
public class RestAdapterFactory {

  private final List<RestAdapter> adapters;

  /**
   * Creates a new RestAdapterFactory.
   *
   * @param store The store holding the todos
   * @param clock The clock used to stamp new todos
   */
  public RestAdapterFactory(TodoStore store, Clock clock) {
    this.adapters = List.of(new HomeRestAdapter(), new TodoRestAdapter(store, clock));
  }

  /**
   * Configures the Javalin router to use the REST adapters.
   */
  public void configureRoutes(RouterConfig router) {
    router.apiBuilder(() -> adapters.forEach(RestAdapter::registerRoutes));
  }
}
