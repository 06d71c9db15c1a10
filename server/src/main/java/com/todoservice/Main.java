package com.todoservice;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.todoservice.common.status.Status;
import com.todoservice.common.status.StatusOr;
import com.todoservice.config.Environment;
import com.todoservice.config.MongoConfig;
import com.todoservice.config.ServerConfig;
import com.todoservice.db.MongoTodoStore;
import com.todoservice.db.TodoStore;
import com.todoservice.rest.RestAdapterFactory;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;
import io.javalin.openapi.OpenApiInfo;
import io.javalin.openapi.OpenApiServer;
import io.javalin.openapi.plugin.OpenApiPlugin;
import io.javalin.openapi.plugin.redoc.ReDocPlugin;
import io.javalin.openapi.plugin.swagger.SwaggerPlugin;
import io.javalin.plugin.bundled.CorsPluginConfig.CorsRule;
import java.nio.file.Path;
import java.time.Clock;
import org.tinylog.Logger;

/**
 * Entry point of the todo service.
 *
 * <p>Startup reads the configuration, opens the MongoDB store and starts the Javalin REST server.
 * Every step reports failure as a {@link Status} to {@link #main}, which is the only place that
 * exits the process. On JVM shutdown (for example Ctrl+C) the server stops accepting connections,
 * waits up to the configured shutdown timeout for in-flight requests and then closes the store.
 *
 * <h2>Routes</h2>
 *
 * <ul>
 *   <li>{@code GET /} - home page
 *   <li>{@code GET /todo/} - list todos
 *   <li>{@code POST /todo/} - create a todo
 *   <li>{@code PUT /todo/{id}} - update a todo
 *   <li>{@code DELETE /todo/{id}} - delete a todo
 * </ul>
 */
public class Main {

  private final ServerConfig serverConfig;
  private final MongoTodoStore store;
  private Javalin app;

  public Main(ServerConfig serverConfig, MongoTodoStore store) {
    this.serverConfig = serverConfig;
    this.store = store;
  }

  /**
   * Builds the server from the environment: reads both configuration records and opens the store.
   *
   * @param environment the configuration source
   * @return StatusOr containing the server, or the first configuration or connection error
   */
  public static StatusOr<Main> create(Environment environment) {
    StatusOr<MongoConfig> mongoConfigOr = MongoConfig.fromEnvironment(environment);
    if (mongoConfigOr.isNotOk()) {
      return StatusOr.ofStatus(mongoConfigOr.getStatus());
    }
    StatusOr<ServerConfig> serverConfigOr = ServerConfig.fromEnvironment(environment);
    if (serverConfigOr.isNotOk()) {
      return StatusOr.ofStatus(serverConfigOr.getStatus());
    }
    return MongoTodoStore.open(mongoConfigOr.getValue())
        .map(store -> new Main(serverConfigOr.getValue(), store));
  }

  /**
   * Creates the Javalin application with all routes, the strict JSON mapper, request logging, CORS
   * and the OpenAPI documentation plugins. The application is not started.
   *
   * @param store The store the todo handlers use
   * @param serverConfig The listener settings
   * @param clock The clock used to stamp new todos
   * @return the configured application
   */
  public static Javalin createApp(TodoStore store, ServerConfig serverConfig, Clock clock) {
    RestAdapterFactory restAdapterFactory = new RestAdapterFactory(store, clock);

    // Note: redoc and swagger read the definition from /openapi
    return Javalin.create(
        config -> {
          config.showJavalinBanner = false;
          config.jsonMapper(new JavalinJackson(createObjectMapper(), false));
          config.router.ignoreTrailingSlashes = true;
          config.jetty.modifyServer(
              server -> server.setStopTimeout(serverConfig.shutdownTimeout().toMillis()));
          config.requestLogger.http(
              (ctx, executionTimeMs) ->
                  Logger.info(
                      "{} {} -> {} ({} ms)",
                      ctx.method(),
                      ctx.path(),
                      ctx.status().getCode(),
                      executionTimeMs));
          config.bundledPlugins.enableCors(cors -> cors.addRule(CorsRule::anyHost));
          config.registerPlugin(
              new OpenApiPlugin(
                  openApiConfig ->
                      openApiConfig.withDefinitionConfiguration(
                          (version, openApiDefinition) ->
                              openApiDefinition
                                  .withInfo(Main::getOpenApiInfo)
                                  .withServer(
                                      openApiServer ->
                                          getOpenApiServer(serverConfig, openApiServer)))));
          config.registerPlugin(
              new ReDocPlugin(
                  reDocConfiguration -> reDocConfiguration.setDocumentationPath("/openapi")));
          config.registerPlugin(
              new SwaggerPlugin(
                  swaggerConfiguration -> swaggerConfiguration.setDocumentationPath("/openapi")));

          restAdapterFactory.configureRoutes(config.router);
        });
  }

  /**
   * Jackson mapper for request and response bodies. Scalar coercion is off, so a number or boolean
   * where a string is expected (or a string where a boolean is expected) fails to decode.
   */
  static ObjectMapper createObjectMapper() {
    return JsonMapper.builder().disable(MapperFeature.ALLOW_COERCION_OF_SCALARS).build();
  }

  private static OpenApiInfo getOpenApiInfo(OpenApiInfo openApiInfo) {
    return openApiInfo
        .title("Todo API")
        .description("CRUD operations over a collection of todo items stored in MongoDB.")
        .version("v1");
  }

  private static OpenApiServer getOpenApiServer(
      ServerConfig serverConfig, OpenApiServer openApiServer) {
    String port = String.valueOf(serverConfig.port());
    return openApiServer
        .description("Todo REST API server endpoint")
        .url("http://localhost:{port}/")
        .variable("port", "Server's REST port", port, port);
  }

  /**
   * Starts the REST server and registers the shutdown hook.
   *
   * @return OK once the server listens, or the reason it could not start
   */
  public Status start() {
    Status storeStatus = store.ping();
    if (storeStatus.isError()) {
      // Not fatal: the store may come up after the server does.
      Logger.warn("MongoDB did not answer at startup: {}", storeStatus);
    }

    try {
      app = createApp(store, serverConfig, Clock.systemUTC()).start(serverConfig.port());
    } catch (RuntimeException e) {
      store.close();
      return Status.internal("Failed to start REST server on port " + serverConfig.port(), e);
    }
    Logger.info("REST server started, listening on port {}.", serverConfig.port());

    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  Logger.info("Shutting down server since JVM is shutting down");
                  try {
                    Main.this.stop();
                  } catch (Exception e) {
                    Logger.error(e, "Error during shutdown.");
                  }
                }));
    return Status.ok();
  }

  /** Stops the REST server, waiting for in-flight requests, then closes the store. */
  public void stop() {
    if (app != null) {
      app.stop();
      Logger.info("REST server stopped gracefully");
    }
    store.close();
  }

  public static void main(String[] args) {
    StatusOr<Main> serverOr = Environment.load(Path.of(".env")).flatMap(Main::create);
    if (serverOr.isNotOk()) {
      Logger.error("Startup failed: {}", serverOr.getStatus());
      System.exit(1);
    }

    Status started = serverOr.getValue().start();
    if (started.isError()) {
      Logger.error(started.getCause(), "Startup failed: {}", started);
      System.exit(1);
    }
  }
}
