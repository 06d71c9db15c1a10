package com.todoservice.rest;

import static io.javalin.apibuilder.ApiBuilder.get;

import com.google.common.io.Resources;
import io.javalin.http.Context;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;

/** Serves the static home page at {@code /}. */
public class HomeRestAdapter implements RestAdapter {

  static final String HOME_PAGE_RESOURCE = "/static/home.html";

  private final String homePage;

  /**
   * Creates a new HomeRestAdapter, reading the page from the classpath once.
   *
   * @throws IllegalStateException if the page is not on the classpath
   */
  public HomeRestAdapter() {
    URL page = HomeRestAdapter.class.getResource(HOME_PAGE_RESOURCE);
    if (page == null) {
      throw new IllegalStateException(HOME_PAGE_RESOURCE + " could not be loaded.");
    }
    try {
      this.homePage = Resources.toString(page, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + HOME_PAGE_RESOURCE, e);
    }
  }

  @Override
  public void registerRoutes() {
    get("/", this::handleHome);
  }

  /**
   * Renders the home page.
   *
   * @param ctx The Javalin context containing the request and response
   */
  public void handleHome(Context ctx) {
    ctx.html(homePage);
  }
}
