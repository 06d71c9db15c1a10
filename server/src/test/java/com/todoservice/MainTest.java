package com.todoservice;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.todoservice.rest.dto.CreateTodoRequest;
import com.todoservice.rest.dto.UpdateTodoRequest;
import org.junit.jupiter.api.Test;

/** Tests for the JSON mapper the REST server decodes request bodies with. */
public class MainTest {

  private final ObjectMapper mapper = Main.createObjectMapper();

  @Test
  void testObjectMapper_DecodesWellTypedBodies() throws Exception {
    UpdateTodoRequest request =
        mapper.readValue("{\"title\":\"Buy milk\",\"completed\":true}", UpdateTodoRequest.class);

    assertEquals("Buy milk", request.title());
    assertTrue(request.completedOrDefault());
  }

  @Test
  void testObjectMapper_RejectsScalarCoercion() {
    assertThrows(
        MismatchedInputException.class,
        () -> mapper.readValue("{\"title\":123}", CreateTodoRequest.class));
    assertThrows(
        MismatchedInputException.class,
        () -> mapper.readValue("{\"title\":\"x\",\"completed\":\"true\"}", UpdateTodoRequest.class));
  }
}
