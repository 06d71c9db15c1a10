package com.todoservice.util;

import static org.junit.jupiter.api.Assertions.*;

import com.todoservice.common.status.StatusCode;
import com.todoservice.common.status.StatusOr;
import com.todoservice.db.Todo;
import java.time.Instant;
import java.util.List;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

public class TodoMapperTest {

  private static final ObjectId ID = new ObjectId("65f1c2a9e4b0a1b2c3d4e5f6");
  private static final Instant CREATED_AT = Instant.parse("2024-03-13T10:15:30.123Z");

  @Test
  void testToView() {
    com.todoservice.rest.dto.Todo view =
        TodoMapper.toView(new Todo(ID, "Buy milk", true, CREATED_AT));

    assertEquals("65f1c2a9e4b0a1b2c3d4e5f6", view.id());
    assertEquals("Buy milk", view.title());
    assertTrue(view.completed());
    assertEquals("2024-03-13T10:15:30.123Z", view.createdAt());
  }

  @Test
  void testToView_MissingCreationTime() {
    com.todoservice.rest.dto.Todo view = TodoMapper.toView(new Todo(ID, "", false, null));

    assertNull(view.createdAt());
    assertEquals("", view.title());
  }

  @Test
  void testToViews_KeepsOrder() {
    ObjectId second = new ObjectId();
    List<com.todoservice.rest.dto.Todo> views =
        TodoMapper.toViews(
            List.of(new Todo(ID, "a", false, CREATED_AT), new Todo(second, "b", false, CREATED_AT)));

    assertEquals(List.of(ID.toHexString(), second.toHexString()),
        views.stream().map(com.todoservice.rest.dto.Todo::id).toList());
    assertTrue(TodoMapper.toViews(List.of()).isEmpty());
  }

  @Test
  void testToRecord_ReversesToView() {
    Todo todo = new Todo(ID, "Buy milk", false, CREATED_AT);

    StatusOr<Todo> recordOr = TodoMapper.toRecord(TodoMapper.toView(todo));

    assertTrue(recordOr.isOk());
    assertEquals(todo, recordOr.getValue());
  }

  @Test
  void testToRecord_RejectsBadCreationTime() {
    StatusOr<Todo> recordOr =
        TodoMapper.toRecord(
            new com.todoservice.rest.dto.Todo(ID.toHexString(), "x", false, "yesterday"));

    assertEquals(StatusCode.INVALID_ARGUMENT, recordOr.getStatus().getCode());
  }

  @Test
  void testParseId() {
    assertEquals(ID, TodoMapper.parseId("65f1c2a9e4b0a1b2c3d4e5f6").getValue());
    assertEquals(ID, TodoMapper.parseId(" 65f1c2a9e4b0a1b2c3d4e5f6 ").getValue());
  }

  @Test
  void testParseId_Invalid() {
    assertEquals(StatusCode.INVALID_ARGUMENT, TodoMapper.parseId(null).getStatus().getCode());
    assertEquals(StatusCode.INVALID_ARGUMENT, TodoMapper.parseId("").getStatus().getCode());
    assertEquals(StatusCode.INVALID_ARGUMENT, TodoMapper.parseId("abc").getStatus().getCode());
    assertEquals(
        StatusCode.INVALID_ARGUMENT,
        TodoMapper.parseId("zzf1c2a9e4b0a1b2c3d4e5f6").getStatus().getCode());
    assertEquals(
        "Invalid todo ID format: abc", TodoMapper.parseId("abc").getStatus().getMessage());
  }
}
