package com.todoservice.db;

import static org.junit.jupiter.api.Assertions.*;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.todoservice.common.status.StatusCode;
import com.todoservice.common.status.StatusOr;
import com.todoservice.config.MongoConfig;
import java.time.Instant;
import java.util.List;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/** CRUD tests for MongoTodoStore against a real MongoDB. Skipped when Docker is unavailable. */
@Testcontainers(disabledWithoutDocker = true)
public class MongoTodoStoreContainerTest {

  private static final String DATABASE = "todo_store_test";
  private static final String COLLECTION = "todo";

  @Container
  private static final MongoDBContainer mongo =
      new MongoDBContainer(DockerImageName.parse("mongo:7.0"));

  private static MongoTodoStore store;
  private static MongoClient rawClient;
  private static MongoCollection<Document> rawCollection;

  @BeforeAll
  static void setUp() {
    MongoConfig config = new MongoConfig(mongo.getConnectionString(), DATABASE, COLLECTION);
    store = MongoTodoStore.open(config).getValue();

    // A second client for seeding documents the store itself would never write
    rawClient = MongoClients.create(mongo.getConnectionString());
    rawCollection = rawClient.getDatabase(DATABASE).getCollection(COLLECTION);
  }

  @AfterAll
  static void tearDown() {
    if (store != null) {
      store.close();
    }
    if (rawClient != null) {
      rawClient.close();
    }
  }

  @BeforeEach
  void clearData() {
    rawCollection.deleteMany(new Document());
  }

  @Test
  void testPing() {
    assertTrue(store.ping().isOk());
  }

  @Test
  void testFindAll_ReturnsEmptyList_WhenNoTodos() {
    StatusOr<List<Todo>> result = store.findAll();

    assertTrue(result.isOk());
    assertTrue(result.getValue().isEmpty());
  }

  @Test
  void testInsert_ThenFindAll() {
    // Given: Two new todos
    Todo first = Todo.newTodo("Buy milk", Instant.parse("2024-03-13T10:15:30.123456Z"));
    Todo second = Todo.newTodo("Walk dog", Instant.parse("2024-03-13T11:00:00Z"));

    // When: We insert them
    StatusOr<ObjectId> firstIdOr = store.insert(first);
    StatusOr<ObjectId> secondIdOr = store.insert(second);

    // Then: The generated ids come back and both are listed unchanged
    assertEquals(first.id(), firstIdOr.getValue());
    assertEquals(second.id(), secondIdOr.getValue());
    List<Todo> todos = store.findAll().getValue();
    assertEquals(2, todos.size());
    assertTrue(todos.contains(first));
    assertTrue(todos.contains(second));
  }

  @Test
  void testInsert_DuplicateIdIsInternalError() {
    Todo todo = Todo.newTodo("Buy milk", Instant.now());
    assertTrue(store.insert(todo).isOk());

    StatusOr<ObjectId> duplicateOr = store.insert(todo);

    assertEquals(StatusCode.INTERNAL, duplicateOr.getStatus().getCode());
  }

  @Test
  void testUpdateById_ChangesTitleAndCompletedOnly() {
    Todo todo = Todo.newTodo("Buy milk", Instant.parse("2024-03-13T10:15:30.123Z"));
    store.insert(todo);

    StatusOr<Long> matchedOr = store.updateById(todo.id(), new TodoUpdate("Buy oat milk", true));

    assertEquals(1L, matchedOr.getValue());
    List<Todo> todos = store.findAll().getValue();
    assertEquals(List.of(new Todo(todo.id(), "Buy oat milk", true, todo.createdAt())), todos);
  }

  @Test
  void testUpdateById_SameValuesStillMatch() {
    Todo todo = Todo.newTodo("Buy milk", Instant.now());
    store.insert(todo);

    StatusOr<Long> matchedOr = store.updateById(todo.id(), new TodoUpdate("Buy milk", false));

    assertEquals(1L, matchedOr.getValue());
  }

  @Test
  void testUpdateById_UnknownIdMatchesNothing() {
    StatusOr<Long> matchedOr = store.updateById(new ObjectId(), new TodoUpdate("x", true));

    assertTrue(matchedOr.isOk());
    assertEquals(0L, matchedOr.getValue());
  }

  @Test
  void testDeleteById() {
    Todo todo = Todo.newTodo("Buy milk", Instant.now());
    store.insert(todo);

    assertEquals(1L, store.deleteById(todo.id()).getValue());
    assertEquals(0L, store.deleteById(todo.id()).getValue());
    assertTrue(store.findAll().getValue().isEmpty());
  }

  @Test
  void testFindAll_DecodesSparseDocuments() {
    ObjectId id = new ObjectId();
    rawCollection.insertOne(new Document("_id", id));

    List<Todo> todos = store.findAll().getValue();

    assertEquals(List.of(new Todo(id, "", false, null)), todos);
  }

  @Test
  void testFindAll_FailsOnUndecodableDocument() {
    store.insert(Todo.newTodo("fine", Instant.now()));
    rawCollection.insertOne(new Document("_id", new ObjectId()).append("completed", "yes"));

    StatusOr<List<Todo>> result = store.findAll();

    assertEquals(StatusCode.INTERNAL, result.getStatus().getCode());
  }
}
