package ecotrack.platform.adapters.actions;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.json.JsonMapper;
import ecotrack.core.actions.Action;
import ecotrack.core.actions.ActionFields;
import ecotrack.core.actions.ActionNotFoundException;
import ecotrack.core.actions.ActionStorageException;
import ecotrack.core.actions.ActionStore;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileActionRecordsAdapterTest {
  private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

  @TempDir Path tempDir;

  private Path file;
  private JsonFileActionRecordsAdapter adapter;

  @BeforeEach
  void setUp() {
    file = tempDir.resolve("data").resolve("actions_data.json");
    adapter = new JsonFileActionRecordsAdapter(objectMapper, file.toString());
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  @Test
  void open_missingFile_createsEmptyArray() throws IOException {
    adapter.open();

    assertTrue(Files.exists(file));
    JsonNode root = objectMapper.readTree(Files.readAllBytes(file));
    assertTrue(root.isArray());
    assertEquals(0, root.size());
    assertEquals(List.of(), adapter.load());
  }

  @Test
  void open_existingFile_keepsContents() throws IOException {
    Files.createDirectories(file.getParent());
    Files.writeString(file, "[{\"id\":3,\"action\":\"Recycling\",\"date\":\"2025-01-08\",\"points\":25}]");

    adapter.open();

    assertEquals(List.of(new Action(3, "Recycling", LocalDate.of(2025, 1, 8), 25)), adapter.load());
  }

  @Test
  void load_missingOrBlankFile_returnsEmpty() throws IOException {
    assertEquals(List.of(), adapter.load());

    Files.createDirectories(file.getParent());
    Files.writeString(file, "  \n");
    assertEquals(List.of(), adapter.load());
  }

  @Test
  void modify_thenReload_roundTripsCollectionInOrder() {
    adapter.open();
    List<Action> actions =
        List.of(
            new Action(1, "Recycling", LocalDate.of(2025, 1, 8), 25),
            new Action(2, "Bike commute", LocalDate.of(2025, 1, 9), 10),
            new Action(5, "Compost \"kitchen\" scraps", LocalDate.of(2024, 12, 31), 3));

    adapter.modify(stored -> stored.addAll(actions));

    JsonFileActionRecordsAdapter reopened = new JsonFileActionRecordsAdapter(objectMapper, file.toString());
    assertEquals(actions, reopened.load());
  }

  @Test
  void modify_writesPlainJsonArrayWithIsoDates() throws IOException {
    adapter.open();

    adapter.modify(stored -> stored.add(new Action(1, "Recycling", LocalDate.of(2025, 1, 8), 25)));

    JsonNode root = objectMapper.readTree(Files.readAllBytes(file));
    assertTrue(root.isArray());
    JsonNode first = root.get(0);
    assertEquals(1, first.get("id").asInt());
    assertEquals("Recycling", first.get("action").asText());
    assertEquals("2025-01-08", first.get("date").asText());
    assertEquals(25, first.get("points").asInt());
    List<String> keys = new ArrayList<>();
    first.fieldNames().forEachRemaining(keys::add);
    assertEquals(List.of("id", "action", "date", "points"), keys);
  }

  @Test
  void modify_failingMutation_leavesFileUntouched() throws IOException {
    adapter.open();
    adapter.modify(stored -> stored.add(new Action(1, "Recycling", LocalDate.of(2025, 1, 8), 25)));
    String before = Files.readString(file);

    assertThrows(
        ActionNotFoundException.class,
        () ->
            adapter.modify(
                stored -> {
                  stored.clear();
                  throw new ActionNotFoundException(9);
                }));

    assertEquals(before, Files.readString(file));
  }

  @Test
  void modify_leavesNoTempFilesBehind() throws IOException {
    adapter.open();

    for (int i = 1; i <= 5; i++) {
      long id = i;
      adapter.modify(stored -> stored.add(new Action(id, "A" + id, LocalDate.of(2025, 1, 1), 1)));
    }

    try (Stream<Path> files = Files.list(file.getParent())) {
      List<String> names = files.map(p -> p.getFileName().toString()).sorted().toList();
      assertEquals(List.of("actions_data.json", "actions_data.json.lock"), names);
    }
  }

  @Test
  void modify_beforeOpen_isRejected() {
    assertThrows(IllegalStateException.class, () -> adapter.modify(stored -> null));
  }

  @Test
  void load_corruptFile_raisesStorageError() throws IOException {
    Files.createDirectories(file.getParent());
    Files.writeString(file, "[{\"id\": 1, \"action\": ", StandardCharsets.UTF_8);

    ActionStorageException e = assertThrows(ActionStorageException.class, () -> adapter.load());

    assertEquals(file.toAbsolutePath(), e.file());
    assertThat(e.getMessage(), containsString("Failed to read actions from"));
  }

  @Test
  void open_corruptFile_failsAndKeepsData() throws IOException {
    Files.createDirectories(file.getParent());
    Files.writeString(file, "{\"not\": \"an array\"}");

    assertThrows(ActionStorageException.class, () -> adapter.open());

    assertEquals("{\"not\": \"an array\"}", Files.readString(file));
  }

  @Test
  void load_wellFormedJsonWithInvalidActions_raisesStorageError() throws IOException {
    Files.createDirectories(file.getParent());
    List<String> contents =
        List.of(
            "null",
            "[null]",
            "[{\"id\":1}]",
            "[{\"action\":\"Recycling\",\"date\":\"2025-01-08\",\"points\":25}]",
            "[{\"id\":1,\"action\":\"Recycling\",\"date\":\"2025-01-08\",\"points\":25},"
                + "{\"id\":1,\"action\":\"Bike commute\",\"date\":\"2025-01-09\",\"points\":10}]",
            "[{\"id\":1,\"action\":\"  \",\"date\":\"2025-01-08\",\"points\":25}]",
            "[{\"id\":1,\"action\":\"Recycling\",\"points\":25}]",
            "[{\"id\":1,\"action\":\"Recycling\",\"date\":\"2025-01-08\",\"points\":0}]");

    for (String content : contents) {
      Files.writeString(file, content);

      ActionStorageException e =
          assertThrows(ActionStorageException.class, () -> adapter.load(), content);

      assertThat(e.getMessage(), containsString("Invalid actions"));
      assertEquals(file.toAbsolutePath(), e.file());
    }
  }

  @Test
  void open_duplicateIds_failsAndKeepsData() throws IOException {
    String content =
        "[{\"id\":2,\"action\":\"A\",\"date\":\"2025-01-08\",\"points\":1},"
            + "{\"id\":2,\"action\":\"B\",\"date\":\"2025-01-08\",\"points\":1}]";
    Files.createDirectories(file.getParent());
    Files.writeString(file, content);

    assertThrows(ActionStorageException.class, () -> adapter.open());

    assertEquals(content, Files.readString(file));
  }

  @Test
  void modify_failedWrite_keepsPreviousContentsAndNoTempFile() throws IOException {
    Files.createDirectories(file.getParent());
    Files.writeString(file, "[{\"id\":1,\"action\":\"Recycling\",\"date\":\"2025-01-08\",\"points\":25}]");
    String before = Files.readString(file);

    ObjectWriter failingWriter = mock(ObjectWriter.class);
    when(failingWriter.writeValueAsBytes(any())).thenThrow(new JsonMappingException(null, "disk full"));
    ObjectMapper mapper = spy(objectMapper);
    doReturn(failingWriter).when(mapper).writerWithDefaultPrettyPrinter();
    adapter = new JsonFileActionRecordsAdapter(mapper, file.toString());
    adapter.open();

    ActionStorageException e =
        assertThrows(
            ActionStorageException.class,
            () -> adapter.modify(stored -> stored.add(new Action(2, "Bike commute", LocalDate.of(2025, 1, 9), 10))));

    assertThat(e.getMessage(), containsString("Failed to write actions to"));
    assertEquals(before, Files.readString(file));
    try (Stream<Path> files = Files.list(file.getParent())) {
      List<String> names = files.map(p -> p.getFileName().toString()).sorted().toList();
      assertEquals(List.of("actions_data.json", "actions_data.json.lock"), names);
    }
  }

  @Test
  void modify_whileAnotherAdapterHoldsTheFile_raisesStorageError() {
    adapter.open();
    JsonFileActionRecordsAdapter second = new JsonFileActionRecordsAdapter(objectMapper, file.toString());
    try {
      second.open();
      adapter.modify(
          stored -> {
            ActionStorageException e =
                assertThrows(ActionStorageException.class, () -> second.modify(other -> null));
            assertThat(e.getMessage(), containsString("already held"));
            return null;
          });
    } finally {
      second.close();
    }
  }

  @Test
  void modify_firstYearOfEra_roundTripsWithFourDigitYear() throws IOException {
    adapter.open();

    adapter.modify(stored -> stored.add(new Action(1, "Seed saving", LocalDate.of(1, 1, 1), 4)));

    assertEquals("0001-01-01", objectMapper.readTree(Files.readAllBytes(file)).get(0).get("date").asText());
    assertEquals(LocalDate.of(1, 1, 1), adapter.load().get(0).date());
  }

  @Test
  void concurrentCreates_noLostUpdatesAndUniqueIds() throws Exception {
    adapter.open();
    ActionStore store = new ActionStore(adapter, Clock.systemDefaultZone());
    int threads = 8;
    int perThread = 15;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<List<Long>>> futures = new ArrayList<>();

    try {
      for (int t = 0; t < threads; t++) {
        int worker = t;
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  List<Long> ids = new ArrayList<>();
                  for (int i = 0; i < perThread; i++) {
                    ids.add(store.create(ActionFields.of("w" + worker + "-" + i, "2025-01-08", 1)).id());
                    assertTrue(store.list().size() >= ids.size());
                  }
                  return ids;
                }));
      }
      start.countDown();

      Set<Long> ids = new HashSet<>();
      for (Future<List<Long>> future : futures) {
        ids.addAll(future.get(30, TimeUnit.SECONDS));
      }

      assertEquals(threads * perThread, ids.size());
      List<Action> persisted = new JsonFileActionRecordsAdapter(objectMapper, file.toString()).load();
      assertEquals(threads * perThread, persisted.size());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void close_isIdempotent_andReopenWorks() {
    adapter.open();
    adapter.close();
    adapter.close();

    adapter.open();
    adapter.modify(stored -> stored.add(new Action(1, "Recycling", LocalDate.of(2025, 1, 8), 25)));

    assertEquals(1, adapter.load().size());
  }
}
