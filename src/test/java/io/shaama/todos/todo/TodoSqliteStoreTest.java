package io.shaama.todos.todo;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.shaama.todos.config.EnvironmentDefaults;
import io.shaama.todos.todo.model.Todo;
import io.shaama.todos.todo.model.TodoResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Runs against the production store: sqlite-jdbc, the SQLite dialect and
 * {@code schema-sqlite.sql} applied at startup.
 */
@SpringBootTest
@AutoConfigureMockMvc
class TodoSqliteStoreTest {

    @TempDir
    static Path databaseDir;

    @DynamicPropertySource
    static void sqliteDatabase(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url",
                () -> EnvironmentDefaults.toJdbcUrl("sqlite:" + databaseDir.resolve("todos.sqlite")));
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private TodoService todoService;

    @BeforeEach
    void resetDatabase() {
        jdbcTemplate.execute("DELETE FROM todos");
    }

    @Test
    void startupMigrationCreatesTodosTable() {
        Long tables = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = 'todos'", Long.class);

        assertThat(tables).isEqualTo(1L);
    }

    @Test
    void createUpdateDeleteReadScenario() throws Exception {
        MvcResult createResult = mockMvc.perform(post("/v1/todos")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"body\":\"buy milk\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.completed").value(false))
                .andReturn();
        TodoResponse created = objectMapper.readValue(createResult.getResponse().getContentAsString(), TodoResponse.class);
        assertThat(created.updatedAt()).isEqualTo(created.createdAt());

        MvcResult updateResult = mockMvc.perform(put("/v1/todos/{id}", created.id())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"body\":\"buy milk\",\"completed\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(created.id()))
                .andExpect(jsonPath("$.body").value("buy milk"))
                .andExpect(jsonPath("$.completed").value(true))
                .andReturn();
        TodoResponse updated = objectMapper.readValue(updateResult.getResponse().getContentAsString(), TodoResponse.class);
        assertThat(updated.createdAt()).isEqualTo(created.createdAt());
        assertThat(updated.updatedAt()).isAfter(created.updatedAt());

        mockMvc.perform(delete("/v1/todos/{id}", created.id()))
                .andExpect(status().isOk());

        mockMvc.perform(get("/v1/todos/{id}", created.id()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void deletedIdIsNeverReused() {
        todoService.create("first");
        Todo newest = todoService.create("newest");
        todoService.delete(newest.getId());

        Todo next = todoService.create("next");

        assertThat(next.getId()).isGreaterThan(newest.getId());
    }

    @Test
    void timestampsAreStoredAsText() {
        Todo todo = todoService.create("stamped");

        String storedType = jdbcTemplate.queryForObject(
                "SELECT typeof(created_at) || ',' || typeof(updated_at) FROM todos WHERE id = ?",
                String.class, todo.getId());
        String storedCreatedAt = jdbcTemplate.queryForObject(
                "SELECT created_at FROM todos WHERE id = ?", String.class, todo.getId());

        assertThat(storedType).isEqualTo("text,text");
        assertThat(storedCreatedAt).matches("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}\\.\\d{3}");
        assertThat(todoService.read(todo.getId()).getCreatedAt()).isEqualTo(todo.getCreatedAt());
    }

    @Test
    void concurrentUpdatesAndDeletesAllSucceed() throws Exception {
        List<Long> ids = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            ids.add(todoService.create("todo " + i).getId());
        }

        List<Callable<Void>> calls = new ArrayList<>();
        for (int i = 0; i < 80; i++) {
            long id = ids.get(i % ids.size());
            String body = "round " + i;
            calls.add(() -> {
                todoService.update(id, body, true);
                return null;
            });
            long missingId = 100_000L + i;
            calls.add(() -> {
                todoService.delete(missingId);
                return null;
            });
        }

        ExecutorService executor = Executors.newFixedThreadPool(16);
        try {
            for (Future<Void> result : executor.invokeAll(calls)) {
                // get() rethrows any TodoStoreException raised by the call
                result.get();
            }
        } finally {
            executor.shutdown();
            executor.awaitTermination(30, TimeUnit.SECONDS);
        }

        assertThat(todoService.list())
                .hasSize(ids.size())
                .allSatisfy(todo -> assertThat(todo.isCompleted()).isTrue());
    }
}
