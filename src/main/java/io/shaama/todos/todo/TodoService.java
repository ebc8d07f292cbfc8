package io.shaama.todos.todo;

import io.shaama.todos.todo.model.Todo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.function.Supplier;

/**
 * The five todo operations. Every call round-trips to the store; each mutation
 * and the row it returns share one transaction and are flushed before the
 * method returns.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class TodoService {

    private final TodoRepository todoRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<Todo> list() {
        return inStore("list", () -> todoRepository.findAll());
    }

    @Transactional(readOnly = true)
    public Todo read(long id) {
        log.debug("Reading todo {}", id);
        return inStore("read", () -> todoRepository.findById(id)
                .orElseThrow(() -> TodoStoreException.notFound(id)));
    }

    public Todo create(String body) {
        Todo saved = inStore("create", () -> todoRepository.saveAndFlush(Todo.create(body, now())));
        log.info("Created todo {}", saved.getId());
        return saved;
    }

    public Todo update(long id, String body, boolean completed) {
        Todo updated = inStore("update", () -> {
            Todo todo = todoRepository.findById(id)
                    .orElseThrow(() -> TodoStoreException.notFound(id));
            todo.update(body, completed, now());
            return todoRepository.saveAndFlush(todo);
        });
        log.info("Updated todo {} (completed={})", id, completed);
        return updated;
    }

    /**
     * Deleting an id that does not exist is not an error.
     */
    public void delete(long id) {
        boolean deleted = inStore("delete", () -> todoRepository.findById(id)
                .map(todo -> {
                    todoRepository.delete(todo);
                    todoRepository.flush();
                    return true;
                })
                .orElse(false));
        if (deleted) {
            log.info("Deleted todo {}", id);
        } else {
            log.debug("Delete of missing todo {} treated as success", id);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }

    private static <T> T inStore(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw TodoStoreException.storeFailure(operation, e);
        }
    }
}
