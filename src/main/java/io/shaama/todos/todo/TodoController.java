package io.shaama.todos.todo;

import io.shaama.todos.todo.model.CreateTodo;
import io.shaama.todos.todo.model.TodoResponse;
import io.shaama.todos.todo.model.UpdateTodo;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.List;

@RestController
@RequestMapping(TodoController.BASE_PATH)
@RequiredArgsConstructor
public class TodoController {

    public static final String BASE_PATH = "/v1/todos";

    private final TodoService todoService;

    @GetMapping
    public List<TodoResponse> list() {
        return todoService.list().stream()
                .map(TodoResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public TodoResponse read(@PathVariable("id") long id) {
        return TodoResponse.from(todoService.read(id));
    }

    @PostMapping
    public ResponseEntity<TodoResponse> create(@Valid @RequestBody CreateTodo request) {
        TodoResponse created = TodoResponse.from(todoService.create(request.getBody()));
        return ResponseEntity.created(URI.create(BASE_PATH + "/" + created.id()))
                .body(created);
    }

    @PutMapping("/{id}")
    public TodoResponse update(@PathVariable("id") long id, @Valid @RequestBody UpdateTodo request) {
        return TodoResponse.from(todoService.update(id, request.getBody(), request.getCompleted()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") long id) {
        todoService.delete(id);
        return ResponseEntity.ok().build();
    }
}
