package io.shaama.todos.todo.model;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

// No partial updates: both fields are required.
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class UpdateTodo {

    @NotNull
    private String body;

    @NotNull
    private Boolean completed;

}
