package io.shaama.todos.todo.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDateTime;

// JSON field names are the wire contract, independent of the column mapping.
@JsonPropertyOrder({"id", "body", "completed", "created_at", "updated_at"})
public record TodoResponse(
        @JsonProperty("id") long id,
        @JsonProperty("body") String body,
        @JsonProperty("completed") boolean completed,
        @JsonProperty("created_at") LocalDateTime createdAt,
        @JsonProperty("updated_at") LocalDateTime updatedAt
) {

    public static TodoResponse from(Todo todo) {
        return new TodoResponse(
                todo.getId(),
                todo.getBody(),
                todo.isCompleted(),
                todo.getCreatedAt(),
                todo.getUpdatedAt()
        );
    }
}
