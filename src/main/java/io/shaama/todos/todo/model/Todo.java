package io.shaama.todos.todo.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

@Entity
@Table(name = "todos")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Todo {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String body;

    @Column(nullable = false)
    private boolean completed;

    @Convert(converter = TimestampTextConverter.class)
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Convert(converter = TimestampTextConverter.class)
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static Todo create(String body, LocalDateTime now) {
        return Todo.builder()
                .body(body)
                .completed(false)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Replaces body and completed together and moves {@code updatedAt} forward.
     * If {@code now} is not after the stored value (same millisecond, clock
     * skew) the stored value is advanced by one millisecond instead.
     */
    public void update(String body, boolean completed, LocalDateTime now) {
        this.body = body;
        this.completed = completed;
        this.updatedAt = now.isAfter(updatedAt) ? now : updatedAt.plus(1, ChronoUnit.MILLIS);
    }
}
