package io.shaama.todos.todo.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;

// Same text shape as SQLite's CURRENT_TIMESTAMP ("YYYY-MM-DD HH:MM:SS"), plus milliseconds.
@Converter
public class TimestampTextConverter implements AttributeConverter<LocalDateTime, String> {

    static final DateTimeFormatter WRITE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    static final DateTimeFormatter READ_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral(' ').optionalEnd()
            .optionalStart().appendLiteral('T').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .toFormatter();

    @Override
    public String convertToDatabaseColumn(LocalDateTime value) {
        return value == null ? null : WRITE_FORMAT.format(value);
    }

    @Override
    public LocalDateTime convertToEntityAttribute(String column) {
        return column == null ? null : LocalDateTime.parse(column.trim(), READ_FORMAT);
    }
}
