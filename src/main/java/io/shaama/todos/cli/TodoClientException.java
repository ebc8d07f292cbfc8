package io.shaama.todos.cli;

public class TodoClientException extends Exception {

    public TodoClientException(String message) {
        super(message);
    }

    public TodoClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
