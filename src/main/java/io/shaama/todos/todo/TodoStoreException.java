package io.shaama.todos.todo;

import lombok.Getter;

@Getter
public class TodoStoreException extends RuntimeException {

    public enum Kind {
        /** No row matched the requested id. */
        NOT_FOUND,
        /** Any other failure reported by the backing store. */
        STORE_FAILURE
    }

    private final Kind kind;

    private TodoStoreException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static TodoStoreException notFound(long id) {
        return new TodoStoreException(Kind.NOT_FOUND, "Todo " + id + " not found", null);
    }

    public static TodoStoreException storeFailure(String operation, Throwable cause) {
        return new TodoStoreException(Kind.STORE_FAILURE, "Store failure during " + operation, cause);
    }
}
