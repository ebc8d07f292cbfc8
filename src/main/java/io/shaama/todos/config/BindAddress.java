package io.shaama.todos.config;

public record BindAddress(String host, int port) {

    public static BindAddress parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Bind address must not be empty");
        }
        String trimmed = value.trim();
        int separator = trimmed.lastIndexOf(':');
        if (separator <= 0 || separator == trimmed.length() - 1) {
            throw new IllegalArgumentException("Bind address must look like host:port, got: " + value);
        }

        String host = trimmed.substring(0, separator);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }

        int port;
        try {
            port = Integer.parseInt(trimmed.substring(separator + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in bind address: " + value, e);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range in bind address: " + value);
        }
        return new BindAddress(host, port);
    }
}
