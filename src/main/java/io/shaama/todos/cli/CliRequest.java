package io.shaama.todos.cli;

import java.net.URI;

public record CliRequest(String method, URI uri, String body) {
}
