package io.shaama.todos.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.shaama.todos.todo.model.CreateTodo;
import io.shaama.todos.todo.model.UpdateTodo;

import java.io.PrintStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line client for the todos API.
 * <pre>
 * TodoCli &lt;base-url&gt; list
 * TodoCli &lt;base-url&gt; create &lt;body&gt;
 * TodoCli &lt;base-url&gt; read &lt;id&gt;
 * TodoCli &lt;base-url&gt; update &lt;id&gt; &lt;body&gt; [-c|--completed]
 * TodoCli &lt;base-url&gt; delete &lt;id&gt;
 * </pre>
 */
public class TodoCli {

    static final String TODOS_PATH = "/v1/todos";

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: TodoCli <base-url> <command> [args]",
            "Commands:",
            "  list                                 List all todos",
            "  create <body>                        Create a new todo",
            "  read <id>                            Read a todo",
            "  update <id> <body> [-c|--completed]  Update a todo",
            "  delete <id>                          Delete a todo");

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) {
        System.exit(run(args, HttpClient.newHttpClient(), System.out, System.err));
    }

    static int run(String[] args, HttpClient httpClient, PrintStream out, PrintStream err) {
        for (String arg : args) {
            if (arg.equals("-h") || arg.equals("--help")) {
                out.println(USAGE);
                return EXIT_OK;
            }
        }

        CliRequest request;
        try {
            request = parse(args);
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        try {
            new TodoClient(httpClient, MAPPER, out, err).send(request);
            return EXIT_OK;
        } catch (TodoClientException e) {
            err.println("error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    static CliRequest parse(String[] args) {
        List<String> positional = new ArrayList<>();
        boolean completed = false;
        for (String arg : args) {
            switch (arg) {
                case "-c", "--completed" -> completed = true;
                default -> positional.add(arg);
            }
        }

        if (positional.size() < 2) {
            throw new IllegalArgumentException("expected <base-url> and <command>");
        }
        String baseUrl = positional.get(0);
        String command = positional.get(1);
        List<String> rest = positional.subList(2, positional.size());

        if (completed && !command.equals("update")) {
            throw new IllegalArgumentException("--completed is only valid for update");
        }

        return switch (command) {
            case "list" -> {
                expectArgs(command, rest, 0);
                yield new CliRequest("GET", resolve(baseUrl, TODOS_PATH), null);
            }
            case "create" -> {
                expectArgs(command, rest, 1);
                yield new CliRequest("POST", resolve(baseUrl, TODOS_PATH), toJson(new CreateTodo(rest.get(0))));
            }
            case "read" -> {
                expectArgs(command, rest, 1);
                yield new CliRequest("GET", resolve(baseUrl, todoPath(rest.get(0))), null);
            }
            case "update" -> {
                expectArgs(command, rest, 2);
                yield new CliRequest("PUT", resolve(baseUrl, todoPath(rest.get(0))),
                        toJson(new UpdateTodo(rest.get(1), completed)));
            }
            case "delete" -> {
                expectArgs(command, rest, 1);
                yield new CliRequest("DELETE", resolve(baseUrl, todoPath(rest.get(0))), null);
            }
            default -> throw new IllegalArgumentException("unknown command: " + command);
        };
    }

    /**
     * Keeps the scheme and authority of {@code baseUrl} and replaces its path.
     */
    static URI resolve(String baseUrl, String path) {
        String withScheme = baseUrl.contains("://") ? baseUrl : "http://" + baseUrl;
        URI base = URI.create(withScheme);
        if (base.getRawAuthority() == null) {
            throw new IllegalArgumentException("base URL has no host: " + baseUrl);
        }
        return URI.create(base.getScheme() + "://" + base.getRawAuthority() + path);
    }

    private static String todoPath(String id) {
        try {
            return TODOS_PATH + "/" + Long.parseLong(id);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("id must be an integer, got: " + id);
        }
    }

    private static void expectArgs(String command, List<String> args, int count) {
        if (args.size() != count) {
            throw new IllegalArgumentException(command + " takes " + count + " argument(s), got " + args.size());
        }
    }

    private static String toJson(Object payload) {
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode request body", e);
        }
    }
}
