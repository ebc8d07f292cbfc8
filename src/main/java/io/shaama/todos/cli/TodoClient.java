package io.shaama.todos.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.PrintStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

public class TodoClient {

    private static final String JSON = "application/json";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final PrintStream out;
    private final PrintStream err;

    public TodoClient(HttpClient httpClient, ObjectMapper objectMapper, PrintStream out, PrintStream err) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.out = out;
        this.err = err;
    }

    public int send(CliRequest request) throws TodoClientException {
        HttpRequest httpRequest = HttpRequest.newBuilder(request.uri())
                .header("Content-Type", JSON)
                .method(request.method(), request.body() == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(request.body()))
                .build();

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new TodoClientException(request.method() + " " + request.uri() + " failed: " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TodoClientException("Interrupted while waiting for " + request.uri(), e);
        }

        String body = decodeUtf8(response.body());
        Optional<String> contentType = response.headers().firstValue("Content-Type");

        err.println("Status: " + response.statusCode());
        contentType.ifPresent(value -> err.println("Content-Type: " + value));

        if (contentType.map(value -> value.startsWith(JSON)).orElse(false) && !body.isBlank()) {
            out.println(prettyPrint(body));
        } else {
            out.println(body);
        }
        return response.statusCode();
    }

    String prettyPrint(String json) throws TodoClientException {
        try {
            JsonNode tree = objectMapper.readTree(json);
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new TodoClientException("Malformed JSON response body: " + e.getOriginalMessage(), e);
        }
    }

    static String decodeUtf8(byte[] bytes) throws TodoClientException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new TodoClientException("Response body is not valid UTF-8", e);
        }
    }

    private static String describe(IOException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
