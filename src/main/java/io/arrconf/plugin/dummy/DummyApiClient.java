package io.arrconf.plugin.dummy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.arrconf.plugin.RemoteApiException;
import io.arrconf.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

final class DummyApiClient {
    static final String API_KEY_HEADER = "X-Api-Key";

    private static final Logger log = LoggerFactory.getLogger(DummyApiClient.class);
    private static final HttpClient HTTP = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();

    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;

    DummyApiClient(String baseUrl, String apiKey, Duration timeout) {
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.timeout = timeout;
    }

    JsonNode get(String path) {
        return send("GET", path, null);
    }

    JsonNode post(String path, JsonNode body) {
        return send("POST", path, body);
    }

    JsonNode put(String path, JsonNode body) {
        return send("PUT", path, body);
    }

    void delete(String path) {
        send("DELETE", path, null);
    }

    private JsonNode send(String method, String path, JsonNode body) {
        String url = baseUrl + "/" + (path.startsWith("/") ? path.substring(1) : path);
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .header("Accept", "application/json");
        if (apiKey != null) {
            request.header(API_KEY_HEADER, apiKey);
        }
        if (body != null) {
            request.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(body), StandardCharsets.UTF_8));
            log.debug("{} {} <- {}", method, url, Jsons.toCompactJson(body));
        } else {
            request.method(method, HttpRequest.BodyPublishers.noBody());
            log.debug("{} {}", method, url);
        }

        HttpResponse<String> response;
        try {
            response = HTTP.send(request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to reach " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while calling " + url, e);
        }
        int status = response.statusCode();
        log.debug("{} {} -> status_code={} res={}", method, url, status, response.body());
        if (status == 401 || status == 403) {
            throw new RemoteApiException("Unauthorized: " + method + " " + url, status);
        }
        if (status / 100 != 2) {
            throw new RemoteApiException(
                    "Unexpected response with error code " + status + " from " + method + " " + url + ": " + response.body(),
                    status
            );
        }
        String raw = response.body();
        if (raw == null || raw.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return Jsons.mapper().readTree(raw);
        } catch (JsonProcessingException e) {
            throw new RemoteApiException("Invalid JSON from " + method + " " + url + ": " + e.getOriginalMessage(), status, e);
        }
    }
}
