package io.arrconf.plugin.dummy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.arrconf.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process stand-in for a dummy instance, bound to an ephemeral loopback port.
 */
final class FakeDummyServer implements AutoCloseable {
    final String instanceId;
    final String apiKey;
    final List<String> requests = Collections.synchronizedList(new ArrayList<>());

    volatile boolean initialized;
    final ObjectNode settings = Jsons.mapper().createObjectNode();
    final ArrayNode tags = Jsons.mapper().createArrayNode();

    private final AtomicInteger nextTagId = new AtomicInteger(1);
    private final HttpServer server;

    FakeDummyServer(String name) throws IOException {
        this.instanceId = "id-" + name;
        this.apiKey = "key-" + name;
        settings.put("instanceName", "Dummy");
        settings.put("logLevel", 2);
        settings.put("enableSsl", false);
        settings.putNull("upstreamId");
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/api/v1/", this::handle);
        server.start();
    }

    int port() {
        return server.getAddress().getPort();
    }

    synchronized void addTag(int id, String label) {
        ObjectNode tag = tags.addObject();
        tag.put("id", id);
        tag.put("label", label);
        nextTagId.set(Math.max(nextTagId.get(), id + 1));
    }

    synchronized List<String> tagLabels() {
        List<String> labels = new ArrayList<>();
        tags.forEach(tag -> labels.add(tag.path("label").asText()));
        return labels;
    }

    long count(String prefix) {
        synchronized (requests) {
            return requests.stream().filter(r -> r.startsWith(prefix)).count();
        }
    }

    private void handle(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        String path = exchange.getRequestURI().getPath();
        JsonNode body;
        try (InputStream in = exchange.getRequestBody()) {
            byte[] raw = in.readAllBytes();
            body = raw.length == 0 ? null : Jsons.mapper().readTree(raw);
        }
        requests.add(method + " " + path);

        if (path.equals("/api/v1/initialize")) {
            if (method.equals("GET")) {
                ObjectNode state = Jsons.mapper().createObjectNode();
                state.put("initialized", initialized);
                state.put("apiKey", apiKey);
                respond(exchange, 200, state);
            } else {
                initialized = true;
                respond(exchange, 204, null);
            }
            return;
        }
        if (!apiKey.equals(exchange.getRequestHeaders().getFirst("X-Api-Key"))) {
            respond(exchange, 401, null);
            return;
        }
        synchronized (this) {
            if (path.equals("/api/v1/status") && method.equals("GET")) {
                ObjectNode status = Jsons.mapper().createObjectNode();
                status.put("instanceId", instanceId);
                respond(exchange, 200, status);
            } else if (path.equals("/api/v1/settings") && method.equals("GET")) {
                respond(exchange, 200, settings);
            } else if (path.equals("/api/v1/settings") && method.equals("PUT")) {
                settings.setAll((ObjectNode) body);
                respond(exchange, 200, settings);
            } else if (path.equals("/api/v1/tag") && method.equals("GET")) {
                respond(exchange, 200, tags);
            } else if (path.equals("/api/v1/tag") && method.equals("POST")) {
                for (JsonNode label : body.path("labels")) {
                    addTag(nextTagId.get(), label.asText());
                }
                respond(exchange, 201, tags);
            } else if (path.startsWith("/api/v1/tag/") && method.equals("DELETE")) {
                String id = path.substring("/api/v1/tag/".length());
                Iterator<JsonNode> it = tags.elements();
                boolean removed = false;
                while (it.hasNext()) {
                    if (it.next().path("id").asText().equals(id)) {
                        it.remove();
                        removed = true;
                    }
                }
                respond(exchange, removed ? 204 : 404, null);
            } else {
                respond(exchange, 404, null);
            }
        }
    }

    private static void respond(HttpExchange exchange, int status, JsonNode body) throws IOException {
        if (body == null) {
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
            return;
        }
        byte[] bytes = Jsons.toCompactJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Override
    public void close() {
        server.stop(0);
    }
}
