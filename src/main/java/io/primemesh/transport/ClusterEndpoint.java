package io.primemesh.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.primemesh.model.ClusterMessage;
import io.primemesh.model.MessageReply;
import io.primemesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Inbound HTTP surface of a node: {@code POST /cluster/message} for election
 * traffic plus read-only GET routes registered by the owner (status, health,
 * metrics).
 */
public final class ClusterEndpoint implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ClusterEndpoint.class);
    private static final int MAX_BODY_BYTES = 64 * 1024;

    private final HttpServer server;
    private final ExecutorService executor;
    private final Duration replyTimeout;
    private final MessageDispatcher dispatcher;
    private final Map<String, Route> routes = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    private ClusterEndpoint(HttpServer server, ExecutorService executor, Duration replyTimeout, MessageDispatcher dispatcher) {
        this.server = server;
        this.executor = executor;
        this.replyTimeout = replyTimeout;
        this.dispatcher = dispatcher;
    }

    /**
     * Binds and starts serving. Throws {@link IOException} when the address is
     * unavailable.
     */
    public static ClusterEndpoint bind(String address, int port, Duration replyTimeout, MessageDispatcher dispatcher)
            throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(address, port), 0);
        AtomicInteger threads = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(4, r -> {
            Thread t = new Thread(r, "primemesh-endpoint-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        ClusterEndpoint endpoint = new ClusterEndpoint(server, executor, replyTimeout, dispatcher);
        server.createContext(HttpElectionTransport.MESSAGE_PATH, endpoint::handleMessage);
        server.createContext("/", endpoint::handleRoute);
        server.setExecutor(executor);
        server.start();
        return endpoint;
    }

    public int boundPort() {
        return server.getAddress().getPort();
    }

    public void registerJson(String path, Supplier<Object> body) {
        routes.put(path, new Route("application/json; charset=utf-8", () -> Jsons.toJson(body.get())));
    }

    public void registerText(String path, String contentType, Supplier<String> body) {
        routes.put(path, new Route(contentType, body));
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        server.stop(0);
        executor.shutdownNow();
    }

    private void handleMessage(HttpExchange exchange) throws IOException {
        try (exchange) {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                writeJson(exchange, Map.of("status", "method_not_allowed"), 405);
                return;
            }
            ClusterMessage message;
            try {
                message = Jsons.mapper().readValue(readBody(exchange), ClusterMessage.class);
            } catch (JsonProcessingException e) {
                LOG.debug("Rejecting malformed cluster message from {}", exchange.getRemoteAddress(), e);
                writeJson(exchange, MessageReply.invalidMessage(), 400);
                return;
            }
            if (message == null) {
                writeJson(exchange, MessageReply.invalidMessage(), 400);
                return;
            }
            CompletableFuture<MessageReply> pending = dispatcher.dispatch(message);
            MessageReply reply;
            try {
                reply = pending.get(replyTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                pending.cancel(false);
                LOG.warn("Control loop busy, no reply within {}ms type={}", replyTimeout.toMillis(), message.type());
                writeJson(exchange, MessageReply.busy(), 503);
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                writeJson(exchange, MessageReply.busy(), 503);
                return;
            } catch (ExecutionException e) {
                LOG.warn("Cluster message handling failed type={}", message.type(), e.getCause());
                writeJson(exchange, MessageReply.busy(), 503);
                return;
            }
            writeJson(exchange, reply, 200);
        }
    }

    private void handleRoute(HttpExchange exchange) throws IOException {
        try (exchange) {
            String path = exchange.getRequestURI().getPath();
            Route route = routes.get(path);
            if (route == null) {
                writeJson(exchange, Map.of("error", "not_found", "path", path), 404);
                return;
            }
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                writeJson(exchange, Map.of("error", "method_not_allowed"), 405);
                return;
            }
            String body;
            try {
                body = route.body().get();
            } catch (RuntimeException e) {
                LOG.warn("Status route failed path={}", path, e);
                writeJson(exchange, Map.of("error", "internal_error"), 500);
                return;
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", route.contentType());
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    private static String readBody(HttpExchange exchange) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            byte[] bytes = in.readNBytes(MAX_BODY_BYTES);
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toCompactJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private record Route(String contentType, Supplier<String> body) {
    }
}
