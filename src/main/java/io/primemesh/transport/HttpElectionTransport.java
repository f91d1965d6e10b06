package io.primemesh.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.primemesh.model.ClusterMessage;
import io.primemesh.model.ClusterNode;
import io.primemesh.model.MessageReply;
import io.primemesh.util.Jsons;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Posts cluster messages as JSON to {@code http://<address>:<port>/cluster/message}.
 */
public final class HttpElectionTransport implements ElectionTransport {
    public static final String MESSAGE_PATH = "/cluster/message";

    private final Duration requestTimeout;
    private final ExecutorService executor;
    private final HttpClient http;

    public HttpElectionTransport(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        AtomicInteger threads = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "primemesh-transport-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.http = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .executor(executor)
                .build();
    }

    @Override
    public CompletableFuture<MessageReply> send(ClusterNode target, ClusterMessage message) {
        URI uri;
        try {
            uri = URI.create("http://" + hostLiteral(target.address()) + ":" + target.port() + MESSAGE_PATH);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(
                    new ClusterTransportException(target.nodeId(), "Invalid peer address: " + target.address(), e));
        }
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(message), StandardCharsets.UTF_8))
                .build();
        return http.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .thenApply(response -> decode(target, response));
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static MessageReply decode(ClusterNode target, HttpResponse<String> response) {
        if (response.statusCode() / 100 != 2) {
            throw new ClusterTransportException(target.nodeId(),
                    "Peer " + target.nodeId() + " replied status=" + response.statusCode());
        }
        try {
            return Jsons.mapper().readValue(response.body(), MessageReply.class);
        } catch (JsonProcessingException e) {
            throw new ClusterTransportException(target.nodeId(), "Unreadable reply from " + target.nodeId(), e);
        }
    }

    private static String hostLiteral(String address) {
        return address.indexOf(':') >= 0 && !address.startsWith("[") ? "[" + address + "]" : address;
    }
}
