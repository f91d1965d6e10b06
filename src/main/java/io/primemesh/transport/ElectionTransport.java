package io.primemesh.transport;

import io.primemesh.model.ClusterMessage;
import io.primemesh.model.ClusterNode;
import io.primemesh.model.MessageReply;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound half of the cluster channel. Sends never block the caller; failures
 * complete the future exceptionally.
 */
public interface ElectionTransport extends AutoCloseable {
    CompletableFuture<MessageReply> send(ClusterNode target, ClusterMessage message);

    @Override
    void close();
}
