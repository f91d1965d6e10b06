package io.primemesh.transport;

import io.primemesh.model.ClusterMessage;
import io.primemesh.model.MessageReply;

import java.util.concurrent.CompletableFuture;

/**
 * Receives decoded inbound messages. The returned future completes once the
 * control loop has processed the message.
 */
@FunctionalInterface
public interface MessageDispatcher {
    CompletableFuture<MessageReply> dispatch(ClusterMessage message);
}
