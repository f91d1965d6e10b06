package io.primemesh.cluster;

import io.primemesh.model.ClusterMessage;
import io.primemesh.model.MessageReply;

import java.util.concurrent.CompletableFuture;

record InboundMessage(ClusterMessage message, CompletableFuture<MessageReply> reply) {
}
