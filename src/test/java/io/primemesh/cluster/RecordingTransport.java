package io.primemesh.cluster;

import io.primemesh.model.ClusterMessage;
import io.primemesh.model.ClusterNode;
import io.primemesh.model.MessageReply;
import io.primemesh.transport.ElectionTransport;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;

/**
 * Transport double that records every send and answers through a replaceable
 * responder. The default responder never answers.
 */
final class RecordingTransport implements ElectionTransport {
    private final List<Sent> sent = new ArrayList<>();
    private BiFunction<ClusterNode, ClusterMessage, CompletableFuture<MessageReply>> responder =
            (target, message) -> new CompletableFuture<>();
    private boolean closed;

    @Override
    public synchronized CompletableFuture<MessageReply> send(ClusterNode target, ClusterMessage message) {
        sent.add(new Sent(target.nodeId(), message));
        return responder.apply(target, message);
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    synchronized void respondWith(BiFunction<ClusterNode, ClusterMessage, CompletableFuture<MessageReply>> responder) {
        this.responder = responder;
    }

    synchronized void grantAllVotes() {
        respondWith((target, message) -> CompletableFuture.completedFuture(
                "vote_request".equals(message.type()) ? MessageReply.vote(true) : MessageReply.ok()));
    }

    synchronized List<Sent> sent() {
        return List.copyOf(sent);
    }

    synchronized List<Sent> sentOfType(String type) {
        List<Sent> out = new ArrayList<>();
        for (Sent s : sent) {
            if (type.equals(s.message().type())) {
                out.add(s);
            }
        }
        return out;
    }

    synchronized void clear() {
        sent.clear();
    }

    synchronized boolean closed() {
        return closed;
    }

    record Sent(String targetNodeId, ClusterMessage message) {
    }
}
