package io.primemesh.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Election and heartbeat message exchanged between orchestrators.
 *
 * <p>Only the fields of the given {@code type} are set. {@code address} and
 * {@code port} describe the sender's endpoint so receivers can register peers
 * they have not seen yet; {@code term} on a heartbeat lets a late joiner learn
 * the current leader.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClusterMessage(
        @JsonProperty("type") String type,
        @JsonProperty("node_id") String nodeId,
        @JsonProperty("candidate_id") String candidateId,
        @JsonProperty("leader_id") String leaderId,
        @JsonProperty("term") Long term,
        @JsonProperty("address") String address,
        @JsonProperty("port") Integer port
) {

    public static ClusterMessage heartbeat(String nodeId, Long term, String address, Integer port) {
        return new ClusterMessage(MessageType.HEARTBEAT.wireName(), nodeId, null, null, term, address, port);
    }

    public static ClusterMessage voteRequest(String candidateId, long term, String address, Integer port) {
        return new ClusterMessage(MessageType.VOTE_REQUEST.wireName(), null, candidateId, null, term, address, port);
    }

    public static ClusterMessage leaderAnnouncement(String leaderId, long term, String address, Integer port) {
        return new ClusterMessage(MessageType.LEADER_ANNOUNCEMENT.wireName(), null, null, leaderId, term, address, port);
    }

    @JsonIgnore
    public MessageType messageType() {
        return MessageType.fromWire(type);
    }

    /**
     * Node that sent the message, whichever field carries it for this type.
     */
    @JsonIgnore
    public String senderId() {
        return switch (messageType()) {
            case HEARTBEAT -> nodeId;
            case VOTE_REQUEST -> candidateId;
            case LEADER_ANNOUNCEMENT -> leaderId;
            case UNKNOWN -> nodeId;
        };
    }
}
