package io.primemesh.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageReply(
        @JsonProperty("status") String status,
        @JsonProperty("vote_granted") Boolean voteGranted
) {
    public static final String OK = "ok";
    public static final String UNKNOWN_MESSAGE_TYPE = "unknown_message_type";
    public static final String INVALID_MESSAGE = "invalid_message";
    public static final String BUSY = "busy";

    public static MessageReply ok() {
        return new MessageReply(OK, null);
    }

    public static MessageReply unknownMessageType() {
        return new MessageReply(UNKNOWN_MESSAGE_TYPE, null);
    }

    public static MessageReply invalidMessage() {
        return new MessageReply(INVALID_MESSAGE, null);
    }

    public static MessageReply busy() {
        return new MessageReply(BUSY, null);
    }

    public static MessageReply vote(boolean granted) {
        return new MessageReply(null, granted);
    }

    public boolean granted() {
        return Boolean.TRUE.equals(voteGranted);
    }
}
