package io.primemesh.transport;

public final class ClusterTransportException extends RuntimeException {
    private final String targetNodeId;

    public ClusterTransportException(String targetNodeId, String message) {
        super(message);
        this.targetNodeId = targetNodeId;
    }

    public ClusterTransportException(String targetNodeId, String message, Throwable cause) {
        super(message, cause);
        this.targetNodeId = targetNodeId;
    }

    public String targetNodeId() {
        return targetNodeId;
    }
}
