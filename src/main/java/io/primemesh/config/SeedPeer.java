package io.primemesh.config;

/**
 * Statically configured cluster peer, written as {@code nodeId@host:port}.
 */
public record SeedPeer(String nodeId, String host, int port) {

    public SeedPeer {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("Seed peer node id must not be blank");
        }
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Seed peer host must not be blank: " + nodeId);
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid seed peer port: " + port);
        }
    }

    public static SeedPeer parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Seed peer must not be blank");
        }
        String value = raw.trim();
        int at = value.indexOf('@');
        int colon = value.lastIndexOf(':');
        if (at <= 0 || colon <= at + 1 || colon == value.length() - 1) {
            throw new IllegalArgumentException("Seed peer must look like nodeId@host:port, got: " + raw);
        }
        int port;
        try {
            port = Integer.parseInt(value.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid seed peer port in: " + raw, e);
        }
        return new SeedPeer(value.substring(0, at), value.substring(at + 1, colon), port);
    }

    @Override
    public String toString() {
        return nodeId + "@" + host + ":" + port;
    }
}
