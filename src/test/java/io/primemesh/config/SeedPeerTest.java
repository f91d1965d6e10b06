package io.primemesh.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class SeedPeerTest {

    @Test
    void parsesNodeHostAndPort() {
        SeedPeer peer = SeedPeer.parse(" node-2@10.0.0.2:8766 ");
        Assertions.assertEquals("node-2", peer.nodeId());
        Assertions.assertEquals("10.0.0.2", peer.host());
        Assertions.assertEquals(8766, peer.port());
        Assertions.assertEquals("node-2@10.0.0.2:8766", peer.toString());
    }

    @Test
    void rejectsMalformedPeers() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> SeedPeer.parse("10.0.0.2:8766"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> SeedPeer.parse("node-2@10.0.0.2"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> SeedPeer.parse("node-2@10.0.0.2:"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> SeedPeer.parse("node-2@10.0.0.2:http"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> SeedPeer.parse("node-2@10.0.0.2:0"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> SeedPeer.parse(""));
    }
}
