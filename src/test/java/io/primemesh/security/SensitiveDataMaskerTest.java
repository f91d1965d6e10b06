package io.primemesh.security;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class SensitiveDataMaskerTest {

    @Test
    void redactsCredentialNamesButKeepsDigests() {
        Assertions.assertTrue(SensitiveDataMasker.isCredentialName("identity_key"));
        Assertions.assertTrue(SensitiveDataMasker.isCredentialName("X-Auth-Token"));
        Assertions.assertTrue(SensitiveDataMasker.isCredentialName("Authorization"));
        Assertions.assertFalse(SensitiveDataMasker.isCredentialName("identity_key_hash"));
        Assertions.assertFalse(SensitiveDataMasker.isCredentialName("leader_id"));
        Assertions.assertFalse(SensitiveDataMasker.isCredentialName(null));
    }

    @Test
    void redactsKnownSecretValuesAnywhere() {
        SensitiveDataMasker masker = new SensitiveDataMasker("cluster-key-123", " ", null);

        JsonNode masked = masker.maskDetails(Map.of(
                "note", "cluster-key-123",
                "peers", List.of("b", "cluster-key-123"),
                "nested", Map.of("password", "hunter2", "port", 8766)
        ));

        Assertions.assertEquals(SensitiveDataMasker.REDACTED, masked.path("note").asText());
        Assertions.assertEquals("b", masked.path("peers").get(0).asText());
        Assertions.assertEquals(SensitiveDataMasker.REDACTED, masked.path("peers").get(1).asText());
        Assertions.assertEquals(SensitiveDataMasker.REDACTED, masked.path("nested").path("password").asText());
        Assertions.assertEquals(8766, masked.path("nested").path("port").asInt());
        Assertions.assertTrue(masker.maskDetails(null).isEmpty());
    }
}
