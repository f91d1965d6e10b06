package io.primemesh.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class HashingTest {

    @Test
    void sha256MatchesKnownDigest() {
        Assertions.assertEquals(
                "2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824",
                Hashing.sha256Hex("hello")
        );
    }

    @Test
    void digestComparisonRejectsNullAndMismatch() {
        String digest = Hashing.sha256Hex("key");
        Assertions.assertTrue(Hashing.digestsEqual(digest, Hashing.sha256Hex("key")));
        Assertions.assertFalse(Hashing.digestsEqual(digest, Hashing.sha256Hex("other")));
        Assertions.assertFalse(Hashing.digestsEqual(null, digest));
    }

    @Test
    void hmacDependsOnSecret() {
        Assertions.assertNotEquals(Hashing.hmacSha256Hex("a", "row"), Hashing.hmacSha256Hex("b", "row"));
        Assertions.assertEquals(Hashing.hmacSha256Hex("a", "row"), Hashing.hmacSha256Hex("a", "row"));
    }
}
