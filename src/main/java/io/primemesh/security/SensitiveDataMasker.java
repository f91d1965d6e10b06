package io.primemesh.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.primemesh.util.Jsons;

import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Redacts credentials from cluster data before it is written to audit rows.
 *
 * <p>A field is redacted when its name looks like a credential, or when its
 * value is one of the secrets this masker was built with (the cluster identity
 * key, typically). Digests such as {@code identity_key_hash} are safe to
 * publish and pass through unchanged.
 */
public final class SensitiveDataMasker {
    public static final String REDACTED = "***";

    private static final Set<String> CREDENTIAL_NAMES = Set.of(
            "password", "passwd", "secret", "token", "authorization", "credential", "identitykey", "signingkey"
    );
    private static final Set<String> DIGEST_SUFFIXES = Set.of("hash", "digest", "fingerprint");

    private final Set<String> knownSecrets = new HashSet<>();

    public SensitiveDataMasker(String... secrets) {
        for (String secret : secrets) {
            if (secret != null && !secret.isBlank()) {
                knownSecrets.add(secret);
            }
        }
    }

    public JsonNode maskDetails(Map<String, ?> details) {
        ObjectNode out = JsonNodeFactory.instance.objectNode();
        if (details == null) {
            return out;
        }
        for (Map.Entry<String, ?> entry : details.entrySet()) {
            out.set(entry.getKey(), maskField(entry.getKey(), toNode(entry.getValue())));
        }
        return out;
    }

    /**
     * True for names like {@code identity_key} or {@code Authorization}, false
     * for digests of them.
     */
    public static boolean isCredentialName(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        String normalized = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        for (String suffix : DIGEST_SUFFIXES) {
            if (normalized.endsWith(suffix)) {
                return false;
            }
        }
        for (String credential : CREDENTIAL_NAMES) {
            if (normalized.contains(credential)) {
                return true;
            }
        }
        return false;
    }

    private JsonNode maskField(String name, JsonNode value) {
        if (isCredentialName(name)) {
            return TextNode.valueOf(REDACTED);
        }
        return maskValue(value);
    }

    private JsonNode maskValue(JsonNode value) {
        if (value.isTextual() && knownSecrets.contains(value.asText())) {
            return TextNode.valueOf(REDACTED);
        }
        if (value.isObject()) {
            ObjectNode out = JsonNodeFactory.instance.objectNode();
            value.fields().forEachRemaining(field -> out.set(field.getKey(), maskField(field.getKey(), field.getValue())));
            return out;
        }
        if (value.isArray()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode();
            value.forEach(item -> out.add(maskValue(item)));
            return out;
        }
        return value;
    }

    private static JsonNode toNode(Object value) {
        if (value == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        return Jsons.mapper().valueToTree(value);
    }
}
