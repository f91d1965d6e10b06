package io.primemesh.store;

import java.util.Locale;

/**
 * Builds the namespaced physical keys shared by every backend:
 * {@code primemesh:<namespace>:<kind>:<key>}.
 */
final class StoreKeys {
    static final String CONTEXT_PREFIX = "context:";

    private StoreKeys() {
    }

    static String data(String namespace, String key) {
        return physical(namespace, "data", key);
    }

    static String queue(String namespace, String queue) {
        return physical(namespace, "queue", queue);
    }

    private static String physical(String namespace, String kind, String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Store " + kind + " key must not be blank");
        }
        String ns = namespace == null || namespace.isBlank() ? "default" : namespace.trim().toLowerCase(Locale.ROOT);
        return "primemesh:" + ns + ":" + kind + ":" + key;
    }
}
