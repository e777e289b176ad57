package com.podcast.bus.config;

import java.util.UUID;

/**
 * Builds consumer names using a strict, deterministic convention.
 *
 * <h2>Base format</h2>
 * <pre>
 * &lt;service&gt;_&lt;node&gt;
 * </pre>
 *
 * <h2>Ephemeral format</h2>
 * <pre>
 * &lt;service&gt;_&lt;node&gt;_&lt;8 hex chars&gt;
 * </pre>
 *
 * <p>A fixed name is what lets a restarted instance find its own pending entries again. Ephemeral
 * names never resume; their leftovers are picked up by another consumer's reclaim sweep after the
 * visibility timeout.</p>
 *
 * <p>Keep the format stable: changing it orphans the pending entries of running deployments.</p>
 */
public final class ConsumerName {

    private ConsumerName() {}

    public static String of(String service, String node) {
        return require(service, "service") + "_" + require(node, "node");
    }

    public static String ephemeral(String service, String node) {
        return of(service, node) + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    /**
     * Resolves the name for this instance: explicit {@code consumer-name} first, then the identity mode.
     */
    public static String resolve(EventBusProperties props) {
        String explicit = props.getConsumerName();
        if (explicit != null && !explicit.isBlank()) {
            return explicit.trim();
        }
        return props.getIdentityMode() == EventBusProperties.IdentityMode.EPHEMERAL
                ? ephemeral(props.getService(), props.getNodeId())
                : of(props.getService(), props.getNodeId());
    }

    private static String require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required for the consumer name");
        }
        return value.trim();
    }
}
