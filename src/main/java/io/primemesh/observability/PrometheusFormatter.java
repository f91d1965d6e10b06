package io.primemesh.observability;

import io.primemesh.cluster.OrchestratorStats;

import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(OrchestratorStats stats) {
        return format(stats, Map.of());
    }

    /**
     * Renders cluster gauges, plus one {@code primemesh_node_inflight_requests}
     * sample per entry of {@code nodeLoads} when routing data is attached.
     */
    public static String format(OrchestratorStats stats, Map<String, Integer> nodeLoads) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "primemesh_current_term", "Current election term", null, null, stats.currentTerm());
        appendGauge(sb, "primemesh_is_leader", "Whether this node is the prime instance (1=yes,0=no)", null, null,
                stats.leader() ? 1 : 0);
        appendGauge(sb, "primemesh_node_state", "Own election state (1 for the current state)", "state", "follower",
                "follower".equals(stats.state()) ? 1 : 0);
        appendGauge(sb, "primemesh_node_state", "Own election state (1 for the current state)", "state", "candidate",
                "candidate".equals(stats.state()) ? 1 : 0);
        appendGauge(sb, "primemesh_node_state", "Own election state (1 for the current state)", "state", "leader",
                "leader".equals(stats.state()) ? 1 : 0);
        appendGauge(sb, "primemesh_node_state", "Own election state (1 for the current state)", "state", "disconnected",
                "disconnected".equals(stats.state()) ? 1 : 0);
        appendGauge(sb, "primemesh_nodes_total", "Known cluster members grouped by health", "health", "healthy",
                stats.healthyNodes());
        appendGauge(sb, "primemesh_nodes_total", "Known cluster members grouped by health", "health", "unhealthy",
                stats.unhealthyNodes());
        appendGauge(sb, "primemesh_messages_handled_total", "Inbound cluster messages handled", null, null,
                stats.messagesHandled());
        appendGauge(sb, "primemesh_transport_errors_total", "Outbound cluster message failures", null, null,
                stats.transportErrors());
        appendGauge(sb, "primemesh_elections_started_total", "Elections started by this node", null, null,
                stats.electionsStarted());
        appendGauge(sb, "primemesh_leader_changes_total", "Observed leader changes", null, null,
                stats.leaderChanges());
        appendGauge(sb, "primemesh_endpoint_degraded", "Inbound endpoint failed to bind (1=degraded,0=ok)", null, null,
                stats.degraded() ? 1 : 0);
        if (nodeLoads != null && !nodeLoads.isEmpty()) {
            appendMapGauge(sb, "primemesh_node_inflight_requests", "In-flight routed requests per node", "node_id", nodeLoads);
        }
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Integer> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Integer> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
