package io.primemesh.observability;

import io.primemesh.cluster.OrchestratorStats;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

final class PrometheusFormatterTest {

    @Test
    void rendersClusterGauges() {
        OrchestratorStats stats = new OrchestratorStats("a", "leader", 7, true, 2, 1, 40, 3, 2, 1, false);

        String text = PrometheusFormatter.format(stats);

        Assertions.assertTrue(text.contains("# TYPE primemesh_current_term gauge\nprimemesh_current_term 7\n"));
        Assertions.assertTrue(text.contains("primemesh_is_leader 1\n"));
        Assertions.assertTrue(text.contains("primemesh_node_state{state=\"leader\"} 1\n"));
        Assertions.assertTrue(text.contains("primemesh_node_state{state=\"follower\"} 0\n"));
        Assertions.assertTrue(text.contains("primemesh_nodes_total{health=\"healthy\"} 2\n"));
        Assertions.assertTrue(text.contains("primemesh_nodes_total{health=\"unhealthy\"} 1\n"));
        Assertions.assertTrue(text.contains("primemesh_messages_handled_total 40\n"));
        Assertions.assertTrue(text.contains("primemesh_transport_errors_total 3\n"));
        Assertions.assertTrue(text.contains("primemesh_endpoint_degraded 0\n"));
        Assertions.assertEquals(text.indexOf("# HELP primemesh_node_state "),
                text.lastIndexOf("# HELP primemesh_node_state "));
        Assertions.assertFalse(text.contains("primemesh_node_inflight_requests"));
    }

    @Test
    void appendsPerNodeLoadsWithEscapedLabels() {
        OrchestratorStats stats = new OrchestratorStats("a", "follower", 1, false, 1, 0, 0, 0, 0, 0, true);
        Map<String, Integer> loads = new LinkedHashMap<>();
        loads.put("a", 2);
        loads.put("odd\"id", 1);

        String text = PrometheusFormatter.format(stats, loads);

        Assertions.assertTrue(text.contains("primemesh_is_leader 0\n"));
        Assertions.assertTrue(text.contains("primemesh_endpoint_degraded 1\n"));
        Assertions.assertTrue(text.contains("primemesh_node_inflight_requests{node_id=\"a\"} 2\n"));
        Assertions.assertTrue(text.contains("primemesh_node_inflight_requests{node_id=\"odd\\\"id\"} 1\n"));
    }
}
