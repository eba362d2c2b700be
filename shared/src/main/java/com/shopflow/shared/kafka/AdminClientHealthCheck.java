package com.shopflow.shared.kafka;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.DescribeClusterOptions;
import org.apache.kafka.common.Node;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Checks the cluster with a metadata request (describeCluster).
 * The admin client is created lazily on the first check, so constructing this
 * while the broker is down never fails.
 */
@Slf4j
public class AdminClientHealthCheck implements BrokerHealthCheck {

    private final Map<String, Object> adminConfig;
    private volatile Admin admin;

    public AdminClientHealthCheck(String bootstrapServers, String clientId) {
        Map<String, Object> props = new HashMap<>();
        props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(AdminClientConfig.CLIENT_ID_CONFIG, clientId + "-health");
        props.put(AdminClientConfig.RECONNECT_BACKOFF_MAX_MS_CONFIG, 5000);
        this.adminConfig = props;
    }

    @Override
    public void verify(Duration timeout) throws Exception {
        Collection<Node> nodes = admin()
                .describeCluster(new DescribeClusterOptions().timeoutMs((int) timeout.toMillis()))
                .nodes()
                .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (nodes == null || nodes.isEmpty()) {
            throw new IllegalStateException("Broker reported no live nodes");
        }
        log.debug("Broker health check succeeded: nodes={}", nodes.size());
    }

    @Override
    public synchronized void close(Duration timeout) {
        if (admin != null) {
            admin.close(timeout);
            admin = null;
        }
    }

    private synchronized Admin admin() {
        if (admin == null) {
            admin = Admin.create(adminConfig);
        }
        return admin;
    }
}
