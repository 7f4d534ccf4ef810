package io.agenthub.spring.boot;

import io.agenthub.room.RoomPolicy;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentHubPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(AgentHubProperties.class);
            assertEquals(AgentHubProperties.Backend.MEMORY, props.getStorage().getBackend());
            assertEquals("./data/agenthub", props.getStorage().getEmbeddedPath());
            assertEquals("agenthub_record", props.getStorage().getTableName());
            assertEquals(3, props.getStorage().getMaxAttempts());
            assertEquals(RoomPolicy.DEDICATED, props.getRoom().getPolicy());
            assertEquals(Duration.ofSeconds(30), props.getRoom().getProvisioningTimeout());
            assertEquals(5, props.getDelivery().getMaxAttempts());
            assertEquals(Duration.ofSeconds(10), props.getDelivery().getSendTimeout());
            assertEquals(200, props.getDelivery().getBaseDelayMs());
            assertEquals(10000, props.getDelivery().getMaxDelayMs());
            assertNull(props.getMatrix().getHomeserver());
            assertNull(props.getChain().getUrl());
            assertEquals("agenthub", props.getChain().getDidNamespace());
            assertEquals(5, props.getChain().getMaxDidAttempts());
            assertNull(props.getAudit().getMessageUrl());
            assertEquals(Duration.ofSeconds(120), props.getPresence().getOfflineThreshold());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("agenthub", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "agenthub.api-base=https://hub.example.com/api/v1",
                "agenthub.storage.backend=postgresql",
                "agenthub.storage.table-name=hub_records",
                "agenthub.storage.max-attempts=1",
                "agenthub.room.policy=shared",
                "agenthub.room.provisioning-timeout=PT1M",
                "agenthub.delivery.max-attempts=3",
                "agenthub.delivery.send-timeout=2s",
                "agenthub.matrix.homeserver=https://matrix.example.com",
                "agenthub.matrix.access-token=secret",
                "agenthub.chain.url=http://chain:8080",
                "agenthub.chain.did-namespace=acme",
                "agenthub.audit.approval-url=http://audit/approvals",
                "agenthub.presence.offline-threshold=PT30S",
                "agenthub.metrics.enabled=false",
                "agenthub.metrics.name-prefix=tenant_a.agenthub"
        ).run(ctx -> {
            var props = ctx.getBean(AgentHubProperties.class);
            assertEquals("https://hub.example.com/api/v1", props.getApiBase());
            assertEquals(AgentHubProperties.Backend.POSTGRESQL, props.getStorage().getBackend());
            assertEquals("hub_records", props.getStorage().getTableName());
            assertEquals(1, props.getStorage().getMaxAttempts());
            assertEquals(RoomPolicy.SHARED, props.getRoom().getPolicy());
            assertEquals(Duration.ofMinutes(1), props.getRoom().getProvisioningTimeout());
            assertEquals(3, props.getDelivery().getMaxAttempts());
            assertEquals(Duration.ofSeconds(2), props.getDelivery().getSendTimeout());
            assertEquals("https://matrix.example.com", props.getMatrix().getHomeserver());
            assertEquals("secret", props.getMatrix().getAccessToken());
            assertEquals("http://chain:8080", props.getChain().getUrl());
            assertEquals("acme", props.getChain().getDidNamespace());
            assertEquals("http://audit/approvals", props.getAudit().getApprovalUrl());
            assertEquals(Duration.ofSeconds(30), props.getPresence().getOfflineThreshold());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("tenant_a.agenthub", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(AgentHubProperties.class)
    static class PropsConfig {
    }
}
