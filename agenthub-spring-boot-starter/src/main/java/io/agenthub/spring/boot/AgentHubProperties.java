package io.agenthub.spring.boot;

import io.agenthub.jdbc.TableNames;
import io.agenthub.room.RoomPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the hub.
 *
 * @see AgentHubAutoConfiguration
 */
@ConfigurationProperties(prefix = "agenthub")
public class AgentHubProperties {

    /**
     * Base URL of this hub's HTTP API, advertised in the discovery document.
     */
    private String apiBase;

    private final Storage storage = new Storage();
    private final Room room = new Room();
    private final Delivery delivery = new Delivery();
    private final Matrix matrix = new Matrix();
    private final Chain chain = new Chain();
    private final Audit audit = new Audit();
    private final Permission permission = new Permission();
    private final Presence presence = new Presence();
    private final Metrics metrics = new Metrics();

    public String getApiBase() {
        return apiBase;
    }

    public void setApiBase(String apiBase) {
        this.apiBase = apiBase;
    }

    public Storage getStorage() {
        return storage;
    }

    public Room getRoom() {
        return room;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public Matrix getMatrix() {
        return matrix;
    }

    public Chain getChain() {
        return chain;
    }

    public Audit getAudit() {
        return audit;
    }

    public Permission getPermission() {
        return permission;
    }

    public Presence getPresence() {
        return presence;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum Backend {
        MEMORY,
        EMBEDDED_FILE,
        MYSQL,
        POSTGRESQL
    }

    public static class Storage {
        private Backend backend = Backend.MEMORY;
        /**
         * Database file of the EMBEDDED_FILE backend, without the {@code .mv.db} suffix.
         */
        private String embeddedPath = "./data/agenthub";
        private String tableName = TableNames.DEFAULT_TABLE;
        /**
         * Attempts per store operation when the database is unavailable.
         */
        private int maxAttempts = 3;

        public Backend getBackend() {
            return backend;
        }

        public void setBackend(Backend backend) {
            this.backend = backend;
        }

        public String getEmbeddedPath() {
            return embeddedPath;
        }

        public void setEmbeddedPath(String embeddedPath) {
            this.embeddedPath = embeddedPath;
        }

        public String getTableName() {
            return tableName;
        }

        public void setTableName(String tableName) {
            this.tableName = tableName;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    public static class Room {
        private RoomPolicy policy = RoomPolicy.DEDICATED;
        private Duration provisioningTimeout = Duration.ofSeconds(30);

        public RoomPolicy getPolicy() {
            return policy;
        }

        public void setPolicy(RoomPolicy policy) {
            this.policy = policy;
        }

        public Duration getProvisioningTimeout() {
            return provisioningTimeout;
        }

        public void setProvisioningTimeout(Duration provisioningTimeout) {
            this.provisioningTimeout = provisioningTimeout;
        }
    }

    public static class Delivery {
        private int maxAttempts = 5;
        private Duration sendTimeout = Duration.ofSeconds(10);
        private long baseDelayMs = 200;
        private long maxDelayMs = 10000;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getSendTimeout() {
            return sendTimeout;
        }

        public void setSendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Matrix {
        /**
         * Homeserver base URL. The Matrix client is only created when this is set.
         */
        private String homeserver;
        private String accessToken;
        private Duration timeout = Duration.ofSeconds(10);

        public String getHomeserver() {
            return homeserver;
        }

        public void setHomeserver(String homeserver) {
            this.homeserver = homeserver;
        }

        public String getAccessToken() {
            return accessToken;
        }

        public void setAccessToken(String accessToken) {
            this.accessToken = accessToken;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Chain {
        private String url;
        private String didNamespace = "agenthub";
        private Duration timeout = Duration.ofSeconds(5);
        private int maxDidAttempts = 5;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getDidNamespace() {
            return didNamespace;
        }

        public void setDidNamespace(String didNamespace) {
            this.didNamespace = didNamespace;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getMaxDidAttempts() {
            return maxDidAttempts;
        }

        public void setMaxDidAttempts(int maxDidAttempts) {
            this.maxDidAttempts = maxDidAttempts;
        }
    }

    public static class Audit {
        private String messageUrl;
        private String approvalUrl;
        private Duration timeout = Duration.ofSeconds(5);

        public String getMessageUrl() {
            return messageUrl;
        }

        public void setMessageUrl(String messageUrl) {
            this.messageUrl = messageUrl;
        }

        public String getApprovalUrl() {
            return approvalUrl;
        }

        public void setApprovalUrl(String approvalUrl) {
            this.approvalUrl = approvalUrl;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Permission {
        private String url;
        private Duration timeout = Duration.ofSeconds(5);

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Presence {
        private Duration offlineThreshold = Duration.ofSeconds(120);

        public Duration getOfflineThreshold() {
            return offlineThreshold;
        }

        public void setOfflineThreshold(Duration offlineThreshold) {
            this.offlineThreshold = offlineThreshold;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "agenthub";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
