package io.agenthub.spring.boot;

import io.agenthub.AgentHub;
import io.agenthub.http.HttpAuditReporter;
import io.agenthub.http.HttpChainRegistrar;
import io.agenthub.http.HttpPermissionInitializer;
import io.agenthub.http.MatrixChannelClient;
import io.agenthub.jdbc.RecordStores;
import io.agenthub.jdbc.StorageSettings;
import io.agenthub.spi.AuditReporter;
import io.agenthub.spi.ChainRegistrar;
import io.agenthub.spi.ChannelProvisioner;
import io.agenthub.spi.ChannelSender;
import io.agenthub.spi.MetricsExporter;
import io.agenthub.spi.PermissionInitializer;
import io.agenthub.spi.RecordStore;
import io.agenthub.util.ExponentialBackoffRetryPolicy;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.AnyNestedCondition;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;

import javax.sql.DataSource;
import java.nio.file.Path;

/**
 * Auto-configuration for the hub.
 *
 * <p>Picks the storage backend from {@code agenthub.storage.backend}, creates HTTP
 * collaborators for every endpoint that is configured, and wires an {@link AgentHub}.
 * Application beans of the collaborator SPI types replace the HTTP clients.
 *
 * @see AgentHubProperties
 * @see AgentHubMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(AgentHub.class)
@EnableConfigurationProperties(AgentHubProperties.class)
public class AgentHubAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public StorageSettings agentHubStorageSettings(AgentHubProperties props,
                                                   ObjectProvider<DataSource> dataSourceProvider) {
        AgentHubProperties.Storage storage = props.getStorage();
        return switch (storage.getBackend()) {
            case MEMORY -> new StorageSettings.Memory();
            case EMBEDDED_FILE -> new StorageSettings.EmbeddedFile(Path.of(storage.getEmbeddedPath()));
            case MYSQL -> new StorageSettings.MySql(requireDataSource(dataSourceProvider, storage));
            case POSTGRESQL -> new StorageSettings.Postgres(requireDataSource(dataSourceProvider, storage));
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public RecordStore agentHubRecordStore(StorageSettings settings, AgentHubProperties props) {
        return RecordStores.open(settings, props.getStorage().getTableName());
    }

    @Bean
    @ConditionalOnMissingBean({ChannelProvisioner.class, ChannelSender.class})
    @ConditionalOnProperty(prefix = "agenthub.matrix", name = "homeserver")
    public MatrixChannelClient matrixChannelClient(AgentHubProperties props) {
        AgentHubProperties.Matrix matrix = props.getMatrix();
        return new MatrixChannelClient(matrix.getHomeserver(), matrix.getAccessToken(), matrix.getTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "agenthub.chain", name = "url")
    public ChainRegistrar chainRegistrar(AgentHubProperties props) {
        AgentHubProperties.Chain chain = props.getChain();
        return new HttpChainRegistrar(chain.getUrl(), chain.getDidNamespace(), chain.getTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    @Conditional(OnAuditEndpoint.class)
    public AuditReporter auditReporter(AgentHubProperties props) {
        AgentHubProperties.Audit audit = props.getAudit();
        return new HttpAuditReporter(audit.getMessageUrl(), audit.getApprovalUrl(), audit.getTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "agenthub.permission", name = "url")
    public PermissionInitializer permissionInitializer(AgentHubProperties props) {
        AgentHubProperties.Permission permission = props.getPermission();
        return new HttpPermissionInitializer(permission.getUrl(), permission.getTimeout());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public AgentHub agentHub(AgentHubProperties props,
                             RecordStore store,
                             ObjectProvider<ChannelProvisioner> provisionerProvider,
                             ObjectProvider<ChannelSender> senderProvider,
                             ObjectProvider<ChainRegistrar> chainProvider,
                             ObjectProvider<AuditReporter> auditProvider,
                             ObjectProvider<PermissionInitializer> permissionProvider,
                             ObjectProvider<MetricsExporter> metricsProvider) {
        ChannelProvisioner provisioner = provisionerProvider.getIfAvailable();
        ChannelSender sender = senderProvider.getIfAvailable();
        if (provisioner == null || sender == null) {
            throw new IllegalStateException(
                "agenthub.matrix.homeserver must be set, or ChannelProvisioner and ChannelSender beans provided");
        }
        AgentHubProperties.Delivery delivery = props.getDelivery();
        AgentHub.Builder builder = AgentHub.builder()
            .store(store)
            .channelProvisioner(provisioner)
            .channelSender(sender)
            .chainRegistrar(chainProvider.getIfAvailable())
            .auditReporter(auditProvider.getIfAvailable())
            .permissionInitializer(permissionProvider.getIfAvailable())
            .roomPolicy(props.getRoom().getPolicy())
            .roomProvisioningTimeout(props.getRoom().getProvisioningTimeout())
            .deliveryRetryPolicy(new ExponentialBackoffRetryPolicy(delivery.getBaseDelayMs(), delivery.getMaxDelayMs()))
            .deliveryMaxAttempts(delivery.getMaxAttempts())
            .sendTimeout(delivery.getSendTimeout())
            .maxDidAttempts(props.getChain().getMaxDidAttempts())
            .storeMaxAttempts(props.getStorage().getMaxAttempts())
            .presenceOfflineThreshold(props.getPresence().getOfflineThreshold())
            .matrixHomeserver(props.getMatrix().getHomeserver())
            .apiBase(props.getApiBase());
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        return builder.build();
    }

    static class OnAuditEndpoint extends AnyNestedCondition {
        OnAuditEndpoint() {
            super(ConfigurationPhase.REGISTER_BEAN);
        }

        @ConditionalOnProperty(prefix = "agenthub.audit", name = "message-url")
        static class MessageUrl {
        }

        @ConditionalOnProperty(prefix = "agenthub.audit", name = "approval-url")
        static class ApprovalUrl {
        }
    }

    private static DataSource requireDataSource(ObjectProvider<DataSource> provider,
                                                AgentHubProperties.Storage storage) {
        DataSource dataSource = provider.getIfAvailable();
        if (dataSource == null) {
            throw new IllegalStateException("agenthub.storage.backend=" + storage.getBackend()
                + " requires a DataSource (configure spring.datasource.url)");
        }
        return dataSource;
    }
}
