package de.netcompliance.config;

import de.netcompliance.connector.PropertiesCredentialResolver;
import de.netcompliance.connector.TcpTransportProvider;
import de.netcompliance.core.audit.AuditOptions;
import de.netcompliance.core.audit.AuditOrchestrator;
import de.netcompliance.core.connector.ConnectorFactory;
import de.netcompliance.core.connector.CredentialResolver;
import de.netcompliance.core.connector.SessionRegistry;
import de.netcompliance.core.connector.TransportProvider;
import de.netcompliance.core.evaluation.RuleEvaluator;
import de.netcompliance.core.execution.ExecutionOptions;
import de.netcompliance.core.execution.WorkflowExecutor;
import de.netcompliance.core.execution.handler.NotificationDispatcher;
import de.netcompliance.core.execution.handler.StepHandlerRegistry;
import de.netcompliance.core.repository.DeviceInventory;
import de.netcompliance.core.repository.ResultStore;
import de.netcompliance.infrastructure.parsing.WorkflowParser;
import de.netcompliance.infrastructure.validation.ValidatorRegistry;
import de.netcompliance.notification.LoggingNotificationDispatcher;
import de.netcompliance.repository.InMemoryResultStore;
import de.netcompliance.repository.WorkflowCatalog;
import de.netcompliance.repository.YamlDeviceInventory;
import de.netcompliance.repository.YamlRuleRepository;
import de.netcompliance.repository.YamlWorkflowCatalog;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternUtils;

import java.io.IOException;
import java.time.Clock;
import java.util.Arrays;

/**
 * Wires the engine of the library with the collaborators of this application.
 */
@Configuration
@EnableConfigurationProperties(ComplianceProperties.class)
public class EngineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ValidatorRegistry validatorRegistry() {
        return new ValidatorRegistry();
    }

    @Bean
    public YamlDeviceInventory deviceInventory(final ComplianceProperties properties,
                                               final ResourceLoader resourceLoader,
                                               final Clock clock) throws IOException {
        var resource = resourceLoader.getResource(properties.getResources().getDevices());
        return new YamlDeviceInventory(resource.getInputStream(), clock);
    }

    @Bean
    public YamlRuleRepository ruleRepository(final ComplianceProperties properties,
                                             final ResourceLoader resourceLoader) throws IOException {
        var resource = resourceLoader.getResource(properties.getResources().getRules());
        return new YamlRuleRepository(resource.getInputStream());
    }

    @Bean
    public WorkflowParser workflowParser(final ValidatorRegistry validatorRegistry) {
        return new WorkflowParser(validatorRegistry);
    }

    @Bean
    public WorkflowCatalog workflowCatalog(final ComplianceProperties properties,
                                           final ResourceLoader resourceLoader,
                                           final WorkflowParser workflowParser) throws IOException {
        ResourcePatternResolver resolver = ResourcePatternUtils.getResourcePatternResolver(resourceLoader);
        var resources = resolver.getResources(properties.getResources().getWorkflows());
        return new YamlWorkflowCatalog(workflowParser, Arrays.asList(resources));
    }

    @Bean
    public InMemoryResultStore resultStore() {
        return new InMemoryResultStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public CredentialResolver credentialResolver(final ComplianceProperties properties) {
        return new PropertiesCredentialResolver(properties.getCredentials());
    }

    @Bean
    @ConditionalOnMissingBean
    public TransportProvider transportProvider(final ComplianceProperties properties) {
        return new TcpTransportProvider(properties.getTransport());
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationDispatcher notificationDispatcher() {
        return new LoggingNotificationDispatcher();
    }

    @Bean
    public SessionRegistry sessionRegistry(final CredentialResolver credentialResolver,
                                           final TransportProvider transportProvider,
                                           final ComplianceProperties properties) {
        return new SessionRegistry(new ConnectorFactory(credentialResolver, transportProvider),
                properties.getTransport().getLeaseTimeout());
    }

    @Bean
    public AuditOrchestrator auditOrchestrator(final DeviceInventory deviceInventory,
                                               final YamlRuleRepository ruleRepository,
                                               final ResultStore resultStore,
                                               final SessionRegistry sessionRegistry,
                                               final ValidatorRegistry validatorRegistry,
                                               final ComplianceProperties properties,
                                               final Clock clock) {
        var audit = properties.getAudit();
        var options = AuditOptions.builder()
                .concurrency(audit.getConcurrency())
                .deviceTimeout(audit.getDeviceTimeout())
                .maxRetries(audit.getMaxRetries())
                .retryDelay(audit.getRetryDelay())
                .respectBackoff(audit.isRespectBackoff())
                .retainedRuns(audit.getRetainedRuns())
                .build();
        return new AuditOrchestrator(deviceInventory, ruleRepository, resultStore, sessionRegistry,
                new RuleEvaluator(), validatorRegistry, options, clock);
    }

    @Bean
    public StepHandlerRegistry stepHandlerRegistry(final NotificationDispatcher notificationDispatcher) {
        return StepHandlerRegistry.ofDefault(notificationDispatcher);
    }

    @Bean
    public WorkflowExecutor workflowExecutor(final SessionRegistry sessionRegistry,
                                             final StepHandlerRegistry stepHandlerRegistry,
                                             final ResultStore resultStore,
                                             final ValidatorRegistry validatorRegistry,
                                             final ComplianceProperties properties,
                                             final Clock clock) {
        var options = ExecutionOptions.builder()
                .parallelism(properties.getWorkflow().getParallelism())
                .retainedExecutions(properties.getWorkflow().getRetainedExecutions())
                .build();
        return new WorkflowExecutor(sessionRegistry, stepHandlerRegistry, resultStore, validatorRegistry, options, clock);
    }
}
