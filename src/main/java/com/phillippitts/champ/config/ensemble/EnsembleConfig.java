package com.phillippitts.champ.config.ensemble;

import com.phillippitts.champ.service.ensemble.EnsembleOrchestrator;
import com.phillippitts.champ.service.ensemble.ModelClient;
import com.phillippitts.champ.service.ensemble.ModelTransport;
import com.phillippitts.champ.service.ensemble.RestClientModelTransport;
import com.phillippitts.champ.service.ensemble.RetryingModelClient;
import com.phillippitts.champ.service.metrics.EnsembleMetricsPublisher;
import com.phillippitts.champ.util.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Wires one {@link RetryingModelClient} per configured endpoint and the orchestrator over them.
 */
@Configuration
public class EnsembleConfig {

    private static final Logger LOG = LogManager.getLogger(EnsembleConfig.class);

    private final EnsembleProperties properties;

    public EnsembleConfig(EnsembleProperties properties) {
        this.properties = properties;
    }

    /**
     * Transport whose request factory enforces the per-attempt timeout on connect and read.
     */
    @Bean
    public ModelTransport modelTransport() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.getRequestTimeout());
        factory.setReadTimeout(properties.getRequestTimeout());
        return new RestClientModelTransport(RestClient.builder().requestFactory(factory).build());
    }

    @Bean
    public EnsembleOrchestrator ensembleOrchestrator(ModelTransport modelTransport,
                                                     Sleeper sleeper,
                                                     EnsembleMetricsPublisher metricsPublisher,
                                                     @Qualifier("dispatchExecutor") Executor dispatchExecutor,
                                                     Clock clock) {
        List<ModelClient> modelClients = modelClients(modelTransport, sleeper, metricsPublisher);
        EnsembleOrchestrator.Settings settings = new EnsembleOrchestrator.Settings(
                properties.getRoundTimeout(), properties.getHistoryCapacity());
        LOG.info("Ensemble ready: {} endpoint(s), roundTimeout={}, maxRetries={}",
                modelClients.size(), properties.getRoundTimeout(), properties.getMaxRetries());
        return new EnsembleOrchestrator(modelClients, dispatchExecutor, settings, clock);
    }

    List<ModelClient> modelClients(ModelTransport modelTransport,
                                   Sleeper sleeper,
                                   EnsembleMetricsPublisher metricsPublisher) {
        RetryingModelClient.RetryPolicy policy = new RetryingModelClient.RetryPolicy(
                properties.getMaxRetries(), properties.getRetryBackoff(), properties.getCircuitBreakerFailures());
        Set<String> names = new HashSet<>();
        List<ModelClient> clients = new ArrayList<>();
        for (EnsembleProperties.Endpoint endpoint : properties.getEndpoints()) {
            if (!names.add(endpoint.getName())) {
                throw new IllegalStateException("Duplicate model endpoint name: " + endpoint.getName());
            }
            RetryingModelClient client = new RetryingModelClient(endpoint.getName(), URI.create(endpoint.getUrl()),
                    modelTransport, policy, sleeper, metricsPublisher);
            LOG.info("Configured model endpoint {} -> {}", client.getName(), client.getEndpoint());
            clients.add(client);
        }
        return clients;
    }
}
