package com.beacon.statusservice.config;

import com.beacon.observability.StatusMetrics;
import com.beacon.statusservice.domain.DependencySet;
import com.beacon.statusservice.domain.MonitorSettings;
import com.beacon.statusservice.domain.ServiceChecker;
import com.beacon.statusservice.domain.ServiceStateProvider;
import com.beacon.statusservice.domain.StatusAggregator;
import com.beacon.statusservice.domain.StatusQueryService;
import com.beacon.statusservice.domain.StatusRepository;
import com.beacon.statusservice.infrastructure.health.StatusStoreHealthIndicator;
import com.beacon.statusservice.infrastructure.probe.SystemctlServiceStateProvider;
import com.beacon.statusservice.infrastructure.store.FileStatusRepository;
import com.beacon.statusservice.infrastructure.store.InMemoryStatusRepository;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the monitoring core from {@link MonitorProperties}. */
@Configuration
public class MonitorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MonitorConfiguration.class);

    static final String UNRESOLVED_HOST = "unknown-host";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MonitorSettings monitorSettings(MonitorProperties properties) {
        MonitorSettings settings =
                new MonitorSettings(
                        properties.applicationName(),
                        new DependencySet(properties.dependencies()),
                        hostNameOrLocal(properties.hostName()),
                        properties.probeTimeout(),
                        properties.cycleTimeout(),
                        properties.readTimeout());
        log.info(
                "Monitoring {} on {} with dependencies {}",
                settings.applicationName(),
                settings.hostName(),
                settings.dependencies().names());
        return settings;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService probeExecutor(MonitorProperties properties) {
        return Executors.newFixedThreadPool(properties.probeThreads(), daemonThreads("beacon-probe-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService readExecutor(MonitorProperties properties) {
        return Executors.newFixedThreadPool(properties.readThreads(), daemonThreads("beacon-read-"));
    }

    @Bean
    public ServiceStateProvider serviceStateProvider(MonitorSettings settings) {
        return new SystemctlServiceStateProvider(settings.hostName(), settings.probeTimeout());
    }

    @Bean
    public StatusRepository statusRepository(MonitorProperties properties) {
        MonitorProperties.Store store = properties.store();
        if (store.type() == MonitorProperties.StoreType.FILE) {
            return new FileStatusRepository(Path.of(store.directory()));
        }
        return new InMemoryStatusRepository();
    }

    @Bean
    public StatusMetrics statusMetrics(
            MeterRegistry meterRegistry,
            @Value("${spring.application.name:status-service}") String serviceName) {
        return new StatusMetrics(meterRegistry, serviceName);
    }

    @Bean
    public ServiceChecker serviceChecker(
            ServiceStateProvider provider,
            @Qualifier("probeExecutor") ExecutorService probeExecutor,
            Clock clock,
            MonitorSettings settings,
            StatusMetrics metrics) {
        return new ServiceChecker(provider, probeExecutor, clock, settings.probeTimeout(), metrics);
    }

    @Bean
    public StatusAggregator statusAggregator(MonitorSettings settings) {
        return new StatusAggregator(settings.dependencies());
    }

    @Bean
    public StatusQueryService statusQueryService(
            MonitorSettings settings,
            ServiceChecker checker,
            StatusAggregator aggregator,
            StatusRepository repository,
            @Qualifier("readExecutor") ExecutorService readExecutor,
            Clock clock,
            StatusMetrics metrics) {
        return new StatusQueryService(
                settings, checker, aggregator, repository, readExecutor, clock, metrics);
    }

    @Bean
    public StatusStoreHealthIndicator statusStoreHealthIndicator(
            StatusRepository repository, MonitorProperties properties) {
        return new StatusStoreHealthIndicator(
                repository, properties.store().type().name().toLowerCase());
    }

    static String hostNameOrLocal(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Could not resolve local host name, using '{}': {}", UNRESOLVED_HOST, e.getMessage());
            return UNRESOLVED_HOST;
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
