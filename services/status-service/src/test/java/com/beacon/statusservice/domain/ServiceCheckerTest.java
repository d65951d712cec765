package com.beacon.statusservice.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.beacon.observability.CorrelationContext;
import com.beacon.observability.CorrelationContextHolder;
import com.beacon.observability.StatusMetrics;
import com.beacon.statusmodel.ServiceStatus;
import com.beacon.statusmodel.StatusRecord;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ServiceChecker")
class ServiceCheckerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private ExecutorService executor;
    private SimpleMeterRegistry registry;
    private StatusMetrics metrics;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        registry = new SimpleMeterRegistry();
        metrics = new StatusMetrics(registry, "status-service");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        CorrelationContextHolder.clear();
    }

    private ServiceChecker checker(ServiceStateProvider provider) {
        return new ServiceChecker(provider, executor, CLOCK, TIMEOUT, metrics);
    }

    private double probeCount(String outcome) {
        return registry.get(StatusMetrics.PROBE_OUTCOMES).tag("outcome", outcome).counter().count();
    }

    @Nested
    @DisplayName("state mapping")
    class StateMapping {

        @Test
        @DisplayName("RUNNING maps to UP, stamped with the clock")
        void runningIsUp() throws Exception {
            ServiceStateProvider provider = mock(ServiceStateProvider.class);
            when(provider.stateOf("httpd", "web-01")).thenReturn(ServiceState.RUNNING);

            StatusRecord record = checker(provider).check("httpd", "web-01");

            assertThat(record.serviceName()).isEqualTo("httpd");
            assertThat(record.status()).isEqualTo(ServiceStatus.UP);
            assertThat(record.hostName()).isEqualTo("web-01");
            assertThat(record.timestamp()).isEqualTo(NOW);
            verify(provider, times(1)).stateOf("httpd", "web-01");
            assertThat(probeCount("up")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("STOPPED maps to DOWN")
        void stoppedIsDown() {
            StatusRecord record = checker((name, host) -> ServiceState.STOPPED).check("rabbitmq", "h");

            assertThat(record.status()).isEqualTo(ServiceStatus.DOWN);
            assertThat(probeCount("down")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("UNKNOWN and null answers map to UNKNOWN")
        void unknownAndNull() {
            assertThat(checker((name, host) -> ServiceState.UNKNOWN).check("a", "h").status())
                    .isEqualTo(ServiceStatus.UNKNOWN);
            assertThat(checker((name, host) -> null).check("a", "h").status())
                    .isEqualTo(ServiceStatus.UNKNOWN);
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("a provider exception yields UNKNOWN instead of propagating")
        void exceptionIsUnknown() {
            ServiceStateProvider failing =
                    (name, host) -> {
                        throw new IOException("ssh: connect to host h port 22: Connection refused");
                    };

            StatusRecord record = checker(failing).check("postgresql", "h");

            assertThat(record.status()).isEqualTo(ServiceStatus.UNKNOWN);
            assertThat(record.timestamp()).isEqualTo(NOW);
            assertThat(probeCount("error")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("a probe that overruns its timeout yields UNKNOWN and is interrupted")
        void timeoutIsUnknownAndCancelled() throws Exception {
            CountDownLatch interrupted = new CountDownLatch(1);
            ServiceStateProvider hanging =
                    (name, host) -> {
                        try {
                            Thread.sleep(TimeUnit.MINUTES.toMillis(1));
                        } catch (InterruptedException e) {
                            interrupted.countDown();
                            throw e;
                        }
                        return ServiceState.RUNNING;
                    };

            StatusRecord record = checker(hanging).check("httpd", "h", Duration.ofMillis(100));

            assertThat(record.status()).isEqualTo(ServiceStatus.UNKNOWN);
            assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(probeCount("timeout")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("a rejected probe yields UNKNOWN")
        void rejectedIsUnknown() {
            executor.shutdown();

            StatusRecord record = checker((name, host) -> ServiceState.RUNNING).check("httpd", "h");

            assertThat(record.status()).isEqualTo(ServiceStatus.UNKNOWN);
        }
    }

    @Test
    @DisplayName("runs the probe under the caller's context narrowed to the service")
    void propagatesContext() {
        AtomicReference<CorrelationContext> seen = new AtomicReference<>();
        CorrelationContextHolder.set(CorrelationContext.forCheckCycle("cycle-1"));

        checker(
                        (name, host) -> {
                            seen.set(CorrelationContextHolder.get().orElse(null));
                            return ServiceState.RUNNING;
                        })
                .check("httpd", "h");

        assertThat(seen.get()).isEqualTo(new CorrelationContext("cycle-1", "cycle-1", "httpd"));
        assertThat(CorrelationContextHolder.get()).contains(CorrelationContext.forCheckCycle("cycle-1"));
    }

    @Test
    @DisplayName("rejects a blank service name")
    void rejectsBlankName() {
        assertThatThrownBy(() -> checker((name, host) -> ServiceState.RUNNING).check(" ", "h"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
