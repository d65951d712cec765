package com.beacon.statusservice.config;

import com.beacon.statusservice.domain.StatusQueryService;
import com.beacon.statusservice.infrastructure.scheduling.CheckCycleScheduler;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Periodic check cycles, off unless {@code beacon.monitor.schedule-enabled=true}. */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "beacon.monitor", name = "schedule-enabled", havingValue = "true")
public class SchedulingConfiguration {

    @Bean
    public CheckCycleScheduler checkCycleScheduler(StatusQueryService statusQueryService) {
        return new CheckCycleScheduler(statusQueryService);
    }
}
