package com.beacon.statusservice.infrastructure.health;

import com.beacon.statusmodel.StatusRecord;
import com.beacon.statusservice.domain.StatusRepository;
import java.util.Map;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/** Reports whether the status store answers reads, with the number of services it tracks. */
public class StatusStoreHealthIndicator implements HealthIndicator {

    private final StatusRepository repository;
    private final String storeType;

    public StatusStoreHealthIndicator(StatusRepository repository, String storeType) {
        this.repository = repository;
        this.storeType = storeType;
    }

    @Override
    public Health health() {
        try {
            Map<String, StatusRecord> latest = repository.latestAll();
            return Health.up()
                    .withDetail("store", storeType)
                    .withDetail("trackedServices", latest.size())
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("store", storeType)
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
