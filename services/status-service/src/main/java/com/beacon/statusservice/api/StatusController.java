package com.beacon.statusservice.api;

import com.beacon.statusmodel.StatusRecord;
import com.beacon.statusmodel.StatusSubmission;
import com.beacon.statusservice.domain.RecordedStatus;
import com.beacon.statusservice.domain.StatusQueryService;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP binding of {@link StatusQueryService}. Errors are rendered by the global exception handler,
 * so every method here handles the success path only.
 */
@RestController
public class StatusController {

    private final StatusQueryService statusQueryService;

    public StatusController(StatusQueryService statusQueryService) {
        this.statusQueryService = statusQueryService;
    }

    @PostMapping("/add")
    @ResponseStatus(HttpStatus.CREATED)
    public AddStatusResponse add(@RequestBody(required = false) StatusSubmission submission) {
        RecordedStatus recorded = statusQueryService.recordStatus(submission);
        return new AddStatusResponse(
                "Status recorded successfully",
                recorded.record().serviceName(),
                recorded.id().value(),
                recorded.record().timestamp());
    }

    @GetMapping("/healthcheck")
    public HealthcheckResponse healthcheck() {
        Map<String, String> services = new LinkedHashMap<>();
        for (Map.Entry<String, StatusRecord> entry : statusQueryService.getAll().entrySet()) {
            services.put(entry.getKey(), entry.getValue().status().value());
        }
        return new HealthcheckResponse(services, Instant.now());
    }

    @GetMapping("/healthcheck/{serviceName}")
    public ServiceStatusResponse healthcheck(@PathVariable String serviceName) {
        return ServiceStatusResponse.from(statusQueryService.getOne(serviceName), Instant.now());
    }

    @GetMapping("/overview")
    public OverviewResponse overview() {
        return OverviewResponse.from(statusQueryService.overview(), Instant.now());
    }

    @PostMapping("/check-cycle")
    public CheckCycleResponse checkCycle() {
        return CheckCycleResponse.from(statusQueryService.runCheckCycle());
    }
}
