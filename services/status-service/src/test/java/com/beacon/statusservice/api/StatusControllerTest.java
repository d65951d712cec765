package com.beacon.statusservice.api;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.endsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.beacon.statusmodel.ServiceStatus;
import com.beacon.statusmodel.StatusRecord;
import com.beacon.statusmodel.StatusSubmission;
import com.beacon.statusservice.domain.ApplicationStatus;
import com.beacon.statusservice.domain.CheckCycleResult;
import com.beacon.statusservice.domain.DeadlineExceededException;
import com.beacon.statusservice.domain.RecordId;
import com.beacon.statusservice.domain.RecordedStatus;
import com.beacon.statusservice.domain.StatusNotFoundException;
import com.beacon.statusservice.domain.StatusOverview;
import com.beacon.statusservice.domain.StatusQueryService;
import com.beacon.statusservice.domain.StatusValidationException;
import com.beacon.statusservice.domain.StoreUnavailableException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(StatusController.class)
@ActiveProfiles("test")
@DisplayName("StatusController")
class StatusControllerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired private MockMvc mockMvc;

    @MockBean private StatusQueryService statusQueryService;

    @Nested
    @DisplayName("POST /add")
    class Add {

        @Test
        @DisplayName("returns 201 with the record id")
        void created() throws Exception {
            StatusRecord record = new StatusRecord("httpd", ServiceStatus.UP, "web-01", T0);
            when(statusQueryService.recordStatus(any(StatusSubmission.class)))
                    .thenReturn(new RecordedStatus(new RecordId("rec-1"), record));

            mockMvc.perform(
                            post("/add")
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .content(
                                            "{\"service_name\":\"httpd\",\"service_status\":\"UP\",\"host_name\":\"web-01\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.message").value("Status recorded successfully"))
                    .andExpect(jsonPath("$.service_name").value("httpd"))
                    .andExpect(jsonPath("$.record_id").value("rec-1"))
                    .andExpect(jsonPath("$.timestamp").value("2024-05-01T10:00:00Z"));

            verify(statusQueryService)
                    .recordStatus(new StatusSubmission("httpd", "UP", "web-01", null));
        }

        @Test
        @DisplayName("returns 400 for an invalid status")
        void invalidStatus() throws Exception {
            when(statusQueryService.recordStatus(any(StatusSubmission.class)))
                    .thenThrow(
                            new StatusValidationException("service_status must be one of: UP, DOWN"));

            mockMvc.perform(
                            post("/add")
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .content("{\"service_name\":\"httpd\",\"service_status\":\"MAYBE\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON))
                    .andExpect(jsonPath("$.detail").value("service_status must be one of: UP, DOWN"))
                    .andExpect(jsonPath("$.correlationId").exists());
        }

        @Test
        @DisplayName("returns 400 for malformed JSON without calling the service")
        void malformedJson() throws Exception {
            mockMvc.perform(post("/add").contentType(MediaType.APPLICATION_JSON).content("{\"service_name\":"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.type", endsWith("/errors/bad-request")));

            verify(statusQueryService, never()).recordStatus(any());
        }

        @Test
        @DisplayName("passes a missing body on for validation")
        void missingBody() throws Exception {
            when(statusQueryService.recordStatus(null))
                    .thenThrow(new StatusValidationException("request body must not be empty"));

            mockMvc.perform(post("/add").contentType(MediaType.APPLICATION_JSON))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value("request body must not be empty"));
        }

        @Test
        @DisplayName("returns 503 when the store is unavailable")
        void storeUnavailable() throws Exception {
            when(statusQueryService.recordStatus(any(StatusSubmission.class)))
                    .thenThrow(new StoreUnavailableException("disk full"));

            mockMvc.perform(
                            post("/add")
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .content("{\"service_name\":\"httpd\",\"service_status\":\"UP\"}"))
                    .andExpect(status().isServiceUnavailable());
        }
    }

    @Nested
    @DisplayName("GET /healthcheck")
    class Healthcheck {

        @Test
        @DisplayName("lists every service in store order")
        void listsServices() throws Exception {
            Map<String, StatusRecord> all = new LinkedHashMap<>();
            all.put("httpd", StatusRecord.of("httpd", ServiceStatus.UP, T0));
            all.put("rabbitmq", StatusRecord.of("rabbitmq", ServiceStatus.DOWN, T0));
            all.put("rbcapp1", StatusRecord.of("rbcapp1", ServiceStatus.DEGRADED, T0));
            when(statusQueryService.getAll()).thenReturn(all);

            mockMvc.perform(get("/healthcheck"))
                    .andExpect(status().isOk())
                    .andExpect(
                            content()
                                    .string(
                                            containsString(
                                                    "\"services\":{\"httpd\":\"UP\",\"rabbitmq\":\"DOWN\",\"rbcapp1\":\"DEGRADED\"}")))
                    .andExpect(jsonPath("$.timestamp").exists());
        }

        @Test
        @DisplayName("returns 503 after exactly one store read when the store is unreachable")
        void storeUnavailable() throws Exception {
            when(statusQueryService.getAll()).thenThrow(new StoreUnavailableException("refused"));

            mockMvc.perform(get("/healthcheck"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.status").value(503));

            verify(statusQueryService, times(1)).getAll();
        }

        @Test
        @DisplayName("returns one service with last_updated")
        void oneService() throws Exception {
            when(statusQueryService.getOne("httpd"))
                    .thenReturn(new StatusRecord("httpd", ServiceStatus.DOWN, "web-01", T0));

            mockMvc.perform(get("/healthcheck/httpd"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.service_name").value("httpd"))
                    .andExpect(jsonPath("$.service_status").value("DOWN"))
                    .andExpect(jsonPath("$.host_name").value("web-01"))
                    .andExpect(jsonPath("$.last_updated").value("2024-05-01T10:00:00Z"));
        }

        @Test
        @DisplayName("returns 404 for an unknown service and echoes the correlation ID")
        void unknownService() throws Exception {
            when(statusQueryService.getOne("unknownservice"))
                    .thenThrow(new StatusNotFoundException("unknownservice"));

            mockMvc.perform(get("/healthcheck/unknownservice").header("X-Correlation-ID", "trace-9"))
                    .andExpect(status().isNotFound())
                    .andExpect(header().string("X-Correlation-ID", "trace-9"))
                    .andExpect(jsonPath("$.detail").value("Service \"unknownservice\" not found"))
                    .andExpect(jsonPath("$.correlationId").value("trace-9"));
        }
    }

    @Test
    @DisplayName("GET /overview returns counts and the services requiring attention")
    void overview() throws Exception {
        when(statusQueryService.overview())
                .thenReturn(new StatusOverview(4, 2, 2, List.of("rabbitmq", "rbcapp1")));

        mockMvc.perform(get("/overview"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(4))
                .andExpect(jsonPath("$.up_count").value(2))
                .andExpect(jsonPath("$.down_count").value(2))
                .andExpect(jsonPath("$.requiring_attention", contains("rabbitmq", "rbcapp1")));
    }

    @Nested
    @DisplayName("POST /check-cycle")
    class CheckCycle {

        @Test
        @DisplayName("returns the cycle outcome")
        void completed() throws Exception {
            List<StatusRecord> deps =
                    List.of(
                            StatusRecord.of("httpd", ServiceStatus.UP, T0),
                            StatusRecord.of("rabbitmq", ServiceStatus.DOWN, T0),
                            StatusRecord.of("postgresql", ServiceStatus.UP, T0));
            when(statusQueryService.runCheckCycle())
                    .thenReturn(
                            new CheckCycleResult(
                                    "cycle-1",
                                    deps,
                                    ApplicationStatus.DEGRADED,
                                    StatusRecord.of("rbcapp1", ServiceStatus.DEGRADED, T0)));

            mockMvc.perform(post("/check-cycle"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.cycle_id").value("cycle-1"))
                    .andExpect(jsonPath("$.application_status").value("DEGRADED"))
                    .andExpect(jsonPath("$.services.rabbitmq").value("DOWN"))
                    .andExpect(jsonPath("$.services.rbcapp1").value("DEGRADED"));
        }

        @Test
        @DisplayName("returns 504 when the cycle deadline passes")
        void deadlineExceeded() throws Exception {
            when(statusQueryService.runCheckCycle())
                    .thenThrow(new DeadlineExceededException("check cycle c-1", Duration.ofSeconds(60)));

            mockMvc.perform(post("/check-cycle")).andExpect(status().isGatewayTimeout());
        }
    }
}
