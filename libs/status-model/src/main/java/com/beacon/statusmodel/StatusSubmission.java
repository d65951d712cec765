package com.beacon.statusmodel;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * A status report as submitted by an external client, before validation.
 *
 * <p>All fields are raw strings so that an unrecognised status such as {@code "MAYBE"} reaches
 * {@link StatusRecordValidator} instead of failing inside the JSON binder.
 *
 * @param serviceName required service name
 * @param serviceStatus required status, "UP" or "DOWN"
 * @param hostName optional host name
 * @param timestamp optional ISO-8601 timestamp; the submission time is used when absent
 */
public record StatusSubmission(
        @JsonProperty("service_name") String serviceName,
        @JsonProperty("service_status") String serviceStatus,
        @JsonProperty("host_name") String hostName,
        @JsonProperty("timestamp") String timestamp) {

    /**
     * Converts a validated submission into a record, filling the host and timestamp defaults.
     *
     * @param clock clock supplying the timestamp when none was submitted
     * @throws IllegalArgumentException if the submission does not pass {@link
     *     StatusRecordValidator#validate(StatusSubmission)}
     */
    public StatusRecord toRecord(Clock clock) {
        ValidationResult result = StatusRecordValidator.validate(this);
        if (!result.valid()) {
            throw new IllegalArgumentException(result.message());
        }
        Instant observedAt = parseTimestamp(timestamp).orElseGet(clock::instant);
        return new StatusRecord(
                serviceName.trim(),
                ServiceStatus.valueOf(serviceStatus),
                hostName == null ? null : hostName.trim(),
                observedAt);
    }

    /**
     * Parses an ISO-8601 timestamp. Accepts an instant ({@code 2024-05-01T10:00:00Z}), an offset
     * date-time ({@code 2024-05-01T12:00:00+02:00}) or a local date-time, which is read as UTC.
     *
     * @return the parsed instant, or empty when the value is blank or unparseable
     */
    public static Optional<Instant> parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String text = value.trim();
        try {
            return Optional.of(OffsetDateTime.parse(text).toInstant());
        } catch (DateTimeParseException notOffset) {
            try {
                return Optional.of(LocalDateTime.parse(text).toInstant(ZoneOffset.UTC));
            } catch (DateTimeParseException notLocal) {
                return Optional.empty();
            }
        }
    }
}
