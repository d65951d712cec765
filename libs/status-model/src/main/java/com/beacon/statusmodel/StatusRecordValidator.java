package com.beacon.statusmodel;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Validates externally submitted status reports.
 *
 * <p>All problems are collected and returned together in a {@link ValidationResult}, so a client
 * fixing a bad request sees every error at once.
 */
public final class StatusRecordValidator {

    /** Service names are identifiers; they also become part of status file names. */
    private static final Pattern SERVICE_NAME = Pattern.compile("[A-Za-z0-9._-]+");

    private StatusRecordValidator() {
        // utility class
    }

    /**
     * Checks that a submission carries a service name, a submittable status and, when present, a
     * parseable timestamp.
     */
    public static ValidationResult validate(StatusSubmission submission) {
        if (submission == null) {
            return ValidationResult.fail(List.of("request body must not be empty"));
        }
        List<String> errors = new ArrayList<>();

        List<String> missing = new ArrayList<>();
        if (isBlank(submission.serviceName())) {
            missing.add("service_name");
        }
        if (isBlank(submission.serviceStatus())) {
            missing.add("service_status");
        }
        if (!missing.isEmpty()) {
            errors.add("Missing required fields: " + String.join(", ", missing));
        }

        if (!isBlank(submission.serviceName())
                && !isValidServiceName(submission.serviceName().trim())) {
            errors.add("service_name may only contain letters, digits, '.', '_' and '-'");
        }

        if (!isBlank(submission.serviceStatus())
                && ServiceStatus.fromString(submission.serviceStatus())
                        .filter(ServiceStatus::isSubmittable)
                        .isEmpty()) {
            errors.add("service_status must be one of: UP, DOWN");
        }

        if (!isBlank(submission.timestamp())
                && StatusSubmission.parseTimestamp(submission.timestamp()).isEmpty()) {
            errors.add("timestamp must be in ISO 8601 format");
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    /** Whether a name is a usable service identifier. */
    public static boolean isValidServiceName(String name) {
        return name != null && SERVICE_NAME.matcher(name).matches();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
