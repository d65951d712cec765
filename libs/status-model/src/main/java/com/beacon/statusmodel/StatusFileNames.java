package com.beacon.statusmodel;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File naming convention for persisted status records:
 * {@code {service_name}-status-{YYYYMMDDTHHMMSSZ}.json}.
 *
 * <p>The timestamp is the record's observation instant in compact ISO-8601 basic format, UTC, second
 * precision. Two records for the same service within one second collide; the later one carries a
 * collision counter ({@code httpd-status-20240501T100000Z-1.json}).
 */
public final class StatusFileNames {

    public static final String EXTENSION = ".json";

    private static final DateTimeFormatter BASIC_INSTANT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private static final Pattern FILE_NAME =
            Pattern.compile("^(.+)-status-(\\d{8}T\\d{6}Z)(?:-(\\d+))?\\.json$");

    private StatusFileNames() {
        // utility class
    }

    /** File name for a record, without a collision counter. */
    public static String fileName(StatusRecord record) {
        return fileName(record, 0);
    }

    /**
     * File name for a record with the given collision counter; counter 0 means no suffix.
     *
     * @throws IllegalArgumentException if the counter is negative
     */
    public static String fileName(StatusRecord record, int collision) {
        if (collision < 0) {
            throw new IllegalArgumentException("collision must not be negative");
        }
        String base = record.serviceName() + "-status-" + BASIC_INSTANT.format(record.timestamp());
        return collision == 0 ? base + EXTENSION : base + "-" + collision + EXTENSION;
    }

    /**
     * Extracts the collision counter from a status file name.
     *
     * @return the counter (0 when the name has none), or empty if the name does not follow the
     *     convention
     */
    public static Optional<Integer> collisionOf(String fileName) {
        Matcher matcher = FILE_NAME.matcher(fileName);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String counter = matcher.group(3);
        return Optional.of(counter == null ? 0 : Integer.parseInt(counter));
    }

    /** Whether the file name follows the status file convention. */
    public static boolean isStatusFile(String fileName) {
        return FILE_NAME.matcher(fileName).matches();
    }
}
