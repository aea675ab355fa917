package com.warmlead.crm.sync.pipedrive;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Parses Pipedrive timestamps into UTC LocalDateTime.
 * Accepts "2024-01-01 11:00:00" (Pipedrive's UTC format) and ISO-8601 with or without offset.
 */
public final class PipedriveTimestamps {

    private static final DateTimeFormatter PIPEDRIVE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Pattern PIPEDRIVE_PATTERN = Pattern.compile("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}");
    private static final Pattern OFFSET_SUFFIX = Pattern.compile(".*(Z|[+-]\\d{2}:?\\d{2})$");

    private PipedriveTimestamps() {
    }

    /**
     * @return parsed UTC time, or null when the value is blank or not a recognized format
     */
    public static LocalDateTime parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        try {
            if (PIPEDRIVE_PATTERN.matcher(text).matches()) {
                return LocalDateTime.parse(text, PIPEDRIVE_FORMAT);
            }
            if (OFFSET_SUFFIX.matcher(text).matches()) {
                return OffsetDateTime.parse(text).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
            }
            return LocalDateTime.parse(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static String format(LocalDateTime value) {
        return value == null ? null : value.format(PIPEDRIVE_FORMAT);
    }
}
