package com.di.starnova.util;

import com.di.starnova.exception.MalformedRecordException;
import lombok.extern.slf4j.Slf4j;
import org.apache.beam.sdk.schemas.Schema;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;

/**
 * Utility class for converting raw text cells to Apache Beam Schema-compatible types.
 *
 * Conversions are strict: a value either parses to the declared type or the record is malformed.
 * - Empty or blank cells are null; null is rejected for non-nullable fields
 * - INT32 / INT64: decimal integers, surrounding whitespace ignored (zip prefixes like "01037" parse to 1037)
 * - DOUBLE: decimal numbers; NaN and infinities are rejected
 * - DATETIME: "yyyy-MM-dd HH:mm:ss" or "yyyy-MM-dd", interpreted as UTC (Joda DateTime)
 * - STRING: taken verbatim
 */
@Slf4j
public final class TypeConverter {

    private TypeConverter() {
        // Utility class - prevent instantiation
    }

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormat.forPattern("yyyy-MM-dd HH:mm:ss").withZoneUTC();
    private static final DateTimeFormatter DATE = DateTimeFormat.forPattern("yyyy-MM-dd").withZoneUTC();

    /**
     * Converts a raw cell to the type of {@code field}.
     *
     * @param raw     cell text, may be null
     * @param field   declared schema field
     * @param context table and record position, used in error messages
     * @return the converted value, or null for an empty cell of a nullable field
     * @throws MalformedRecordException if the value cannot be parsed or a required value is missing
     */
    public static Object convertToSchemaType(String raw, Schema.Field field, String context) {
        Schema.FieldType fieldType = field.getType();
        if (raw == null || raw.isBlank()) {
            if (Boolean.TRUE.equals(fieldType.getNullable())) {
                return null;
            }
            throw new MalformedRecordException(String.format(
                    "%s: required column '%s' is empty", context, field.getName()));
        }
        Schema.TypeName typeName = fieldType.getTypeName();
        try {
            switch (typeName) {
                case STRING:
                    return raw;
                case INT32:
                    return Integer.parseInt(raw.trim());
                case INT64:
                    return Long.parseLong(raw.trim());
                case DOUBLE:
                    return convertToDouble(raw.trim());
                case DATETIME:
                    return convertToDateTime(raw.trim());
                default:
                    throw new MalformedRecordException(String.format(
                            "%s: column '%s' has unsupported schema type %s", context, field.getName(), typeName));
            }
        } catch (IllegalArgumentException e) {
            // NumberFormatException and Joda parse failures are IllegalArgumentExceptions
            log.debug("Failed to convert '{}' for field '{}' ({}): {}", raw, field.getName(), typeName, e.getMessage());
            throw new MalformedRecordException(String.format(
                    "%s: cannot convert '%s' to %s for column '%s'", context, raw, typeName, field.getName()), e);
        }
    }

    private static Double convertToDouble(String value) {
        double d = Double.parseDouble(value);
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new IllegalArgumentException("not a finite number");
        }
        return d;
    }

    private static DateTime convertToDateTime(String value) {
        DateTimeFormatter formatter = value.length() > 10 ? TIMESTAMP : DATE;
        return formatter.parseDateTime(value).withZone(DateTimeZone.UTC);
    }
}
