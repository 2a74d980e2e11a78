package com.example.purgejobs.access;

import com.example.purgejobs.models.InvalidationJob;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Optional;
import java.util.function.Function;

/**
 * The fixed set of job fields callers may filter and sort on. Query parameter names are only
 * ever looked up here; the stored attribute names come from these constants, never from the
 * request.
 */
public enum JobFilterField {
    ID("id", "id", ValueType.INTEGER, InvalidationJob::getId),
    KEYWORD("keyword", "keyword", ValueType.STRING, InvalidationJob::getKeyword),
    ASSET_URL("assetURL", "asset_url", ValueType.STRING, InvalidationJob::getAssetUrl),
    START_TIME("startTime", "start_time", ValueType.TIMESTAMP, InvalidationJob::getStartTime),
    USER_ID("userId", "created_by_id", ValueType.INTEGER, InvalidationJob::getCreatedById),
    CREATED_BY("createdBy", "created_by_name", ValueType.STRING, InvalidationJob::getCreatedByName),
    DELIVERY_SERVICE("deliveryService", "delivery_service_xml_id", ValueType.STRING,
            InvalidationJob::getDeliveryServiceXmlId),
    DS_ID("dsId", "delivery_service_id", ValueType.INTEGER, InvalidationJob::getDeliveryServiceId);

    enum ValueType { INTEGER, STRING, TIMESTAMP }

    private final String parameterName;
    private final String attributeName;
    private final ValueType valueType;
    private final Function<InvalidationJob, Object> extractor;

    JobFilterField(String parameterName,
                   String attributeName,
                   ValueType valueType,
                   Function<InvalidationJob, Object> extractor) {
        this.parameterName = parameterName;
        this.attributeName = attributeName;
        this.valueType = valueType;
        this.extractor = extractor;
    }

    public static Optional<JobFilterField> fromParameter(String name) {
        return Arrays.stream(values())
                .filter(field -> field.parameterName.equals(name))
                .findFirst();
    }

    public String parameterName() {
        return parameterName;
    }

    public String attributeName() {
        return attributeName;
    }

    /**
     * Converts a raw query parameter into the stored representation: {@link Long} for integer
     * and timestamp fields (timestamps as epoch millis), {@link String} otherwise.
     *
     * @throws IllegalArgumentException if the value does not fit the field's type
     */
    public Object parse(String raw) {
        switch (valueType) {
            case INTEGER -> {
                try {
                    return Long.parseLong(raw.trim());
                } catch (NumberFormatException ex) {
                    throw new IllegalArgumentException(parameterName + " must be an integer");
                }
            }
            case TIMESTAMP -> {
                try {
                    return Instant.parse(raw.trim()).toEpochMilli();
                } catch (DateTimeParseException ex) {
                    throw new IllegalArgumentException(parameterName + " must be an RFC 3339 timestamp");
                }
            }
            default -> {
                return raw;
            }
        }
    }

    public Object valueOf(InvalidationJob job) {
        return extractor.apply(job);
    }

    public Comparator<InvalidationJob> comparator() {
        if (valueType == ValueType.STRING) {
            return Comparator.comparing(job -> (String) valueOf(job), Comparator.nullsFirst(Comparator.naturalOrder()));
        }
        return Comparator.comparing(job -> (Long) valueOf(job), Comparator.nullsFirst(Comparator.naturalOrder()));
    }
}
