package com.example.purgejobs.models;

import java.time.Duration;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;

/**
 * A content invalidation job. The delivery service and creator are stored both by id and by
 * their display names; neither reference may change once the job exists.
 */
@DynamoDbBean
@NoArgsConstructor                     // needed for DynamoDB Enhanced Client reflection
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
public class InvalidationJob {

    public static final String KEYWORD = "PURGE";
    public static final String REFRESH = "REFRESH";

    @NonNull
    private Long id;

    @NonNull
    private String assetUrl;

    @NonNull
    private Long deliveryServiceId;

    @NonNull
    private String deliveryServiceXmlId;

    @NonNull
    private Long createdById;

    @NonNull
    private String createdByName;

    // epoch millis
    @NonNull
    private Long startTime;

    @NonNull
    private Integer ttlHours;

    @NonNull
    private Long enteredTime;

    @NonNull
    private Long lastUpdated;

    @NonNull
    @Default
    private String keyword = KEYWORD;

    @NonNull
    @Default
    private String invalidationType = REFRESH;

    // ----- DynamoDB Enhanced annotations on getters -----

    @DynamoDbPartitionKey
    @DynamoDbAttribute("id")
    public Long getId() { return id; }

    @DynamoDbAttribute("asset_url")
    public String getAssetUrl() { return assetUrl; }

    @DynamoDbAttribute("delivery_service_id")
    @DynamoDbSecondaryPartitionKey(indexNames = "jobs_by_delivery_service")
    public Long getDeliveryServiceId() { return deliveryServiceId; }

    @DynamoDbAttribute("delivery_service_xml_id")
    public String getDeliveryServiceXmlId() { return deliveryServiceXmlId; }

    @DynamoDbAttribute("created_by_id")
    public Long getCreatedById() { return createdById; }

    @DynamoDbAttribute("created_by_name")
    public String getCreatedByName() { return createdByName; }

    @DynamoDbAttribute("start_time")
    public Long getStartTime() { return startTime; }

    @DynamoDbAttribute("ttl_hours")
    public Integer getTtlHours() { return ttlHours; }

    @DynamoDbAttribute("entered_time")
    public Long getEnteredTime() { return enteredTime; }

    @DynamoDbAttribute("last_updated")
    public Long getLastUpdated() { return lastUpdated; }

    @DynamoDbAttribute("keyword")
    public String getKeyword() { return keyword; }

    @DynamoDbAttribute("invalidation_type")
    public String getInvalidationType() { return invalidationType; }

    // ----- Domain helpers -----

    public Instant startInstant() {
        return Instant.ofEpochMilli(startTime);
    }

    public Instant endInstant() {
        return startInstant().plus(Duration.ofHours(ttlHours));
    }

    public String parameters() {
        return formatParameters(ttlHours);
    }

    /**
     * A job is active once its start time has been reached; only pending jobs may be changed.
     */
    public boolean hasStarted(long nowMillis) {
        return startTime <= nowMillis;
    }

    public static String formatParameters(int ttlHours) {
        return "TTL:" + ttlHours + "h";
    }
}
