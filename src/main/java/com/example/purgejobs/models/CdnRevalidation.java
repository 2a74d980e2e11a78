package com.example.purgejobs.models;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * Pending-revalidation marker for a whole CDN. A job change raises one flag here instead of
 * writing every fleet member. A server derives its own pending state by comparing these
 * timestamps with the last time it applied its configuration (see {@link Server#pendingFlags}).
 */
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class CdnRevalidation {

    public static final String TABLE_NAME = "cdn_revalidations";

    private Long cdnId;
    private Long updPendingSince;
    private Long revalPendingSince;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("cdn_id")
    public Long getCdnId() { return cdnId; }

    @DynamoDbAttribute("upd_pending_since")
    public Long getUpdPendingSince() { return updPendingSince; }

    @DynamoDbAttribute("reval_pending_since")
    public Long getRevalPendingSince() { return revalPendingSince; }
}
