package com.example.purgejobs.models;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * Last deletion time per table. Deleted rows leave no trace of their own, so conditional reads
 * fold this timestamp into their freshness check.
 */
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class DeletionMarker {

    @NonNull private String tableName;
    @NonNull private Long lastUpdated;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("table_name")
    public String getTableName() { return tableName; }

    @DynamoDbAttribute("last_updated")
    public Long getLastUpdated() { return lastUpdated; }
}
