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
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class ChangeLogEntry {

    public static final String API_CHANGE = "APICHANGE";

    @NonNull private String userName;   // PK
    @NonNull private String tsUlid;     // SK "{millis}_{random}"
    @NonNull private String level;
    @NonNull private String message;
    @NonNull private Long timestamp;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("user_name")
    public String getUserName() { return userName; }

    @DynamoDbSortKey
    @DynamoDbAttribute("ts_ulid")
    public String getTsUlid() { return tsUlid; }

    @DynamoDbAttribute("level")
    public String getLevel() { return level; }

    @DynamoDbAttribute("message")
    public String getMessage() { return message; }

    @DynamoDbAttribute("timestamp")
    public Long getTimestamp() { return timestamp; }
}
