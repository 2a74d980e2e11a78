package com.example.purgejobs.models;

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

@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class Tenant {

    @NonNull private Long id;
    @NonNull private String name;

    // null for the root tenant
    private Long parentId;

    @NonNull
    @Default
    private Boolean active = Boolean.TRUE;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("id")
    public Long getId() { return id; }

    @DynamoDbAttribute("name")
    public String getName() { return name; }

    @DynamoDbAttribute("parent_id")
    public Long getParentId() { return parentId; }

    @DynamoDbAttribute("active")
    public Boolean getActive() { return active; }
}
