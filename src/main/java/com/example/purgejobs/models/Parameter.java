package com.example.purgejobs.models;

import java.util.Set;
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

/**
 * A named configuration value scoped to a config file. Profile-level parameters list the
 * server profiles they are assigned to; global parameters leave {@code profiles} empty.
 */
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class Parameter {

    public static final String GLOBAL_CONFIG_FILE = "global";
    public static final String REGEX_REVALIDATE_CONFIG_FILE = "regex_revalidate.config";
    public static final String USE_REVAL_PENDING = "use_reval_pending";
    public static final String MAX_REVAL_DURATION_DAYS = "maxRevalDurationDays";
    public static final String LOCATION = "location";

    @NonNull private String name;
    @NonNull private String configFile;
    private String value;
    private Set<String> profiles;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("name")
    public String getName() { return name; }

    @DynamoDbSortKey
    @DynamoDbAttribute("config_file")
    public String getConfigFile() { return configFile; }

    @DynamoDbAttribute("value")
    public String getValue() { return value; }

    @DynamoDbAttribute("profiles")
    public Set<String> getProfiles() { return profiles; }
}
