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
public class CdnLock {

    @NonNull private String cdnName;
    @NonNull private String userName;

    @NonNull
    @Default
    private Boolean soft = Boolean.TRUE;

    private String message;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("cdn_name")
    public String getCdnName() { return cdnName; }

    @DynamoDbAttribute("user_name")
    public String getUserName() { return userName; }

    @DynamoDbAttribute("soft")
    public Boolean getSoft() { return soft; }

    @DynamoDbAttribute("message")
    public String getMessage() { return message; }

    /**
     * Hard locks stop everyone except the holder from changing anything on the CDN.
     */
    public boolean blocks(String username) {
        return !Boolean.TRUE.equals(soft) && !userName.equals(username);
    }
}
