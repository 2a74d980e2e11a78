package com.example.purgejobs.access;

import java.util.Map;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

/**
 * Atomic counter items in the sequences table; ADD creates the item on first use.
 */
@Component
public class DynamoJobSequenceAccess implements JobSequenceAccess {

    private static final String TABLE_NAME = "sequences";
    private static final String JOB_SEQUENCE = "invalidation_jobs";

    private final DynamoDbClient dynamo;

    public DynamoJobSequenceAccess(DynamoDbClient dynamo) {
        this.dynamo = dynamo;
    }

    @Override
    public long nextJobId() {
        UpdateItemResponse response = dynamo.updateItem(r -> r.tableName(TABLE_NAME)
                .key(Map.of("name", AttributeValue.builder().s(JOB_SEQUENCE).build()))
                .updateExpression("ADD #v :one")
                .expressionAttributeNames(Map.of("#v", "value"))
                .expressionAttributeValues(Map.of(":one", AttributeValue.builder().n("1").build()))
                .returnValues(ReturnValue.UPDATED_NEW));
        return Long.parseLong(response.attributes().get("value").n());
    }
}
