package com.example.purgejobs.access;

import com.example.purgejobs.models.DeletionMarker;
import java.util.Optional;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

@Component
public class DynamoDeletionLogAccess implements DeletionLogAccess {

    private final DynamoDbTable<DeletionMarker> table;

    public DynamoDeletionLogAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table("last_deleted", TableSchema.fromBean(DeletionMarker.class));
    }

    @Override
    public Optional<Long> findLastDeleted(String tableName) {
        return Optional.ofNullable(table.getItem(Key.builder().partitionValue(tableName).build()))
                .map(DeletionMarker::getLastUpdated);
    }
}
