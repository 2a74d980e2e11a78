package com.example.purgejobs.access;

import com.example.purgejobs.models.CdnRevalidation;
import java.util.Optional;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

@Component
public class DynamoCdnRevalidationAccess implements CdnRevalidationAccess {

    private final DynamoDbTable<CdnRevalidation> table;

    public DynamoCdnRevalidationAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(CdnRevalidation.TABLE_NAME, TableSchema.fromBean(CdnRevalidation.class));
    }

    @Override
    public Optional<CdnRevalidation> findByCdnId(long cdnId) {
        return Optional.ofNullable(table.getItem(Key.builder().partitionValue(cdnId).build()));
    }
}
