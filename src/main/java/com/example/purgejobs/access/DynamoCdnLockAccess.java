package com.example.purgejobs.access;

import com.example.purgejobs.models.CdnLock;
import java.util.Optional;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

@Component
public class DynamoCdnLockAccess implements CdnLockAccess {

    private final DynamoDbTable<CdnLock> table;

    public DynamoCdnLockAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table("cdn_locks", TableSchema.fromBean(CdnLock.class));
    }

    @Override
    public Optional<CdnLock> findByCdnName(String cdnName) {
        return Optional.ofNullable(table.getItem(Key.builder().partitionValue(cdnName).build()));
    }
}
