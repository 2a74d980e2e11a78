package com.example.purgejobs.access;

import com.example.purgejobs.models.Tenant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

@Component
public class DynamoTenantAccess implements TenantAccess {

    private final DynamoDbTable<Tenant> table;

    public DynamoTenantAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table("tenants", TableSchema.fromBean(Tenant.class));
    }

    @Override
    public Optional<Tenant> findById(long id) {
        return Optional.ofNullable(table.getItem(Key.builder().partitionValue(id).build()));
    }

    @Override
    public List<Tenant> findAll() {
        return table.scan().items().stream().collect(Collectors.toList());
    }
}
