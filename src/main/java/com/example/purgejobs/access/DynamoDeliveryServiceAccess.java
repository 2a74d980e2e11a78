package com.example.purgejobs.access;

import com.example.purgejobs.models.DeliveryService;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;

@Component
public class DynamoDeliveryServiceAccess implements DeliveryServiceAccess {

    private final DynamoDbTable<DeliveryService> table;

    public DynamoDeliveryServiceAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table("delivery_services", TableSchema.fromBean(DeliveryService.class));
    }

    @Override
    public Optional<DeliveryService> findById(long id) {
        return Optional.ofNullable(table.getItem(Key.builder().partitionValue(id).build()));
    }

    @Override
    public Optional<DeliveryService> findByXmlId(String xmlId) {
        return table.index("delivery_services_by_xml_id")
                .query(r -> r.queryConditional(QueryConditional.keyEqualTo(
                        Key.builder().partitionValue(xmlId).build())))
                .stream()
                .flatMap(page -> page.items().stream())
                .findFirst();
    }

    @Override
    public List<DeliveryService> findAllByTenantIds(Set<Long> tenantIds) {
        if (tenantIds.isEmpty()) {
            return List.of();
        }
        // one row per delivery service; filtered client-side
        return table.scan()
                .items()
                .stream()
                .filter(ds -> tenantIds.contains(ds.getTenantId()))
                .collect(Collectors.toList());
    }
}
