package com.example.purgejobs.access;

import com.example.purgejobs.models.Server;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;

@Component
public class DynamoServerAccess implements ServerAccess {

    private final DynamoDbTable<Server> table;

    public DynamoServerAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table("servers", TableSchema.fromBean(Server.class));
    }

    @Override
    public List<Server> findAllByCdnId(long cdnId) {
        return table.index("servers_by_cdn")
                .query(r -> r.queryConditional(QueryConditional.keyEqualTo(
                        Key.builder().partitionValue(cdnId).build())))
                .stream()
                .flatMap(page -> page.items().stream())
                .collect(Collectors.toList());
    }
}
