package com.example.purgejobs.access;

import com.example.purgejobs.models.Parameter;
import java.util.Optional;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

@Component
public class DynamoParameterAccess implements ParameterAccess {

    private final DynamoDbTable<Parameter> table;

    public DynamoParameterAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table("parameters", TableSchema.fromBean(Parameter.class));
    }

    @Override
    public Optional<Parameter> find(String name, String configFile) {
        return Optional.ofNullable(table.getItem(r -> r.key(Key.builder()
                .partitionValue(name)
                .sortValue(configFile)
                .build())));
    }
}
