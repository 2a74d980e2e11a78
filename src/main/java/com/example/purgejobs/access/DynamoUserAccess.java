package com.example.purgejobs.access;

import com.example.purgejobs.models.User;
import java.util.Optional;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;

@Component
public class DynamoUserAccess implements UserAccess {

    private final DynamoDbTable<User> table;

    public DynamoUserAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table("users", TableSchema.fromBean(User.class));
    }

    @Override
    public Optional<User> findById(long id) {
        return Optional.ofNullable(table.getItem(Key.builder().partitionValue(id).build()));
    }

    @Override
    public Optional<User> findByUsername(String username) {
        return table.index("users_by_username")
                .query(r -> r.queryConditional(QueryConditional.keyEqualTo(
                        Key.builder().partitionValue(username).build())))
                .stream()
                .flatMap(page -> page.items().stream())
                .findFirst();
    }
}
