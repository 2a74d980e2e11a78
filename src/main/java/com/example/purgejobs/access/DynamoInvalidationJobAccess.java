package com.example.purgejobs.access;

import com.example.purgejobs.models.InvalidationJob;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.ScanEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

@Component
public class DynamoInvalidationJobAccess implements InvalidationJobAccess {

    private final DynamoDbTable<InvalidationJob> table;

    public DynamoInvalidationJobAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(InvalidationJob.class));
    }

    @Override
    public Optional<InvalidationJob> findById(long id) {
        return Optional.ofNullable(table.getItem(Key.builder().partitionValue(id).build()));
    }

    @Override
    public List<InvalidationJob> findAllByDeliveryServiceId(long deliveryServiceId) {
        return table.index("jobs_by_delivery_service")
                .query(r -> r.queryConditional(QueryConditional.keyEqualTo(
                        Key.builder().partitionValue(deliveryServiceId).build())))
                .stream()
                .flatMap(page -> page.items().stream())
                .collect(Collectors.toList());
    }

    @Override
    public List<InvalidationJob> find(JobQuery query) {
        if (query.deliveryServiceIds().isEmpty()) {
            return List.of();
        }
        ScanEnhancedRequest scanRequest = ScanEnhancedRequest.builder()
                .filterExpression(filterExpression(query))
                .build();
        return table.scan(scanRequest)
                .items()
                .stream()
                .filter(job -> inScope(query, job))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Long> findLatestUpdate(JobQuery query) {
        if (query.deliveryServiceIds().isEmpty()) {
            return Optional.empty();
        }
        ScanEnhancedRequest scanRequest = ScanEnhancedRequest.builder()
                .filterExpression(filterExpression(query))
                .attributesToProject("last_updated", JobFilterField.DS_ID.attributeName())
                .build();
        return table.scan(scanRequest)
                .items()
                .stream()
                .filter(job -> inScope(query, job))
                .map(InvalidationJob::getLastUpdated)
                .filter(Objects::nonNull)
                .max(Long::compare);
    }

    /**
     * Builds the scan filter from the criteria and the start bound, or returns null when there
     * is nothing to filter on. Attribute names are bound through placeholders taken from
     * {@link JobFilterField}; caller input only ever lands in expression values.
     * <p>
     * The delivery service scope is not part of the expression: it can hold any number of ids,
     * and DynamoDB caps an expression at 4 KB. It is applied to the scanned items instead.
     */
    static Expression filterExpression(JobQuery query) {
        Expression.Builder builder = Expression.builder();
        List<String> clauses = new ArrayList<>();

        int index = 0;
        for (JobQuery.Criterion criterion : query.criteria()) {
            String name = "#f" + index;
            String value = ":f" + index;
            builder.putExpressionName(name, criterion.field().attributeName());
            builder.putExpressionValue(value, toAttributeValue(criterion.value()));
            clauses.add(name + " = " + value);
            index++;
        }

        if (query.startedAtOrAfter() != null) {
            builder.putExpressionName("#st", JobFilterField.START_TIME.attributeName());
            builder.putExpressionValue(":st", toAttributeValue(query.startedAtOrAfter()));
            clauses.add("#st >= :st");
        }

        if (clauses.isEmpty()) {
            return null;
        }
        return builder.expression(String.join(" AND ", clauses)).build();
    }

    private static boolean inScope(JobQuery query, InvalidationJob job) {
        return job.getDeliveryServiceId() != null
                && query.deliveryServiceIds().contains(job.getDeliveryServiceId());
    }

    private static AttributeValue toAttributeValue(Object value) {
        if (value instanceof Long number) {
            return AttributeValue.builder().n(String.valueOf(number)).build();
        }
        return AttributeValue.builder().s(String.valueOf(value)).build();
    }
}
