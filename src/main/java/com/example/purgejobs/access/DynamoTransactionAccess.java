package com.example.purgejobs.access;

import com.example.purgejobs.models.CdnRevalidation;
import com.example.purgejobs.models.ChangeLogEntry;
import com.example.purgejobs.models.DeletionMarker;
import com.example.purgejobs.models.InvalidationJob;
import com.example.purgejobs.models.RevalidationFlag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactDeleteItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactPutItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactUpdateItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactWriteItemsEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Maps a {@link WriteTransaction} onto a single TransactWriteItems call. Every staged write is
 * one action, and a job mutation stages at most five, well under DynamoDB's 100-action limit.
 */
@Component
@Slf4j
public class DynamoTransactionAccess implements TransactionAccess {

    private static final Expression ID_ABSENT = Expression.builder()
            .expression("attribute_not_exists(#id)")
            .putExpressionName("#id", "id")
            .build();

    private static final Expression ID_PRESENT = Expression.builder()
            .expression("attribute_exists(#id)")
            .putExpressionName("#id", "id")
            .build();

    private final DynamoDbEnhancedClient enhancedClient;
    private final DynamoDbTable<InvalidationJob> jobs;
    private final DynamoDbTable<CdnRevalidation> cdnRevalidations;
    private final DynamoDbTable<DeletionMarker> lastDeleted;
    private final DynamoDbTable<ChangeLogEntry> changeLog;

    public DynamoTransactionAccess(DynamoDbEnhancedClient enhancedClient) {
        this.enhancedClient = enhancedClient;
        this.jobs = enhancedClient.table(InvalidationJobAccess.TABLE_NAME,
                TableSchema.fromBean(InvalidationJob.class));
        this.cdnRevalidations = enhancedClient.table(CdnRevalidation.TABLE_NAME,
                TableSchema.fromBean(CdnRevalidation.class));
        this.lastDeleted = enhancedClient.table("last_deleted", TableSchema.fromBean(DeletionMarker.class));
        this.changeLog = enhancedClient.table("change_log", TableSchema.fromBean(ChangeLogEntry.class));
    }

    @Override
    public WriteTransaction begin() {
        return new DynamoWriteTransaction();
    }

    private class DynamoWriteTransaction implements WriteTransaction {

        private final TransactWriteItemsEnhancedRequest.Builder request = TransactWriteItemsEnhancedRequest.builder();
        private int actions;
        private boolean committed;

        @Override
        public void createJob(InvalidationJob job) {
            stage();
            request.addPutItem(jobs, TransactPutItemEnhancedRequest.builder(InvalidationJob.class)
                    .item(job)
                    .conditionExpression(ID_ABSENT)
                    .build());
        }

        @Override
        public void updateJob(InvalidationJob job, long nowMillis) {
            stage();
            Expression stillPending = Expression.builder()
                    .expression("attribute_exists(#id) AND #st > :now")
                    .putExpressionName("#id", "id")
                    .putExpressionName("#st", "start_time")
                    .putExpressionValue(":now", AttributeValue.builder().n(String.valueOf(nowMillis)).build())
                    .build();
            request.addPutItem(jobs, TransactPutItemEnhancedRequest.builder(InvalidationJob.class)
                    .item(job)
                    .conditionExpression(stillPending)
                    .build());
        }

        @Override
        public void deleteJob(InvalidationJob job) {
            stage();
            request.addDeleteItem(jobs, TransactDeleteItemEnhancedRequest.builder()
                    .key(Key.builder().partitionValue(job.getId()).build())
                    .conditionExpression(ID_PRESENT)
                    .build());
        }

        @Override
        public void recordDeletion(DeletionMarker marker) {
            stage();
            request.addPutItem(lastDeleted, marker);
        }

        @Override
        public void raiseFlag(long cdnId, RevalidationFlag flag, long raisedAt) {
            stage();
            // ignoreNulls keeps the other flag's timestamp; the item is created on first use.
            request.addUpdateItem(cdnRevalidations,
                    TransactUpdateItemEnhancedRequest.builder(CdnRevalidation.class)
                            .item(flag.raisedOn(cdnId, raisedAt))
                            .ignoreNulls(true)
                            .build());
        }

        @Override
        public void appendChangeLog(ChangeLogEntry entry) {
            stage();
            request.addPutItem(changeLog, entry);
        }

        @Override
        public void commit() {
            if (committed) {
                throw new IllegalStateException("transaction already committed");
            }
            committed = true;
            if (actions == 0) {
                return;
            }
            log.debug("Committing transaction with {} actions", actions);
            enhancedClient.transactWriteItems(request.build());
        }

        private void stage() {
            if (committed) {
                throw new IllegalStateException("transaction already committed");
            }
            actions++;
        }
    }
}
