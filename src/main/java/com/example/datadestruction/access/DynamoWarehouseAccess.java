package com.example.datadestruction.access;

import com.example.datadestruction.config.DestructionProperties;
import com.example.datadestruction.models.TargetTable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.DeleteRequest;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.WriteRequest;

/**
 * DynamoDB binding of {@link WarehouseAccess}. The physical table is {@code project.dataset.table}.
 *
 * When the key column is the table's partition key, rows are located with one Query per key.
 * Otherwise the table is scanned with an {@code IN} filter, at most 100 keys per scan. Deletes
 * collect the primary key of every matching row and remove them with BatchWriteItem in chunks
 * of 25, re-submitting unprocessed items a bounded number of times.
 */
@Component
@Slf4j
public class DynamoWarehouseAccess implements WarehouseAccess {

    private static final int MAX_BATCH_WRITE_ITEMS = 25;
    private static final int MAX_IN_OPERANDS = 100;
    private static final long RETRY_BACKOFF_MILLIS = 50L;

    private final DynamoDbClient dynamo;
    private final int maxBatchRetries;

    public DynamoWarehouseAccess(DynamoDbClient dynamo, DestructionProperties properties) {
        this.dynamo = dynamo;
        this.maxBatchRetries = properties.getStore().getMaxBatchRetries();
    }

    @Override
    public Set<String> selectExistingKeys(TargetTable target, Set<String> keys) {
        String tableName = target.physicalName();
        String keyColumn = target.keyColumn();
        PrimaryKey primaryKey = describePrimaryKey(tableName);

        Set<String> existing = new HashSet<>();
        if (keyColumn.equals(primaryKey.partitionKey())) {
            for (String key : keys) {
                // One row is enough to prove existence.
                boolean found = !dynamo.query(queryByKey(tableName, keyColumn, key, List.of(keyColumn))
                                .limit(1)
                                .build())
                        .items()
                        .isEmpty();
                if (found) {
                    existing.add(key);
                }
            }
        } else {
            scanByKeys(tableName, keyColumn, keys, List.of(keyColumn), item -> {
                AttributeValue value = item.get(keyColumn);
                if (value != null && value.s() != null && keys.contains(value.s())) {
                    existing.add(value.s());
                }
            });
        }
        return existing;
    }

    @Override
    public int deleteByKeys(TargetTable target, Set<String> keys) {
        String tableName = target.physicalName();
        String keyColumn = target.keyColumn();
        PrimaryKey primaryKey = describePrimaryKey(tableName);
        List<String> keyAttributes = primaryKey.attributes();

        List<Map<String, AttributeValue>> rowKeys = new ArrayList<>();
        Consumer<Map<String, AttributeValue>> collect = item -> {
            Map<String, AttributeValue> rowKey = new HashMap<>();
            for (String attribute : keyAttributes) {
                rowKey.put(attribute, item.get(attribute));
            }
            rowKeys.add(rowKey);
        };

        if (keyColumn.equals(primaryKey.partitionKey())) {
            for (String key : keys) {
                dynamo.queryPaginator(queryByKey(tableName, keyColumn, key, keyAttributes).build())
                        .items()
                        .forEach(collect);
            }
        } else {
            scanByKeys(tableName, keyColumn, keys, keyAttributes, collect);
        }

        for (int from = 0; from < rowKeys.size(); from += MAX_BATCH_WRITE_ITEMS) {
            int to = Math.min(from + MAX_BATCH_WRITE_ITEMS, rowKeys.size());
            batchDelete(tableName, rowKeys.subList(from, to));
        }

        log.debug("Deleted {} rows from {} for {} keys", rowKeys.size(), tableName, keys.size());
        return rowKeys.size();
    }

    private QueryRequest.Builder queryByKey(String tableName,
                                            String keyColumn,
                                            String key,
                                            List<String> projection) {
        Map<String, String> names = new HashMap<>();
        names.put("#k", keyColumn);
        return QueryRequest.builder()
                .tableName(tableName)
                .keyConditionExpression("#k = :k")
                .expressionAttributeNames(withProjectionNames(names, projection))
                .expressionAttributeValues(Map.of(":k", AttributeValue.fromS(key)))
                .projectionExpression(projectionExpression(projection))
                .consistentRead(true);
    }

    private void scanByKeys(String tableName,
                            String keyColumn,
                            Set<String> keys,
                            List<String> projection,
                            Consumer<Map<String, AttributeValue>> consumer) {
        List<String> ordered = new ArrayList<>(keys);
        for (int from = 0; from < ordered.size(); from += MAX_IN_OPERANDS) {
            List<String> chunk = ordered.subList(from, Math.min(from + MAX_IN_OPERANDS, ordered.size()));

            Map<String, AttributeValue> values = new HashMap<>();
            List<String> placeholders = new ArrayList<>(chunk.size());
            for (int i = 0; i < chunk.size(); i++) {
                String placeholder = ":k" + i;
                placeholders.add(placeholder);
                values.put(placeholder, AttributeValue.fromS(chunk.get(i)));
            }
            Map<String, String> names = new HashMap<>();
            names.put("#k", keyColumn);

            ScanRequest request = ScanRequest.builder()
                    .tableName(tableName)
                    .filterExpression("#k IN (" + String.join(", ", placeholders) + ")")
                    .expressionAttributeNames(withProjectionNames(names, projection))
                    .expressionAttributeValues(values)
                    .projectionExpression(projectionExpression(projection))
                    .consistentRead(true)
                    .build();
            dynamo.scanPaginator(request).items().forEach(consumer);
        }
    }

    private void batchDelete(String tableName, List<Map<String, AttributeValue>> rowKeys) {
        List<WriteRequest> writes = rowKeys.stream()
                .map(key -> WriteRequest.builder()
                        .deleteRequest(DeleteRequest.builder().key(key).build())
                        .build())
                .toList();

        Map<String, List<WriteRequest>> pending = Map.of(tableName, writes);
        int attempt = 0;
        while (!pending.isEmpty()) {
            if (attempt > maxBatchRetries) {
                throw new IllegalStateException("Gave up deleting from " + tableName + " after "
                        + maxBatchRetries + " retries with " + pending.get(tableName).size()
                        + " unprocessed rows");
            }
            if (attempt > 0) {
                pause(attempt);
            }
            final Map<String, List<WriteRequest>> requestItems = pending;
            BatchWriteItemResponse response = dynamo.batchWriteItem(r -> r.requestItems(requestItems));
            pending = response.hasUnprocessedItems() ? response.unprocessedItems() : Map.of();
            attempt++;
        }
    }

    private PrimaryKey describePrimaryKey(String tableName) {
        List<KeySchemaElement> schema = dynamo.describeTable(b -> b.tableName(tableName))
                .table()
                .keySchema();
        String partitionKey = null;
        String sortKey = null;
        for (KeySchemaElement element : schema) {
            if (element.keyType() == KeyType.HASH) {
                partitionKey = element.attributeName();
            } else if (element.keyType() == KeyType.RANGE) {
                sortKey = element.attributeName();
            }
        }
        if (partitionKey == null) {
            throw new IllegalStateException("Table " + tableName + " has no partition key");
        }
        return new PrimaryKey(partitionKey, sortKey);
    }

    private static Map<String, String> withProjectionNames(Map<String, String> names, List<String> projection) {
        for (int i = 0; i < projection.size(); i++) {
            names.put("#p" + i, projection.get(i));
        }
        return names;
    }

    private static String projectionExpression(List<String> projection) {
        List<String> placeholders = new ArrayList<>(projection.size());
        for (int i = 0; i < projection.size(); i++) {
            placeholders.add("#p" + i);
        }
        return String.join(", ", placeholders);
    }

    private static void pause(int attempt) {
        try {
            Thread.sleep(RETRY_BACKOFF_MILLIS * attempt);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while retrying unprocessed deletes", ex);
        }
    }

    private record PrimaryKey(String partitionKey, String sortKey) {
        List<String> attributes() {
            return sortKey == null ? List.of(partitionKey) : List.of(partitionKey, sortKey);
        }
    }
}
