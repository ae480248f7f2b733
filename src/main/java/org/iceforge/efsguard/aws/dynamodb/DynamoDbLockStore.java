package org.iceforge.efsguard.aws.dynamodb;

import org.iceforge.efsguard.lock.LockConfigurationException;
import org.iceforge.efsguard.lock.LockRecord;
import org.iceforge.efsguard.lock.LockStore;
import org.iceforge.efsguard.lock.LockStoreException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Lock records in a DynamoDB table keyed by {@code pk}.
 * <p>
 * Item shape: {@code {pk: S, lock_id: S, expires_at: N}} where {@code expires_at} is epoch
 * seconds with sub-second precision. DynamoDB evaluates the condition expressions atomically
 * with the write, which is what makes this a mutual exclusion.
 */
public class DynamoDbLockStore implements LockStore {

    static final String PK = "pk";
    static final String LOCK_ID = "lock_id";
    static final String EXPIRES_AT = "expires_at";

    static final String PUT_CONDITION = "attribute_not_exists(#pk) OR #exp < :now";
    static final String DELETE_CONDITION = "#lockId = :lockId";

    private final DynamoDbClient dynamoDb;
    private final String table;

    public DynamoDbLockStore(DynamoDbClient dynamoDb, String table) {
        this.dynamoDb = Objects.requireNonNull(dynamoDb);
        if (table == null || table.isBlank()) {
            throw new LockConfigurationException("efsguard.lock.dynamodb.table is required but not set.");
        }
        this.table = table;
    }

    @Override
    public boolean tryPut(String key, String lockId, Instant expiresAt, Instant now) {
        PutItemRequest put = PutItemRequest.builder()
                .tableName(table)
                .item(Map.of(
                        PK, AttributeValue.fromS(key),
                        LOCK_ID, AttributeValue.fromS(lockId),
                        EXPIRES_AT, AttributeValue.fromN(epochSeconds(expiresAt))
                ))
                .conditionExpression(PUT_CONDITION)
                .expressionAttributeNames(Map.of("#pk", PK, "#exp", EXPIRES_AT))
                .expressionAttributeValues(Map.of(":now", AttributeValue.fromN(epochSeconds(now))))
                .build();

        try {
            dynamoDb.putItem(put);
            return true;
        } catch (ConditionalCheckFailedException e) {
            return false;
        } catch (DynamoDbException e) {
            throw new LockStoreException("PutItem on " + table + " failed: " + errorCode(e), e, false);
        } catch (SdkClientException e) {
            throw new LockStoreException("PutItem on " + table + " failed: " + e.getMessage(), e, true);
        }
    }

    @Override
    public boolean deleteIfOwner(String key, String lockId) {
        DeleteItemRequest delete = DeleteItemRequest.builder()
                .tableName(table)
                .key(Map.of(PK, AttributeValue.fromS(key)))
                .conditionExpression(DELETE_CONDITION)
                .expressionAttributeNames(Map.of("#lockId", LOCK_ID))
                .expressionAttributeValues(Map.of(":lockId", AttributeValue.fromS(lockId)))
                .build();

        try {
            dynamoDb.deleteItem(delete);
            return true;
        } catch (ConditionalCheckFailedException e) {
            return false;
        } catch (DynamoDbException e) {
            throw new LockStoreException("DeleteItem on " + table + " failed: " + errorCode(e), e, false);
        } catch (SdkClientException e) {
            throw new LockStoreException("DeleteItem on " + table + " failed: " + e.getMessage(), e, true);
        }
    }

    @Override
    public Optional<LockRecord> find(String key) {
        GetItemRequest get = GetItemRequest.builder()
                .tableName(table)
                .key(Map.of(PK, AttributeValue.fromS(key)))
                .consistentRead(true)
                .build();

        GetItemResponse response;
        try {
            response = dynamoDb.getItem(get);
        } catch (DynamoDbException e) {
            throw new LockStoreException("GetItem on " + table + " failed: " + errorCode(e), e, false);
        } catch (SdkClientException e) {
            throw new LockStoreException("GetItem on " + table + " failed: " + e.getMessage(), e, true);
        }
        if (!response.hasItem() || response.item().isEmpty()) {
            return Optional.empty();
        }
        Map<String, AttributeValue> item = response.item();
        AttributeValue lockId = item.get(LOCK_ID);
        AttributeValue expiresAt = item.get(EXPIRES_AT);
        if (lockId == null || expiresAt == null || expiresAt.n() == null) {
            throw new LockStoreException("Malformed lock record for " + key + " in " + table, null, false);
        }
        return Optional.of(new LockRecord(lockId.s(), fromEpochSeconds(expiresAt.n())));
    }

    static String epochSeconds(Instant instant) {
        return BigDecimal.valueOf(instant.getEpochSecond())
                .add(BigDecimal.valueOf(instant.getNano(), 9))
                .stripTrailingZeros()
                .toPlainString();
    }

    static Instant fromEpochSeconds(String value) {
        BigDecimal seconds = new BigDecimal(value);
        long whole = seconds.longValue();
        int nanos = seconds.subtract(BigDecimal.valueOf(whole)).movePointRight(9).intValue();
        return Instant.ofEpochSecond(whole, nanos);
    }

    private static String errorCode(DynamoDbException e) {
        if (e.awsErrorDetails() != null && e.awsErrorDetails().errorCode() != null) {
            return e.awsErrorDetails().errorCode();
        }
        return String.valueOf(e.statusCode());
    }
}
