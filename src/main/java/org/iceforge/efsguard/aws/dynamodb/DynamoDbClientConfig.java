package org.iceforge.efsguard.aws.dynamodb;

import org.iceforge.efsguard.aws.EfsGuardAwsProperties;
import org.iceforge.efsguard.lock.LockProperties;
import org.iceforge.efsguard.lock.LockStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

import java.net.URI;
import java.time.Duration;

/**
 * DynamoDB client and lock store.
 * <p>
 * The client fails fast (1s per attempt, one SDK retry): acquire() already retries with its
 * own budget, so long SDK-level retries would only eat into the wait timeout.
 */
@Configuration
@ConditionalOnProperty(prefix = "efsguard.lock", name = "store", havingValue = "dynamodb", matchIfMissing = true)
public class DynamoDbClientConfig {

    @Bean
    public DynamoDbClient dynamoDbClient(EfsGuardAwsProperties props) {
        DynamoDbClientBuilder b = DynamoDbClient.builder()
                .credentialsProvider(DefaultCredentialsProvider.create())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallAttemptTimeout(Duration.ofSeconds(1))
                        .retryPolicy(RetryPolicy.builder().numRetries(1).build())
                        .build());

        if (props.region() != null && !props.region().isBlank()) {
            b = b.region(Region.of(props.region()));
        }
        if (props.dynamodb() != null && props.dynamodb().endpoint() != null && !props.dynamodb().endpoint().isBlank()) {
            b = b.endpointOverride(URI.create(props.dynamodb().endpoint()));
        }

        return b.build();
    }

    @Bean
    public LockStore dynamoDbLockStore(DynamoDbClient dynamoDb, LockProperties props) {
        return new DynamoDbLockStore(dynamoDb, props.getDynamodb().getTable());
    }
}
