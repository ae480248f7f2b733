package org.iceforge.efsguard.aws;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "efsguard.aws")
public record EfsGuardAwsProperties(
        String region,
        DynamoDbProperties dynamodb
) {
    /**
     * @param endpoint optional endpoint override, e.g. DynamoDB Local
     */
    public record DynamoDbProperties(
            String endpoint
    ) {}
}
