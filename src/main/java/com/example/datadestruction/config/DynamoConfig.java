package com.example.datadestruction.config;

import java.net.URI;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.awscore.retry.AwsRetryStrategy;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * Store clients. Target tables are addressed by name through the low-level client; the registry
 * table is mapped through the enhanced client.
 */
@Configuration
@Slf4j
public class DynamoConfig {

    @Bean
    public DynamoDbClient dynamo(
            @Value("${server.aws.region}") String region,
            @Value("${server.aws.endpoint}") String endpoint,
            @Value("${server.aws.use-localstack:true}") boolean useLocalstack,
            DestructionProperties properties) {
        int maxAttempts = properties.getStore().getSdkMaxAttempts();
        var builder = DynamoDbClient.builder()
                .region(Region.of(region))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .retryStrategy(AwsRetryStrategy.standardRetryStrategy()
                                .toBuilder()
                                .maxAttempts(maxAttempts)
                                .build())
                        .build());
        if (useLocalstack) {
            log.info("Using LocalStack DynamoDB at {}", endpoint);
            builder.endpointOverride(URI.create(endpoint))
                    .credentialsProvider(StaticCredentialsProvider.create(
                            AwsBasicCredentials.create("test", "test")));
        }
        log.info("DynamoDB client for project {} in {} (max attempts {})",
                properties.getProject(), region, maxAttempts);
        return builder.build();
    }

    @Bean
    public DynamoDbEnhancedClient dynamoEnhanced(DynamoDbClient dynamo) {
        return DynamoDbEnhancedClient.builder().dynamoDbClient(dynamo).build();
    }
}
