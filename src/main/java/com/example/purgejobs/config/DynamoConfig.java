package com.example.purgejobs.config;

import java.net.URI;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * Store clients and the clock, built once at startup and injected everywhere they are needed.
 * Outside LocalStack the default AWS credential chain applies.
 */
@Configuration
public class DynamoConfig {

    @Bean
    public DynamoDbClient dynamo(
            @Value("${store.dynamodb.region}") String region,
            @Value("${store.dynamodb.endpoint}") String endpoint,
            @Value("${store.dynamodb.use-localstack:true}") boolean useLocalstack,
            @Value("${store.dynamodb.local-access-key:test}") String localAccessKey,
            @Value("${store.dynamodb.local-secret-key:test}") String localSecretKey) {
        var builder = DynamoDbClient.builder().region(Region.of(region));
        if (!useLocalstack) {
            return builder.build();
        }
        return builder.endpointOverride(URI.create(endpoint))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(localAccessKey, localSecretKey)))
                .build();
    }

    @Bean
    public DynamoDbEnhancedClient enhancedClient(DynamoDbClient dynamo) {
        return DynamoDbEnhancedClient.builder().dynamoDbClient(dynamo).build();
    }

    // Job timing decisions all read this clock.
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
