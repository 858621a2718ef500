package com.wifi.roaming.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

import java.net.URI;
import java.time.Duration;

/**
 * DynamoDB clients for the roaming state table. Only active with {@code roaming.store.type=dynamodb}.
 *
 * <p>Outside the {@code local} profile the default credential provider chain applies. With
 * {@code local} the client signs with static credentials so it can talk to DynamoDB Local at
 * {@code aws.dynamodb.endpoint}.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "roaming.store", name = "type", havingValue = "dynamodb")
public class DynamoDBConfig {

    /** Upper bound for one save or load, SDK retries included. */
    private static final Duration API_CALL_TIMEOUT = Duration.ofSeconds(10);

    @Bean
    public DynamoDbClient roamingStateDynamoDbClient(
            @Value("${aws.dynamodb.region:us-east-1}") String region,
            @Value("${aws.dynamodb.endpoint:}") String endpoint,
            Environment environment) {
        boolean local = environment.acceptsProfiles(Profiles.of("local"));

        DynamoDbClientBuilder builder = DynamoDbClient.builder()
                .region(Region.of(region))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(API_CALL_TIMEOUT)
                        .build());
        if (StringUtils.hasText(endpoint)) {
            builder.endpointOverride(URI.create(endpoint));
        }
        if (local) {
            builder.credentialsProvider(StaticCredentialsProvider.create(
                    AwsBasicCredentials.create("local", "local")));
        }

        log.info("Roaming state DynamoDB client: region={}, endpoint={}, local={}",
                region, StringUtils.hasText(endpoint) ? endpoint : "default", local);
        return builder.build();
    }

    @Bean
    public DynamoDbEnhancedClient roamingStateEnhancedClient(DynamoDbClient roamingStateDynamoDbClient) {
        return DynamoDbEnhancedClient.builder()
                .dynamoDbClient(roamingStateDynamoDbClient)
                .build();
    }
}
