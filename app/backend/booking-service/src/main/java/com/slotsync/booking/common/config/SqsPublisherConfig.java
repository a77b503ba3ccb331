package com.slotsync.booking.common.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.SqsAsyncClientBuilder;

import java.net.URI;
import java.time.Duration;

/**
 * SQS Publisher 설정
 * Booking-Service -> Notification-Lambda로 예약 이벤트 발행
 *
 * 발행은 예약 트랜잭션과 분리된 비동기 호출이며, 호출당 제한 시간을 둔다.
 */
@Configuration
public class SqsPublisherConfig {

    @Value("${aws.sqs.endpoint:}")
    private String sqsEndpoint;

    @Value("${aws.region:ap-northeast-2}")
    private String region;

    @Value("${aws.sqs.api-call-timeout-seconds:10}")
    private long apiCallTimeoutSeconds;

    @Bean
    public SqsAsyncClient sqsAsyncClient() {
        SqsAsyncClientBuilder builder = SqsAsyncClient.builder()
                .region(Region.of(region))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(Duration.ofSeconds(apiCallTimeoutSeconds))
                        .build());

        // LocalStack
        if (sqsEndpoint != null && !sqsEndpoint.isBlank()) {
            builder.endpointOverride(URI.create(sqsEndpoint));
        }

        return builder.build();
    }
}
