package com.example.resq_ai.config;

import com.example.resq_ai.service.Interfaces.ObjectStore;
import com.example.resq_ai.service.LocalObjectStore;
import com.example.resq_ai.service.S3ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

@EnableConfigurationProperties(StorageProperties.class)
@Configuration
public class StorageConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(StorageConfig.class);

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "storage.backend", havingValue = "s3", matchIfMissing = true)
    public S3Client s3Client(StorageProperties properties) {
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(properties.getRegion()))
                .credentialsProvider(credentials(properties))
                .forcePathStyle(properties.isPathStyleAccess())
                // attempts are counted by the pipeline's Retry, one SDK call per attempt
                .overrideConfiguration(c -> c.retryPolicy(RetryPolicy.none()));
        if (properties.getEndpointOverride() != null && !properties.getEndpointOverride().isBlank()) {
            builder.endpointOverride(URI.create(properties.getEndpointOverride()));
        }
        LOGGER.info("S3 client wired: region={}, endpoint={}, staticCredentials={}",
                properties.getRegion(), properties.getEndpointOverride(), properties.hasStaticCredentials());
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(name = "storage.backend", havingValue = "s3", matchIfMissing = true)
    public ObjectStore s3ObjectStore(S3Client s3Client, StorageProperties properties) {
        return new S3ObjectStore(s3Client, properties.getMaxObjectBytes(),
                Duration.ofMillis(properties.getDefaultTimeoutMs()));
    }

    @Bean
    @ConditionalOnProperty(name = "storage.backend", havingValue = "local")
    public ObjectStore localObjectStore(StorageProperties properties) {
        Path base = Path.of(properties.getLocal().getBaseDir());
        LOGGER.info("Storage wired: backend=local, base={}", base);
        return new LocalObjectStore(base, properties.getMaxObjectBytes());
    }

    private static AwsCredentialsProvider credentials(StorageProperties properties) {
        if (properties.hasStaticCredentials()) {
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(properties.getAccessKeyId(), properties.getSecretAccessKey()));
        }
        return DefaultCredentialsProvider.create();
    }
}
