/**
 * Configuration for the Amazon S3 client and presigner used for media storage
 *
 * Features:
 * - Creates S3 beans only when credentials and bucket are present
 * - Supports custom endpoint URL for MinIO or other S3 compatible services
 * - Uses path-style addressing whenever a custom endpoint is configured
 */
package net.clipforge.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;

@Configuration
@Conditional(S3EnvironmentCondition.class)
public class S3Config {
    private static final Logger logger = LoggerFactory.getLogger(S3Config.class);

    private final String accessKeyId;
    private final String secretAccessKey;
    private final String s3ServerUrl;
    private final String s3Region;

    public S3Config(@Value("${s3.access-key-id:${S3_ACCESS_KEY_ID:}}") String accessKeyId,
                    @Value("${s3.secret-access-key:${S3_SECRET_ACCESS_KEY:}}") String secretAccessKey,
                    @Value("${s3.server-url:${S3_SERVER_URL:}}") String s3ServerUrl,
                    @Value("${s3.region:${AWS_REGION:us-west-2}}") String s3Region) {
        this.accessKeyId = accessKeyId;
        this.secretAccessKey = secretAccessKey;
        this.s3ServerUrl = s3ServerUrl;
        this.s3Region = s3Region;
    }

    /**
     * Creates the S3Client used for all media reads and writes.
     *
     * @return Configured S3Client instance
     */
    @Bean(destroyMethod = "close")
    public S3Client s3Client() {
        requireCredentials();
        try {
            var builder = S3Client.builder()
                    .region(Region.of(s3Region))
                    .credentialsProvider(credentialsProvider());
            if (hasText(s3ServerUrl)) {
                builder.endpointOverride(URI.create(s3ServerUrl))
                        .serviceConfiguration(pathStyle());
                logger.info("Configuring S3Client with custom endpoint {} and region {}", s3ServerUrl, s3Region);
            } else {
                logger.info("Configuring S3Client for AWS-managed endpoint in region {}", s3Region);
            }
            return builder.build();
        } catch (RuntimeException ex) {
            logger.error("Failed to create S3Client bean due to configuration error", ex);
            throw new IllegalStateException("Failed to configure S3Client", ex);
        }
    }

    /**
     * Creates the presigner that issues time-limited read URLs.
     */
    @Bean(destroyMethod = "close")
    public S3Presigner s3Presigner() {
        requireCredentials();
        var builder = S3Presigner.builder()
                .region(Region.of(s3Region))
                .credentialsProvider(credentialsProvider());
        if (hasText(s3ServerUrl)) {
            builder.endpointOverride(URI.create(s3ServerUrl))
                    .serviceConfiguration(pathStyle());
        }
        return builder.build();
    }

    private void requireCredentials() {
        if (!hasText(accessKeyId) || !hasText(secretAccessKey)) {
            throw new IllegalStateException("S3 credentials are incomplete. Ensure s3.access-key-id and s3.secret-access-key are configured.");
        }
    }

    private StaticCredentialsProvider credentialsProvider() {
        return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKeyId, secretAccessKey));
    }

    private static S3Configuration pathStyle() {
        return S3Configuration.builder().pathStyleAccessEnabled(true).build();
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
