package io.b2mash.storagebridge.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Connection settings for both storage backends. Clients are not built here: each adapter builds
 * its own on first use, so a half-configured deployment still starts.
 */
@Configuration
@EnableConfigurationProperties({S3Config.MinioProperties.class, S3Config.AwsProperties.class})
public class S3Config {

  /**
   * Self-hosted, S3-compatible store. {@code endpoint} is usually a bare {@code host:port}; the
   * scheme then follows {@code secure}.
   */
  @ConfigurationProperties("s3.minio")
  public record MinioProperties(
      String endpoint,
      String accessKey,
      String secretKey,
      boolean secure,
      String region,
      String notificationQueueArn,
      StsProperties sts) {}

  @ConfigurationProperties("s3.aws")
  public record AwsProperties(
      String endpoint, String region, String accessKey, String secretKey, StsProperties sts) {}

  /**
   * Settings for the AssumeRole sub-call that issues scoped credentials. Blank endpoint or keys
   * fall back to the backend's data-plane values.
   */
  public record StsProperties(
      String endpoint,
      String region,
      String accessKey,
      String secretKey,
      String uploadRoleArn,
      String downloadRoleArn,
      String uploadSessionName,
      String downloadSessionName,
      Duration sessionDuration) {}
}
