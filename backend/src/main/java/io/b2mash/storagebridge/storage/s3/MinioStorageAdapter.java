package io.b2mash.storagebridge.storage.s3;

import io.b2mash.storagebridge.config.S3ClientFactory;
import io.b2mash.storagebridge.config.S3Config.MinioProperties;
import io.b2mash.storagebridge.config.S3Config.StsProperties;
import io.b2mash.storagebridge.config.S3Connection;
import io.b2mash.storagebridge.exception.StorageConfigurationException;
import io.b2mash.storagebridge.storage.AccessPolicy;
import io.b2mash.storagebridge.storage.StorageTarget;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.NotificationConfiguration;
import software.amazon.awssdk.services.s3.model.PutBucketNotificationConfigurationRequest;
import software.amazon.awssdk.services.s3.model.QueueConfiguration;

/**
 * Self-hosted MinIO backend. New buckets get an {@code s3:ObjectCreated:*} notification to the
 * configured queue so downstream services learn about uploads.
 *
 * <p>MinIO ignores the role ARN and session name of AssumeRole; the session policy alone scopes
 * the issued credentials. Download credentials cover the whole bucket here, unlike the cloud
 * backend which scopes them to one object.
 */
@Component
@ConditionalOnProperty(name = "s3.minio.enabled", havingValue = "true", matchIfMissing = true)
public class MinioStorageAdapter extends AbstractS3StorageAdapter {

  private static final Logger log = LoggerFactory.getLogger(MinioStorageAdapter.class);

  static final String DEFAULT_REGION = "us-east-1";
  static final String DEFAULT_STS_REGION = "eu-west-1";
  static final String IGNORED_ROLE_ARN = "arn:x:ignored:by:minio:";
  static final String IGNORED_SESSION_NAME = "ignored-by-minio";
  static final Duration DEFAULT_SESSION_DURATION = Duration.ofSeconds(12000);
  static final String OBJECT_CREATED_EVENT = "s3:ObjectCreated:*";

  private final MinioProperties properties;

  @Autowired
  public MinioStorageAdapter(MinioProperties properties) {
    this(properties, new S3ClientFactory(), Clock.systemUTC());
  }

  MinioStorageAdapter(MinioProperties properties, S3ClientFactory clientFactory, Clock clock) {
    super("MinIO", clientFactory, clock);
    this.properties = properties;
  }

  @Override
  public StorageTarget target() {
    return StorageTarget.SELF_HOSTED;
  }

  @Override
  public boolean createBucket(String bucket) {
    s3().createBucket(CreateBucketRequest.builder().bucket(bucket).build());
    log.info("Created bucket {} on MinIO", bucket);

    var queueArn = properties.notificationQueueArn();
    if (!isBlank(queueArn)) {
      var queue =
          QueueConfiguration.builder()
              .id("1")
              .queueArn(queueArn)
              .eventsWithStrings(OBJECT_CREATED_EVENT)
              .build();
      s3().putBucketNotificationConfiguration(
              PutBucketNotificationConfigurationRequest.builder()
                  .bucket(bucket)
                  .notificationConfiguration(
                      NotificationConfiguration.builder().queueConfigurations(queue).build())
                  .build());
    }
    return true;
  }

  @Override
  protected S3Connection dataPlaneConnection() {
    if (isBlank(properties.endpoint())) {
      throw StorageConfigurationException.notConnected("MinIO", "s3.minio.endpoint");
    }
    if (isBlank(properties.accessKey()) || isBlank(properties.secretKey())) {
      throw StorageConfigurationException.notConnected(
          "MinIO", "s3.minio.access-key/s3.minio.secret-key");
    }
    return new S3Connection(
        S3Connection.resolveEndpoint(properties.endpoint(), properties.secure()),
        firstNonBlank(properties.region(), DEFAULT_REGION),
        properties.accessKey(),
        properties.secretKey(),
        true);
  }

  @Override
  protected S3Connection credentialConnection() {
    var dataPlane = dataPlaneConnection();
    var sts = sts();
    var endpoint = S3Connection.resolveEndpoint(sts.endpoint(), properties.secure());
    return new S3Connection(
        endpoint != null ? endpoint : dataPlane.endpoint(),
        firstNonBlank(sts.region(), DEFAULT_STS_REGION),
        firstNonBlank(sts.accessKey(), dataPlane.accessKey()),
        firstNonBlank(sts.secretKey(), dataPlane.secretKey()),
        true);
  }

  @Override
  protected RoleSession uploadRoleSession() {
    var sts = sts();
    return new RoleSession(
        firstNonBlank(sts.uploadRoleArn(), IGNORED_ROLE_ARN),
        firstNonBlank(sts.uploadSessionName(), IGNORED_SESSION_NAME),
        sessionDuration(sts));
  }

  @Override
  protected RoleSession downloadRoleSession() {
    var sts = sts();
    return new RoleSession(
        firstNonBlank(sts.downloadRoleArn(), IGNORED_ROLE_ARN),
        firstNonBlank(sts.downloadSessionName(), IGNORED_SESSION_NAME),
        sessionDuration(sts));
  }

  @Override
  protected AccessPolicy downloadPolicy(String bucket, String objectName) {
    return AccessPolicy.forBucketDownload(bucket);
  }

  private StsProperties sts() {
    return properties.sts() != null
        ? properties.sts()
        : new StsProperties(null, null, null, null, null, null, null, null, null);
  }

  private static Duration sessionDuration(StsProperties sts) {
    return sts.sessionDuration() != null ? sts.sessionDuration() : DEFAULT_SESSION_DURATION;
  }
}
