package io.b2mash.storagebridge.storage.s3;

import io.b2mash.storagebridge.config.S3ClientFactory;
import io.b2mash.storagebridge.config.S3Config.AwsProperties;
import io.b2mash.storagebridge.config.S3Config.StsProperties;
import io.b2mash.storagebridge.config.S3Connection;
import io.b2mash.storagebridge.exception.StorageConfigurationException;
import io.b2mash.storagebridge.storage.AccessPolicy;
import io.b2mash.storagebridge.storage.StorageTarget;
import io.b2mash.storagebridge.storage.StorageTargetResolver;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.s3.model.CreateBucketConfiguration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;

/**
 * AWS S3 backend. Buckets are created in the configured region. Download credentials are scoped to
 * the single requested object.
 */
@Component
@ConditionalOnProperty(name = "s3.aws.enabled", havingValue = "true", matchIfMissing = true)
public class AwsStorageAdapter extends AbstractS3StorageAdapter {

  private static final Logger log = LoggerFactory.getLogger(AwsStorageAdapter.class);

  /** us-east-1 is the default location and must not be sent as a location constraint. */
  static final String DEFAULT_LOCATION = "us-east-1";

  static final String UPLOAD_SESSION_NAME = "StorageUploadSession";
  static final String DOWNLOAD_SESSION_NAME = "StorageDownloadSession";
  static final Duration DEFAULT_SESSION_DURATION = Duration.ofHours(1);

  private final AwsProperties properties;
  private final StorageTargetResolver targetResolver;

  @Autowired
  public AwsStorageAdapter(AwsProperties properties, StorageTargetResolver targetResolver) {
    this(properties, targetResolver, new S3ClientFactory(), Clock.systemUTC());
  }

  AwsStorageAdapter(
      AwsProperties properties,
      StorageTargetResolver targetResolver,
      S3ClientFactory clientFactory,
      Clock clock) {
    super("AWS", clientFactory, clock);
    this.properties = properties;
    this.targetResolver = targetResolver;
  }

  @Override
  public StorageTarget target() {
    return StorageTarget.CLOUD;
  }

  @Override
  public boolean createBucket(String bucket) {
    var region = properties.region();
    if (isBlank(region)) {
      throw new StorageConfigurationException(
          "Region not set", "s3.aws.region is required to create bucket " + bucket + " on AWS");
    }
    var request = CreateBucketRequest.builder().bucket(bucket);
    if (!DEFAULT_LOCATION.equals(region)) {
      request.createBucketConfiguration(
          CreateBucketConfiguration.builder().locationConstraint(region).build());
    }
    s3().createBucket(request.build());
    log.info("Created bucket {} on AWS in {}", bucket, region);
    return true;
  }

  @Override
  protected S3Connection dataPlaneConnection() {
    if (isBlank(properties.endpoint()) || isBlank(properties.region())) {
      throw StorageConfigurationException.notConnected("AWS", "s3.aws.endpoint/s3.aws.region");
    }
    if (isBlank(properties.accessKey()) || isBlank(properties.secretKey())) {
      throw StorageConfigurationException.notConnected(
          "AWS", "s3.aws.access-key/s3.aws.secret-key");
    }
    var target = targetResolver.resolve();
    if (target != StorageTarget.CLOUD) {
      // both backends are needed while migrating, so this is not an error
      log.info("Connecting to AWS while the storage target is {}", target);
    }
    return new S3Connection(
        S3Connection.resolveEndpoint(properties.endpoint(), true),
        properties.region(),
        properties.accessKey(),
        properties.secretKey(),
        false);
  }

  @Override
  protected S3Connection credentialConnection() {
    var sts = sts();
    var region = firstNonBlank(sts.region(), properties.region());
    var accessKey = firstNonBlank(sts.accessKey(), properties.accessKey());
    var secretKey = firstNonBlank(sts.secretKey(), properties.secretKey());
    if (isBlank(region) || isBlank(accessKey) || isBlank(secretKey)) {
      throw StorageConfigurationException.notConnected(
          "AWS STS", "s3.aws.sts.region/access-key/secret-key");
    }
    return new S3Connection(
        S3Connection.resolveEndpoint(sts.endpoint(), true), region, accessKey, secretKey, false);
  }

  @Override
  protected RoleSession uploadRoleSession() {
    var sts = sts();
    return new RoleSession(
        requireRoleArn(sts.uploadRoleArn(), "s3.aws.sts.upload-role-arn"),
        firstNonBlank(sts.uploadSessionName(), UPLOAD_SESSION_NAME),
        sessionDuration(sts));
  }

  @Override
  protected RoleSession downloadRoleSession() {
    var sts = sts();
    return new RoleSession(
        requireRoleArn(sts.downloadRoleArn(), "s3.aws.sts.download-role-arn"),
        firstNonBlank(sts.downloadSessionName(), DOWNLOAD_SESSION_NAME),
        sessionDuration(sts));
  }

  @Override
  protected AccessPolicy downloadPolicy(String bucket, String objectName) {
    return AccessPolicy.forObjectDownload(bucket, objectName);
  }

  private StsProperties sts() {
    return properties.sts() != null
        ? properties.sts()
        : new StsProperties(null, null, null, null, null, null, null, null, null);
  }

  private static String requireRoleArn(String roleArn, String property) {
    if (isBlank(roleArn)) {
      throw new StorageConfigurationException(
          "Role not set", property + " is required to issue scoped credentials on AWS");
    }
    return roleArn;
  }

  private static Duration sessionDuration(StsProperties sts) {
    return sts.sessionDuration() != null ? sts.sessionDuration() : DEFAULT_SESSION_DURATION;
  }
}
