package io.b2mash.storagebridge.storage.s3;

import io.b2mash.storagebridge.config.S3ClientFactory;
import io.b2mash.storagebridge.config.S3Connection;
import io.b2mash.storagebridge.exception.ObjectConflictException;
import io.b2mash.storagebridge.exception.ObjectNotFoundException;
import io.b2mash.storagebridge.storage.AccessPolicy;
import io.b2mash.storagebridge.storage.CredentialGrant;
import io.b2mash.storagebridge.storage.LazyClient;
import io.b2mash.storagebridge.storage.PresignedPostForm;
import io.b2mash.storagebridge.storage.PresignedUrl;
import io.b2mash.storagebridge.storage.StorageBackend;
import jakarta.annotation.Nullable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Bucket;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListBucketsRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PutObjectPresignRequest;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;
import software.amazon.awssdk.services.sts.model.AssumeRoleResponse;

/**
 * Operation set shared by every S3-compatible backend. Subclasses supply connection parameters,
 * bucket creation and the download policy; all AWS SDK types stay inside this package.
 *
 * <p>Clients are built lazily on first use and held until {@link #reconnect()}.
 */
public abstract class AbstractS3StorageAdapter implements StorageBackend {

  private static final Logger log = LoggerFactory.getLogger(AbstractS3StorageAdapter.class);

  static final Duration ACCESS_LINK_EXPIRY = Duration.ofHours(1);
  static final Duration UPLOAD_LINK_EXPIRY = Duration.ofHours(12);
  static final String ACCESS_LINK_CONTENT_TYPE = "application/json";
  static final String TEMP_FILE_PREFIX = "tmpfile.";

  private final LazyClient<S3Client> s3Client;
  private final LazyClient<S3Presigner> s3Presigner;
  private final LazyClient<StsClient> stsClient;
  private final PresignedPostFormBuilder postFormBuilder;
  protected final Clock clock;

  protected AbstractS3StorageAdapter(String name, S3ClientFactory clientFactory, Clock clock) {
    this.clock = clock;
    this.s3Client =
        new LazyClient<>(name + " S3", () -> clientFactory.s3Client(dataPlaneConnection()));
    this.s3Presigner =
        new LazyClient<>(
            name + " presigner", () -> clientFactory.s3Presigner(dataPlaneConnection()));
    this.stsClient =
        new LazyClient<>(name + " STS", () -> clientFactory.stsClient(credentialConnection()));
    this.postFormBuilder = new PresignedPostFormBuilder(clock);
  }

  /**
   * Connection for bucket and object calls.
   *
   * @throws io.b2mash.storagebridge.exception.StorageConfigurationException if endpoint or keys
   *     are missing
   */
  protected abstract S3Connection dataPlaneConnection();

  /** Connection for the AssumeRole sub-call, which may use its own endpoint and keys. */
  protected abstract S3Connection credentialConnection();

  protected abstract RoleSession uploadRoleSession();

  protected abstract RoleSession downloadRoleSession();

  protected abstract AccessPolicy downloadPolicy(String bucket, String objectName);

  /** Role and session the scoped credentials are issued under. */
  protected record RoleSession(String roleArn, String sessionName, Duration duration) {}

  /** Drops all clients; the next call rebuilds them from the current configuration. */
  public void reconnect() {
    s3Client.reset();
    s3Presigner.reset();
    stsClient.reset();
  }

  protected S3Client s3() {
    return s3Client.get();
  }

  @Override
  public boolean bucketExists(String bucket) {
    try {
      s3().headBucket(HeadBucketRequest.builder().bucket(bucket).build());
      return true;
    } catch (S3Exception e) {
      if (isNotFound(e)) {
        return false;
      }
      throw e;
    }
  }

  @Override
  public boolean removeBucket(String bucket) {
    s3().deleteBucket(DeleteBucketRequest.builder().bucket(bucket).build());
    log.info("Removed bucket {} from {}", bucket, target());
    return true;
  }

  @Override
  public boolean putObject(String bucket, String objectName, byte[] data, String contentType) {
    ensureBucket(bucket);
    var putRequest =
        PutObjectRequest.builder().bucket(bucket).key(objectName).contentType(contentType).build();
    s3().putObject(putRequest, RequestBody.fromBytes(data));
    return true;
  }

  @Override
  public String getObject(String bucket, String objectName) {
    return new String(getObjectBytes(bucket, objectName), StandardCharsets.UTF_8);
  }

  @Override
  public byte[] getObjectBytes(String bucket, String objectName) {
    if (!bucketExists(bucket)) {
      return new byte[0];
    }
    var getRequest = GetObjectRequest.builder().bucket(bucket).key(objectName).build();
    return s3().getObjectAsBytes(getRequest).asByteArray();
  }

  @Override
  public Optional<Path> downloadObject(
      String bucket, String objectName, String fileType, @Nullable String fileName) {
    if (!bucketExists(bucket)) {
      return Optional.empty();
    }
    var target =
        Path.of(fileName == null || fileName.isBlank() ? TEMP_FILE_PREFIX + fileType : fileName);
    try {
      Files.deleteIfExists(target);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to replace existing file " + target, e);
    }
    s3().getObject(GetObjectRequest.builder().bucket(bucket).key(objectName).build(), target);
    return Optional.of(target);
  }

  @Override
  public boolean uploadObject(String bucket, String objectName, Path localPath, boolean force) {
    if (!bucketExists(bucket)) {
      return false;
    }
    // check the source before touching an existing object
    if (!Files.exists(localPath)) {
      log.warn("Upload of {}/{} skipped, local file {} not found", bucket, objectName, localPath);
      return false;
    }
    if (objectExists(bucket, objectName)) {
      if (!force) {
        throw new ObjectConflictException(bucket, objectName);
      }
      deleteObject(bucket, objectName);
    }
    s3().putObject(
            PutObjectRequest.builder().bucket(bucket).key(objectName).build(),
            RequestBody.fromFile(localPath));
    return true;
  }

  @Override
  public boolean deleteObject(String bucket, String objectName) {
    if (!objectExists(bucket, objectName)) {
      return false;
    }
    s3().deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(objectName).build());
    return true;
  }

  @Override
  public boolean objectExists(String bucket, String objectName) {
    try {
      s3().headObject(HeadObjectRequest.builder().bucket(bucket).key(objectName).build());
      return true;
    } catch (S3Exception e) {
      if (isNotFound(e)) {
        return false;
      }
      throw e;
    }
  }

  @Override
  public PresignedUrl createAccessLink(String bucket, String objectName) {
    if (!objectExists(bucket, objectName)) {
      throw new ObjectNotFoundException(bucket, objectName);
    }
    var getRequest =
        GetObjectRequest.builder()
            .bucket(bucket)
            .key(objectName)
            .responseContentType(ACCESS_LINK_CONTENT_TYPE)
            .build();

    var presignRequest =
        GetObjectPresignRequest.builder()
            .signatureDuration(ACCESS_LINK_EXPIRY)
            .getObjectRequest(getRequest)
            .build();

    var presigned = s3Presigner.get().presignGetObject(presignRequest);
    return new PresignedUrl(
        presigned.url().toExternalForm(), clock.instant().plus(ACCESS_LINK_EXPIRY));
  }

  @Override
  public PresignedPostForm createDataUploadLink(String bucket, String objectName) {
    ensureBucket(bucket);
    return postFormBuilder.build(dataPlaneConnection(), bucket, objectName, UPLOAD_LINK_EXPIRY);
  }

  @Override
  public PresignedUrl createFileUploadLink(String bucket, String objectName) {
    ensureBucket(bucket);
    var putRequest = PutObjectRequest.builder().bucket(bucket).key(objectName).build();

    var presignRequest =
        PutObjectPresignRequest.builder()
            .signatureDuration(UPLOAD_LINK_EXPIRY)
            .putObjectRequest(putRequest)
            .build();

    var presigned = s3Presigner.get().presignPutObject(presignRequest);
    return new PresignedUrl(
        presigned.url().toExternalForm(), clock.instant().plus(UPLOAD_LINK_EXPIRY));
  }

  @Override
  public CredentialGrant getUploadCredentialsAndId(String bucket) {
    ensureBucket(bucket);
    return issueCredentials(uploadRoleSession(), AccessPolicy.forUpload(bucket));
  }

  @Override
  public CredentialGrant getDownloadCredentials(String bucket, String objectName) {
    ensureBucket(bucket);
    return issueCredentials(downloadRoleSession(), downloadPolicy(bucket, objectName));
  }

  @Override
  public boolean copyObject(
      String sourceBucket, String sourceObject, String targetBucket, String targetObject) {
    s3().copyObject(
            CopyObjectRequest.builder()
                .sourceBucket(sourceBucket)
                .sourceKey(sourceObject)
                .destinationBucket(targetBucket)
                .destinationKey(targetObject)
                .build());
    return true;
  }

  @Override
  public Set<String> listBuckets() {
    var names = new LinkedHashSet<String>();
    for (Bucket bucket : s3().listBuckets(ListBucketsRequest.builder().build()).buckets()) {
      names.add(bucket.name());
    }
    return names;
  }

  @Override
  public Set<String> listObjects(String bucket, @Nullable String prefix) {
    var names = new LinkedHashSet<String>();
    String continuationToken = null;
    ListObjectsV2Response page;
    do {
      page =
          s3().listObjectsV2(
                  ListObjectsV2Request.builder()
                      .bucket(bucket)
                      .prefix(prefix)
                      .continuationToken(continuationToken)
                      .build());
      for (S3Object object : page.contents()) {
        names.add(object.key());
      }
      continuationToken = page.nextContinuationToken();
    } while (Boolean.TRUE.equals(page.isTruncated()) && continuationToken != null);
    return names;
  }

  protected void ensureBucket(String bucket) {
    if (!bucketExists(bucket)) {
      createBucket(bucket);
    }
  }

  private CredentialGrant issueCredentials(RoleSession session, AccessPolicy policy) {
    var request =
        AssumeRoleRequest.builder()
            .roleArn(session.roleArn())
            .roleSessionName(session.sessionName())
            .policy(policy.toJson())
            .durationSeconds((int) session.duration().toSeconds())
            .build();
    var response = stsClient.get().assumeRole(request);
    log.debug(
        "Issued scoped credentials on {} for session {}, expiring {}",
        target(),
        session.sessionName(),
        response.credentials().expiration());
    return toGrant(response);
  }

  static CredentialGrant toGrant(AssumeRoleResponse response) {
    var credentials = response.credentials();
    var roleUser = response.assumedRoleUser();
    return new CredentialGrant(
        new CredentialGrant.TemporaryCredentials(
            credentials.accessKeyId(),
            credentials.secretAccessKey(),
            credentials.sessionToken(),
            credentials.expiration()),
        roleUser == null
            ? null
            : new CredentialGrant.AssumedRole(roleUser.assumedRoleId(), roleUser.arn()),
        response.packedPolicySize());
  }

  static boolean isNotFound(S3Exception e) {
    return e instanceof NoSuchBucketException
        || e instanceof NoSuchKeyException
        || e.statusCode() == 404;
  }

  static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  static String firstNonBlank(String value, String fallback) {
    return isBlank(value) ? fallback : value;
  }
}
