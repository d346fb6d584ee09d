package io.b2mash.storagebridge.storage;

import jakarta.annotation.Nullable;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for all object storage access. Every call resolves the current target, dispatches to
 * that backend and returns its result unchanged. When no backend serves the target, calls return
 * a neutral value ({@code false}, empty) instead of failing.
 *
 * <p>Composite operations (archive, recursive removal, empty-storage, tokenizer upload) run object
 * by object without locks or rollback. Each step is idempotent, so an interrupted run is finished
 * by running it again.
 */
@Service
public class StorageService {

  private static final Logger log = LoggerFactory.getLogger(StorageService.class);

  public static final String ARCHIVE_BUCKET = "archive";
  static final String TOKENIZER_OBJECT = "docbin_full";

  /** Tenant buckets are named after the organization id. */
  private static final Pattern TENANT_BUCKET_PATTERN =
      Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$");

  private final StorageTargetResolver targetResolver;
  private final StorageBackendRegistry backendRegistry;
  private final CredentialGrantFormatter credentialGrantFormatter;
  private final Set<StorageTarget> missingBackendsReported = ConcurrentHashMap.newKeySet();

  public StorageService(
      StorageTargetResolver targetResolver,
      StorageBackendRegistry backendRegistry,
      CredentialGrantFormatter credentialGrantFormatter) {
    this.targetResolver = targetResolver;
    this.backendRegistry = backendRegistry;
    this.credentialGrantFormatter = credentialGrantFormatter;
  }

  /** The target that would answer a call made now; UNKNOWN when no backend serves it. */
  public StorageTarget currentTarget() {
    return currentBackend().map(StorageBackend::target).orElse(StorageTarget.UNKNOWN);
  }

  // --- buckets ---

  public boolean bucketExists(String bucket) {
    return currentBackend().map(b -> b.bucketExists(bucket)).orElse(false);
  }

  public boolean createBucket(String bucket) {
    return currentBackend().map(b -> b.createBucket(bucket)).orElse(false);
  }

  public boolean removeBucket(String bucket) {
    return removeBucket(bucket, false);
  }

  /**
   * Removes a bucket. A bucket that still holds objects is emptied first when {@code recursive} is
   * set, otherwise it is left untouched and false is returned.
   */
  public boolean removeBucket(String bucket, boolean recursive) {
    var objects = listObjects(bucket, null);
    if (!objects.isEmpty()) {
      if (!recursive) {
        log.info("Bucket {} holds {} objects, not removing it", bucket, objects.size());
        return false;
      }
      for (var objectName : objects) {
        deleteObject(bucket, objectName);
      }
    }
    return currentBackend().map(b -> b.removeBucket(bucket)).orElse(false);
  }

  public Set<String> listBuckets() {
    return currentBackend().map(StorageBackend::listBuckets).orElse(Set.of());
  }

  public Set<String> listObjects(String bucket, @Nullable String prefix) {
    return currentBackend().map(b -> b.listObjects(bucket, prefix)).orElse(Set.of());
  }

  /**
   * Moves (or copies, when {@code deleteExisting} is false) the objects of a bucket into {@link
   * #ARCHIVE_BUCKET} under {@code "<bucket>/<objectName>"}. An archived object with the same key is
   * replaced. With {@code deleteExisting} the emptied source bucket is removed at the end.
   *
   * @param prefix only objects below this prefix (e.g. a project id); null for all
   * @return true once done, or null when the source bucket doesn't exist (nothing was ever stored)
   */
  @Nullable
  public Boolean archiveBucket(String bucket, @Nullable String prefix, boolean deleteExisting) {
    if (!bucketExists(bucket)) {
      log.debug("Bucket {} doesn't exist, nothing to archive", bucket);
      return null;
    }
    if (!bucketExists(ARCHIVE_BUCKET)) {
      createBucket(ARCHIVE_BUCKET);
    }

    var objects = listObjects(bucket, prefix);
    log.info("Archiving {} objects from bucket {} (prefix={})", objects.size(), bucket, prefix);
    for (var objectName : objects) {
      var archiveObjectName = archiveObjectName(bucket, objectName);
      if (objectExists(ARCHIVE_BUCKET, archiveObjectName)) {
        deleteObject(ARCHIVE_BUCKET, archiveObjectName);
      }
      copyObject(bucket, objectName, ARCHIVE_BUCKET, archiveObjectName);
      if (deleteExisting) {
        deleteObject(bucket, objectName);
      }
    }

    if (deleteExisting) {
      removeBucket(bucket);
    }
    return true;
  }

  @Nullable
  public Boolean archiveBucket(String bucket) {
    return archiveBucket(bucket, null, true);
  }

  static String archiveObjectName(String bucket, String objectName) {
    return bucket + "/" + objectName;
  }

  /**
   * Deletes every bucket and its objects. Does nothing unless {@code force} is set, which keeps
   * this safe to leave wired up outside local environments.
   *
   * @param onlyUuid when set, buckets whose name is not a UUID (archive, infrastructure) are kept
   * @return {@code force}
   */
  public boolean emptyStorage(boolean force, boolean onlyUuid) {
    if (!force) {
      return false;
    }
    for (var bucket : listBuckets()) {
      if (onlyUuid && !isTenantBucket(bucket)) {
        log.debug("Keeping non-tenant bucket {}", bucket);
        continue;
      }
      for (var objectName : listObjects(bucket, null)) {
        deleteObject(bucket, objectName);
      }
      removeBucket(bucket);
      log.info("Emptied and removed bucket {}", bucket);
    }
    return true;
  }

  public static boolean isTenantBucket(String bucket) {
    return bucket != null && TENANT_BUCKET_PATTERN.matcher(bucket).matches();
  }

  // --- objects ---

  public boolean putObject(String bucket, String objectName, String data) {
    return currentBackend().map(b -> b.putObject(bucket, objectName, data)).orElse(false);
  }

  public boolean putObject(String bucket, String objectName, byte[] data, String contentType) {
    return currentBackend()
        .map(b -> b.putObject(bucket, objectName, data, contentType))
        .orElse(false);
  }

  public String getObject(String bucket, String objectName) {
    return currentBackend().map(b -> b.getObject(bucket, objectName)).orElse("");
  }

  public byte[] getObjectBytes(String bucket, String objectName) {
    return currentBackend().map(b -> b.getObjectBytes(bucket, objectName)).orElse(new byte[0]);
  }

  public Optional<Path> downloadObject(
      String bucket, String objectName, String fileType, @Nullable String fileName) {
    return currentBackend().flatMap(b -> b.downloadObject(bucket, objectName, fileType, fileName));
  }

  public Optional<Path> downloadObject(String bucket, String objectName, String fileType) {
    return downloadObject(bucket, objectName, fileType, null);
  }

  public boolean uploadObject(String bucket, String objectName, Path localPath, boolean force) {
    return currentBackend()
        .map(b -> b.uploadObject(bucket, objectName, localPath, force))
        .orElse(false);
  }

  public boolean uploadObject(String bucket, String objectName, Path localPath) {
    return uploadObject(bucket, objectName, localPath, false);
  }

  public boolean deleteObject(String bucket, String objectName) {
    return currentBackend().map(b -> b.deleteObject(bucket, objectName)).orElse(false);
  }

  public boolean objectExists(String bucket, String objectName) {
    return currentBackend().map(b -> b.objectExists(bucket, objectName)).orElse(false);
  }

  public boolean copyObject(
      String sourceBucket, String sourceObject, String targetBucket, String targetObject) {
    return currentBackend()
        .map(b -> b.copyObject(sourceBucket, sourceObject, targetBucket, targetObject))
        .orElse(false);
  }

  /**
   * Replaces the serialized tokenizer output of a project, stored as {@code
   * "<projectId>/docbin_full"} (bare {@code docbin_full} without a project id).
   */
  public boolean uploadTokenizerData(String bucket, @Nullable String projectId, String data) {
    var objectName = tokenizerObjectName(projectId);
    if (!bucketExists(bucket)) {
      createBucket(bucket);
    }
    if (objectExists(bucket, objectName)) {
      deleteObject(bucket, objectName);
    }
    putObject(bucket, objectName, data);
    return true;
  }

  static String tokenizerObjectName(@Nullable String projectId) {
    return (projectId != null && !projectId.isEmpty() ? projectId + "/" : "") + TOKENIZER_OBJECT;
  }

  // --- presigned links ---

  public Optional<PresignedUrl> createAccessLink(String bucket, String objectName) {
    return currentBackend().map(b -> b.createAccessLink(bucket, objectName));
  }

  public Optional<PresignedPostForm> createDataUploadLink(String bucket, String objectName) {
    return currentBackend().map(b -> b.createDataUploadLink(bucket, objectName));
  }

  public Optional<PresignedUrl> createFileUploadLink(String bucket, String objectName) {
    return currentBackend().map(b -> b.createFileUploadLink(bucket, objectName));
  }

  // --- scoped credentials ---

  public Optional<String> getUploadCredentialsAndId(String bucket) {
    return getUploadCredentialsAndId(bucket, null, false);
  }

  /** Upload credentials for the bucket as stable JSON, tagged with the caller's task id. */
  public Optional<String> getUploadCredentialsAndId(
      String bucket, @Nullable String taskId, boolean onlyEssentials) {
    return getUploadCredentialsAndIdAsMap(bucket, taskId, onlyEssentials)
        .map(credentialGrantFormatter::toJson);
  }

  public Optional<Map<String, Object>> getUploadCredentialsAndIdAsMap(
      String bucket, @Nullable String taskId, boolean onlyEssentials) {
    return currentBackend()
        .map(b -> b.getUploadCredentialsAndId(bucket))
        .map(grant -> credentialGrantFormatter.toMap(grant, bucket, null, taskId, onlyEssentials));
  }

  public Optional<String> getDownloadCredentials(String bucket, String objectName) {
    return getDownloadCredentials(bucket, objectName, null, false);
  }

  public Optional<String> getDownloadCredentials(
      String bucket, String objectName, @Nullable String taskId, boolean onlyEssentials) {
    return getDownloadCredentialsAsMap(bucket, objectName, taskId, onlyEssentials)
        .map(credentialGrantFormatter::toJson);
  }

  public Optional<Map<String, Object>> getDownloadCredentialsAsMap(
      String bucket, String objectName, @Nullable String taskId, boolean onlyEssentials) {
    return currentBackend()
        .map(b -> b.getDownloadCredentials(bucket, objectName))
        .map(
            grant ->
                credentialGrantFormatter.toMap(
                    grant, bucket, objectName, taskId, onlyEssentials));
  }

  private Optional<StorageBackend> currentBackend() {
    var target = targetResolver.resolve();
    var backend = backendRegistry.find(target);
    if (backend.isEmpty()) {
      if (missingBackendsReported.add(target)) {
        log.warn("No storage backend registered for target {}, returning neutral results", target);
      } else {
        log.debug("No storage backend for target {}, neutral result", target);
      }
    }
    return backend;
  }
}
