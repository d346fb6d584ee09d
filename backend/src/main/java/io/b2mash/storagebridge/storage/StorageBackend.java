package io.b2mash.storagebridge.storage;

import jakarta.annotation.Nullable;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

/**
 * One object storage provider behind the operation set every backend supports. Domain code goes
 * through {@link StorageService}, which picks the implementation per call.
 *
 * <p>Missing buckets and objects are normal negative results ({@code false}, empty values), never
 * errors. Provider errors other than "not found" propagate unchanged.
 */
public interface StorageBackend {

  String DEFAULT_CONTENT_TYPE = "application/json";

  /** The target this backend answers for. */
  StorageTarget target();

  boolean bucketExists(String bucket);

  boolean createBucket(String bucket);

  /** Removes an empty bucket. The provider rejects the call if objects remain. */
  boolean removeBucket(String bucket);

  /** Writes the object, creating the bucket first if needed. Replaces any existing object. */
  boolean putObject(String bucket, String objectName, byte[] data, String contentType);

  default boolean putObject(
      String bucket, String objectName, String data, String contentType, Charset encoding) {
    return putObject(bucket, objectName, data.getBytes(encoding), contentType);
  }

  default boolean putObject(String bucket, String objectName, String data) {
    return putObject(bucket, objectName, data, DEFAULT_CONTENT_TYPE, StandardCharsets.UTF_8);
  }

  /** Object content decoded as UTF-8, or an empty string when the bucket doesn't exist. */
  String getObject(String bucket, String objectName);

  /** Raw object content, or an empty array when the bucket doesn't exist. */
  byte[] getObjectBytes(String bucket, String objectName);

  /**
   * Downloads the object to {@code fileName}, or to {@code tmpfile.<fileType>} in the working
   * directory when no name is given. A file already at that path is replaced.
   *
   * @return the written file, empty when the bucket doesn't exist
   */
  Optional<Path> downloadObject(
      String bucket, String objectName, String fileType, @Nullable String fileName);

  /**
   * Uploads a local file.
   *
   * @return false when the bucket or the local file doesn't exist
   * @throws io.b2mash.storagebridge.exception.ObjectConflictException if the object exists and
   *     {@code force} is false. With {@code force} the existing object is deleted before the
   *     upload, so readers may briefly see no object at all.
   */
  boolean uploadObject(String bucket, String objectName, Path localPath, boolean force);

  /** Returns false, without error, when there was nothing to delete. */
  boolean deleteObject(String bucket, String objectName);

  boolean objectExists(String bucket, String objectName);

  /**
   * GET link valid for one hour; the response is served as {@code application/json}.
   *
   * @throws io.b2mash.storagebridge.exception.ObjectNotFoundException if the object doesn't exist
   */
  PresignedUrl createAccessLink(String bucket, String objectName);

  /** POST-form upload valid for twelve hours. Creates the bucket if needed. */
  PresignedPostForm createDataUploadLink(String bucket, String objectName);

  /** PUT link valid for twelve hours. Creates the bucket if needed. */
  PresignedUrl createFileUploadLink(String bucket, String objectName);

  /**
   * Temporary credentials allowing read, write, delete and multipart uploads below the bucket,
   * plus location and listing on the bucket itself. Creates the bucket if needed.
   */
  CredentialGrant getUploadCredentialsAndId(String bucket);

  /** Temporary read-only credentials for downloading. Creates the bucket if needed. */
  CredentialGrant getDownloadCredentials(String bucket, String objectName);

  /** Server-side copy; no bytes pass through this process. */
  boolean copyObject(
      String sourceBucket, String sourceObject, String targetBucket, String targetObject);

  Set<String> listBuckets();

  /** Every object name below {@code prefix}, recursively. A null prefix lists the whole bucket. */
  Set<String> listObjects(String bucket, @Nullable String prefix);
}
