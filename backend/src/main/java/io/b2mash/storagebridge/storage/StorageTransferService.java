package io.b2mash.storagebridge.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Copies buckets from the self-hosted backend to the cloud backend, independently of the current
 * target. Objects travel through a local temporary file one at a time.
 *
 * <p>There is no resumption or rollback: a failure leaves the objects handled so far transferred
 * and the rest untouched. Running the transfer again finishes the job (with {@code
 * forceOverwrite}, or after removing the already transferred objects from the cloud side).
 */
@Service
public class StorageTransferService {

  private static final Logger log = LoggerFactory.getLogger(StorageTransferService.class);

  private final StorageBackendRegistry backendRegistry;

  public StorageTransferService(StorageBackendRegistry backendRegistry) {
    this.backendRegistry = backendRegistry;
  }

  /**
   * @param removeFromSource delete each object from the self-hosted side once uploaded, then the
   *     bucket itself
   * @param forceOverwrite replace objects that already exist on the cloud side instead of failing
   * @return false, with no side effects, when the source bucket doesn't exist. Also false when
   *     the cloud side refused an object; such objects and the source bucket are kept
   * @throws io.b2mash.storagebridge.exception.ObjectConflictException if an object already exists
   *     on the cloud side and {@code forceOverwrite} is false
   */
  public boolean transferBucketFromSelfHostedToCloud(
      String bucket, boolean removeFromSource, boolean forceOverwrite) {
    var source = backendRegistry.find(StorageTarget.SELF_HOSTED).orElse(null);
    var destination = backendRegistry.find(StorageTarget.CLOUD).orElse(null);
    if (source == null || destination == null) {
      log.warn(
          "Transfer of bucket {} needs both backends, available: {}",
          bucket,
          backendRegistry.availableTargets());
      return false;
    }

    if (!source.bucketExists(bucket)) {
      log.info("Bucket {} doesn't exist on the self-hosted backend, nothing to transfer", bucket);
      return false;
    }
    if (!destination.bucketExists(bucket)) {
      destination.createBucket(bucket);
    }

    var objects = source.listObjects(bucket, null);
    log.info("Transferring {} objects of bucket {} to the cloud backend", objects.size(), bucket);

    var skipped = new ArrayList<String>();
    Path workDir = createWorkDir();
    try {
      int index = 0;
      for (var objectName : objects) {
        var localFile = workDir.resolve("object-" + index++);
        boolean uploaded;
        try {
          var downloaded =
              source
                  .downloadObject(bucket, objectName, "", localFile.toString())
                  .orElseThrow(
                      () ->
                          new IllegalStateException(
                              "Bucket " + bucket + " disappeared during transfer"));
          uploaded = destination.uploadObject(bucket, objectName, downloaded, forceOverwrite);
        } finally {
          deleteLocalFile(localFile);
        }
        if (!uploaded) {
          // the object stays on the self-hosted side
          skipped.add(objectName);
          continue;
        }
        if (removeFromSource) {
          source.deleteObject(bucket, objectName);
        }
      }
    } finally {
      deleteLocalFile(workDir);
    }

    if (!skipped.isEmpty()) {
      log.warn(
          "Transfer of bucket {} incomplete, {} objects were not uploaded and kept on the"
              + " self-hosted side: {}",
          bucket,
          skipped.size(),
          skipped);
      return false;
    }
    if (removeFromSource) {
      source.removeBucket(bucket);
    }
    log.info("Transferred bucket {} (removeFromSource={})", bucket, removeFromSource);
    return true;
  }

  private static Path createWorkDir() {
    try {
      return Files.createTempDirectory("storage-transfer-");
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create a temporary directory for the transfer", e);
    }
  }

  private static void deleteLocalFile(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Could not delete temporary file {}: {}", path, e.getMessage());
    }
  }
}
