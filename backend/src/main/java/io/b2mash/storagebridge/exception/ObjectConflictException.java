package io.b2mash.storagebridge.exception;

public class ObjectConflictException extends StorageException {

  public ObjectConflictException(String bucket, String objectName) {
    super(
        "Object name already taken",
        "Object "
            + objectName
            + " already exists in bucket "
            + bucket
            + " -- to overwrite it, upload with force");
  }
}
