package io.b2mash.storagebridge.exception;

public class ObjectNotFoundException extends StorageException {

  public ObjectNotFoundException(String bucket, String objectName) {
    super(
        "Object not found",
        "Object " + objectName + " couldn't be found in bucket " + bucket);
  }
}
