package io.b2mash.storagebridge.exception;

/**
 * Raised when a backend is used without the connection parameters it needs. Always fatal for the
 * call; nothing is retried.
 */
public class StorageConfigurationException extends StorageException {

  public StorageConfigurationException(String title, String detail) {
    super(title, detail);
  }

  public static StorageConfigurationException notConnected(String backend, String missing) {
    return new StorageConfigurationException(
        "S3 not connected", backend + " client cannot be built, missing " + missing);
  }
}
