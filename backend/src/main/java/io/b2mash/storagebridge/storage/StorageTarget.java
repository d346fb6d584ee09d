package io.b2mash.storagebridge.storage;

/** Which backend answers a storage call. */
public enum StorageTarget {
  /** S3-compatible store run next to the application (MinIO). */
  SELF_HOSTED,
  /** Cloud object storage (AWS S3). */
  CLOUD,
  /** No backend available; calls degrade to neutral results. */
  UNKNOWN
}
