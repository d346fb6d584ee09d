package io.b2mash.storagebridge.storage;

import java.time.Instant;

/**
 * A signed GET or PUT link. {@code expiresAt} is computed from the local clock when signing, the
 * provider enforces the real expiry.
 */
public record PresignedUrl(String url, Instant expiresAt) {

  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }
}
