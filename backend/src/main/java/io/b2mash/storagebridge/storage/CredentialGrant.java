package io.b2mash.storagebridge.storage;

import jakarta.annotation.Nullable;
import java.time.Instant;

/**
 * Temporary credentials issued for one policy. Generated on demand and handed to the caller;
 * nothing is stored and the only revocation is expiry.
 */
public record CredentialGrant(
    TemporaryCredentials credentials,
    @Nullable AssumedRole assumedRoleUser,
    @Nullable Integer packedPolicySize) {

  public record TemporaryCredentials(
      String accessKeyId, String secretAccessKey, String sessionToken, Instant expiration) {

    @Override
    public String toString() {
      return "TemporaryCredentials[accessKeyId=" + accessKeyId + ", expiration=" + expiration + "]";
    }
  }

  public record AssumedRole(String assumedRoleId, String arn) {}
}
