package io.b2mash.storagebridge.storage;

import java.time.Instant;
import java.util.Map;

/**
 * Browser-style POST upload: the client submits a multipart form to {@code url} with every entry
 * of {@code fields} followed by the file part.
 */
public record PresignedPostForm(String url, Map<String, String> fields, Instant expiresAt) {

  public PresignedPostForm {
    fields = Map.copyOf(fields);
  }
}
