package io.b2mash.storagebridge.config;

import java.net.URI;

/**
 * Fully resolved parameters for one SDK client. {@code endpoint} is null when the SDK should use
 * the provider's default regional endpoint.
 */
public record S3Connection(
    URI endpoint, String region, String accessKey, String secretKey, boolean pathStyle) {

  /** Turns a configured endpoint into a URI, adding a scheme when only host and port are given. */
  public static URI resolveEndpoint(String endpoint, boolean secure) {
    if (endpoint == null || endpoint.isBlank()) {
      return null;
    }
    if (endpoint.contains("://")) {
      return URI.create(endpoint);
    }
    return URI.create((secure ? "https://" : "http://") + endpoint);
  }

  @Override
  public String toString() {
    // keys stay out of logs
    return "S3Connection[endpoint=" + endpoint + ", region=" + region + "]";
  }
}
