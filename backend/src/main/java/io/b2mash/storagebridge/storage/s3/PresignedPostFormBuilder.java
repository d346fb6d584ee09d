package io.b2mash.storagebridge.storage.s3;

import io.b2mash.storagebridge.config.S3Connection;
import io.b2mash.storagebridge.storage.PresignedPostForm;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

/**
 * Signs browser POST uploads (Signature Version 4 POST policy). The SDK presigner only covers
 * query-string requests, so the policy document and signature are computed here.
 */
class PresignedPostFormBuilder {

  static final String ALGORITHM = "AWS4-HMAC-SHA256";
  private static final String SERVICE = "s3";
  private static final String HMAC = "HmacSHA256";
  private static final DateTimeFormatter DATE =
      DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);
  private static final DateTimeFormatter AMZ_DATE =
      DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);
  private static final DateTimeFormatter POLICY_EXPIRATION =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

  private static final ObjectMapper MAPPER = JsonMapper.builder().build();

  private final Clock clock;

  PresignedPostFormBuilder(Clock clock) {
    this.clock = clock;
  }

  PresignedPostForm build(S3Connection connection, String bucket, String key, Duration expiry) {
    Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    Instant expiresAt = now.plus(expiry);
    String credential =
        connection.accessKey()
            + "/"
            + DATE.format(now)
            + "/"
            + connection.region()
            + "/"
            + SERVICE
            + "/aws4_request";
    String amzDate = AMZ_DATE.format(now);

    var policy = new LinkedHashMap<String, Object>();
    policy.put("expiration", POLICY_EXPIRATION.format(expiresAt));
    policy.put(
        "conditions",
        List.of(
            Map.of("bucket", bucket),
            Map.of("key", key),
            Map.of("x-amz-algorithm", ALGORITHM),
            Map.of("x-amz-credential", credential),
            Map.of("x-amz-date", amzDate)));
    String encodedPolicy =
        Base64.getEncoder()
            .encodeToString(MAPPER.writeValueAsString(policy).getBytes(StandardCharsets.UTF_8));

    byte[] signingKey = signingKey(connection.secretKey(), DATE.format(now), connection.region());
    String signature = HexFormat.of().formatHex(hmac(signingKey, encodedPolicy));

    var fields = new LinkedHashMap<String, String>();
    fields.put("key", key);
    fields.put("x-amz-algorithm", ALGORITHM);
    fields.put("x-amz-credential", credential);
    fields.put("x-amz-date", amzDate);
    fields.put("policy", encodedPolicy);
    fields.put("x-amz-signature", signature);

    return new PresignedPostForm(uploadUrl(connection, bucket), fields, expiresAt);
  }

  static String uploadUrl(S3Connection connection, String bucket) {
    URI endpoint =
        connection.endpoint() != null
            ? connection.endpoint()
            : URI.create("https://s3." + connection.region() + ".amazonaws.com");
    String base = endpoint.toString().replaceAll("/+$", "");
    if (connection.pathStyle()) {
      return base + "/" + bucket;
    }
    return endpoint.getScheme() + "://" + bucket + "." + endpoint.getAuthority();
  }

  static byte[] signingKey(String secretKey, String date, String region) {
    byte[] dateKey = hmac(("AWS4" + secretKey).getBytes(StandardCharsets.UTF_8), date);
    byte[] regionKey = hmac(dateKey, region);
    byte[] serviceKey = hmac(regionKey, SERVICE);
    return hmac(serviceKey, "aws4_request");
  }

  private static byte[] hmac(byte[] key, String data) {
    try {
      Mac mac = Mac.getInstance(HMAC);
      mac.init(new SecretKeySpec(key, HMAC));
      return mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("HmacSHA256 is not available", e);
    }
  }
}
