package io.b2mash.storagebridge.storage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

/**
 * Inline session policy passed to AssumeRole. The issued credentials can do at most what this
 * policy allows, whatever the role itself grants.
 */
@JsonPropertyOrder({"Version", "Statement"})
public record AccessPolicy(
    @JsonProperty("Version") String version,
    @JsonProperty("Statement") List<Statement> statements) {

  public static final String VERSION = "2012-10-17";

  static final List<String> UPLOAD_OBJECT_ACTIONS =
      List.of(
          "s3:AbortMultipartUpload",
          "s3:DeleteObject",
          "s3:ListMultipartUploadParts",
          "s3:PutObject",
          "s3:GetObject");

  static final List<String> UPLOAD_BUCKET_ACTIONS =
      List.of("s3:GetBucketLocation", "s3:ListBucket", "s3:ListBucketMultipartUploads");

  static final List<String> READ_OBJECT_ACTIONS = List.of("s3:GetObject");

  static final List<String> READ_BUCKET_ACTIONS = List.of("s3:GetBucketLocation", "s3:ListBucket");

  private static final ObjectMapper MAPPER = JsonMapper.builder().build();

  public AccessPolicy {
    statements = List.copyOf(statements);
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonPropertyOrder({"Sid", "Effect", "Action", "Resource"})
  public record Statement(
      @JsonProperty("Sid") String sid,
      @JsonProperty("Effect") String effect,
      @JsonProperty("Action") List<String> actions,
      @JsonProperty("Resource") List<String> resources) {

    public static Statement allow(String sid, List<String> actions, List<String> resources) {
      return new Statement(sid, "Allow", List.copyOf(actions), List.copyOf(resources));
    }
  }

  public static AccessPolicy of(Statement... statements) {
    return new AccessPolicy(VERSION, List.of(statements));
  }

  /** Read, write and multipart on every object, plus location and listing on the bucket. */
  public static AccessPolicy forUpload(String bucket) {
    return of(
        Statement.allow("PutObj", UPLOAD_OBJECT_ACTIONS, List.of(objectsArn(bucket))),
        Statement.allow("ListBucket", UPLOAD_BUCKET_ACTIONS, List.of(bucketArn(bucket))));
  }

  /** Read-only access to exactly one object. */
  public static AccessPolicy forObjectDownload(String bucket, String objectName) {
    return of(
        Statement.allow("GetObj", READ_OBJECT_ACTIONS, List.of(objectArn(bucket, objectName))));
  }

  /** Read-only access to every object of the bucket. */
  public static AccessPolicy forBucketDownload(String bucket) {
    return of(
        Statement.allow("GetObj", READ_OBJECT_ACTIONS, List.of(objectsArn(bucket))),
        Statement.allow("ListBucket", READ_BUCKET_ACTIONS, List.of(bucketArn(bucket))));
  }

  public static String bucketArn(String bucket) {
    return "arn:aws:s3:::" + bucket;
  }

  public static String objectsArn(String bucket) {
    return bucketArn(bucket) + "/*";
  }

  public static String objectArn(String bucket, String objectName) {
    return bucketArn(bucket) + "/" + objectName;
  }

  /** Compact JSON, the form STS expects in the {@code Policy} parameter. */
  public String toJson() {
    return MAPPER.writeValueAsString(this);
  }
}
