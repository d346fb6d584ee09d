package io.b2mash.storagebridge.storage;

import jakarta.annotation.Nullable;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * Renders a {@link CredentialGrant} in the external shape callers consume. Keys are sorted at
 * every level so the JSON is stable:
 *
 * <pre>
 * {"AssumedRoleUser":{...},"Credentials":{"AccessKeyId":..,"Expiration":..,"SecretAccessKey":..,
 *  "SessionToken":..},"PackedPolicySize":..,"bucket":..,"objectName":..,"uploadTaskId":..}
 * </pre>
 *
 * <p>The essentials variant keeps only {@code bucket}, {@code Credentials} without {@code
 * Expiration}, and {@code uploadTaskId}.
 */
@Component
public class CredentialGrantFormatter {

  static final String CREDENTIALS = "Credentials";
  static final String EXPIRATION = "Expiration";
  static final String BUCKET = "bucket";
  static final String OBJECT_NAME = "objectName";
  static final String UPLOAD_TASK_ID = "uploadTaskId";

  static final Set<String> ESSENTIAL_KEYS = Set.of(BUCKET, CREDENTIALS, UPLOAD_TASK_ID);

  private final ObjectMapper objectMapper;

  public CredentialGrantFormatter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public Map<String, Object> toMap(
      CredentialGrant grant,
      String bucket,
      @Nullable String objectName,
      @Nullable String taskId,
      boolean onlyEssentials) {
    var credentials = new TreeMap<String, Object>();
    credentials.put("AccessKeyId", grant.credentials().accessKeyId());
    credentials.put("SecretAccessKey", grant.credentials().secretAccessKey());
    credentials.put("SessionToken", grant.credentials().sessionToken());
    if (grant.credentials().expiration() != null) {
      credentials.put(EXPIRATION, grant.credentials().expiration().toString());
    }

    var response = new TreeMap<String, Object>();
    response.put(CREDENTIALS, credentials);
    if (grant.assumedRoleUser() != null) {
      var roleUser = new TreeMap<String, Object>();
      roleUser.put("Arn", grant.assumedRoleUser().arn());
      roleUser.put("AssumedRoleId", grant.assumedRoleUser().assumedRoleId());
      response.put("AssumedRoleUser", roleUser);
    }
    if (grant.packedPolicySize() != null) {
      response.put("PackedPolicySize", grant.packedPolicySize());
    }
    response.put(BUCKET, bucket);
    if (objectName != null) {
      response.put(OBJECT_NAME, objectName);
    }
    if (taskId != null && !taskId.isBlank()) {
      response.put(UPLOAD_TASK_ID, taskId);
    }

    if (onlyEssentials) {
      response.keySet().retainAll(ESSENTIAL_KEYS);
      credentials.remove(EXPIRATION);
    }
    return response;
  }

  public String toJson(Map<String, Object> response) {
    return objectMapper.writeValueAsString(response);
  }
}
