package io.b2mash.storagebridge.storage.s3;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.storagebridge.config.S3ClientFactory;
import io.b2mash.storagebridge.config.S3Config.MinioProperties;
import io.b2mash.storagebridge.config.S3Config.StsProperties;
import io.b2mash.storagebridge.config.S3Connection;
import io.b2mash.storagebridge.exception.ObjectConflictException;
import io.b2mash.storagebridge.exception.ObjectNotFoundException;
import io.b2mash.storagebridge.exception.StorageConfigurationException;
import io.b2mash.storagebridge.storage.StorageTarget;
import java.io.IOException;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Bucket;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListBucketsRequest;
import software.amazon.awssdk.services.s3.model.ListBucketsResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.PutBucketNotificationConfigurationRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;
import software.amazon.awssdk.services.sts.model.AssumeRoleResponse;
import software.amazon.awssdk.services.sts.model.Credentials;
import tools.jackson.databind.json.JsonMapper;

@ExtendWith(MockitoExtension.class)
class MinioStorageAdapterTest {

  private static final Instant NOW = Instant.parse("2025-03-01T10:15:30Z");
  private static final String BUCKET = "3fa85f64-5717-4562-b3fc-2c963f66afa6";

  @Mock private S3ClientFactory clientFactory;
  @Mock private S3Client s3;
  @Mock private S3Presigner presigner;
  @Mock private StsClient sts;

  @TempDir Path tempDir;

  private MinioStorageAdapter adapter;

  @BeforeEach
  void setUp() {
    lenient().when(clientFactory.s3Client(any())).thenReturn(s3);
    lenient().when(clientFactory.s3Presigner(any())).thenReturn(presigner);
    lenient().when(clientFactory.stsClient(any())).thenReturn(sts);
    adapter = adapterWith(properties("minio:9000", "arn:minio:sqs::_:webhook"));
  }

  private MinioStorageAdapter adapterWith(MinioProperties properties) {
    return new MinioStorageAdapter(properties, clientFactory, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static MinioProperties properties(String endpoint, String queueArn) {
    return new MinioProperties(
        endpoint,
        "minio-access",
        "minio-secret",
        false,
        null,
        queueArn,
        new StsProperties(null, null, null, null, null, null, null, null, null));
  }

  private void bucketExists(boolean exists) {
    if (exists) {
      when(s3.headBucket(any(HeadBucketRequest.class)))
          .thenReturn(HeadBucketResponse.builder().build());
    } else {
      when(s3.headBucket(any(HeadBucketRequest.class)))
          .thenThrow(NoSuchBucketException.builder().statusCode(404).build());
    }
  }

  private void objectExists(boolean exists) {
    if (exists) {
      when(s3.headObject(any(HeadObjectRequest.class)))
          .thenReturn(HeadObjectResponse.builder().build());
    } else {
      when(s3.headObject(any(HeadObjectRequest.class)))
          .thenThrow(S3Exception.builder().statusCode(404).build());
    }
  }

  @Test
  void target_isSelfHosted() {
    assertThat(adapter.target()).isEqualTo(StorageTarget.SELF_HOSTED);
  }

  @Test
  void clients_areBuiltLazilyWithPathStyleHttpEndpoint() {
    verify(clientFactory, never()).s3Client(any());
    bucketExists(true);

    adapter.bucketExists(BUCKET);
    adapter.bucketExists(BUCKET);

    var connection = ArgumentCaptor.forClass(S3Connection.class);
    verify(clientFactory, times(1)).s3Client(connection.capture());
    assertThat(connection.getValue().endpoint()).isEqualTo(URI.create("http://minio:9000"));
    assertThat(connection.getValue().region()).isEqualTo("us-east-1");
    assertThat(connection.getValue().pathStyle()).isTrue();
  }

  @Test
  void missingEndpoint_failsAtFirstUseWithNotConnected() {
    var unconfigured = adapterWith(properties("", null));

    assertThatThrownBy(() -> unconfigured.bucketExists(BUCKET))
        .isInstanceOf(StorageConfigurationException.class)
        .satisfies(
            e ->
                assertThat(((StorageConfigurationException) e).getTitle())
                    .isEqualTo("S3 not connected"));
  }

  @Test
  void bucketExists_mapsNotFoundToFalse() {
    bucketExists(false);

    assertThat(adapter.bucketExists(BUCKET)).isFalse();
  }

  @Test
  void bucketExists_propagatesOtherProviderErrors() {
    when(s3.headBucket(any(HeadBucketRequest.class)))
        .thenThrow((S3Exception) S3Exception.builder().statusCode(403).build());

    assertThatThrownBy(() -> adapter.bucketExists(BUCKET)).isInstanceOf(S3Exception.class);
  }

  @Test
  void objectExists_propagatesOtherProviderErrors() {
    when(s3.headObject(any(HeadObjectRequest.class)))
        .thenThrow((S3Exception) S3Exception.builder().statusCode(403).build());

    assertThatThrownBy(() -> adapter.objectExists(BUCKET, "p1/file"))
        .isInstanceOf(S3Exception.class);
  }

  @Test
  void copyObject_sendsOneServerSideCopy() {
    var copied =
        adapter.copyObject(BUCKET, "p1/docbin_full", "archive", BUCKET + "/p1/docbin_full");

    assertThat(copied).isTrue();

    var request = ArgumentCaptor.forClass(CopyObjectRequest.class);
    verify(s3).copyObject(request.capture());
    assertThat(request.getValue().sourceBucket()).isEqualTo(BUCKET);
    assertThat(request.getValue().sourceKey()).isEqualTo("p1/docbin_full");
    assertThat(request.getValue().destinationBucket()).isEqualTo("archive");
    assertThat(request.getValue().destinationKey()).isEqualTo(BUCKET + "/p1/docbin_full");
    verify(s3, never()).getObjectAsBytes(any(GetObjectRequest.class));
    verify(s3, never()).putObject(any(PutObjectRequest.class), any(RequestBody.class));
  }

  @Test
  void listBuckets_returnsBucketNames() {
    when(s3.listBuckets(any(ListBucketsRequest.class)))
        .thenReturn(
            ListBucketsResponse.builder()
                .buckets(
                    Bucket.builder().name(BUCKET).build(),
                    Bucket.builder().name("archive").build())
                .build());

    assertThat(adapter.listBuckets()).containsExactly(BUCKET, "archive");
  }

  @Test
  void createBucket_registersObjectCreatedNotification() {
    assertThat(adapter.createBucket(BUCKET)).isTrue();

    verify(s3).createBucket(CreateBucketRequest.builder().bucket(BUCKET).build());
    var request = ArgumentCaptor.forClass(PutBucketNotificationConfigurationRequest.class);
    verify(s3).putBucketNotificationConfiguration(request.capture());
    var queue = request.getValue().notificationConfiguration().queueConfigurations().get(0);
    assertThat(queue.queueArn()).isEqualTo("arn:minio:sqs::_:webhook");
    assertThat(queue.eventsAsStrings()).containsExactly("s3:ObjectCreated:*");
  }

  @Test
  void createBucket_withoutQueueSkipsNotification() {
    var withoutQueue = adapterWith(properties("minio:9000", ""));

    withoutQueue.createBucket(BUCKET);

    verify(s3, never())
        .putBucketNotificationConfiguration(any(PutBucketNotificationConfigurationRequest.class));
  }

  @Test
  void putObject_createsMissingBucketFirst() {
    bucketExists(false);

    adapter.putObject(BUCKET, "p1/data.json", "{}");

    var order = inOrder(s3);
    order.verify(s3).createBucket(any(CreateBucketRequest.class));
    var request = ArgumentCaptor.forClass(PutObjectRequest.class);
    order.verify(s3).putObject(request.capture(), any(RequestBody.class));
    assertThat(request.getValue().key()).isEqualTo("p1/data.json");
    assertThat(request.getValue().contentType()).isEqualTo("application/json");
  }

  @Test
  void getObject_decodesUtf8() {
    bucketExists(true);
    when(s3.getObjectAsBytes(any(GetObjectRequest.class)))
        .thenReturn(
            ResponseBytes.fromByteArray(
                GetObjectResponse.builder().build(), "äöü".getBytes(StandardCharsets.UTF_8)));

    assertThat(adapter.getObject(BUCKET, "p1/data.json")).isEqualTo("äöü");
  }

  @Test
  void getObject_returnsEmptyForMissingBucket() {
    bucketExists(false);

    assertThat(adapter.getObject(BUCKET, "p1/data.json")).isEmpty();
    verify(s3, never()).getObjectAsBytes(any(GetObjectRequest.class));
  }

  @Test
  void downloadObject_returnsEmptyForMissingBucket() {
    bucketExists(false);

    assertThat(adapter.downloadObject(BUCKET, "p1/model", "bin", null)).isEmpty();
  }

  @Test
  void downloadObject_replacesExistingFile() throws IOException {
    bucketExists(true);
    var target = Files.writeString(tempDir.resolve("model.bin"), "stale");

    var result = adapter.downloadObject(BUCKET, "p1/model", "bin", target.toString());

    assertThat(result).contains(target);
    assertThat(target).doesNotExist();
    verify(s3).getObject(any(GetObjectRequest.class), eq(target));
  }

  @Test
  void uploadObject_conflictsWithoutForce() throws IOException {
    bucketExists(true);
    objectExists(true);
    var file = Files.writeString(tempDir.resolve("upload.txt"), "data");

    assertThatThrownBy(() -> adapter.uploadObject(BUCKET, "p1/file", file, false))
        .isInstanceOf(ObjectConflictException.class);
    verify(s3, never()).putObject(any(PutObjectRequest.class), any(RequestBody.class));
  }

  @Test
  void uploadObject_withForceDeletesThenPuts() throws IOException {
    bucketExists(true);
    objectExists(true);
    var file = Files.writeString(tempDir.resolve("upload.txt"), "data");

    assertThat(adapter.uploadObject(BUCKET, "p1/file", file, true)).isTrue();

    var order = inOrder(s3);
    order.verify(s3).deleteObject(any(DeleteObjectRequest.class));
    order.verify(s3).putObject(any(PutObjectRequest.class), any(RequestBody.class));
  }

  @Test
  void uploadObject_returnsFalseForMissingLocalFile() {
    bucketExists(true);

    assertThat(adapter.uploadObject(BUCKET, "p1/file", tempDir.resolve("missing"), true))
        .isFalse();
    verify(s3, never()).deleteObject(any(DeleteObjectRequest.class));
  }

  @Test
  void deleteObject_returnsFalseWhenNothingToDelete() {
    objectExists(false);

    assertThat(adapter.deleteObject(BUCKET, "p1/file")).isFalse();
    verify(s3, never()).deleteObject(any(DeleteObjectRequest.class));
  }

  @Test
  void createAccessLink_presignsOneHourJsonGet() throws Exception {
    objectExists(true);
    var presigned = mock(PresignedGetObjectRequest.class);
    when(presigned.url())
        .thenReturn(new URL("http://minio:9000/bucket/p1/file?X-Amz-Signature=x"));
    when(presigner.presignGetObject(any(GetObjectPresignRequest.class))).thenReturn(presigned);

    var link = adapter.createAccessLink(BUCKET, "p1/file");

    var request = ArgumentCaptor.forClass(GetObjectPresignRequest.class);
    verify(presigner).presignGetObject(request.capture());
    assertThat(request.getValue().signatureDuration()).isEqualTo(Duration.ofHours(1));
    assertThat(request.getValue().getObjectRequest().responseContentType())
        .isEqualTo("application/json");
    assertThat(link.url()).startsWith("http://minio:9000/bucket/p1/file");
    assertThat(link.expiresAt()).isEqualTo(NOW.plus(Duration.ofHours(1)));
    assertThat(link.isExpired(NOW.plus(Duration.ofMinutes(59)))).isFalse();
    assertThat(link.isExpired(NOW.plus(Duration.ofHours(1)))).isTrue();
  }

  @Test
  void createAccessLink_throwsForMissingObject() {
    objectExists(false);

    assertThatThrownBy(() -> adapter.createAccessLink(BUCKET, "p1/file"))
        .isInstanceOf(ObjectNotFoundException.class);
  }

  @Test
  void getDownloadCredentials_coverWholeBucketWithIgnoredRole() {
    bucketExists(true);
    when(sts.assumeRole(any(AssumeRoleRequest.class))).thenReturn(assumeRoleResponse());

    var grant = adapter.getDownloadCredentials(BUCKET, "p1/file");

    var request = ArgumentCaptor.forClass(AssumeRoleRequest.class);
    verify(sts).assumeRole(request.capture());
    assertThat(request.getValue().roleArn()).isEqualTo("arn:x:ignored:by:minio:");
    assertThat(request.getValue().durationSeconds()).isEqualTo(12000);
    var policy = JsonMapper.builder().build().readTree(request.getValue().policy());
    assertThat(policy.get("Statement").get(0).get("Resource").get(0).asString())
        .isEqualTo("arn:aws:s3:::" + BUCKET + "/*");
    assertThat(policy.get("Statement").get(1).get("Resource").get(0).asString())
        .isEqualTo("arn:aws:s3:::" + BUCKET);
    assertThat(grant.credentials().accessKeyId()).isEqualTo("STSKEY");
    assertThat(grant.credentials().expiration()).isEqualTo(NOW.plusSeconds(12000));
  }

  @Test
  void stsConnection_fallsBackToDataPlaneEndpointAndKeys() {
    bucketExists(true);
    when(sts.assumeRole(any(AssumeRoleRequest.class))).thenReturn(assumeRoleResponse());

    adapter.getUploadCredentialsAndId(BUCKET);

    var connection = ArgumentCaptor.forClass(S3Connection.class);
    verify(clientFactory).stsClient(connection.capture());
    assertThat(connection.getValue().endpoint()).isEqualTo(URI.create("http://minio:9000"));
    assertThat(connection.getValue().region()).isEqualTo("eu-west-1");
    assertThat(connection.getValue().accessKey()).isEqualTo("minio-access");
  }

  @Test
  void listObjects_followsContinuationTokens() {
    when(s3.listObjectsV2(any(ListObjectsV2Request.class)))
        .thenReturn(
            ListObjectsV2Response.builder()
                .contents(S3Object.builder().key("p1/a").build())
                .isTruncated(true)
                .nextContinuationToken("next")
                .build(),
            ListObjectsV2Response.builder()
                .contents(S3Object.builder().key("p1/b").build())
                .isTruncated(false)
                .build());

    assertThat(adapter.listObjects(BUCKET, "p1/")).containsExactly("p1/a", "p1/b");

    var requests = ArgumentCaptor.forClass(ListObjectsV2Request.class);
    verify(s3, times(2)).listObjectsV2(requests.capture());
    assertThat(requests.getAllValues().get(1).continuationToken()).isEqualTo("next");
  }

  @Test
  void reconnect_closesAndRebuildsClients() {
    bucketExists(true);
    adapter.bucketExists(BUCKET);

    adapter.reconnect();
    adapter.bucketExists(BUCKET);

    verify(s3).close();
    verify(clientFactory, times(2)).s3Client(any());
  }

  private static AssumeRoleResponse assumeRoleResponse() {
    return AssumeRoleResponse.builder()
        .credentials(
            Credentials.builder()
                .accessKeyId("STSKEY")
                .secretAccessKey("STSSECRET")
                .sessionToken("STSTOKEN")
                .expiration(NOW.plusSeconds(12000))
                .build())
        .build();
  }
}
