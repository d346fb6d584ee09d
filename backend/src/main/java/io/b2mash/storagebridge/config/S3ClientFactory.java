package io.b2mash.storagebridge.config;

import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.checksums.RequestChecksumCalculation;
import software.amazon.awssdk.core.checksums.ResponseChecksumValidation;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.sts.StsClient;

/** Builds AWS SDK clients from a resolved {@link S3Connection}. */
public class S3ClientFactory {

  public S3Client s3Client(S3Connection connection) {
    var builder =
        S3Client.builder()
            .region(Region.of(connection.region()))
            .credentialsProvider(credentials(connection))
            .serviceConfiguration(
                S3Configuration.builder().pathStyleAccessEnabled(connection.pathStyle()).build())
            // only checksum where the operation demands it, S3-compatible stores vary here
            .requestChecksumCalculation(RequestChecksumCalculation.WHEN_REQUIRED)
            .responseChecksumValidation(ResponseChecksumValidation.WHEN_REQUIRED);

    if (connection.endpoint() != null) {
      builder.endpointOverride(connection.endpoint());
    }
    return builder.build();
  }

  public S3Presigner s3Presigner(S3Connection connection) {
    var builder =
        S3Presigner.builder()
            .region(Region.of(connection.region()))
            .credentialsProvider(credentials(connection))
            .serviceConfiguration(
                S3Configuration.builder().pathStyleAccessEnabled(connection.pathStyle()).build());

    if (connection.endpoint() != null) {
      builder.endpointOverride(connection.endpoint());
    }
    return builder.build();
  }

  public StsClient stsClient(S3Connection connection) {
    var builder =
        StsClient.builder()
            .region(Region.of(connection.region()))
            .credentialsProvider(credentials(connection));

    if (connection.endpoint() != null) {
      builder.endpointOverride(connection.endpoint());
    }
    return builder.build();
  }

  private static StaticCredentialsProvider credentials(S3Connection connection) {
    return StaticCredentialsProvider.create(
        AwsBasicCredentials.create(connection.accessKey(), connection.secretKey()));
  }
}
