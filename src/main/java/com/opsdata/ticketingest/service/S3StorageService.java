package com.opsdata.ticketingest.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

/**
 * Fetches ticket exports from S3. Accepts {@code s3://bucket/key}, or {@code s3:///key} for the
 * configured default bucket.
 */
@Service
public class S3StorageService {

    private static final Logger logger = LoggerFactory.getLogger(S3StorageService.class);
    private static final String SCHEME = "s3://";

    public record S3ObjectLocation(String bucketName, String key) {
    }

    private final S3Client s3Client;
    private final String defaultBucketName;

    public S3StorageService(S3Client s3Client, @Value("${app.s3.bucket-name:}") String defaultBucketName) {
        this.s3Client = s3Client;
        this.defaultBucketName = defaultBucketName;
    }

    public S3ObjectLocation parseS3Uri(String s3Uri) {
        if (s3Uri == null || !s3Uri.startsWith(SCHEME)) {
            throw new IllegalArgumentException("Invalid S3 URI format: Must start with s3://. Received: " + s3Uri);
        }
        String pathPart = s3Uri.substring(SCHEME.length());
        if (pathPart.startsWith("/")) {
            String key = pathPart.replaceFirst("^/+", "");
            if (key.isEmpty()) {
                throw new IllegalArgumentException("Invalid S3 URI: Key is empty for default bucket URI " + s3Uri);
            }
            if (defaultBucketName == null || defaultBucketName.isBlank()) {
                throw new IllegalArgumentException("No default bucket configured for " + s3Uri);
            }
            return new S3ObjectLocation(defaultBucketName, key);
        }
        int firstSlash = pathPart.indexOf('/');
        if (firstSlash <= 0 || firstSlash == pathPart.length() - 1) {
            throw new IllegalArgumentException(
                    "Invalid S3 URI format. Expected s3://bucket/key or s3:///key. Received: " + s3Uri);
        }
        return new S3ObjectLocation(pathPart.substring(0, firstSlash), pathPart.substring(firstSlash + 1));
    }

    public byte[] download(S3ObjectLocation location) {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(location.bucketName())
                .key(location.key())
                .build();
        try {
            ResponseBytes<GetObjectResponse> bytes = s3Client.getObjectAsBytes(request);
            logger.info("Downloaded s3://{}/{} ({} bytes)", location.bucketName(), location.key(), bytes.asByteArray().length);
            return bytes.asByteArray();
        } catch (NoSuchKeyException e) {
            throw new TicketIngestionException(
                    "No object at s3://" + location.bucketName() + "/" + location.key(), e);
        } catch (SdkException e) {
            logger.error("Failed to download s3://{}/{}", location.bucketName(), location.key(), e);
            throw new TicketIngestionException("S3 download failed: " + e.getMessage(), e);
        }
    }
}
