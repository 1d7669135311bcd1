package com.starscape.imagevariants.features.storage.infra;

import com.starscape.imagevariants.features.storage.domain.BlobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.FileNotFoundException;
import java.io.IOException;

/**
 * Stores image files as S3 objects, keyed by their relative path.
 */
@Service
@Profile("s3")
public class S3BlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(S3BlobStore.class);

    private final S3Client s3Client;
    private final String bucket;

    public S3BlobStore(S3Client s3Client, @Value("${aws.s3.bucket}") String bucket) {
        this.s3Client = s3Client;
        this.bucket = bucket;
    }

    @Override
    public void write(String relativePath, byte[] content, String contentType) throws IOException {
        PutObjectRequest putRequest = PutObjectRequest.builder()
                .bucket(bucket)
                .key(relativePath)
                .contentType(contentType)
                .contentLength((long) content.length)
                .build();

        try {
            s3Client.putObject(putRequest, RequestBody.fromBytes(content));
            log.debug("Uploaded S3 object: bucket={}, key={}", bucket, relativePath);
        } catch (SdkException e) {
            throw new IOException("Failed to upload S3 object: " + relativePath, e);
        }
    }

    @Override
    public byte[] read(String relativePath) throws IOException {
        GetObjectRequest getRequest = GetObjectRequest.builder()
                .bucket(bucket)
                .key(relativePath)
                .build();

        try (ResponseInputStream<GetObjectResponse> response = s3Client.getObject(getRequest)) {
            return response.readAllBytes();
        } catch (NoSuchKeyException e) {
            throw new FileNotFoundException("S3 object not found: " + relativePath);
        } catch (SdkException e) {
            throw new IOException("Failed to download S3 object: " + relativePath, e);
        }
    }

    @Override
    public boolean delete(String relativePath) {
        try {
            DeleteObjectRequest deleteRequest = DeleteObjectRequest.builder()
                    .bucket(bucket)
                    .key(relativePath)
                    .build();

            s3Client.deleteObject(deleteRequest);
            log.info("Deleted S3 object: bucket={}, key={}", bucket, relativePath);
            return true;
        } catch (NoSuchKeyException e) {
            log.debug("S3 object does not exist (already deleted?): bucket={}, key={}", bucket, relativePath);
            return true;
        } catch (SdkException e) {
            log.error("Failed to delete S3 object: bucket={}, key={}", bucket, relativePath, e);
            return false;
        }
    }
}
