package net.clipforge.support.storage;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.clipforge.exception.ObjectStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

/**
 * S3-backed {@link ObjectStore}.
 *
 * <p>This gateway centralizes all direct AWS SDK usage so the upload and reconstruction
 * workflows stay free of SDK request/response details. Every SDK failure is rethrown as
 * {@link ObjectStoreException} so retry classification sees a single transient type.</p>
 */
public final class S3ObjectStorageGateway implements ObjectStore {

    private static final Logger logger = LoggerFactory.getLogger(S3ObjectStorageGateway.class);

    private final S3Client s3Client;
    private final S3Presigner presigner;
    private final String bucketName;

    public S3ObjectStorageGateway(S3Client s3Client, S3Presigner presigner, String bucketName) {
        this.s3Client = s3Client;
        this.presigner = presigner;
        this.bucketName = bucketName;
    }

    /**
     * Validates startup configuration for this adapter.
     */
    public void validateConfiguration() {
        if (!hasText(bucketName)) {
            throw new IllegalStateException("S3 bucket name must be configured when S3 object storage is active.");
        }
    }

    @Override
    public void put(String key, byte[] bytes, String contentType) {
        PutObjectRequest putObjectRequest = PutObjectRequest.builder()
            .bucket(bucketName)
            .key(key)
            .contentType(contentType)
            .contentLength((long) bytes.length)
            .build();
        try {
            s3Client.putObject(putObjectRequest, RequestBody.fromBytes(bytes));
            logger.debug("Uploaded {} ({} bytes) to S3 bucket {}", key, bytes.length, bucketName);
        } catch (S3Exception exception) {
            throw new ObjectStoreException("S3 error uploading " + key + ": " + resolveS3ErrorMessage(exception), key, exception);
        } catch (SdkClientException exception) {
            throw new ObjectStoreException("S3 client error uploading " + key + ": " + exception.getMessage(), key, exception);
        }
    }

    @Override
    public Optional<byte[]> get(String key) {
        GetObjectRequest getObjectRequest = GetObjectRequest.builder()
            .bucket(bucketName)
            .key(key)
            .build();
        try {
            ResponseBytes<GetObjectResponse> objectBytes = s3Client.getObjectAsBytes(getObjectRequest);
            return Optional.of(objectBytes.asByteArray());
        } catch (NoSuchKeyException exception) {
            if (logger.isTraceEnabled()) {
                logger.trace("S3 key {} not found: {}", key, exception.getMessage());
            }
            return Optional.empty();
        } catch (S3Exception exception) {
            if (exception.statusCode() == 404) {
                return Optional.empty();
            }
            throw new ObjectStoreException("S3 error downloading " + key + ": " + resolveS3ErrorMessage(exception), key, exception);
        } catch (SdkClientException exception) {
            throw new ObjectStoreException("S3 client error downloading " + key + ": " + exception.getMessage(), key, exception);
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucketName).key(key).build());
            return true;
        } catch (NoSuchKeyException exception) {
            return false;
        } catch (S3Exception exception) {
            if (exception.statusCode() == 404) {
                return false;
            }
            throw new ObjectStoreException("S3 error checking " + key + ": " + resolveS3ErrorMessage(exception), key, exception);
        } catch (SdkClientException exception) {
            throw new ObjectStoreException("S3 client error checking " + key + ": " + exception.getMessage(), key, exception);
        }
    }

    @Override
    public void delete(String key) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucketName).key(key).build());
            logger.debug("Deleted object {}", key);
        } catch (NoSuchKeyException exception) {
            logger.debug("Delete of missing key {} treated as success", key);
        } catch (S3Exception exception) {
            throw new ObjectStoreException("S3 error deleting " + key + ": " + resolveS3ErrorMessage(exception), key, exception);
        } catch (SdkClientException exception) {
            throw new ObjectStoreException("S3 client error deleting " + key + ": " + exception.getMessage(), key, exception);
        }
    }

    @Override
    public List<String> list(String prefix) {
        List<String> keys = new ArrayList<>();
        String continuationToken = null;
        try {
            do {
                ListObjectsV2Request.Builder requestBuilder = ListObjectsV2Request.builder()
                    .bucket(bucketName)
                    .continuationToken(continuationToken);
                if (hasText(prefix)) {
                    requestBuilder.prefix(prefix);
                }
                ListObjectsV2Response response = s3Client.listObjectsV2(requestBuilder.build());
                for (S3Object object : response.contents()) {
                    keys.add(object.key());
                }
                continuationToken = response.nextContinuationToken();
            } while (continuationToken != null);
        } catch (S3Exception exception) {
            throw new ObjectStoreException(
                "S3 error listing prefix '" + prefix + "' in bucket " + bucketName + ": " + resolveS3ErrorMessage(exception),
                prefix,
                exception
            );
        } catch (SdkClientException exception) {
            throw new ObjectStoreException(
                "S3 client error listing prefix '" + prefix + "': " + exception.getMessage(), prefix, exception);
        }
        logger.debug("Listed {} object(s) under prefix '{}'", keys.size(), prefix);
        return keys;
    }

    @Override
    public String signedUrl(String key, Duration ttl, SignedUrlIntent intent) {
        GetObjectRequest.Builder getRequest = GetObjectRequest.builder().bucket(bucketName).key(key);
        if (intent == SignedUrlIntent.DOWNLOAD) {
            getRequest.responseContentDisposition("attachment; filename=\"" + fileNameOf(key) + "\"");
        }
        GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
            .signatureDuration(ttl)
            .getObjectRequest(getRequest.build())
            .build();
        try {
            return presigner.presignGetObject(presignRequest).url().toString();
        } catch (SdkClientException exception) {
            throw new ObjectStoreException("Failed to sign URL for " + key + ": " + exception.getMessage(), key, exception);
        }
    }

    @Override
    public void verifyReachable() {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucketName).build());
        } catch (S3Exception exception) {
            throw new ObjectStoreException("S3 bucket " + bucketName + " is not reachable: "
                + resolveS3ErrorMessage(exception), null, exception);
        } catch (SdkClientException exception) {
            throw new ObjectStoreException("S3 endpoint is not reachable: " + exception.getMessage(), null, exception);
        }
    }

    @Override
    public String describe() {
        return "s3://" + bucketName;
    }

    private static String fileNameOf(String key) {
        int slash = key.lastIndexOf('/');
        return slash >= 0 ? key.substring(slash + 1) : key;
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }

    private static String resolveS3ErrorMessage(S3Exception exception) {
        if (exception.awsErrorDetails() != null && exception.awsErrorDetails().errorMessage() != null) {
            return exception.awsErrorDetails().errorMessage();
        }
        return exception.getMessage();
    }
}
