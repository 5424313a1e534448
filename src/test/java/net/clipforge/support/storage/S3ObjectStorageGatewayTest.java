package net.clipforge.support.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.URL;
import java.time.Duration;
import net.clipforge.exception.ObjectStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

@ExtendWith(MockitoExtension.class)
class S3ObjectStorageGatewayTest {

    @Mock
    private S3Client s3Client;

    @Mock
    private S3Presigner presigner;

    private S3ObjectStorageGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new S3ObjectStorageGateway(s3Client, presigner, "clips");
    }

    @Test
    void should_SendBucketKeyAndContentType_When_Putting() {
        gateway.put("o/l/clip.mp4", new byte[] {1, 2, 3}, "video/mp4");

        ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(captor.capture(), any(RequestBody.class));
        assertThat(captor.getValue().bucket()).isEqualTo("clips");
        assertThat(captor.getValue().key()).isEqualTo("o/l/clip.mp4");
        assertThat(captor.getValue().contentType()).isEqualTo("video/mp4");
        assertThat(captor.getValue().contentLength()).isEqualTo(3L);
    }

    @Test
    void should_WrapSdkFailure_When_PutFails() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
            .thenThrow(SdkClientException.create("connection reset"));

        assertThatThrownBy(() -> gateway.put("o/l/clip.mp4", new byte[] {1}, "video/mp4"))
            .isInstanceOf(ObjectStoreException.class)
            .hasMessageContaining("connection reset");
    }

    @Test
    void should_ReturnEmpty_When_KeyMissing() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
            .thenThrow(NoSuchKeyException.builder().message("missing").build());

        assertThat(gateway.get("o/l/none")).isEmpty();
    }

    @Test
    void should_ReturnBytes_When_KeyPresent() {
        ResponseBytes<GetObjectResponse> bytes =
            ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), new byte[] {4, 5});
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class))).thenReturn(bytes);

        assertThat(gateway.get("o/l/clip.mp4")).hasValueSatisfying(value -> assertThat(value).containsExactly(4, 5));
    }

    @Test
    void should_ReportAbsence_When_HeadReturns404() {
        when(s3Client.headObject(any(HeadObjectRequest.class)))
            .thenThrow(S3Exception.builder().statusCode(404).message("Not Found").build());

        assertThat(gateway.exists("o/l/none")).isFalse();
    }

    @Test
    void should_RaiseStoreError_When_HeadFailsOtherwise() {
        when(s3Client.headObject(any(HeadObjectRequest.class)))
            .thenThrow(S3Exception.builder().statusCode(503).message("Slow Down").build());

        assertThatThrownBy(() -> gateway.exists("o/l/clip.mp4")).isInstanceOf(ObjectStoreException.class);
    }

    @Test
    void should_FollowContinuationTokens_When_Listing() {
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(
            ListObjectsV2Response.builder()
                .contents(S3Object.builder().key("o/l/a").build(), S3Object.builder().key("o/l/b").build())
                .nextContinuationToken("page-2")
                .build(),
            ListObjectsV2Response.builder()
                .contents(S3Object.builder().key("o/l/c").build())
                .build());

        assertThat(gateway.list("o/l/")).containsExactly("o/l/a", "o/l/b", "o/l/c");
    }

    @Test
    void should_SetAttachmentDisposition_When_SigningDownloadUrl() throws Exception {
        PresignedGetObjectRequest presigned = mock(PresignedGetObjectRequest.class);
        when(presigned.url()).thenReturn(new URL("https://clips.s3.amazonaws.com/o/l/clip.mp4?X-Amz-Signature=abc"));
        when(presigner.presignGetObject(any(GetObjectPresignRequest.class))).thenReturn(presigned);

        String url = gateway.signedUrl("o/l/clip.mp4", Duration.ofMinutes(15), SignedUrlIntent.DOWNLOAD);

        ArgumentCaptor<GetObjectPresignRequest> captor = ArgumentCaptor.forClass(GetObjectPresignRequest.class);
        verify(presigner).presignGetObject(captor.capture());
        assertThat(url).startsWith("https://clips.s3.amazonaws.com/o/l/clip.mp4");
        assertThat(captor.getValue().signatureDuration()).isEqualTo(Duration.ofMinutes(15));
        assertThat(captor.getValue().getObjectRequest().responseContentDisposition())
            .isEqualTo("attachment; filename=\"clip.mp4\"");
    }

    @Test
    void should_RejectBlankBucket_When_Validating() {
        S3ObjectStorageGateway unconfigured = new S3ObjectStorageGateway(s3Client, presigner, " ");

        assertThatThrownBy(unconfigured::validateConfiguration).isInstanceOf(IllegalStateException.class);
        assertThat(gateway.describe()).isEqualTo("s3://clips");
    }
}
